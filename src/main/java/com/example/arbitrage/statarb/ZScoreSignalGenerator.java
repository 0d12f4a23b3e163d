package com.example.arbitrage.statarb;

import com.example.arbitrage.common.model.SignalDirection;
import com.example.arbitrage.common.model.ZScoreSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Сигналы парной торговли по z-score спреда.
 * <p>
 * Состояния: нет позиции или позиция long_spread/short_spread. Из "нет позиции" входим при |z| >= entry,
 * из позиции выходим при |z| <= exit. Позицию хранит вызывающий код, генератор ее только читает.
 */
@Slf4j
@RequiredArgsConstructor
public class ZScoreSignalGenerator {

    private final CorrelationEstimator estimator;
    private final Clock clock;

    /**
     * (последний спред - среднее) / std; 0 при нулевом std
     */
    public OptionalDouble calculateZScore(String pair1, String pair2) {
        Optional<double[]> spread = estimator.currentSpread(pair1, pair2);
        return spread.map(s -> OptionalDouble.of(SpreadMath.zScore(s))).orElseGet(OptionalDouble::empty);
    }

    /**
     * @param currentPosition текущая позиция (LONG_SPREAD или SHORT_SPREAD), пусто - позиции нет
     */
    public Optional<ZScoreSignal> getSignal(String pair1,
                                            String pair2,
                                            double entryThreshold,
                                            double exitThreshold,
                                            Optional<SignalDirection> currentPosition) {
        if (entryThreshold <= 0) {
            throw new IllegalArgumentException("Порог входа должен быть > 0: " + entryThreshold);
        }
        if (currentPosition.isPresent() && !currentPosition.get().isEntry()) {
            throw new IllegalArgumentException("Позиция не может быть " + currentPosition.get());
        }

        OptionalDouble zScore = calculateZScore(pair1, pair2);
        if (zScore.isEmpty()) {
            return Optional.empty();
        }

        double z = zScore.getAsDouble();
        double absZ = Math.abs(z);

        if (currentPosition.isPresent()) {
            if (absZ <= exitThreshold) {
                log.info("🚪 Выход из {} по {} / {}: z={}", currentPosition.get().getValue(), pair1, pair2, z);
                return Optional.of(signal(pair1, pair2, z, SignalDirection.EXIT, 1.0 - absZ / entryThreshold));
            }
            return Optional.empty();
        }

        if (absZ >= entryThreshold) {
            // z > 0: первая пара переоценена относительно второй
            SignalDirection direction = z > 0 ? SignalDirection.SHORT_SPREAD : SignalDirection.LONG_SPREAD;
            double confidence = Math.min(1.0, absZ / (2 * entryThreshold));
            log.info("📈 Вход {} по {} / {}: z={}", direction.getValue(), pair1, pair2, z);
            return Optional.of(signal(pair1, pair2, z, direction, confidence));
        }

        return Optional.empty();
    }

    private ZScoreSignal signal(String pair1, String pair2, double z, SignalDirection direction, double confidence) {
        return ZScoreSignal.builder()
                .pair1(pair1)
                .pair2(pair2)
                .zScore(z)
                .direction(direction)
                .confidence(confidence)
                .timestamp(clock.instant())
                .build();
    }
}
