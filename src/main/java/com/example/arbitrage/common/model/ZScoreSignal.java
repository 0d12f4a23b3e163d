package com.example.arbitrage.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Сигнал парной торговли по z-score спреда
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ZScoreSignal {
    private String pair1;
    private String pair2;
    private double zScore;
    private SignalDirection direction;
    private double confidence;
    private Instant timestamp;

    /**
     * Покупаем первую пару при long_spread, иначе продаем
     */
    public TradeAction getPair1Action() {
        return direction == SignalDirection.LONG_SPREAD ? TradeAction.BUY : TradeAction.SELL;
    }

    /**
     * Вторая нога всегда противоположна первой
     */
    public TradeAction getPair2Action() {
        return direction == SignalDirection.LONG_SPREAD ? TradeAction.SELL : TradeAction.BUY;
    }
}
