package com.example.arbitrage.common.model;

import com.example.arbitrage.common.utils.BigDecimalUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Расчет прибыли прохода по треугольному пути.
 * endAmount = 0 и profitable = false означают, что одну из ног не удалось оценить.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PathProfit {
    private TriangularPath path;
    private BigDecimal startAmount;
    private BigDecimal endAmount;
    private BigDecimal profit;
    private BigDecimal profitPct;
    @Builder.Default
    private List<BigDecimal> rates = List.of();
    @Builder.Default
    private List<BigDecimal> fees = List.of();
    private boolean profitable;
    private Instant timestamp;

    public static PathProfit notPriceable(TriangularPath path, BigDecimal startAmount, Instant timestamp) {
        return PathProfit.builder()
                .path(path)
                .startAmount(startAmount)
                .endAmount(BigDecimal.ZERO)
                .profit(BigDecimal.ZERO)
                .profitPct(BigDecimal.ZERO)
                .profitable(false)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Итоговый множитель по циклу
     */
    public BigDecimal getNetMultiplier() {
        if (!BigDecimalUtil.isPositive(startAmount)) {
            return BigDecimal.ZERO;
        }
        return endAmount.divide(startAmount, BigDecimalUtil.MC);
    }
}
