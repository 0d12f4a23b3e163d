package com.example.arbitrage.common.utils;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;

@Slf4j
public final class BigDecimalUtil {

    /**
     * Точность всех денежных расчетов движка
     */
    public static final MathContext MC = MathContext.DECIMAL128;

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private BigDecimalUtil() {
    }

    public static BigDecimal safeParse(String str) {
        if (str == null || str.trim().isEmpty()) return null;
        try {
            return new BigDecimal(str.trim());
        } catch (NumberFormatException e) {
            log.warn("⚠️ Не удалось сконвертировать в BigDecimal: '{}'", str);
            return null;
        }
    }

    /**
     * value * pct / 100
     */
    public static BigDecimal percentOf(BigDecimal value, BigDecimal pct) {
        return value.multiply(pct, MC).divide(HUNDRED, MC);
    }

    /**
     * part / whole * 100, ноль если whole не положительный
     */
    public static BigDecimal toPercent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return part.divide(whole, MC).multiply(HUNDRED, MC);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
