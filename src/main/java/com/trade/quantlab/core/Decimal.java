package com.trade.quantlab.core;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 账本中的金额、价格、数量计算统一走此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 默认精度：价格保留8位小数
     */
    public static final int PRICE_SCALE = 8;

    /**
     * 默认精度：百分比保留2位小数
     */
    private static final int PERCENT_SCALE = 2;

    private static final MathContext SQRT_CONTEXT = MathContext.DECIMAL64;

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal of(double value) {
        return BigDecimal.valueOf(value);
    }

    public static BigDecimal of(long value) {
        return BigDecimal.valueOf(value);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO;
    }

    /**
     * 价格格式化（8位小数）
     */
    public static BigDecimal scalePrice(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 数量取整（整数单位，向下取整）
     */
    public static BigDecimal floorUnits(BigDecimal value) {
        return value.setScale(0, RoundingMode.DOWN);
    }

    /**
     * 安全除法，避免除零
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 平方根，负数与零返回0
     */
    public static BigDecimal sqrt(BigDecimal value) {
        if (value.compareTo(BigDecimal.ZERO) <= 0) {
            return BigDecimal.ZERO;
        }
        return value.sqrt(SQRT_CONTEXT);
    }

    /**
     * 计算百分比变化
     */
    public static BigDecimal percentChange(BigDecimal from, BigDecimal to) {
        if (from.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return to.subtract(from)
                .divide(from, PERCENT_SCALE + 2, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * 判断是否为正值
     */
    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * 判断是否为负值
     */
    public static boolean isNegative(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) < 0;
    }

    /**
     * 判断是否为零
     */
    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }
}
