package com.budgetbite.recipe_service.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

public final class PricingUtil {

    public static final int CURRENCY_SCALE = 2;
    public static final String DEFAULT_CURRENCY_SYMBOL = "₱";

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(CURRENCY_SCALE);

    private PricingUtil() {
    }

    /**
     * 1) 통화 정밀도(소수 둘째 자리, HALF_UP)로 반올림
     *    null은 0.00으로 취급
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 2) double 입력용 반올림. NaN/Infinity는 하위 합계를 오염시키지 않도록 0.00
     */
    public static BigDecimal round(double amount) {
        if (!Double.isFinite(amount)) {
            return ZERO;
        }
        return round(BigDecimal.valueOf(amount));
    }

    /**
     * 3) 재료 총액 = 수량 × 단가 (반올림)
     */
    public static BigDecimal ingredientTotalCost(BigDecimal quantity, BigDecimal costPerUnit) {
        if (quantity == null || costPerUnit == null) {
            return ZERO;
        }
        return round(quantity.multiply(costPerUnit));
    }

    /**
     * 4) 레시피 총액 = 재료 총액 합계 (반올림)
     *    재료 목록이 바뀔 때마다 호출하는 쪽에서 명시적으로 다시 계산해야 한다.
     */
    public static BigDecimal recipeTotalCost(Collection<BigDecimal> ingredientCosts) {
        if (ingredientCosts == null || ingredientCosts.isEmpty()) {
            return ZERO;
        }
        BigDecimal sum = ingredientCosts.stream()
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return round(sum);
    }

    public static String format(BigDecimal amount) {
        return format(amount, DEFAULT_CURRENCY_SYMBOL);
    }

    /**
     * 5) 화면 표시용 금액 문자열 (예: ₱25.00)
     */
    public static String format(BigDecimal amount, String currencySymbol) {
        String symbol = currencySymbol != null ? currencySymbol : DEFAULT_CURRENCY_SYMBOL;
        return symbol + round(amount).toPlainString();
    }
}
