package com.budgetbite.recipe_service.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PricingUtilTest {

    @Test
    @DisplayName("소수 둘째 자리 HALF_UP 반올림, null 은 0.00")
    void round_bigDecimal() {
        assertEquals(new BigDecimal("1.01"), PricingUtil.round(new BigDecimal("1.005")));
        assertEquals(new BigDecimal("1.00"), PricingUtil.round(new BigDecimal("1.004")));
        assertEquals(new BigDecimal("20.00"), PricingUtil.round(new BigDecimal("20")));
        assertEquals(new BigDecimal("0.00"), PricingUtil.round((BigDecimal) null));
    }

    @Test
    @DisplayName("NaN / Infinity 는 0.00")
    void round_nonFiniteDouble() {
        assertEquals(new BigDecimal("0.00"), PricingUtil.round(Double.NaN));
        assertEquals(new BigDecimal("0.00"), PricingUtil.round(Double.POSITIVE_INFINITY));
        assertEquals(new BigDecimal("0.00"), PricingUtil.round(Double.NEGATIVE_INFINITY));
        assertEquals(new BigDecimal("2.35"), PricingUtil.round(2.345));
    }

    @Test
    @DisplayName("재료 총액 = 수량 × 단가")
    void ingredientTotalCost() {
        assertEquals(new BigDecimal("30.00"), PricingUtil.ingredientTotalCost(new BigDecimal("250"), new BigDecimal("0.12")));
        assertEquals(new BigDecimal("0.83"), PricingUtil.ingredientTotalCost(new BigDecimal("0.333"), new BigDecimal("2.5")));
        assertEquals(new BigDecimal("0.00"), PricingUtil.ingredientTotalCost(null, BigDecimal.TEN));
    }

    @Test
    @DisplayName("레시피 총액은 null 을 건너뛰고 합산한다")
    void recipeTotalCost() {
        List<BigDecimal> costs = Arrays.asList(new BigDecimal("20.00"), null, new BigDecimal("80.00"));
        assertEquals(new BigDecimal("100.00"), PricingUtil.recipeTotalCost(costs));
        assertEquals(new BigDecimal("0.00"), PricingUtil.recipeTotalCost(List.of()));
    }

    @Test
    @DisplayName("표시용 금액 문자열")
    void format() {
        assertEquals("₱25.00", PricingUtil.format(new BigDecimal("25")));
        assertEquals("₱0.00", PricingUtil.format(null));
        assertEquals("$3.50", PricingUtil.format(new BigDecimal("3.499"), "$"));
    }
}
