package com.budgetbite.recipe_service.domain.entity;

import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import com.budgetbite.recipe_service.util.PricingUtil;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Embeddable
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecipeIngredient {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "quantity", nullable = false, precision = 12, scale = 3)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit", nullable = false, length = 20)
    private IngredientUnit unit;

    @Column(name = "cost_per_unit", nullable = false, precision = 12, scale = 3)
    private BigDecimal costPerUnit;

    @Column(name = "total_cost", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalCost;

    /**
     * totalCost는 직접 입력받지 않고 항상 quantity × costPerUnit 으로 계산한다.
     */
    public static RecipeIngredient of(String name, BigDecimal quantity, IngredientUnit unit, BigDecimal costPerUnit) {
        return RecipeIngredient.builder()
                .name(name)
                .quantity(quantity)
                .unit(unit)
                .costPerUnit(costPerUnit)
                .totalCost(PricingUtil.ingredientTotalCost(quantity, costPerUnit))
                .build();
    }
}
