package com.budgetbite.recipe_service.domain.dto.cost;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CostBreakdownDto {
    private int originalServings;
    private int targetServings;
    private BigDecimal scaleFactor;
    private BigDecimal originalTotalCost;
    private BigDecimal scaledTotalCost;
    private BigDecimal costPerServing;
    private List<IngredientCostBreakdownDto> ingredients;

    @Setter
    private String formattedScaledTotalCost;

    @Setter
    private String formattedCostPerServing;
}
