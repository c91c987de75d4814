package com.budgetbite.recipe_service.domain.dto.cost;

import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IngredientCostBreakdownDto {
    private String name;
    private BigDecimal originalQuantity;
    private BigDecimal scaledQuantity;
    private IngredientUnit unit;
    private BigDecimal costPerUnit;
    private BigDecimal originalTotalCost;
    private BigDecimal scaledTotalCost;

    @Schema(description = "레시피 환산 총액 대비 비중 (%)")
    private BigDecimal percentageOfTotal;

    @Setter
    private String formattedScaledTotalCost;
}
