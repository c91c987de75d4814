package com.budgetbite.recipe_service.domain.dto.recipe.ingredient;

import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;


@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecipeIngredientDto {

    @Schema(description = "재료명")
    private String name;

    @Schema(description = "수량 (unit 기준)")
    private BigDecimal quantity;

    @Schema(description = "단위 (cups, tbsp, kg ...)")
    private IngredientUnit unit;

    @Schema(description = "단위당 가격")
    private BigDecimal costPerUnit;

    @Schema(description = "재료 총액 = quantity × costPerUnit")
    private BigDecimal totalCost;

    @Setter
    @Schema(description = "표시용 재료 총액 (예: ₱40.00)")
    private String formattedTotalCost;

    @Setter
    @Schema(description = "표시용 단위당 가격")
    private String formattedCostPerUnit;
}
