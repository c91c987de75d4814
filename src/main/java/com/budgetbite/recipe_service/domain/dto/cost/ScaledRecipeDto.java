package com.budgetbite.recipe_service.domain.dto.cost;

import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * 목표 인분으로 환산된 레시피. 요청마다 새로 계산되며 저장되지 않는다.
 * totalCost, ingredients 는 환산된 값이다.
 */
@Getter
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "인분 환산 레시피 DTO")
public class ScaledRecipeDto extends RecipeDto {

    @Schema(description = "원본 레시피 인분 수 (servings 표기에서 추출)")
    private int originalServings;

    @Schema(description = "요청한 인분 수")
    private int targetServings;

    @Schema(description = "환산 배수 = targetServings / originalServings (소수 둘째 자리)")
    private BigDecimal scaleFactor;

    @Schema(description = "1인분 비용")
    private BigDecimal costPerServing;

    @Setter
    @Schema(description = "표시용 총액 (예: ₱200.00)")
    private String formattedTotalCost;

    @Setter
    @Schema(description = "표시용 1인분 비용")
    private String formattedCostPerServing;

    @Setter
    @Schema(description = "재료별 비용 비중 (상세 조회 시에만 포함)")
    private CostBreakdownDto costBreakdown;
}
