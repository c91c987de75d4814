package com.budgetbite.recipe_service.domain.dto.cost;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

@Getter
@SuperBuilder
@NoArgsConstructor
@Schema(description = "예산 필터 결과 레시피 DTO")
public class FilteredRecipeDto extends ScaledRecipeDto {

    @Schema(description = "환산 총액 (비교에 사용된 값)")
    private BigDecimal scaledTotalCost;

    @Schema(description = "예산 이내 여부 (scaledTotalCost <= budget)")
    private boolean fitsInBudget;
}
