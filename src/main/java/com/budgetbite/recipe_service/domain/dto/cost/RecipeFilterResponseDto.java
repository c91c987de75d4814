package com.budgetbite.recipe_service.domain.dto.cost;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "예산/인분 필터 응답")
public class RecipeFilterResponseDto {

    @Schema(description = "결과 레시피 수")
    private int count;

    @Schema(description = "적용된 필터 조건")
    private BudgetFilterDto filters;

    @Schema(description = "결과 레시피 (조건에 따라 정렬됨)")
    private List<FilteredRecipeDto> recipes;
}
