package com.budgetbite.recipe_service.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "레시피 목록 응답")
public class RecipeListResponseDto {

    @Schema(description = "결과 레시피 수")
    private int count;

    @Schema(description = "검색어 (검색 API 에서만 포함)")
    private String query;

    @Schema(description = "레시피 목록. servings/budget 조건이 있으면 환산 필드가 함께 포함된다.")
    private List<? extends RecipeDto> recipes;
}
