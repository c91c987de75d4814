package com.budgetbite.recipe_service.domain.dto.recipe;

import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.step.RecipeStepRequestDto;
import com.budgetbite.recipe_service.domain.type.Difficulty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * 레시피 생성/수정용
 */

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeCreateRequestDto {

    @NotBlank(message = "레시피 이름은 필수입니다.")
    @Size(max = 200, message = "레시피 이름은 200자를 넘을 수 없습니다.")
    private String name;

    @NotBlank(message = "레시피 설명은 필수입니다.")
    @Size(max = 1000, message = "레시피 설명은 1000자를 넘을 수 없습니다.")
    private String description;

    @NotEmpty(message = "레시피에는 재료가 최소 1개 필요합니다.")
    private List<@Valid RecipeIngredientRequestDto> ingredients;

    private List<@Valid RecipeStepRequestDto> instructions;

    // 숫자(4)와 문자열("4 people") 모두 허용
    @NotBlank(message = "인분 정보는 필수입니다.")
    @Size(max = 20, message = "인분 표기는 20자를 넘을 수 없습니다.")
    private String servings;

    @PositiveOrZero(message = "준비 시간은 음수일 수 없습니다.")
    private Integer prepTime;

    @PositiveOrZero(message = "조리 시간은 음수일 수 없습니다.")
    private Integer cookTime;

    private Difficulty difficulty;

    @Size(max = 50, message = "카테고리는 50자를 넘을 수 없습니다.")
    private String category;

    @Size(max = 50, message = "요리 국가는 50자를 넘을 수 없습니다.")
    private String cuisine;

    private List<@NotBlank(message = "태그는 빈 값일 수 없습니다.") @Size(max = 30, message = "태그는 30자를 넘을 수 없습니다.") String> tags;
}
