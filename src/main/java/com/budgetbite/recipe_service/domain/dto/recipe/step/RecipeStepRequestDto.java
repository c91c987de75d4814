package com.budgetbite.recipe_service.domain.dto.recipe.step;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeStepRequestDto {

    @NotNull(message = "단계 번호는 필수입니다.")
    @Min(value = 1, message = "단계 번호는 1 이상이어야 합니다.")
    private Integer stepNumber;

    @NotBlank(message = "단계 설명은 필수입니다.")
    @Size(max = 500, message = "단계 설명은 500자를 넘을 수 없습니다.")
    private String description;
}
