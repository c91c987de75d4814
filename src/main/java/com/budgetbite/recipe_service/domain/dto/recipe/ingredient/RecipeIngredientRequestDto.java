package com.budgetbite.recipe_service.domain.dto.recipe.ingredient;

import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;


/**
 *
 *  재료 요청용 (totalCost 는 서버에서 계산하므로 받지 않는다)
 */

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientRequestDto {

    @NotBlank(message = "재료명은 필수입니다.")
    @Size(max = 100, message = "재료명은 100자를 넘을 수 없습니다.")
    private String name;

    @NotNull(message = "재료 수량은 필수입니다.")
    @PositiveOrZero(message = "재료 수량은 음수일 수 없습니다.")
    @Digits(integer = 9, fraction = 3, message = "재료 수량은 소수 셋째 자리까지 입력할 수 있습니다.")
    private BigDecimal quantity;

    @NotNull(message = "재료 단위는 필수입니다.")
    private IngredientUnit unit;

    @NotNull(message = "단위당 가격은 필수입니다.")
    @PositiveOrZero(message = "단위당 가격은 음수일 수 없습니다.")
    @Digits(integer = 9, fraction = 3, message = "단위당 가격은 소수 셋째 자리까지 입력할 수 있습니다.")
    private BigDecimal costPerUnit;
}
