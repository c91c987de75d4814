package com.budgetbite.recipe_service;

import com.budgetbite.recipe_service.domain.dto.cost.RecipeFilterResponseDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import com.budgetbite.recipe_service.service.RecipeCostService;
import com.budgetbite.recipe_service.service.RecipeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RecipeServiceApplicationTests {

	@Autowired
	private RecipeService recipeService;

	@Autowired
	private RecipeCostService recipeCostService;

	private static RecipeCreateRequestDto request(String name, String costPerUnit) {
		return RecipeCreateRequestDto.builder()
				.name(name)
				.description(name + " 설명")
				.servings("2")
				.ingredients(List.of(RecipeIngredientRequestDto.builder()
						.name("rice")
						.quantity(BigDecimal.ONE)
						.unit(IngredientUnit.CUPS)
						.costPerUnit(new BigDecimal(costPerUnit))
						.build()))
				.build();
	}

	@Test
	void contextLoads() {
	}

	@Test
	@DisplayName("레시피를 추가하면 예산 필터 캐시가 비워져 새 레시피가 바로 보인다")
	void filterCacheEvictedOnCreate() {
		BigDecimal budget = new BigDecimal("100");
		RecipeDto first = recipeService.createRecipe(request("Cache Rice A", "40"));
		RecipeDto second = null;
		try {
			RecipeFilterResponseDto before = recipeCostService.filterRecipes(budget, 4, null, null);
			assertThat(before.getRecipes()).extracting(RecipeDto::getName).containsExactly("Cache Rice A");

			second = recipeService.createRecipe(request("Cache Rice B", "20"));

			RecipeFilterResponseDto after = recipeCostService.filterRecipes(budget, 4, null, null);
			// 4인분 기준 B ₱40 (₱10/인분), A ₱80 (₱20/인분)
			assertThat(after.getRecipes()).extracting(RecipeDto::getName)
					.containsExactly("Cache Rice B", "Cache Rice A");
		} finally {
			recipeService.deleteRecipe(first.getId());
			if (second != null) {
				recipeService.deleteRecipe(second.getId());
			}
		}
	}

}
