package com.budgetbite.recipe_service.service;

import com.budgetbite.recipe_service.config.CacheConfig;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.step.RecipeStepRequestDto;
import com.budgetbite.recipe_service.domain.entity.Recipe;
import com.budgetbite.recipe_service.domain.repository.RecipeRepository;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.exception.ErrorCode;
import com.budgetbite.recipe_service.mapper.RecipeIngredientMapper;
import com.budgetbite.recipe_service.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 레시피 생성/수정/삭제.
 * 재료가 바뀌면 재료 총액과 레시피 총액을 항상 서버에서 다시 계산한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    private final RecipeRepository recipeRepository;

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.BUDGET_RECIPES, allEntries = true)
    public RecipeDto createRecipe(RecipeCreateRequestDto dto) {
        validateStepNumbers(dto.getInstructions());

        String name = dto.getName().trim();
        if (recipeRepository.existsByName(name)) {
            throw new CustomException(ErrorCode.DUPLICATE_RECIPE_NAME, "같은 이름의 레시피가 이미 존재합니다: " + name);
        }

        Recipe saved = recipeRepository.save(RecipeMapper.toEntity(dto));
        log.info("레시피 생성: id={}, name={}, totalCost={}", saved.getId(), saved.getName(), saved.getTotalCost());
        return RecipeMapper.toDto(saved);
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.BUDGET_RECIPES, allEntries = true)
    public RecipeDto updateRecipe(Long recipeId, RecipeCreateRequestDto dto) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateStepNumbers(dto.getInstructions());

        String name = dto.getName().trim();
        if (recipeRepository.existsByNameAndIdNot(name, recipeId)) {
            throw new CustomException(ErrorCode.DUPLICATE_RECIPE_NAME, "같은 이름의 레시피가 이미 존재합니다: " + name);
        }

        recipe.update(
                name,
                dto.getDescription(),
                dto.getServings().trim(),
                dto.getPrepTime(),
                dto.getCookTime(),
                dto.getDifficulty(),
                dto.getCategory(),
                dto.getCuisine(),
                dto.getTags(),
                RecipeMapper.toStepEntities(dto.getInstructions())
        );
        recipe.replaceIngredients(RecipeIngredientMapper.toEntityList(dto.getIngredients()));

        // updatedAt 반영을 위해 응답 전에 flush
        recipeRepository.saveAndFlush(recipe);
        log.info("레시피 수정: id={}, totalCost={}", recipeId, recipe.getTotalCost());
        return RecipeMapper.toDto(recipe);
    }

    @Transactional
    @CacheEvict(cacheNames = CacheConfig.BUDGET_RECIPES, allEntries = true)
    public void deleteRecipe(Long recipeId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        recipeRepository.delete(recipe);
        log.info("레시피 삭제: id={}, name={}", recipeId, recipe.getName());
    }

    private Recipe getRecipeOrThrow(Long recipeId) {
        return recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    private void validateStepNumbers(List<RecipeStepRequestDto> steps) {
        if (steps == null) {
            return;
        }
        Set<Integer> seen = new HashSet<>();
        for (RecipeStepRequestDto step : steps) {
            if (!seen.add(step.getStepNumber())) {
                throw new CustomException(ErrorCode.DUPLICATE_STEP_NUMBER,
                        "조리 단계 번호가 중복되었습니다: " + step.getStepNumber());
            }
        }
    }
}
