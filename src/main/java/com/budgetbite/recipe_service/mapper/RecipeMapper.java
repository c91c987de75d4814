package com.budgetbite.recipe_service.mapper;

import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.step.RecipeStepDto;
import com.budgetbite.recipe_service.domain.dto.recipe.step.RecipeStepRequestDto;
import com.budgetbite.recipe_service.domain.entity.Recipe;
import com.budgetbite.recipe_service.domain.entity.RecipeStep;
import com.budgetbite.recipe_service.domain.type.Difficulty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Recipe 엔티티 ⇄ DTO 변환.
 * RecipeScaler 는 엔티티를 모르기 때문에 비용 계산 전에 반드시 이 매퍼로 RecipeDto 를 만든다.
 */
public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto) {
        Recipe recipe = Recipe.builder()
                .name(dto.getName().trim())
                .description(dto.getDescription())
                .servings(dto.getServings().trim())
                .prepTime(dto.getPrepTime())
                .cookTime(dto.getCookTime())
                .difficulty(dto.getDifficulty() != null ? dto.getDifficulty() : Difficulty.MEDIUM)
                .category(dto.getCategory())
                .cuisine(dto.getCuisine())
                .tags(dto.getTags() != null ? new ArrayList<>(dto.getTags()) : new ArrayList<>())
                .instructions(new ArrayList<>(toStepEntities(dto.getInstructions())))
                .build();

        recipe.replaceIngredients(RecipeIngredientMapper.toEntityList(dto.getIngredients()));
        return recipe;
    }

    /**
     * 단계는 stepNumber 순으로 정렬해서 저장한다.
     */
    public static List<RecipeStep> toStepEntities(List<RecipeStepRequestDto> steps) {
        if (steps == null) {
            return Collections.emptyList();
        }
        return steps.stream()
                .sorted(Comparator.comparing(RecipeStepRequestDto::getStepNumber))
                .map(step -> new RecipeStep(step.getStepNumber(), step.getDescription()))
                .toList();
    }

    public static RecipeDto toDto(Recipe recipe) {
        return RecipeDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .description(recipe.getDescription())
                .ingredients(RecipeIngredientMapper.toDtoList(recipe.getIngredients()))
                .instructions(toStepDtos(recipe.getInstructions()))
                .servings(recipe.getServings())
                .totalCost(recipe.getTotalCost())
                .prepTime(recipe.getPrepTime())
                .cookTime(recipe.getCookTime())
                .totalTime(recipe.getTotalTime())
                .difficulty(recipe.getDifficulty())
                .category(recipe.getCategory())
                .cuisine(recipe.getCuisine())
                .tags(new ArrayList<>(recipe.getTags()))
                .createdAt(recipe.getCreatedAt())
                .updatedAt(recipe.getUpdatedAt())
                .build();
    }

    public static List<RecipeDto> toDtoList(List<Recipe> recipes) {
        return recipes.stream()
                .map(RecipeMapper::toDto)
                .toList();
    }

    private static List<RecipeStepDto> toStepDtos(List<RecipeStep> steps) {
        if (steps == null) {
            return Collections.emptyList();
        }
        return steps.stream()
                .map(step -> RecipeStepDto.builder()
                        .stepNumber(step.getStepNumber())
                        .description(step.getDescription())
                        .build())
                .toList();
    }
}
