package com.budgetbite.recipe_service.mapper;

import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.budgetbite.recipe_service.domain.entity.RecipeIngredient;

import java.util.Collections;
import java.util.List;

public class RecipeIngredientMapper {

    /**
     * 요청값에는 totalCost 가 없으므로 엔티티 생성 시점에 수량 × 단가로 계산된다.
     */
    public static RecipeIngredient toEntity(RecipeIngredientRequestDto dto) {
        return RecipeIngredient.of(
                dto.getName().trim(),
                dto.getQuantity(),
                dto.getUnit(),
                dto.getCostPerUnit()
        );
    }

    public static List<RecipeIngredient> toEntityList(List<RecipeIngredientRequestDto> dtos) {
        if (dtos == null) {
            return Collections.emptyList();
        }
        return dtos.stream()
                .map(RecipeIngredientMapper::toEntity)
                .toList();
    }

    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        return RecipeIngredientDto.builder()
                .name(entity.getName())
                .quantity(entity.getQuantity())
                .unit(entity.getUnit())
                .costPerUnit(entity.getCostPerUnit())
                .totalCost(entity.getTotalCost())
                .build();
    }

    public static List<RecipeIngredientDto> toDtoList(List<RecipeIngredient> entities) {
        if (entities == null) {
            return Collections.emptyList();
        }
        return entities.stream()
                .map(RecipeIngredientMapper::toDto)
                .toList();
    }
}
