package com.budgetbite.recipe_service.service;

import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeListResponseDto;
import com.budgetbite.recipe_service.domain.repository.RecipeRepository;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.exception.ErrorCode;
import com.budgetbite.recipe_service.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeSearchService {

    private final RecipeRepository recipeRepository;
    private final RecipeCostService recipeCostService;

    @Transactional(readOnly = true)
    public RecipeDto getRecipeDetail(Long recipeId) {
        return recipeRepository.findById(recipeId)
                .map(RecipeMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    /**
     * 전체 목록 (최신순). keyword 가 있으면 검색 결과로 대체된다.
     */
    @Transactional(readOnly = true)
    public RecipeListResponseDto getRecipes(String keyword, BigDecimal budget, Integer servings) {
        log.debug("레시피 목록 조회: keyword={}, budget={}, servings={}", keyword, budget, servings);

        List<RecipeDto> recipes = StringUtils.hasText(keyword)
                ? RecipeMapper.toDtoList(recipeRepository.search(keyword.trim()))
                : RecipeMapper.toDtoList(recipeRepository.findAllByOrderByCreatedAtDesc());

        List<? extends RecipeDto> priced = recipeCostService.priceForListing(recipes, budget, servings);
        return RecipeListResponseDto.builder()
                .count(priced.size())
                .recipes(priced)
                .build();
    }

    @Transactional(readOnly = true)
    public RecipeListResponseDto searchRecipes(String query, BigDecimal budget, Integer servings) {
        if (!StringUtils.hasText(query)) {
            throw new CustomException(ErrorCode.SEARCH_QUERY_REQUIRED);
        }
        String keyword = query.trim();
        log.debug("레시피 검색: q={}, budget={}, servings={}", keyword, budget, servings);

        List<RecipeDto> recipes = RecipeMapper.toDtoList(recipeRepository.search(keyword));
        List<? extends RecipeDto> priced = recipeCostService.priceForListing(recipes, budget, servings);

        return RecipeListResponseDto.builder()
                .count(priced.size())
                .query(keyword)
                .recipes(priced)
                .build();
    }
}
