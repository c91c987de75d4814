package com.budgetbite.recipe_service.service;

import com.budgetbite.recipe_service.config.CacheConfig;
import com.budgetbite.recipe_service.config.ScalingProperties;
import com.budgetbite.recipe_service.domain.dto.cost.BudgetFilterDto;
import com.budgetbite.recipe_service.domain.dto.cost.CostBreakdownDto;
import com.budgetbite.recipe_service.domain.dto.cost.FilteredRecipeDto;
import com.budgetbite.recipe_service.domain.dto.cost.RecipeFilterResponseDto;
import com.budgetbite.recipe_service.domain.dto.cost.ScaledRecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.budgetbite.recipe_service.domain.entity.Recipe;
import com.budgetbite.recipe_service.domain.repository.RecipeRepository;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.exception.ErrorCode;
import com.budgetbite.recipe_service.mapper.RecipeMapper;
import com.budgetbite.recipe_service.util.PricingUtil;
import com.budgetbite.recipe_service.util.RecipeScaler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 예산/인분 관련 조회.
 * 계산은 전부 RecipeScaler 에 위임하고, 여기서는 파라미터 검증 / 조회 / 표시용 문자열만 담당한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeCostService {

    private final RecipeRepository recipeRepository;
    private final ScalingProperties scalingProperties;

    /**
     * 예산/인분 파라미터 검증. 위반 사항을 모두 모아 하나의 메시지로 던진다.
     * 모든 파라미터는 선택값이며 null 이면 검사하지 않는다.
     */
    public void validateParameters(BigDecimal budget, Integer servings, BigDecimal minBudget, BigDecimal maxBudget) {
        List<String> errors = new ArrayList<>();

        if (budget != null) {
            if (budget.signum() < 0) {
                errors.add("예산은 0 이상이어야 합니다.");
            }
            if (budget.compareTo(scalingProperties.getMaxBudget()) > 0) {
                errors.add("예산은 " + PricingUtil.format(scalingProperties.getMaxBudget(), scalingProperties.getCurrencySymbol())
                        + " 을 넘을 수 없습니다.");
            }
        }

        if (servings != null && (servings < 1 || servings > scalingProperties.getMaxServings())) {
            errors.add("인분 수는 1 이상 " + scalingProperties.getMaxServings() + " 이하이어야 합니다.");
        }

        if (minBudget != null && minBudget.signum() < 0) {
            errors.add("최소 예산은 0 이상이어야 합니다.");
        }
        if (maxBudget != null && maxBudget.signum() < 0) {
            errors.add("최대 예산은 0 이상이어야 합니다.");
        }
        if (minBudget != null && maxBudget != null && minBudget.compareTo(maxBudget) > 0) {
            errors.add(ErrorCode.INVALID_BUDGET_RANGE.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_BUDGET_PARAMETER, String.join(" ", errors));
        }
    }

    /**
     * 1) budget + servings → 목표 인분 환산 후 예산 이내, 1인분 비용 오름차순
     * 2) budget 만 → 레시피 자체 인분 기준 예산 이내, 1인분 비용 오름차순
     * 3) minBudget / maxBudget → 범위 필터, (환산) 총액 오름차순
     * 4) 조건 없음 → 전체 레시피 + 1인분 비용, 총액 오름차순
     *
     * 호출 전에 {@link #validateParameters} 를 거쳐야 한다.
     */
    @Cacheable(cacheNames = CacheConfig.BUDGET_RECIPES)
    @Transactional(readOnly = true)
    public RecipeFilterResponseDto filterRecipes(BigDecimal budget, Integer servings,
                                                 BigDecimal minBudget, BigDecimal maxBudget) {
        log.debug("예산 필터 조회: budget={}, servings={}, minBudget={}, maxBudget={}",
                budget, servings, minBudget, maxBudget);

        List<RecipeDto> recipes = loadAll();

        List<FilteredRecipeDto> result;
        if (budget != null && servings != null) {
            result = RecipeScaler.filterAndRank(recipes, budget, servings);
        } else if (budget != null) {
            result = RecipeScaler.filterAndRankAtOwnServings(recipes, budget);
        } else {
            result = RecipeScaler.filterByBudgetRange(recipes, minBudget, maxBudget, servings);
        }

        result.forEach(this::applyFormatting);

        return RecipeFilterResponseDto.builder()
                .count(result.size())
                .filters(BudgetFilterDto.builder()
                        .budget(budget)
                        .servings(servings)
                        .minBudget(minBudget)
                        .maxBudget(maxBudget)
                        .build())
                .recipes(result)
                .build();
    }

    /**
     * 정확한 예산 ± 허용 오차 범위의 레시피. budget, servings 는 필수.
     */
    @Transactional(readOnly = true)
    public RecipeFilterResponseDto findRecipesForExactBudget(BigDecimal budget, Integer servings, BigDecimal tolerance) {
        if (budget == null || servings == null) {
            throw new CustomException(ErrorCode.INVALID_BUDGET_PARAMETER, "예산과 인분 수는 필수입니다.");
        }
        if (tolerance != null && tolerance.signum() < 0) {
            throw new CustomException(ErrorCode.INVALID_BUDGET_PARAMETER, "허용 오차는 0 이상이어야 합니다.");
        }
        validateParameters(budget, servings, null, null);

        BigDecimal appliedTolerance = tolerance != null ? tolerance : scalingProperties.getExactBudgetTolerance();
        List<FilteredRecipeDto> result =
                RecipeScaler.recipesForExactBudget(loadAll(), budget, servings, appliedTolerance);
        result.forEach(this::applyFormatting);

        return RecipeFilterResponseDto.builder()
                .count(result.size())
                .filters(BudgetFilterDto.builder()
                        .budget(budget)
                        .servings(servings)
                        .tolerance(appliedTolerance)
                        .build())
                .recipes(result)
                .build();
    }

    /**
     * 상세 화면용 인분 환산 + 재료별 비용 비중
     */
    @Transactional(readOnly = true)
    public ScaledRecipeDto getRecipeForServings(Long recipeId, int servings) {
        validateParameters(null, servings, null, null);

        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        RecipeDto dto = RecipeMapper.toDto(recipe);

        if (!RecipeScaler.isScalable(dto)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_SCALABLE);
        }

        ScaledRecipeDto scaled = RecipeScaler.scaleToServings(dto, servings);
        scaled.setCostBreakdown(RecipeScaler.ingredientCostBreakdown(dto, servings));
        applyFormatting(scaled);
        return scaled;
    }

    /**
     * 목록 화면 가격 계산. 목록/검색 API 가 같은 규칙을 쓰도록 여기 모아둔다.
     * <ul>
     *     <li>budget 있음 → 예산 필터 + 1인분 비용 정렬 (servings 없으면 각자 인분)</li>
     *     <li>servings 만 있음 → 환산 가능한 레시피는 환산, 나머지는 원본 그대로 (순서 유지)</li>
     *     <li>둘 다 없음 → 원본 그대로</li>
     * </ul>
     */
    public List<? extends RecipeDto> priceForListing(List<RecipeDto> recipes, BigDecimal budget, Integer servings) {
        validateParameters(budget, servings, null, null);

        if (budget != null) {
            List<FilteredRecipeDto> filtered = servings != null
                    ? RecipeScaler.filterAndRank(recipes, budget, servings)
                    : RecipeScaler.filterAndRankAtOwnServings(recipes, budget);
            filtered.forEach(this::applyFormatting);
            return filtered;
        }

        if (servings == null) {
            return recipes;
        }

        List<RecipeDto> priced = new ArrayList<>(recipes.size());
        for (RecipeDto recipe : recipes) {
            if (RecipeScaler.isScalable(recipe)) {
                ScaledRecipeDto scaled = RecipeScaler.scaleToServings(recipe, servings);
                applyFormatting(scaled);
                priced.add(scaled);
            } else {
                priced.add(recipe);
            }
        }
        return priced;
    }

    private List<RecipeDto> loadAll() {
        return RecipeMapper.toDtoList(recipeRepository.findAllByOrderByCreatedAtDesc());
    }

    private void applyFormatting(ScaledRecipeDto scaled) {
        String symbol = scalingProperties.getCurrencySymbol();

        scaled.setFormattedTotalCost(PricingUtil.format(scaled.getTotalCost(), symbol));
        scaled.setFormattedCostPerServing(PricingUtil.format(scaled.getCostPerServing(), symbol));

        if (scaled.getIngredients() != null) {
            for (RecipeIngredientDto ingredient : scaled.getIngredients()) {
                ingredient.setFormattedTotalCost(PricingUtil.format(ingredient.getTotalCost(), symbol));
                ingredient.setFormattedCostPerUnit(PricingUtil.format(ingredient.getCostPerUnit(), symbol));
            }
        }

        CostBreakdownDto breakdown = scaled.getCostBreakdown();
        if (breakdown != null) {
            breakdown.setFormattedScaledTotalCost(PricingUtil.format(breakdown.getScaledTotalCost(), symbol));
            breakdown.setFormattedCostPerServing(PricingUtil.format(breakdown.getCostPerServing(), symbol));
            breakdown.getIngredients().forEach(item ->
                    item.setFormattedScaledTotalCost(PricingUtil.format(item.getScaledTotalCost(), symbol)));
        }
    }
}
