package com.budgetbite.recipe_service.util;

import com.budgetbite.recipe_service.domain.dto.cost.CostBreakdownDto;
import com.budgetbite.recipe_service.domain.dto.cost.FilteredRecipeDto;
import com.budgetbite.recipe_service.domain.dto.cost.IngredientCostBreakdownDto;
import com.budgetbite.recipe_service.domain.dto.cost.ScaledRecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientDto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * 인분 환산 / 예산 필터 계산기.
 *
 * <p>목록 가격, 필터 가격, 상세 화면 환산이 모두 이 클래스를 거치므로 어디서 보든 같은 금액이 나온다.
 * 상태가 없는 순수 함수 모음이며 I/O, 로깅을 하지 않는다.
 *
 * <p>금액/수량 출력은 모두 소수 둘째 자리 HALF_UP. 환산 값은 {@code value × target ÷ original}
 * 을 한 번에 계산한 뒤 한 번만 반올림한다.
 */
public final class RecipeScaler {

    public static final BigDecimal DEFAULT_EXACT_BUDGET_TOLERANCE = new BigDecimal("5.00");

    private static final int SCALE = PricingUtil.CURRENCY_SCALE;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    private static final BigDecimal IDENTITY_FACTOR = BigDecimal.ONE.setScale(SCALE);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private RecipeScaler() {
    }

    /**
     * 레시피를 목표 인분으로 환산한다.
     *
     * <p>레시피 총액은 환산된 재료 금액을 다시 더하지 않고 원래 총액에서 바로 환산한다.
     * 그래서 재료 금액 합계와 총액이 재료 수 × 0.005 정도까지 차이 날 수 있다.
     *
     * @throws IllegalArgumentException 재료가 없거나 총액이 0 이하이거나 targetServings 가 0 이하인 경우
     */
    public static ScaledRecipeDto scaleToServings(RecipeDto recipe, int targetServings) {
        requireScalable(recipe, targetServings);
        if (recipe.getTotalCost() == null || recipe.getTotalCost().signum() <= 0) {
            throw new IllegalArgumentException("Recipe total cost must be positive to scale: " + recipe.getTotalCost());
        }

        int originalServings = ServingParser.parse(recipe.getServings());

        // 같은 인분이면 반올림 오차가 끼지 않도록 원본 그대로 돌려준다
        if (originalServings == targetServings) {
            return withRecipeFields(ScaledRecipeDto.builder(), recipe)
                    .originalServings(originalServings)
                    .targetServings(targetServings)
                    .scaleFactor(IDENTITY_FACTOR)
                    .costPerServing(perServing(recipe.getTotalCost(), originalServings))
                    .build();
        }

        BigDecimal scaledTotalCost = scale(recipe.getTotalCost(), originalServings, targetServings);

        return withRecipeFields(ScaledRecipeDto.builder(), recipe)
                .ingredients(scaleIngredients(recipe.getIngredients(), originalServings, targetServings))
                .totalCost(scaledTotalCost)
                .servings(String.valueOf(targetServings))
                .originalServings(originalServings)
                .targetServings(targetServings)
                .scaleFactor(scaleFactor(originalServings, targetServings))
                .costPerServing(perServing(scaledTotalCost, targetServings))
                .build();
    }

    /**
     * 목표 인분으로 환산했을 때 예산 이내(경계 포함)인 레시피만 남기고 1인분 비용 오름차순으로 정렬한다.
     * 1인분 비용이 같으면 입력 순서를 유지한다.
     *
     * <p>예산이나 인분이 없거나 0 이하이면 예외 대신 빈 목록을 돌려준다.
     */
    public static List<FilteredRecipeDto> filterAndRank(List<RecipeDto> recipes, BigDecimal budget, Integer targetServings) {
        if (targetServings == null || targetServings <= 0) {
            return Collections.emptyList();
        }
        return rankWithinBudget(recipes, budget, recipe -> targetServings);
    }

    /**
     * {@link #filterAndRank} 와 같지만 레시피마다 자기 인분 수를 그대로 사용한다 (환산 없음).
     */
    public static List<FilteredRecipeDto> filterAndRankAtOwnServings(List<RecipeDto> recipes, BigDecimal budget) {
        return rankWithinBudget(recipes, budget, recipe -> ServingParser.parse(recipe.getServings()));
    }

    /**
     * [minBudget, maxBudget] 범위(경계 포함)에 드는 레시피를 (환산) 총액 오름차순으로 돌려준다.
     *
     * @param minBudget      null 이면 0
     * @param maxBudget      null 이면 상한 없음
     * @param targetServings null 또는 0 이하이면 각 레시피의 원래 인분/총액으로 비교
     */
    public static List<FilteredRecipeDto> filterByBudgetRange(List<RecipeDto> recipes, BigDecimal minBudget,
                                                              BigDecimal maxBudget, Integer targetServings) {
        if (recipes == null || recipes.isEmpty()) {
            return Collections.emptyList();
        }

        BigDecimal lower = minBudget != null ? minBudget : BigDecimal.ZERO;
        Predicate<BigDecimal> inRange = cost ->
                cost.compareTo(lower) >= 0 && (maxBudget == null || cost.compareTo(maxBudget) <= 0);
        boolean scaled = targetServings != null && targetServings > 0;

        return recipes.stream()
                .filter(Objects::nonNull)
                .map(recipe -> {
                    int originalServings = ServingParser.parse(recipe.getServings());
                    int target = scaled ? targetServings : originalServings;
                    return project(recipe, originalServings, target, inRange);
                })
                .filter(FilteredRecipeDto::isFitsInBudget)
                .sorted(Comparator.comparing(FilteredRecipeDto::getScaledTotalCost))
                .toList();
    }

    /**
     * 정확한 예산 ± tolerance 범위에 드는 레시피. 하한은 0 아래로 내려가지 않는다.
     *
     * @param tolerance null 이면 {@link #DEFAULT_EXACT_BUDGET_TOLERANCE}
     */
    public static List<FilteredRecipeDto> recipesForExactBudget(List<RecipeDto> recipes, BigDecimal exactBudget,
                                                                Integer targetServings, BigDecimal tolerance) {
        if (recipes == null || exactBudget == null || exactBudget.signum() <= 0
                || targetServings == null || targetServings <= 0) {
            return Collections.emptyList();
        }

        BigDecimal margin = tolerance != null ? tolerance.abs() : DEFAULT_EXACT_BUDGET_TOLERANCE;
        BigDecimal minBudget = exactBudget.subtract(margin).max(BigDecimal.ZERO);
        BigDecimal maxBudget = exactBudget.add(margin);

        return filterByBudgetRange(recipes, minBudget, maxBudget, targetServings);
    }

    /**
     * 1인분 비용. servings 가 없거나 0 이면 레시피 자체 인분 수를 사용한다.
     * 총액이 없거나 0 이면, 또는 servings 가 음수이면 0.00.
     */
    public static BigDecimal costPerServing(RecipeDto recipe, Integer servings) {
        if (recipe == null || recipe.getTotalCost() == null || recipe.getTotalCost().signum() == 0) {
            return ZERO;
        }

        int actualServings = (servings == null || servings == 0)
                ? ServingParser.parse(recipe.getServings())
                : servings;
        if (actualServings <= 0) {
            return ZERO;
        }
        return perServing(recipe.getTotalCost(), actualServings);
    }

    /**
     * 상세 화면용 재료별 비용 내역. 비중(%)은 환산 전 정밀도의 레시피 총액 기준이다.
     *
     * @throws IllegalArgumentException 재료가 없거나 targetServings 가 0 이하인 경우
     */
    public static CostBreakdownDto ingredientCostBreakdown(RecipeDto recipe, int targetServings) {
        requireScalable(recipe, targetServings);

        int originalServings = ServingParser.parse(recipe.getServings());
        BigDecimal originalTotal = recipe.getTotalCost() != null ? recipe.getTotalCost() : BigDecimal.ZERO;
        BigDecimal scaledTotalCost = scale(originalTotal, originalServings, targetServings);

        // 환산 총액(반올림 전) = originalTotal × target / original
        BigDecimal percentageDenominator = originalTotal.multiply(BigDecimal.valueOf(targetServings));

        List<IngredientCostBreakdownDto> breakdown = new ArrayList<>();
        for (RecipeIngredientDto ingredient : recipe.getIngredients()) {
            BigDecimal scaledCost = scale(ingredient.getTotalCost(), originalServings, targetServings);
            BigDecimal percentage = percentageDenominator.signum() == 0
                    ? ZERO
                    : scaledCost.multiply(HUNDRED)
                    .multiply(BigDecimal.valueOf(originalServings))
                    .divide(percentageDenominator, SCALE, RoundingMode.HALF_UP);

            breakdown.add(IngredientCostBreakdownDto.builder()
                    .name(ingredient.getName())
                    .originalQuantity(ingredient.getQuantity())
                    .scaledQuantity(scale(ingredient.getQuantity(), originalServings, targetServings))
                    .unit(ingredient.getUnit())
                    .costPerUnit(ingredient.getCostPerUnit())
                    .originalTotalCost(ingredient.getTotalCost())
                    .scaledTotalCost(scaledCost)
                    .percentageOfTotal(percentage)
                    .build());
        }

        return CostBreakdownDto.builder()
                .originalServings(originalServings)
                .targetServings(targetServings)
                .scaleFactor(scaleFactor(originalServings, targetServings))
                .originalTotalCost(originalTotal)
                .scaledTotalCost(scaledTotalCost)
                .costPerServing(perServing(scaledTotalCost, targetServings))
                .ingredients(breakdown)
                .build();
    }

    /**
     * {@link #scaleToServings} 가 예외 없이 환산할 수 있는 레시피인지 (재료 1개 이상, 총액 양수)
     */
    public static boolean isScalable(RecipeDto recipe) {
        return recipe != null
                && recipe.getIngredients() != null && !recipe.getIngredients().isEmpty()
                && recipe.getTotalCost() != null && recipe.getTotalCost().signum() > 0;
    }

    private static List<FilteredRecipeDto> rankWithinBudget(List<RecipeDto> recipes, BigDecimal budget,
                                                            ToIntFunction<RecipeDto> targetOf) {
        if (recipes == null || recipes.isEmpty() || budget == null || budget.signum() <= 0) {
            return Collections.emptyList();
        }

        Predicate<BigDecimal> withinBudget = cost -> cost.compareTo(budget) <= 0;

        return recipes.stream()
                .filter(Objects::nonNull)
                .map(recipe -> project(recipe, ServingParser.parse(recipe.getServings()),
                        targetOf.applyAsInt(recipe), withinBudget))
                .filter(FilteredRecipeDto::isFitsInBudget)
                .sorted(Comparator.comparing(FilteredRecipeDto::getCostPerServing))
                .toList();
    }

    /**
     * 필터용 환산. scaleToServings 와 같은 계산이지만 예외 없이 0 총액/빈 재료도 받아들인다.
     */
    private static FilteredRecipeDto project(RecipeDto recipe, int originalServings, int targetServings,
                                             Predicate<BigDecimal> fits) {
        boolean identity = originalServings == targetServings;
        BigDecimal scaledTotalCost = identity
                ? PricingUtil.round(recipe.getTotalCost())
                : scale(recipe.getTotalCost(), originalServings, targetServings);

        FilteredRecipeDto.FilteredRecipeDtoBuilder<?, ?> builder = withRecipeFields(FilteredRecipeDto.builder(), recipe)
                .originalServings(originalServings)
                .targetServings(targetServings)
                .scaleFactor(identity ? IDENTITY_FACTOR : scaleFactor(originalServings, targetServings))
                .costPerServing(perServing(scaledTotalCost, targetServings))
                .scaledTotalCost(scaledTotalCost)
                .fitsInBudget(fits.test(scaledTotalCost));

        if (!identity) {
            builder.ingredients(scaleIngredients(recipe.getIngredients(), originalServings, targetServings))
                    .totalCost(scaledTotalCost)
                    .servings(String.valueOf(targetServings));
        }
        return builder.build();
    }

    private static List<RecipeIngredientDto> scaleIngredients(List<RecipeIngredientDto> ingredients,
                                                              int originalServings, int targetServings) {
        if (ingredients == null) {
            return Collections.emptyList();
        }
        // 단가는 그대로, 사용량과 금액만 환산
        return ingredients.stream()
                .map(ingredient -> RecipeIngredientDto.builder()
                        .name(ingredient.getName())
                        .quantity(scale(ingredient.getQuantity(), originalServings, targetServings))
                        .unit(ingredient.getUnit())
                        .costPerUnit(ingredient.getCostPerUnit())
                        .totalCost(scale(ingredient.getTotalCost(), originalServings, targetServings))
                        .build())
                .toList();
    }

    private static <B extends RecipeDto.RecipeDtoBuilder<?, ?>> B withRecipeFields(B builder, RecipeDto recipe) {
        builder.id(recipe.getId());
        builder.name(recipe.getName());
        builder.description(recipe.getDescription());
        builder.ingredients(recipe.getIngredients());
        builder.instructions(recipe.getInstructions());
        builder.servings(recipe.getServings());
        builder.totalCost(recipe.getTotalCost());
        builder.prepTime(recipe.getPrepTime());
        builder.cookTime(recipe.getCookTime());
        builder.totalTime(recipe.getTotalTime());
        builder.difficulty(recipe.getDifficulty());
        builder.category(recipe.getCategory());
        builder.cuisine(recipe.getCuisine());
        builder.tags(recipe.getTags());
        builder.createdAt(recipe.getCreatedAt());
        builder.updatedAt(recipe.getUpdatedAt());
        return builder;
    }

    private static void requireScalable(RecipeDto recipe, int targetServings) {
        if (recipe == null) {
            throw new IllegalArgumentException("Recipe must not be null");
        }
        if (recipe.getIngredients() == null || recipe.getIngredients().isEmpty()) {
            throw new IllegalArgumentException("Recipe must have at least one ingredient: " + recipe.getName());
        }
        if (targetServings <= 0) {
            throw new IllegalArgumentException("Target servings must be positive: " + targetServings);
        }
    }

    private static BigDecimal scale(BigDecimal value, int originalServings, int targetServings) {
        if (value == null) {
            return ZERO;
        }
        return value.multiply(BigDecimal.valueOf(targetServings))
                .divide(BigDecimal.valueOf(originalServings), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal scaleFactor(int originalServings, int targetServings) {
        return BigDecimal.valueOf(targetServings)
                .divide(BigDecimal.valueOf(originalServings), SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal perServing(BigDecimal totalCost, int servings) {
        if (totalCost == null) {
            return ZERO;
        }
        return totalCost.divide(BigDecimal.valueOf(servings), SCALE, RoundingMode.HALF_UP);
    }
}
