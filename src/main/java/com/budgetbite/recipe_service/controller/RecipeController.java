package com.budgetbite.recipe_service.controller;

import com.budgetbite.recipe_service.domain.dto.cost.RecipeFilterResponseDto;
import com.budgetbite.recipe_service.domain.dto.cost.ScaledRecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeListResponseDto;
import com.budgetbite.recipe_service.service.RecipeCostService;
import com.budgetbite.recipe_service.service.RecipeSearchService;
import com.budgetbite.recipe_service.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 API", description = "레시피 조회/검색, 예산·인분 필터, 인분 환산 및 레시피 관리를 위한 API입니다.")
public class RecipeController {

    private final RecipeService recipeService;
    private final RecipeSearchService recipeSearchService;
    private final RecipeCostService recipeCostService;

    @GetMapping
    @Operation(summary = "레시피 목록 조회", description = "전체 레시피를 최신순으로 조회합니다. servings 를 주면 해당 인분으로 환산하고, budget 을 주면 예산 이내 레시피만 1인분 비용 순으로 돌려줍니다.")
    public ResponseEntity<RecipeListResponseDto> getRecipes(
            @Parameter(description = "검색어 (이름, 설명, 재료, 태그, 카테고리)") @RequestParam(value = "search", required = false) String search,
            @Parameter(description = "예산 (₱)") @RequestParam(value = "budget", required = false) BigDecimal budget,
            @Parameter(description = "목표 인분 수") @RequestParam(value = "servings", required = false) Integer servings) {

        return ResponseEntity.ok(recipeSearchService.getRecipes(search, budget, servings));
    }

    @GetMapping("/search")
    @Operation(summary = "레시피 검색", description = "검색어로 레시피를 찾습니다. 검색어가 비어 있으면 400을 돌려줍니다.")
    public ResponseEntity<RecipeListResponseDto> searchRecipes(
            @Parameter(description = "검색어 (필수)") @RequestParam(value = "q", required = false) String q,
            @Parameter(description = "예산 (₱)") @RequestParam(value = "budget", required = false) BigDecimal budget,
            @Parameter(description = "목표 인분 수") @RequestParam(value = "servings", required = false) Integer servings) {

        return ResponseEntity.ok(recipeSearchService.searchRecipes(q, budget, servings));
    }

    @GetMapping("/filter")
    @Operation(summary = "예산/인분 필터", description = "budget + servings 이면 환산 후 예산 이내 레시피를 1인분 비용 순으로, minBudget/maxBudget 이면 총액 범위로 필터링합니다.")
    public ResponseEntity<RecipeFilterResponseDto> filterRecipes(
            @Parameter(description = "예산 (₱)") @RequestParam(value = "budget", required = false) BigDecimal budget,
            @Parameter(description = "목표 인분 수") @RequestParam(value = "servings", required = false) Integer servings,
            @Parameter(description = "최소 예산 (₱)") @RequestParam(value = "minBudget", required = false) BigDecimal minBudget,
            @Parameter(description = "최대 예산 (₱)") @RequestParam(value = "maxBudget", required = false) BigDecimal maxBudget) {

        recipeCostService.validateParameters(budget, servings, minBudget, maxBudget);
        return ResponseEntity.ok(recipeCostService.filterRecipes(budget, servings, minBudget, maxBudget));
    }

    @GetMapping("/filter/exact")
    @Operation(summary = "정확한 예산 필터", description = "budget ± tolerance 범위에 드는 레시피를 총액 순으로 조회합니다. tolerance 기본값은 ₱5.00 입니다.")
    public ResponseEntity<RecipeFilterResponseDto> filterRecipesForExactBudget(
            @Parameter(description = "예산 (₱, 필수)") @RequestParam(value = "budget", required = false) BigDecimal budget,
            @Parameter(description = "목표 인분 수 (필수)") @RequestParam(value = "servings", required = false) Integer servings,
            @Parameter(description = "허용 오차 (₱)") @RequestParam(value = "tolerance", required = false) BigDecimal tolerance) {

        return ResponseEntity.ok(recipeCostService.findRecipesForExactBudget(budget, servings, tolerance));
    }

    @GetMapping("/{recipeId}")
    @Operation(summary = "레시피 상세 조회", description = "저장된 인분 기준의 레시피 상세 정보를 조회합니다.")
    public ResponseEntity<RecipeDto> getRecipe(
            @Parameter(description = "레시피 ID") @PathVariable("recipeId") Long recipeId) {

        return ResponseEntity.ok(recipeSearchService.getRecipeDetail(recipeId));
    }

    @GetMapping("/{recipeId}/servings/{servings}")
    @Operation(summary = "인분 환산 상세 조회", description = "레시피를 지정한 인분으로 환산하고 재료별 비용 비중을 함께 돌려줍니다.")
    public ResponseEntity<ScaledRecipeDto> getRecipeForServings(
            @Parameter(description = "레시피 ID") @PathVariable("recipeId") Long recipeId,
            @Parameter(description = "목표 인분 수") @PathVariable("servings") int servings) {

        return ResponseEntity.ok(recipeCostService.getRecipeForServings(recipeId, servings));
    }

    @PostMapping
    @Operation(summary = "레시피 생성", description = "재료 총액과 레시피 총액은 서버에서 계산합니다.")
    public ResponseEntity<RecipeDto> createRecipe(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "레시피 생성 요청 DTO") @RequestBody @Valid RecipeCreateRequestDto request) {

        RecipeDto created = recipeService.createRecipe(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{recipeId}")
    @Operation(summary = "레시피 수정", description = "레시피 전체를 교체하고 재료비를 다시 계산합니다.")
    public ResponseEntity<RecipeDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable("recipeId") Long recipeId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "레시피 수정 요청 DTO") @RequestBody @Valid RecipeCreateRequestDto request) {

        return ResponseEntity.ok(recipeService.updateRecipe(recipeId, request));
    }

    @DeleteMapping("/{recipeId}")
    @Operation(summary = "레시피 삭제", description = "지정한 레시피를 삭제합니다.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable("recipeId") Long recipeId) {

        recipeService.deleteRecipe(recipeId);
        return ResponseEntity.noContent().build();
    }
}
