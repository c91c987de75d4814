package com.budgetbite.recipe_service.service;

import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeListResponseDto;
import com.budgetbite.recipe_service.domain.entity.Recipe;
import com.budgetbite.recipe_service.domain.entity.RecipeIngredient;
import com.budgetbite.recipe_service.domain.repository.RecipeRepository;
import com.budgetbite.recipe_service.domain.type.IngredientUnit;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeSearchServiceTest {

    @Mock
    private RecipeRepository recipeRepository;

    @Mock
    private RecipeCostService recipeCostService;

    @InjectMocks
    private RecipeSearchService recipeSearchService;

    private Recipe adobo;

    @BeforeEach
    void setUp() {
        adobo = Recipe.builder().id(1L).name("Chicken Adobo").description("braised").servings("4").build();
        adobo.replaceIngredients(List.of(
                RecipeIngredient.of("chicken", BigDecimal.ONE, IngredientUnit.KG, new BigDecimal("100"))));
    }

    @Test
    @DisplayName("getRecipeDetail: 엔티티를 DTO 로 변환, 없으면 RECIPE_NOT_FOUND")
    void getRecipeDetail() {
        when(recipeRepository.findById(1L)).thenReturn(Optional.of(adobo));
        when(recipeRepository.findById(2L)).thenReturn(Optional.empty());

        RecipeDto dto = recipeSearchService.getRecipeDetail(1L);

        assertEquals("Chicken Adobo", dto.getName());
        assertEquals(new BigDecimal("100.00"), dto.getTotalCost());
        assertEquals(ErrorCode.RECIPE_NOT_FOUND,
                assertThrows(CustomException.class, () -> recipeSearchService.getRecipeDetail(2L)).getErrorCode());
    }

    @Test
    @DisplayName("getRecipes: 검색어가 없으면 전체 목록을 가격 계산에 넘긴다")
    @SuppressWarnings("unchecked")
    void getRecipes_all() {
        when(recipeRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(adobo));
        doAnswer(invocation -> invocation.getArgument(0))
                .when(recipeCostService).priceForListing(anyList(), isNull(), eq(2));

        RecipeListResponseDto response = recipeSearchService.getRecipes("  ", null, 2);

        ArgumentCaptor<List<RecipeDto>> captor = ArgumentCaptor.forClass(List.class);
        verify(recipeCostService).priceForListing(captor.capture(), isNull(), eq(2));
        assertEquals("Chicken Adobo", captor.getValue().get(0).getName());
        assertEquals(1, response.getCount());
        assertNull(response.getQuery());
        verify(recipeRepository, never()).search(any());
    }

    @Test
    @DisplayName("getRecipes: 검색어가 있으면 검색 결과를 사용한다")
    void getRecipes_withKeyword() {
        when(recipeRepository.search("adobo")).thenReturn(List.of(adobo));
        doAnswer(invocation -> invocation.getArgument(0))
                .when(recipeCostService).priceForListing(anyList(), isNull(), isNull());

        RecipeListResponseDto response = recipeSearchService.getRecipes(" adobo ", null, null);

        assertEquals(1, response.getCount());
        verify(recipeRepository, never()).findAllByOrderByCreatedAtDesc();
    }

    @Test
    @DisplayName("searchRecipes: 검색어가 비어 있으면 SEARCH_QUERY_REQUIRED")
    void searchRecipes_blankQuery() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeSearchService.searchRecipes(" ", null, null));

        assertEquals(ErrorCode.SEARCH_QUERY_REQUIRED, ex.getErrorCode());
        verifyNoInteractions(recipeRepository, recipeCostService);
    }

    @Test
    @DisplayName("searchRecipes: 응답에 검색어를 포함한다")
    void searchRecipes() {
        when(recipeRepository.search("chicken")).thenReturn(List.of(adobo));
        doAnswer(invocation -> invocation.getArgument(0))
                .when(recipeCostService).priceForListing(anyList(), eq(new BigDecimal("500")), isNull());

        RecipeListResponseDto response = recipeSearchService.searchRecipes("chicken", new BigDecimal("500"), null);

        assertEquals("chicken", response.getQuery());
        assertEquals(1, response.getCount());
    }
}
