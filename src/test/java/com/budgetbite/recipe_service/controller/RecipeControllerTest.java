package com.budgetbite.recipe_service.controller;

import com.budgetbite.recipe_service.domain.dto.cost.BudgetFilterDto;
import com.budgetbite.recipe_service.domain.dto.cost.FilteredRecipeDto;
import com.budgetbite.recipe_service.domain.dto.cost.RecipeFilterResponseDto;
import com.budgetbite.recipe_service.domain.dto.cost.ScaledRecipeDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.type.Difficulty;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.exception.ErrorCode;
import com.budgetbite.recipe_service.service.RecipeCostService;
import com.budgetbite.recipe_service.service.RecipeSearchService;
import com.budgetbite.recipe_service.service.RecipeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {RecipeController.class, HealthCheckController.class})
@ActiveProfiles("test")
class RecipeControllerTest {

    private static final String VALID_RECIPE_JSON = """
            {
              "name": "Chicken Adobo",
              "description": "Chicken braised in vinegar and soy sauce",
              "servings": 4,
              "difficulty": "Easy",
              "ingredients": [
                { "name": "chicken", "quantity": 1, "unit": "kg", "costPerUnit": 220 }
              ],
              "instructions": [
                { "stepNumber": 1, "description": "Simmer everything" }
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RecipeService recipeService;

    @MockitoBean
    private RecipeSearchService recipeSearchService;

    @MockitoBean
    private RecipeCostService recipeCostService;

    @Test
    @DisplayName("GET /filter: 파라미터 검증 후 필터 결과를 돌려준다")
    void filterRecipes() throws Exception {
        FilteredRecipeDto adobo = FilteredRecipeDto.builder()
                .id(1L)
                .name("Chicken Adobo")
                .totalCost(new BigDecimal("200.00"))
                .scaledTotalCost(new BigDecimal("200.00"))
                .costPerServing(new BigDecimal("25.00"))
                .originalServings(4)
                .targetServings(8)
                .scaleFactor(new BigDecimal("2.00"))
                .fitsInBudget(true)
                .build();
        adobo.setFormattedTotalCost("₱200.00");
        when(recipeCostService.filterRecipes(new BigDecimal("250"), 8, null, null))
                .thenReturn(RecipeFilterResponseDto.builder()
                        .count(1)
                        .filters(BudgetFilterDto.builder().budget(new BigDecimal("250")).servings(8).build())
                        .recipes(List.of(adobo))
                        .build());

        mockMvc.perform(get("/api/recipes/filter").param("budget", "250").param("servings", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.filters.budget").value(250))
                .andExpect(jsonPath("$.filters.servings").value(8))
                .andExpect(jsonPath("$.recipes[0].name").value("Chicken Adobo"))
                .andExpect(jsonPath("$.recipes[0].scaledTotalCost").value(200.0))
                .andExpect(jsonPath("$.recipes[0].fitsInBudget").value(true))
                .andExpect(jsonPath("$.recipes[0].formattedTotalCost").value("₱200.00"));

        verify(recipeCostService).validateParameters(new BigDecimal("250"), 8, null, null);
    }

    @Test
    @DisplayName("GET /filter: 검증 실패 시 400 + 301")
    void filterRecipes_invalid() throws Exception {
        doThrow(new CustomException(ErrorCode.INVALID_BUDGET_PARAMETER, "인분 수는 1 이상 100 이하이어야 합니다."))
                .when(recipeCostService).validateParameters(isNull(), eq(0), isNull(), isNull());

        mockMvc.perform(get("/api/recipes/filter").param("servings", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("301"))
                .andExpect(jsonPath("$.message").value("인분 수는 1 이상 100 이하이어야 합니다."));

        verify(recipeCostService, never()).filterRecipes(any(), any(), any(), any());
    }

    @Test
    @DisplayName("GET /filter: 숫자가 아닌 예산은 400")
    void filterRecipes_typeMismatch() throws Exception {
        mockMvc.perform(get("/api/recipes/filter").param("budget", "cheap"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("901"));
    }

    @Test
    @DisplayName("GET /search: 검색어 누락 시 400 + 204")
    void searchRecipes_missingQuery() throws Exception {
        when(recipeSearchService.searchRecipes(null, null, null))
                .thenThrow(new CustomException(ErrorCode.SEARCH_QUERY_REQUIRED));

        mockMvc.perform(get("/api/recipes/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("204"))
                .andExpect(jsonPath("$.message").value(ErrorCode.SEARCH_QUERY_REQUIRED.getMessage()));
    }

    @Test
    @DisplayName("GET /{id}/servings/{servings}: 환산 결과")
    void getRecipeForServings() throws Exception {
        ScaledRecipeDto scaled = ScaledRecipeDto.builder()
                .id(1L)
                .name("Chicken Adobo")
                .servings("8")
                .difficulty(Difficulty.EASY)
                .totalCost(new BigDecimal("200.00"))
                .originalServings(4)
                .targetServings(8)
                .scaleFactor(new BigDecimal("2.00"))
                .costPerServing(new BigDecimal("25.00"))
                .build();
        scaled.setFormattedCostPerServing("₱25.00");
        when(recipeCostService.getRecipeForServings(1L, 8)).thenReturn(scaled);

        mockMvc.perform(get("/api/recipes/1/servings/8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.originalServings").value(4))
                .andExpect(jsonPath("$.targetServings").value(8))
                .andExpect(jsonPath("$.costPerServing").value(25.0))
                .andExpect(jsonPath("$.difficulty").value("Easy"))
                .andExpect(jsonPath("$.formattedCostPerServing").value("₱25.00"));
    }

    @Test
    @DisplayName("GET /{id}: 없는 레시피는 404 + 201")
    void getRecipe_notFound() throws Exception {
        when(recipeSearchService.getRecipeDetail(99L)).thenThrow(new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        mockMvc.perform(get("/api/recipes/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("201"));
    }

    @Test
    @DisplayName("POST: 숫자 인분도 문자열로 받아 201")
    void createRecipe() throws Exception {
        when(recipeService.createRecipe(any(RecipeCreateRequestDto.class)))
                .thenReturn(RecipeDto.builder().id(10L).name("Chicken Adobo").totalCost(new BigDecimal("220.00")).build());

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_RECIPE_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(10))
                .andExpect(jsonPath("$.totalCost").value(220.0));

        ArgumentCaptor<RecipeCreateRequestDto> captor = ArgumentCaptor.forClass(RecipeCreateRequestDto.class);
        verify(recipeService).createRecipe(captor.capture());
        assertEquals("4", captor.getValue().getServings());
        assertEquals(Difficulty.EASY, captor.getValue().getDifficulty());
    }

    @Test
    @DisplayName("POST: 재료가 없으면 400 + 검증 메시지")
    void createRecipe_validation() throws Exception {
        String body = """
                { "name": "Empty", "description": "nothing", "servings": "2", "ingredients": [] }
                """;

        mockMvc.perform(post("/api/recipes").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("901"))
                .andExpect(jsonPath("$.message").value("레시피에는 재료가 최소 1개 필요합니다."));

        verifyNoInteractions(recipeService);
    }

    @Test
    @DisplayName("POST: 허용되지 않은 단위는 400 + 905")
    void createRecipe_unknownUnit() throws Exception {
        String body = VALID_RECIPE_JSON.replace("\"kg\"", "\"bucket\"");

        mockMvc.perform(post("/api/recipes").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("905"));
    }

    @Test
    @DisplayName("POST: JSON 이 아니면 415")
    void createRecipe_wrongContentType() throws Exception {
        mockMvc.perform(post("/api/recipes").contentType(MediaType.TEXT_PLAIN).content("adobo"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.code").value("906"));
    }

    @Test
    @DisplayName("PUT: 수정 결과를 200 으로 돌려준다")
    void updateRecipe() throws Exception {
        when(recipeService.updateRecipe(eq(5L), any(RecipeCreateRequestDto.class)))
                .thenReturn(RecipeDto.builder().id(5L).name("Chicken Adobo").build());

        mockMvc.perform(put("/api/recipes/5").contentType(MediaType.APPLICATION_JSON).content(VALID_RECIPE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5));
    }

    @Test
    @DisplayName("DELETE: 204")
    void deleteRecipe() throws Exception {
        mockMvc.perform(delete("/api/recipes/3"))
                .andExpect(status().isNoContent());

        verify(recipeService).deleteRecipe(3L);
    }

    @Test
    @DisplayName("지원하지 않는 메소드는 405 + 902")
    void methodNotAllowed() throws Exception {
        mockMvc.perform(patch("/api/recipes/3"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value("902"));
    }

    @Test
    @DisplayName("GET /api/health → OK")
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
