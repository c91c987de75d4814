package com.budgetbite.recipe_service.domain.dto.recipe;

import com.budgetbite.recipe_service.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.budgetbite.recipe_service.domain.dto.recipe.step.RecipeStepDto;
import com.budgetbite.recipe_service.domain.type.Difficulty;
import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 레시피 기본 정보 (저장된 인분 기준).
 * 비용 계산 엔진(RecipeScaler)은 엔티티가 아니라 이 형태만 입력으로 받는다.
 */
@Getter
@SuperBuilder
@NoArgsConstructor
@Schema(description = "레시피 정보 DTO")
public class RecipeDto {

    @Schema(description = "레시피 ID")
    private Long id;

    @Schema(description = "레시피 이름")
    private String name;

    @Schema(description = "레시피 설명")
    private String description;

    @Schema(description = "재료 목록 (순서 유지)")
    private List<RecipeIngredientDto> ingredients;

    @Schema(description = "조리 단계 목록")
    private List<RecipeStepDto> instructions;

    @Schema(description = "인분 표기 (예: \"4\", \"4 people\", \"4 to 6\")")
    private String servings;

    @Schema(description = "레시피 총 재료비")
    private BigDecimal totalCost;

    @Schema(description = "준비 시간 (분)")
    private Integer prepTime;

    @Schema(description = "조리 시간 (분)")
    private Integer cookTime;

    @Schema(description = "총 소요 시간 (분) = prepTime + cookTime")
    private Integer totalTime;

    @Schema(description = "난이도 (Easy, Medium, Hard)")
    private Difficulty difficulty;

    @Schema(description = "카테고리")
    private String category;

    @Schema(description = "요리 국가/스타일")
    private String cuisine;

    @Schema(description = "태그 목록")
    private List<String> tags;

    @JsonFormat(
            shape = JsonFormat.Shape.STRING,
            pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'",
            timezone = "UTC"
    )
    @Schema(description = "생성일시 (UTC)")
    private LocalDateTime createdAt;

    @JsonFormat(
            shape = JsonFormat.Shape.STRING,
            pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'",
            timezone = "UTC"
    )
    @Schema(description = "업데이트일시 (UTC)")
    private LocalDateTime updatedAt;
}
