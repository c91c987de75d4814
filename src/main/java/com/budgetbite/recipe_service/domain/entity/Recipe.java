package com.budgetbite.recipe_service.domain.entity;

import com.budgetbite.recipe_service.domain.entity.common.BaseTimeEntity;
import com.budgetbite.recipe_service.domain.type.Difficulty;
import com.budgetbite.recipe_service.util.PricingUtil;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;


@Entity
@Table(
        name = "recipes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_recipe_name", columnNames = {"name"})
        },
        indexes = {
                @Index(name = "idx_recipe_total_cost", columnList = "total_cost"),
                @Index(name = "idx_recipe_difficulty", columnList = "difficulty"),
                @Index(name = "idx_recipe_created_at", columnList = "created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 1000)
    private String description;

    /** 인분 표기 원문 ("4", "4 people", "4 to 6") */
    @Column(nullable = false, length = 20)
    private String servings;

    @Column(name = "total_cost", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal totalCost = BigDecimal.ZERO;

    @Column(name = "prep_time")
    private Integer prepTime;

    @Column(name = "cook_time")
    private Integer cookTime;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    @Builder.Default
    private Difficulty difficulty = Difficulty.MEDIUM;

    @Column(length = 50)
    private String category;

    @Column(length = 50)
    private String cuisine;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "recipe_tags", joinColumns = @JoinColumn(name = "recipe_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag", length = 30)
    @BatchSize(size = 20)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "recipe_ingredients", joinColumns = @JoinColumn(name = "recipe_id"))
    @OrderColumn(name = "ingredient_order")
    @BatchSize(size = 20)
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "recipe_steps", joinColumns = @JoinColumn(name = "recipe_id"))
    @OrderColumn(name = "step_order")
    @BatchSize(size = 20)
    @Builder.Default
    private List<RecipeStep> instructions = new ArrayList<>();

    public void update(String name, String description, String servings, Integer prepTime, Integer cookTime,
                       Difficulty difficulty, String category, String cuisine, List<String> tags,
                       List<RecipeStep> instructions) {
        this.name = name;
        this.description = description;
        this.servings = servings;
        this.prepTime = prepTime;
        this.cookTime = cookTime;
        this.difficulty = difficulty != null ? difficulty : Difficulty.MEDIUM;
        this.category = category;
        this.cuisine = cuisine;
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        this.instructions = instructions != null ? new ArrayList<>(instructions) : new ArrayList<>();
    }

    /**
     * 재료 목록 교체 + totalCost 재계산.
     * totalCost는 재료 총액의 파생값이므로 재료가 바뀌는 유일한 경로인 이 메서드에서만 갱신된다.
     */
    public void replaceIngredients(List<RecipeIngredient> ingredients) {
        this.ingredients = ingredients != null ? new ArrayList<>(ingredients) : new ArrayList<>();
        this.totalCost = PricingUtil.recipeTotalCost(
                this.ingredients.stream().map(RecipeIngredient::getTotalCost).toList());
    }

    public int getTotalTime() {
        int prep = prepTime != null ? prepTime : 0;
        int cook = cookTime != null ? cookTime : 0;
        return prep + cook;
    }
}
