package com.budgetbite.recipe_service.domain.dto.cost;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 응답에 그대로 돌려주는 필터 조건
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class BudgetFilterDto {
    private BigDecimal budget;
    private Integer servings;
    private BigDecimal minBudget;
    private BigDecimal maxBudget;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BigDecimal tolerance;
}
