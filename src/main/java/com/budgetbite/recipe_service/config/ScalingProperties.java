package com.budgetbite.recipe_service.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "recipe.scaling")
@Getter @Setter
public class ScalingProperties {
    private BigDecimal maxBudget = new BigDecimal("100000");
    private int maxServings = 100;
    private BigDecimal exactBudgetTolerance = new BigDecimal("5.00");
    private String currencySymbol = "₱";
}
