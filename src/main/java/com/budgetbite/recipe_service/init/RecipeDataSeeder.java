package com.budgetbite.recipe_service.init;

import com.budgetbite.recipe_service.domain.dto.recipe.RecipeCreateRequestDto;
import com.budgetbite.recipe_service.domain.dto.recipe.RecipeDto;
import com.budgetbite.recipe_service.domain.repository.RecipeRepository;
import com.budgetbite.recipe_service.exception.CustomException;
import com.budgetbite.recipe_service.service.RecipeService;
import com.budgetbite.recipe_service.util.PricingUtil;
import com.budgetbite.recipe_service.util.RecipeScaler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 빈 DB 에 classpath:data/recipes.json 의 기본 레시피를 넣는다.
 * 레시피가 하나라도 있으면 아무것도 하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "recipe.seed", name = "enabled", havingValue = "true")
public class RecipeDataSeeder implements ApplicationRunner {

    static final String SEED_RESOURCE = "data/recipes.json";
    static final String DEFAULT_CUISINE = "Filipino";
    static final String DEFAULT_CATEGORY = "Main Dish";
    static final List<String> DEFAULT_TAGS = List.of("filipino");

    private final RecipeRepository recipeRepository;
    private final RecipeService recipeService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @Override
    public void run(ApplicationArguments args) {
        if (recipeRepository.count() > 0) {
            log.info("레시피 데이터가 이미 존재하여 시딩을 건너뜁니다.");
            return;
        }

        List<RecipeCreateRequestDto> seeds = loadSeeds();
        log.info("레시피 시딩 시작: {}건", seeds.size());

        List<RecipeDto> inserted = new ArrayList<>();
        for (RecipeCreateRequestDto seed : seeds) {
            applyDefaults(seed);

            Set<ConstraintViolation<RecipeCreateRequestDto>> violations = validator.validate(seed);
            if (!violations.isEmpty()) {
                log.warn("레시피 '{}' 검증 실패로 건너뜀: {}", seed.getName(), violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .collect(Collectors.joining(", ")));
                continue;
            }

            try {
                inserted.add(recipeService.createRecipe(seed));
            } catch (CustomException e) {
                log.warn("레시피 '{}' 저장 실패로 건너뜀: {}", seed.getName(), e.getMessage());
            }
        }

        logSummary(inserted);
    }

    List<RecipeCreateRequestDto> loadSeeds() {
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<RecipeCreateRequestDto>>() {});
        } catch (IOException e) {
            throw new IllegalStateException(SEED_RESOURCE + " 로드 실패", e);
        }
    }

    static void applyDefaults(RecipeCreateRequestDto seed) {
        if (!StringUtils.hasText(seed.getCuisine())) {
            seed.setCuisine(DEFAULT_CUISINE);
        }
        if (!StringUtils.hasText(seed.getCategory())) {
            seed.setCategory(DEFAULT_CATEGORY);
        }
        if (seed.getTags() == null || seed.getTags().isEmpty()) {
            seed.setTags(new ArrayList<>(DEFAULT_TAGS));
        }
    }

    private void logSummary(List<RecipeDto> inserted) {
        log.info("레시피 시딩 완료: {}건 저장", inserted.size());
        if (inserted.isEmpty()) {
            return;
        }

        for (RecipeDto recipe : inserted) {
            log.info("  - {} | 총액 {} ({}/인분) | {}인분 | {}분 | 재료 {}개",
                    recipe.getName(),
                    PricingUtil.format(recipe.getTotalCost()),
                    PricingUtil.format(RecipeScaler.costPerServing(recipe, null)),
                    recipe.getServings(),
                    recipe.getTotalTime(),
                    recipe.getIngredients().size());
        }

        List<BigDecimal> costs = inserted.stream().map(RecipeDto::getTotalCost).toList();
        BigDecimal sum = costs.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = sum.divide(BigDecimal.valueOf(costs.size()), PricingUtil.CURRENCY_SCALE, RoundingMode.HALF_UP);
        BigDecimal min = costs.stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
        BigDecimal max = costs.stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO);

        log.info("재료비 통계: 평균 {}, 범위 {} ~ {}",
                PricingUtil.format(average), PricingUtil.format(min), PricingUtil.format(max));
    }
}
