package com.budgetbite.recipe_service.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String BUDGET_RECIPES = "budgetRecipes";

    @Bean
    public CacheManager cacheManager() {
        SimpleCacheManager cacheManager = new SimpleCacheManager();
        cacheManager.setCaches(List.of(
                buildCache(BUDGET_RECIPES, 60, 100)
        ));
        return cacheManager;
    }

    /**
     * 캐시 생성 헬퍼 메서드
     * @param name 캐시 이름
     * @param minutes 만료 시간(분)
     * @param maxSize 최대 저장 개수
     */
    private CaffeineCache buildCache(String name, int minutes, int maxSize) {
        return new CaffeineCache(name, Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(minutes))
                .maximumSize(maxSize)
                .recordStats()
                .build());
    }
}
