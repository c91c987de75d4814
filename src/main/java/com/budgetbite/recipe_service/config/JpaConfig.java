package com.budgetbite.recipe_service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * createdAt / updatedAt 자동 기록.
 * 애플리케이션 클래스에 두면 @WebMvcTest 슬라이스에서도 JPA 메타모델을 요구하므로 분리해 둔다.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
