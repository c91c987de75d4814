package com.budgetbite.recipe_service.domain.repository;

import com.budgetbite.recipe_service.domain.entity.Recipe;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long> {

    List<Recipe> findAllByOrderByCreatedAtDesc();

    /**
     * 이름/설명/재료명/태그/카테고리/요리 국가 중 하나라도 키워드를 포함하는 레시피 (대소문자 무시)
     */
    @Query("""
                SELECT DISTINCT r FROM Recipe r
                LEFT JOIN r.ingredients i
                LEFT JOIN r.tags t
                WHERE LOWER(r.name) LIKE LOWER(CONCAT('%', :keyword, '%'))
                   OR LOWER(r.description) LIKE LOWER(CONCAT('%', :keyword, '%'))
                   OR LOWER(i.name) LIKE LOWER(CONCAT('%', :keyword, '%'))
                   OR LOWER(t) LIKE LOWER(CONCAT('%', :keyword, '%'))
                   OR LOWER(r.category) LIKE LOWER(CONCAT('%', :keyword, '%'))
                   OR LOWER(r.cuisine) LIKE LOWER(CONCAT('%', :keyword, '%'))
                ORDER BY r.createdAt DESC
            """)
    List<Recipe> search(@Param("keyword") String keyword);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);
}
