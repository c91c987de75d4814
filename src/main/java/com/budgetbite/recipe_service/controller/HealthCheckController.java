package com.budgetbite.recipe_service.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "헬스 체크 API", description = "모바일 앱과 로드밸런서가 서버 생존 여부를 확인하는 API입니다.")
public class HealthCheckController {

    static final String HEALTHY = "OK";

    @GetMapping("/api/health")
    @Operation(summary = "헬스 체크", description = "DB 조회 없이 애플리케이션 응답 여부만 확인합니다. 응답은 항상 'OK'입니다.")
    public String health() {
        return HEALTHY;
    }
}
