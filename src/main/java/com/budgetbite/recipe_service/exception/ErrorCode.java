package com.budgetbite.recipe_service.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),
    DUPLICATE_RECIPE_NAME(HttpStatus.CONFLICT, "202", "같은 이름의 레시피가 이미 존재합니다."),
    DUPLICATE_STEP_NUMBER(HttpStatus.BAD_REQUEST, "203", "조리 단계 번호는 중복될 수 없습니다."),
    SEARCH_QUERY_REQUIRED(HttpStatus.BAD_REQUEST, "204", "검색어는 필수입니다."),

    // --- Cost / Budget (300) ---
    INVALID_BUDGET_PARAMETER(HttpStatus.BAD_REQUEST, "301", "예산 또는 인분 조건이 올바르지 않습니다."),
    INVALID_BUDGET_RANGE(HttpStatus.BAD_REQUEST, "302", "최소 예산은 최대 예산보다 클 수 없습니다."),
    RECIPE_NOT_SCALABLE(HttpStatus.BAD_REQUEST, "303", "재료비 정보가 없어 인분 환산을 할 수 없는 레시피입니다."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    NULL_POINTER(HttpStatus.BAD_REQUEST, "904", "필수 데이터가 누락되었습니다."),
    INVALID_JSON(HttpStatus.BAD_REQUEST, "905", "JSON 형식이 올바르지 않습니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "906", "지원하지 않는 Content-Type 입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "907", "데이터베이스 제약조건 위반입니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
