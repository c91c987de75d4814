package com.budgetbite.recipe_service.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인분 표기("4", "4 people", "4 to 6", 6 등)에서 숫자 인분 수를 추출한다.
 * 검증기가 아니라 정규화기이므로 어떤 입력에도 예외를 던지지 않는다.
 */
public final class ServingParser {

    public static final int DEFAULT_SERVINGS = 1;

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    private ServingParser() {
    }

    /**
     * @param servingsValue Number 또는 String (null 허용)
     * @return 1 이상의 인분 수. 범위 표기("4 to 6")는 첫 숫자를 사용한다.
     */
    public static int parse(Object servingsValue) {
        if (servingsValue == null) {
            return DEFAULT_SERVINGS;
        }

        if (servingsValue instanceof Number number) {
            return positiveOrDefault(number.intValue());
        }

        String text = servingsValue.toString();
        if (text.isBlank()) {
            return DEFAULT_SERVINGS;
        }

        Matcher matcher = FIRST_NUMBER.matcher(text);
        if (!matcher.find()) {
            return DEFAULT_SERVINGS;
        }

        String digits = matcher.group().replaceFirst("^0+(?!$)", "");
        // int 범위를 넘는 숫자열은 인분 수로 의미가 없으므로 기본값
        if (digits.length() > 9) {
            return DEFAULT_SERVINGS;
        }
        return positiveOrDefault(Integer.parseInt(digits));
    }

    private static int positiveOrDefault(int value) {
        return value > 0 ? value : DEFAULT_SERVINGS;
    }
}
