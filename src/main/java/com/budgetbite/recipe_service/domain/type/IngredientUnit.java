package com.budgetbite.recipe_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum IngredientUnit {
    CUPS("cups"),
    TBSP("tbsp"),
    TSP("tsp"),
    LBS("lbs"),
    OZ("oz"),
    GRAMS("grams"),
    KG("kg"),
    PIECES("pieces"),
    CLOVES("cloves"),
    ML("ml"),
    LITERS("liters"),
    CUP("cup"),
    LARGE("large"),
    CLOVE("clove"),
    SCALLION("scallion"),
    PC("pc"),
    BUNCH("bunch"),
    PACK("pack"),
    HEAD("head"),
    STALK("stalk"),
    SPRIGS("sprigs");

    private final String code;

    IngredientUnit(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static IngredientUnit fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(unit -> unit.code.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid unit '" + code + "'. Allowed units: " + allowedCodes()));
    }

    public static String allowedCodes() {
        return Arrays.stream(values())
                .map(IngredientUnit::getCode)
                .collect(Collectors.joining(", "));
    }
}
