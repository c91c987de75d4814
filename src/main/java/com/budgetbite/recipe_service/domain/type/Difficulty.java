package com.budgetbite.recipe_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    private final String displayName;

    Difficulty(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static Difficulty fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        return Arrays.stream(Difficulty.values())
                .filter(type -> type.displayName.equalsIgnoreCase(displayName.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Difficulty must be Easy, Medium, or Hard: " + displayName));
    }
}
