package com.app.cinematch.model;

import java.util.Arrays;

public enum InteractionAction {
    WATCH("watch"),
    RATE("rate"),
    SKIP("skip"),
    WATCHLIST("watchlist");

    private final String code;

    InteractionAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static InteractionAction fromCode(String code) {
        return Arrays.stream(values())
                .filter(a -> a.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown interaction action: " + code));
    }
}
