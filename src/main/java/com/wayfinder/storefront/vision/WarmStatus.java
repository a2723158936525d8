package com.wayfinder.storefront.vision;

public enum WarmStatus {
    WARM("warm"),
    WARMING("warming"),
    UNAVAILABLE("unavailable");

    private final String value;

    WarmStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
