package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
        String error,
        @JsonProperty("status_code")
        int statusCode
) {

    public static ApiError of(int statusCode, String error) {
        return new ApiError(error, statusCode);
    }
}
