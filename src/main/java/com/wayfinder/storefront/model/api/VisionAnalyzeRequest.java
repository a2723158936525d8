package com.wayfinder.storefront.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record VisionAnalyzeRequest(
        @NotBlank
        @JsonProperty("image_base64")
        String imageBase64,
        String prompt
) {
}
