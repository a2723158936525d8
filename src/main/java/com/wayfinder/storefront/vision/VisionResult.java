package com.wayfinder.storefront.vision;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Image analysis folded into one chat request. Only {@code description} is guaranteed; the catalog
 * fields are present when the model answered with a structured record.
 */
public record VisionResult(
        String description,
        String productType,
        String category,
        String subcategory,
        List<String> keyTerms
) {

    public VisionResult {
        description = description == null ? "" : description.trim();
        keyTerms = keyTerms == null ? List.of() : List.copyOf(keyTerms);
    }

    public static VisionResult ofDescription(String description) {
        return new VisionResult(description, null, null, null, List.of());
    }

    /**
     * Accepts either a plain description string or a {@code {description, product_type, ...}} object.
     *
     * @return null when the node carries nothing usable
     */
    public static VisionResult fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return StringUtils.hasText(node.asText()) ? ofDescription(node.asText()) : null;
        }
        if (!node.isObject()) {
            return null;
        }
        List<String> keyTerms = new ArrayList<>();
        JsonNode terms = node.path("key_terms");
        if (terms.isArray()) {
            for (JsonNode term : terms) {
                if (term.isValueNode() && StringUtils.hasText(term.asText())) {
                    keyTerms.add(term.asText().trim());
                }
            }
        }
        VisionResult result = new VisionResult(
                optionalText(node.get("description")),
                optionalText(node.get("product_type")),
                optionalText(node.get("category")),
                optionalText(node.get("subcategory")),
                keyTerms
        );
        if (!StringUtils.hasText(result.description()) && !result.isStructured()) {
            return null;
        }
        return result;
    }

    public boolean isStructured() {
        return StringUtils.hasText(productType)
                || StringUtils.hasText(category)
                || StringUtils.hasText(subcategory)
                || !keyTerms.isEmpty();
    }

    /**
     * Prefix placed ahead of the user's text in the agent query.
     */
    public String toContextPrefix() {
        StringBuilder context = new StringBuilder("[Vision Context: ").append(description);
        if (StringUtils.hasText(productType)) {
            context.append(" | Product type: ").append(productType);
        }
        if (StringUtils.hasText(category)) {
            context.append(" | Category: ").append(category);
            if (StringUtils.hasText(subcategory)) {
                context.append(" > ").append(subcategory);
            }
        }
        if (!keyTerms.isEmpty()) {
            context.append(" | Key terms: ").append(String.join(", ", keyTerms));
        }
        return context.append("] ").toString();
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("description", description);
        if (isStructured()) {
            data.put("product_type", productType);
            data.put("category", category);
            data.put("subcategory", subcategory);
            data.put("key_terms", keyTerms);
        }
        return data;
    }

    private static String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String text = node.isTextual() ? node.asText() : node.toString();
        return StringUtils.hasText(text) ? text.trim() : null;
    }
}
