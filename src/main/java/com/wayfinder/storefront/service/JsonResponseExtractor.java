package com.wayfinder.storefront.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls a JSON object out of free-form agent or model output.
 * <p>
 * Agents often wrap their JSON in a markdown fence or surround it with prose. The first fenced block is
 * tried as a whole; failing that, the first flat object mentioning one of the required fields.
 */
@Component
public class JsonResponseExtractor {

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public JsonResponseExtractor(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    /**
     * @return the parsed object, or a copy of {@code fallback} (an empty object when null)
     */
    public ObjectNode extract(String responseText, List<String> requiredFields, ObjectNode fallback) {
        ObjectNode defaultValue = fallback == null ? objectMapper.createObjectNode() : fallback.deepCopy();
        if (!StringUtils.hasText(responseText)) {
            return defaultValue;
        }
        String cleaned = stripCodeFence(responseText);

        ObjectNode direct = parseObject(cleaned);
        if (direct != null) {
            return direct;
        }

        if (requiredFields != null && !requiredFields.isEmpty()) {
            Matcher matcher = flatObjectPattern(requiredFields).matcher(cleaned);
            if (matcher.find()) {
                ObjectNode matched = parseObject(matcher.group());
                if (matched != null) {
                    return matched;
                }
            }
        }
        return defaultValue;
    }

    public ObjectNode extract(String responseText) {
        return extract(responseText, List.of(), null);
    }

    String stripCodeFence(String text) {
        if (!text.contains(FENCE)) {
            return text.strip();
        }
        List<String> inner = new ArrayList<>();
        boolean inBlock = false;
        for (String line : text.split("\n", -1)) {
            if (line.strip().startsWith(FENCE)) {
                if (inBlock) {
                    break;
                }
                inBlock = true;
                continue;
            }
            if (inBlock) {
                inner.add(line);
            }
        }
        if (inner.isEmpty()) {
            return text.strip();
        }
        return String.join("\n", inner).strip();
    }

    private ObjectNode parseObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node instanceof ObjectNode objectNode ? objectNode : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private Pattern flatObjectPattern(List<String> requiredFields) {
        String fields = requiredFields.stream()
                .map(field -> Pattern.quote("\"" + field + "\""))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\{[^{}]*(" + fields + ")[^{}]*\\}");
    }
}
