package com.wayfinder.storefront.stream.model;

public enum ChatEventType {
    VISION_ANALYZING("vision_analyzing"),
    VISION_ANALYSIS("vision_analysis"),
    VISION_ERROR("vision_error"),
    CONVERSATION_STARTED("conversation_started"),
    REASONING("reasoning"),
    TOOL_CALL("tool_call"),
    TOOL_RESULT("tool_result"),
    MESSAGE_CHUNK("message_chunk"),
    MESSAGE_COMPLETE("message_complete"),
    COMPLETION("completion"),
    ERROR("error");

    private final String value;

    ChatEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
