package com.wayfinder.storefront.stream.model;

public enum UpstreamEventKind {
    CONVERSATION_ID,
    REASONING,
    TOOL_CALL,
    TOOL_RESULT,
    TEXT_CHUNK,
    MESSAGE_COMPLETE,
    UPSTREAM_ERROR
}
