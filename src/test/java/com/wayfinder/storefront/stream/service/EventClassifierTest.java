package com.wayfinder.storefront.stream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.storefront.stream.model.UpstreamEvent;
import com.wayfinder.storefront.stream.model.UpstreamEventKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventClassifier classifier = new EventClassifier();

    @Test
    void shouldUnwrapDataEnvelope() throws Exception {
        UpstreamEvent event = classify("{\"data\":{\"conversation_id\":\"abc\"}}").orElseThrow();

        assertThat(event).isEqualTo(new UpstreamEvent.ConversationStarted("abc"));
        assertThat(event.kind()).isEqualTo(UpstreamEventKind.CONVERSATION_ID);
    }

    @Test
    void shouldReadUnwrappedPayload() throws Exception {
        assertThat(classify("{\"text_chunk\":\"hi\"}")).contains(new UpstreamEvent.TextChunk("hi"));
    }

    @Test
    void errorShouldWinOverEveryOtherField() throws Exception {
        UpstreamEvent event = classify(
                "{\"error\":{\"message\":\"agent missing\",\"code\":\"not_found\"},\"data\":{\"text_chunk\":\"x\"}}"
        ).orElseThrow();

        assertThat(event).isInstanceOf(UpstreamEvent.UpstreamError.class);
        UpstreamEvent.UpstreamError error = (UpstreamEvent.UpstreamError) event;
        assertThat(error.message()).isEqualTo("agent missing");
        assertThat(error.code().asText()).isEqualTo("not_found");
    }

    @Test
    void errorFieldInsideEnvelopeShouldNotMarkFrameAsFailed() throws Exception {
        UpstreamEvent event = classify(
                "{\"data\":{\"tool_call_id\":\"t1\",\"results\":[{\"id\":\"p1\"}],\"error\":null}}"
        ).orElseThrow();

        assertThat(event.kind()).isEqualTo(UpstreamEventKind.TOOL_RESULT);
        assertThat(classify("{\"data\":{\"error\":\"boom\",\"conversation_id\":\"c\"}}"))
                .contains(new UpstreamEvent.ConversationStarted("c"));
    }

    @Test
    void topLevelStringErrorShouldCarryNoCode() throws Exception {
        UpstreamEvent.UpstreamError error = (UpstreamEvent.UpstreamError) classify(
                "{\"error\":\"boom\",\"data\":{\"conversation_id\":\"c\"}}"
        ).orElseThrow();

        assertThat(error.message()).isEqualTo("boom");
        assertThat(error.code()).isNull();
    }

    @Test
    void errorObjectWithoutMessageShouldUseDefault() throws Exception {
        UpstreamEvent.UpstreamError error = (UpstreamEvent.UpstreamError) classify("{\"error\":{}}").orElseThrow();

        assertThat(error.message()).isEqualTo("Unknown error");
    }

    @Test
    void toolResultShouldWinOverToolCallWhenBothIdsPresent() throws Exception {
        UpstreamEvent event = classify(
                "{\"data\":{\"tool_call_id\":\"t1\",\"tool_id\":\"search\",\"results\":[{\"id\":1}]}}"
        ).orElseThrow();

        assertThat(event).isInstanceOf(UpstreamEvent.ToolResult.class);
        UpstreamEvent.ToolResult result = (UpstreamEvent.ToolResult) event;
        assertThat(result.toolCallId()).isEqualTo("t1");
        assertThat(result.results().get(0).get("id").asInt()).isEqualTo(1);
    }

    @Test
    void toolCallShouldCarryParams() throws Exception {
        UpstreamEvent.ToolCall call = (UpstreamEvent.ToolCall) classify(
                "{\"data\":{\"tool_call_id\":\"t1\",\"tool_id\":\"search\",\"params\":{\"q\":\"tent\"}}}"
        ).orElseThrow();

        assertThat(call.toolId()).isEqualTo("search");
        assertThat(call.params().get("q").asText()).isEqualTo("tent");
    }

    @Test
    void toolCallWithoutToolIdShouldBeDropped() throws Exception {
        assertThat(classify("{\"data\":{\"tool_call_id\":\"t1\",\"progress\":0.5}}")).isEmpty();
    }

    @Test
    void reasoningShouldCarryTransientFlag() throws Exception {
        UpstreamEvent.Reasoning reasoning = (UpstreamEvent.Reasoning) classify(
                "{\"data\":{\"reasoning\":\"Thinking...\",\"transient\":true}}"
        ).orElseThrow();

        assertThat(reasoning.text()).isEqualTo("Thinking...");
        assertThat(reasoning.transientFlag()).isTrue();
    }

    @Test
    void roundResponseMessageShouldBecomeCompleteMessage() throws Exception {
        assertThat(classify("{\"data\":{\"round\":{\"response\":{\"message\":\"final answer\"}}}}"))
                .contains(new UpstreamEvent.MessageComplete("final answer"));
        assertThat(classify("{\"data\":{\"round\":{\"steps\":[]}}}")).isEmpty();
    }

    @Test
    void messageContentShouldWinOverRound() throws Exception {
        assertThat(classify("{\"message_content\":\"a\",\"round\":{\"response\":{\"message\":\"b\"}}}"))
                .contains(new UpstreamEvent.MessageComplete("a"));
    }

    @Test
    void unknownPayloadShouldBeDropped() throws Exception {
        assertThat(classify("{\"data\":{\"heartbeat\":true}}")).isEmpty();
    }

    private Optional<UpstreamEvent> classify(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return classifier.classify(node);
    }
}
