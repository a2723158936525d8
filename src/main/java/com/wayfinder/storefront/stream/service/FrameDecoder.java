package com.wayfinder.storefront.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wayfinder.storefront.stream.model.UpstreamFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental decoder for the agent builder event stream.
 * <p>
 * Network chunks may end anywhere, including inside a multi-byte UTF-8 character, so bytes are buffered
 * and only split on {@code '\n'}, which never occurs inside an encoded character. Complete lines are
 * decoded as they appear; the trailing partial line waits for the next chunk. One instance per stream.
 * <p>
 * Decoding is best effort: a {@code data:} line that is not a JSON object is skipped.
 */
public final class FrameDecoder {

    private static final Logger log = LoggerFactory.getLogger(FrameDecoder.class);

    private static final byte LINE_FEED = '\n';
    private static final String EVENT_PREFIX = "event:";
    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper objectMapper;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private String currentEventType = "";

    public FrameDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public List<UpstreamFrame> feed(byte[] chunk) {
        List<UpstreamFrame> frames = new ArrayList<>();
        if (chunk == null || chunk.length == 0) {
            return frames;
        }
        int lineStart = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] != LINE_FEED) {
                continue;
            }
            pending.write(chunk, lineStart, i - lineStart);
            decodeLine(drainPending(), frames);
            lineStart = i + 1;
        }
        if (lineStart < chunk.length) {
            pending.write(chunk, lineStart, chunk.length - lineStart);
        }
        return frames;
    }

    /**
     * Decodes whatever is left once the stream ends without a final line terminator.
     */
    public List<UpstreamFrame> finish() {
        List<UpstreamFrame> frames = new ArrayList<>();
        if (pending.size() > 0) {
            decodeLine(drainPending(), frames);
        }
        return frames;
    }

    String currentEventType() {
        return currentEventType;
    }

    private String drainPending() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        return line;
    }

    private void decodeLine(String rawLine, List<UpstreamFrame> frames) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            return;
        }
        if (line.startsWith(EVENT_PREFIX)) {
            currentEventType = line.substring(EVENT_PREFIX.length()).strip();
            return;
        }
        if (!line.startsWith(DATA_PREFIX)) {
            return;
        }
        String payload = line.substring(DATA_PREFIX.length()).strip();
        if (payload.isEmpty()) {
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            log.debug("Skipping malformed data line for event '{}': {}", currentEventType, ex.getOriginalMessage());
            return;
        }
        if (node instanceof ObjectNode objectNode) {
            frames.add(new UpstreamFrame(currentEventType, objectNode));
        }
    }
}
