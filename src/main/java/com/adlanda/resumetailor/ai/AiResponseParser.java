package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns raw backend text into a schema-checked payload.
 *
 * Runs {@link JsonExtractor}, decodes with Jackson, then lets the payload
 * validate itself. Every failure is a {@link MalformedAiResponseException}.
 */
public class AiResponseParser {

    private static final Logger log = LoggerFactory.getLogger(AiResponseParser.class);

    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T extends AiPayloads.Payload> T parse(String operation, String raw, Class<T> type) {
        List<String> candidates = JsonExtractor.candidates(raw);

        JsonProcessingException lastError = null;
        for (String candidate : candidates) {
            T payload;
            try {
                payload = objectMapper.readValue(candidate, type);
            } catch (JsonProcessingException e) {
                lastError = e;
                continue;
            }
            if (payload == null) {
                continue;
            }
            payload.validate();
            return payload;
        }

        log.debug("{}: unparseable response: {}", operation, truncate(raw, 500));
        throw new MalformedAiResponseException(
                operation + ": response could not be decoded as " + type.getSimpleName(), lastError);
    }

    private static String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
