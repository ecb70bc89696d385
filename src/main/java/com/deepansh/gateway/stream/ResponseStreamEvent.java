package com.deepansh.gateway.stream;

import com.deepansh.gateway.model.JsonSupport;
import com.deepansh.gateway.model.ResponseObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One Responses-protocol event. The payload is the full JSON object sent on the
 * wire and always repeats the event type under {@code "type"}.
 */
public record ResponseStreamEvent(String type, Map<String, Object> payload) {

    public ResponseStreamEvent {
        Map<String, Object> copy = new LinkedHashMap<>();
        copy.put("type", type);
        if (payload != null) {
            payload.forEach((k, v) -> {
                if (!"type".equals(k)) {
                    copy.put(k, v);
                }
            });
        }
        payload = Collections.unmodifiableMap(copy);
    }

    /** The {@code delta} text of an output_text.delta event. */
    public Optional<String> textDelta() {
        Object delta = payload.get("delta");
        return delta instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /** The response object carried by lifecycle events, converted to its typed form. */
    public Optional<ResponseObject> response() {
        Object response = payload.get("response");
        if (response == null) {
            return Optional.empty();
        }
        if (response instanceof ResponseObject ro) {
            return Optional.of(ro);
        }
        return Optional.of(JsonSupport.mapper().convertValue(response, ResponseObject.class));
    }
}
