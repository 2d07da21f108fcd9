package com.livedesk.support.common.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The request contradicts the current state of a conversation or ticket.
 * The message is the error code returned to the caller; {@link #details()} names the conflicting state.
 */
public class ConflictException extends RuntimeException {

    private final Map<String, Object> details;

    public ConflictException(String code) {
        this(code, Map.of());
    }

    public ConflictException(String code, Map<String, Object> details) {
        super(code);
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> details() {
        return details;
    }
}
