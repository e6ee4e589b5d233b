package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload for message kinds this service forwards without interpreting,
 * such as {@code 3d_scene_update}. Its entries are written flat into {@code data}.
 */
@ToString
public final class OpaquePayload implements DashboardPayload {

    private final String type;
    private final Map<String, Object> content;

    public OpaquePayload(String type, Map<String, Object> content) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Opaque payload requires a type tag");
        }
        this.type = type;
        this.content = content == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    @Override
    public String messageType() {
        return type;
    }

    @JsonAnyGetter
    public Map<String, Object> getContent() {
        return content;
    }
}
