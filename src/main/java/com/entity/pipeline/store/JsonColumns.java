package com.entity.pipeline.store;

import com.entity.pipeline.core.model.EvidenceSummary;
import com.entity.pipeline.core.model.MentionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts typed value objects to and from the JSON text columns of the schema.
 * JSON is only used at this persistence edge.
 */
public final class JsonColumns {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<MentionContext>> CONTEXT_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {};

    private JsonColumns() {
    }

    public static String writeStrings(Collection<String> values) {
        return write(values);
    }

    public static List<String> readStrings(String json) {
        return json == null || json.isBlank() ? List.of() : read(json, STRING_LIST);
    }

    public static Set<String> readStringSet(String json) {
        return new LinkedHashSet<>(readStrings(json));
    }

    public static String writeContexts(List<MentionContext> contexts) {
        return write(contexts);
    }

    public static List<MentionContext> readContexts(String json) {
        return json == null || json.isBlank() ? List.of() : read(json, CONTEXT_LIST);
    }

    public static String writeEvidence(EvidenceSummary evidence) {
        return write(evidence);
    }

    public static EvidenceSummary readEvidence(String json) {
        if (json == null || json.isBlank() || "{}".equals(json.trim())) {
            return EvidenceSummary.empty();
        }
        try {
            return MAPPER.readValue(json, EvidenceSummary.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Malformed evidence column: " + e.getOriginalMessage(), e);
        }
    }

    public static String writeDetails(Map<String, Object> details) {
        return write(details);
    }

    public static Map<String, Object> readDetails(String json) {
        return json == null || json.isBlank() ? Map.of() : read(json, DETAILS);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Malformed JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
