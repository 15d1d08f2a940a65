package com.boardrag.pipeline.task;

import com.boardrag.pipeline.exception.TaskExecutionException;

import java.util.Map;
import java.util.UUID;

/**
 * Payload keys shared by producers and handlers.
 */
public final class TaskPayloads {

    public static final String STAGING_PATH = "staging_path";
    public static final String STORAGE_KEY = "storage_key";
    public static final String DOCUMENT_ID = "document_id";
    public static final String FILE_ID = "file_id";
    public static final String FULL_VECTORIZE = "full_vectorize";
    public static final String REQUESTED_BY = "requested_by";

    private TaskPayloads() {
    }

    public static String requireString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null || value.toString().isBlank()) {
            throw TaskExecutionException.fatal("Task payload is missing " + key);
        }
        return value.toString();
    }

    public static UUID requireUuid(Map<String, Object> payload, String key) {
        return parseUuid(requireString(payload, key), key);
    }

    public static UUID optionalUuid(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : parseUuid(value.toString(), key);
    }

    public static boolean flag(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof Boolean bool ? bool : Boolean.parseBoolean(String.valueOf(value));
    }

    private static UUID parseUuid(String value, String key) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw TaskExecutionException.fatal("Task payload has malformed " + key + ": " + value, e);
        }
    }
}
