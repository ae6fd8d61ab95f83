package io.xaio.model;

public enum ErrorKind {
    TRANSIENT,
    VALIDATION,
    STALE_INPUT;

    public static ErrorKind fromNullable(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase());
    }
}
