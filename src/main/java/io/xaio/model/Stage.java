package io.xaio.model;

import java.util.Optional;

public enum Stage {
    CAPTURE("capture"),
    REDUCE("reduce"),
    META("meta"),
    CLAIMS("claims"),
    MERGE("merge"),
    PUBLISH("publish");

    private final String wireName;

    Stage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The stage whose DONE artifact this stage consumes. Capture has none: it consumes the work item's
     * canonical key.
     */
    public Optional<Stage> upstream() {
        if (ordinal() == 0) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() - 1]);
    }

    public Optional<Stage> downstream() {
        Stage[] all = values();
        if (ordinal() + 1 >= all.length) {
            return Optional.empty();
        }
        return Optional.of(all[ordinal() + 1]);
    }

    public static Stage fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("stage must not be blank");
        }
        String v = raw.trim();
        for (Stage value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireName.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + raw);
    }
}
