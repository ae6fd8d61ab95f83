package io.xaio.adapter;

import io.xaio.model.Stage;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class AdapterRegistry {
    private final Map<Stage, StageAdapter> adapters = Collections.synchronizedMap(new EnumMap<>(Stage.class));

    public AdapterRegistry register(StageAdapter adapter) {
        adapters.put(adapter.stage(), adapter);
        return this;
    }

    public Optional<StageAdapter> find(Stage stage) {
        return Optional.ofNullable(adapters.get(stage));
    }

    public StageAdapter require(Stage stage) {
        return find(stage).orElseThrow(
                () -> new IllegalArgumentException("No adapter registered for stage " + stage.wireName()
                        + "; configure commands." + stage.wireName()));
    }

    public Collection<Stage> stages() {
        return adapters.keySet();
    }
}
