package io.xaio.testing;

import io.xaio.adapter.IntakeItem;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.TransientStageException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryIntakeSource implements IntakeSource {
    private final Map<String, String> urls = new LinkedHashMap<>();
    private final Map<String, String> statuses = new LinkedHashMap<>();
    private final Map<String, Integer> failingWrites = new LinkedHashMap<>();
    private final List<String> writes = new ArrayList<>();

    public synchronized void add(String externalId, String url) {
        urls.put(externalId, url);
        statuses.put(externalId, "");
    }

    /**
     * The next {@code times} writes of {@code status} fail as if the sheet were unreachable.
     */
    public synchronized void failWrites(String status, int times) {
        failingWrites.put(status, times);
    }

    public synchronized void remove(String externalId) {
        urls.remove(externalId);
        statuses.remove(externalId);
    }

    /**
     * Every attempted write, successful or not, as {@code externalId=status}.
     */
    public synchronized List<String> writes() {
        return List.copyOf(writes);
    }

    public synchronized String status(String externalId) {
        return statuses.get(externalId);
    }

    @Override
    public synchronized List<IntakeItem> listNewItems() {
        List<IntakeItem> out = new ArrayList<>();
        for (Map.Entry<String, String> e : urls.entrySet()) {
            if (statuses.get(e.getKey()).isEmpty()) {
                out.add(new IntakeItem(e.getKey(), e.getValue()));
            }
        }
        return out;
    }

    @Override
    public synchronized void markStatus(String externalId, String status) throws TransientStageException {
        writes.add(externalId + "=" + status);
        int failing = failingWrites.getOrDefault(status, 0);
        if (failing > 0) {
            failingWrites.put(status, failing - 1);
            throw new TransientStageException("sheet write timed out");
        }
        if (!urls.containsKey(externalId)) {
            throw new IllegalArgumentException("unknown row " + externalId);
        }
        statuses.put(externalId, status);
    }
}
