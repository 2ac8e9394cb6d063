package com.phillippitts.feedercontrol.service.remote;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link RemoteStore} used when no remote URL is configured and in tests.
 *
 * <p>Values are deep-copied on the way in and out so callers never share mutable state with
 * the store.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private final Map<String, Object> root = new LinkedHashMap<>();
    private final AtomicLong pushSequence = new AtomicLong();

    @Override
    public synchronized Optional<Object> get(String path) {
        Object node = root;
        for (String segment : segments(path)) {
            if (!(node instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            node = map.get(segment);
            if (node == null) {
                return Optional.empty();
            }
        }
        return Optional.of(deepCopy(node));
    }

    @Override
    public synchronized void set(String path, Object value) {
        List<String> segments = segments(path);
        if (segments.isEmpty()) {
            root.clear();
            if (value instanceof Map<?, ?> map) {
                map.forEach((k, v) -> root.put(String.valueOf(k), deepCopy(v)));
            }
            return;
        }
        Map<String, Object> parent = parentOf(segments, value != null);
        if (parent == null) {
            return;
        }
        String leaf = segments.get(segments.size() - 1);
        if (value == null) {
            parent.remove(leaf);
        } else {
            parent.put(leaf, deepCopy(value));
        }
    }

    @Override
    public synchronized String push(String path, Map<String, Object> value) {
        String key = String.format("-%011x%05d", System.currentTimeMillis(), pushSequence.incrementAndGet() % 100_000);
        String childPath = segments(path).isEmpty() ? key : String.join("/", segments(path)) + "/" + key;
        set(childPath, value);
        return key;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parentOf(List<String> segments, boolean create) {
        Map<String, Object> node = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            Object child = node.get(segments.get(i));
            if (!(child instanceof Map)) {
                if (!create) {
                    return null;
                }
                child = new LinkedHashMap<String, Object>();
                node.put(segments.get(i), child);
            }
            node = (Map<String, Object>) child;
        }
        return node;
    }

    private static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        if (path == null) {
            return result;
        }
        for (String s : path.split("/")) {
            if (!s.isBlank()) {
                result.add(s);
            }
        }
        return result;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        return value;
    }
}
