package com.phillippitts.feedercontrol.service.remote;

import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;

import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical key-value store shared with the mobile app: settings, thresholds and system
 * status are read from it; sensor snapshots and alert state are written to it.
 *
 * <p>Paths are slash-separated without a leading slash (e.g. {@code app_setting/duration}).
 * Values are plain JSON-shaped Java objects: {@link Map}, {@link java.util.List}, {@link Number},
 * {@link String}, {@link Boolean}.
 *
 * <p>Every method throws {@link ConfigUnavailableException} when the store cannot be reached.
 */
public interface RemoteStore {

    /**
     * @param path node path
     * @return node value, empty when the node does not exist
     */
    Optional<Object> get(String path);

    /**
     * Replaces the node at {@code path}. A {@code null} value deletes the node.
     */
    void set(String path, Object value);

    /**
     * Appends a child with a generated, time-ordered key.
     *
     * @return the generated key
     */
    String push(String path, Map<String, Object> value);

    /**
     * Convenience read of a map-valued node; non-map values read as empty.
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> getMap(String path) {
        return get(path)
                .filter(Map.class::isInstance)
                .map(v -> (Map<String, Object>) v)
                .orElse(Map.of());
    }
}
