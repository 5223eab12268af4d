package io.clgrader.core.util;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/// Merges environment-variable layers where later layers win.
///
/// Layers are applied global, section, group, then case.
public final class EnvironmentLayers {

    private EnvironmentLayers() {}

    /// Merges the given layers.
    ///
    /// @param layers maps in increasing precedence, null entries are skipped
    /// @return sorted, unmodifiable merged map, never null
    @SafeVarargs
    public static Map<String, String> merge(Map<String, String>... layers) {
        Map<String, String> merged = new TreeMap<>();
        for (Map<String, String> layer : layers) {
            if (layer != null) {
                merged.putAll(layer);
            }
        }
        return Collections.unmodifiableMap(merged);
    }
}
