package com.shading.sgc.model;

import java.util.List;
import java.util.Map;

/**
 * Typed accessors over a node's property map.
 */
public final class NodeProperties {
    private NodeProperties() {
        // Utility class
    }

    public static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    public static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }

    @SuppressWarnings("unchecked")
    public static List<Double> getDoubles(Map<String, Object> props, String key, List<Double> def) {
        Object v = props.get(key);
        if (v instanceof List<?> list)
            return (List<Double>) list;
        return def;
    }
}
