package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed filter value: an equality term, a set of accepted terms, or a range.
 *
 * <p>On the wire a filter is whatever JSON the caller sent: an array becomes {@link Kind#TERMS},
 * an object carrying any of {@code gte gt lte lt from to} becomes {@link Kind#RANGE}, anything
 * else is a {@link Kind#TERM}.
 */
public final class SearchFilter {
    private static final List<String> RANGE_KEYS = List.of("gte", "gt", "lte", "lt", "from", "to");

    public enum Kind {
        TERM,
        TERMS,
        RANGE
    }

    private final Kind kind;
    private final Object value;
    private final List<Object> values;
    private final Map<String, Object> bounds;

    private SearchFilter(Kind kind, Object value, List<Object> values, Map<String, Object> bounds) {
        this.kind = kind;
        this.value = value;
        this.values = values;
        this.bounds = bounds;
    }

    public static SearchFilter term(Object value) {
        return new SearchFilter(Kind.TERM, Objects.requireNonNull(value, "value"), List.of(), Map.of());
    }

    public static SearchFilter terms(Collection<?> values) {
        return new SearchFilter(Kind.TERMS, null, List.copyOf(values), Map.of());
    }

    public static SearchFilter range(Object gte, Object lte) {
        Map<String, Object> bounds = new LinkedHashMap<>();
        if (gte != null) {
            bounds.put("gte", gte);
        }
        if (lte != null) {
            bounds.put("lte", lte);
        }
        return new SearchFilter(Kind.RANGE, null, List.of(), Collections.unmodifiableMap(bounds));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SearchFilter fromJson(Object raw) {
        if (raw instanceof SearchFilter filter) {
            return filter;
        }
        if (raw instanceof Collection<?> collection) {
            return terms(new ArrayList<>(collection));
        }
        if (raw instanceof Map<?, ?> map && isRangeShaped(map)) {
            Map<String, Object> bounds = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (entry.getValue() == null || !RANGE_KEYS.contains(key)) {
                    continue;
                }
                if ("from".equals(key)) {
                    bounds.put("gte", entry.getValue());
                } else if ("to".equals(key)) {
                    bounds.put("lte", entry.getValue());
                } else {
                    bounds.put(key, entry.getValue());
                }
            }
            return new SearchFilter(Kind.RANGE, null, List.of(), Collections.unmodifiableMap(bounds));
        }
        if (raw == null) {
            throw new IllegalArgumentException("filter value must not be null");
        }
        return term(raw);
    }

    private static boolean isRangeShaped(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (RANGE_KEYS.contains(String.valueOf(key))) {
                return true;
            }
        }
        return false;
    }

    @JsonValue
    public Object toJson() {
        return switch (kind) {
            case TERMS -> values;
            case RANGE -> bounds;
            case TERM -> value;
        };
    }

    public boolean matchesKey(String key) {
        if (key == null) {
            return false;
        }
        return switch (kind) {
            case TERM -> key.equals(String.valueOf(value));
            case TERMS -> values.stream().anyMatch(candidate -> key.equals(String.valueOf(candidate)));
            case RANGE -> false;
        };
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public List<Object> getValues() {
        return values;
    }

    public Map<String, Object> getBounds() {
        return bounds;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SearchFilter that)) {
            return false;
        }
        return kind == that.kind
            && Objects.equals(value, that.value)
            && Objects.equals(values, that.values)
            && Objects.equals(bounds, that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, values, bounds);
    }

    @Override
    public String toString() {
        return kind + "(" + toJson() + ")";
    }
}
