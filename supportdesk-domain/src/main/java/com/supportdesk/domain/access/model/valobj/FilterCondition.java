package com.supportdesk.domain.access.model.valobj;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 单字段匹配条件：match any（与集合有交集）或 match value（等值）。
 */
public final class FilterCondition {

    private final String key;
    private final List<String> anyValues;
    private final String value;

    private FilterCondition(String key, List<String> anyValues, String value) {
        this.key = Objects.requireNonNull(key, "key");
        this.anyValues = anyValues;
        this.value = value;
    }

    public static FilterCondition matchAny(String key, Collection<String> values) {
        return new FilterCondition(key, values == null ? List.of() : List.copyOf(values), null);
    }

    public static FilterCondition matchValue(String key, String value) {
        return new FilterCondition(key, null, Objects.requireNonNull(value, "value"));
    }

    public String getKey() {
        return key;
    }

    public List<String> getAnyValues() {
        return anyValues;
    }

    public String getValue() {
        return value;
    }

    public boolean isMatchAny() {
        return anyValues != null;
    }

    /**
     * 对文档字段值求值。match any 在空集合上恒为 false。
     */
    public boolean test(Collection<String> fieldValues) {
        if (fieldValues == null || fieldValues.isEmpty()) {
            return false;
        }
        if (isMatchAny()) {
            for (String candidate : anyValues) {
                if (fieldValues.contains(candidate)) {
                    return true;
                }
            }
            return false;
        }
        return fieldValues.contains(value);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> match = new LinkedHashMap<>();
        if (isMatchAny()) {
            match.put("any", anyValues);
        } else {
            match.put("value", value);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("match", match);
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterCondition)) {
            return false;
        }
        FilterCondition that = (FilterCondition) o;
        return key.equals(that.key) && Objects.equals(anyValues, that.anyValues) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, anyValues, value);
    }

    @Override
    public String toString() {
        return isMatchAny() ? key + " in " + anyValues : key + " = " + value;
    }
}
