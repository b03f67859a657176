package io.github.flameyossnowy.mongofilter.api.expansion;

import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens nested values into dotted-path query documents.
 *
 * <p>Keys starting with {@value #OPERATOR_PREFIX} are operator keys; every other key is a field
 * segment. Field segments are joined with {@code '.'} and the operator keys found on one level stay
 * together as a single operator object under that level's path.</p>
 *
 * <pre>{@code
 * expand("", {"a": {"b": {"c": 1}}})         -> {"a.b.c": 1}
 * expand("price", {"$gt": 1, "$lt": 5})       -> {"price": {"$gt": 1, "$lt": 5}}
 * expand("", {"$or": [...]})                  -> {"$or": [...]}
 * expandWithOperator("id", "$eq", {"a": 1})   -> {"id.a": {"$eq": 1}}
 * }</pre>
 *
 * <p>An empty object has no pairs and contributes nothing: {@code expand("a", {})} is {@code {}}.
 * Expansions of sibling fields are combined with {@link #merge(ObjectValue, ObjectValue)} semantics.</p>
 */
public final class PathExpansion {
    public static final String OPERATOR_PREFIX = "$";
    private static final char PATH_SEPARATOR = '.';

    private PathExpansion() {
        throw new AssertionError("No instances");
    }

    public static boolean isOperator(@NotNull String key) {
        return key.startsWith(OPERATOR_PREFIX);
    }

    /**
     * Expands {@code value} below {@code prefix}.
     *
     * @throws IllegalArgumentException if {@code prefix} is empty and {@code value} is not an object
     */
    public static @NotNull ObjectValue expand(@NotNull String prefix, @NotNull StructuredValue value) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(value, "value");
        if (prefix.isEmpty() && !value.isObject()) {
            throw new IllegalArgumentException("Only objects can be expanded without a path, got " + value);
        }
        return new ObjectValue(expandPaths(prefix, value));
    }

    private static Map<String, StructuredValue> expandPaths(String path, StructuredValue value) {
        Map<String, StructuredValue> out = new LinkedHashMap<>();
        if (!(value instanceof ObjectValue object)) {
            out.put(path, value);
            return out;
        }

        ObjectValue.Builder operators = null;
        for (Map.Entry<String, StructuredValue> entry : object.fields().entrySet()) {
            String key = entry.getKey();
            if (!isOperator(key)) {
                mergeInto(out, expandPaths(child(path, key), entry.getValue()));
            } else if (path.isEmpty()) {
                out.put(key, entry.getValue());
            } else {
                if (operators == null) operators = ObjectValue.builder();
                operators.put(key, entry.getValue());
            }
        }

        if (operators != null) {
            out.put(path, operators.build());
        }
        return out;
    }

    /**
     * Expands {@code value} below {@code field}, wrapping every leaf (and every operator object) in
     * {@code {operator: ...}}.
     *
     * @throws IllegalArgumentException if {@code field} or {@code operator} is empty
     */
    public static @NotNull ObjectValue expandWithOperator(@NotNull String field, @NotNull String operator, @NotNull StructuredValue value) {
        requireNonEmpty(field, "Field name");
        requireNonEmpty(operator, "Query operator");
        Objects.requireNonNull(value, "value");

        return new ObjectValue(expandOperatorPaths(field, operator, value));
    }

    private static Map<String, StructuredValue> expandOperatorPaths(String path, String operator, StructuredValue value) {
        Map<String, StructuredValue> out = new LinkedHashMap<>();
        if (!(value instanceof ObjectValue object)) {
            out.put(path, ObjectValue.of(operator, value));
            return out;
        }

        ObjectValue.Builder operators = null;
        for (Map.Entry<String, StructuredValue> entry : object.fields().entrySet()) {
            String key = entry.getKey();
            if (isOperator(key)) {
                if (operators == null) operators = ObjectValue.builder();
                operators.put(key, entry.getValue());
            } else {
                mergeInto(out, expandOperatorPaths(child(path, key), operator, entry.getValue()));
            }
        }

        if (operators != null) {
            out.put(path, ObjectValue.of(operator, operators.build()));
        }
        return out;
    }

    /**
     * Shallow union of two documents. A key present in both takes the value from {@code right}.
     */
    public static @NotNull ObjectValue merge(@NotNull ObjectValue left, @NotNull ObjectValue right) {
        if (right.isEmpty()) return left;
        if (left.isEmpty()) return right;

        Map<String, StructuredValue> merged = new LinkedHashMap<>(left.fields());
        mergeInto(merged, right.fields());
        return new ObjectValue(merged);
    }

    private static void mergeInto(Map<String, StructuredValue> target, Map<String, StructuredValue> source) {
        target.putAll(source);
    }

    public static void requireNonEmpty(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " should be non empty.");
        }
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + PATH_SEPARATOR + key;
    }
}
