package io.github.flameyossnowy.mongofilter.api.value;

import io.github.flameyossnowy.mongofilter.api.json.JacksonValueBridge;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable tree of null, boolean, number, string, array and object values.
 *
 * <p>This is the intermediate form shared by encoded entities and filter documents. Values are
 * compared structurally; object equality ignores key order.</p>
 *
 * <pre>{@code
 * StructuredValue price = StructuredValue.of(10);
 * ObjectValue item = ObjectValue.builder()
 *     .put("name", "widget")
 *     .put("tags", List.of("a", "b"))
 *     .build();
 * }</pre>
 */
public sealed interface StructuredValue
    permits StructuredValue.NullValue, StructuredValue.BooleanValue, StructuredValue.NumberValue,
            StructuredValue.StringValue, StructuredValue.ArrayValue, StructuredValue.ObjectValue {

    /**
     * Converts a plain Java value.
     *
     * @throws IllegalArgumentException if the value has no structured form; entities must go
     *                                  through a {@link io.github.flameyossnowy.mongofilter.api.json.ValueCodec}
     */
    static @NotNull StructuredValue of(@Nullable Object value) {
        if (value == null) return NullValue.INSTANCE;
        if (value instanceof StructuredValue structured) return structured;
        if (value instanceof Boolean bool) return BooleanValue.of(bool);
        if (value instanceof Number number) return new NumberValue(number);
        if (value instanceof CharSequence || value instanceof Character) return new StringValue(value.toString());
        if (value instanceof Enum<?> constant) return new StringValue(constant.name());

        if (value instanceof Map<?, ?> map) {
            ObjectValue.Builder builder = ObjectValue.builder();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                builder.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return builder.build();
        }

        if (value instanceof Iterable<?> iterable) {
            List<StructuredValue> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(of(element));
            }
            return new ArrayValue(elements);
        }

        if (value instanceof Object[] array) {
            List<StructuredValue> elements = new ArrayList<>(array.length);
            for (Object element : array) {
                elements.add(of(element));
            }
            return new ArrayValue(elements);
        }

        throw new IllegalArgumentException("No structured representation for " + value.getClass().getName()
            + "; encode it with a ValueCodec first");
    }

    static @NotNull ArrayValue array(Object... values) {
        return (ArrayValue) of(values);
    }

    default boolean isObject() {
        return this instanceof ObjectValue;
    }

    enum NullValue implements StructuredValue {
        INSTANCE;

        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanValue(boolean value) implements StructuredValue {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Numbers keep the width of their BSON counterpart: {@code Integer}, {@code Long}, {@code Double}
     * or {@code BigDecimal}. Smaller and less common {@link Number} types are widened on construction.
     */
    record NumberValue(Number value) implements StructuredValue {
        public NumberValue {
            value = normalize(Objects.requireNonNull(value, "value"));
        }

        private static Number normalize(Number number) {
            if (number instanceof Integer || number instanceof Long
                || number instanceof Double || number instanceof BigDecimal) {
                return number;
            }
            if (number instanceof Byte || number instanceof Short) return number.intValue();
            if (number instanceof Float) return Double.valueOf(number.toString());
            if (number instanceof BigInteger big) return new BigDecimal(big);
            return new BigDecimal(number.toString());
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record StringValue(String value) implements StructuredValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return JacksonValueBridge.toJson(this);
        }
    }

    record ArrayValue(List<StructuredValue> values) implements StructuredValue, Iterable<StructuredValue> {
        public static final ArrayValue EMPTY = new ArrayValue(List.of());

        public ArrayValue {
            values = List.copyOf(values);
        }

        public int size() {
            return values.size();
        }

        public StructuredValue get(int index) {
            return values.get(index);
        }

        @Override
        public @NotNull Iterator<StructuredValue> iterator() {
            return values.iterator();
        }

        @Override
        public String toString() {
            return JacksonValueBridge.toJson(this);
        }
    }

    /**
     * Object with unique string keys. Iteration follows insertion order.
     */
    record ObjectValue(Map<String, StructuredValue> fields) implements StructuredValue {
        public static final ObjectValue EMPTY = new ObjectValue(Map.of());

        public ObjectValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
            for (Map.Entry<String, StructuredValue> entry : fields.entrySet()) {
                Objects.requireNonNull(entry.getKey(), "key");
                Objects.requireNonNull(entry.getValue(), "value of " + entry.getKey());
            }
        }

        @Contract(value = "_, _ -> new", pure = true)
        public static @NotNull ObjectValue of(String key, StructuredValue value) {
            return new ObjectValue(Map.of(key, value));
        }

        @Contract(value = "-> new", pure = true)
        public static @NotNull Builder builder() {
            return new Builder();
        }

        public @Nullable StructuredValue get(String key) {
            return fields.get(key);
        }

        public boolean containsKey(String key) {
            return fields.containsKey(key);
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public int size() {
            return fields.size();
        }

        /**
         * Copy without null-valued fields, applied to nested objects and to objects inside arrays.
         */
        public @NotNull ObjectValue withoutNullFields() {
            Builder builder = builder();
            for (Map.Entry<String, StructuredValue> entry : fields.entrySet()) {
                StructuredValue value = entry.getValue();
                if (value == NullValue.INSTANCE) continue;
                builder.put(entry.getKey(), stripNulls(value));
            }
            return builder.build();
        }

        private static StructuredValue stripNulls(StructuredValue value) {
            if (value instanceof ObjectValue object) return object.withoutNullFields();
            if (value instanceof ArrayValue array) {
                List<StructuredValue> out = new ArrayList<>(array.size());
                for (StructuredValue element : array) {
                    out.add(stripNulls(element));
                }
                return new ArrayValue(out);
            }
            return value;
        }

        @Override
        public String toString() {
            return JacksonValueBridge.toJson(this);
        }

        public static final class Builder {
            private final Map<String, StructuredValue> fields = new LinkedHashMap<>();

            private Builder() {}

            public Builder put(String key, @Nullable Object value) {
                fields.put(Objects.requireNonNull(key, "key"), StructuredValue.of(value));
                return this;
            }

            public Builder putAll(@NotNull ObjectValue other) {
                fields.putAll(other.fields());
                return this;
            }

            public ObjectValue build() {
                return new ObjectValue(fields);
            }
        }
    }
}
