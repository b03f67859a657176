package io.github.flameyossnowy.mongofilter.mongodb.filter;

import com.mongodb.client.model.Filters;
import io.github.flameyossnowy.mongofilter.api.expansion.PathExpansion;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ArrayValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.BooleanValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NumberValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.StringValue;
import io.github.flameyossnowy.mongofilter.mongodb.codec.BsonValueBridge;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Factory methods for MongoDB query filters.
 *
 * <pre>{@code
 * import static io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters.*;
 *
 * FilterDocument cheap = or(gte("price", 10), lt("qty", 5));
 * FilterDocument medium = elemMatch(and(eq("size", "M"), gt("num", 50)));
 * FilterDocument notExpensive = not("price", f -> gt(f, 1.99));
 * }</pre>
 *
 * <p>Values are converted with {@link BsonValueBridge#fromJava(Object)}, so {@code ObjectId}, {@code Date}
 * and {@code Instant} values are accepted; a {@link FilterDocument} value is used as its document. Comparison operators expand structured values into dotted paths, so
 * {@code eq("id", {"a": 1, "b": 2})} becomes {@code {"id.a": {"$eq": 1}, "id.b": {"$eq": 2}}}.</p>
 *
 * <p>Every method returns a new immutable document and fails with {@link IllegalArgumentException}
 * on an empty field name.</p>
 */
public final class MongoFilters {
    public static final String AND = "$and";
    public static final String OR = "$or";
    public static final String NOR = "$nor";
    public static final String EQ = "$eq";
    public static final String NE = "$ne";
    public static final String GT = "$gt";
    public static final String GTE = "$gte";
    public static final String LT = "$lt";
    public static final String LTE = "$lte";
    public static final String IN = "$in";
    public static final String NIN = "$nin";
    public static final String EXISTS = "$exists";
    public static final String REGEX = BsonValueBridge.REGEX_KEY;
    public static final String OPTIONS = BsonValueBridge.REGEX_OPTIONS_KEY;
    public static final String ALL = "$all";
    public static final String ELEM_MATCH = "$elemMatch";
    public static final String SIZE = "$size";

    private MongoFilters() {
        throw new AssertionError("No instances");
    }

    /**
     * Fluent form: {@code field("qty").gte(20)}.
     */
    @Contract("_ -> new")
    public static @NotNull FieldFilter field(@NotNull String name) {
        return new FieldFilter(name);
    }

    // ==================== Comparison ====================

    public static @NotNull FilterDocument eq(@NotNull String field, @Nullable Object value) {
        return operator(field, EQ, value);
    }

    public static @NotNull FilterDocument ne(@NotNull String field, @Nullable Object value) {
        return operator(field, NE, value);
    }

    public static @NotNull FilterDocument gt(@NotNull String field, @Nullable Object value) {
        return operator(field, GT, value);
    }

    public static @NotNull FilterDocument gte(@NotNull String field, @Nullable Object value) {
        return operator(field, GTE, value);
    }

    public static @NotNull FilterDocument lt(@NotNull String field, @Nullable Object value) {
        return operator(field, LT, value);
    }

    public static @NotNull FilterDocument lte(@NotNull String field, @Nullable Object value) {
        return operator(field, LTE, value);
    }

    /**
     * Applies any comparison-style operator, for instance {@code operator("qty", "$mod", List.of(4, 0))}.
     *
     * @throws IllegalArgumentException if {@code field} or {@code operator} is empty
     */
    public static @NotNull FilterDocument operator(@NotNull String field, @NotNull String operator, @Nullable Object value) {
        return new FilterDocument(PathExpansion.expandWithOperator(field, operator, valueOf(value)));
    }

    // ==================== Sets ====================

    public static @NotNull FilterDocument in(@NotNull String field, Object... values) {
        return arrayOperator(field, IN, Arrays.asList(values));
    }

    public static @NotNull FilterDocument in(@NotNull String field, @NotNull Iterable<?> values) {
        return arrayOperator(field, IN, values);
    }

    public static @NotNull FilterDocument nin(@NotNull String field, Object... values) {
        return arrayOperator(field, NIN, Arrays.asList(values));
    }

    public static @NotNull FilterDocument nin(@NotNull String field, @NotNull Iterable<?> values) {
        return arrayOperator(field, NIN, values);
    }

    // ==================== Element ====================

    /**
     * With {@code true}, matches documents that contain the field, including documents where it is
     * null. With {@code false}, only documents without the field.
     */
    public static @NotNull FilterDocument exists(@NotNull String field, boolean exists) {
        return fieldOperator(field, EXISTS, BooleanValue.of(exists));
    }

    // ==================== Evaluation ====================

    public static @NotNull FilterDocument regex(@NotNull String field, @NotNull String pattern) {
        return fieldOperator(field, REGEX, new StringValue(pattern));
    }

    public static @NotNull FilterDocument regex(@NotNull String field, @NotNull String pattern, @NotNull String options) {
        PathExpansion.requireNonEmpty(field, "Field name");
        ObjectValue condition = ObjectValue.builder()
            .put(REGEX, pattern)
            .put(OPTIONS, options)
            .build();
        return new FilterDocument(ObjectValue.of(field, condition));
    }

    /**
     * Pattern flags are translated by the driver, e.g. {@link Pattern#CASE_INSENSITIVE} becomes
     * {@code "$options": "i"}.
     */
    public static @NotNull FilterDocument regex(@NotNull String field, @NotNull Pattern pattern) {
        PathExpansion.requireNonEmpty(field, "Field name");
        return FilterDocument.from(Filters.regex(field, pattern));
    }

    // ==================== Arrays ====================

    public static @NotNull FilterDocument all(@NotNull String field, Object... values) {
        return arrayOperator(field, ALL, Arrays.asList(values));
    }

    public static @NotNull FilterDocument all(@NotNull String field, @NotNull Iterable<?> values) {
        return arrayOperator(field, ALL, values);
    }

    public static @NotNull FilterDocument elemMatch(@NotNull String field, @NotNull Object filter) {
        return fieldOperator(field, ELEM_MATCH, valueOf(filter));
    }

    /**
     * The field-less form, used as a value inside array operators:
     * {@code all("qty", elemMatch(and(eq("size", "M"), gt("num", 50))))}.
     */
    public static @NotNull FilterDocument elemMatch(@NotNull FilterDocument filter) {
        return new FilterDocument(ObjectValue.of(ELEM_MATCH, filter.document()));
    }

    public static @NotNull FilterDocument size(@NotNull String field, int size) {
        return fieldOperator(field, SIZE, new NumberValue(size));
    }

    // ==================== Logical ====================

    /**
     * Negates the operator expression built for {@code field}, e.g.
     * {@code not("price", f -> gt(f, 1.99))}. Rendering is left to the driver's {@code $not} support.
     */
    public static @NotNull FilterDocument not(@NotNull String field, @NotNull Function<String, FilterDocument> filter) {
        PathExpansion.requireNonEmpty(field, "Field name");
        FilterDocument negated = Objects.requireNonNull(filter.apply(field), "filter");
        return FilterDocument.from(Filters.not(negated));
    }

    public static @NotNull FilterDocument and(FilterDocument... filters) {
        return logical(AND, Arrays.asList(filters));
    }

    public static @NotNull FilterDocument and(@NotNull List<FilterDocument> filters) {
        return logical(AND, filters);
    }

    public static @NotNull FilterDocument or(FilterDocument... filters) {
        return logical(OR, Arrays.asList(filters));
    }

    public static @NotNull FilterDocument or(@NotNull List<FilterDocument> filters) {
        return logical(OR, filters);
    }

    public static @NotNull FilterDocument nor(FilterDocument... filters) {
        return logical(NOR, Arrays.asList(filters));
    }

    public static @NotNull FilterDocument nor(@NotNull List<FilterDocument> filters) {
        return logical(NOR, filters);
    }

    // ==================== Expansion ====================

    /**
     * Flattens an object into dotted paths: {@code {"a": {"b": 1}}} becomes {@code {"a.b": 1}}.
     *
     * @throws IllegalArgumentException if {@code value} is not an object
     */
    public static @NotNull FilterDocument expanded(@NotNull Object value) {
        return new FilterDocument(PathExpansion.expand("", valueOf(value)));
    }

    /**
     * Flattens {@code value} below {@code path}. A scalar becomes {@code {path: value}}.
     */
    public static @NotNull FilterDocument expanded(@NotNull String path, @Nullable Object value) {
        return new FilterDocument(PathExpansion.expand(path, valueOf(value)));
    }

    private static FilterDocument logical(String operator, List<FilterDocument> filters) {
        List<StructuredValue> documents = new ArrayList<>(filters.size());
        for (FilterDocument filter : filters) {
            documents.add(Objects.requireNonNull(filter, "filter").document());
        }
        return new FilterDocument(ObjectValue.of(operator, new ArrayValue(documents)));
    }

    private static FilterDocument arrayOperator(String field, String operator, Iterable<?> values) {
        List<StructuredValue> elements = new ArrayList<>();
        for (Object value : values) {
            elements.add(valueOf(value));
        }
        return fieldOperator(field, operator, new ArrayValue(elements));
    }

    private static FilterDocument fieldOperator(String field, String operator, StructuredValue value) {
        PathExpansion.requireNonEmpty(field, "Field name");
        return new FilterDocument(ObjectValue.of(field, ObjectValue.of(operator, value)));
    }

    static StructuredValue valueOf(@Nullable Object value) {
        if (value instanceof FilterDocument filter) return filter.document();
        return BsonValueBridge.fromJava(value);
    }
}
