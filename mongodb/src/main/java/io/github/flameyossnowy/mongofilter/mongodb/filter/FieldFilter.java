package io.github.flameyossnowy.mongofilter.mongodb.filter;

import io.github.flameyossnowy.mongofilter.api.expansion.PathExpansion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Field-scoped view over {@link MongoFilters}.
 *
 * <pre>{@code
 * field("qty").gte(20)
 * field("tags").all("ssl", "security")
 * field("price").not(p -> p.gt(1.99))
 * }</pre>
 */
@SuppressWarnings("unused")
public final class FieldFilter {
    private final String field;

    FieldFilter(String field) {
        PathExpansion.requireNonEmpty(field, "Field name");
        this.field = field;
    }

    public String name() {
        return field;
    }

    // ==================== Comparison ====================

    public FilterDocument eq(@Nullable Object value) { return MongoFilters.eq(field, value); }
    public FilterDocument ne(@Nullable Object value) { return MongoFilters.ne(field, value); }
    public FilterDocument gt(@Nullable Object value) { return MongoFilters.gt(field, value); }
    public FilterDocument gte(@Nullable Object value) { return MongoFilters.gte(field, value); }
    public FilterDocument lt(@Nullable Object value) { return MongoFilters.lt(field, value); }
    public FilterDocument lte(@Nullable Object value) { return MongoFilters.lte(field, value); }
    public FilterDocument operator(@NotNull String operator, @Nullable Object value) { return MongoFilters.operator(field, operator, value); }

    // ==================== Sets and elements ====================

    public FilterDocument in(Object... values) { return MongoFilters.in(field, values); }
    public FilterDocument in(@NotNull Iterable<?> values) { return MongoFilters.in(field, values); }
    public FilterDocument nin(Object... values) { return MongoFilters.nin(field, values); }
    public FilterDocument nin(@NotNull Iterable<?> values) { return MongoFilters.nin(field, values); }
    public FilterDocument exists(boolean exists) { return MongoFilters.exists(field, exists); }

    // ==================== Evaluation ====================

    public FilterDocument regex(@NotNull String pattern) { return MongoFilters.regex(field, pattern); }
    public FilterDocument regex(@NotNull String pattern, @NotNull String options) { return MongoFilters.regex(field, pattern, options); }
    public FilterDocument regex(@NotNull Pattern pattern) { return MongoFilters.regex(field, pattern); }

    // ==================== Arrays ====================

    public FilterDocument all(Object... values) { return MongoFilters.all(field, values); }
    public FilterDocument all(@NotNull Iterable<?> values) { return MongoFilters.all(field, values); }
    public FilterDocument elemMatch(@NotNull Object filter) { return MongoFilters.elemMatch(field, filter); }
    public FilterDocument size(int size) { return MongoFilters.size(field, size); }

    // ==================== Logical ====================

    /**
     * {@code field("price").not(p -> p.gt(1.99))}
     */
    public FilterDocument not(@NotNull Function<FieldFilter, FilterDocument> filter) {
        return MongoFilters.not(field, name -> filter.apply(new FieldFilter(name)));
    }
}
