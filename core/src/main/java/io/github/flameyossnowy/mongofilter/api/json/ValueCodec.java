package io.github.flameyossnowy.mongofilter.api.json;

import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;

/**
 * Converts one Java type to and from its {@link StructuredValue} form.
 *
 * @param <T> the converted type
 */
public interface ValueCodec<T> {

    StructuredValue encode(T value);

    /**
     * @throws io.github.flameyossnowy.mongofilter.api.exceptions.json.JsonProcessException if the value
     *         does not describe a {@code T}
     */
    T decode(StructuredValue value);
}
