package io.github.flameyossnowy.mongofilter.api.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The codecs a data access object uses for its identifiers and its entities.
 *
 * @param <ID> identifier type
 * @param <E> entity type
 */
public record EntityProtocol<ID, E>(ValueCodec<ID> idCodec, ValueCodec<E> entityCodec) {
    public EntityProtocol {
        Objects.requireNonNull(idCodec, "idCodec");
        Objects.requireNonNull(entityCodec, "entityCodec");
    }

    @Contract("_, _, _ -> new")
    public static <ID, E> @NotNull EntityProtocol<ID, E> jackson(ObjectMapper mapper, Class<ID> idType, Class<E> entityType) {
        return new EntityProtocol<>(new JacksonValueCodec<>(mapper, idType), new JacksonValueCodec<>(mapper, entityType));
    }

    @Contract("_, _ -> new")
    public static <ID, E> @NotNull EntityProtocol<ID, E> jackson(Class<ID> idType, Class<E> entityType) {
        return jackson(new ObjectMapper(), idType, entityType);
    }
}
