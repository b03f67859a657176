package io.github.flameyossnowy.mongofilter.mongodb.result;

import com.mongodb.client.MongoIterable;
import io.github.flameyossnowy.mongofilter.api.json.ValueCodec;
import io.github.flameyossnowy.mongofilter.mongodb.codec.BsonValueBridge;
import org.bson.BsonDocument;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes documents returned by the driver into entities.
 */
public final class MongoResultMapper<E> {
    private final ValueCodec<E> codec;

    public MongoResultMapper(ValueCodec<E> codec) {
        this.codec = codec;
    }

    public E decode(@NotNull BsonDocument document) {
        return codec.decode(BsonValueBridge.toStructuredValue(document));
    }

    public Optional<E> decodeOptional(@Nullable BsonDocument document) {
        return document == null ? Optional.empty() : Optional.of(decode(document));
    }

    public List<E> decodeAll(@NotNull MongoIterable<BsonDocument> iterable) {
        List<BsonDocument> documents = iterable.into(new ArrayList<>());
        List<E> out = new ArrayList<>(documents.size());
        for (BsonDocument document : documents) {
            out.add(decode(document));
        }
        return out;
    }
}
