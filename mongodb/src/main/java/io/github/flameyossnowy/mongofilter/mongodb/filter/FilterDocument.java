package io.github.flameyossnowy.mongofilter.mongodb.filter;

import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.mongodb.codec.BsonValueBridge;
import org.bson.BsonDocument;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An immutable filter document. Implements {@link Bson}, so it can be handed to any
 * {@code MongoCollection} method that takes a filter, update or sort.
 */
public record FilterDocument(@NotNull ObjectValue document) implements Bson {
    private static final FilterDocument EMPTY = new FilterDocument(ObjectValue.EMPTY);

    public FilterDocument {
        Objects.requireNonNull(document, "document");
    }

    /**
     * The filter that matches every document.
     */
    public static @NotNull FilterDocument empty() {
        return EMPTY;
    }

    /**
     * @throws io.github.flameyossnowy.mongofilter.api.exceptions.ShapeMismatchException if
     *         {@code value} is not an object
     */
    @Contract("_ -> new")
    public static @NotNull FilterDocument of(@NotNull StructuredValue value) {
        return new FilterDocument(BsonValueBridge.requireObject(value));
    }

    /**
     * Converts a filter built by the driver (or any other {@link Bson}).
     */
    public static @NotNull FilterDocument from(@NotNull Bson bson) {
        if (bson instanceof FilterDocument filter) return filter;
        return new FilterDocument(BsonValueBridge.toObjectValue(bson));
    }

    public boolean isEmpty() {
        return document.isEmpty();
    }

    @Override
    public <TDocument> BsonDocument toBsonDocument(Class<TDocument> documentClass, CodecRegistry codecRegistry) {
        return toBsonDocument();
    }

    @Override
    public BsonDocument toBsonDocument() {
        return BsonValueBridge.toBsonDocument(document);
    }

    @Override
    public String toString() {
        return document.toString();
    }
}
