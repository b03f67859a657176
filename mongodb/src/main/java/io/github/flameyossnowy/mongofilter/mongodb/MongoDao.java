package io.github.flameyossnowy.mongofilter.mongodb;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndReplaceOptions;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import io.github.flameyossnowy.mongofilter.api.exceptions.DocumentNotFoundException;
import io.github.flameyossnowy.mongofilter.api.json.EntityProtocol;
import io.github.flameyossnowy.mongofilter.api.utils.Logging;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.mongodb.codec.BsonValueBridge;
import io.github.flameyossnowy.mongofilter.mongodb.filter.FilterDocument;
import io.github.flameyossnowy.mongofilter.mongodb.result.MongoResultMapper;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters.eq;
import static io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters.expanded;
import static io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters.in;
import static io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters.or;

/**
 * Generic data access object over one collection.
 *
 * <p>Entities and identifiers are converted through the {@link EntityProtocol}. Filters are any
 * {@link Bson}, typically built with {@link io.github.flameyossnowy.mongofilter.mongodb.filter.MongoFilters}.
 * An {@code offset} or {@code limit} of {@code 0} means no skip or no limit.</p>
 *
 * <pre>{@code
 * MongoDao<String, Item> items = MongoDao.builder(EntityProtocol.jackson(String.class, Item.class))
 *     .withClient(client)
 *     .setDatabase("shop")
 *     .setCollection("items")
 *     .build();
 *
 * List<Item> cheap = items.findBy(or(gte("price", 10), lt("qty", 5)));
 * }</pre>
 *
 * @param <ID> identifier type
 * @param <E> entity type
 */
public class MongoDao<ID, E> implements AutoCloseable {
    private final @Nullable MongoClient ownedClient;
    private final MongoCollection<BsonDocument> collection;
    private final EntityProtocol<ID, E> protocol;
    private final MongoResultMapper<E> mapper;

    private final String primaryKey;
    private final boolean skipNull;
    private final Bson defaultSortBy;

    protected MongoDao(
        @Nullable MongoClient ownedClient,
        @NotNull MongoCollection<BsonDocument> collection,
        @NotNull EntityProtocol<ID, E> protocol,
        @NotNull String primaryKey,
        boolean skipNull,
        @NotNull Bson defaultSortBy
    ) {
        this.ownedClient = ownedClient;
        this.collection = collection;
        this.protocol = protocol;
        this.mapper = new MongoResultMapper<>(protocol.entityCodec());
        this.primaryKey = primaryKey;
        this.skipNull = skipNull;
        this.defaultSortBy = defaultSortBy;
    }

    public static <ID, E> @NotNull MongoDaoBuilder<ID, E> builder(@NotNull EntityProtocol<ID, E> protocol) {
        return new MongoDaoBuilder<>(protocol);
    }

    public static <ID, E> @NotNull MongoDaoBuilder<ID, E> builder(@NotNull Class<ID> idType, @NotNull Class<E> entityType) {
        return new MongoDaoBuilder<>(EntityProtocol.jackson(idType, entityType));
    }

    // ==================== Insert ====================

    public boolean insert(@NotNull E entity) {
        BsonDocument document = toDocument(entity);
        Logging.deepInfo(() -> "DAO.insertOne: " + document.toJson());
        InsertOneResult result = collection.insertOne(document);
        return result.wasAcknowledged();
    }

    /**
     * Inserts all entities in one batch. An empty list is a no-op.
     */
    public boolean insert(@NotNull List<E> entities) {
        if (entities.isEmpty()) return true;

        List<BsonDocument> documents = new ArrayList<>(entities.size());
        for (E entity : entities) {
            documents.add(toDocument(entity));
        }
        Logging.deepInfo(() -> "DAO.insertMany: " + documents.size() + " documents");
        InsertManyResult result = collection.insertMany(documents);
        return result.wasAcknowledged();
    }

    // ==================== Find ====================

    protected FindIterable<BsonDocument> internalFindBy(@NotNull Bson filter, int offset, int limit, @NotNull Bson sortBy) {
        Logging.deepInfo(() -> "DAO.internalFindBy: " + filter);
        return collection.find(filter).skip(offset).limit(limit).sort(sortBy);
    }

    public Optional<E> findOneBy(@NotNull Bson filter) {
        return findOneBy(filter, 0, defaultSortBy);
    }

    public Optional<E> findOneBy(@NotNull Bson filter, int offset, @NotNull Bson sortBy) {
        return mapper.decodeOptional(internalFindBy(filter, offset, 1, sortBy).first());
    }

    public List<E> findBy(@NotNull Bson filter) {
        return findBy(filter, 0, 0, defaultSortBy);
    }

    public List<E> findBy(@NotNull Bson filter, int offset, int limit, @NotNull Bson sortBy) {
        return mapper.decodeAll(internalFindBy(filter, offset, limit, sortBy));
    }

    public List<E> findAll() {
        return findAll(0, 0, defaultSortBy);
    }

    public List<E> findAll(int offset, int limit, @NotNull Bson sortBy) {
        return findBy(FilterDocument.empty(), offset, limit, sortBy);
    }

    /**
     * @throws DocumentNotFoundException if no document has this id
     */
    public E getById(@NotNull ID id) {
        FilterDocument filter = idFilter(id);
        Logging.deepInfo(() -> "DAO.getById [" + primaryKey + "] : " + filter);
        BsonDocument document = internalFindBy(filter, 0, 1, defaultSortBy).first();
        if (document == null) {
            throw new DocumentNotFoundException("No document in " + collection.getNamespace() + " matches " + filter, filter);
        }
        return mapper.decode(document);
    }

    public Optional<E> findById(@NotNull ID id) {
        FilterDocument filter = idFilter(id);
        Logging.deepInfo(() -> "DAO.findById [" + primaryKey + "] : " + filter);
        return mapper.decodeOptional(internalFindBy(filter, 0, 1, defaultSortBy).first());
    }

    public List<E> findByIdsIn(@NotNull Collection<ID> ids) {
        return findByIdsIn(ids, 0, 0, defaultSortBy);
    }

    /**
     * Finds with {@code {primaryKey: {"$in": [ids]}}}. Object ids are compared as whole embedded
     * documents, so their field order matters; use {@link #findByIdsOr} for those.
     */
    public List<E> findByIdsIn(@NotNull Collection<ID> ids, int offset, int limit, @NotNull Bson sortBy) {
        if (ids.isEmpty()) return List.of();
        if (ids.size() == 1) return findById(ids.iterator().next()).stream().toList();

        List<StructuredValue> encoded = new ArrayList<>(ids.size());
        for (ID id : ids) {
            encoded.add(protocol.idCodec().encode(id));
        }
        return findBy(in(primaryKey, encoded), offset, limit, sortBy);
    }

    public List<E> findByIdsOr(@NotNull Collection<ID> ids) {
        return findByIdsOr(ids, 0, 0, defaultSortBy);
    }

    /**
     * Finds with {@code {"$or": [expanded id, ...]}}; each id is flattened to dotted paths below the
     * primary key.
     */
    public List<E> findByIdsOr(@NotNull Collection<ID> ids, int offset, int limit, @NotNull Bson sortBy) {
        if (ids.isEmpty()) return List.of();
        if (ids.size() == 1) return findById(ids.iterator().next()).stream().toList();

        List<FilterDocument> alternatives = new ArrayList<>(ids.size());
        for (ID id : ids) {
            alternatives.add(expanded(primaryKey, protocol.idCodec().encode(id)));
        }
        return findBy(or(alternatives), offset, limit, sortBy);
    }

    // ==================== Update ====================

    /**
     * @return the document as it was before the update
     */
    protected Optional<E> internalUpdateBy(@NotNull Bson filter, @NotNull Bson update, boolean upsert) {
        Logging.deepInfo(() -> "DAO.internalUpdateBy [" + primaryKey + "] : " + filter);
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions().upsert(upsert);
        return mapper.decodeOptional(collection.findOneAndUpdate(filter, update, options));
    }

    public Optional<E> updateById(@NotNull ID id, @NotNull Bson update) {
        return updateById(id, update, false);
    }

    public Optional<E> updateById(@NotNull ID id, @NotNull Bson update, boolean upsert) {
        return internalUpdateBy(idFilter(id), update, upsert);
    }

    public Optional<E> updateBy(@NotNull Bson filter, @NotNull Bson update) {
        return updateBy(filter, update, false);
    }

    public Optional<E> updateBy(@NotNull Bson filter, @NotNull Bson update, boolean upsert) {
        return internalUpdateBy(filter, update, upsert);
    }

    // ==================== Replace ====================

    /**
     * @return the document as it was before the replacement
     */
    protected Optional<E> internalReplaceBy(@NotNull Bson filter, @NotNull BsonDocument replacement, boolean upsert) {
        Logging.deepInfo(() -> "DAO.internalReplaceBy : " + filter);
        FindOneAndReplaceOptions options = new FindOneAndReplaceOptions().upsert(upsert);
        return mapper.decodeOptional(collection.findOneAndReplace(filter, replacement, options));
    }

    public Optional<E> replaceById(@NotNull ID id, @NotNull E entity) {
        return replaceById(id, entity, false);
    }

    public Optional<E> replaceById(@NotNull ID id, @NotNull E entity, boolean upsert) {
        return internalReplaceBy(idFilter(id), toDocument(entity), upsert);
    }

    public Optional<E> createOrReplaceById(@NotNull ID id, @NotNull E entity) {
        return replaceById(id, entity, true);
    }

    /**
     * Replaces the document with this id, or inserts the entity when there is none. Not atomic: the
     * server refuses an upsert on a dotted id filter, which structured ids produce.
     *
     * @return the replaced document, or empty if the entity was inserted
     */
    public Optional<E> replaceOrInsertById(@NotNull ID id, @NotNull E entity) {
        Optional<E> before = replaceById(id, entity, false);
        if (before.isPresent()) return before;

        insert(entity);
        return Optional.empty();
    }

    public Optional<E> replaceBy(@NotNull Bson filter, @NotNull E entity) {
        return replaceBy(filter, entity, false);
    }

    public Optional<E> replaceBy(@NotNull Bson filter, @NotNull E entity, boolean upsert) {
        return internalReplaceBy(filter, toDocument(entity), upsert);
    }

    public Optional<E> createOrReplaceBy(@NotNull Bson filter, @NotNull E entity) {
        return replaceBy(filter, entity, true);
    }

    // ==================== Delete ====================

    /**
     * @return the deleted entity
     */
    public Optional<E> deleteById(@NotNull ID id) {
        FilterDocument filter = idFilter(id);
        Logging.deepInfo(() -> "DAO.deleteById [" + primaryKey + "] : " + filter);
        return mapper.decodeOptional(collection.findOneAndDelete(filter));
    }

    /**
     * @return the number of deleted documents
     */
    public long deleteByIds(@NotNull Collection<ID> ids) {
        if (ids.isEmpty()) return 0L;

        List<StructuredValue> encoded = new ArrayList<>(ids.size());
        for (ID id : ids) {
            encoded.add(protocol.idCodec().encode(id));
        }
        FilterDocument filter = in(primaryKey, encoded);
        Logging.deepInfo(() -> "DAO.deleteByIds [" + primaryKey + "] : " + filter);
        DeleteResult result = collection.deleteMany(filter);
        return result.getDeletedCount();
    }

    // ==================== Other ====================

    public <T> List<T> distinct(@NotNull String fieldName, @NotNull Bson filter, @NotNull Class<T> resultType) {
        return collection.distinct(fieldName, filter, resultType).into(new ArrayList<>());
    }

    public List<BsonDocument> aggregate(@NotNull List<? extends Bson> pipeline) {
        return collection.aggregate(pipeline).into(new ArrayList<>());
    }

    protected FilterDocument idFilter(@NotNull ID id) {
        return eq(primaryKey, protocol.idCodec().encode(id));
    }

    protected BsonDocument toDocument(@NotNull E entity) {
        ObjectValue encoded = BsonValueBridge.requireObject(protocol.entityCodec().encode(entity));
        return BsonValueBridge.toBsonDocument(skipNull ? encoded.withoutNullFields() : encoded);
    }

    public @NotNull String getPrimaryKey() {
        return primaryKey;
    }

    public @NotNull MongoCollection<BsonDocument> getCollection() {
        return collection;
    }

    /**
     * Closes the client if this DAO created it; a client or collection supplied to the builder is
     * left open.
     */
    @Override
    public void close() {
        if (ownedClient != null) ownedClient.close();
    }
}
