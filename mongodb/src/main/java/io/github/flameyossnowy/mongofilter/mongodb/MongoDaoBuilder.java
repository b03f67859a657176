package io.github.flameyossnowy.mongofilter.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import io.github.flameyossnowy.mongofilter.api.json.EntityProtocol;
import io.github.flameyossnowy.mongofilter.api.utils.Logging;
import io.github.flameyossnowy.mongofilter.mongodb.filter.FilterDocument;
import org.bson.BsonDocument;
import org.bson.UuidRepresentation;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

@SuppressWarnings("unused")
public class MongoDaoBuilder<ID, E> {
    public static final String DEFAULT_PRIMARY_KEY = "_id";

    private final EntityProtocol<ID, E> protocol;

    private MongoClient client;
    private MongoClientSettings.Builder clientSettings = MongoClientSettings.builder();
    private MongoCollection<BsonDocument> collection;
    private String database;
    private String collectionName;

    private String primaryKey = DEFAULT_PRIMARY_KEY;
    private boolean skipNull = true;
    private Bson defaultSortBy = FilterDocument.empty();

    public MongoDaoBuilder(@NotNull EntityProtocol<ID, E> protocol) {
        this.protocol = Objects.requireNonNull(protocol, "Protocol cannot be null");
    }

    /**
     * Uses an existing client. The built DAO does not close it.
     */
    public MongoDaoBuilder<ID, E> withClient(@NotNull MongoClient client) {
        this.client = client;
        return this;
    }

    /**
     * Settings for the client the DAO creates when no client or collection is supplied. A UUID
     * representation set here is kept; otherwise {@link UuidRepresentation#STANDARD} is used.
     */
    public MongoDaoBuilder<ID, E> withClientSettings(@NotNull MongoClientSettings.Builder clientSettings) {
        this.clientSettings = clientSettings;
        return this;
    }

    public MongoDaoBuilder<ID, E> withConnectionString(@NotNull String connectionString) {
        this.clientSettings.applyConnectionString(new ConnectionString(connectionString));
        return this;
    }

    /**
     * Uses an existing collection; database, collection name and client settings are ignored.
     */
    public MongoDaoBuilder<ID, E> withCollection(@NotNull MongoCollection<BsonDocument> collection) {
        this.collection = collection;
        return this;
    }

    public MongoDaoBuilder<ID, E> setDatabase(@NotNull String database) {
        this.database = database;
        return this;
    }

    public MongoDaoBuilder<ID, E> setCollection(@NotNull String collectionName) {
        this.collectionName = collectionName;
        return this;
    }

    public MongoDaoBuilder<ID, E> primaryKey(@NotNull String primaryKey) {
        this.primaryKey = primaryKey;
        return this;
    }

    public MongoDaoBuilder<ID, E> skipNull(boolean skipNull) {
        this.skipNull = skipNull;
        return this;
    }

    public MongoDaoBuilder<ID, E> defaultSort(@NotNull Bson defaultSortBy) {
        this.defaultSortBy = defaultSortBy;
        return this;
    }

    /**
     * The settings a client created by {@link #build()} would use.
     */
    public @NotNull MongoClientSettings clientSettings() {
        MongoClientSettings settings = clientSettings.build();
        if (settings.getUuidRepresentation() != UuidRepresentation.UNSPECIFIED) return settings;
        return MongoClientSettings.builder(settings).uuidRepresentation(UuidRepresentation.STANDARD).build();
    }

    public MongoDao<ID, E> build() {
        if (primaryKey == null || primaryKey.isEmpty()) throw new IllegalArgumentException("Primary key cannot be empty");
        if (defaultSortBy == null) throw new IllegalArgumentException("Default sort cannot be null");

        if (collection != null) {
            return new MongoDao<>(null, collection, protocol, primaryKey, skipNull, defaultSortBy);
        }

        if (database == null || database.isEmpty()) throw new IllegalArgumentException("Database cannot be null");
        if (collectionName == null || collectionName.isEmpty()) throw new IllegalArgumentException("Collection cannot be null");

        MongoClient owned = null;
        MongoClient mongoClient = client;
        if (mongoClient == null) {
            owned = MongoClients.create(clientSettings());
            mongoClient = owned;
        }

        Logging.info(() -> "Opening DAO on " + database + "." + collectionName + " (primary key " + primaryKey + ")");
        MongoCollection<BsonDocument> target = mongoClient.getDatabase(database).getCollection(collectionName, BsonDocument.class);
        return new MongoDao<>(owned, target, protocol, primaryKey, skipNull, defaultSortBy);
    }
}
