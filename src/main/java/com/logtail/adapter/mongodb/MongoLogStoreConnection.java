package com.logtail.adapter.mongodb;

import com.logtail.adapter.spi.CollectionOptions;
import com.logtail.adapter.spi.ConnectionException;
import com.logtail.adapter.spi.CursorException;
import com.logtail.adapter.spi.LogField;
import com.logtail.adapter.spi.LogRecord;
import com.logtail.adapter.spi.LogStoreConnection;
import com.logtail.adapter.spi.TailingCursor;
import com.mongodb.CursorType;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection to one MongoDB database holding syslog collections.
 */
public class MongoLogStoreConnection implements LogStoreConnection {

    private static final String ID_FIELD = "_id";
    private static final Bson NATURAL_ORDER = new Document("$natural", 1);
    private static final Bson REVERSE_NATURAL_ORDER = new Document("$natural", -1);

    private final MongoClient client;
    private final String databaseName;
    private final int tailAwaitMillis;
    private final AtomicBoolean closed;

    /**
     * Creates a connection over an established client.
     *
     * @param client          the MongoDB client, owned by this connection
     * @param databaseName    the database name
     * @param tailAwaitMillis how long a tailing getMore waits for new data
     */
    public MongoLogStoreConnection(MongoClient client, String databaseName, int tailAwaitMillis) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName must not be null");
        this.tailAwaitMillis = tailAwaitMillis;
        this.closed = new AtomicBoolean(false);
    }

    @Override
    public Optional<CollectionOptions> collectionOptions(String collectionName) {
        Document info;
        try {
            info = getDatabase().listCollections()
                    .filter(Filters.eq("name", collectionName))
                    .first();
        } catch (MongoException e) {
            throw new ConnectionException(databaseName,
                    "cannot read metadata of collection " + collectionName + ": " + e.getMessage(), e);
        }
        if (info == null) {
            return Optional.empty();
        }

        Document options = info.get("options", Document.class);
        if (options == null) {
            return Optional.of(CollectionOptions.uncapped());
        }
        return Optional.of(new CollectionOptions(
                Boolean.TRUE.equals(options.getBoolean("capped")),
                longValue(options.get("size")),
                longValue(options.get("max"))));
    }

    /**
     * Opens a cursor positioned after the newest document, so only records
     * appended from now on are returned.
     */
    @Override
    public TailingCursor openTailingCursor(String collectionName, List<LogField> fields) {
        MongoCollection<Document> coll = getDatabase().getCollection(collectionName);
        Bson projection = buildProjection(fields);
        try {
            Document newest = coll.find()
                    .sort(REVERSE_NATURAL_ORDER)
                    .projection(Projections.include(ID_FIELD))
                    .first();
            Object startAfterId = newest != null ? newest.get(ID_FIELD) : null;

            return new MongoTailingCursor(
                    afterId -> coll.find(afterId != null ? Filters.gt(ID_FIELD, afterId) : new Document())
                            .projection(projection)
                            .sort(NATURAL_ORDER)
                            .cursorType(CursorType.TailableAwait)
                            .noCursorTimeout(true)
                            .maxAwaitTime(tailAwaitMillis, TimeUnit.MILLISECONDS)
                            .cursor(),
                    collectionName,
                    startAfterId,
                    tailAwaitMillis);
        } catch (MongoException e) {
            throw new CursorException("cannot open tailing cursor on " + collectionName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<LogRecord> find(String collectionName, List<LogField> fields, LogField sortField, boolean descending) {
        String sortName = sortField.storeName();
        return getDatabase().getCollection(collectionName)
                .find()
                .projection(buildProjection(fields))
                .sort(descending ? Sorts.descending(sortName) : Sorts.ascending(sortName))
                .map(LogRecordMapper::toLogRecord)
                .into(new ArrayList<>());
    }

    @Override
    public boolean isValid() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.close();
        }
    }

    /**
     * Returns the MongoDB database for this connection.
     */
    public MongoDatabase getDatabase() {
        return client.getDatabase(databaseName);
    }

    private static Bson buildProjection(List<LogField> fields) {
        if (fields.isEmpty()) {
            return new Document();
        }
        return Projections.include(LogField.storeNames(fields));
    }

    private static long longValue(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
