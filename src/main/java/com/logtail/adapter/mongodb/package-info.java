/**
 * MongoDB log store for logtail.
 *
 * <p>syslog-ng's {@code mongodb()} destination appends each message to a
 * collection, by default {@code syslog.messages}. Tailing requires that
 * collection to be capped. Key classes:
 *
 * <ul>
 *   <li>{@link com.logtail.adapter.mongodb.MongoLogStoreDriver} - creates clients and checks reachability</li>
 *   <li>{@link com.logtail.adapter.mongodb.MongoLogStoreConnection} - metadata, tailing cursor and snapshot queries</li>
 *   <li>{@link com.logtail.adapter.mongodb.CommandMonitor} - CommandListener for command counts and failures</li>
 * </ul>
 *
 * <h2>Tailing</h2>
 *
 * <p>The cursor is {@code TailableAwait} with {@code noCursorTimeout}, sorted
 * by {@code $natural} so records arrive in insertion order, and starts after
 * the newest {@code _id} present at open time. Each read is a {@code getMore}
 * that blocks on the server for at most {@code tailAwaitMillis}; an empty read
 * is not an error. When the server drops the cursor because the collection is
 * empty, the query is reissued after the last seen {@code _id}.
 */
package com.logtail.adapter.mongodb;
