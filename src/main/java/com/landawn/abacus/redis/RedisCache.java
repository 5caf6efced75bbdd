/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.redis;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.locks.Lock;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;

/**
 * A {@link CacheBackend} that stores entries in a single Redis server through one connection.
 *
 * <p>Every operation is synchronous and holds the guard passed to the constructor for its whole
 * duration, including any reconnection attempt. Callers on all threads are therefore serialized on
 * one connection and reach Redis in the order they acquire the guard. See {@link ConnectionManager}
 * for the reconnection strategy.</p>
 *
 * <p>No error is thrown to the caller for an unreachable or misbehaving server: {@code get} reports
 * {@link KeyState#FAILED}, {@code put} and {@link #flushAll()} return {@code false}. Error replies
 * from the server are governed by {@link RedisCacheConfig#failOnServerError()}.</p>
 *
 * <p>Connect and command timeouts are the Jedis socket defaults; authentication and TLS are not
 * supported.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RedisCache cache = new RedisCache(RedisCacheConfig.of("localhost", 6379), new ReentrantLock(),
 *         LoggerFactory.getLogger(RedisCache.class), Clock.systemUTC());
 * cache.startUp();
 *
 * cache.put("page:1", bytes);
 * cache.get("page:1", (state, value) -> {
 *     if (state == KeyState.AVAILABLE) {
 *         render(value);
 *     }
 * });
 *
 * cache.shutDown();
 * }</pre>
 *
 * @see RedisCacheFactory
 */
public class RedisCache implements CacheBackend, AutoCloseable {

    static final Logger logger = LoggerFactory.getLogger(RedisCache.class);

    private static final Set<ReplyType> GET_REPLY_TYPES = Collections.unmodifiableSet(EnumSet.of(ReplyType.STRING, ReplyType.NIL));

    private static final Set<ReplyType> DEL_REPLY_TYPES = Collections.unmodifiableSet(EnumSet.of(ReplyType.INTEGER));

    private static final String STATUS_OK = "OK";

    private final RedisCacheConfig config;

    private final Lock mutex;

    private final ConnectionManager connectionManager;

    private final CommandExecutor commandExecutor;

    private final ReplyValidator replyValidator;

    // guarded by mutex.
    private long getCount;

    private long hitCount;

    private long missCount;

    private long putCount;

    private long deleteCount;

    private long failedCount;

    /**
     * Creates a cache talking to Redis through Jedis.
     *
     * @param config the server address and reconnection settings
     * @param mutex the guard serializing all operations; the cache takes ownership of it
     * @param messageHandler the logger for diagnostics; not owned, must stay usable as long as this cache
     * @param clock the time source used to compute reconnection deadlines
     */
    public RedisCache(final RedisCacheConfig config, final Lock mutex, final Logger messageHandler, final Clock clock) {
        this(config, mutex, messageHandler, clock, new JedisRedisConnector());
    }

    /**
     *
     * @param config the server address and reconnection settings
     * @param mutex the guard serializing all operations; the cache takes ownership of it
     * @param messageHandler the logger for diagnostics; not owned, must stay usable as long as this cache
     * @param clock the time source used to compute reconnection deadlines
     * @param connector opens the connections to the server
     */
    public RedisCache(final RedisCacheConfig config, final Lock mutex, final Logger messageHandler, final Clock clock, final RedisConnector connector) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        if (mutex == null) {
            throw new IllegalArgumentException("mutex cannot be null");
        }

        if (messageHandler == null) {
            throw new IllegalArgumentException("messageHandler cannot be null");
        }

        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }

        this.config = config;
        this.mutex = mutex;
        this.connectionManager = new ConnectionManager(config, connector, clock, messageHandler);
        this.commandExecutor = new CommandExecutor(messageHandler);
        this.replyValidator = new ReplyValidator(messageHandler);
    }

    /**
     * Returns the name reported by every {@code RedisCache}, for use where no instance is at hand.
     *
     * @return {@code "RedisCache"}
     */
    public static String formatName() {
        return "RedisCache";
    }

    /**
     * Enables the cache. The connection is opened lazily by the first operation.
     * Calling this method on a started cache has no effect.
     */
    @Override
    public void startUp() {
        mutex.lock();

        try {
            connectionManager.startUp();
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Looks up {@code key}. The callback is always invoked before this method returns, outside the
     * guard, with {@link KeyState#AVAILABLE} and the value, {@link KeyState#NOT_FOUND}, or
     * {@link KeyState#FAILED} if the server could not be reached or answered incorrectly.
     */
    @Override
    public void get(final String key, final Callback callback) {
        checkKey(key);

        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }

        KeyState state = KeyState.FAILED;
        byte[] value = null;

        mutex.lock();

        try {
            getCount++;

            final RedisReply reply = execute(RedisCommand.get(key), GET_REPLY_TYPES, null);

            if (reply == null) {
                failedCount++;
            } else if (reply.type() == ReplyType.STRING) {
                hitCount++;
                state = KeyState.AVAILABLE;
                value = reply.bytes();
            } else {
                missCount++;
                state = KeyState.NOT_FOUND;
            }
        } finally {
            mutex.unlock();
        }

        callback.done(state, value);
    }

    /**
     * Looks up {@code key}.
     *
     * @param key the key, must not be {@code null}
     * @return the value, or {@code null} if the key is not found or the lookup failed
     */
    public byte[] get(final String key) {
        final byte[][] holder = new byte[1][];

        get(key, (state, value) -> holder[0] = value);

        return holder[0];
    }

    /**
     * Stores {@code value} under {@code key} with {@code SET}. The array is sent as it is, without copying.
     *
     * @return {@code true} if Redis acknowledged the write
     */
    @Override
    public boolean put(final String key, final byte[] value) {
        checkKey(key);

        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        mutex.lock();

        try {
            putCount++;

            return succeeded(execute(RedisCommand.set(key, value), null, STATUS_OK));
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Removes {@code key} from Redis. A key that does not exist is not an error, and a failure is
     * only logged and counted.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * cache.put("user:42", bytes);
     * cache.delete("user:42");
     * cache.get("user:42");   // null
     * }</pre>
     *
     * @param key the key to remove, must not be {@code null}
     * @throws IllegalArgumentException if {@code key} is {@code null}
     */
    @Override
    public void delete(final String key) {
        checkKey(key);

        mutex.lock();

        try {
            deleteCount++;

            succeeded(execute(RedisCommand.del(key), DEL_REPLY_TYPES, null));
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Deletes ALL keys of ALL databases on the Redis server. Intended for tests.
     *
     * @return {@code true} if Redis acknowledged the flush
     */
    public boolean flushAll() {
        mutex.lock();

        try {
            return succeeded(execute(RedisCommand.flushAll(), null, STATUS_OK));
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public String name() {
        return formatName();
    }

    @Override
    public boolean isBlocking() {
        return true;
    }

    /**
     * Returns {@code true} if the cache is started and currently holds a connection.
     * No command is sent to the server.
     */
    @Override
    public boolean isHealthy() {
        mutex.lock();

        try {
            return connectionManager.isHealthy();
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Disables the cache and closes the connection. Subsequent operations fail without touching the
     * network until {@link #startUp()} is called again. Safe to call repeatedly and concurrently with
     * other operations.
     */
    @Override
    public void shutDown() {
        mutex.lock();

        try {
            connectionManager.shutDown();
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void close() {
        shutDown();
    }

    /**
     * Returns the settings this cache was created with.
     *
     * @return the config
     */
    public RedisCacheConfig config() {
        return config;
    }

    /**
     * Returns a snapshot of the operation and connection counters since construction.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * RedisCacheStats stats = cache.stats();
     * double hitRatio = stats.getCount() == 0 ? 0 : (double) stats.hitCount() / stats.getCount();
     * }</pre>
     *
     * @return the counters, never {@code null}
     */
    public RedisCacheStats stats() {
        mutex.lock();

        try {
            return new RedisCacheStats(getCount, hitCount, missCount, putCount, deleteCount, failedCount, connectionManager.connectAttempts(),
                    connectionManager.connectFailures(), connectionManager.discardedConnections());
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public String toString() {
        return name() + "{host=" + config.host() + ", port=" + config.port() + "}";
    }

    /**
     * Runs {@code command} and validates its reply. Must be called with the guard held.
     *
     * @param validTypes the reply types the command may produce, used if {@code expectedStatus} is {@code null}
     * @param expectedStatus the status line the command must answer with, or {@code null}
     * @return the reply, or {@code null} if the operation failed. An {@link ReplyType#ERROR} reply is
     *         returned when server errors are configured not to fail operations.
     */
    private RedisReply execute(final RedisCommand command, final Set<ReplyType> validTypes, final String expectedStatus) {
        if (!connectionManager.ensureConnected()) {
            return null;
        }

        final RedisReply reply = commandExecutor.execute(connectionManager.connection(), command);

        if (reply == null) {
            connectionManager.discardConnection();

            return null;
        }

        final ReplyValidator.Verdict verdict = expectedStatus == null ? replyValidator.validate(reply, validTypes, command.name())
                : replyValidator.validateStatus(reply, expectedStatus, command.name());

        switch (verdict) {
            case VALID:
                return reply;

            case SERVER_ERROR:
                return config.failOnServerError() ? null : reply;

            default:
                connectionManager.discardConnection();

                return null;
        }
    }

    private boolean succeeded(final RedisReply reply) {
        if (reply == null) {
            failedCount++;

            return false;
        }

        return true;
    }

    private static void checkKey(final String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
