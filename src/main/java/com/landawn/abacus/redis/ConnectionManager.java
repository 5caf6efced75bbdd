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

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.util.ExceptionUtil;

/**
 * Owns the connection to Redis and decides when a new one may be opened.
 *
 * <p>Reconnection strategy:</p>
 * <ol>
 * <li>If a connection attempt fails, the next attempt is made by a later operation, but not before
 * {@code reconnectionDelay} milliseconds have passed.</li>
 * <li>If an operation fails on an established connection (transport or protocol error), the
 * connection is dropped and the very next operation reconnects without delay.</li>
 * </ol>
 *
 * <p>Not thread-safe. Every method must be called with the {@link RedisCache} guard held.</p>
 */
final class ConnectionManager {

    private final String host;

    private final int port;

    private final long reconnectionDelay;

    private final RedisConnector connector;

    private final Clock clock;

    private final Logger logger;

    private RedisConnection connection;

    // only meaningful while connection == null.
    private long nextReconnectAt;

    private boolean started;

    private long connectAttempts;

    private long connectFailures;

    private long discardedConnections;

    ConnectionManager(final RedisCacheConfig config, final RedisConnector connector, final Clock clock, final Logger logger) {
        this.host = config.host();
        this.port = config.port();
        this.reconnectionDelay = config.reconnectionDelay();
        this.connector = connector;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Enables the manager. No connection is opened until the first operation.
     */
    void startUp() {
        if (started) {
            return;
        }

        started = true;
        nextReconnectAt = 0;

        logger.info("Redis cache for {}:{} started", host, port);
    }

    /**
     * Makes sure a connection is available, opening one if the reconnection deadline has passed.
     *
     * @return {@code true} if {@link #connection()} may be used
     */
    boolean ensureConnected() {
        if (!started) {
            return false;
        }

        if (connection != null) {
            return true;
        }

        if (clock.millis() < nextReconnectAt) {
            if (logger.isDebugEnabled()) {
                logger.debug("Skipping reconnection to {}:{} until {}", host, port, nextReconnectAt);
            }

            return false;
        }

        connectAttempts++;

        try {
            connection = connector.connect(host, port);
        } catch (final RuntimeException e) {
            connectFailures++;

            final long now = clock.millis();
            // saturate instead of wrapping for very large delays.
            nextReconnectAt = reconnectionDelay > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + reconnectionDelay;

            logger.warn("Failed to connect to Redis at {}:{}, next attempt in {} ms: {}", host, port, reconnectionDelay, ExceptionUtil.getErrorMessage(e));

            return false;
        }

        logger.info("Connected to Redis at {}:{}", host, port);

        return true;
    }

    RedisConnection connection() {
        return connection;
    }

    /**
     * Drops the connection after a transport or protocol failure.
     * The reconnection deadline is left as it is, so the next operation may reconnect immediately.
     */
    void discardConnection() {
        if (connection == null) {
            return;
        }

        closeConnection();
        discardedConnections++;

        logger.warn("Dropped connection to Redis at {}:{}", host, port);
    }

    void shutDown() {
        if (!started && connection == null) {
            return;
        }

        started = false;
        closeConnection();

        logger.info("Redis cache for {}:{} shut down", host, port);
    }

    boolean isHealthy() {
        return started && connection != null;
    }

    boolean isStarted() {
        return started;
    }

    long connectAttempts() {
        return connectAttempts;
    }

    long connectFailures() {
        return connectFailures;
    }

    long discardedConnections() {
        return discardedConnections;
    }

    private void closeConnection() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
    }
}
