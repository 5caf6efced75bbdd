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

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;

import redis.clients.jedis.Connection;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;

/**
 * {@link RedisConnector} backed by a single Jedis {@link Connection}.
 * Jedis does the RESP encoding and decoding; this class only maps its results and exceptions onto
 * {@link RedisReply} and the {@link RedisCacheException} hierarchy:
 * <ul>
 * <li>{@link JedisDataException} (an {@code -ERR} reply) becomes a {@link ReplyType#ERROR} reply, the connection stays usable</li>
 * <li>any other {@link JedisException} while connecting becomes a {@link RedisConnectionException}</li>
 * <li>any other {@link JedisException} during a command becomes a {@link RedisTransportException}</li>
 * </ul>
 *
 * <p>No socket timeout, password or TLS is configured beyond the Jedis defaults.</p>
 */
public class JedisRedisConnector implements RedisConnector {

    static final Logger logger = LoggerFactory.getLogger(JedisRedisConnector.class);

    @Override
    public RedisConnection connect(final String host, final int port) {
        final Connection connection = new Connection(host, port);

        try {
            connection.connect();
        } catch (final JedisException e) {
            closeQuietly(connection);

            throw new RedisConnectionException("Failed to connect to " + host + ":" + port, e);
        }

        return new JedisRedisConnection(connection);
    }

    static void closeQuietly(final Connection connection) {
        try {
            connection.close();
        } catch (final JedisException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }
    }

    static final class JedisRedisConnection implements RedisConnection {

        private final Connection connection;

        JedisRedisConnection(final Connection connection) {
            this.connection = connection;
        }

        @Override
        public RedisReply execute(final RedisCommand command) {
            final Object raw;

            try {
                connection.sendCommand(command.keyword(), command.args());
                raw = connection.getOne();
            } catch (final JedisDataException e) {
                return RedisReply.error(e.getMessage());
            } catch (final JedisException e) {
                throw new RedisTransportException(command.name() + " failed", e);
            }

            return RedisReply.of(raw);
        }

        @Override
        public void close() {
            closeQuietly(connection);
        }
    }
}
