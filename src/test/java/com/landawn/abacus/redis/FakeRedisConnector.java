/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.redis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.util.Charsets;

import lombok.Getter;
import lombok.Setter;

/**
 * In-memory stand-in for a Redis server. The store survives reconnections, like a real server
 * would, and failures can be injected per connection or per reply.
 */
final class FakeRedisConnector implements RedisConnector {

    private final Map<String, byte[]> store = new HashMap<>();

    private final Deque<RedisReply> scriptedReplies = new ArrayDeque<>();

    private final List<FakeConnection> connections = new ArrayList<>();

    @Setter
    private volatile boolean reachable = true;

    @Getter
    private int connectAttempts;

    @Getter
    private int executedCommands;

    @Override
    public synchronized RedisConnection connect(final String host, final int port) {
        connectAttempts++;

        if (!reachable) {
            throw new RedisConnectionException("Connection refused: " + host + ":" + port);
        }

        final FakeConnection connection = new FakeConnection();
        connections.add(connection);

        return connection;
    }

    /**
     * Makes every open connection fail on its next command, as if the socket had been reset.
     */
    synchronized void breakConnections() {
        for (final FakeConnection connection : connections) {
            connection.broken = true;
        }
    }

    /**
     * The next command is answered with {@code reply} instead of its normal result.
     */
    synchronized void scriptReply(final RedisReply reply) {
        scriptedReplies.add(reply);
    }

    synchronized int openConnections() {
        int count = 0;

        for (final FakeConnection connection : connections) {
            if (!connection.closed) {
                count++;
            }
        }

        return count;
    }

    synchronized byte[] stored(final String key) {
        return store.get(key);
    }

    private synchronized RedisReply apply(final RedisCommand command) {
        executedCommands++;

        if (!scriptedReplies.isEmpty()) {
            return scriptedReplies.poll();
        }

        switch (command.name()) {
            case "GET": {
                final byte[] value = store.get(key(command));
                return value == null ? RedisReply.nil() : RedisReply.string(value);
            }

            case "SET":
                store.put(key(command), command.arg(1));
                return RedisReply.string("OK");

            case "DEL":
                return RedisReply.integer(store.remove(key(command)) == null ? 0 : 1);

            case "FLUSHALL":
                store.clear();
                return RedisReply.string("OK");

            default:
                return RedisReply.error("ERR unknown command '" + command.name() + "'");
        }
    }

    private static String key(final RedisCommand command) {
        return new String(command.arg(0), Charsets.UTF_8);
    }

    final class FakeConnection implements RedisConnection {

        private volatile boolean broken;

        private volatile boolean closed;

        @Override
        public RedisReply execute(final RedisCommand command) {
            if (closed) {
                throw new IllegalStateException("Command sent on a closed connection");
            }

            if (broken) {
                throw new RedisTransportException(command.name() + " failed: connection reset");
            }

            return apply(command);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
