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

import java.util.ArrayList;
import java.util.List;

import com.landawn.abacus.util.Charsets;

import redis.clients.jedis.Protocol;
import redis.clients.jedis.commands.ProtocolCommand;

/**
 * A Redis command: a keyword plus an ordered list of typed arguments.
 * Every argument is sent as a bulk string; strings are encoded with UTF-8 and integers as their
 * decimal representation.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RedisCommand set = RedisCommand.of(Protocol.Command.SET).arg("user:123").arg(valueBytes);
 * RedisCommand get = RedisCommand.get("user:123");
 * }</pre>
 *
 * <p>Instances are not thread-safe while being built. A command is built, executed once and
 * discarded.</p>
 */
public final class RedisCommand {

    private final ProtocolCommand keyword;

    private final String name;

    private final List<byte[]> args = new ArrayList<>();

    private RedisCommand(final ProtocolCommand keyword) {
        this.keyword = keyword;
        this.name = new String(keyword.getRaw(), Charsets.UTF_8);
    }

    public static RedisCommand of(final ProtocolCommand keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("keyword cannot be null");
        }

        return new RedisCommand(keyword);
    }

    public static RedisCommand get(final String key) {
        return of(Protocol.Command.GET).arg(key);
    }

    public static RedisCommand set(final String key, final byte[] value) {
        return of(Protocol.Command.SET).arg(key).arg(value);
    }

    public static RedisCommand del(final String key) {
        return of(Protocol.Command.DEL).arg(key);
    }

    public static RedisCommand flushAll() {
        return of(Protocol.Command.FLUSHALL);
    }

    public RedisCommand arg(final String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("arg cannot be null");
        }

        args.add(arg.getBytes(Charsets.UTF_8));

        return this;
    }

    public RedisCommand arg(final long arg) {
        return arg(String.valueOf(arg));
    }

    /**
     * Appends a binary argument. The array is not copied.
     *
     * @param arg the argument bytes
     * @return this command
     */
    public RedisCommand arg(final byte[] arg) {
        if (arg == null) {
            throw new IllegalArgumentException("arg cannot be null");
        }

        args.add(arg);

        return this;
    }

    public ProtocolCommand keyword() {
        return keyword;
    }

    /**
     * Returns the keyword as sent on the wire, e.g. {@code "GET"}. Used in log messages.
     *
     * @return the command name
     */
    public String name() {
        return name;
    }

    public byte[][] args() {
        return args.toArray(new byte[args.size()][]);
    }

    public int argCount() {
        return args.size();
    }

    public byte[] arg(final int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return name + " (" + args.size() + " args)";
    }
}
