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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.landawn.abacus.util.Charsets;

/**
 * The result of executing one {@link RedisCommand}.
 * A reply only lives for the duration of the command that produced it and is never stored.
 *
 * @param type the shape of the reply
 * @param value {@code byte[]} for {@link ReplyType#STRING}, {@code Long} for {@link ReplyType#INTEGER},
 *        {@code List} for {@link ReplyType#ARRAY}, the message {@code String} for {@link ReplyType#ERROR},
 *        and {@code null} for {@link ReplyType#NIL}
 */
public record RedisReply(ReplyType type, Object value) {

    private static final RedisReply NIL = new RedisReply(ReplyType.NIL, null);

    public RedisReply {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * Creates a {@link ReplyType#STRING} reply. The array is kept as it is, not copied.
     *
     * @param bytes the payload
     * @return the reply
     */
    public static RedisReply string(final byte[] bytes) {
        return new RedisReply(ReplyType.STRING, bytes);
    }

    /**
     * Creates a {@link ReplyType#STRING} reply with the UTF-8 encoding of {@code str}.
     *
     * @param str the payload
     * @return the reply
     */
    public static RedisReply string(final String str) {
        return string(str.getBytes(Charsets.UTF_8));
    }

    /**
     * Creates a {@link ReplyType#INTEGER} reply.
     *
     * @param value the integer payload
     * @return the reply
     */
    public static RedisReply integer(final long value) {
        return new RedisReply(ReplyType.INTEGER, value);
    }

    /**
     * Creates a {@link ReplyType#ARRAY} reply holding an unmodifiable copy of {@code elements}.
     * Elements may be {@code null} for nil entries.
     *
     * @param elements the decoded elements
     * @return the reply
     */
    public static RedisReply array(final List<?> elements) {
        return new RedisReply(ReplyType.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /**
     * Returns the shared {@link ReplyType#NIL} reply.
     *
     * @return the nil reply
     */
    public static RedisReply nil() {
        return NIL;
    }

    /**
     * Creates a {@link ReplyType#ERROR} reply for an error reported by the server.
     *
     * @param message the server's error message
     * @return the reply
     */
    public static RedisReply error(final String message) {
        return new RedisReply(ReplyType.ERROR, message);
    }

    /**
     * Maps a decoded reply object, as returned by {@code redis.clients.jedis.Connection#getOne()},
     * to a {@code RedisReply}.
     *
     * @param raw the decoded reply
     * @return the typed reply
     * @throws RedisProtocolException if {@code raw} is of a type no Redis reply decodes to
     */
    public static RedisReply of(final Object raw) {
        if (raw == null) {
            return NIL;
        } else if (raw instanceof byte[]) {
            return string((byte[]) raw);
        } else if (raw instanceof Long) {
            return integer((Long) raw);
        } else if (raw instanceof List) {
            return array((List<?>) raw);
        }

        throw new RedisProtocolException("Unrecognized reply of type " + raw.getClass().getName());
    }

    public byte[] bytes() {
        return type == ReplyType.STRING ? (byte[]) value : null;
    }

    /**
     * Returns the payload of a {@link ReplyType#STRING} reply decoded as UTF-8, or {@code null} for
     * any other type.
     *
     * @return the payload as a string
     */
    public String asString() {
        final byte[] bytes = bytes();

        return bytes == null ? null : new String(bytes, Charsets.UTF_8);
    }

    public long asLong() {
        if (type != ReplyType.INTEGER) {
            throw new IllegalStateException("Not an integer reply: " + type);
        }

        return (Long) value;
    }

    public String errorMessage() {
        return type == ReplyType.ERROR ? (String) value : null;
    }

    /**
     * Compares type and payload. {@code byte[]} payloads are compared by content.
     */
    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (!(obj instanceof RedisReply)) {
            return false;
        }

        final RedisReply other = (RedisReply) obj;

        return type == other.type && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return "STRING(" + asString() + ")";
            case ARRAY:
                return "ARRAY(" + ((List<?>) value).size() + ")";
            case NIL:
                return "NIL";
            default:
                return type + "(" + value + ")";
        }
    }
}
