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

/**
 * A live connection to a Redis server: the handle held by {@link ConnectionManager} while
 * communication is believed to be healthy.
 *
 * <p>Implementations are not required to be thread-safe. {@link RedisCache} only touches a
 * connection while its guard is held, so at most one command is in flight at a time.</p>
 */
public interface RedisConnection extends AutoCloseable {

    /**
     * Sends {@code command} and blocks until its reply arrives.
     * A well-formed error reply from the server is returned as a {@link ReplyType#ERROR} reply,
     * not thrown.
     *
     * @param command the command to send
     * @return the reply, never {@code null}
     * @throws RedisTransportException if the connection fails while sending or receiving
     * @throws RedisProtocolException if the reply cannot be interpreted
     */
    RedisReply execute(RedisCommand command);

    /**
     * Releases the connection. Never throws.
     */
    @Override
    void close();
}
