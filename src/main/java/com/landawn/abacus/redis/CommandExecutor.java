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

/**
 * Runs one command on the active connection.
 * The caller must hold the cache guard and must already have a connection from
 * {@link ConnectionManager#ensureConnected()}. Nothing is retried here.
 */
final class CommandExecutor {

    private final Logger logger;

    CommandExecutor(final Logger logger) {
        this.logger = logger;
    }

    /**
     *
     * @param connection the active connection
     * @param command the command to run
     * @return the reply, or {@code null} if the connection failed or the reply could not be read;
     *         the caller is expected to discard the connection in that case
     */
    RedisReply execute(final RedisConnection connection, final RedisCommand command) {
        try {
            return connection.execute(command);
        } catch (final RuntimeException e) {
            logger.warn(e, "Redis {} failed on an established connection", command.name());

            return null;
        }
    }
}
