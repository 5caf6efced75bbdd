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

import java.util.Set;

import com.landawn.abacus.logging.Logger;

/**
 * Checks that a reply has a shape the issuing command may legally produce.
 * A reply of an unexpected type means the client and the server no longer agree on the stream,
 * so the caller must drop the connection.
 */
final class ReplyValidator {

    enum Verdict {
        /** The reply has one of the expected types. */
        VALID,
        /** The server answered with a well-formed error reply. The connection is still in sync. */
        SERVER_ERROR,
        /** The reply has a type the command cannot produce. */
        UNEXPECTED
    }

    private final Logger logger;

    ReplyValidator(final Logger logger) {
        this.logger = logger;
    }

    Verdict validate(final RedisReply reply, final Set<ReplyType> validTypes, final String command) {
        if (reply.type() == ReplyType.ERROR) {
            logger.warn("Redis {}: server error: {}", command, reply.errorMessage());

            return Verdict.SERVER_ERROR;
        }

        if (validTypes.contains(reply.type())) {
            return Verdict.VALID;
        }

        logger.warn("Redis {}: unexpected reply type {}, expected one of {}", command, reply.type(), validTypes);

        return Verdict.UNEXPECTED;
    }

    /**
     * Validates a status reply, e.g. the {@code OK} returned by {@code SET}.
     */
    Verdict validateStatus(final RedisReply reply, final String expectedStatus, final String command) {
        if (reply.type() != ReplyType.STRING) {
            return validate(reply, Set.of(ReplyType.STRING), command);
        }

        if (expectedStatus.equals(reply.asString())) {
            return Verdict.VALID;
        }

        logger.warn("Redis {}: unexpected reply {}, expected {}", command, reply, expectedStatus);

        return Verdict.UNEXPECTED;
    }
}
