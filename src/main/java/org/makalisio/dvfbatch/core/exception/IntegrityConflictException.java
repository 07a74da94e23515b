/*
 * Copyright 2026 Makalisio Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.makalisio.dvfbatch.core.exception;

import org.makalisio.dvfbatch.core.model.EntityType;

/**
 * Thrown when storage already holds a row the identity resolver believed unseen.
 *
 * <p>The in-memory business key mapping and the database have diverged. The chunk
 * is rolled back, the resolver is reloaded from storage and the ingestion step
 * retries the chunk a bounded number of times before escalating.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class IntegrityConflictException extends RuntimeException {

    private final EntityType entityType;

    /**
     * @param entityType the entity whose write conflicted
     * @param message    the detail message
     */
    public IntegrityConflictException(EntityType entityType, String message) {
        super(message);
        this.entityType = entityType;
    }

    /**
     * @param entityType the entity whose write conflicted
     * @param message    the detail message
     * @param cause      the storage-level violation
     */
    public IntegrityConflictException(EntityType entityType, String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
