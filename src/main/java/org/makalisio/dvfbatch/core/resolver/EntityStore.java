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
package org.makalisio.dvfbatch.core.resolver;

import org.makalisio.dvfbatch.core.model.EntityType;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Storage capability for one normalized entity type.
 *
 * <p>Business key logic stays with each implementation: it alone knows which
 * columns form the key and how a stored row maps back to it.</p>
 *
 * @param <K> business key type
 * @param <R> row type
 * @author Makalisio
 * @since 0.0.1
 */
public interface EntityStore<K, R> {

    EntityType getEntityType();

    /**
     * @param row a row of this entity type
     * @return its business key
     */
    K keyOf(R row);

    /**
     * Returns the subset of the given keys already present in storage.
     *
     * @param keys the keys to probe, may be empty
     * @return the stored keys, never null
     */
    Set<K> findExisting(Collection<K> keys);

    /**
     * Inserts the rows in one batch, within the caller's transaction.
     *
     * @param rows rows whose keys are absent from storage
     */
    void persist(List<R> rows);
}
