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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business key to surrogate id mapping of one entity type.
 *
 * <p>Keys resolved for the first time get the next id and stay <em>pending</em>
 * until {@link #commitPending()} (the chunk transaction committed) or
 * {@link #discardPending()} (it rolled back, the ids are handed out again).
 * A pending key resolves to the same id for the rest of the chunk.</p>
 *
 * <p>All methods are serialized on the resolver instance, so one key is never
 * minted twice.</p>
 *
 * @param <K> business key type
 * @author Makalisio
 * @since 0.0.1
 */
public class SurrogateKeyResolver<K> {

    private final EntityType entityType;
    private final Map<K, Long> committed = new HashMap<>();
    private final Map<K, Long> pending = new LinkedHashMap<>();
    private long nextId = 1;
    private long committedNextId = 1;

    public SurrogateKeyResolver(EntityType entityType) {
        this.entityType = entityType;
    }

    /**
     * Replaces the whole mapping with the one found in storage.
     *
     * @param keyIds stored keys and their ids
     * @param maxId  highest stored id
     */
    public synchronized void reload(Map<K, Long> keyIds, long maxId) {
        committed.clear();
        committed.putAll(keyIds);
        pending.clear();
        nextId = maxId + 1;
        committedNextId = nextId;
    }

    /**
     * @param key the business key
     * @return the id of the key, minted if the key was never seen
     */
    public synchronized Resolution resolve(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Business key cannot be null for " + entityType);
        }
        Long id = committed.get(key);
        if (id == null) {
            id = pending.get(key);
        }
        if (id != null) {
            return Resolution.existing(id);
        }
        long minted = nextId++;
        pending.put(key, minted);
        return Resolution.created(minted);
    }

    public synchronized boolean isCommitted(K key) {
        return committed.containsKey(key);
    }

    public synchronized void commitPending() {
        committed.putAll(pending);
        pending.clear();
        committedNextId = nextId;
    }

    public synchronized void discardPending() {
        pending.clear();
        nextId = committedNextId;
    }

    public synchronized int committedSize() {
        return committed.size();
    }

    public synchronized int pendingSize() {
        return pending.size();
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
