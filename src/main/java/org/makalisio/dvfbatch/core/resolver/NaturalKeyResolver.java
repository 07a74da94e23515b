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

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Existence tracking for an entity whose business key is its identity
 * (Mutation, MutationBien). Same pending/committed life cycle as
 * {@link SurrogateKeyResolver}, without ids.
 *
 * @param <K> business key type
 * @author Makalisio
 * @since 0.0.1
 */
public class NaturalKeyResolver<K> {

    private final EntityType entityType;
    private final Set<K> committed = new HashSet<>();
    private final Set<K> pending = new LinkedHashSet<>();

    public NaturalKeyResolver(EntityType entityType) {
        this.entityType = entityType;
    }

    public synchronized void reload(Set<K> keys) {
        committed.clear();
        committed.addAll(keys);
        pending.clear();
    }

    /**
     * @param key the natural key
     * @return true if the key is seen for the first time and its row must be written
     */
    public synchronized boolean resolve(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Natural key cannot be null for " + entityType);
        }
        if (committed.contains(key)) {
            return false;
        }
        return pending.add(key);
    }

    public synchronized boolean isCommitted(K key) {
        return committed.contains(key);
    }

    public synchronized void commitPending() {
        committed.addAll(pending);
        pending.clear();
    }

    public synchronized void discardPending() {
        pending.clear();
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
