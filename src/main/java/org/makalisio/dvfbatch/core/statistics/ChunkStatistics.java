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
package org.makalisio.dvfbatch.core.statistics;

import org.makalisio.dvfbatch.core.model.EntityType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counters of one chunk write. They reach the {@link SourceStatistics} only if
 * the chunk transaction commits.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class ChunkStatistics {

    private int accepted;
    private int duplicateAssociations;
    private int lotsWithoutSurface;
    private final Map<EntityType, Integer> created = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Integer> confirmed = new EnumMap<>(EntityType.class);

    public void recordAccepted() {
        accepted++;
    }

    public void recordDuplicateAssociation() {
        duplicateAssociations++;
    }

    public void recordLotsWithoutSurface(int count) {
        lotsWithoutSurface += count;
    }

    public void recordCreated(EntityType type, int count) {
        created.merge(type, count, Integer::sum);
    }

    public void recordConfirmed(EntityType type, int count) {
        confirmed.merge(type, count, Integer::sum);
    }

    public int getAccepted() {
        return accepted;
    }

    public int getDuplicateAssociations() {
        return duplicateAssociations;
    }

    public int getLotsWithoutSurface() {
        return lotsWithoutSurface;
    }

    public int getCreated(EntityType type) {
        return created.getOrDefault(type, 0);
    }

    public int getConfirmed(EntityType type) {
        return confirmed.getOrDefault(type, 0);
    }

    @Override
    public String toString() {
        return "accepted=" + accepted + ", created=" + created
                + ", duplicateAssociations=" + duplicateAssociations
                + ", lotsWithoutSurface=" + lotsWithoutSurface;
    }
}
