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

import org.makalisio.dvfbatch.core.exception.RejectionReason;
import org.makalisio.dvfbatch.core.model.EntityType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one source. Thread-safe.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class SourceStatistics {

    private final String sourceName;
    private final AtomicLong rowsRead = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong duplicateAssociations = new AtomicLong();
    private final AtomicLong lotsWithoutSurface = new AtomicLong();
    private final AtomicLong integrityConflicts = new AtomicLong();
    private final Map<RejectionReason, AtomicLong> rejected = new EnumMap<>(RejectionReason.class);
    private final Map<EntityType, AtomicLong> created = new EnumMap<>(EntityType.class);
    private final Map<EntityType, AtomicLong> confirmed = new EnumMap<>(EntityType.class);

    public SourceStatistics(String sourceName) {
        this.sourceName = sourceName;
        for (RejectionReason reason : RejectionReason.values()) {
            rejected.put(reason, new AtomicLong());
        }
        for (EntityType type : EntityType.values()) {
            created.put(type, new AtomicLong());
            confirmed.put(type, new AtomicLong());
        }
    }

    /**
     * Adds the counters of a committed chunk.
     */
    public void merge(ChunkStatistics chunk) {
        accepted.addAndGet(chunk.getAccepted());
        duplicateAssociations.addAndGet(chunk.getDuplicateAssociations());
        lotsWithoutSurface.addAndGet(chunk.getLotsWithoutSurface());
        for (EntityType type : EntityType.values()) {
            created.get(type).addAndGet(chunk.getCreated(type));
            confirmed.get(type).addAndGet(chunk.getConfirmed(type));
        }
    }

    public void recordRejected(RejectionReason reason) {
        rejected.get(reason).incrementAndGet();
    }

    public void recordIntegrityConflict() {
        integrityConflicts.incrementAndGet();
    }

    public void setRowsRead(long count) {
        rowsRead.set(count);
    }

    public String getSourceName() {
        return sourceName;
    }

    public long getRowsRead() {
        return rowsRead.get();
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getRejected(RejectionReason reason) {
        return rejected.get(reason).get();
    }

    public long getRejectedTotal() {
        return rejected.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public long getDuplicateAssociations() {
        return duplicateAssociations.get();
    }

    public long getLotsWithoutSurface() {
        return lotsWithoutSurface.get();
    }

    public long getIntegrityConflicts() {
        return integrityConflicts.get();
    }

    public long getCreated(EntityType type) {
        return created.get(type).get();
    }

    public long getConfirmed(EntityType type) {
        return confirmed.get(type).get();
    }
}
