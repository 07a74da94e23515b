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
package org.makalisio.dvfbatch.core.coordinator;

import lombok.Value;
import org.makalisio.dvfbatch.core.exception.RejectionReason;
import org.makalisio.dvfbatch.core.model.EntityType;

import java.util.List;

/**
 * Report of a whole run: one {@link SourceSummary} per configured source, in order.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class RunSummary {

    String runId;
    List<SourceSummary> sources;
    long durationMillis;

    public boolean isAborted() {
        return sources.stream().anyMatch(s -> s.getStatus() == SourceStatus.ABORTED);
    }

    public boolean isStopped() {
        return sources.stream().anyMatch(s -> s.getStatus() == SourceStatus.STOPPED);
    }

    public boolean hasFailures() {
        return sources.stream().anyMatch(s -> s.getStatus() == SourceStatus.FAILED);
    }

    public long getAccepted() {
        return sources.stream().mapToLong(s -> s.getStatistics().getAccepted()).sum();
    }

    public long getRejected(RejectionReason reason) {
        return sources.stream().mapToLong(s -> s.getStatistics().getRejected(reason)).sum();
    }

    public long getDuplicateAssociations() {
        return sources.stream().mapToLong(s -> s.getStatistics().getDuplicateAssociations()).sum();
    }

    public long getCreated(EntityType type) {
        return sources.stream().mapToLong(s -> s.getStatistics().getCreated(type)).sum();
    }
}
