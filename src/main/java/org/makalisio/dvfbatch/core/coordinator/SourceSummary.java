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
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;

/**
 * Status and counters of one source at the end of a run.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class SourceSummary {

    String sourceName;
    SourceStatus status;
    SourceStatistics statistics;

    /** Failure detail, null when the source completed. */
    String message;

    static SourceSummary of(SourceStatistics statistics, SourceStatus status, String message) {
        return new SourceSummary(statistics.getSourceName(), status, statistics, message);
    }
}
