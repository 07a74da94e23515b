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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics of the current run, one entry per source in launch order.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Component
public class RunStatistics {

    private final Map<String, SourceStatistics> sources = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * @param sourceName a source name
     * @return its statistics, created on first access
     */
    public SourceStatistics forSource(String sourceName) {
        return sources.computeIfAbsent(sourceName, SourceStatistics::new);
    }

    /**
     * Forgets every source. Called at the start of a run.
     */
    public void reset() {
        sources.clear();
    }

    public List<SourceStatistics> getSources() {
        synchronized (sources) {
            return new ArrayList<>(sources.values());
        }
    }
}
