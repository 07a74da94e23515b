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
package org.makalisio.dvfbatch.core.writer;

import org.makalisio.dvfbatch.core.model.EntityType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rows written and rows confirmed (already stored) by one {@link BatchLoader#load} call.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class LoadReport {

    private final Map<EntityType, Integer> written = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Integer> confirmed = new EnumMap<>(EntityType.class);

    void recordWritten(EntityType type, int count) {
        written.merge(type, count, Integer::sum);
    }

    void recordConfirmed(EntityType type, int count) {
        confirmed.merge(type, count, Integer::sum);
    }

    public int getWritten(EntityType type) {
        return written.getOrDefault(type, 0);
    }

    public int getConfirmed(EntityType type) {
        return confirmed.getOrDefault(type, 0);
    }

    @Override
    public String toString() {
        return "written=" + written + ", confirmed=" + confirmed;
    }
}
