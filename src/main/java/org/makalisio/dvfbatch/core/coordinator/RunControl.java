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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop flag shared by the coordinator and the ingestion step.
 * A stop request takes effect at the next chunk boundary.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class RunControl {

    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("Stop requested, the run ends after the current chunk");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    void reset() {
        stopRequested.set(false);
    }
}
