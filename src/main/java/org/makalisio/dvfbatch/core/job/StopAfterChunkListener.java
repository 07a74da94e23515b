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
package org.makalisio.dvfbatch.core.job;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.coordinator.RunControl;
import org.springframework.batch.core.ChunkListener;
import org.springframework.batch.core.scope.context.ChunkContext;

/**
 * Ends the ingestion step at the chunk boundary once a stop has been requested.
 * The current chunk is committed first; the job ends STOPPED.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public class StopAfterChunkListener implements ChunkListener {

    private final RunControl runControl;

    public StopAfterChunkListener(RunControl runControl) {
        this.runControl = runControl;
    }

    @Override
    public void afterChunk(ChunkContext context) {
        if (runControl.isStopRequested()) {
            log.warn("Step '{}' — stop requested, terminating after this chunk",
                    context.getStepContext().getStepName());
            context.getStepContext().getStepExecution().setTerminateOnly();
        }
    }
}
