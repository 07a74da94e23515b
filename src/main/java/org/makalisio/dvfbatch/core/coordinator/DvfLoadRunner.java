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
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured sources at start-up when {@code dvf.run-on-startup=true}.
 *
 * <p>Exit code: 0 when every source completed, 1 when a source failed or the run
 * was stopped, 2 when the run was aborted (storage unavailable).</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dvf", name = "run-on-startup", havingValue = "true")
public class DvfLoadRunner implements ApplicationRunner, ExitCodeGenerator {

    private final DvfLoadCoordinator coordinator;
    private int exitCode;

    public DvfLoadRunner(DvfLoadCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = coordinator.run();
        if (summary.isAborted()) {
            exitCode = 2;
        } else if (summary.hasFailures() || summary.isStopped()) {
            exitCode = 1;
        }
        log.info("DVF load finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
