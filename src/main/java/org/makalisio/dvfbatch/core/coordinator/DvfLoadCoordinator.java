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
import org.makalisio.dvfbatch.core.config.DvfLoadProperties;
import org.makalisio.dvfbatch.core.config.YamlSourceConfigLoader;
import org.makalisio.dvfbatch.core.exception.ConfigurationLoadException;
import org.makalisio.dvfbatch.core.exception.IntegrityConflictException;
import org.makalisio.dvfbatch.core.exception.RejectionReason;
import org.makalisio.dvfbatch.core.exception.StorageUnavailableException;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.statistics.RunStatistics;
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a run: launches {@code dvfLoadJob} once per configured source, in order,
 * and builds the {@link RunSummary}.
 *
 * <h2>Politique d'échec</h2>
 * <ul>
 *   <li>ligne rejetée : comptée par le step, jamais fatale</li>
 *   <li>configuration invalide : la source est FAILED avant toute lecture, le run continue</li>
 *   <li>conflit d'intégrité persistant après les retries : la source est FAILED (le chunk
 *       fautif a été annulé, la base reste cohérente), le run continue</li>
 *   <li>base indisponible : la source est ABORTED et le run s'arrête</li>
 *   <li>arrêt demandé : la source en cours s'arrête au prochain chunk, les suivantes ne partent pas</li>
 * </ul>
 *
 * <p>Chaque lancement est une nouvelle instance de job ({@code runId}) : un run relancé
 * après un crash repart du début des fichiers, le resolver rechargé reconnaissant
 * tout ce qui est déjà en base.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class DvfLoadCoordinator {

    static final String INGESTION_STEP_PREFIX = "dvfIngestionStep";

    private final JobLauncher jobLauncher;
    private final Job dvfLoadJob;
    private final YamlSourceConfigLoader configLoader;
    private final DvfLoadProperties properties;
    private final RunStatistics runStatistics;
    private final RunControl runControl;

    public DvfLoadCoordinator(JobLauncher jobLauncher,
                              @Qualifier("dvfLoadJob") Job dvfLoadJob,
                              YamlSourceConfigLoader configLoader,
                              DvfLoadProperties properties,
                              RunStatistics runStatistics,
                              RunControl runControl) {
        this.jobLauncher = jobLauncher;
        this.dvfLoadJob = dvfLoadJob;
        this.configLoader = configLoader;
        this.properties = properties;
        this.runStatistics = runStatistics;
        this.runControl = runControl;
    }

    /**
     * Runs every source listed in {@code dvf.sources}.
     */
    public RunSummary run() {
        return run(properties.getSources());
    }

    /**
     * @param sourceNames the sources to load, in order
     * @return the run report
     */
    public synchronized RunSummary run(List<String> sourceNames) {
        long start = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString();
        runControl.reset();
        runStatistics.reset();

        log.info("Run {} — {} source(s): {}", runId, sourceNames.size(), sourceNames);

        List<SourceSummary> results = new ArrayList<>();
        boolean halted = false;
        for (String sourceName : sourceNames) {
            SourceStatistics statistics = runStatistics.forSource(sourceName);
            if (halted || runControl.isStopRequested()) {
                results.add(SourceSummary.of(statistics, SourceStatus.NOT_STARTED, null));
                continue;
            }
            SourceSummary summary = runSource(sourceName, runId, statistics);
            results.add(summary);
            halted = summary.getStatus() == SourceStatus.ABORTED || summary.getStatus() == SourceStatus.STOPPED;
        }

        RunSummary summary = new RunSummary(runId, results, System.currentTimeMillis() - start);
        logSummary(summary);
        return summary;
    }

    /**
     * Asks the running source to stop after its current chunk; no further source starts.
     */
    public void requestStop() {
        runControl.requestStop();
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  Source
    // ─────────────────────────────────────────────────────────────────────────

    private SourceSummary runSource(String sourceName, String runId, SourceStatistics statistics) {
        try {
            configLoader.load(sourceName);
        } catch (ConfigurationLoadException | IllegalArgumentException e) {
            log.error("Source '{}' — configuration rejected, source skipped: {}", sourceName, e.getMessage());
            return SourceSummary.of(statistics, SourceStatus.FAILED, e.getMessage());
        }

        JobParameters parameters = new JobParametersBuilder()
                .addString("sourceName", sourceName)
                .addString("runId", runId)
                .toJobParameters();

        JobExecution execution;
        try {
            log.info("Source '{}' — launching {}", sourceName, dvfLoadJob.getName());
            execution = jobLauncher.run(dvfLoadJob, parameters);
        } catch (JobExecutionException e) {
            log.error("Source '{}' — job could not be launched", sourceName, e);
            return SourceSummary.of(statistics, SourceStatus.FAILED, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Source '{}' — job repository unavailable, run aborted", sourceName, e);
            return SourceSummary.of(statistics, SourceStatus.ABORTED, e.getMessage());
        }

        for (StepExecution step : execution.getStepExecutions()) {
            if (step.getStepName().startsWith(INGESTION_STEP_PREFIX)) {
                statistics.setRowsRead(step.getReadCount() + step.getReadSkipCount());
            }
        }

        BatchStatus status = execution.getStatus();
        if (status == BatchStatus.COMPLETED) {
            log.info("Source '{}' — completed: {} accepted, {} rejected", sourceName,
                    statistics.getAccepted(), statistics.getRejectedTotal());
            return SourceSummary.of(statistics, SourceStatus.COMPLETED, null);
        }
        if (status == BatchStatus.STOPPED) {
            log.warn("Source '{}' — stopped at a chunk boundary", sourceName);
            return SourceSummary.of(statistics, SourceStatus.STOPPED, "Stop requested");
        }

        List<Throwable> failures = execution.getAllFailureExceptions();
        if (hasCause(failures, StorageUnavailableException.class)
                || hasCause(failures, DataAccessResourceFailureException.class)) {
            log.error("Source '{}' — storage unavailable, run aborted", sourceName);
            return SourceSummary.of(statistics, SourceStatus.ABORTED, firstMessage(failures));
        }
        if (hasCause(failures, IntegrityConflictException.class)) {
            log.error("Source '{}' — integrity conflict persisted after retries, source failed", sourceName);
        } else {
            log.error("Source '{}' — job ended with status {}", sourceName, status);
        }
        return SourceSummary.of(statistics, SourceStatus.FAILED, firstMessage(failures));
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  Helpers
    // ─────────────────────────────────────────────────────────────────────────

    static boolean hasCause(List<Throwable> failures, Class<? extends Throwable> type) {
        for (Throwable failure : failures) {
            for (Throwable t = failure; t != null; t = t.getCause()) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String firstMessage(List<Throwable> failures) {
        return failures.isEmpty() ? null : failures.get(0).getMessage();
    }

    private void logSummary(RunSummary summary) {
        log.info("Run {} — finished in {} ms (aborted={}, stopped={}, failures={})", summary.getRunId(),
                summary.getDurationMillis(), summary.isAborted(), summary.isStopped(), summary.hasFailures());
        for (SourceSummary source : summary.getSources()) {
            SourceStatistics s = source.getStatistics();
            log.info("  {} [{}] read={} accepted={} malformed={} invalid={} duplicateAssociations={}"
                            + " lotsWithoutSurface={} created: localisation={} bien={} lot={} mutation={} mutationBien={}",
                    source.getSourceName(), source.getStatus(), s.getRowsRead(), s.getAccepted(),
                    s.getRejected(RejectionReason.MALFORMED_RECORD), s.getRejected(RejectionReason.INVALID_VALUE),
                    s.getDuplicateAssociations(), s.getLotsWithoutSurface(),
                    s.getCreated(EntityType.LOCALISATION), s.getCreated(EntityType.BIEN),
                    s.getCreated(EntityType.LOT), s.getCreated(EntityType.MUTATION),
                    s.getCreated(EntityType.MUTATION_BIEN));
        }
    }
}
