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
import org.makalisio.dvfbatch.core.config.YamlSourceConfigLoader;
import org.makalisio.dvfbatch.core.coordinator.RunControl;
import org.makalisio.dvfbatch.core.exception.IntegrityConflictException;
import org.makalisio.dvfbatch.core.exception.RecordRejectedException;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.makalisio.dvfbatch.core.processor.DvfRecordParser;
import org.makalisio.dvfbatch.core.reader.CsvRawRecordReaderBuilder;
import org.makalisio.dvfbatch.core.relation.RelationshipBuilder;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.makalisio.dvfbatch.core.statistics.RunStatistics;
import org.makalisio.dvfbatch.core.tasklet.ResolverRehydrationTasklet;
import org.makalisio.dvfbatch.core.writer.BatchLoader;
import org.makalisio.dvfbatch.core.writer.NormalizingItemWriter;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.FaultTolerantStepBuilder;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.batch.item.ItemWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Configuration du job de chargement DVF.
 *
 * <h2>Cycle de vie des beans</h2>
 * <pre>
 *   Démarrage application
 *     └─ dvfLoadJob                 (Singleton)
 *          ├─ dvfRehydrationStep    (@JobScope — recharge le resolver depuis la base)
 *          └─ dvfIngestionStep      (@JobScope — chunk reader/parser/writer)
 * </pre>
 *
 * <h2>Tolérance aux fautes du step d'ingestion</h2>
 * <ul>
 *   <li>lignes rejetées (lecture ou parsing) : skip sans limite, sans rollback</li>
 *   <li>{@link IntegrityConflictException} et erreurs transitoires : rollback du chunk,
 *       puis retry avec backoff exponentiel ({@code retryLimit} tentatives)</li>
 *   <li>toute autre erreur : échec du step, décision laissée au coordinateur</li>
 * </ul>
 *
 * <p>Paramètres du job : {@code sourceName} et {@code runId}.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Configuration
public class DvfLoadJobConfig {

    private final YamlSourceConfigLoader configLoader;
    private final CsvRawRecordReaderBuilder readerBuilder;
    private final IdentityResolver identityResolver;
    private final RelationshipBuilder relationshipBuilder;
    private final BatchLoader batchLoader;
    private final RunStatistics runStatistics;
    private final RunControl runControl;

    public DvfLoadJobConfig(YamlSourceConfigLoader configLoader,
                            CsvRawRecordReaderBuilder readerBuilder,
                            IdentityResolver identityResolver,
                            RelationshipBuilder relationshipBuilder,
                            BatchLoader batchLoader,
                            RunStatistics runStatistics,
                            RunControl runControl) {
        this.configLoader = configLoader;
        this.readerBuilder = readerBuilder;
        this.identityResolver = identityResolver;
        this.relationshipBuilder = relationshipBuilder;
        this.batchLoader = batchLoader;
        this.runStatistics = runStatistics;
        this.runControl = runControl;
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  JOB
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * @param jobRepository      le dépôt Spring Batch
     * @param dvfRehydrationStep step de rechargement (proxy @JobScope)
     * @param dvfIngestionStep   step chunk principale (proxy @JobScope)
     * @return le job configuré
     */
    @Bean
    public Job dvfLoadJob(JobRepository jobRepository,
                          Step dvfRehydrationStep,
                          Step dvfIngestionStep) {
        return new JobBuilder("dvfLoadJob", jobRepository)
                .start(dvfRehydrationStep)
                .next(dvfIngestionStep)
                .build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  REHYDRATATION
    // ─────────────────────────────────────────────────────────────────────────

    @Bean
    @JobScope
    public Step dvfRehydrationStep(JobRepository jobRepository,
                                   PlatformTransactionManager txManager,
                                   @Value("#{jobParameters['sourceName']}") String sourceName) {
        return new StepBuilder("dvfRehydrationStep-" + sourceName, jobRepository)
                .tasklet(new ResolverRehydrationTasklet(identityResolver, sourceName), txManager)
                .build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  INGESTION (chunk)
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * @param jobRepository       le dépôt Spring Batch
     * @param txManager           gestionnaire de transaction (une transaction par chunk)
     * @param dvfIngestionReader  reader (proxy @StepScope)
     * @param dvfRecordParser     parser (proxy @StepScope)
     * @param dvfNormalizingWriter writer (proxy @StepScope)
     * @param sourceName          nom de la source (depuis jobParameters)
     * @return la step configurée
     */
    @Bean
    @JobScope
    public Step dvfIngestionStep(JobRepository jobRepository,
                                 PlatformTransactionManager txManager,
                                 ItemStreamReader<RawRecord> dvfIngestionReader,
                                 ItemProcessor<RawRecord, ParsedRecord> dvfRecordParser,
                                 ItemWriter<ParsedRecord> dvfNormalizingWriter,
                                 @Value("#{jobParameters['sourceName']}") String sourceName) {

        SourceConfig config = configLoader.load(sourceName);
        log.info("Source '{}' — building ingestion step (chunkSize={}, retryLimit={})",
                sourceName, config.getChunkSize(), config.getRetryLimit());

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(config.getBackoffInitialMillis());
        backOff.setMaxInterval(config.getBackoffMaxMillis());
        backOff.setMultiplier(2.0);

        FaultTolerantStepBuilder<RawRecord, ParsedRecord> ftBuilder =
                new StepBuilder("dvfIngestionStep-" + sourceName, jobRepository)
                        .<RawRecord, ParsedRecord>chunk(config.getChunkSize(), txManager)
                        .reader(dvfIngestionReader)
                        .processor(dvfRecordParser)
                        .writer(dvfNormalizingWriter)
                        .faultTolerant()
                        .skipPolicy(new RecordRejectionSkipPolicy())
                        .noRollback(RecordRejectedException.class)
                        .retry(IntegrityConflictException.class)
                        .retry(TransientDataAccessException.class)
                        .retryLimit(config.getRetryLimit())
                        .backOffPolicy(backOff);

        ftBuilder.listener(new RejectedRecordListener(sourceName, runStatistics.forSource(sourceName)));
        ftBuilder.listener(new StopAfterChunkListener(runControl));

        return ftBuilder.build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  READER / PARSER / WRITER  (@StepScope)
    // ─────────────────────────────────────────────────────────────────────────

    @Bean
    @StepScope
    public ItemStreamReader<RawRecord> dvfIngestionReader(
            @Value("#{jobParameters['sourceName']}") String sourceName) {
        return readerBuilder.build(configLoader.load(sourceName));
    }

    @Bean
    @StepScope
    public ItemProcessor<RawRecord, ParsedRecord> dvfRecordParser(
            @Value("#{jobParameters['sourceName']}") String sourceName) {
        return new DvfRecordParser(configLoader.load(sourceName));
    }

    @Bean
    @StepScope
    public ItemWriter<ParsedRecord> dvfNormalizingWriter(
            @Value("#{jobParameters['sourceName']}") String sourceName) {
        return new NormalizingItemWriter(sourceName, identityResolver, relationshipBuilder, batchLoader,
                runStatistics.forSource(sourceName));
    }
}
