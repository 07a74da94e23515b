package org.makalisio.dvfbatch.core.support;

import org.makalisio.dvfbatch.core.exception.RecordRejectedException;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.makalisio.dvfbatch.core.processor.DvfRecordParser;
import org.makalisio.dvfbatch.core.reader.CsvRawRecordReaderBuilder;
import org.makalisio.dvfbatch.core.relation.RelationshipBuilder;
import org.makalisio.dvfbatch.core.repository.BienJdbcStore;
import org.makalisio.dvfbatch.core.repository.LocalisationJdbcStore;
import org.makalisio.dvfbatch.core.repository.LotJdbcStore;
import org.makalisio.dvfbatch.core.repository.MutationBienJdbcStore;
import org.makalisio.dvfbatch.core.repository.MutationJdbcStore;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;
import org.makalisio.dvfbatch.core.writer.BatchLoader;
import org.makalisio.dvfbatch.core.writer.NormalizingItemWriter;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The write side of the ingestion step without Spring Batch around it: each chunk is
 * written by the {@link NormalizingItemWriter} inside its own transaction.
 */
public class LoadHarness {

    private final TransactionTemplate transactionTemplate;
    private final IdentityResolver identityResolver;
    private final NormalizingItemWriter writer;
    private final SourceStatistics statistics = new SourceStatistics("harness");

    public LoadHarness(DataSource dataSource) {
        this(dataSource, MutationBienJdbcStore::new);
    }

    /**
     * @param mutationBienStores builds the association store, to put a faulty one in place
     */
    public LoadHarness(DataSource dataSource,
                       Function<NamedParameterJdbcTemplate, MutationBienJdbcStore> mutationBienStores) {
        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(dataSource);
        LocalisationJdbcStore localisations = new LocalisationJdbcStore(jdbc);
        BienJdbcStore biens = new BienJdbcStore(jdbc);
        LotJdbcStore lots = new LotJdbcStore(jdbc);
        MutationJdbcStore mutations = new MutationJdbcStore(jdbc);
        MutationBienJdbcStore associations = mutationBienStores.apply(jdbc);

        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.identityResolver = new IdentityResolver(localisations, biens, lots, mutations, associations);
        BatchLoader batchLoader = new BatchLoader(identityResolver, localisations, biens, lots, mutations, associations);
        this.writer = new NormalizingItemWriter("harness", identityResolver, new RelationshipBuilder(),
                batchLoader, statistics);
    }

    /**
     * Rehydrates the resolver, then writes the records in chunks of the given size.
     */
    public void load(List<ParsedRecord> records, int chunkSize) {
        identityResolver.reload();
        for (int from = 0; from < records.size(); from += chunkSize) {
            writeChunk(records.subList(from, Math.min(from + chunkSize, records.size())));
        }
    }

    public void writeChunk(List<ParsedRecord> records) {
        transactionTemplate.executeWithoutResult(status -> writer.write(new Chunk<>(records)));
    }

    public IdentityResolver getIdentityResolver() {
        return identityResolver;
    }

    public SourceStatistics getStatistics() {
        return statistics;
    }

    /**
     * Reads and parses a CSV file with the default source settings. Rejected rows are
     * counted in the given statistics and left out.
     */
    public static List<ParsedRecord> parse(String path, SourceStatistics statistics) throws Exception {
        SourceConfig config = new SourceConfig();
        config.setName("harness");
        config.setType("CSV");
        config.setPath(path);

        DvfRecordParser parser = new DvfRecordParser(config);
        ItemStreamReader<RawRecord> reader = new CsvRawRecordReaderBuilder().build(config);
        List<ParsedRecord> records = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            RawRecord raw;
            while ((raw = reader.read()) != null) {
                try {
                    records.add(parser.process(raw));
                } catch (RecordRejectedException e) {
                    statistics.recordRejected(e.getReason());
                }
            }
        } finally {
            reader.close();
        }
        return records;
    }
}
