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
package org.makalisio.dvfbatch.core.reader;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.MultiResourceItemReader;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * Builds the reader of a DVF source: one CSV file, or every {@code *.csv} file
 * of a directory read in file name order.
 *
 * <p>Column names come from the header line of each file (trimmed, lower-cased)
 * unless the source declares them explicitly. Each {@link RawRecord} carries the
 * line number it was read from.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class CsvRawRecordReaderBuilder {

    private static final char BOM = '\uFEFF';

    /**
     * @param config the source configuration
     * @return a reader over the file or the directory
     * @throws IllegalArgumentException if config is null
     * @throws IllegalStateException    if the path does not exist, is unreadable, or holds no CSV file
     */
    public ItemStreamReader<RawRecord> build(SourceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("SourceConfig cannot be null");
        }

        File path = new File(config.getPath());
        if (!path.exists()) {
            String errorMsg = String.format("CSV path not found for source '%s': %s", config.getName(), path);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }
        if (!path.canRead()) {
            String errorMsg = String.format("CSV path is not readable for source '%s': %s", config.getName(), path);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        if (path.isFile()) {
            log.info("Source '{}' — reading CSV file {}", config.getName(), path);
            FlatFileItemReader<RawRecord> reader = fileReader(config);
            reader.setResource(new FileSystemResource(path));
            return reader;
        }

        File[] files = path.listFiles((dir, name) -> name.toLowerCase(Locale.ROOT).endsWith(".csv"));
        if (files == null || files.length == 0) {
            String errorMsg = String.format("No CSV file in directory for source '%s': %s", config.getName(), path);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }
        Arrays.sort(files, Comparator.comparing(File::getName));
        Resource[] resources = Arrays.stream(files).map(FileSystemResource::new).toArray(Resource[]::new);

        log.info("Source '{}' — reading {} CSV file(s) from {}", config.getName(), resources.length, path);

        MultiResourceItemReader<RawRecord> reader = new MultiResourceItemReader<>();
        reader.setName("csvFilesReader-" + config.getName());
        reader.setResources(resources);
        reader.setDelegate(fileReader(config));
        return reader;
    }

    // ─────────────────────────────────────────────────────────────────────────
    //  Helpers
    // ─────────────────────────────────────────────────────────────────────────

    private FlatFileItemReader<RawRecord> fileReader(SourceConfig config) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(config.getDelimiter());
        tokenizer.setStrict(false); // lignes courtes complétées, colonnes en trop ignorées

        FlatFileItemReader<RawRecord> reader = new FlatFileItemReader<>();
        reader.setName("csvReader-" + config.getName());
        reader.setEncoding(config.getEncoding());
        reader.setStrict(true);
        reader.setLinesToSkip(config.isSkipHeader() ? 1 : 0);

        if (config.isHeaderNamed()) {
            reader.setSkippedLinesCallback(header -> {
                String[] names = headerNames(header, config.getDelimiter());
                tokenizer.setNames(names);
                log.debug("Source '{}' — header: {}", config.getName(), String.join(",", names));
            });
        } else {
            tokenizer.setNames(config.getColumnNames());
        }

        reader.setLineMapper(lineMapper(tokenizer));
        return reader;
    }

    static String[] headerNames(String header, String delimiter) {
        String line = !header.isEmpty() && header.charAt(0) == BOM ? header.substring(1) : header;
        FieldSet fields = new DelimitedLineTokenizer(delimiter).tokenize(line);
        return Arrays.stream(fields.getValues())
                .map(name -> name.strip().toLowerCase(Locale.ROOT))
                .toArray(String[]::new);
    }

    private static LineMapper<RawRecord> lineMapper(DelimitedLineTokenizer tokenizer) {
        return (line, lineNumber) -> {
            FieldSet fields = tokenizer.tokenize(line);
            String[] names = fields.getNames();
            RawRecord record = new RawRecord(lineNumber);
            for (int i = 0; i < names.length; i++) {
                if (!names[i].isEmpty()) {
                    record.put(names[i], fields.readRawString(i));
                }
            }
            return record;
        };
    }
}
