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
import org.makalisio.dvfbatch.core.exception.RecordRejectedException;
import org.makalisio.dvfbatch.core.exception.RejectionReason;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;
import org.springframework.batch.core.SkipListener;
import org.springframework.batch.item.file.FlatFileParseException;

/**
 * Compte et journalise chaque ligne rejetée, par motif.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public class RejectedRecordListener implements SkipListener<RawRecord, ParsedRecord> {

    private final String sourceName;
    private final SourceStatistics statistics;

    public RejectedRecordListener(String sourceName, SourceStatistics statistics) {
        this.sourceName = sourceName;
        this.statistics = statistics;
    }

    @Override
    public void onSkipInRead(Throwable t) {
        statistics.recordRejected(RejectionReason.MALFORMED_RECORD);
        if (t instanceof FlatFileParseException) {
            FlatFileParseException e = (FlatFileParseException) t;
            log.warn("Source '{}' — line {} unreadable, skipped: {}", sourceName, e.getLineNumber(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } else {
            log.warn("Source '{}' — line skipped at read: {}", sourceName, t.getMessage());
        }
    }

    @Override
    public void onSkipInProcess(RawRecord item, Throwable t) {
        if (t instanceof RecordRejectedException) {
            RecordRejectedException e = (RecordRejectedException) t;
            statistics.recordRejected(e.getReason());
            log.warn("Source '{}' — line {} rejected ({}), field '{}': {}",
                    sourceName, item.getLineNumber(), e.getReason(), e.getField(), e.getMessage());
        } else {
            statistics.recordRejected(RejectionReason.MALFORMED_RECORD);
            log.warn("Source '{}' — line {} rejected: {}", sourceName, item.getLineNumber(), t.getMessage());
        }
    }

    @Override
    public void onSkipInWrite(ParsedRecord item, Throwable t) {
        log.error("Source '{}' — line {} skipped at write: {}", sourceName, item.getLineNumber(), t.getMessage());
    }
}
