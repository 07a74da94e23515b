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
package org.makalisio.dvfbatch.core.exception;

/**
 * Base class for row-level rejections raised by the record parser.
 *
 * <p>A rejected row is skipped by the ingestion step and counted in the run
 * statistics under its {@link RejectionReason}; it never aborts the run.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
public abstract class RecordRejectedException extends RuntimeException {

    private final String field;
    private final String rawValue;

    protected RecordRejectedException(String field, String rawValue, String message) {
        super(message);
        this.field = field;
        this.rawValue = rawValue;
    }

    protected RecordRejectedException(String field, String rawValue, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.rawValue = rawValue;
    }

    /**
     * @return name of the offending source column
     */
    public String getField() {
        return field;
    }

    /**
     * @return the raw text of the offending column, or {@code null} if it was absent
     */
    public String getRawValue() {
        return rawValue;
    }

    /**
     * @return the reason under which the row is counted
     */
    public abstract RejectionReason getReason();
}
