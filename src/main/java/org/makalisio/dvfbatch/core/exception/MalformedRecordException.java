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
 * Thrown when a field of a source row cannot be parsed to its expected type,
 * or when a required field is absent.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class MalformedRecordException extends RecordRejectedException {

    /**
     * @param field    the offending column
     * @param rawValue the raw text, {@code null} if absent
     * @param message  the detail message
     */
    public MalformedRecordException(String field, String rawValue, String message) {
        super(field, rawValue, message);
    }

    /**
     * @param field    the offending column
     * @param rawValue the raw text
     * @param message  the detail message
     * @param cause    the parse failure
     */
    public MalformedRecordException(String field, String rawValue, String message, Throwable cause) {
        super(field, rawValue, message, cause);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.MALFORMED_RECORD;
    }
}
