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
 * Thrown when a field parses but its value is out of constraint
 * (negative surface, value or room count, or a value too large for its column).
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class InvalidValueException extends RecordRejectedException {

    /**
     * @param field    the offending column
     * @param rawValue the raw text
     * @param message  the detail message
     */
    public InvalidValueException(String field, String rawValue, String message) {
        super(field, rawValue, message);
    }

    @Override
    public RejectionReason getReason() {
        return RejectionReason.INVALID_VALUE;
    }
}
