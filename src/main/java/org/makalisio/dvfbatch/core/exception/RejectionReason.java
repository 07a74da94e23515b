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
 * Reasons for which a source row is excluded from the load.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public enum RejectionReason {

    /** A field could not be parsed, or a required field is absent. */
    MALFORMED_RECORD,

    /** A field parsed but violates a value constraint (negative surface, value...). */
    INVALID_VALUE
}
