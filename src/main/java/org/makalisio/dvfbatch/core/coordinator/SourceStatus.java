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

/**
 * Outcome of one source within a run.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public enum SourceStatus {

    /** Every row was read; rejected rows are counted, not failures. */
    COMPLETED,

    /** Configuration error or integrity conflict still present after the retries. The run went on. */
    FAILED,

    /** Stopped at a chunk boundary on request. */
    STOPPED,

    /** Storage unavailable: the whole run was aborted. */
    ABORTED,

    /** Not launched because the run was stopped or aborted before. */
    NOT_STARTED
}
