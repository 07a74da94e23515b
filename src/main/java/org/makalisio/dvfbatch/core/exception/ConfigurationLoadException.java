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
 * Thrown when the YAML configuration of a DVF source cannot be found, parsed or validated.
 * The source fails before any row is read; the coordinator moves on to the next source.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class ConfigurationLoadException extends RuntimeException {

    private final String sourceName;

    /**
     * @param sourceName the source whose configuration failed
     * @param message    the detail message
     */
    public ConfigurationLoadException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    /**
     * @param sourceName the source whose configuration failed
     * @param message    the detail message
     * @param cause      the underlying I/O or YAML error
     */
    public ConfigurationLoadException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
