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
package org.makalisio.dvfbatch.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-level settings, bound from the {@code dvf.*} keys of application.yml.
 *
 * <pre>
 * dvf:
 *   run-on-startup: true
 *   sources:
 *     - dvf-2023-33
 *     - dvf-2023-40
 * </pre>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "dvf")
public class DvfLoadProperties {

    /** Sources to load, in order. Each name maps to ingestion/{name}.yml. */
    private List<String> sources = new ArrayList<>();

    /** Launch the run when the application starts. */
    private boolean runOnStartup = false;
}
