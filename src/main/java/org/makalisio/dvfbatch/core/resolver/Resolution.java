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
package org.makalisio.dvfbatch.core.resolver;

import lombok.Value;

/**
 * Outcome of resolving a business key to a surrogate id.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class Resolution {

    long id;

    /** True when the id was minted by this call: the caller must write the row. */
    boolean created;

    public static Resolution existing(long id) {
        return new Resolution(id, false);
    }

    public static Resolution created(long id) {
        return new Resolution(id, true);
    }
}
