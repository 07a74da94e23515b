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
package org.makalisio.dvfbatch.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Row of the {@code MUTATION_BIEN} relation: which property was sold in which
 * mutation, and for how much.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
@Builder
public class MutationBien {

    String mutationId;
    long bienId;

    /** Declared value, scale 2; null when the source gives none. */
    BigDecimal value;

    public MutationBienKey key() {
        return new MutationBienKey(mutationId, bienId);
    }
}
