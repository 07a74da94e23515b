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
package org.makalisio.dvfbatch.core.tasklet;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

/**
 * Premier step du job : reconstruit le mapping clé métier → id depuis la base.
 *
 * <p>Chaque lancement repart ainsi de l'état réellement validé en base, sans
 * offset de reprise : les chunks validés par un run interrompu sont reconnus,
 * les chunks annulés n'ont laissé aucune trace.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public class ResolverRehydrationTasklet implements Tasklet {

    private final IdentityResolver identityResolver;
    private final String sourceName;

    /**
     * @param identityResolver le resolver à recharger
     * @param sourceName       nom de la source (pour les logs)
     */
    public ResolverRehydrationTasklet(IdentityResolver identityResolver, String sourceName) {
        this.identityResolver = identityResolver;
        this.sourceName = sourceName;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        log.info("Source '{}' — rechargement du resolver ({})",
                sourceName, chunkContext.getStepContext().getStepName());
        identityResolver.reload();
        return RepeatStatus.FINISHED;
    }
}
