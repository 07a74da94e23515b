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

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.exception.StorageUnavailableException;
import org.makalisio.dvfbatch.core.model.Bien;
import org.makalisio.dvfbatch.core.model.BienKey;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.model.Localisation;
import org.makalisio.dvfbatch.core.model.LocalisationKey;
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.LotKey;
import org.makalisio.dvfbatch.core.model.Mutation;
import org.makalisio.dvfbatch.core.model.MutationBien;
import org.makalisio.dvfbatch.core.model.MutationBienKey;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

/**
 * Owner of every business key mapping of the run.
 *
 * <p>Localisation, Bien and Lot keys resolve to surrogate ids; Mutation ids and
 * (mutation, bien) pairs are only checked for existence. The mapping is rebuilt
 * from storage by {@link #reload()} at the start of each job and whenever it has
 * been {@link #invalidate() invalidated} after an integrity conflict.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class IdentityResolver {

    private final SurrogateKeyStore<LocalisationKey, Localisation> localisationStore;
    private final SurrogateKeyStore<BienKey, Bien> bienStore;
    private final SurrogateKeyStore<LotKey, Lot> lotStore;
    private final NaturalKeyStore<String, Mutation> mutationStore;
    private final NaturalKeyStore<MutationBienKey, MutationBien> mutationBienStore;

    private final SurrogateKeyResolver<LocalisationKey> localisations =
            new SurrogateKeyResolver<>(EntityType.LOCALISATION);
    private final SurrogateKeyResolver<BienKey> biens = new SurrogateKeyResolver<>(EntityType.BIEN);
    private final SurrogateKeyResolver<LotKey> lots = new SurrogateKeyResolver<>(EntityType.LOT);
    private final NaturalKeyResolver<String> mutations = new NaturalKeyResolver<>(EntityType.MUTATION);
    private final NaturalKeyResolver<MutationBienKey> associations =
            new NaturalKeyResolver<>(EntityType.MUTATION_BIEN);

    private volatile boolean stale = true;

    public IdentityResolver(SurrogateKeyStore<LocalisationKey, Localisation> localisationStore,
                            SurrogateKeyStore<BienKey, Bien> bienStore,
                            SurrogateKeyStore<LotKey, Lot> lotStore,
                            NaturalKeyStore<String, Mutation> mutationStore,
                            NaturalKeyStore<MutationBienKey, MutationBien> mutationBienStore) {
        this.localisationStore = localisationStore;
        this.bienStore = bienStore;
        this.lotStore = lotStore;
        this.mutationStore = mutationStore;
        this.mutationBienStore = mutationBienStore;
    }

    /**
     * Rebuilds every mapping from storage. Pending entries are dropped.
     *
     * @throws StorageUnavailableException if storage cannot be reached
     */
    public synchronized void reload() {
        long start = System.currentTimeMillis();
        try {
            localisations.reload(localisationStore.loadKeyIds(), localisationStore.maxId());
            biens.reload(bienStore.loadKeyIds(), bienStore.maxId());
            lots.reload(lotStore.loadKeyIds(), lotStore.maxId());
            mutations.reload(mutationStore.loadKeys());
            associations.reload(mutationBienStore.loadKeys());
        } catch (DataAccessResourceFailureException e) {
            log.error("Identity resolver reload failed: storage unavailable", e);
            throw new StorageUnavailableException("Cannot rehydrate the identity resolver from storage", e);
        }
        stale = false;
        log.info("Identity resolver loaded in {} ms: {} localisations, {} biens, {} lots, {} mutations, {} associations",
                System.currentTimeMillis() - start,
                localisations.committedSize(), biens.committedSize(), lots.committedSize(),
                mutations.committedSize(), associations.committedSize());
    }

    /**
     * Marks the mapping as diverged from storage. The next {@link #ensureFresh()} reloads it.
     */
    public void invalidate() {
        log.warn("Identity resolver invalidated, it will be reloaded before the next write");
        stale = true;
    }

    public synchronized void ensureFresh() {
        if (stale) {
            reload();
        }
    }

    public boolean isStale() {
        return stale;
    }

    // ─── Resolution ──────────────────────────────────────────────────────────

    public Resolution resolveLocalisation(LocalisationKey key) {
        return localisations.resolve(key);
    }

    public Resolution resolveBien(BienKey key) {
        return biens.resolve(key);
    }

    public Resolution resolveLot(LotKey key) {
        return lots.resolve(key);
    }

    /**
     * @return true if the mutation is new and its row must be written
     */
    public boolean resolveMutation(String mutationId) {
        return mutations.resolve(mutationId);
    }

    /**
     * @return true if the pair is new, false for a duplicate association
     */
    public boolean resolveAssociation(MutationBienKey key) {
        return associations.resolve(key);
    }

    /**
     * @param type the entity type
     * @param key  a business key of that type
     * @return true if the key belongs to a committed row
     */
    public boolean isCommitted(EntityType type, Object key) {
        switch (type) {
            case LOCALISATION:
                return localisations.isCommitted((LocalisationKey) key);
            case BIEN:
                return biens.isCommitted((BienKey) key);
            case LOT:
                return lots.isCommitted((LotKey) key);
            case MUTATION:
                return mutations.isCommitted((String) key);
            case MUTATION_BIEN:
                return associations.isCommitted((MutationBienKey) key);
            default:
                throw new IllegalArgumentException("Unknown entity type: " + type);
        }
    }

    // ─── Transaction outcome ─────────────────────────────────────────────────

    /**
     * The chunk committed: pending keys become permanent.
     */
    public void commitPending() {
        localisations.commitPending();
        biens.commitPending();
        lots.commitPending();
        mutations.commitPending();
        associations.commitPending();
    }

    /**
     * The chunk rolled back: pending keys are forgotten and their ids reused.
     */
    public void discardPending() {
        localisations.discardPending();
        biens.discardPending();
        lots.discardPending();
        mutations.discardPending();
        associations.discardPending();
    }
}
