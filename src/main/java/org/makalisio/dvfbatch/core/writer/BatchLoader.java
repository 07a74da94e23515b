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
package org.makalisio.dvfbatch.core.writer;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.exception.IntegrityConflictException;
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
import org.makalisio.dvfbatch.core.resolver.EntityStore;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Écrit un {@link LoadBatch} dans l'ordre des clés étrangères :
 * LOCALISATION → BIEN → LOT → MUTATION → MUTATION_BIEN.
 *
 * <p>Pour chaque type, les clés du lot sont d'abord recherchées en base.
 * Une clé déjà stockée que le resolver connaît comme validée est une simple
 * confirmation (la ligne n'est pas réinsérée). Une clé stockée que le resolver
 * croyait nouvelle signifie que le resolver et la base ont divergé : le chunk
 * échoue avec une {@link IntegrityConflictException}.</p>
 *
 * <p>Toutes les écritures se font dans la transaction de l'appelant.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class BatchLoader {

    private final IdentityResolver identityResolver;
    private final EntityStore<LocalisationKey, Localisation> localisationStore;
    private final EntityStore<BienKey, Bien> bienStore;
    private final EntityStore<LotKey, Lot> lotStore;
    private final EntityStore<String, Mutation> mutationStore;
    private final EntityStore<MutationBienKey, MutationBien> mutationBienStore;

    public BatchLoader(IdentityResolver identityResolver,
                       EntityStore<LocalisationKey, Localisation> localisationStore,
                       EntityStore<BienKey, Bien> bienStore,
                       EntityStore<LotKey, Lot> lotStore,
                       EntityStore<String, Mutation> mutationStore,
                       EntityStore<MutationBienKey, MutationBien> mutationBienStore) {
        this.identityResolver = identityResolver;
        this.localisationStore = localisationStore;
        this.bienStore = bienStore;
        this.lotStore = lotStore;
        this.mutationStore = mutationStore;
        this.mutationBienStore = mutationBienStore;
    }

    /**
     * @param batch the rows of one chunk
     * @return what was written and what was confirmed
     * @throws IntegrityConflictException  if storage holds a row the resolver believed unseen
     * @throws StorageUnavailableException if storage cannot be reached
     */
    public LoadReport load(LoadBatch batch) {
        LoadReport report = new LoadReport();
        write(localisationStore, batch.getLocalisations(), report);
        write(bienStore, batch.getBiens(), report);
        write(lotStore, batch.getLots(), report);
        write(mutationStore, batch.getMutations(), report);
        write(mutationBienStore, batch.getAssociations(), report);
        return report;
    }

    private <K, R> void write(EntityStore<K, R> store, List<R> rows, LoadReport report) {
        if (rows.isEmpty()) {
            return;
        }
        EntityType type = store.getEntityType();

        Map<K, R> byKey = new LinkedHashMap<>();
        for (R row : rows) {
            byKey.put(store.keyOf(row), row);
        }

        try {
            Set<K> existing = store.findExisting(byKey.keySet());
            List<K> conflicts = new ArrayList<>();
            for (K key : existing) {
                if (identityResolver.isCommitted(type, key)) {
                    log.debug("{} — key already stored and known, confirmed: {}", type, key);
                    byKey.remove(key);
                } else {
                    conflicts.add(key);
                }
            }
            if (!conflicts.isEmpty()) {
                log.error("{} — {} key(s) already stored but unknown to the resolver, first: {}",
                        type, conflicts.size(), conflicts.get(0));
                throw new IntegrityConflictException(type,
                        conflicts.size() + " " + type + " row(s) already stored but resolved as new");
            }

            store.persist(new ArrayList<>(byKey.values()));
            report.recordWritten(type, byKey.size());
            report.recordConfirmed(type, existing.size());

        } catch (DataIntegrityViolationException e) {
            log.error("{} — insert rejected by a storage constraint: {}", type, e.getMostSpecificCause().getMessage());
            throw new IntegrityConflictException(type, "Storage constraint violated while writing " + type, e);

        } catch (DataAccessResourceFailureException e) {
            log.error("{} — storage unavailable", type, e);
            throw new StorageUnavailableException("Storage unavailable while writing " + type, e);
        }
    }
}
