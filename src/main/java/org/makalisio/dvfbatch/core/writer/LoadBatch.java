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

import org.makalisio.dvfbatch.core.model.Bien;
import org.makalisio.dvfbatch.core.model.Localisation;
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.Mutation;
import org.makalisio.dvfbatch.core.model.MutationBien;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * New rows of one chunk, buffered per entity type.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class LoadBatch {

    private final List<Localisation> localisations = new ArrayList<>();
    private final List<Bien> biens = new ArrayList<>();
    private final List<Lot> lots = new ArrayList<>();
    private final List<Mutation> mutations = new ArrayList<>();
    private final List<MutationBien> associations = new ArrayList<>();

    public void addLocalisation(Localisation localisation) {
        localisations.add(localisation);
    }

    public void addBien(Bien bien) {
        biens.add(bien);
    }

    public void addLot(Lot lot) {
        lots.add(lot);
    }

    public void addMutation(Mutation mutation) {
        mutations.add(mutation);
    }

    public void addAssociation(MutationBien association) {
        associations.add(association);
    }

    public List<Localisation> getLocalisations() {
        return Collections.unmodifiableList(localisations);
    }

    public List<Bien> getBiens() {
        return Collections.unmodifiableList(biens);
    }

    public List<Lot> getLots() {
        return Collections.unmodifiableList(lots);
    }

    public List<Mutation> getMutations() {
        return Collections.unmodifiableList(mutations);
    }

    public List<MutationBien> getAssociations() {
        return Collections.unmodifiableList(associations);
    }

    public boolean isEmpty() {
        return localisations.isEmpty() && biens.isEmpty() && lots.isEmpty()
                && mutations.isEmpty() && associations.isEmpty();
    }
}
