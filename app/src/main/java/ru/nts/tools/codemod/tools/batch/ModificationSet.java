/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.codemod.tools.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Упорядоченный пакет операций, применяемый как одна транзакция.
 */
public final class ModificationSet {

    private final List<Modification> modifications;

    public ModificationSet(List<Modification> modifications) {
        this.modifications = List.copyOf(modifications);
    }

    public static ModificationSet of(Modification... modifications) {
        List<Modification> list = new ArrayList<>();
        Collections.addAll(list, modifications);
        return new ModificationSet(list);
    }

    public List<Modification> modifications() {
        return modifications;
    }

    public int size() {
        return modifications.size();
    }

    public boolean isEmpty() {
        return modifications.isEmpty();
    }
}
