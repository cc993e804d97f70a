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
package ru.nts.tools.codemod.core.vcs;

/**
 * Режим {@code git reset}.
 */
public enum ResetMode {
    /** Указатель ветки переносится, изменения остаются в индексе. */
    SOFT("--soft"),
    /** Индекс и рабочее дерево приводятся к коммиту. */
    HARD("--hard");

    private final String flag;

    ResetMode(String flag) {
        this.flag = flag;
    }

    public String flag() {
        return flag;
    }
}
