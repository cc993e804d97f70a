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
 * Варианты отката, упорядоченные по разрушительности.
 */
public enum RollbackOption {
    SOFT(1, "Soft rollback", "git reset --soft (keeps changes staged)", "safe"),
    HARD(2, "Hard rollback", "git reset --hard (discards all changes)", "discards uncommitted work"),
    ABANDON(3, "Abandon current line", "creates new branch from rollback point", "safe, old branch kept"),
    FORCE_RESET(4, "Force reset branch", "DESTRUCTIVE, permanently loses commits", "destructive");

    private final int number;
    private final String title;
    private final String description;
    private final String destructiveness;

    RollbackOption(int number, String title, String description, String destructiveness) {
        this.number = number;
        this.title = title;
        this.description = description;
        this.destructiveness = destructiveness;
    }

    public int number() {
        return number;
    }

    public String destructiveness() {
        return destructiveness;
    }

    public boolean requiresConfirmation() {
        return this == FORCE_RESET;
    }

    public String menuLine() {
        return number + ". " + title + " - " + description + " [" + destructiveness + "]";
    }

    /**
     * @return option for a menu choice, {@code null} if the choice is not a number of an option
     */
    public static RollbackOption fromChoice(String choice) {
        for (RollbackOption option : values()) {
            if (String.valueOf(option.number).equals(choice.trim())) {
                return option;
            }
        }
        return null;
    }
}
