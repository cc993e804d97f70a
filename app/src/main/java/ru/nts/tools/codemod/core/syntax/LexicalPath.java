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
package ru.nts.tools.codemod.core.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dotted declaration path split into the target name and its containment chain.
 * {@code "A.B.method"} becomes name {@code method} with chain {@code [A, B]};
 * a bare name has an empty chain and addresses the module level.
 *
 * @param name  declared name
 * @param chain names of the enclosing classes/functions, outermost first
 */
public record LexicalPath(String name, List<String> chain) {

    public LexicalPath {
        chain = List.copyOf(chain);
    }

    public static LexicalPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new IllegalArgumentException("Declaration path is empty");
        }
        List<String> parts = Arrays.asList(dotted.strip().split("\\.", -1));
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Invalid declaration path: '" + dotted + "'");
            }
        }
        List<String> trimmed = new ArrayList<>(parts.size());
        for (String part : parts) {
            trimmed.add(part.strip());
        }
        return new LexicalPath(trimmed.get(trimmed.size() - 1), trimmed.subList(0, trimmed.size() - 1));
    }

    public boolean isModuleLevel() {
        return chain.isEmpty();
    }

    /**
     * Sibling path: same chain, different name.
     */
    public LexicalPath withName(String otherName) {
        return new LexicalPath(otherName, chain);
    }

    @Override
    public String toString() {
        return chain.isEmpty() ? name : String.join(".", chain) + "." + name;
    }
}
