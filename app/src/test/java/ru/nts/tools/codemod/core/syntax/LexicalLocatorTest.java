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

import org.junit.jupiter.api.Test;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Поиск деклараций учитывает точную цепочку областей.
 */
class LexicalLocatorTest {

    private static final String SOURCE = """
            def helper():
                return "module"


            class A:
                def helper(self):
                    return "method"

                class Inner:
                    def helper(self):
                        return "inner"


            def outer():
                def helper():
                    return "local"
                return helper()
            """;

    private final SyntaxTree tree = PythonTreeBuilder.build(SOURCE);

    @Test
    void moduleLevelRequestIgnoresNestedNamesakes() {
        List<SyntaxNode> matches = LexicalLocator.findAll(tree, LexicalPath.parse("helper"), null);
        assertEquals(1, matches.size());
        assertTrue(matches.get(0).isModuleLevel());
        assertEquals(0, matches.get(0).startRow());
    }

    @Test
    void chainSelectsOneScope() {
        assertEquals(1, LexicalLocator.findAll(tree, LexicalPath.parse("A.helper"), NodeKind.CALLABLE).size());
        assertEquals(1, LexicalLocator.findAll(tree, LexicalPath.parse("A.Inner.helper"), null).size());
        assertEquals(1, LexicalLocator.findAll(tree, LexicalPath.parse("outer.helper"), null).size());
    }

    @Test
    void kindFiltersMatches() {
        assertTrue(LexicalLocator.findAll(tree, LexicalPath.parse("A"), NodeKind.CALLABLE).isEmpty());
        assertTrue(LexicalLocator.exists(tree, LexicalPath.parse("A"), NodeKind.CONTAINER));
    }

    @Test
    void allDuplicatesAreReported() {
        SyntaxTree duplicates = PythonTreeBuilder.build("def f():\n    pass\n\n\ndef f():\n    pass\n");
        assertEquals(2, LexicalLocator.findAll(duplicates, LexicalPath.parse("f"), null).size());
    }

    @Test
    void resolveScopeWalksTheChain() {
        int scope = LexicalLocator.resolveScope(tree, LexicalPath.parse("A.Inner.x"));
        assertEquals("Inner", tree.node(scope).name());
        assertEquals(SyntaxNode.MODULE, LexicalLocator.resolveScope(tree, LexicalPath.parse("x")));
    }

    @Test
    void unresolvedChainNamesTheMissingContainer() {
        CodemodException e = assertThrows(CodemodException.class,
                () -> LexicalLocator.resolveScope(tree, LexicalPath.parse("A.Missing.x")));
        assertEquals(CodemodErrorCode.CONTAINER_NOT_FOUND, e.getCode());
        assertEquals("A.Missing", e.getContext().get("container"));
    }
}
