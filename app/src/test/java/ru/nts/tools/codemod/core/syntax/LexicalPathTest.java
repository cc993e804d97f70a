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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexicalPathTest {

    @Test
    void bareNameAddressesModuleLevel() {
        LexicalPath path = LexicalPath.parse("helper");
        assertEquals("helper", path.name());
        assertTrue(path.chain().isEmpty());
        assertTrue(path.isModuleLevel());
    }

    @Test
    void dottedPathSplitsIntoChainAndName() {
        LexicalPath path = LexicalPath.parse("Outer.Inner.method");
        assertEquals("method", path.name());
        assertEquals(List.of("Outer", "Inner"), path.chain());
        assertEquals("Outer.Inner.method", path.toString());
    }

    @Test
    void siblingKeepsTheChain() {
        LexicalPath sibling = LexicalPath.parse("A.b").withName("c");
        assertEquals("A.c", sibling.toString());
    }

    @Test
    void emptySegmentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> LexicalPath.parse("A..b"));
        assertThrows(IllegalArgumentException.class, () -> LexicalPath.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> LexicalPath.parse(null));
    }

    @Test
    void targetKindMustBeDeclaration() {
        assertThrows(IllegalArgumentException.class, () -> new Target(LexicalPath.parse("x"), NodeKind.IMPORT));
        assertEquals(NodeKind.BINDING, Target.of("x").withKind(NodeKind.BINDING).kind());
    }
}
