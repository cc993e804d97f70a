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

class PythonTreeBuilderTest {

    @Test
    void classifiesModuleStatements() {
        SyntaxTree tree = PythonTreeBuilder.build("""
                import os
                from pathlib import Path
                LIMIT: int = 10
                counter += 1


                @decorator
                def run():
                    pass


                class Service:
                    pass


                if __name__ == "__main__":
                    run()
                """);
        List<NodeKind> kinds = tree.roots().stream().map(SyntaxNode::kind).toList();
        assertEquals(List.of(NodeKind.IMPORT, NodeKind.IMPORT, NodeKind.BINDING, NodeKind.STATEMENT,
                NodeKind.CALLABLE, NodeKind.CONTAINER, NodeKind.GUARD), kinds);
        assertEquals("LIMIT", tree.roots().get(2).name());
        assertFalse(tree.isMalformed());
    }

    @Test
    void decoratedDefinitionStartsAtDecorator() {
        SyntaxTree tree = PythonTreeBuilder.build("@property\ndef value(self):\n    return 1\n");
        SyntaxNode node = tree.roots().get(0);
        assertEquals("value", node.name());
        assertEquals(0, node.startByte());
        assertTrue(tree.text(node).startsWith("@property"));
    }

    @Test
    void adjacentCommentsAreAttached() {
        SyntaxTree tree = PythonTreeBuilder.build("x = 1\n\n# about f\n# more\ndef f():\n    pass\n");
        SyntaxNode f = tree.roots().get(1);
        assertEquals("# about f\n# more\ndef f():\n    pass", tree.slice(f.triviaStart(), f.endByte()));
    }

    @Test
    void detachedCommentIsNotAttached() {
        SyntaxTree tree = PythonTreeBuilder.build("# detached\n\ndef f():\n    pass\n");
        SyntaxNode f = tree.roots().get(0);
        assertEquals(f.startByte(), f.triviaStart());
    }

    @Test
    void nestedBodiesFormTheArena() {
        SyntaxTree tree = PythonTreeBuilder.build("class A:\n    X = 1\n\n    def m(self):\n        pass\n");
        SyntaxNode a = tree.roots().get(0);
        List<SyntaxNode> body = tree.children(a.index());
        assertEquals(2, body.size());
        assertEquals("    ", body.get(1).indent());
        assertEquals(List.of("A"), tree.chainOf(body.get(1)));
        assertFalse(a.inlineBody());
    }

    @Test
    void branchStatementsKeepEnclosingScope() {
        SyntaxTree tree = PythonTreeBuilder.build("""
                class A:
                    try:
                        import fast
                    except ImportError:
                        def helper(self):
                            pass
                    with lock:
                        LIMIT = 1
                """);
        SyntaxNode a = tree.roots().get(0);
        List<SyntaxNode> members = tree.members(a.index());
        List<String> declared = members.stream().filter(SyntaxNode::isDeclaration).map(SyntaxNode::name).toList();
        assertEquals(List.of("helper", "LIMIT"), declared);
        SyntaxNode helper = members.stream().filter(n -> "helper".equals(n.name())).findFirst().orElseThrow();
        assertEquals(List.of("A"), tree.chainOf(helper));
        assertEquals(List.of(helper), tree.siblings(helper));
        assertEquals(2, tree.children(a.index()).size());
    }

    @Test
    void chainedAssignmentIsNamedAfterFirstTarget() {
        SyntaxNode node = PythonTreeBuilder.build("a = b = 1\n").roots().get(0);
        assertEquals(NodeKind.BINDING, node.kind());
        assertEquals("a", node.name());
    }

    @Test
    void inlineBodyIsDetected() {
        SyntaxNode node = PythonTreeBuilder.build("class B: pass\n").roots().get(0);
        assertTrue(node.inlineBody());
    }

    @Test
    void brokenSourceIsMalformed() {
        assertTrue(PythonTreeBuilder.build("def broken(:\n").isMalformed());
    }

    @Test
    void editsAreAppliedFromTheEnd() {
        SyntaxTree tree = PythonTreeBuilder.build("a = 1\nb = 2\n");
        String result = tree.apply(List.of(new SourceEdit(0, 5, "a = 10"), new SourceEdit(6, 11, "b = 20")));
        assertEquals("a = 10\nb = 20\n", result);
        assertThrows(IllegalStateException.class,
                () -> tree.apply(List.of(new SourceEdit(0, 5, "x"), new SourceEdit(3, 8, "y"))));
    }
}
