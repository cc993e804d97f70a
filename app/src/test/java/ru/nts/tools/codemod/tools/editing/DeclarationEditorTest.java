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
package ru.nts.tools.codemod.tools.editing;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.syntax.Fragment;
import ru.nts.tools.codemod.core.syntax.LexicalPath;
import ru.nts.tools.codemod.core.syntax.NodeKind;
import ru.nts.tools.codemod.core.syntax.PythonTreeBuilder;
import ru.nts.tools.codemod.core.syntax.SyntaxNode;
import ru.nts.tools.codemod.core.syntax.Target;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты структурного редактора деклараций.
 */
class DeclarationEditorTest {

    private final DeclarationEditor editor = new DeclarationEditor("test.py");

    @Nested
    class EmptyModule {

        @Test
        void insertIntoEmptyModule() {
            EditResult result = editor.insert("", Target.of("foo"), "def foo():\n    return 1");
            assertEquals("def foo():\n    return 1\n", result.content());
            assertEquals(EditState.SERIALIZED, result.state());
        }

        @Test
        void replaceThenDeleteLeavesEmptyFile() {
            String inserted = editor.insert("", Target.of("foo"), "def foo():\n    return 1").content();
            EditResult replaced = editor.replace(inserted, Target.of("foo"), "def foo():\n    return 2");
            assertEquals("def foo():\n    return 2\n", replaced.content());
            assertTrue(replaced.replaced());
            assertEquals(1, replaced.matchCount());

            EditResult deleted = editor.delete(replaced.content(), Target.of("foo"));
            assertEquals("", deleted.content());
        }
    }

    @Nested
    class Replace {

        @Test
        void replacesMethodInsideClass() {
            String source = """
                    class A:
                        def b(self):
                            return 1

                        def c(self):
                            return 2
                    """;
            EditResult result = editor.replace(source, Target.of("A.b"), "def b(self):\n    return 10");
            assertEquals("""
                    class A:
                        def b(self):
                            return 10

                        def c(self):
                            return 2
                    """, result.content());
            assertFalse(result.fallback());
        }

        @Test
        void missingTargetIsInserted() {
            EditResult result = editor.replace("def a():\n    pass\n", Target.of("new_func"), "def new_func():\n    return 1");
            assertFalse(result.replaced());
            assertEquals(0, result.matchCount());
            assertEquals("def a():\n    pass\n\n\ndef new_func():\n    return 1\n", result.content());
        }

        @Test
        void duplicatesCollapseIntoOne() {
            String source = """
                    def helper():
                        return 1


                    def helper():
                        return 2


                    def helper():
                        return 3
                    """;
            EditResult result = editor.replace(source, Target.of("helper"), "def helper():\n    return 42");
            assertEquals(3, result.matchCount());
            assertEquals("def helper():\n    return 42\n", result.content());
        }

        @Test
        void bindingIsReplacedInPlace() {
            EditResult result = editor.replace("X = 1\nY = 2\n", Target.of("X"), "X = 42");
            assertEquals("X = 42\nY = 2\n", result.content());
        }

        @Test
        void decoratorsAreReplacedWithTheDefinition() {
            String source = """
                    import functools


                    @functools.lru_cache
                    def cached(x):
                        return x
                    """;
            EditResult result = editor.replace(source, Target.of("cached"),
                    "@functools.cache\ndef cached(x):\n    return x * 2");
            assertEquals("""
                    import functools


                    @functools.cache
                    def cached(x):
                        return x * 2
                    """, result.content());
        }

        @Test
        void attachedCommentsSurviveReplacementWithoutComments() {
            String source = "# helper docs\ndef helper():\n    return 1\n";
            EditResult result = editor.replace(source, Target.of("helper"), "def helper():\n    return 2");
            assertEquals("# helper docs\ndef helper():\n    return 2\n", result.content());
        }

        @Test
        void fragmentCommentsReplaceAttachedComments() {
            String source = "# helper docs\ndef helper():\n    return 1\n";
            String fragment = "# new docs\ndef helper():\n    return 3";
            String once = editor.replace(source, Target.of("helper"), fragment).content();
            String twice = editor.replace(once, Target.of("helper"), fragment).content();
            assertEquals("# new docs\ndef helper():\n    return 3\n", once);
            assertEquals(once, twice);
        }

        @Test
        void replacementIsIdempotent() {
            String source = "class A:\n    def b(self):\n        return 1\n";
            String fragment = "    def b(self):\n        return 5\n";
            String once = editor.replace(source, Target.of("A.b"), fragment).content();
            String twice = editor.replace(once, Target.of("A.b"), fragment).content();
            assertEquals(once, twice);
        }

        @Test
        void siblingsOfMultiDeclarationFragmentFollowThePrimary() {
            String source = """
                    def first():
                        return 1


                    def third():
                        return 3
                    """;
            String fragment = """
                    def first():
                        return 10


                    def second():
                        return 2
                    """;
            EditResult result = editor.replace(source, Target.of("first"), fragment);
            assertEquals("""
                    def first():
                        return 10


                    def second():
                        return 2


                    def third():
                        return 3
                    """, result.content());
        }

        @Test
        void conditionalDefinitionsCollapseIntoOne() {
            String source = """
                    import sys

                    if sys.platform == 'win32':
                        def foo():
                            return 1
                    else:
                        def foo():
                            return 2
                    """;
            EditResult result = editor.replace(source, Target.of("foo"), "def foo():\n    return 3");
            assertEquals("""
                    import sys

                    if sys.platform == 'win32':
                        def foo():
                            return 3
                    else:
                        pass
                    """, result.content());
            assertTrue(result.replaced());
            assertEquals(2, result.matchCount());
        }

        @Test
        void fallbackDefinitionInExceptBranchIsReplacedInPlace() {
            String source = """
                    try:
                        from fast import helper
                    except ImportError:
                        def helper(value):
                            return value
                    """;
            EditResult result = editor.replace(source, Target.of("helper"), "def helper(value):\n    return value * 2");
            assertEquals("""
                    try:
                        from fast import helper
                    except ImportError:
                        def helper(value):
                            return value * 2
                    """, result.content());
        }

        @Test
        void reinsertionTakesPlaceOfEmptiedBody() {
            String source = "class A:\n    def m(self):\n        return 1\n\n    def m(self):\n        return 2\n";
            Fragment fragment = Fragment.parse("def m(self):\n    return 3");
            String result = editor.place(PythonTreeBuilder.build(source), LexicalPath.parse("A.m"),
                    NodeKind.CALLABLE, fragment, fragment.first(), true);
            assertEquals("class A:\n    def m(self):\n        return 3\n", result);
        }

        @Test
        void crlfLineEndingsArePreserved() {
            EditResult result = editor.replace("def a():\r\n    return 1\r\n", Target.of("a"), "def a():\n    return 2");
            assertEquals("def a():\r\n    return 2\r\n", result.content());
        }

        @Test
        void fragmentWithoutTargetNameIsRejected() {
            CodemodException e = assertThrows(CodemodException.class,
                    () -> editor.replace("def a():\n    pass\n", Target.of("a"), "def b():\n    pass\n\n\ndef c():\n    pass"));
            assertEquals(CodemodErrorCode.MALFORMED_FRAGMENT, e.getCode());
        }

        @Test
        void malformedSourceIsReported() {
            CodemodException e = assertThrows(CodemodException.class,
                    () -> editor.replace("def broken(:\n", Target.of("broken"), "def broken():\n    pass"));
            assertEquals(CodemodErrorCode.MALFORMED_SOURCE, e.getCode());
            assertEquals(EditState.MALFORMED.name(), e.getContext().get("state"));
        }
    }

    @Nested
    class Insert {

        @Test
        void insertsBeforeMainGuard() {
            String source = """
                    import os


                    def existing():
                        pass


                    if __name__ == "__main__":
                        existing()
                    """;
            EditResult result = editor.insert(source, Target.of("new_func"), "def new_func():\n    return 1");
            assertEquals("""
                    import os


                    def existing():
                        pass


                    def new_func():
                        return 1


                    if __name__ == "__main__":
                        existing()
                    """, result.content());
        }

        @Test
        void insertsBeforeExecutableCodeAfterDeclarations() {
            String source = "def existing():\n    pass\n\nprint(\"hello\")\n";
            EditResult result = editor.insert(source, Target.of("new_func"), "def new_func():\n    return 1");
            assertEquals("def existing():\n    pass\n\n\ndef new_func():\n    return 1\n\n\nprint(\"hello\")\n",
                    result.content());
        }

        @Test
        void appendsToClassBody() {
            String source = "class A:\n    def b(self):\n        return 1\n";
            EditResult result = editor.insert(source, Target.of("A.c"), "def c(self):\n    return 'ok'");
            assertEquals("class A:\n    def b(self):\n        return 1\n\n    def c(self):\n        return 'ok'\n",
                    result.content());
        }

        @Test
        void expandsInlineBody() {
            EditResult result = editor.insert("class B: pass\n", Target.of("B.m"), "def m(self):\n    return 1");
            assertEquals("class B:\n    pass\n\n    def m(self):\n        return 1\n", result.content());
        }

        @Test
        void unknownContainerIsReported() {
            CodemodException e = assertThrows(CodemodException.class,
                    () -> editor.insert("class A:\n    pass\n", Target.of("Missing.m"), "def m(self):\n    pass"));
            assertEquals(CodemodErrorCode.CONTAINER_NOT_FOUND, e.getCode());
            assertEquals("test.py", e.getContext().get("file"));
        }

        @Test
        void markerIsTheGuardBlock() {
            var tree = PythonTreeBuilder.build("import os\n\n\ndef f():\n    pass\n\n\nif __name__ == '__main__':\n    f()\n");
            SyntaxNode marker = DeclarationEditor.insertionMarker(tree);
            assertNotNull(marker);
            assertEquals(NodeKind.GUARD, marker.kind());
        }

        @Test
        void headerStatementsAreNotMarkers() {
            var tree = PythonTreeBuilder.build("import os\nprint('setup')\n\n\ndef f():\n    pass\n");
            assertNull(DeclarationEditor.insertionMarker(tree));
        }
    }

    @Nested
    class Delete {

        @Test
        void deletesMethodAndKeepsSibling() {
            String source = "class A:\n    def b(self):\n        return 1\n\n    def c(self):\n        return 'ok'\n";
            EditResult result = editor.delete(source, Target.of("A.b"));
            assertEquals("class A:\n    def c(self):\n        return 'ok'\n", result.content());
        }

        @Test
        void insertThenDeleteOriginalMethod() {
            String source = "class A:\n    def b(self):\n        return 1\n";
            String inserted = editor.insert(source, Target.of("A.c"), "def c(self):\n    return 'ok'").content();
            String deleted = editor.delete(inserted, Target.of("A.b")).content();
            assertEquals("class A:\n    def c(self):\n        return 'ok'\n", deleted);
        }

        @Test
        void emptiedBodyGetsPass() {
            EditResult result = editor.delete("class A:\n    def b(self):\n        return 1\n", Target.of("A.b"));
            assertEquals("class A:\n    pass\n", result.content());
        }

        @Test
        void moduleLevelDeleteLeavesNestedNamesake() {
            String source = """
                    def helper():
                        return "module"


                    class A:
                        def helper(self):
                            return "method"
                    """;
            EditResult result = editor.delete(source, Target.of("helper"));
            assertEquals("class A:\n    def helper(self):\n        return \"method\"\n", result.content());
            assertEquals(1, result.matchCount());
        }

        @Test
        void containerDeleteLeavesDeeperNamesake() {
            String source = """
                    class A:
                        def m(self):
                            return 1

                        class B:
                            def m(self):
                                return 2
                    """;
            EditResult result = editor.delete(source, Target.of("A.m"));
            assertEquals("""
                    class A:
                        class B:
                            def m(self):
                                return 2
                    """, result.content());
            assertEquals(1, result.matchCount());
        }

        @Test
        void deletesConditionalDefinitions() {
            String source = "if FAST:\n    def foo():\n        return 1\nelse:\n    def foo():\n        return 2\n";
            EditResult result = editor.delete(source, Target.of("foo"));
            assertEquals(EditState.SERIALIZED, result.state());
            assertEquals(2, result.matchCount());
            assertEquals("if FAST:\n    pass\nelse:\n    pass\n", result.content());
        }

        @Test
        void branchKeepsRemainingStatements() {
            String source = "if DEBUG:\n    def trace(msg):\n        print(msg)\n\n    LEVEL = 1\n";
            EditResult result = editor.delete(source, Target.of("trace"));
            assertEquals("if DEBUG:\n    LEVEL = 1\n", result.content());
        }

        @Test
        void entryPointBodyIsNotSearched() {
            String source = "if __name__ == \"__main__\":\n    def helper():\n        return 1\n    helper()\n";
            EditResult result = editor.delete(source, Target.of("helper"));
            assertEquals(EditState.NOT_FOUND, result.state());
            assertEquals(source, result.content());
        }

        @Test
        void deletesBinding() {
            EditResult result = editor.delete("X = 1\nY = 2\n", Target.of("Y"));
            assertEquals("X = 1\n", result.content());
        }

        @Test
        void missingTargetLeavesSourceUntouched() {
            String source = "def a():\n    pass\n";
            EditResult result = editor.delete(source, Target.of("b"));
            assertEquals(EditState.NOT_FOUND, result.state());
            assertFalse(result.isFound());
            assertSame(source, result.content());
        }
    }

    @Nested
    class Header {

        @Test
        void replacesEverythingAboveFirstDefinition() {
            String source = "import os\nOLD = 1\n\ndef f():\n    pass\n";
            EditResult result = editor.replaceHeader(source, "import sys\nNEW = 2");
            assertEquals("import sys\nNEW = 2\n\n\ndef f():\n    pass\n", result.content());
        }

        @Test
        void declarationsGoAfterNewHeader() {
            String withHeader = editor.replaceHeader("def old_func():\n    pass\n",
                    "#!/usr/bin/env python3\nimport json\n\nAPI_BASE = 'https://api.example.com'").content();
            String content = editor.insert(withHeader, Target.of("fetch"), "def fetch():\n    return API_BASE").content();
            assertTrue(content.startsWith("#!/usr/bin/env python3\nimport json"));
            assertTrue(content.indexOf("API_BASE =") < content.indexOf("def old_func"));
            assertTrue(content.indexOf("def old_func") < content.indexOf("def fetch"));
        }

        @Test
        void headerOnlyModuleIsReplacedWhole() {
            assertEquals("import sys\n", editor.replaceHeader("import os\nX = 1\n", "import sys").content());
        }

        @Test
        void malformedHeaderIsRejected() {
            CodemodException e = assertThrows(CodemodException.class,
                    () -> editor.replaceHeader("import os\n", "def (:"));
            assertEquals(CodemodErrorCode.MALFORMED_FRAGMENT, e.getCode());
        }
    }
}
