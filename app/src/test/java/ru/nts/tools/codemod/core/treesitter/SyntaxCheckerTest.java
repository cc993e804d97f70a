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
package ru.nts.tools.codemod.core.treesitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxCheckerTest {

    @Test
    void validPythonHasNoErrors() {
        SyntaxChecker.SyntaxCheckResult result = SyntaxChecker.checkPython("""
                import os


                class Valid:
                    def method(self):
                        return os.getcwd()
                """);
        assertFalse(result.hasErrors(), "Valid Python should have no errors: " + result.errors());
        assertEquals("", result.firstError());
    }

    @Test
    void brokenSignatureIsReportedWithLine() {
        SyntaxChecker.SyntaxCheckResult result = SyntaxChecker.checkPython("x = 1\n\ndef broken(:\n    pass\n");
        assertTrue(result.hasErrors());
        SyntaxChecker.SyntaxError error = result.errors().get(0);
        assertTrue(error.line() >= 3, "Error should point at the broken def: " + error);
    }

    @Test
    void emptySourceIsValid() {
        assertFalse(SyntaxChecker.checkPython("").hasErrors());
    }

    @Test
    void parserIsSharedPerThread() {
        assertSame(TreeSitterManager.getInstance(), TreeSitterManager.getInstance());
        assertThrows(IllegalArgumentException.class, () -> TreeSitterManager.getInstance().getLanguage("cobol"));
    }
}
