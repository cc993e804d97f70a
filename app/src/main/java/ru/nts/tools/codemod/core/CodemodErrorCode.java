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
package ru.nts.tools.codemod.core;

import java.util.Map;

/**
 * Structured error codes for codemod batches.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of the rendered form:
 * <pre>
 * [ERROR: CONTAINER_NOT_FOUND]
 * Message: Container chain does not resolve
 * Solution: Declare container 'Parser' first or fix the dotted path 'Parser.parse'.
 * Context: file=src/app.py, target=Parser.parse
 * </pre>
 */
public enum CodemodErrorCode {

    // ============ Structural Patch Errors ============

    MALFORMED_FRAGMENT("Replacement fragment is malformed",
            "The fragment must parse on its own and consist of declarations only (def, class, or NAME = value)."),

    MALFORMED_SOURCE("Source file does not parse",
            "Fix the syntax errors in %file% before applying structural edits to it."),

    TARGET_NOT_FOUND("Declaration not found",
            "Nothing named '%target%' exists at that scope. Check the dotted path or enable best-effort deletes."),

    CONTAINER_NOT_FOUND("Container chain does not resolve",
            "Declare container '%container%' first or fix the dotted path '%target%'."),

    AMBIGUOUS_KIND("Declaration kind cannot be inferred",
            "The fragment must contain a def, class, or a single-name assignment."),

    PATCH_CONFLICT("Replacement could not be verified",
            "The declaration '%target%' was not in the expected state after replacement. Inspect %file% manually."),

    UNSUPPORTED_LANGUAGE("Unsupported source language",
            "Structural edits are supported for Python sources (.py, .pyi, .pyw)."),

    // ============ Version Control Errors ============

    REPOSITORY_UNAVAILABLE("Version control is unavailable",
            "Run inside a git repository with at least one commit and configure user.name and user.email."),

    CHECKPOINT_FAILURE("Checkpoint could not be created",
            "The batch was refused before any change. Check 'git status' and repository permissions."),

    STAGING_FAILURE("File could not be staged",
            "Check that '%path%' is inside the repository and not ignored."),

    COMMIT_FAILURE("Commit after modifications failed",
            "Working tree is modified but uncommitted. Commit manually or roll back to %checkpoint%."),

    ROLLBACK_FAILURE("Rollback failed",
            "Inspect the repository state and run 'git reset --hard %commit%' manually if appropriate."),

    NO_ROLLBACK_POINT("No rollback point recorded",
            "Apply a modification set first; the rollback point is stored in .modification_rollback.json."),

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check the path '%path%'."),

    DIRECTORY_NOT_EMPTY("Directory is not empty",
            "Pass recursive=true to remove '%path%' with its contents."),

    PATH_OUTSIDE_ROOT("Path is outside of the working directory",
            "Use paths relative to the working root %root%."),

    SEARCH_TEXT_NOT_FOUND("Search text not found",
            "The text to replace does not occur in '%path%'."),

    IO_ERROR("I/O error",
            "Check file permissions and disk space."),

    INTERNAL_ERROR("Internal error",
            "Unexpected failure: %reason%. The batch was treated as failed."),

    // ============ Batch Description Errors ============

    INVALID_STANZA("Invalid modification stanza",
            "Operation '%operation%' expects: %expected%."),

    UNKNOWN_OPERATION("Unknown modification operation",
            "Supported operations: %supported%.");

    private final String message;
    private final String solution;

    CodemodErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (file, target, path, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
