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
package ru.nts.tools.codemod;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.vcs.RollbackOption;
import ru.nts.tools.codemod.core.vcs.RollbackPoint;
import ru.nts.tools.codemod.core.vcs.SnapshotManager;
import ru.nts.tools.codemod.tools.batch.ApplyOptions;
import ru.nts.tools.codemod.tools.batch.ApplyResult;
import ru.nts.tools.codemod.tools.batch.ModificationSet;
import ru.nts.tools.codemod.tools.batch.TransactionalApplyController;
import ru.nts.tools.codemod.tools.stanza.ModificationFactory;
import ru.nts.tools.codemod.tools.stanza.ModificationFileParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Точка входа командной строки.
 *
 * <pre>
 * codemod apply &lt;file&gt; [--manual-rollback] [--no-commit] [--best-effort-deletes] [--json] [--root &lt;dir&gt;]
 * codemod rollback [--root &lt;dir&gt;]
 * </pre>
 *
 * Корень рабочего дерева берется из {@code --root}, затем из переменной окружения {@code CODEMOD_ROOT},
 * иначе используется текущая директория. Отчеты печатаются в stdout, журнал пишется в stderr.
 */
public final class CodemodCli {

    private static final Logger log = LoggerFactory.getLogger(CodemodCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String ROOT_ENV = "CODEMOD_ROOT";

    private static final String USAGE = """
            Usage:
              codemod apply <modification-file> [--manual-rollback] [--no-commit] [--best-effort-deletes] [--json] [--root <dir>]
              codemod rollback [--root <dir>]
            """;

    private final PrintStream out;
    private final BufferedReader in;
    private final Map<String, String> env;
    private final Path cwd;

    CodemodCli(PrintStream out, InputStream in, Map<String, String> env, Path cwd) {
        this.out = out;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.env = env;
        this.cwd = cwd;
    }

    public static void main(String[] args) {
        // UTF-8 для stdout/stderr независимо от кодировки консоли
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        CodemodCli cli = new CodemodCli(System.out, System.in, System.getenv(), Paths.get("").toAbsolutePath());
        System.exit(cli.run(args));
    }

    int run(String[] args) {
        if (args.length == 0) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        switch (args[0]) {
            case "apply":
                return apply(args);
            case "rollback":
                return rollback(args);
            case "-h":
            case "--help":
            case "help":
                out.print(USAGE);
                return EXIT_OK;
            default:
                out.println("Unknown command: " + args[0]);
                out.print(USAGE);
                return EXIT_USAGE;
        }
    }

    private int apply(String[] args) {
        String file = null;
        String root = null;
        boolean json = false;
        ApplyOptions options = ApplyOptions.defaults();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manual-rollback" -> options = options.withAutoRollback(false);
                case "--no-commit" -> options = options.withAutoCommit(false);
                case "--best-effort-deletes" -> options = options.withBestEffortDeletes(true);
                case "--json" -> json = true;
                case "--root" -> {
                    if (i + 1 >= args.length) {
                        out.println("--root requires a directory");
                        return EXIT_USAGE;
                    }
                    root = args[++i];
                }
                default -> {
                    if (args[i].startsWith("--") || file != null) {
                        out.println("Unexpected argument: " + args[i]);
                        out.print(USAGE);
                        return EXIT_USAGE;
                    }
                    file = args[i];
                }
            }
        }
        if (file == null) {
            out.print(USAGE);
            return EXIT_USAGE;
        }

        Path workRoot = resolveRoot(root);
        Path modificationFile = cwd.resolve(file).normalize();
        if (!Files.isRegularFile(modificationFile)) {
            out.println("Modification file not found: " + modificationFile);
            return EXIT_USAGE;
        }

        ModificationSet modifications;
        try {
            modifications = ModificationFactory.create(ModificationFileParser.parse(modificationFile));
        } catch (CodemodException e) {
            out.println(e.toUserMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Cannot read {}", modificationFile, e);
            out.println("Cannot read modification file: " + e.getMessage());
            return EXIT_FAILED;
        }

        TransactionalApplyController controller = new TransactionalApplyController(workRoot);
        ApplyResult result = controller.apply(modifications, options);
        out.println(json ? result.toJson() : result.toText());
        if (result.isSuccess() && !json) {
            out.println("Modifications complete. Run 'codemod rollback' for rollback options.");
        }
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    private int rollback(String[] args) {
        String root = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--root") && i + 1 < args.length) {
                root = args[++i];
            } else {
                out.println("Unexpected argument: " + args[i]);
                out.print(USAGE);
                return EXIT_USAGE;
            }
        }

        SnapshotManager snapshots = new TransactionalApplyController(resolveRoot(root)).snapshots();
        RollbackPoint point;
        try {
            point = snapshots.lastCheckpoint();
        } catch (CodemodException e) {
            log.debug("No rollback point: {}", e.toLogMessage());
            out.println("No rollback data found");
            return EXIT_FAILED;
        }
        out.println(SnapshotManager.rollbackOptions(point));

        try {
            while (true) {
                String choice = prompt("\nEnter choice (1-4, or 'q' to quit): ");
                if (choice == null || choice.equals("q")) {
                    return EXIT_OK;
                }
                RollbackOption option = RollbackOption.fromChoice(choice);
                if (option == null) {
                    out.println("Invalid choice");
                    continue;
                }
                switch (option) {
                    case SOFT -> out.println("Soft rollback to " + snapshots.softRollback(point.snapshotId()));
                    case HARD -> out.println("Hard rollback to " + snapshots.hardRollback(point.snapshotId()));
                    case ABANDON -> {
                        String name = prompt("New branch name (or press Enter for auto): ");
                        String branch = snapshots.abandonToCheckpoint(point.snapshotId(), name == null || name.isBlank() ? null : name.strip());
                        out.println("Switched to new branch " + branch);
                    }
                    case FORCE_RESET -> {
                        String confirm = prompt("WARNING: This will permanently lose commits! Type 'yes' to confirm: ");
                        if (confirm == null || !confirm.equalsIgnoreCase("yes")) {
                            continue;
                        }
                        out.println("Branch reset to " + snapshots.forceResetBranch(point.snapshotId(), null));
                    }
                }
                return EXIT_OK;
            }
        } catch (CodemodException e) {
            out.println(e.toUserMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Cannot read from stdin", e);
            return EXIT_FAILED;
        }
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        String line = in.readLine();
        return line == null ? null : line.strip();
    }

    private Path resolveRoot(String root) {
        if (root != null && !root.isBlank()) {
            return cwd.resolve(root).toAbsolutePath().normalize();
        }
        String fromEnv = env.get(ROOT_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return cwd.resolve(fromEnv).toAbsolutePath().normalize();
        }
        return cwd;
    }
}
