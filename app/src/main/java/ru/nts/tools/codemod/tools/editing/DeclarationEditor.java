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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.CodemodErrorCode;
import ru.nts.tools.codemod.core.CodemodException;
import ru.nts.tools.codemod.core.syntax.Fragment;
import ru.nts.tools.codemod.core.syntax.LexicalLocator;
import ru.nts.tools.codemod.core.syntax.LexicalPath;
import ru.nts.tools.codemod.core.syntax.NodeKind;
import ru.nts.tools.codemod.core.syntax.PythonText;
import ru.nts.tools.codemod.core.syntax.PythonTreeBuilder;
import ru.nts.tools.codemod.core.syntax.SourceEdit;
import ru.nts.tools.codemod.core.syntax.SyntaxNode;
import ru.nts.tools.codemod.core.syntax.SyntaxTree;
import ru.nts.tools.codemod.core.syntax.Target;
import ru.nts.tools.codemod.core.treesitter.SyntaxChecker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Структурный редактор python-модуля: replace / insert / delete деклараций по лексическому пути
 * и замена заголовка модуля.
 *
 * <p>Каждый вызов строит дерево заново (parse → locate → mutate → serialize), изменения накладываются
 * байтовыми правками на исходный текст, поэтому форматирование вне затронутых деклараций сохраняется.
 * Результат replace подтверждается повторным разбором; если подтверждение не проходит, применяется
 * явная последовательность delete-then-insert, а при повторной неудаче операция завершается PATCH_CONFLICT.</p>
 *
 * <p>Экземпляр не хранит состояние между вызовами, {@code origin} используется только в контексте ошибок.</p>
 */
public final class DeclarationEditor {

    private static final Logger log = LoggerFactory.getLogger(DeclarationEditor.class);

    private static final String MODULE_GAP = "\n\n\n";
    private static final String MEMBER_GAP = "\n\n";
    private static final String BODY_STEP = "    ";

    private final String origin;

    public DeclarationEditor(String origin) {
        this.origin = origin;
    }

    /**
     * Replaces every declaration at {@code target} with the fragment's primary declaration.
     * The first match keeps its place and its attached comments, the others are removed.
     * If nothing matches, the fragment is inserted as by {@link #insert}.
     * Other declarations of the fragment are upserted into the same scope after the primary one.
     */
    public EditResult replace(String source, Target target, String fragmentText) {
        boolean crlf = source.contains("\r\n");
        String text = PythonText.normalizeNewlines(source);
        Fragment fragment = parseFragment(fragmentText, target);
        SyntaxTree tree = parseSource(text, target);

        Fragment.Declaration primary = fragment.primaryFor(target.name(), target.kind())
                .orElseThrow(() -> new CodemodException(CodemodErrorCode.MALFORMED_FRAGMENT,
                        context(target, "reason", "fragment does not declare " + target.name())));
        NodeKind kind = target.kind() != null ? target.kind() : primary.kind();
        LexicalPath path = target.path();

        // Единственный источник истины о наличии цели
        List<SyntaxNode> matches = LexicalLocator.findAll(tree, path, kind);
        boolean replaced = !matches.isEmpty();
        log.debug("{}: {} {} matched {} time(s)", origin, kind.label(), path, matches.size());

        String result = place(tree, path, kind, fragment, primary, false);
        boolean fallback = false;
        if (!verified(result, path, kind, primary)) {
            log.warn("{}: replacement of {} was not confirmed, retrying as delete-then-insert", origin, path);
            fallback = true;
            result = place(tree, path, kind, fragment, primary, true);
            if (!verified(result, path, kind, primary)) {
                throw new CodemodException(CodemodErrorCode.PATCH_CONFLICT, context(target));
            }
        }
        return new EditResult(finish(result, crlf), EditState.SERIALIZED, matches.size(), replaced, fallback);
    }

    /**
     * Appends every fragment declaration to the scope named by the target's chain.
     * At module level the declarations go before the trailing guard block or the first executable
     * statement that follows a declaration; inside a class or def they go after the last body statement.
     *
     * @throws CodemodException CONTAINER_NOT_FOUND if the chain does not resolve
     */
    public EditResult insert(String source, Target target, String fragmentText) {
        boolean crlf = source.contains("\r\n");
        String text = PythonText.normalizeNewlines(source);
        Fragment fragment = parseFragment(fragmentText, target);
        SyntaxTree tree = parseSource(text, target);

        String result = insertInto(tree, target.path(), fragment.declarations(), false);
        SyntaxTree check = PythonTreeBuilder.build(result);
        if (check.isMalformed()) {
            throw new CodemodException(CodemodErrorCode.PATCH_CONFLICT, context(target, "reason", check.syntax().firstError()));
        }
        return new EditResult(finish(result, crlf), EditState.SERIALIZED, 0, false, false);
    }

    /**
     * Removes every declaration at exactly {@code target}. A body left without statements gets {@code pass}.
     *
     * @return {@link EditState#NOT_FOUND} with the source untouched when nothing matches
     */
    public EditResult delete(String source, Target target) {
        boolean crlf = source.contains("\r\n");
        String text = PythonText.normalizeNewlines(source);
        SyntaxTree tree = parseSource(text, target);

        List<SyntaxNode> matches = LexicalLocator.findAll(tree, target.path(), target.kind());
        if (matches.isEmpty()) {
            log.debug("{}: nothing to delete at {}", origin, target);
            return EditResult.notFound(source);
        }
        String result = tree.apply(deletions(tree, matches));
        return new EditResult(finish(result, crlf), EditState.SERIALIZED, matches.size(), false, false);
    }

    /**
     * Replaces the module header: everything above the first class, def or guard block
     * (or the whole module when there is none). An empty header removes the region.
     */
    public EditResult replaceHeader(String source, String header) {
        boolean crlf = source.contains("\r\n");
        String text = PythonText.normalizeNewlines(source);
        SyntaxTree tree = parseSource(text, null);

        String newHeader = header == null ? "" : PythonText.canonical(header);
        if (!newHeader.isEmpty()) {
            SyntaxChecker.SyntaxCheckResult syntax = SyntaxChecker.checkPython(newHeader);
            if (syntax.hasErrors()) {
                throw new CodemodException(CodemodErrorCode.MALFORMED_FRAGMENT,
                        Map.of("reason", syntax.firstError(), "file", origin));
            }
        }

        Optional<SyntaxNode> firstBody = tree.roots().stream().filter(n -> n.kind().endsHeader()).findFirst();
        String result;
        if (firstBody.isPresent()) {
            String rest = tree.slice(tree.lineStart(firstBody.get().triviaStart()), tree.length());
            result = (newHeader.isEmpty() ? "" : newHeader + MODULE_GAP) + rest;
        } else {
            result = newHeader;
        }
        return new EditResult(finish(result, crlf), EditState.SERIALIZED, 0, false, false);
    }

    // ---- replace ----

    /**
     * Substitutes or inserts the primary declaration, then upserts the siblings one at a time.
     *
     * @param reinsert delete all matches first and insert the primary declaration anew
     */
    String place(SyntaxTree tree, LexicalPath path, NodeKind kind, Fragment fragment,
                         Fragment.Declaration primary, boolean reinsert) {
        String result;
        List<SyntaxNode> matches = LexicalLocator.findAll(tree, path, kind);
        if (reinsert) {
            String cleared = matches.isEmpty() ? tree.source() : tree.apply(deletions(tree, matches));
            result = insertInto(PythonTreeBuilder.build(cleared), path, List.of(primary), true);
        } else if (!matches.isEmpty()) {
            result = substitute(tree, matches, primary);
        } else {
            result = insertInto(tree, path, List.of(primary), false);
        }

        Fragment.Declaration anchor = primary;
        for (Fragment.Declaration sibling : fragment.declarations()) {
            if (sibling == primary) {
                continue;
            }
            SyntaxTree current = PythonTreeBuilder.build(result);
            List<SyntaxNode> existing = LexicalLocator.findAll(current, path.withName(sibling.name()), sibling.kind());
            if (!existing.isEmpty()) {
                result = substitute(current, existing, sibling);
            } else {
                List<SyntaxNode> anchors = LexicalLocator.findAll(current, path.withName(anchor.name()), anchor.kind());
                result = anchors.isEmpty()
                        ? insertInto(current, path, List.of(sibling), false)
                        : insertAfter(current, anchors.get(anchors.size() - 1), sibling);
            }
            anchor = sibling;
        }
        return result;
    }

    private String substitute(SyntaxTree tree, List<SyntaxNode> matches, Fragment.Declaration declaration) {
        SyntaxNode first = matches.get(0);
        // Комментарии фрагмента заменяют прикрепленные комментарии, иначе последние сохраняются
        int start = declaration.text().equals(declaration.coreText()) ? first.startByte() : first.triviaStart();
        List<SourceEdit> edits = new ArrayList<>();
        edits.add(new SourceEdit(start, first.endByte(),
                PythonText.indent(declaration.text(), first.indent(), true)));
        if (matches.size() > 1) {
            edits.addAll(deletions(tree, matches.subList(1, matches.size())));
        }
        return tree.apply(edits);
    }

    /**
     * Re-parses the result and checks that the primary declaration is present exactly once with the fragment's text
     * and that a renamed target no longer exists.
     */
    private boolean verified(String result, LexicalPath path, NodeKind kind, Fragment.Declaration primary) {
        SyntaxTree tree = PythonTreeBuilder.build(result);
        if (tree.isMalformed()) {
            log.debug("{}: result does not parse: {}", origin, tree.syntax().firstError());
            return false;
        }
        List<SyntaxNode> placed = LexicalLocator.findAll(tree, path.withName(primary.name()), primary.kind());
        String expected = PythonText.canonical(primary.coreText());
        boolean content = placed.stream()
                .anyMatch(n -> PythonText.canonical(n.indent() + tree.text(n)).equals(expected));
        if (!content) {
            return false;
        }
        if (primary.name().equals(path.name()) && primary.kind() == kind) {
            return placed.size() == 1;
        }
        return LexicalLocator.findAll(tree, path, kind).isEmpty();
    }

    // ---- insert ----

    /**
     * @param takePlaceholder a body that is only {@code pass} is replaced by the declarations instead of extended
     */
    private String insertInto(SyntaxTree tree, LexicalPath path, List<Fragment.Declaration> declarations,
                              boolean takePlaceholder) {
        int scope;
        try {
            scope = LexicalLocator.resolveScope(tree, path);
        } catch (CodemodException e) {
            Map<String, Object> ctx = new LinkedHashMap<>(e.getContext());
            ctx.put("file", origin);
            throw new CodemodException(e.getCode(), ctx, e);
        }
        if (scope == SyntaxNode.MODULE) {
            StringBuilder block = new StringBuilder();
            for (Fragment.Declaration declaration : declarations) {
                if (block.length() > 0) block.append(MODULE_GAP);
                block.append(declaration.text());
            }
            return insertAtModule(tree, block.toString());
        }
        return insertIntoScope(tree, tree.node(scope), declarations, takePlaceholder);
    }

    private String insertAtModule(SyntaxTree tree, String block) {
        SyntaxNode marker = insertionMarker(tree);
        if (marker != null) {
            int pos = tree.lineStart(marker.triviaStart());
            String prefix = tree.slice(0, pos).stripTrailing();
            String rest = tree.slice(pos, tree.length());
            return (prefix.isEmpty() ? "" : prefix + MODULE_GAP) + block + MODULE_GAP + rest;
        }
        String body = tree.source().stripTrailing();
        return (body.isEmpty() ? "" : body + MODULE_GAP) + block + "\n";
    }

    /**
     * Первый guard-блок либо первый исполняемый оператор после декларации; поиск начинается после заголовка.
     */
    static SyntaxNode insertionMarker(SyntaxTree tree) {
        boolean inHeader = true;
        boolean seenDeclaration = false;
        for (SyntaxNode node : tree.roots()) {
            if (inHeader && !node.kind().endsHeader()) {
                continue;
            }
            inHeader = false;
            if (node.kind() == NodeKind.GUARD) {
                return node;
            }
            if (node.isDeclaration()) {
                seenDeclaration = true;
            } else if (node.kind() == NodeKind.STATEMENT && seenDeclaration) {
                return node;
            }
        }
        return null;
    }

    private String insertIntoScope(SyntaxTree tree, SyntaxNode scope, List<Fragment.Declaration> declarations,
                                   boolean takePlaceholder) {
        List<SyntaxNode> body = tree.children(scope.index());
        String bodyIndent = scope.inlineBody() || body.isEmpty()
                ? scope.indent() + BODY_STEP
                : body.get(0).indent();

        StringBuilder block = new StringBuilder();
        for (Fragment.Declaration declaration : declarations) {
            if (block.length() > 0) block.append(MEMBER_GAP);
            block.append(PythonText.indent(declaration.text(), bodyIndent, false));
        }

        boolean placeholder = takePlaceholder && body.size() == 1 && tree.text(body.get(0)).equals("pass");
        if (scope.inlineBody()) {
            // class B: pass  ->  тело переносится на отдельные строки
            int start = scope.bodyStart();
            while (start > 0 && tree.slice(start - 1, start).equals(" ")) {
                start--;
            }
            String inline = tree.slice(scope.bodyStart(), scope.bodyEnd()).strip();
            String expanded = placeholder ? "\n" + block : "\n" + bodyIndent + inline + MEMBER_GAP + block;
            return tree.apply(List.of(new SourceEdit(start, scope.bodyEnd(), expanded)));
        }
        if (placeholder) {
            SyntaxNode pass = body.get(0);
            return tree.apply(List.of(new SourceEdit(tree.lineStart(pass.startByte()), pass.endByte(), block.toString())));
        }
        SyntaxNode last = body.get(body.size() - 1);
        return tree.apply(List.of(SourceEdit.insert(tree.lineEnd(last.endByte()), MEMBER_GAP + block)));
    }

    private String insertAfter(SyntaxTree tree, SyntaxNode anchor, Fragment.Declaration declaration) {
        String gap = anchor.block() == SyntaxNode.MODULE ? MODULE_GAP : MEMBER_GAP;
        String text = PythonText.indent(declaration.text(), anchor.indent(), false);
        return tree.apply(List.of(SourceEdit.insert(tree.lineEnd(anchor.endByte()), gap + text)));
    }

    // ---- delete ----

    /**
     * Deletion edits for the given nodes. Ranges of neighbouring nodes are merged;
     * a body or branch block that loses all its statements keeps a single {@code pass}.
     */
    private List<SourceEdit> deletions(SyntaxTree tree, List<SyntaxNode> nodes) {
        Set<Integer> doomed = new HashSet<>();
        nodes.forEach(n -> doomed.add(n.index()));

        List<SourceEdit> edits = new ArrayList<>();
        List<int[]> ranges = new ArrayList<>();
        Set<Integer> emptied = new HashSet<>();
        for (SyntaxNode node : nodes) {
            List<SyntaxNode> siblings = tree.siblings(node);
            if (node.block() != SyntaxNode.MODULE && siblings.stream().allMatch(c -> doomed.contains(c.index()))) {
                if (emptied.add(node.block())) {
                    edits.add(passEdit(tree, siblings));
                }
                continue;
            }
            ranges.add(deletionRange(tree, node));
        }

        ranges.sort(Comparator.comparingInt(r -> r[0]));
        int[] current = null;
        for (int[] range : ranges) {
            if (current != null && range[0] <= current[1]) {
                current[1] = Math.max(current[1], range[1]);
                continue;
            }
            if (current != null) {
                edits.add(SourceEdit.delete(current[0], current[1]));
            }
            current = range.clone();
        }
        if (current != null) {
            edits.add(SourceEdit.delete(current[0], current[1]));
        }
        return edits;
    }

    private int[] deletionRange(SyntaxTree tree, SyntaxNode node) {
        if (!tree.ownsLines(node)) {
            return new int[]{node.startByte(), node.endByte()};
        }
        int length = tree.length();
        int start = tree.lineStart(node.triviaStart());
        int end = tree.lineEnd(node.endByte());
        if (end < length) {
            end++;
        }
        boolean atTop = start == 0 || isFirstChild(tree, node) || tree.isBlank(tree.lineStart(start - 1), start);
        if (!atTop) {
            return new int[]{start, end};
        }
        if (hasNextSibling(tree, node)) {
            while (end < length) {
                int next = tree.lineEnd(end);
                if (!tree.isBlank(end, next)) {
                    break;
                }
                end = next < length ? next + 1 : next;
            }
        } else {
            // Последняя декларация в области: убираем пустые строки над ней
            while (start > 0) {
                int previous = tree.lineStart(start - 1);
                if (!tree.isBlank(previous, start)) {
                    break;
                }
                start = previous;
            }
        }
        return new int[]{start, end};
    }

    private static boolean isFirstChild(SyntaxTree tree, SyntaxNode node) {
        return tree.siblings(node).get(0).index() == node.index();
    }

    private static boolean hasNextSibling(SyntaxTree tree, SyntaxNode node) {
        List<SyntaxNode> siblings = tree.siblings(node);
        return siblings.get(siblings.size() - 1).index() != node.index();
    }

    private static SourceEdit passEdit(SyntaxTree tree, List<SyntaxNode> body) {
        SyntaxNode first = body.get(0);
        SyntaxNode last = body.get(body.size() - 1);
        if (!tree.ownsLines(first) || !tree.ownsLines(last)) {
            return new SourceEdit(first.startByte(), last.endByte(), "pass");
        }
        int end = tree.lineEnd(last.endByte());
        return new SourceEdit(tree.lineStart(first.triviaStart()), end, first.indent() + "pass");
    }

    // ---- common ----

    private SyntaxTree parseSource(String text, Target target) {
        SyntaxTree tree = PythonTreeBuilder.build(text);
        if (tree.isMalformed()) {
            Map<String, Object> ctx = context(target, "reason", tree.syntax().firstError());
            ctx.put("state", EditState.MALFORMED.name());
            throw new CodemodException(CodemodErrorCode.MALFORMED_SOURCE, ctx);
        }
        return tree;
    }

    private Fragment parseFragment(String fragmentText, Target target) {
        try {
            return Fragment.parse(fragmentText);
        } catch (CodemodException e) {
            Map<String, Object> ctx = context(target);
            ctx.putAll(e.getContext());
            ctx.put("state", EditState.MALFORMED.name());
            throw new CodemodException(e.getCode(), ctx, e);
        }
    }

    private Map<String, Object> context(Target target) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("file", origin);
        if (target != null) {
            ctx.put("target", target.toString());
        }
        return ctx;
    }

    private Map<String, Object> context(Target target, String key, Object value) {
        Map<String, Object> ctx = context(target);
        ctx.put(key, value);
        return ctx;
    }

    /**
     * Одна завершающая пустая строка; пустой модуль остается пустым. Исходные CRLF восстанавливаются.
     */
    private static String finish(String text, boolean crlf) {
        if (text.isBlank()) {
            return "";
        }
        String normalized = text.stripTrailing() + "\n";
        return crlf ? normalized.replace("\n", "\r\n") : normalized;
    }
}
