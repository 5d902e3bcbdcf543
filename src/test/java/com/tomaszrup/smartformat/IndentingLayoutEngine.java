////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.smartformat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;

import com.tomaszrup.smartformat.engine.LayoutContext;
import com.tomaszrup.smartformat.engine.LayoutEngine;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.rules.FormattingRuleChain;
import com.tomaszrup.smartformat.syntax.SyntaxKind;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Minimal {@link LayoutEngine} for tests, in the spirit of a brace-depth
 * indenter:
 * <ul>
 *   <li>every token that starts a line is indented by its brace depth;</li>
 *   <li>an open brace that follows {@code )} or {@code =>} on the same line
 *       moves to its own line, unless a rule preserves the line break layout
 *       in front of it;</li>
 *   <li>whitespace in front of {@code ;} on the same line is removed.</li>
 * </ul>
 * Formatting a single token only re-indents the line it is on. Only the
 * whitespace between tokens is ever changed. Calls are counted so
 * tests can assert that the engine was, or was not, consulted.
 *
 * <pre>{@code
 * IndentingLayoutEngine engine = new IndentingLayoutEngine();
 * EditorFormattingService service = new EditorFormattingService(engine, new StatementRangeResolver());
 * ...
 * Assertions.assertEquals(0, engine.getTotalCalls());
 * }</pre>
 */
public class IndentingLayoutEngine implements LayoutEngine {

    private final AtomicInteger spanCalls = new AtomicInteger();
    private final AtomicInteger tokenCalls = new AtomicInteger();
    private volatile List<TextSpan> lastSpans;
    private volatile SyntaxToken lastToken;
    private volatile FormattingRuleChain lastRules;

    @Override
    public CompletableFuture<List<TextChange>> formatSpans(SyntaxTree tree, List<TextSpan> spans,
            EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
        spanCalls.incrementAndGet();
        lastSpans = spans;
        lastRules = rules;
        RecordingLayoutContext context = new RecordingLayoutContext(options);
        rules.applyTo(context);
        cancelChecker.checkCanceled();

        List<TextChange> changes = new ArrayList<>();
        Map<SyntaxToken, Integer> depths = computeDepths(tree);
        String lineBreak = lineBreakOf(tree);
        SyntaxToken previous = SyntaxToken.MISSING;
        for (SyntaxToken token : tokensOf(tree)) {
            if (!token.getSpan().isEmpty() && inAnySpan(spans, token.getSpanStart())) {
                TextChange change = layoutToken(tree, previous, token, depths.get(token), options, context,
                        lineBreak);
                if (change != null) {
                    changes.add(change);
                }
            }
            previous = token;
        }
        return CompletableFuture.completedFuture(changes);
    }

    @Override
    public CompletableFuture<List<TextChange>> formatToken(SyntaxTree tree, SyntaxToken token,
            EditorFormattingOptions options, FormattingRuleChain rules, CancelChecker cancelChecker) {
        tokenCalls.incrementAndGet();
        lastToken = token;
        lastRules = rules;
        rules.applyTo(new RecordingLayoutContext(options));
        cancelChecker.checkCanceled();

        Map<SyntaxToken, Integer> depths = computeDepths(tree);
        List<TextChange> changes = new ArrayList<>();
        if (!depths.containsKey(token) || token.getSpan().isEmpty()) {
            return CompletableFuture.completedFuture(changes);
        }
        // indent the line the token is on
        SyntaxToken first = token;
        SyntaxToken previous = tree.getPreviousToken(first);
        while (!startsLine(tree, previous, first)) {
            first = previous;
            previous = tree.getPreviousToken(first);
        }
        TextChange change = indentIfFirstOnLine(tree, previous, first, depths.get(first), options);
        if (change != null) {
            changes.add(change);
        }
        return CompletableFuture.completedFuture(changes);
    }

    public int getSpanCalls() {
        return spanCalls.get();
    }

    public int getTokenCalls() {
        return tokenCalls.get();
    }

    public int getTotalCalls() {
        return spanCalls.get() + tokenCalls.get();
    }

    public List<TextSpan> getLastSpans() {
        return lastSpans;
    }

    public SyntaxToken getLastToken() {
        return lastToken;
    }

    public FormattingRuleChain getLastRules() {
        return lastRules;
    }

    private static TextChange layoutToken(SyntaxTree tree, SyntaxToken previous, SyntaxToken token, int depth,
            EditorFormattingOptions options, RecordingLayoutContext context, String lineBreak) {
        TextChange indentation = indentIfFirstOnLine(tree, previous, token, depth, options);
        if (indentation != null || startsLine(tree, previous, token)) {
            return indentation;
        }
        int gapStart = previous.getSpan().getEnd();
        int gapEnd = token.getSpanStart();
        if (token.isKind(SyntaxKind.OPEN_BRACE_TOKEN)
                && (previous.isKind(SyntaxKind.CLOSE_PAREN_TOKEN) || "=>".equals(previous.getText()))
                && !context.preservesLineBreakBefore(token)) {
            return new TextChange(TextSpan.fromBounds(gapStart, gapEnd), lineBreak + indent(depth, options));
        }
        if (token.isKind(SyntaxKind.SEMICOLON_TOKEN) && gapEnd > gapStart) {
            return new TextChange(TextSpan.fromBounds(gapStart, gapEnd), "");
        }
        return null;
    }

    private static TextChange indentIfFirstOnLine(SyntaxTree tree, SyntaxToken previous, SyntaxToken token,
            int depth, EditorFormattingOptions options) {
        if (!startsLine(tree, previous, token)) {
            return null;
        }
        // only the leading whitespace, a comment in front of the token stays
        int indentStart = tree.getText().getLineStart(token.getSpanStart());
        int indentEnd = indentStart;
        while (indentEnd < token.getSpanStart()
                && (tree.getText().charAt(indentEnd) == ' ' || tree.getText().charAt(indentEnd) == '\t')) {
            indentEnd++;
        }
        String current = tree.getText().substring(TextSpan.fromBounds(indentStart, indentEnd));
        String desired = indent(depth, options);
        if (current.equals(desired)) {
            return null;
        }
        return new TextChange(TextSpan.fromBounds(indentStart, indentEnd), desired);
    }

    private static boolean startsLine(SyntaxTree tree, SyntaxToken previous, SyntaxToken token) {
        if (previous.isMissing()) {
            return true;
        }
        return containsLineBreak(tree, previous.getSpan().getEnd(), token.getSpanStart());
    }

    private static boolean containsLineBreak(SyntaxTree tree, int start, int end) {
        for (int i = start; i < end; i++) {
            char c = tree.getText().charAt(i);
            if (c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }

    private static String indent(int depth, EditorFormattingOptions options) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            if (options.isUseTabs()) {
                builder.append('\t');
            } else {
                for (int j = 0; j < options.getIndentSize(); j++) {
                    builder.append(' ');
                }
            }
        }
        return builder.toString();
    }

    private static boolean inAnySpan(List<TextSpan> spans, int position) {
        for (TextSpan span : spans) {
            if (span.contains(position)) {
                return true;
            }
        }
        return false;
    }

    private static List<SyntaxToken> tokensOf(SyntaxTree tree) {
        List<SyntaxToken> tokens = new ArrayList<>();
        SyntaxToken token = tree.findToken(0, false);
        while (!token.isMissing()) {
            tokens.add(token);
            token = tree.getNextToken(token);
        }
        return tokens;
    }

    private static Map<SyntaxToken, Integer> computeDepths(SyntaxTree tree) {
        Map<SyntaxToken, Integer> depths = new HashMap<>();
        int depth = 0;
        for (SyntaxToken token : tokensOf(tree)) {
            if (token.isKind(SyntaxKind.CLOSE_BRACE_TOKEN)) {
                depth = Math.max(0, depth - 1);
            }
            depths.put(token, depth);
            if (token.isKind(SyntaxKind.OPEN_BRACE_TOKEN)) {
                depth++;
            }
        }
        return depths;
    }

    private static String lineBreakOf(SyntaxTree tree) {
        return tree.getText().toString().contains("\r\n") ? "\r\n" : "\n";
    }

    /**
     * Collects what formatting rules ask for while a span is laid out.
     */
    static final class RecordingLayoutContext implements LayoutContext {
        private final EditorFormattingOptions options;
        private final List<Predicate<SyntaxToken>> preservedLineBreaks = new ArrayList<>();

        RecordingLayoutContext(EditorFormattingOptions options) {
            this.options = options;
        }

        @Override
        public EditorFormattingOptions getOptions() {
            return options;
        }

        @Override
        public void preserveLineBreaksBefore(Predicate<SyntaxToken> tokens) {
            preservedLineBreaks.add(tokens);
        }

        boolean preservesLineBreakBefore(SyntaxToken token) {
            for (Predicate<SyntaxToken> predicate : preservedLineBreaks) {
                if (predicate.test(token)) {
                    return true;
                }
            }
            return false;
        }
    }
}
