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
package com.tomaszrup.smartformat.policy;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.smartformat.FormattingDocument;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.rules.FormattingRuleAssembler;
import com.tomaszrup.smartformat.rules.FormattingRuleChain;
import com.tomaszrup.smartformat.syntax.SyntaxFactsService;
import com.tomaszrup.smartformat.syntax.SyntaxKind;
import com.tomaszrup.smartformat.syntax.SyntaxToken;
import com.tomaszrup.smartformat.syntax.SyntaxTree;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Decides, per {@link TriggerEvent}, whether to format and over what.
 *
 * <p>Every event follows the same outline: fetch the tree and the options,
 * validate the anchor, try a range format, and for typed characters and
 * return fall back to formatting the single token when the range format
 * produced nothing. Each evaluation works on its own snapshot and holds no
 * state between calls.</p>
 *
 * <p>Rejections are silent: the result is an empty list. A tree, options or
 * language service that cannot be obtained also yields an empty list.
 * Cancellation is the only failure that escapes, as a
 * {@link CancellationException} completing the returned future.</p>
 */
public class FormattingTriggerPolicy {
	private static final Logger logger = LoggerFactory.getLogger(FormattingTriggerPolicy.class);

	private final FormattingRuleAssembler ruleAssembler;
	private final FormattingDispatcher dispatcher;

	public FormattingTriggerPolicy(FormattingRuleAssembler ruleAssembler, FormattingDispatcher dispatcher) {
		this.ruleAssembler = Objects.requireNonNull(ruleAssembler, "ruleAssembler");
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
	}

	public CompletableFuture<List<TextChange>> evaluate(FormattingDocument document, TriggerEvent event,
			CancelChecker cancelChecker) {
		Objects.requireNonNull(document, "document");
		Objects.requireNonNull(event, "event");
		Objects.requireNonNull(cancelChecker, "cancelChecker");

		if (event.getKind() == TriggerEvent.Kind.TYPED_CHARACTER
				&& !FormattingEligibility.isSupportedCharacter(((TriggerEvent.TypedCharacter) event).getCharacter())) {
			return FormattingDispatcher.noEdits();
		}

		return await(document.getSyntaxTree(), "syntax tree", document, cancelChecker)
				.thenCompose(tree -> {
					if (tree == null) {
						return FormattingDispatcher.noEdits();
					}
					return await(document.getOptions(), "options", document, cancelChecker)
							.thenCompose(options -> {
								if (options == null) {
									return FormattingDispatcher.noEdits();
								}
								return dispatch(document, tree, options, event, cancelChecker);
							});
				});
	}

	private CompletableFuture<List<TextChange>> dispatch(FormattingDocument document, SyntaxTree tree,
			EditorFormattingOptions options, TriggerEvent event, CancelChecker cancelChecker) {
		switch (event.getKind()) {
			case TYPED_CHARACTER:
				return onTypedCharacter(document, tree, options, (TriggerEvent.TypedCharacter) event, cancelChecker);
			case RETURN:
				return onReturn(document, tree, options, (TriggerEvent.Return) event, cancelChecker);
			case PASTE:
				return onPaste(document, tree, options, (TriggerEvent.Paste) event, cancelChecker);
			case ON_DEMAND:
				return onDemand(document, tree, options, (TriggerEvent.OnDemand) event, cancelChecker);
			default:
				throw new IllegalArgumentException("Unknown trigger event: " + event);
		}
	}

	private CompletableFuture<List<TextChange>> onTypedCharacter(FormattingDocument document, SyntaxTree tree,
			EditorFormattingOptions options, TriggerEvent.TypedCharacter event, CancelChecker cancelChecker) {
		char typedChar = event.getCharacter();
		int caretOffset = event.getCaretOffset();
		if (!FormattingEligibility.supportsTypedCharacter(options, typedChar)) {
			logger.debug("Typed character '{}' is disabled by options {}", typedChar, options);
			return FormattingDispatcher.noEdits();
		}

		SyntaxToken token = TokenLocator.locateTokenBeforeCaret(tree, caretOffset);
		if (token.isMissing()
				|| !FormattingEligibility.isValidKindForTypedCharacter(typedChar, token.getKind())
				|| FormattingEligibility.isInvalidTokenKind(token)) {
			logger.debug("No formattable token for '{}' at {}: {}", typedChar, caretOffset, token);
			return FormattingDispatcher.noEdits();
		}
		if (!FormattingEligibility.isKeywordSuffixCharacter(typedChar)
				&& !FormattingEligibility.matchesTypedCharacter(token, typedChar)) {
			logger.debug("Token {} was not produced by typing '{}'", token, typedChar);
			return FormattingDispatcher.noEdits();
		}

		SyntaxFactsService syntaxFacts = document.getLanguageService(SyntaxFactsService.class);
		if (syntaxFacts != null && syntaxFacts.isInNonUserCode(tree, caretOffset, cancelChecker)) {
			logger.debug("Caret {} is in non-user code", caretOffset);
			return FormattingDispatcher.noEdits();
		}
		if (FormattingEligibility.shouldNotFormatOnTypedCharacter(token, tree)) {
			logger.debug("Token {} is excluded in this context", token);
			return FormattingDispatcher.noEdits();
		}

		FormattingContext context = createContext(
				ruleAssembler.forTypedInput(document, caretOffset), tree, options, cancelChecker);
		if (context == null) {
			return FormattingDispatcher.noEdits();
		}

		// format-on-close-brace off: indent the brace, leave the block alone
		boolean smartIndentOnly = token.isKind(SyntaxKind.CLOSE_BRACE_TOKEN)
				&& !options.isFormatOnCloseBrace();
		if (smartIndentOnly) {
			return dispatcher.formatToken(context, token);
		}
		return dispatcher.formatRangeOrToken(context, token);
	}

	private CompletableFuture<List<TextChange>> onReturn(FormattingDocument document, SyntaxTree tree,
			EditorFormattingOptions options, TriggerEvent.Return event, CancelChecker cancelChecker) {
		int caretOffset = event.getCaretOffset();
		SyntaxToken token = TokenLocator.locateTokenBeforeCaret(tree, caretOffset);
		if (token.isMissing() || !FormattingEligibility.isSingleCharacterToken(token)) {
			logger.debug("No formattable token before return at {}: {}", caretOffset, token);
			return FormattingDispatcher.noEdits();
		}
		if (FormattingEligibility.shouldNotFormatOnReturn(token)) {
			logger.debug("Return after {} does not trigger formatting", token);
			return FormattingDispatcher.noEdits();
		}

		FormattingContext context = createContext(
				ruleAssembler.forTypedInput(document, caretOffset), tree, options, cancelChecker);
		if (context == null) {
			return FormattingDispatcher.noEdits();
		}
		return dispatcher.formatRangeOrToken(context, token);
	}

	private CompletableFuture<List<TextChange>> onPaste(FormattingDocument document, SyntaxTree tree,
			EditorFormattingOptions options, TriggerEvent.Paste event, CancelChecker cancelChecker) {
		FormattingContext context = createContext(ruleAssembler.forPaste(document), tree, options, cancelChecker);
		if (context == null) {
			return FormattingDispatcher.noEdits();
		}
		TextSpan span = FormattingSpans.getFormattingSpan(tree, event.getSpan());
		return dispatcher.formatSpan(context, span);
	}

	private CompletableFuture<List<TextChange>> onDemand(FormattingDocument document, SyntaxTree tree,
			EditorFormattingOptions options, TriggerEvent.OnDemand event, CancelChecker cancelChecker) {
		FormattingContext context = createContext(ruleAssembler.forDocument(document), tree, options, cancelChecker);
		if (context == null) {
			return FormattingDispatcher.noEdits();
		}
		TextSpan span = FormattingSpans.getFormattingSpan(tree, event.getSpan());
		return dispatcher.formatSpan(context, span);
	}

	private static FormattingContext createContext(FormattingRuleChain rules, SyntaxTree tree,
			EditorFormattingOptions options, CancelChecker cancelChecker) {
		if (rules == null) {
			return null;
		}
		return new FormattingContext(tree, options, rules, cancelChecker);
	}

	/**
	 * Waits for a collaborator's result. A {@code null} future, a
	 * {@code null} value or a failure other than cancellation all come back as
	 * {@code null}; cancellation is rethrown.
	 */
	private static <T> CompletableFuture<T> await(CompletableFuture<T> future, String what,
			FormattingDocument document, CancelChecker cancelChecker) {
		CompletableFuture<T> source = future != null ? future : CompletableFuture.completedFuture(null);
		return source.handle((value, throwable) -> {
			if (throwable != null) {
				Throwable cause = unwrap(throwable);
				if (cause instanceof CancellationException) {
					throw (CancellationException) cause;
				}
				logger.debug("Could not obtain {} for {}: {}", what, document.getUri(), cause.toString());
				return null;
			}
			cancelChecker.checkCanceled();
			if (value == null) {
				logger.debug("No {} available for {}", what, document.getUri());
			}
			return value;
		});
	}

	static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
