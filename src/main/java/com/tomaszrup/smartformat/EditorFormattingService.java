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

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.smartformat.engine.FormattingRangeResolver;
import com.tomaszrup.smartformat.engine.LayoutEngine;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.policy.FormattingDispatcher;
import com.tomaszrup.smartformat.policy.FormattingEligibility;
import com.tomaszrup.smartformat.policy.FormattingTriggerPolicy;
import com.tomaszrup.smartformat.policy.TriggerEvent;
import com.tomaszrup.smartformat.rules.FormattingRuleAssembler;
import com.tomaszrup.smartformat.rules.HostFormattingRuleFactory;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Entry point for editors: decides when automatic formatting runs and over
 * which span, then asks the {@link LayoutEngine} for the edits.
 *
 * <p>All {@code on*} methods return a future of an immutable list that is
 * empty whenever nothing should change. The instance is stateless and safe
 * to share between concurrent requests.</p>
 */
public class EditorFormattingService {
	private static final Logger logger = LoggerFactory.getLogger(EditorFormattingService.class);

	private final FormattingTriggerPolicy policy;

	public EditorFormattingService(LayoutEngine layoutEngine, FormattingRangeResolver rangeResolver) {
		this(layoutEngine, rangeResolver, HostFormattingRuleFactory.NONE);
	}

	public EditorFormattingService(LayoutEngine layoutEngine, FormattingRangeResolver rangeResolver,
			HostFormattingRuleFactory hostRuleFactory) {
		this.policy = new FormattingTriggerPolicy(
				new FormattingRuleAssembler(hostRuleFactory),
				new FormattingDispatcher(layoutEngine, rangeResolver));
	}

	public boolean supportsFormatDocument() {
		return true;
	}

	public boolean supportsFormatSelection() {
		return true;
	}

	public boolean supportsFormatOnPaste() {
		return true;
	}

	public boolean supportsFormatOnReturn() {
		return true;
	}

	/**
	 * Cheap check a host runs before {@link #onTypedChar}. Blocks on the
	 * document's options; if they cannot be read the answer is {@code false}.
	 */
	public boolean supportsFormattingOnTypedCharacter(FormattingDocument document, char ch) {
		if (!FormattingEligibility.isSupportedCharacter(ch)) {
			return false;
		}
		CompletableFuture<EditorFormattingOptions> optionsFuture = document.getOptions();
		if (optionsFuture == null) {
			return false;
		}
		try {
			EditorFormattingOptions options = optionsFuture.join();
			return options != null && supportsFormattingOnTypedCharacter(options, ch);
		} catch (CompletionException | CancellationException e) {
			logger.debug("Options unavailable for {}: {}", document.getUri(), e.toString());
			return false;
		}
	}

	public boolean supportsFormattingOnTypedCharacter(EditorFormattingOptions options, char ch) {
		return FormattingEligibility.supportsTypedCharacter(options, ch);
	}

	/**
	 * Formats after the user typed {@code typedChar}, leaving the caret at
	 * {@code caretOffset}.
	 */
	public CompletableFuture<List<TextChange>> onTypedChar(FormattingDocument document, char typedChar,
			int caretOffset, CancelChecker cancelChecker) {
		return format(document, TriggerEvent.typedCharacter(typedChar, caretOffset), cancelChecker);
	}

	/**
	 * Formats after the user pressed return, leaving the caret at
	 * {@code caretOffset} on the new line.
	 */
	public CompletableFuture<List<TextChange>> onReturn(FormattingDocument document, int caretOffset,
			CancelChecker cancelChecker) {
		return format(document, TriggerEvent.returnKey(caretOffset), cancelChecker);
	}

	/**
	 * Formats text that was just pasted into {@code span}.
	 */
	public CompletableFuture<List<TextChange>> onPaste(FormattingDocument document, TextSpan span,
			CancelChecker cancelChecker) {
		return format(document, TriggerEvent.paste(span), cancelChecker);
	}

	/**
	 * Formats the selection, or the whole document when {@code span} is
	 * {@code null}.
	 */
	public CompletableFuture<List<TextChange>> onDemand(FormattingDocument document, TextSpan span,
			CancelChecker cancelChecker) {
		return format(document, TriggerEvent.onDemand(span), cancelChecker);
	}

	public CompletableFuture<List<TextChange>> format(FormattingDocument document, TriggerEvent event,
			CancelChecker cancelChecker) {
		logger.debug("Evaluating {} for {}", event, document.getUri());
		return policy.evaluate(document, event, cancelChecker);
	}
}
