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
package com.tomaszrup.smartformat.lsp;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentOnTypeFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.eclipse.lsp4j.jsonrpc.CompletableFutures;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.smartformat.EditorFormattingService;
import com.tomaszrup.smartformat.FormattingDocument;
import com.tomaszrup.smartformat.engine.TextChange;
import com.tomaszrup.smartformat.syntax.TextSpan;

/**
 * Serves the LSP formatting requests, plus {@code smartFormat/formatOnPaste},
 * on top of an {@link EditorFormattingService}.
 *
 * <p>Every request answers with an empty list when nothing should change,
 * including for documents that are not open. Cancelling the returned future
 * cancels the formatting work.</p>
 */
public class FormattingRequestHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingRequestHandler.class);

	private final EditorFormattingService formattingService;
	private final OpenDocumentTracker documentTracker;
	private final DocumentSnapshotProvider snapshotProvider;
	private final FormattingRequestGuard requestGuard = new FormattingRequestGuard();

	public FormattingRequestHandler(EditorFormattingService formattingService, OpenDocumentTracker documentTracker,
			DocumentSnapshotProvider snapshotProvider) {
		this.formattingService = formattingService;
		this.documentTracker = documentTracker;
		this.snapshotProvider = snapshotProvider;
	}

	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return handle("formatting", uri, (request) -> formattingService.onDemand(request.document, null,
				request.cancelChecker));
	}

	public CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return handle("rangeFormatting", uri, (request) -> {
			TextSpan span = Ranges.toSpan(request.text, params.getRange());
			if (span == null) {
				logger.debug("rangeFormatting skipped, invalid range {}", params.getRange());
				return null;
			}
			return formattingService.onDemand(request.document, span, request.cancelChecker);
		});
	}

	/**
	 * A {@code "\n"} trigger is treated as the return key. Any other
	 * single-character trigger goes through the cheap support check first.
	 */
	public CompletableFuture<List<? extends TextEdit>> onTypeFormatting(DocumentOnTypeFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String trigger = params.getCh();
		return handle("onTypeFormatting", uri, (request) -> {
			int caret = Positions.getOffset(request.text, params.getPosition());
			if (caret < 0) {
				logger.debug("onTypeFormatting skipped, invalid position {}", params.getPosition());
				return null;
			}
			if (Protocol.RETURN_TRIGGER.equals(trigger)) {
				return formattingService.onReturn(request.document, caret, request.cancelChecker);
			}
			if (trigger == null || trigger.length() != 1) {
				logger.debug("onTypeFormatting skipped, unsupported trigger '{}'", trigger);
				return null;
			}
			char ch = trigger.charAt(0);
			if (!formattingService.supportsFormattingOnTypedCharacter(request.document, ch)) {
				return null;
			}
			return formattingService.onTypedChar(request.document, ch, caret, request.cancelChecker);
		});
	}

	@JsonRequest(value = Protocol.REQUEST_FORMAT_ON_PASTE, useSegment = false)
	public CompletableFuture<List<? extends TextEdit>> formatOnPaste(PasteFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return handle("formatOnPaste", uri, (request) -> {
			TextSpan span = Ranges.toSpan(request.text, params.getRange());
			if (span == null) {
				logger.debug("formatOnPaste skipped, invalid range {}", params.getRange());
				return null;
			}
			return formattingService.onPaste(request.document, span, request.cancelChecker);
		});
	}

	private CompletableFuture<List<? extends TextEdit>> handle(String requestName, URI uri,
			Function<Request, CompletableFuture<List<TextChange>>> formatCall) {
		// lsp4j cancels the future it was handed, so the checker watches that one
		CompletableFuture<List<? extends TextEdit>> response = new CompletableFuture<>();
		CancelChecker cancelChecker = new CompletableFutures.FutureCancelChecker(response);
		List<? extends TextEdit> fallback = Collections.emptyList();
		try {
			requestGuard.run(requestName, uri,
					() -> MdcRequestContext.withDocument(uri, () -> startRequest(uri, cancelChecker, formatCall)),
					fallback)
					.whenComplete((edits, throwable) -> {
						if (throwable != null) {
							response.completeExceptionally(throwable);
						} else {
							response.complete(edits);
						}
					});
		} catch (CancellationException e) {
			response.cancel(false);
		}
		return response;
	}

	private CompletableFuture<List<? extends TextEdit>> startRequest(URI uri, CancelChecker cancelChecker,
			Function<Request, CompletableFuture<List<TextChange>>> formatCall) {
		String text = documentTracker.getContents(uri);
		if (text == null) {
			logger.debug("Document is not open, nothing to format");
			return noEdits();
		}
		FormattingDocument document = snapshotProvider.snapshot(uri, text);
		if (document == null) {
			logger.debug("No snapshot available, nothing to format");
			return noEdits();
		}

		CompletableFuture<List<TextChange>> changes = formatCall.apply(new Request(document, text, cancelChecker));
		if (changes == null) {
			return noEdits();
		}
		return changes.<List<? extends TextEdit>>thenApply(textChanges -> toTextEdits(text, textChanges));
	}

	private static CompletableFuture<List<? extends TextEdit>> noEdits() {
		return CompletableFuture.completedFuture(Collections.emptyList());
	}

	static List<TextEdit> toTextEdits(String text, List<TextChange> changes) {
		if (changes == null || changes.isEmpty()) {
			return Collections.emptyList();
		}
		List<TextEdit> edits = new ArrayList<>(changes.size());
		for (TextChange change : changes) {
			edits.add(new TextEdit(Ranges.fromSpan(text, change.getSpan()), change.getNewText()));
		}
		return edits;
	}

	private static final class Request {
		final FormattingDocument document;
		final String text;
		final CancelChecker cancelChecker;

		Request(FormattingDocument document, String text, CancelChecker cancelChecker) {
			this.document = document;
			this.text = text;
			this.cancelChecker = cancelChecker;
		}
	}
}
