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
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Thread-safe tracker for the text of documents open in the editor.
 *
 * <p>Only open documents are known; formatting a document the client never
 * opened yields no edits.</p>
 */
public class OpenDocumentTracker {
	private static final Logger logger = LoggerFactory.getLogger(OpenDocumentTracker.class);

	private final ConcurrentHashMap<URI, String> openDocuments = new ConcurrentHashMap<>();

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(openDocuments.keySet());
	}

	public boolean isOpen(URI uri) {
		return openDocuments.containsKey(uri);
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openDocuments.put(uri, params.getTextDocument().getText());
	}

	/**
	 * Applies incremental or full-content changes atomically using
	 * {@link ConcurrentHashMap#compute}.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openDocuments.compute(uri, (key, currentText) -> {
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				currentText = applyChange(key, currentText, change);
			}
			return currentText;
		});
	}

	public void didClose(DidCloseTextDocumentParams params) {
		openDocuments.remove(URI.create(params.getTextDocument().getUri()));
	}

	/**
	 * @return the current text, or {@code null} if the document is not open
	 */
	public String getContents(URI uri) {
		return openDocuments.get(uri);
	}

	public void setContents(URI uri, String contents) {
		openDocuments.put(uri, contents);
	}

	private static String applyChange(URI uri, String currentText, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (range == null || currentText == null) {
			return change.getText();
		}
		int offsetStart = Positions.getOffset(currentText, range.getStart());
		int offsetEnd = Positions.getOffset(currentText, range.getEnd());
		if (offsetStart < 0 || offsetEnd < offsetStart) {
			logger.warn("Ignoring change with invalid range {} for {}", range, uri);
			return currentText;
		}
		StringBuilder builder = new StringBuilder(currentText.length() + change.getText().length());
		builder.append(currentText, 0, offsetStart);
		builder.append(change.getText());
		builder.append(currentText, offsetEnd, currentText.length());
		return builder.toString();
	}
}
