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

import java.util.Arrays;
import java.util.List;

import org.eclipse.lsp4j.DocumentOnTypeFormattingOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.TextDocumentSyncKind;

import com.tomaszrup.smartformat.EditorFormattingService;

/**
 * Advertises the formatting requests a {@link FormattingRequestHandler}
 * serves.
 */
public final class FormattingCapabilities {

	static final String FIRST_TRIGGER_CHARACTER = ";";

	static final List<String> MORE_TRIGGER_CHARACTERS = Arrays.asList("}", "{", "#", "n", "t", "e", ":", ")",
			Protocol.RETURN_TRIGGER);

	private FormattingCapabilities() {
	}

	public static void register(ServerCapabilities serverCapabilities, EditorFormattingService service) {
		serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
		serverCapabilities.setDocumentFormattingProvider(service.supportsFormatDocument());
		serverCapabilities.setDocumentRangeFormattingProvider(service.supportsFormatSelection());
		serverCapabilities.setDocumentOnTypeFormattingProvider(
				new DocumentOnTypeFormattingOptions(FIRST_TRIGGER_CHARACTER, MORE_TRIGGER_CHARACTERS));
	}
}
