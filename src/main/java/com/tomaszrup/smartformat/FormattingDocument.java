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

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import com.tomaszrup.smartformat.options.EditorFormattingOptions;
import com.tomaszrup.smartformat.syntax.SyntaxTree;

/**
 * Immutable snapshot of a document as seen by one formatting request. The
 * host creates a fresh snapshot per request; nothing is cached across
 * requests.
 *
 * <p>Both futures may complete with {@code null}, or exceptionally, when the
 * tree or the options cannot be obtained. The formatting service then
 * produces no edits.</p>
 */
public interface FormattingDocument {

	URI getUri();

	CompletableFuture<SyntaxTree> getSyntaxTree();

	CompletableFuture<EditorFormattingOptions> getOptions();

	/**
	 * Looks up a language service such as
	 * {@link com.tomaszrup.smartformat.rules.SyntaxFormattingService} or
	 * {@link com.tomaszrup.smartformat.syntax.SyntaxFactsService}.
	 *
	 * @return the service, or {@code null} if the language does not provide it
	 */
	<T> T getLanguageService(Class<T> serviceType);
}
