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
package com.tomaszrup.smartformat.syntax;

import org.eclipse.lsp4j.jsonrpc.CancelChecker;

/**
 * Language service answering questions about a tree that the tree itself
 * does not model.
 */
@FunctionalInterface
public interface SyntaxFactsService {

	/**
	 * Whether {@code position} lies in code the user does not edit directly,
	 * such as generated or hidden regions.
	 */
	boolean isInNonUserCode(SyntaxTree tree, int position, CancelChecker cancelChecker);
}
