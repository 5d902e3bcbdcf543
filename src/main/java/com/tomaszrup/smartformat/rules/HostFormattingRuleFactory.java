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
package com.tomaszrup.smartformat.rules;

import java.util.Collections;
import java.util.List;

import com.tomaszrup.smartformat.FormattingDocument;

/**
 * Supplies rules that depend on the hosting editor, for example rules that
 * keep generated regions of an embedded-code view intact.
 */
@FunctionalInterface
public interface HostFormattingRuleFactory {

	/** Factory for hosts without rules of their own. */
	HostFormattingRuleFactory NONE = (document, position) -> Collections.emptyList();

	/**
	 * @param position caret offset the formatting was triggered at
	 * @return rules to run ahead of the language defaults, possibly empty
	 */
	List<FormattingRule> createRules(FormattingDocument document, int position);
}
