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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.smartformat.FormattingDocument;

/**
 * Builds the rule chain for each kind of formatting request. The order is
 * part of the contract: the layout engine lets later rules override earlier
 * ones, so host rules always come before the language defaults and the paste
 * rule always comes first.
 *
 * <p>Each method returns {@code null} when the document has no
 * {@link SyntaxFormattingService}; callers treat that as "nothing to do".</p>
 */
public class FormattingRuleAssembler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingRuleAssembler.class);

	private final HostFormattingRuleFactory hostRuleFactory;

	public FormattingRuleAssembler(HostFormattingRuleFactory hostRuleFactory) {
		this.hostRuleFactory = Objects.requireNonNull(hostRuleFactory, "hostRuleFactory");
	}

	/**
	 * Host rules for {@code position}, then the language defaults. Used for
	 * typed-character and return triggers.
	 */
	public FormattingRuleChain forTypedInput(FormattingDocument document, int position) {
		FormattingRuleChain defaults = defaultRules(document);
		if (defaults == null) {
			return null;
		}
		FormattingRuleChain hostRules = FormattingRuleChain.of(hostRuleFactory.createRules(document, position));
		return hostRules.concat(defaults);
	}

	/**
	 * The paste rule, then the language defaults. Host rules are not
	 * consulted for paste.
	 */
	public FormattingRuleChain forPaste(FormattingDocument document) {
		FormattingRuleChain defaults = defaultRules(document);
		if (defaults == null) {
			return null;
		}
		return defaults.prepend(PasteFormattingRule.INSTANCE);
	}

	/**
	 * The language defaults alone, for explicit document or selection
	 * formatting.
	 */
	public FormattingRuleChain forDocument(FormattingDocument document) {
		return defaultRules(document);
	}

	private static FormattingRuleChain defaultRules(FormattingDocument document) {
		SyntaxFormattingService service = document.getLanguageService(SyntaxFormattingService.class);
		if (service == null) {
			logger.debug("No syntax formatting service for {}", document.getUri());
			return null;
		}
		return FormattingRuleChain.of(service.getDefaultFormattingRules());
	}
}
