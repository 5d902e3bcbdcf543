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
package com.tomaszrup.smartformat.options;

/**
 * Holds the session's current {@link EditorFormattingOptions}. Each
 * configuration change swaps in a new immutable instance, so a formatting
 * request that already read the options keeps a consistent snapshot.
 */
public final class FormattingConfiguration {

	private volatile EditorFormattingOptions options;

	public FormattingConfiguration() {
		this(EditorFormattingOptions.defaults());
	}

	public FormattingConfiguration(EditorFormattingOptions initial) {
		this.options = initial;
	}

	public EditorFormattingOptions getOptions() {
		return options;
	}

	/**
	 * Processes {@code initializationOptions} or a
	 * {@code didChangeConfiguration} settings object.
	 *
	 * @param rawSettings the raw settings object from the LSP params
	 */
	public synchronized void handleConfigurationChange(Object rawSettings) {
		options = FormattingSettingsParser.parse(rawSettings, options);
	}
}
