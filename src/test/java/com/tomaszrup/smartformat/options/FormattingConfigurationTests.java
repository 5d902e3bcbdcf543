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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

class FormattingConfigurationTests {

	private static JsonObject closeBraceSettings(boolean value) {
		JsonObject section = new JsonObject();
		section.addProperty("formatOnCloseBrace", value);
		JsonObject settings = new JsonObject();
		settings.add(FormattingSettingsParser.SECTION, section);
		return settings;
	}

	@Test
	void testStartsWithDefaults() {
		Assertions.assertEquals(EditorFormattingOptions.defaults(), new FormattingConfiguration().getOptions());
	}

	@Test
	void testConfigurationChangeSwapsSnapshot() {
		FormattingConfiguration configuration = new FormattingConfiguration();
		EditorFormattingOptions before = configuration.getOptions();

		configuration.handleConfigurationChange(closeBraceSettings(false));
		Assertions.assertFalse(configuration.getOptions().isFormatOnCloseBrace());
		// a snapshot taken earlier is unaffected
		Assertions.assertTrue(before.isFormatOnCloseBrace());

		configuration.handleConfigurationChange(closeBraceSettings(true));
		Assertions.assertTrue(configuration.getOptions().isFormatOnCloseBrace());
	}

	@Test
	void testIgnoredSettingsKeepOptions() {
		EditorFormattingOptions initial = EditorFormattingOptions.defaults().withIndentStyle(IndentStyle.NONE);
		FormattingConfiguration configuration = new FormattingConfiguration(initial);
		configuration.handleConfigurationChange(new JsonObject());
		configuration.handleConfigurationChange(null);
		Assertions.assertSame(initial, configuration.getOptions());
	}
}
