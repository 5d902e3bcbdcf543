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

import java.util.Locale;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code smartFormat} section of the JSON settings a client sends
 * in {@code initializationOptions} or {@code workspace/didChangeConfiguration}.
 *
 * <pre>{@code
 * "smartFormat": {
 *     "indentStyle": "smart",
 *     "formatOnCloseBrace": true,
 *     "formatOnSemicolon": true,
 *     "tabSize": 4,
 *     "insertSpaces": true,
 *     "logLevel": "debug"
 * }
 * }</pre>
 *
 * Entries that are missing or have the wrong shape keep their previous value.
 */
public final class FormattingSettingsParser {

    private static final Logger logger = LoggerFactory.getLogger(FormattingSettingsParser.class);

    public static final String SECTION = "smartFormat";

    private static final String INDENT_STYLE_OPTION = "indentStyle";
    private static final String FORMAT_ON_CLOSE_BRACE_OPTION = "formatOnCloseBrace";
    private static final String FORMAT_ON_SEMICOLON_OPTION = "formatOnSemicolon";
    private static final String TAB_SIZE_OPTION = "tabSize";
    private static final String INSERT_SPACES_OPTION = "insertSpaces";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    private FormattingSettingsParser() {
    }

    /**
     * Applies the {@code smartFormat} section of {@code rawSettings} on top
     * of {@code current}.
     *
     * @return the updated options, or {@code current} itself when the input
     *         is not a {@link JsonObject} or has no {@code smartFormat} object
     */
    public static EditorFormattingOptions parse(Object rawSettings, EditorFormattingOptions current) {
        if (!(rawSettings instanceof JsonObject)) {
            return current;
        }
        JsonObject settings = (JsonObject) rawSettings;
        if (!settings.has(SECTION) || !settings.get(SECTION).isJsonObject()) {
            return current;
        }
        JsonObject section = settings.getAsJsonObject(SECTION);
        applyLogLevelOption(section);

        EditorFormattingOptions result = current;
        IndentStyle indentStyle = parseIndentStyle(section);
        if (indentStyle != null) {
            result = result.withIndentStyle(indentStyle);
        }
        Boolean closeBrace = parseBoolean(section, FORMAT_ON_CLOSE_BRACE_OPTION);
        if (closeBrace != null) {
            result = result.withFormatOnCloseBrace(closeBrace);
        }
        Boolean semicolon = parseBoolean(section, FORMAT_ON_SEMICOLON_OPTION);
        if (semicolon != null) {
            result = result.withFormatOnSemicolon(semicolon);
        }
        result = applyIndentation(section, result);

        if (!result.equals(current)) {
            logger.info("Formatting options changed: {}", result);
        }
        return result;
    }

    private static IndentStyle parseIndentStyle(JsonObject section) {
        String value = parseString(section, INDENT_STYLE_OPTION);
        if (value == null) {
            return null;
        }
        try {
            return IndentStyle.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown indent style '{}', keeping current value", value);
            return null;
        }
    }

    private static EditorFormattingOptions applyIndentation(JsonObject section, EditorFormattingOptions current) {
        int indentSize = current.getIndentSize();
        boolean useTabs = current.isUseTabs();
        JsonElement tabSize = section.get(TAB_SIZE_OPTION);
        if (tabSize != null && tabSize.isJsonPrimitive() && tabSize.getAsJsonPrimitive().isNumber()) {
            int value = tabSize.getAsInt();
            if (value > 0) {
                indentSize = value;
            } else {
                logger.warn("Ignoring non-positive tab size {}", value);
            }
        }
        Boolean insertSpaces = parseBoolean(section, INSERT_SPACES_OPTION);
        if (insertSpaces != null) {
            useTabs = !insertSpaces;
        }
        if (indentSize == current.getIndentSize() && useTabs == current.isUseTabs()) {
            return current;
        }
        return current.withIndentation(indentSize, useTabs);
    }

    private static Boolean parseBoolean(JsonObject section, String name) {
        JsonElement element = section.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            return null;
        }
        return element.getAsBoolean();
    }

    private static String parseString(JsonObject section, String name) {
        JsonElement element = section.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        return element.getAsString();
    }

    private static void applyLogLevelOption(JsonObject section) {
        String level = parseString(section, LOG_LEVEL_OPTION);
        if (level != null) {
            applyLogLevel(level);
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }
}
