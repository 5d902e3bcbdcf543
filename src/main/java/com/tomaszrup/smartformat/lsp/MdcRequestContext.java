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
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "document"} so that every log line written
 * while a formatting request is handled names the document it is for.
 *
 * <pre>{@code
 * T result = MdcRequestContext.withDocument(uri, () -> handle(params));
 * }</pre>
 */
public final class MdcRequestContext {

    /** MDC key used in the logback pattern via {@code %X{document}}. */
    public static final String MDC_KEY = "document";

    private MdcRequestContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "document"} key to the file name of {@code uri},
     * or to the whole URI when it has no path.
     */
    public static void setDocument(URI uri) {
        if (uri == null) {
            MDC.put(MDC_KEY, "unknown");
            return;
        }
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            MDC.put(MDC_KEY, uri.toString());
            return;
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 && slash < path.length() - 1 ? path.substring(slash + 1) : path;
        MDC.put(MDC_KEY, name);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Runs {@code task} with the document key set, then restores whatever
     * MDC context the calling thread had before.
     */
    public static <T> T withDocument(URI uri, Supplier<T> task) {
        Map<String, String> previousContext = MDC.getCopyOfContextMap();
        setDocument(uri);
        try {
            return task.get();
        } finally {
            if (previousContext != null) {
                MDC.setContextMap(previousContext);
            } else {
                MDC.clear();
            }
        }
    }
}
