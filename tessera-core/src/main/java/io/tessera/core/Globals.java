/*
 * The MIT License
 *
 * Copyright 2025 The Tessera Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.tessera.core;

import io.tessera.output.LogContext;

import java.io.InputStream;
import java.util.Properties;

/**
 * Global constants of the engine.
 */
public final class Globals {

    /**
     * Version loaded from tessera-meta.properties.
     */
    public static final String TESSERA_VERSION;

    static {
        TESSERA_VERSION = loadVersion();
    }

    private static String loadVersion() {
        try (InputStream is = Globals.class.getResourceAsStream("/tessera-meta.properties")) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                return props.getProperty("tessera.version", "(unknown)");
            }
        } catch (Exception e) {
            LogContext.RUNTIME_LOGGER.debug("could not read tessera-meta.properties: {}", e.getMessage());
        }
        return "(unknown)";
    }

    private Globals() {
        // utility class
    }

}
