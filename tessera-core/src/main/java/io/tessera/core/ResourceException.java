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

/**
 * Acquisition or release of a suite resource failed.
 */
public class ResourceException extends TesseraException {

    public enum Phase {
        ACQUIRE, RELEASE
    }

    private final Phase phase;

    public ResourceException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public static ResourceException acquire(String owner, Throwable cause) {
        return new ResourceException(Phase.ACQUIRE, "failed to acquire resource for " + owner + ": " + cause, cause);
    }

    public static ResourceException release(String owner, Throwable cause) {
        return new ResourceException(Phase.RELEASE, "failed to release resource for " + owner + ": " + cause, cause);
    }

    public Phase getPhase() {
        return phase;
    }

}
