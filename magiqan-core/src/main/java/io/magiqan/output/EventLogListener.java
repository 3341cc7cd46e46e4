/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
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
package io.magiqan.output;

import io.magiqan.common.Json;
import io.magiqan.core.RunEvent;
import io.magiqan.core.RunListener;
import org.slf4j.Logger;

/**
 * Traces every run event as one JSON line on the {@code magiqan.events} logger.
 * A Runner subscribes one automatically when that logger is at DEBUG.
 */
public class EventLogListener implements RunListener {

    private static final Logger logger = LogContext.EVENTS_LOGGER;

    public static boolean isEnabled() {
        return logger.isDebugEnabled();
    }

    @Override
    public void onEvent(RunEvent event) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} {}", event.getType().getValue(), Json.stringifyStrict(event.toJson()));
        }
    }

}
