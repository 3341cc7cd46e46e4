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
package io.magiqan.core;

import io.magiqan.output.LogContext;
import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-runner publish/subscribe channel. Delivery is synchronous, on the emitting
 * thread, in subscription order. A listener that throws is logged and skipped,
 * it never affects the run or the listeners after it.
 */
public class EventBus {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(RunListener listener) {
        listeners.add(listener);
    }

    public boolean unsubscribe(RunListener listener) {
        return listeners.remove(listener);
    }

    public List<RunListener> getListeners() {
        return List.copyOf(listeners);
    }

    public void emit(RunEvent event) {
        for (RunListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException | Error e) {
                logger.warn("listener {} failed on {}: {}", listener, event.getType().getValue(), e.getMessage());
                logger.debug("listener failure", e);
            }
        }
    }

}
