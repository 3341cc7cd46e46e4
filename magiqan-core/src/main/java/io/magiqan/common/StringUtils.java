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
package io.magiqan.common;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

public class StringUtils {

    private StringUtils() {
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String throwableToString(Throwable t) {
        try (final StringWriter sw = new StringWriter();
             final PrintWriter pw = new PrintWriter(sw, true)) {
            t.printStackTrace(pw);
            return sw.toString();
        } catch (IOException e) {
            return t.toString();
        }
    }

    /**
     * First line of the message, or the class name when there is none.
     */
    public static String firstLine(Throwable t) {
        String message = t.getMessage();
        if (isBlank(message)) {
            return t.getClass().getName();
        }
        int pos = message.indexOf('\n');
        return pos == -1 ? message : message.substring(0, pos);
    }

}
