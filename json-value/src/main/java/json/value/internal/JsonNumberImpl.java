/*
 * Copyright (c) 2025, 2026, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.  Oracle designates this
 * particular file as subject to the "Classpath" exception as provided
 * by Oracle in the LICENSE file that accompanied this code.
 *
 * This code is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE.  See the GNU General Public License
 * version 2 for more details (a copy is included in the LICENSE file that
 * accompanied this code).
 *
 * You should have received a copy of the GNU General Public License version
 * 2 along with this work; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA.
 *
 * Please contact Oracle, 500 Oracle Parkway, Redwood Shores, CA 94065 USA
 * or visit www.oracle.com if you need additional information or have any
 * questions.
 */

package json.value.internal;

import json.value.JsonNumber;

import java.util.Locale;
import java.util.Objects;

/// Implementation of `JsonNumber`, holding the number text as given.
public final class JsonNumberImpl implements JsonNumber {

    private final String text;

    /// @throws IllegalArgumentException if `text` is not a JSON number
    public JsonNumberImpl(String text) {
        Objects.requireNonNull(text, "text");
        if (!GRAMMAR.matcher(text).matches()) {
            throw new IllegalArgumentException("Not a JSON number: " + text);
        }
        this.text = text;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNumberImpl other && text.equalsIgnoreCase(other.text);
    }

    @Override
    public int hashCode() {
        return text.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
