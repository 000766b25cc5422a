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

package json.value;

import json.value.internal.JsonNumberImpl;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/// The interface that represents JSON number, an arbitrary-precision
/// number represented in base 10 using decimal digits.
///
/// The number keeps its textual form; `toString()` returns it unchanged so a
/// writer can emit it verbatim.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259#section-6 RFC 8259:
///      The JavaScript Object Notation (JSON) Data Interchange Format - Numbers
public non-sealed interface JsonNumber extends JsonValue {

    /// RFC 8259 `number` production.
    Pattern GRAMMAR = Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");

    /// {@return the JSON number text of this `JsonNumber`}
    @Override
    String toString();

    /// Creates a JSON number from the given `double` value using
    /// {@link Double#toString(double)}.
    ///
    /// @throws IllegalArgumentException if `num` is not finite.
    static JsonNumber of(double num) {
        if (!Double.isFinite(num)) {
            throw new IllegalArgumentException("Not a valid JSON number");
        }
        return new JsonNumberImpl(Double.toString(num));
    }

    /// Creates a JSON number from the given `long` value.
    static JsonNumber of(long num) {
        return new JsonNumberImpl(Long.toString(num));
    }

    /// Creates a JSON number from the given `BigInteger` value.
    static JsonNumber of(BigInteger num) {
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from the given `BigDecimal` value.
    static JsonNumber of(BigDecimal num) {
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from its textual form.
    ///
    /// @throws IllegalArgumentException if `num` is not a valid JSON number.
    static JsonNumber of(String num) {
        return new JsonNumberImpl(num);
    }
}
