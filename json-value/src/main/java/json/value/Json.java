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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds `JsonValue` trees from untyped Java objects.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.fromUntyped(Map.of(
///     "user", Map.of("name", "Bob", "age", 25),
///     "scores", List.of(85, 90, 78)
/// ));
/// ```
public final class Json {

    /// {@return a `JsonValue` created from the given `src` object}
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Number*` | `JsonNumber` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `CharSequence` | `JsonString` |
    ///
    /// *The supported `Number` subclasses are: `Byte`,
    /// `Short`, `Integer`, `Long`, `Float`,
    /// `Double`, `BigInteger`, and `BigDecimal`.
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    ///         to a `JsonValue`.
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        }
        if (src instanceof JsonValue jv) {
            return jv;
        }
        if (src instanceof Map<?, ?> map) {
            Map<String, JsonValue> m = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                m.put(key, fromUntyped(entry.getValue()));
            }
            return JsonObject.of(m);
        }
        if (src instanceof List<?> list) {
            List<JsonValue> l = new ArrayList<>(list.size());
            for (Object o : list) {
                l.add(fromUntyped(o));
            }
            return JsonArray.of(l);
        }
        if (src instanceof CharSequence str) {
            return JsonString.of(str.toString());
        }
        if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        }
        if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        }
        if (src instanceof Float || src instanceof Double) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        if (src instanceof BigInteger bi) {
            return JsonNumber.of(bi);
        }
        if (src instanceof BigDecimal bd) {
            return JsonNumber.of(bd);
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    // no instantiation is allowed for this class
    private Json() {}
}
