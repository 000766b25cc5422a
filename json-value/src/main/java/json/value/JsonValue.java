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

import json.value.internal.Utils;

import java.util.List;
import java.util.Map;

/// The interface that represents a JSON value.
///
/// Instances of `JsonValue` are immutable and thread safe. They are built
/// with the `of` factories of each subtype or converted from plain Java
/// objects with {@link Json#fromUntyped(Object)}.
///
/// The tree is walked recursively by consumers such as a JSON writer; there
/// is no parser in this module.
public sealed interface JsonValue
        permits JsonString, JsonNumber, JsonObject, JsonArray, JsonBoolean, JsonNull {

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw Utils.composeTypeError(this, "JsonBoolean");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw Utils.composeTypeError(this, "JsonString");
    }

    /// {@return the {@link JsonArray#elements() elements} of a `JsonArray`}
    default List<JsonValue> elements() {
        throw Utils.composeTypeError(this, "JsonArray");
    }

    /// {@return the {@link JsonObject#members() members} of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw Utils.composeTypeError(this, "JsonObject");
    }
}
