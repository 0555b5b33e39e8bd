/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.cst.core.taxonomy;

import java.util.Locale;
import java.util.Optional;

/**
 * Шестнадцать категорий KIND (биты 4-7 семантического кода).
 * Каждые четыре подряд относятся к одной {@link SuperKind}.
 */
public enum Kind {
    // Data & Structure
    LITERAL,
    NAME,
    PATTERN,
    TYPE,

    // Computation
    OPERATOR,
    COMPUTATION,
    TRANSFORM,
    DEFINITION,

    // Control & Effects
    EXECUTION,
    FLOW_CONTROL,
    ERROR_HANDLING,
    ORGANIZATION,

    // Meta & External
    METADATA,
    EXTERNAL,
    PARSER_SPECIFIC,
    RESERVED;

    private static final Kind[] VALUES = values();

    /**
     * Значение битов 4-7 в семантическом коде.
     */
    public int code() {
        return ordinal() << 4;
    }

    public SuperKind superKind() {
        return SuperKind.values()[ordinal() >> 2];
    }

    public static Kind fromCode(int semanticCode) {
        return VALUES[(semanticCode & 0xF0) >> 4];
    }

    public static Optional<Kind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("COMPUTATION_NODE")) {
            return Optional.of(COMPUTATION);
        }
        for (Kind kind : VALUES) {
            if (kind.name().equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
