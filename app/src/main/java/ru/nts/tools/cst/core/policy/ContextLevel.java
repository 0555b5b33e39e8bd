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
package ru.nts.tools.cst.core.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * Детализация контекста: ничего, таксономия, плюс имя, плюс нативный контекст стратегии.
 */
public enum ContextLevel {
    NONE,
    NODE_TYPES_ONLY,
    NORMALIZED,
    NATIVE;

    public boolean isAtLeast(ContextLevel other) {
        return ordinal() >= other.ordinal();
    }

    public static Optional<ContextLevel> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
