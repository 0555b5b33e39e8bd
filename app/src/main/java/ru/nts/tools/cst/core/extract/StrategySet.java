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
package ru.nts.tools.cst.core.extract;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Набор стратегий одного языка: не более одной стратегии на категорию.
 * Неизменяем после build(); разрешение выполняется один раз при регистрации языка.
 */
public final class StrategySet {

    public static final StrategySet EMPTY = builder("none").build();

    private final String language;
    private final Map<StrategyCategory, NativeStrategy> strategies;

    private StrategySet(String language, Map<StrategyCategory, NativeStrategy> strategies) {
        this.language = language;
        this.strategies = Collections.unmodifiableMap(strategies);
    }

    public static Builder builder(String language) {
        return new Builder(language);
    }

    public String language() {
        return language;
    }

    /**
     * Стратегия для категории или null, если категория не обогащается.
     */
    public NativeStrategy resolve(StrategyCategory category) {
        if (category == null || category == StrategyCategory.NONE) {
            return null;
        }
        return strategies.get(category);
    }

    public boolean supports(StrategyCategory category) {
        return resolve(category) != null;
    }

    public static final class Builder {

        private final String language;
        private final EnumMap<StrategyCategory, NativeStrategy> strategies = new EnumMap<>(StrategyCategory.class);

        private Builder(String language) {
            this.language = Objects.requireNonNull(language, "language");
        }

        public Builder register(StrategyCategory category, NativeStrategy strategy) {
            Objects.requireNonNull(strategy, "strategy");
            if (category == StrategyCategory.NONE) {
                throw new IllegalArgumentException("Category NONE cannot carry a strategy");
            }
            if (strategies.putIfAbsent(category, strategy) != null) {
                throw new IllegalStateException("Duplicate strategy for " + language + "/" + category);
            }
            return this;
        }

        public StrategySet build() {
            return new StrategySet(language, new EnumMap<>(strategies));
        }
    }
}
