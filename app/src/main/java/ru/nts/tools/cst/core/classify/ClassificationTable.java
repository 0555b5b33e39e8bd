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
package ru.nts.tools.cst.core.classify;

import ru.nts.tools.cst.core.extract.StrategySet;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Неизменяемая таблица "тип узла грамматики -> NodeConfig" для одного языка.
 * Стратегии нативного контекста разрешаются один раз в {@link Builder#build(StrategySet)}.
 */
public final class ClassificationTable {

    private final String language;
    private final Map<String, NodeConfig> entries;

    private ClassificationTable(String language, Map<String, NodeConfig> entries) {
        this.language = language;
        this.entries = Map.copyOf(entries);
    }

    public static Builder builder(String language) {
        return new Builder(language);
    }

    public String language() {
        return language;
    }

    /**
     * Точное совпадение по типу узла.
     *
     * @return запись или null, если тип не описан
     */
    public NodeConfig lookup(String nodeType) {
        return nodeType != null ? entries.get(nodeType) : null;
    }

    public Set<String> nodeTypes() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {

        private final String language;
        private final Map<String, NodeConfig> entries = new HashMap<>();

        private Builder(String language) {
            this.language = Objects.requireNonNull(language, "language");
        }

        /**
         * Одна запись для нескольких типов узлов.
         */
        public Builder put(NodeConfig config, String... nodeTypes) {
            Objects.requireNonNull(config, "config");
            for (String nodeType : nodeTypes) {
                if (entries.putIfAbsent(nodeType, config) != null) {
                    throw new IllegalStateException("Duplicate node type '" + nodeType + "' for " + language);
                }
            }
            return this;
        }

        public ClassificationTable build(StrategySet strategies) {
            Map<String, NodeConfig> resolved = new HashMap<>();
            for (Map.Entry<String, NodeConfig> entry : entries.entrySet()) {
                NodeConfig config = entry.getValue();
                resolved.put(entry.getKey(), config.withStrategy(strategies.resolve(config.category())));
            }
            return new ClassificationTable(language, resolved);
        }
    }
}
