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
package ru.nts.tools.cst.core.language;

import ru.nts.tools.cst.core.classify.NodeClassifier;
import ru.nts.tools.cst.core.extract.StrategySet;

import java.util.List;
import java.util.Objects;

/**
 * Зарегистрированный язык: идентификатор, псевдонимы, расширения файлов,
 * классификатор узлов и набор стратегий нативного контекста.
 *
 * @param id канонический идентификатор (совпадает с идентификатором грамматики tree-sitter)
 * @param aliases альтернативные имена (например "py")
 * @param extensions расширения файлов без точки
 * @param classifier классификатор с уже разрешенными стратегиями
 * @param strategies набор стратегий, из которого разрешался классификатор
 */
public record LanguageDefinition(
        String id,
        List<String> aliases,
        List<String> extensions,
        NodeClassifier classifier,
        StrategySet strategies
) {

    public LanguageDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(strategies, "strategies");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        extensions = extensions != null ? List.copyOf(extensions) : List.of();
    }

    public boolean matches(String name) {
        return id.equals(name) || aliases.contains(name);
    }
}
