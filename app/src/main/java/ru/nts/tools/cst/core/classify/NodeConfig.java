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

import ru.nts.tools.cst.core.extract.NativeStrategy;
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.taxonomy.SemanticType;
import ru.nts.tools.cst.core.taxonomy.UniversalFlag;

import java.util.Objects;

/**
 * Запись таблицы классификации для одного типа узла грамматики.
 *
 * @param semanticType семантический тип
 * @param refinement уточнение (0-3), см. {@link ru.nts.tools.cst.core.taxonomy.Refinements}
 * @param flags безусловные универсальные флаги
 * @param keywordIfLeaf ставить флаг KEYWORD, только если у узла нет детей.
 *                      Само это условие никогда не попадает в выходные данные
 * @param nameStrategy способ извлечения имени
 * @param category категория стратегии нативного контекста
 * @param strategy стратегия, разрешенная при построении таблицы (null если нет)
 */
public record NodeConfig(
        SemanticType semanticType,
        int refinement,
        int flags,
        boolean keywordIfLeaf,
        NameStrategy nameStrategy,
        StrategyCategory category,
        NativeStrategy strategy
) {

    public NodeConfig {
        Objects.requireNonNull(semanticType, "semanticType");
        Objects.requireNonNull(nameStrategy, "nameStrategy");
        Objects.requireNonNull(category, "category");
        if (refinement < 0 || refinement > 3) {
            throw new IllegalArgumentException("Refinement out of range: " + refinement);
        }
        if ((flags & ~UniversalFlag.MASK) != 0) {
            throw new IllegalArgumentException("Unknown flag bits: 0x" + Integer.toHexString(flags));
        }
    }

    /**
     * Запись без имени, флагов и стратегии.
     */
    public static NodeConfig of(SemanticType semanticType) {
        return new NodeConfig(semanticType, 0, 0, false, NameStrategy.NONE, StrategyCategory.NONE, null);
    }

    public static NodeConfig of(SemanticType semanticType, NameStrategy nameStrategy) {
        return of(semanticType).withName(nameStrategy);
    }

    public boolean hasStrategy() {
        return strategy != null;
    }

    public NodeConfig withName(NameStrategy value) {
        return new NodeConfig(semanticType, refinement, flags, keywordIfLeaf, value, category, strategy);
    }

    public NodeConfig withRefinement(int value) {
        return new NodeConfig(semanticType, value, flags, keywordIfLeaf, nameStrategy, category, strategy);
    }

    public NodeConfig withFlags(UniversalFlag... value) {
        return new NodeConfig(semanticType, refinement, flags | UniversalFlag.mask(value), keywordIfLeaf,
                nameStrategy, category, strategy);
    }

    public NodeConfig asKeywordIfLeaf() {
        return new NodeConfig(semanticType, refinement, flags, true, nameStrategy, category, strategy);
    }

    public NodeConfig withCategory(StrategyCategory value) {
        return new NodeConfig(semanticType, refinement, flags, keywordIfLeaf, nameStrategy, value, strategy);
    }

    public NodeConfig withStrategy(NativeStrategy value) {
        return new NodeConfig(semanticType, refinement, flags, keywordIfLeaf, nameStrategy, category, value);
    }
}
