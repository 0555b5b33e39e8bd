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

import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;

/**
 * Стратегия извлечения нативного контекста для пары (язык, категория).
 *
 * <p>Контракт: реализация никогда не выпускает наружу внутреннюю ошибку.
 * Любой сбой (неверные смещения, неожиданная форма детей, отсутствующий подузел)
 * возвращается как {@link ExtractionOutcome#failed(Throwable)}.
 * Реализации собираются через {@link #guarded(Extractor)}, который этот контракт обеспечивает.
 */
@FunctionalInterface
public interface NativeStrategy {

    /**
     * Извлекает контекст узла.
     *
     * @param node узел, классифицированный в категорию стратегии
     * @param source полный исходный текст файла
     * @return контекст или описание сбоя
     */
    ExtractionOutcome extract(SyntaxNode node, SourceText source);

    /**
     * Оборачивает функцию извлечения так, что исключения превращаются в failed-результат.
     */
    static NativeStrategy guarded(Extractor extractor) {
        return (node, source) -> {
            try {
                return ExtractionOutcome.ok(extractor.extract(node, source));
            } catch (RuntimeException | StackOverflowError e) {
                return ExtractionOutcome.failed(e);
            }
        };
    }

    /**
     * Функция извлечения, которой разрешено бросать исключения.
     */
    @FunctionalInterface
    interface Extractor {
        NativeContext extract(SyntaxNode node, SourceText source);
    }
}
