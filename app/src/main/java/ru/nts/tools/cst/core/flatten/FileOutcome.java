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
package ru.nts.tools.cst.core.flatten;

import ru.nts.tools.cst.core.treesitter.ParseFailureException;

/**
 * Итог разбора одного файла в пакете: либо результат, либо одна ошибка уровня файла.
 *
 * @param path путь файла
 * @param language язык
 * @param result результат (null при ошибке)
 * @param error ошибка (null при успехе)
 */
public record FileOutcome(String path, String language, ParseResult result, ParseFailureException error) {

    public FileOutcome {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static FileOutcome success(SourceUnit unit, ParseResult result) {
        return new FileOutcome(unit.path(), unit.language(), result, null);
    }

    public static FileOutcome failure(SourceUnit unit, ParseFailureException error) {
        return new FileOutcome(unit.path(), unit.language(), null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
