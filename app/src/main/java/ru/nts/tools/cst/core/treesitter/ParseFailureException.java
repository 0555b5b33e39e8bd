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
package ru.nts.tools.cst.core.treesitter;

/**
 * Парсер не смог построить дерево для файла.
 * Ошибка фатальна для текущего файла и не повторяется внутри движка.
 */
public class ParseFailureException extends RuntimeException {

    private final String language;

    public ParseFailureException(String language, String message) {
        super(message);
        this.language = language;
    }

    public ParseFailureException(String language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
