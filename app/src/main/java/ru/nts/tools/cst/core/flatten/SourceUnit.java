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

import ru.nts.tools.cst.core.treesitter.LanguageDetector;
import ru.nts.tools.cst.core.treesitter.ParseFailureException;
import ru.nts.tools.cst.core.treesitter.SourceText;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Единица работы для пакетного разбора: путь, язык и текст.
 */
public record SourceUnit(String path, String language, SourceText source) {

    public SourceUnit {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(source, "source");
        path = path != null ? path : "";
    }

    public static SourceUnit of(String path, String language, String content) {
        return new SourceUnit(path, language, SourceText.of(content));
    }

    /**
     * Читает файл; язык определяется по расширению или shebang.
     *
     * @throws ParseFailureException если язык определить не удалось
     */
    public static SourceUnit read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        SourceText source = SourceText.of(bytes);
        String language = LanguageDetector.detect(file, source.content())
                .orElseThrow(() -> new ParseFailureException(null, "Cannot detect language for: " + file));
        return new SourceUnit(file.toString(), language, source);
    }
}
