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

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Определяет язык исходного файла по расширению, а для файлов без расширения по строке shebang.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    /**
     * Файловые признаки языка: основное расширение первым, затем прочие; имена интерпретаторов для shebang.
     */
    private record FileSignature(String language, List<String> extensions, Set<String> interpreters) {

        String primaryExtension() {
            return extensions.get(0);
        }
    }

    private static final List<FileSignature> SIGNATURES = List.of(
            new FileSignature("java", List.of("java"), Set.of("java")),
            new FileSignature("python", List.of("py", "pyi", "pyw"), Set.of("python", "pypy")),
            new FileSignature("javascript", List.of("js", "mjs", "cjs", "jsx"), Set.of("node", "nodejs")));

    private static final List<String> SUPPORTED_LANGUAGES =
            SIGNATURES.stream().map(FileSignature::language).toList();

    /**
     * Определяет язык по расширению файла (регистр не важен).
     *
     * @return идентификатор языка или empty, если расширение не зарегистрировано
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return SIGNATURES.stream()
                .filter(s -> s.extensions().contains(extension))
                .map(FileSignature::language)
                .findFirst();
    }

    /**
     * Определяет язык по расширению, а если его нет, то по интерпретатору из shebang.
     *
     * @param path путь к файлу
     * @param content содержимое файла (достаточно первой строки)
     */
    public static Optional<String> detect(Path path, String content) {
        Optional<String> byExtension = detect(path);
        if (byExtension.isPresent() || content == null || !content.startsWith("#!")) {
            return byExtension;
        }
        String interpreter = interpreter(content.lines().findFirst().orElse(""));
        return SIGNATURES.stream()
                .filter(s -> s.interpreters().contains(interpreter))
                .map(FileSignature::language)
                .findFirst();
    }

    /**
     * Имя интерпретатора из shebang без каталога и номера версии.
     * "#!/usr/bin/env -S python3.11 -u" дает "python".
     */
    static String interpreter(String shebang) {
        String[] words = shebang.substring(2).trim().split("\\s+");
        int i = 0;
        if (words.length > 0 && baseName(words[0]).equals("env")) {
            i = 1;
            while (i < words.length && words[i].startsWith("-")) {
                i++;
            }
        }
        if (i >= words.length) {
            return "";
        }
        String name = baseName(words[i]);
        int end = name.length();
        while (end > 0 && (Character.isDigit(name.charAt(end - 1)) || name.charAt(end - 1) == '.')) {
            end--;
        }
        return name.substring(0, end);
    }

    private static String baseName(String command) {
        return command.substring(command.lastIndexOf('/') + 1);
    }

    /**
     * Основное расширение файлов языка.
     */
    public static Optional<String> getFileExtension(String langId) {
        return SIGNATURES.stream()
                .filter(s -> s.language().equals(langId))
                .map(FileSignature::primaryExtension)
                .findFirst();
    }

    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }

    public static boolean isSupported(Path path) {
        return detect(path).isPresent();
    }
}
