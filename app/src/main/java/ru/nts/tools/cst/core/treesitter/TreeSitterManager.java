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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import ru.nts.tools.cst.core.Diagnostics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров.
 * Управляет пулом парсеров для различных языков.
 * Thread-safe через ThreadLocal парсеров: каждый поток разбирает свои файлы своим парсером.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Максимальный размер файла для парсинга (5MB).
     * Файлы большего размера не парсятся для предотвращения OOM.
     */
    private static final long MAX_PARSE_SIZE_BYTES = 5 * 1024 * 1024;

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Получает TSLanguage объект для указанного языка.
     * Ленивая загрузка - язык загружается только при первом обращении.
     *
     * @param langId идентификатор языка (java, python, javascript)
     * @return TSLanguage объект
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSLanguage getLanguage(String langId) {
        return languages.computeIfAbsent(langId, this::loadLanguage);
    }

    /**
     * Проверяет, есть ли грамматика для языка.
     */
    public boolean supports(String langId) {
        return LanguageDetector.getSupportedLanguages().contains(langId);
    }

    private TSLanguage loadLanguage(String langId) {
        Diagnostics.log("Loading tree-sitter grammar: " + langId);
        return switch (langId) {
            case "java" -> new TreeSitterJava();
            case "python" -> new TreeSitterPython();
            case "javascript" -> new TreeSitterJavascript();
            default -> throw new IllegalArgumentException("Unsupported language: " + langId);
        };
    }

    /**
     * Получает или создает TSParser для текущего потока.
     */
    private TSParser getParser(String langId) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(getLanguage(k));
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Разбирает текст и возвращает дерево, которым владеет вызывающий.
     *
     * @param source исходный текст
     * @param langId идентификатор языка
     * @return дерево разбора; закрывается вызывающим
     * @throws ParseFailureException если язык не поддерживается или парсер не вернул дерево
     */
    public SyntaxTree parse(SourceText source, String langId) {
        TSParser parser;
        try {
            parser = getParser(langId);
        } catch (IllegalArgumentException e) {
            throw new ParseFailureException(langId, e.getMessage(), e);
        }
        TSTree tree = parser.parseString(null, source.content());
        if (tree == null) {
            throw new ParseFailureException(langId, "Failed to parse content for language: " + langId);
        }
        return new TreeSitterSyntaxTree(tree, langId);
    }

    /**
     * Читает файл и разбирает его.
     *
     * @param path путь к файлу
     * @param langId идентификатор языка (если null, определяется по расширению)
     * @return дерево вместе с текстом
     * @throws IOException если файл не может быть прочитан
     * @throws ParseFailureException если язык не определен или файл слишком большой
     */
    public ParsedFile parseFile(Path path, String langId) throws IOException {
        String effectiveLangId = langId;
        if (effectiveLangId == null) {
            effectiveLangId = LanguageDetector.detect(path)
                    .orElseThrow(() -> new ParseFailureException(null,
                            "Cannot detect language for: " + path));
        }

        long fileSize = Files.size(path);
        if (fileSize > MAX_PARSE_SIZE_BYTES) {
            throw new ParseFailureException(effectiveLangId, String.format(
                    "File too large for AST parsing: %d bytes (max: %d bytes). Path: %s",
                    fileSize, MAX_PARSE_SIZE_BYTES, path));
        }

        SourceText source = SourceText.of(Files.readAllBytes(path));
        return new ParsedFile(path, effectiveLangId, source, parse(source, effectiveLangId));
    }

    /**
     * Разобранный файл: дерево и текст, из которого оно построено.
     */
    public record ParsedFile(Path path, String langId, SourceText source, SyntaxTree tree) {}
}
