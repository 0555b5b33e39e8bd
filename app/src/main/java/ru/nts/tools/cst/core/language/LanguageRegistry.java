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

import ru.nts.tools.cst.core.Diagnostics;
import ru.nts.tools.cst.core.classify.ClassificationTable;
import ru.nts.tools.cst.core.classify.NodeClassifier;
import ru.nts.tools.cst.core.classify.languages.JavaNodeTypes;
import ru.nts.tools.cst.core.classify.languages.JavaScriptNodeTypes;
import ru.nts.tools.cst.core.classify.languages.PythonNodeTypes;
import ru.nts.tools.cst.core.extract.StrategySet;
import ru.nts.tools.cst.core.extract.extractors.JavaNativeStrategies;
import ru.nts.tools.cst.core.extract.extractors.JavaScriptNativeStrategies;
import ru.nts.tools.cst.core.extract.extractors.PythonNativeStrategies;
import ru.nts.tools.cst.core.treesitter.LanguageDetector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Реестр поддерживаемых языков.
 * Таблицы классификации и стратегии строятся один раз при первом обращении к реестру
 * и дальше только читаются, поэтому реестр безопасен для конкурентного использования.
 */
public final class LanguageRegistry {

    private static final LanguageRegistry INSTANCE = new LanguageRegistry();

    /**
     * Язык по каноническому id или псевдониму (в нижнем регистре).
     */
    private final Map<String, LanguageDefinition> byName;
    private final List<LanguageDefinition> languages;

    private LanguageRegistry() {
        List<LanguageDefinition> all = new ArrayList<>();
        all.add(register("java", List.of(), List.of("java"),
                JavaNativeStrategies.create(), JavaNodeTypes::create));
        all.add(register("python", List.of("py"), List.of("py", "pyi", "pyw"),
                PythonNativeStrategies.create(), PythonNodeTypes::create));
        all.add(register("javascript", List.of("js"), List.of("js", "mjs", "cjs", "jsx"),
                JavaScriptNativeStrategies.create(), JavaScriptNodeTypes::create));

        Map<String, LanguageDefinition> names = new LinkedHashMap<>();
        for (LanguageDefinition language : all) {
            names.put(language.id(), language);
            language.aliases().forEach(alias -> names.put(alias, language));
        }
        this.languages = List.copyOf(all);
        this.byName = Map.copyOf(names);
    }

    public static LanguageRegistry getInstance() {
        return INSTANCE;
    }

    private static LanguageDefinition register(String id, List<String> aliases, List<String> extensions,
                                               StrategySet strategies,
                                               Function<StrategySet, ClassificationTable> tableFactory) {
        ClassificationTable table = tableFactory.apply(strategies);
        Diagnostics.log("Registered language " + id + ": " + table.size() + " node types");
        return new LanguageDefinition(id, aliases, extensions, new NodeClassifier(table), strategies);
    }

    /**
     * Ищет язык по id или псевдониму (регистр не важен).
     */
    public Optional<LanguageDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Возвращает язык или бросает IllegalArgumentException.
     */
    public LanguageDefinition require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + name));
    }

    /**
     * Определяет язык по расширению файла.
     */
    public Optional<LanguageDefinition> detect(Path path) {
        return LanguageDetector.detect(path).flatMap(this::find);
    }

    public boolean isSupported(String name) {
        return find(name).isPresent();
    }

    public List<LanguageDefinition> languages() {
        return languages;
    }

    public List<String> supportedLanguages() {
        return languages.stream().map(LanguageDefinition::id).toList();
    }
}
