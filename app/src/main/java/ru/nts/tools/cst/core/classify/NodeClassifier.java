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

import ru.nts.tools.cst.core.taxonomy.ArityBin;
import ru.nts.tools.cst.core.taxonomy.SemanticType;
import ru.nts.tools.cst.core.taxonomy.Taxonomy;
import ru.nts.tools.cst.core.taxonomy.UniversalFlag;

import java.util.Objects;

/**
 * Классификатор узлов одного языка.
 *
 * <p>Сначала точный поиск в таблице, затем детерминированные правила по форме строки типа:
 * <ol>
 *   <li>нет букв и цифр - пунктуация</li>
 *   <li>*_declaration / *_definition - определение (класс, функция, модуль или переменная)</li>
 *   <li>*_expression - вычисление (вызов, если в имени есть "call")</li>
 *   <li>*_statement - оператор</li>
 *   <li>identifier / *_identifier - идентификатор</li>
 *   <li>*comment - комментарий</li>
 *   <li>иначе - UNCLASSIFIED без стратегии</li>
 * </ol>
 * Метод {@link #classify(String)} тотален и никогда не бросает исключений.
 */
public final class NodeClassifier {

    static final NodeConfig PUNCTUATION = NodeConfig.of(SemanticType.PARSER_PUNCTUATION);
    static final NodeConfig CLASS_LIKE = NodeConfig.of(SemanticType.DEFINITION_CLASS, NameStrategy.FIND_IDENTIFIER);
    static final NodeConfig FUNCTION_LIKE = NodeConfig.of(SemanticType.DEFINITION_FUNCTION, NameStrategy.FIND_IDENTIFIER);
    static final NodeConfig MODULE_LIKE = NodeConfig.of(SemanticType.DEFINITION_MODULE, NameStrategy.FIND_IDENTIFIER);
    static final NodeConfig VARIABLE_LIKE = NodeConfig.of(SemanticType.DEFINITION_VARIABLE, NameStrategy.FIND_IDENTIFIER);
    static final NodeConfig CALL_LIKE = NodeConfig.of(SemanticType.COMPUTATION_CALL);
    static final NodeConfig EXPRESSION_LIKE = NodeConfig.of(SemanticType.COMPUTATION_EXPRESSION);
    static final NodeConfig STATEMENT_LIKE = NodeConfig.of(SemanticType.EXECUTION_STATEMENT);
    static final NodeConfig IDENTIFIER_LIKE = NodeConfig.of(SemanticType.NAME_IDENTIFIER, NameStrategy.NODE_TEXT);
    static final NodeConfig COMMENT_LIKE = NodeConfig.of(SemanticType.METADATA_COMMENT);

    /**
     * Запись для нераспознанных типов.
     */
    public static final NodeConfig UNCLASSIFIED = NodeConfig.of(SemanticType.UNCLASSIFIED);

    private final ClassificationTable table;

    public NodeClassifier(ClassificationTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public ClassificationTable table() {
        return table;
    }

    public NodeConfig classify(String nodeType) {
        NodeConfig config = table.lookup(nodeType);
        return config != null ? config : fallback(nodeType);
    }

    /**
     * Разрешает итоговую таксономию: условный KEYWORD и бин арности зависят от количества детей.
     */
    public static Taxonomy taxonomy(NodeConfig config, int childCount) {
        int flags = config.flags();
        if (config.keywordIfLeaf() && childCount == 0) {
            flags |= UniversalFlag.KEYWORD.bit();
        }
        return new Taxonomy(config.semanticType(), config.refinement(), flags, ArityBin.bin(childCount));
    }

    static NodeConfig fallback(String nodeType) {
        if (nodeType == null || nodeType.isEmpty()) {
            return UNCLASSIFIED;
        }
        if (!hasLetterOrDigit(nodeType)) {
            return PUNCTUATION;
        }
        if (nodeType.endsWith("_declaration") || nodeType.endsWith("_definition")) {
            if (containsAny(nodeType, "class", "struct", "interface", "enum", "trait")) {
                return CLASS_LIKE;
            }
            if (containsAny(nodeType, "function", "method", "constructor")) {
                return FUNCTION_LIKE;
            }
            if (containsAny(nodeType, "module", "namespace", "package")) {
                return MODULE_LIKE;
            }
            return VARIABLE_LIKE;
        }
        if (nodeType.endsWith("_expression")) {
            return nodeType.contains("call") ? CALL_LIKE : EXPRESSION_LIKE;
        }
        if (nodeType.endsWith("_statement")) {
            return STATEMENT_LIKE;
        }
        if (nodeType.equals("identifier") || nodeType.endsWith("_identifier")) {
            return IDENTIFIER_LIKE;
        }
        if (nodeType.endsWith("comment")) {
            return COMMENT_LIKE;
        }
        return UNCLASSIFIED;
    }

    private static boolean hasLetterOrDigit(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetterOrDigit(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String value, String... parts) {
        for (String part : parts) {
            if (value.contains(part)) {
                return true;
            }
        }
        return false;
    }
}
