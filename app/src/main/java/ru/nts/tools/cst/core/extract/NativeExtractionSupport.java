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

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Утилиты навигации по узлам для стратегий нативного контекста и извлечения имен.
 */
public final class NativeExtractionSupport {

    private NativeExtractionSupport() {}

    /**
     * Типы узлов, которые считаются "идентификатором" при поиске имени, в порядке приоритета.
     */
    public static final List<String> IDENTIFIER_TYPES = List.of(
            "identifier", "property_identifier", "field_identifier", "qualified_identifier",
            "name", "simple_identifier", "type_identifier");

    /**
     * Ключевые слова, которые считаются модификаторами, если встречаются как прямые дети объявления.
     */
    public static final Set<String> MODIFIER_KEYWORDS = Set.of(
            "public", "private", "protected", "static", "final", "abstract", "async",
            "synchronized", "native", "default", "transient", "volatile", "strictfp",
            "sealed", "non-sealed", "export", "get", "set", "readonly", "const", "let", "var");

    /**
     * Находит первый дочерний узел указанного типа.
     */
    public static SyntaxNode findChildByType(SyntaxNode parent, String type) {
        if (parent == null) return null;
        int childCount = parent.childCount();
        for (int i = 0; i < childCount; i++) {
            SyntaxNode child = parent.child(i);
            if (child != null && child.type().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Находит первый дочерний узел любого из указанных типов (порядок детей важнее порядка типов).
     */
    public static SyntaxNode findChildByTypes(SyntaxNode parent, Set<String> types) {
        if (parent == null) return null;
        int childCount = parent.childCount();
        for (int i = 0; i < childCount; i++) {
            SyntaxNode child = parent.child(i);
            if (child != null && types.contains(child.type())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Находит последний дочерний узел любого из указанных типов.
     */
    public static SyntaxNode findLastChildByTypes(SyntaxNode parent, Set<String> types) {
        if (parent == null) return null;
        for (int i = parent.childCount() - 1; i >= 0; i--) {
            SyntaxNode child = parent.child(i);
            if (child != null && types.contains(child.type())) {
                return child;
            }
        }
        return null;
    }

    public static List<SyntaxNode> children(SyntaxNode parent) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        int childCount = parent.childCount();
        for (int i = 0; i < childCount; i++) {
            SyntaxNode child = parent.child(i);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Текст узла. Для null возвращает пустую строку.
     */
    public static String text(SyntaxNode node, SourceText source) {
        return node != null ? source.text(node) : "";
    }

    /**
     * Имя из первого дочернего идентификатора (по приоритету {@link #IDENTIFIER_TYPES}).
     */
    public static String identifierName(SyntaxNode node, SourceText source) {
        for (String type : IDENTIFIER_TYPES) {
            SyntaxNode id = findChildByType(node, type);
            if (id != null) {
                return text(id, source);
            }
        }
        return "";
    }

    public static String collapseWhitespace(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    /**
     * Убирает кавычки строкового литерала ('x', "x", `x`).
     */
    public static String unquote(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if (first == last && (first == '"' || first == '\'' || first == '`')) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    /**
     * Собирает модификаторы: прямые дети-ключевые слова и содержимое дочернего узла "modifiers".
     * Аннотации пропускаются, их собирает {@link #collectAnnotations}.
     */
    public static List<String> collectModifiers(SyntaxNode node, SourceText source) {
        List<String> modifiers = new ArrayList<>();
        for (SyntaxNode child : children(node)) {
            String type = child.type();
            if (type.equals("modifiers")) {
                for (SyntaxNode modifier : children(child)) {
                    if (!isAnnotation(modifier.type())) {
                        modifiers.add(text(modifier, source));
                    }
                }
            } else if (MODIFIER_KEYWORDS.contains(type)) {
                modifiers.add(type);
            }
        }
        return modifiers;
    }

    /**
     * Собирает аннотации/декораторы (в том числе внутри "modifiers") через пробел.
     */
    public static String collectAnnotations(SyntaxNode node, SourceText source) {
        List<String> annotations = new ArrayList<>();
        for (SyntaxNode child : children(node)) {
            if (child.type().equals("modifiers")) {
                for (SyntaxNode modifier : children(child)) {
                    if (isAnnotation(modifier.type())) {
                        annotations.add(collapseWhitespace(text(modifier, source)));
                    }
                }
            } else if (isAnnotation(child.type()) || child.type().equals("decorator")) {
                annotations.add(collapseWhitespace(text(child, source)));
            }
        }
        return String.join(" ", annotations);
    }

    private static boolean isAnnotation(String type) {
        return type.equals("annotation") || type.equals("marker_annotation");
    }

    /**
     * Строит квалифицированное имя: имена охватывающих контейнеров через точку плюс собственное имя.
     *
     * @param node узел, для которого строится имя
     * @param source исходный текст
     * @param ownName собственное имя узла (может быть пустым)
     * @param containerTypes типы узлов-контейнеров (классы, функции, модули)
     * @return квалифицированное имя или ownName, если контейнеров нет
     */
    public static String qualifiedName(SyntaxNode node, SourceText source, String ownName, Set<String> containerTypes) {
        Deque<String> parts = new LinkedList<>();
        if (ownName != null && !ownName.isEmpty()) {
            parts.addFirst(ownName);
        }
        SyntaxNode current = node.parent();
        while (current != null) {
            if (containerTypes.contains(current.type())) {
                String containerName = identifierName(current, source);
                if (!containerName.isEmpty()) {
                    parts.addFirst(containerName);
                }
            }
            current = current.parent();
        }
        return String.join(".", parts);
    }

    /**
     * Аргументы вызова в виде параметров: имя = текст аргумента.
     * Скобки и запятые пропускаются.
     */
    public static List<ParameterInfo> callArguments(SyntaxNode argumentList, SourceText source) {
        List<ParameterInfo> arguments = new ArrayList<>();
        for (SyntaxNode child : children(argumentList)) {
            if (isPunctuation(child.type()) || child.type().equals("comment")) {
                continue;
            }
            arguments.add(new ParameterInfo(collapseWhitespace(text(child, source)), ""));
        }
        return arguments;
    }

    /**
     * Типы анонимных узлов-разделителей в списках параметров и аргументов.
     */
    public static boolean isPunctuation(String type) {
        return type.equals("(") || type.equals(")") || type.equals(",")
                || type.equals("[") || type.equals("]") || type.equals("{") || type.equals("}");
    }
}
