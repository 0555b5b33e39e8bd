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

import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;

import java.util.Set;

import static ru.nts.tools.cst.core.extract.NativeExtractionSupport.*;

/**
 * Извлекает имя узла по {@link NameStrategy}.
 * Все операции ограничены прямыми детьми узла, результат "" если имя не найдено.
 */
public final class NameExtractor {

    private NameExtractor() {}

    private static final Set<String> ASSIGNMENT_TYPES = Set.of(
            "binary_operator", "variable_declarator", "init_declarator", "assignment",
            "assignment_expression", "augmented_assignment", "named_expression");

    private static final Set<String> MEMBER_ACCESS_TYPES = Set.of(
            "attribute", "member_expression", "field_expression", "selector_expression",
            "field_access", "scoped_identifier", "qualified_identifier");

    private static final Set<String> QUALIFIED_TYPES = Set.of(
            "qualified_identifier", "scoped_identifier", "scoped_type_identifier", "dotted_name");

    private static final Set<String> PROPERTY_TYPES = Set.of("property_identifier", "field_identifier");

    private static final Set<String> IDENTIFIER_SET = Set.copyOf(IDENTIFIER_TYPES);

    public static String extract(SyntaxNode node, SourceText source, NameStrategy strategy) {
        if (node == null || strategy == null) {
            return "";
        }
        return switch (strategy) {
            case NONE -> "";
            case NODE_TEXT -> text(node, source);
            case FIRST_CHILD -> text(node.child(0), source);
            case FIND_IDENTIFIER -> identifierName(node, source);
            case FIND_PROPERTY -> {
                SyntaxNode property = findChildByTypes(node, PROPERTY_TYPES);
                yield property != null ? text(property, source) : identifierName(node, source);
            }
            case FIND_ASSIGNMENT_TARGET -> assignmentTarget(node, source);
            case FIND_QUALIFIED_IDENTIFIER -> {
                SyntaxNode qualified = findChildByTypes(node, QUALIFIED_TYPES);
                yield qualified != null ? text(qualified, source) : identifierName(node, source);
            }
            case FIND_IN_DECLARATOR -> declaratorName(node, source);
            case FIND_CALL_TARGET -> callTarget(node, source);
        };
    }

    private static String assignmentTarget(SyntaxNode node, SourceText source) {
        String type = node.type();
        if (ASSIGNMENT_TYPES.contains(type) || type.endsWith("declarator")) {
            SyntaxNode first = node.child(0);
            if (first != null && IDENTIFIER_SET.contains(first.type())) {
                return text(first, source);
            }
        }
        // expression_statement -> assignment -> identifier
        SyntaxNode nested = findChildByTypes(node, ASSIGNMENT_TYPES);
        if (nested != null) {
            SyntaxNode first = nested.child(0);
            if (first != null && IDENTIFIER_SET.contains(first.type())) {
                return text(first, source);
            }
        }
        return identifierName(node, source);
    }

    private static String declaratorName(SyntaxNode node, SourceText source) {
        for (SyntaxNode child : children(node)) {
            if (child.type().endsWith("declarator")) {
                String name = identifierName(child, source);
                if (!name.isEmpty()) {
                    return name;
                }
            }
        }
        return identifierName(node, source);
    }

    /**
     * foo(...) -> foo; obj.method(...) -> method; иначе весь текст вызываемого выражения.
     */
    private static String callTarget(SyntaxNode node, SourceText source) {
        // Java method_invocation: [object "."] name argument_list
        if (node.type().equals("method_invocation")) {
            return text(findLastChildByTypes(node, Set.of("identifier")), source);
        }
        SyntaxNode first = node.child(0);
        if (first == null) {
            return "";
        }
        if (IDENTIFIER_SET.contains(first.type())) {
            return text(first, source);
        }
        if (MEMBER_ACCESS_TYPES.contains(first.type())) {
            SyntaxNode last = findLastChildByTypes(first, IDENTIFIER_SET);
            return last != null ? text(last, source) : text(first, source);
        }
        SyntaxNode identifier = findChildByType(node, "identifier");
        return identifier != null ? text(identifier, source) : "";
    }
}
