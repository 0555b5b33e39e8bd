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
package ru.nts.tools.cst.core.extract.extractors;

import ru.nts.tools.cst.core.extract.NativeContext;
import ru.nts.tools.cst.core.extract.ParameterInfo;
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.extract.StrategySet;
import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static ru.nts.tools.cst.core.extract.NativeContext.EMPTY;
import static ru.nts.tools.cst.core.extract.NativeExtractionSupport.*;
import static ru.nts.tools.cst.core.extract.NativeStrategy.guarded;

/**
 * Стратегии нативного контекста для JavaScript.
 */
public final class JavaScriptNativeStrategies {

    private JavaScriptNativeStrategies() {}

    static final Set<String> CONTAINERS = Set.of(
            "class_declaration", "class", "function_declaration", "generator_function_declaration",
            "method_definition");

    private static final Set<String> ANONYMOUS_FUNCTIONS = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");

    public static StrategySet create() {
        return StrategySet.builder("javascript")
                .register(StrategyCategory.FUNCTION, guarded(JavaScriptNativeStrategies::extractFunction))
                .register(StrategyCategory.CLASS, guarded(JavaScriptNativeStrategies::extractClass))
                .register(StrategyCategory.VARIABLE, guarded(JavaScriptNativeStrategies::extractDeclarator))
                .register(StrategyCategory.CALL, guarded(JavaScriptNativeStrategies::extractCall))
                .register(StrategyCategory.IMPORT, guarded(JavaScriptNativeStrategies::extractImport))
                .build();
    }

    static NativeContext extractFunction(SyntaxNode node, SourceText source) {
        // у стрелочной функции идентификатор среди детей - это параметр или тело, а не имя
        String name = node.type().equals("arrow_function") ? "" : identifierName(node, source);
        if (name.isEmpty() && ANONYMOUS_FUNCTIONS.contains(node.type())) {
            // const f = () => ... : имя берется из variable_declarator
            SyntaxNode parent = node.parent();
            if (parent != null && parent.type().equals("variable_declarator")) {
                name = identifierName(parent, source);
            }
        }
        List<String> modifiers = collectModifiers(node, source);
        if (findChildByType(node, "*") != null) {
            modifiers = new ArrayList<>(modifiers);
            modifiers.add("generator");
        }
        return new NativeContext(
                "",
                functionParameters(node, source),
                modifiers,
                qualifiedName(node, source, name, CONTAINERS),
                collectAnnotations(node, source));
    }

    static NativeContext extractClass(SyntaxNode node, SourceText source) {
        String name = identifierName(node, source);
        String superType = "";
        SyntaxNode heritage = findChildByType(node, "class_heritage");
        if (heritage != null) {
            String text = collapseWhitespace(text(heritage, source));
            superType = text.startsWith("extends ") ? text.substring("extends ".length()) : text;
        }
        return new NativeContext(
                superType,
                List.of(),
                List.of(),
                qualifiedName(node, source, name, CONTAINERS),
                collectAnnotations(node, source));
    }

    /**
     * variable_declarator: вид объявления (const/let/var) берется из родителя.
     */
    static NativeContext extractDeclarator(SyntaxNode node, SourceText source) {
        String name = identifierName(node, source);
        List<String> modifiers = List.of();
        SyntaxNode declaration = node.parent();
        if (declaration != null) {
            SyntaxNode keyword = declaration.child(0);
            if (keyword != null && MODIFIER_KEYWORDS.contains(keyword.type())) {
                modifiers = List.of(keyword.type());
            }
        }
        return EMPTY.withModifiers(modifiers).withQualifiedName(qualifiedName(node, source, name, CONTAINERS));
    }

    static NativeContext extractCall(SyntaxNode node, SourceText source) {
        List<ParameterInfo> arguments = callArguments(findChildByType(node, "arguments"), source);
        if (node.type().equals("new_expression")) {
            String constructor = node.childCount() > 1 ? text(node.child(1), source) : "";
            return EMPTY.withSignatureType(constructor).withParameters(arguments).withQualifiedName(constructor);
        }
        SyntaxNode function = node.child(0);
        String callee = collapseWhitespace(text(function, source));
        String receiver = "";
        if (function != null && function.type().equals("member_expression")) {
            receiver = collapseWhitespace(text(function.child(0), source));
        }
        return EMPTY.withSignatureType(receiver).withParameters(arguments).withQualifiedName(callee);
    }

    /**
     * import x, { a, b as c } from 'module'. Имена возвращаются как параметры.
     */
    static NativeContext extractImport(SyntaxNode node, SourceText source) {
        String module = unquote(text(findChildByType(node, "string"), source));
        List<ParameterInfo> names = new ArrayList<>();
        SyntaxNode clause = findChildByType(node, "import_clause");
        for (SyntaxNode child : children(clause)) {
            switch (child.type()) {
                case "identifier" -> names.add(new ParameterInfo(text(child, source), "default"));
                case "namespace_import" -> names.add(new ParameterInfo(identifierName(child, source), "namespace"));
                case "named_imports" -> {
                    for (SyntaxNode specifier : children(child)) {
                        if (specifier.type().equals("import_specifier")) {
                            names.add(new ParameterInfo(text(specifier.child(0), source), ""));
                        }
                    }
                }
                default -> { }
            }
        }
        return EMPTY.withQualifiedName(module).withParameters(names);
    }

    private static List<ParameterInfo> functionParameters(SyntaxNode node, SourceText source) {
        List<ParameterInfo> params = new ArrayList<>();
        SyntaxNode paramsNode = findChildByType(node, "formal_parameters");
        if (paramsNode == null) {
            // x => x * 2
            SyntaxNode single = findChildByType(node, "identifier");
            if (single != null && node.type().equals("arrow_function")) {
                params.add(new ParameterInfo(text(single, source), ""));
            }
            return params;
        }
        for (SyntaxNode child : children(paramsNode)) {
            switch (child.type()) {
                case "identifier" -> params.add(new ParameterInfo(text(child, source), ""));
                case "assignment_pattern" -> {
                    SyntaxNode left = child.child(0);
                    SyntaxNode right = child.child(child.childCount() - 1);
                    params.add(new ParameterInfo(text(left, source), "")
                            .withDefault(collapseWhitespace(text(right, source))));
                }
                case "rest_pattern" -> params.add(
                        new ParameterInfo("..." + identifierName(child, source), "").asVariadic());
                case "object_pattern", "array_pattern" -> params.add(
                        new ParameterInfo(collapseWhitespace(text(child, source)), ""));
                default -> { }
            }
        }
        return params;
    }
}
