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
 * Стратегии нативного контекста для Python.
 * Параметры: param, param: type, param=default, *args, **kwargs.
 */
public final class PythonNativeStrategies {

    private PythonNativeStrategies() {}

    static final Set<String> CONTAINERS = Set.of("class_definition", "function_definition");

    public static StrategySet create() {
        return StrategySet.builder("python")
                .register(StrategyCategory.FUNCTION, guarded(PythonNativeStrategies::extractFunction))
                .register(StrategyCategory.CLASS, guarded(PythonNativeStrategies::extractClass))
                .register(StrategyCategory.VARIABLE, guarded(PythonNativeStrategies::extractAssignment))
                .register(StrategyCategory.CALL, guarded(PythonNativeStrategies::extractCall))
                .register(StrategyCategory.IMPORT, guarded(PythonNativeStrategies::extractImport))
                .build();
    }

    static NativeContext extractFunction(SyntaxNode node, SourceText source) {
        if (node.type().equals("lambda")) {
            return EMPTY.withParameters(parameters(findChildByType(node, "lambda_parameters"), source));
        }
        String name = identifierName(node, source);
        return new NativeContext(
                text(findChildByType(node, "type"), source),
                parameters(findChildByType(node, "parameters"), source),
                collectModifiers(node, source),
                qualifiedName(node, source, name, CONTAINERS),
                decorators(node, source));
    }

    static NativeContext extractClass(SyntaxNode node, SourceText source) {
        String name = identifierName(node, source);
        String bases = "";
        SyntaxNode argumentList = findChildByType(node, "argument_list");
        if (argumentList != null) {
            List<String> baseNames = new ArrayList<>();
            for (ParameterInfo base : callArguments(argumentList, source)) {
                baseNames.add(base.name());
            }
            bases = String.join(", ", baseNames);
        }
        return new NativeContext(
                bases,
                List.of(),
                List.of(),
                qualifiedName(node, source, name, CONTAINERS),
                decorators(node, source));
    }

    /**
     * assignment: left [":" type] ["=" right].
     */
    static NativeContext extractAssignment(SyntaxNode node, SourceText source) {
        SyntaxNode target = node.child(0);
        String name = target != null && target.type().equals("identifier") ? text(target, source) : "";
        return EMPTY
                .withSignatureType(text(findChildByType(node, "type"), source))
                .withQualifiedName(qualifiedName(node, source, name, CONTAINERS));
    }

    static NativeContext extractCall(SyntaxNode node, SourceText source) {
        SyntaxNode function = node.child(0);
        String callee = collapseWhitespace(text(function, source));
        String receiver = "";
        if (function != null && function.type().equals("attribute")) {
            receiver = collapseWhitespace(text(function.child(0), source));
        }
        List<ParameterInfo> arguments = new ArrayList<>();
        for (SyntaxNode argument : children(findChildByType(node, "argument_list"))) {
            if (isPunctuation(argument.type()) || argument.type().equals("comment")) {
                continue;
            }
            if (argument.type().equals("keyword_argument")) {
                String keyword = identifierName(argument, source);
                arguments.add(new ParameterInfo(keyword, "").withDefault(valueAfter(argument, "=", source)));
            } else {
                arguments.add(new ParameterInfo(collapseWhitespace(text(argument, source)), ""));
            }
        }
        return EMPTY.withSignatureType(receiver).withParameters(arguments).withQualifiedName(callee);
    }

    /**
     * import a.b / from a.b import c, d as e. Импортируемые имена возвращаются как параметры.
     */
    static NativeContext extractImport(SyntaxNode node, SourceText source) {
        String module = "";
        List<ParameterInfo> names = new ArrayList<>();
        boolean fromImport = node.type().equals("import_from_statement");
        boolean moduleSeen = false;
        for (SyntaxNode child : children(node)) {
            switch (child.type()) {
                case "dotted_name", "relative_import" -> {
                    if (fromImport && !moduleSeen) {
                        module = text(child, source);
                        moduleSeen = true;
                    } else {
                        names.add(new ParameterInfo(text(child, source), ""));
                    }
                }
                case "aliased_import" -> names.add(new ParameterInfo(
                        text(findChildByType(child, "dotted_name"), source), "")
                        .withAnnotations(text(findChildByType(child, "identifier"), source)));
                case "wildcard_import" -> names.add(new ParameterInfo("*", ""));
                default -> { }
            }
        }
        if (!fromImport && names.size() == 1) {
            module = names.get(0).name();
        }
        return EMPTY.withQualifiedName(module).withParameters(names)
                .withModifiers(fromImport ? List.of("from") : List.of());
    }

    static List<ParameterInfo> parameters(SyntaxNode paramList, SourceText source) {
        List<ParameterInfo> params = new ArrayList<>();
        for (SyntaxNode child : children(paramList)) {
            ParameterInfo param = switch (child.type()) {
                case "identifier" -> new ParameterInfo(text(child, source), "");
                case "typed_parameter" -> typedParameter(child, source);
                case "default_parameter" -> {
                    String name = text(findChildByType(child, "identifier"), source);
                    yield new ParameterInfo(name, "").withDefault(valueAfter(child, "=", source));
                }
                case "typed_default_parameter" -> {
                    String name = text(findChildByType(child, "identifier"), source);
                    String type = text(findChildByType(child, "type"), source);
                    yield new ParameterInfo(name, type).withDefault(valueAfter(child, "=", source));
                }
                case "list_splat_pattern" -> splat(child, "*", source);
                case "dictionary_splat_pattern" -> splat(child, "**", source);
                default -> null;
            };
            if (param != null && !param.name().isEmpty()) {
                params.add(param);
            }
        }
        return params;
    }

    private static ParameterInfo typedParameter(SyntaxNode node, SourceText source) {
        String type = text(findChildByType(node, "type"), source);
        SyntaxNode first = node.child(0);
        if (first != null && first.type().equals("list_splat_pattern")) {
            return new ParameterInfo(splat(first, "*", source).name(), type).asVariadic();
        }
        if (first != null && first.type().equals("dictionary_splat_pattern")) {
            return new ParameterInfo(splat(first, "**", source).name(), type).asVariadic();
        }
        return new ParameterInfo(text(findChildByType(node, "identifier"), source), type);
    }

    private static ParameterInfo splat(SyntaxNode node, String prefix, SourceText source) {
        return new ParameterInfo(prefix + text(findChildByType(node, "identifier"), source), "").asVariadic();
    }

    private static String valueAfter(SyntaxNode node, String separator, SourceText source) {
        boolean seen = false;
        for (SyntaxNode child : children(node)) {
            if (seen) {
                return collapseWhitespace(text(child, source));
            }
            seen = child.type().equals(separator);
        }
        return "";
    }

    /**
     * Декораторы лежат в родительском decorated_definition.
     */
    private static String decorators(SyntaxNode node, SourceText source) {
        SyntaxNode parent = node.parent();
        if (parent == null || !parent.type().equals("decorated_definition")) {
            return "";
        }
        return collectAnnotations(parent, source);
    }
}
