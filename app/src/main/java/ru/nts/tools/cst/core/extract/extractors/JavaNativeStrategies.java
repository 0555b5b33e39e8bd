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
 * Стратегии нативного контекста для Java.
 */
public final class JavaNativeStrategies {

    private JavaNativeStrategies() {}

    static final Set<String> CONTAINERS = Set.of(
            "class_declaration", "interface_declaration", "enum_declaration",
            "record_declaration", "annotation_type_declaration");

    private static final Set<String> TYPE_NODES = Set.of(
            "type_identifier", "generic_type", "array_type", "integral_type",
            "floating_point_type", "boolean_type", "void_type",
            "scoped_type_identifier", "primitive_type");

    public static StrategySet create() {
        return StrategySet.builder("java")
                .register(StrategyCategory.FUNCTION, guarded(JavaNativeStrategies::extractMethod))
                .register(StrategyCategory.CLASS, guarded(JavaNativeStrategies::extractClass))
                .register(StrategyCategory.VARIABLE, guarded(JavaNativeStrategies::extractVariable))
                .register(StrategyCategory.CALL, guarded(JavaNativeStrategies::extractCall))
                .register(StrategyCategory.IMPORT, guarded(JavaNativeStrategies::extractImport))
                .build();
    }

    static NativeContext extractMethod(SyntaxNode node, SourceText source) {
        if (node.type().equals("lambda_expression")) {
            return EMPTY.withParameters(lambdaParameters(node, source));
        }
        String name = identifierName(node, source);
        return new NativeContext(
                returnType(node, source),
                parameters(findChildByType(node, "formal_parameters"), source),
                collectModifiers(node, source),
                qualifiedName(node, source, name, CONTAINERS),
                collectAnnotations(node, source));
    }

    static NativeContext extractClass(SyntaxNode node, SourceText source) {
        String name = identifierName(node, source);
        String superType = "";
        SyntaxNode superclass = findChildByType(node, "superclass");
        if (superclass != null) {
            superType = text(findChildByTypes(superclass, TYPE_NODES), source);
        }
        // Компоненты record-а - это его параметры
        List<ParameterInfo> components = parameters(findChildByType(node, "formal_parameters"), source);
        return new NativeContext(
                superType,
                components,
                collectModifiers(node, source),
                qualifiedName(node, source, name, CONTAINERS),
                collectAnnotations(node, source));
    }

    static NativeContext extractVariable(SyntaxNode node, SourceText source) {
        SyntaxNode declarator = findChildByType(node, "variable_declarator");
        String name = identifierName(declarator, source);
        return new NativeContext(
                text(findChildByTypes(node, TYPE_NODES), source),
                List.of(),
                collectModifiers(node, source),
                qualifiedName(node, source, name, CONTAINERS),
                collectAnnotations(node, source));
    }

    static NativeContext extractCall(SyntaxNode node, SourceText source) {
        SyntaxNode argumentList = findChildByType(node, "argument_list");
        List<ParameterInfo> arguments = callArguments(argumentList, source);
        if (node.type().equals("object_creation_expression")) {
            String type = text(findChildByTypes(node, TYPE_NODES), source);
            return EMPTY.withSignatureType(type).withParameters(arguments).withQualifiedName(type);
        }
        // method_invocation: [object "."] name argument_list
        int end = argumentList != null ? argumentList.startByte() : node.endByte();
        String callee = collapseWhitespace(source.slice(node.startByte(), end));
        String receiver = "";
        int dot = callee.lastIndexOf('.');
        if (dot > 0) {
            receiver = callee.substring(0, dot);
        }
        return EMPTY.withSignatureType(receiver).withParameters(arguments).withQualifiedName(callee);
    }

    static NativeContext extractImport(SyntaxNode node, SourceText source) {
        SyntaxNode target = findChildByTypes(node, Set.of("scoped_identifier", "identifier"));
        String name = text(target, source);
        if (findChildByType(node, "asterisk") != null) {
            name = name + ".*";
        }
        List<String> modifiers = findChildByType(node, "static") != null ? List.of("static") : List.of();
        return EMPTY.withQualifiedName(name).withModifiers(modifiers);
    }

    private static String returnType(SyntaxNode node, SourceText source) {
        // Тип стоит до имени метода; модификаторы и type_parameters пропускаются
        for (SyntaxNode child : children(node)) {
            String type = child.type();
            if (type.equals("identifier")) {
                break;
            }
            if (TYPE_NODES.contains(type)) {
                return text(child, source);
            }
        }
        return "";
    }

    static List<ParameterInfo> parameters(SyntaxNode paramsNode, SourceText source) {
        List<ParameterInfo> params = new ArrayList<>();
        for (SyntaxNode child : children(paramsNode)) {
            String childType = child.type();
            if (childType.equals("formal_parameter")) {
                ParameterInfo param = formalParameter(child, source);
                if (param != null) params.add(param);
            } else if (childType.equals("spread_parameter")) {
                ParameterInfo param = spreadParameter(child, source);
                if (param != null) params.add(param);
            }
        }
        return params;
    }

    private static ParameterInfo formalParameter(SyntaxNode paramNode, SourceText source) {
        String type = "";
        String name = null;
        for (SyntaxNode child : children(paramNode)) {
            String childType = child.type();
            if (childType.equals("modifiers")) {
                continue;
            }
            if (type.isEmpty() && TYPE_NODES.contains(childType)) {
                type = text(child, source);
            } else if (childType.equals("identifier")) {
                name = text(child, source);
            }
        }
        if (name == null) {
            return null;
        }
        return new ParameterInfo(name, type).withAnnotations(collectAnnotations(paramNode, source));
    }

    private static ParameterInfo spreadParameter(SyntaxNode paramNode, SourceText source) {
        String type = "";
        String name = null;
        for (SyntaxNode child : children(paramNode)) {
            String childType = child.type();
            if (TYPE_NODES.contains(childType)) {
                type = text(child, source);
            } else if (childType.equals("variable_declarator")) {
                name = identifierName(child, source);
            }
        }
        if (name == null) {
            return null;
        }
        return new ParameterInfo(name, type).asVariadic();
    }

    private static List<ParameterInfo> lambdaParameters(SyntaxNode node, SourceText source) {
        List<ParameterInfo> params = new ArrayList<>();
        SyntaxNode first = node.child(0);
        if (first == null) {
            return params;
        }
        switch (first.type()) {
            case "identifier" -> params.add(new ParameterInfo(text(first, source), ""));
            case "inferred_parameters" -> {
                for (SyntaxNode child : children(first)) {
                    if (child.type().equals("identifier")) {
                        params.add(new ParameterInfo(text(child, source), ""));
                    }
                }
            }
            case "formal_parameters" -> params.addAll(parameters(first, source));
            default -> { }
        }
        return params;
    }
}
