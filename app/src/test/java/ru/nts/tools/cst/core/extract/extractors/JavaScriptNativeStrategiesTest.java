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

import org.junit.jupiter.api.Test;
import ru.nts.tools.cst.core.extract.NativeContext;
import ru.nts.tools.cst.core.extract.ParameterInfo;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptNativeStrategiesTest extends AbstractNativeStrategiesTest {

    @Override
    protected String language() {
        return "javascript";
    }

    @Test
    void functionParameters() {
        String code = "function greet(name, greeting = \"hi\", ...rest) {}";

        NativeContext ctx = extract(code, "function_declaration", JavaScriptNativeStrategies::extractFunction);

        assertEquals("greet", ctx.qualifiedName());
        List<ParameterInfo> params = ctx.parameters();
        assertEquals(3, params.size());
        assertEquals("name", params.get(0).name());
        assertEquals("greeting", params.get(1).name());
        assertEquals("\"hi\"", params.get(1).defaultValue());
        assertTrue(params.get(1).isOptional());
        assertEquals("...rest", params.get(2).name());
        assertTrue(params.get(2).isVariadic());
    }

    @Test
    void asyncAndGeneratorModifiers() {
        NativeContext async = extract("async function load() {}", "function_declaration",
                JavaScriptNativeStrategies::extractFunction);
        assertEquals(List.of("async"), async.modifiers());

        NativeContext generator = extract("function* gen() {}", "generator_function_declaration",
                JavaScriptNativeStrategies::extractFunction);
        assertEquals(List.of("generator"), generator.modifiers());
    }

    @Test
    void arrowFunctionTakesDeclaratorName() {
        NativeContext ctx = extract("const add = (a, b) => a + b;", "arrow_function",
                JavaScriptNativeStrategies::extractFunction);

        assertEquals("add", ctx.qualifiedName());
        assertEquals(List.of("a", "b"), ctx.parameters().stream().map(ParameterInfo::name).toList());
    }

    @Test
    void arrowFunctionSingleParameter() {
        NativeContext ctx = extract("const twice = x => x * 2;", "arrow_function",
                JavaScriptNativeStrategies::extractFunction);

        assertEquals("twice", ctx.qualifiedName(), "Parameter must not be taken as the name");
        assertEquals(1, ctx.parameters().size());
        assertEquals("x", ctx.parameters().get(0).name());
    }

    @Test
    void methodQualifiedByClass() {
        String code = "class Dog extends Animal { bark(times) {} }";

        NativeContext method = extract(code, "method_definition", JavaScriptNativeStrategies::extractFunction);
        assertEquals("Dog.bark", method.qualifiedName());
        assertEquals(1, method.parameters().size());

        NativeContext cls = extract(code, "class_declaration", JavaScriptNativeStrategies::extractClass);
        assertEquals("Animal", cls.signatureType());
        assertEquals("Dog", cls.qualifiedName());
    }

    @Test
    void declaratorKind() {
        NativeContext ctx = extract("let counter = 0;", "variable_declarator",
                JavaScriptNativeStrategies::extractDeclarator);

        assertEquals(List.of("let"), ctx.modifiers());
        assertEquals("counter", ctx.qualifiedName());
    }

    @Test
    void memberCall() {
        NativeContext ctx = extract("console.log(\"a\", x);", "call_expression",
                JavaScriptNativeStrategies::extractCall);

        assertEquals("console.log", ctx.qualifiedName());
        assertEquals("console", ctx.signatureType());
        assertEquals(List.of("\"a\"", "x"), ctx.parameters().stream().map(ParameterInfo::name).toList());
    }

    @Test
    void constructorCall() {
        NativeContext ctx = extract("const m = new Map(entries);", "new_expression",
                JavaScriptNativeStrategies::extractCall);

        assertEquals("Map", ctx.signatureType());
        assertEquals("entries", ctx.parameters().get(0).name());
    }

    @Test
    void importClause() {
        String code = "import React, { useState, useEffect as ue } from 'react';";

        NativeContext ctx = extract(code, "import_statement", JavaScriptNativeStrategies::extractImport);

        assertEquals("react", ctx.qualifiedName());
        List<ParameterInfo> names = ctx.parameters();
        assertEquals(3, names.size());
        assertEquals("React", names.get(0).name());
        assertEquals("default", names.get(0).type());
        assertEquals("useState", names.get(1).name());
        assertEquals("useEffect", names.get(2).name());
    }

    @Test
    void namespaceImport() {
        NativeContext ctx = extract("import * as fs from 'fs';", "import_statement",
                JavaScriptNativeStrategies::extractImport);

        assertEquals("fs", ctx.qualifiedName());
        assertEquals("fs", ctx.parameters().get(0).name());
        assertEquals("namespace", ctx.parameters().get(0).type());
    }
}
