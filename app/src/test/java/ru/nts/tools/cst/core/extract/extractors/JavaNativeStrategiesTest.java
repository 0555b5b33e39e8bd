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
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.extract.StrategySet;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaNativeStrategiesTest extends AbstractNativeStrategiesTest {

    @Override
    protected String language() {
        return "java";
    }

    @Test
    void methodSignature() {
        String code = """
                public class Service extends Base {
                    @Override
                    public static <T> List<T> process(final String name, int... counts) {
                        return null;
                    }
                }
                """;

        NativeContext ctx = extract(code, "method_declaration", JavaNativeStrategies::extractMethod);

        assertEquals("List<T>", ctx.signatureType(), "Return type");
        assertEquals(List.of("public", "static"), ctx.modifiers());
        assertEquals("@Override", ctx.annotations());
        assertEquals("Service.process", ctx.qualifiedName());

        List<ParameterInfo> params = ctx.parameters();
        assertEquals(2, params.size());
        assertEquals("name", params.get(0).name());
        assertEquals("String", params.get(0).type());
        assertFalse(params.get(0).isVariadic());
        assertEquals("counts", params.get(1).name());
        assertEquals("int", params.get(1).type());
        assertTrue(params.get(1).isVariadic(), "int... is variadic");
    }

    @Test
    void parameterAnnotations() {
        String code = "class A { void handle(@NotNull String value) {} }";

        NativeContext ctx = extract(code, "method_declaration", JavaNativeStrategies::extractMethod);

        assertEquals("void", ctx.signatureType());
        assertEquals(1, ctx.parameters().size());
        assertEquals("@NotNull", ctx.parameters().get(0).annotations());
    }

    @Test
    void nestedQualifiedName() {
        String code = "class Outer { static class Inner { void run() {} } }";

        NativeContext ctx = extract(code, "method_declaration", JavaNativeStrategies::extractMethod);

        assertEquals("Outer.Inner.run", ctx.qualifiedName());
    }

    @Test
    void lambdaParameters() {
        String code = "class A { Object f = (a, b) -> a + b; }";

        NativeContext ctx = extract(code, "lambda_expression", JavaNativeStrategies::extractMethod);

        assertEquals(List.of("a", "b"), ctx.parameters().stream().map(ParameterInfo::name).toList());
        assertEquals("", ctx.qualifiedName());
    }

    @Test
    void classWithSuperclass() {
        String code = "public final class Service extends Base {}";

        NativeContext ctx = extract(code, "class_declaration", JavaNativeStrategies::extractClass);

        assertEquals("Base", ctx.signatureType());
        assertEquals(List.of("public", "final"), ctx.modifiers());
        assertEquals("Service", ctx.qualifiedName());
        assertTrue(ctx.parameters().isEmpty());
    }

    @Test
    void recordComponentsAreParameters() {
        String code = "public record Point(int x, int y) {}";

        NativeContext ctx = extract(code, "record_declaration", JavaNativeStrategies::extractClass);

        assertEquals(2, ctx.parameters().size());
        assertEquals("x", ctx.parameters().get(0).name());
        assertEquals("int", ctx.parameters().get(1).type());
    }

    @Test
    void fieldDeclaration() {
        String code = "class Config { private static final int MAX = 10; }";

        NativeContext ctx = extract(code, "field_declaration", JavaNativeStrategies::extractVariable);

        assertEquals("int", ctx.signatureType());
        assertEquals(List.of("private", "static", "final"), ctx.modifiers());
        assertEquals("Config.MAX", ctx.qualifiedName());
    }

    @Test
    void methodInvocation() {
        String code = "class A { void f() { System.out.println(\"hi\", x); } }";

        NativeContext ctx = extract(code, "method_invocation", JavaNativeStrategies::extractCall);

        assertEquals("System.out.println", ctx.qualifiedName());
        assertEquals("System.out", ctx.signatureType(), "Receiver");
        assertEquals(List.of("\"hi\"", "x"), ctx.parameters().stream().map(ParameterInfo::name).toList());
    }

    @Test
    void constructorCall() {
        String code = "class A { Object f() { return new ArrayList<>(10); } }";

        NativeContext ctx = extract(code, "object_creation_expression", JavaNativeStrategies::extractCall);

        assertEquals("ArrayList<>", ctx.signatureType());
        assertEquals(1, ctx.parameters().size());
        assertEquals("10", ctx.parameters().get(0).name());
    }

    @Test
    void staticWildcardImport() {
        NativeContext ctx = extract("import static java.util.Collections.*;", "import_declaration",
                JavaNativeStrategies::extractImport);

        assertEquals("java.util.Collections.*", ctx.qualifiedName());
        assertEquals(List.of("static"), ctx.modifiers());
    }

    @Test
    void plainImport() {
        NativeContext ctx = extract("import java.util.List;", "import_declaration",
                JavaNativeStrategies::extractImport);

        assertEquals("java.util.List", ctx.qualifiedName());
        assertTrue(ctx.modifiers().isEmpty());
    }

    @Test
    void allCategoriesRegistered() {
        StrategySet strategies = JavaNativeStrategies.create();
        for (StrategyCategory category : StrategyCategory.values()) {
            assertEquals(category != StrategyCategory.NONE, strategies.supports(category), category.name());
        }
    }
}
