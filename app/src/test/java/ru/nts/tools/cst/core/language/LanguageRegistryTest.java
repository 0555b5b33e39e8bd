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

import org.junit.jupiter.api.Test;
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.taxonomy.SemanticType;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageRegistryTest {

    private final LanguageRegistry registry = LanguageRegistry.getInstance();

    @Test
    void singleton() {
        assertSame(registry, LanguageRegistry.getInstance());
    }

    @Test
    void findByIdAndAlias() {
        assertEquals("python", registry.find("py").orElseThrow().id());
        assertEquals("javascript", registry.find("JS").orElseThrow().id());
        assertEquals("java", registry.find("Java").orElseThrow().id());
        assertTrue(registry.find("cobol").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void requireUnknownThrows() {
        assertThrows(IllegalArgumentException.class, () -> registry.require("cobol"));
    }

    @Test
    void detectByPath() {
        assertEquals("python", registry.detect(Path.of("tool.py")).orElseThrow().id());
        assertEquals("javascript", registry.detect(Path.of("index.mjs")).orElseThrow().id());
        assertTrue(registry.detect(Path.of("README.md")).isEmpty());
    }

    @Test
    void supportedLanguagesInRegistrationOrder() {
        assertEquals(List.of("java", "python", "javascript"), registry.supportedLanguages());
        assertTrue(registry.isSupported("py"));
    }

    @Test
    void strategiesAttachedToClassifications() {
        LanguageDefinition java = registry.require("java");

        assertTrue(java.classifier().classify("method_declaration").hasStrategy());
        assertSame(java.strategies().resolve(StrategyCategory.FUNCTION),
                java.classifier().classify("method_declaration").strategy());
        assertFalse(java.classifier().classify("if_statement").hasStrategy());
    }

    @Test
    void everyLanguageClassifiesCoreConstructs() {
        assertEquals(SemanticType.DEFINITION_FUNCTION,
                registry.require("python").classifier().classify("function_definition").semanticType());
        assertEquals(SemanticType.DEFINITION_FUNCTION,
                registry.require("javascript").classifier().classify("function_declaration").semanticType());
        assertEquals(SemanticType.DEFINITION_FUNCTION,
                registry.require("java").classifier().classify("method_declaration").semanticType());
    }

    @Test
    void definitionMatchesNames() {
        LanguageDefinition python = registry.require("python");
        assertTrue(python.matches("python"));
        assertTrue(python.matches("py"));
        assertFalse(python.matches("java"));
        assertTrue(python.extensions().contains("pyi"));
    }
}
