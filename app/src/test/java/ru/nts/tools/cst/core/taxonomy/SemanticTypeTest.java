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
package ru.nts.tools.cst.core.taxonomy;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SemanticTypeTest {

    @Test
    void codesAreUniqueAndRoundTrip() {
        Set<Integer> codes = new HashSet<>();
        for (SemanticType type : SemanticType.values()) {
            assertTrue(codes.add(type.code()), "Duplicate code for " + type);
            assertEquals(0, type.code() & 0x03, "Refinement bits must be clear in " + type);
            assertSame(type, SemanticType.fromCode(type.code()));
        }
        assertEquals(64, codes.size());
    }

    @Test
    void codeLayout() {
        assertEquals(0x70, SemanticType.DEFINITION_FUNCTION.code());
        assertEquals(0x78, SemanticType.DEFINITION_CLASS.code());
        assertEquals(0x50, SemanticType.COMPUTATION_CALL.code());
        assertEquals(0x00, SemanticType.LITERAL_NUMBER.code());
        assertEquals(0xEC, SemanticType.PARSER_CONSTRUCT.code());
    }

    @Test
    void fromCodeIgnoresRefinementBits() {
        assertSame(SemanticType.DEFINITION_FUNCTION, SemanticType.fromCode(0x70 | Refinements.Function.ASYNC));
        assertSame(SemanticType.FLOW_LOOP, SemanticType.fromCode(SemanticType.FLOW_LOOP.code() | 0x02));
    }

    @Test
    void hierarchy() {
        assertEquals(Kind.DEFINITION, SemanticType.DEFINITION_VARIABLE.kind());
        assertEquals(SuperKind.COMPUTATION, SemanticType.DEFINITION_VARIABLE.superKind());
        assertEquals(SuperKind.DATA_STRUCTURE, SemanticType.NAME_IDENTIFIER.superKind());
        assertEquals(SuperKind.CONTROL_EFFECTS, SemanticType.FLOW_JUMP.superKind());
        assertEquals(SuperKind.META_EXTERNAL, SemanticType.EXTERNAL_IMPORT.superKind());
        assertEquals(2, SemanticType.FLOW_JUMP.subType());
    }

    @Test
    void kindAndSuperKindDecodeFromCode() {
        int code = SemanticType.ERROR_CATCH.code();
        assertEquals(Kind.ERROR_HANDLING, Kind.fromCode(code));
        assertEquals(SuperKind.CONTROL_EFFECTS, SuperKind.fromCode(code));
    }

    @Test
    void fromName() {
        assertEquals(SemanticType.COMPUTATION_CALL, SemanticType.fromName(" computation_call ").orElseThrow());
        assertTrue(SemanticType.fromName("NOT_A_TYPE").isEmpty());
        assertTrue(SemanticType.fromName(null).isEmpty());
        assertEquals(Kind.COMPUTATION, Kind.fromName("COMPUTATION_NODE").orElseThrow());
    }

    @Test
    void predicates() {
        assertTrue(SemanticType.DEFINITION_MODULE.isDefinition());
        assertTrue(SemanticType.EXECUTION_INVOCATION.isCall());
        assertTrue(SemanticType.COMPUTATION_CALL.isCall());
        assertFalse(SemanticType.COMPUTATION_ACCESS.isCall());
        assertTrue(SemanticType.NAME_SCOPED.isIdentifier());
        assertFalse(SemanticType.NAME_KEYWORD.isIdentifier());
        assertTrue(SemanticType.FLOW_SYNC.isControlFlow());
        assertTrue(SemanticType.ERROR_FINALLY.isError());
        assertEquals(4, SemanticType.definitionTypes().size());
        assertTrue(SemanticType.searchableTypes().contains(SemanticType.EXTERNAL_IMPORT));
    }

    @Test
    void unclassifiedIsParserConstruct() {
        assertSame(SemanticType.PARSER_CONSTRUCT, SemanticType.UNCLASSIFIED);
    }
}
