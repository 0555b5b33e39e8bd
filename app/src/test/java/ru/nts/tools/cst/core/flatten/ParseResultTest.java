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
package ru.nts.tools.cst.core.flatten;

import org.junit.jupiter.api.Test;
import ru.nts.tools.cst.core.policy.ExtractionPolicy;
import ru.nts.tools.cst.core.policy.StructureLevel;
import ru.nts.tools.cst.core.taxonomy.SemanticType;
import ru.nts.tools.cst.core.treesitter.FixtureTree;
import ru.nts.tools.cst.core.treesitter.SourceText;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.cst.core.treesitter.FixtureNode.leaf;
import static ru.nts.tools.cst.core.treesitter.FixtureNode.node;

class ParseResultTest {

    private static final String SOURCE = "f x y";

    private static ParseResult flatten(ExtractionPolicy policy) {
        FixtureTree tree = FixtureTree.of("fixture", SOURCE,
                node("program", 0, 5,
                        node("function_declaration", 0, 3, leaf("identifier", 0, 1), leaf("identifier", 2, 3)),
                        leaf("identifier", 4, 5)));
        return new FlatteningEngine().flatten(tree, SourceText.of(SOURCE), FixtureLanguage.definition(),
                "fixture.txt", policy);
    }

    @Test
    void children() {
        ParseResult result = flatten(ExtractionPolicy.defaults());

        assertEquals(List.of(1, 4), result.children(0).stream().map(NodeRecord::id).toList());
        assertEquals(List.of(2, 3), result.children(1).stream().map(NodeRecord::id).toList());
        assertTrue(result.children(4).isEmpty());
    }

    @Test
    void parent() {
        ParseResult result = flatten(ExtractionPolicy.defaults());

        assertEquals(1, result.parent(3).orElseThrow().id());
        assertEquals(0, result.parent(4).orElseThrow().id());
        assertTrue(result.parent(0).isEmpty());
    }

    @Test
    void navigationWorksWithMinimalStructure() {
        ParseResult result = flatten(ExtractionPolicy.defaults().withStructure(StructureLevel.MINIMAL));
        assertEquals(2, result.children(0).size());
    }

    @Test
    void navigationRequiresStructure() {
        ParseResult result = flatten(ExtractionPolicy.defaults().withStructure(StructureLevel.NONE));

        assertThrows(IllegalStateException.class, () -> result.children(0));
        assertThrows(IllegalStateException.class, () -> result.parent(1));
    }

    @Test
    void nodeOutOfRange() {
        ParseResult result = flatten(ExtractionPolicy.defaults());
        assertThrows(IndexOutOfBoundsException.class, () -> result.node(5));
        assertThrows(IndexOutOfBoundsException.class, () -> result.node(-1));
    }

    @Test
    void findByTypeAndSemanticType() {
        ParseResult result = flatten(ExtractionPolicy.defaults());

        assertEquals(3, result.findByType("identifier").size());
        assertEquals(1, result.findBySemanticType(SemanticType.DEFINITION_FUNCTION).size());
        assertEquals("f", result.findBySemanticType(SemanticType.DEFINITION_FUNCTION).get(0).name());
        assertTrue(flatten(ExtractionPolicy.minimal()).findBySemanticType(SemanticType.NAME_IDENTIFIER).isEmpty());
    }

    @Test
    void columnsFollowPolicy() {
        assertEquals(List.of("node_id", "type"), flatten(ExtractionPolicy.minimal()).columns());

        List<String> columns = flatten(ExtractionPolicy.defaults()).columns();
        assertEquals(List.of("node_id", "type", "language", "file_path", "start_line", "end_line",
                "parent_id", "depth", "sibling_index", "children_count", "descendant_count",
                "semantic_type", "universal_flags", "arity_bin", "normalized_type", "name", "preview"), columns);
    }

    @Test
    void nodesAreImmutable() {
        ParseResult result = flatten(ExtractionPolicy.defaults());
        assertThrows(UnsupportedOperationException.class, () -> result.nodes().remove(0));
        assertEquals(2, result.maxDepth());
        assertEquals(5, result.nodeCount());
    }
}
