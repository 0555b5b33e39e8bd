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

import org.junit.jupiter.api.Test;
import ru.nts.tools.cst.core.extract.ExtractionOutcome;
import ru.nts.tools.cst.core.extract.NativeStrategy;
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.extract.StrategySet;
import ru.nts.tools.cst.core.taxonomy.SemanticType;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationTableTest {

    private static final NativeStrategy NOOP = (node, source) -> ExtractionOutcome.ok(null);

    @Test
    void duplicateNodeTypeIsRejected() {
        ClassificationTable.Builder builder = ClassificationTable.builder("test")
                .put(NodeConfig.of(SemanticType.FLOW_LOOP), "for_statement");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> builder.put(NodeConfig.of(SemanticType.FLOW_CONDITIONAL), "for_statement"));
        assertTrue(e.getMessage().contains("for_statement"));
    }

    @Test
    void strategiesResolvedAtBuild() {
        StrategySet strategies = StrategySet.builder("test")
                .register(StrategyCategory.FUNCTION, NOOP)
                .build();

        ClassificationTable table = ClassificationTable.builder("test")
                .put(NodeConfig.of(SemanticType.DEFINITION_FUNCTION).withCategory(StrategyCategory.FUNCTION),
                        "function_definition")
                .put(NodeConfig.of(SemanticType.DEFINITION_CLASS).withCategory(StrategyCategory.CLASS),
                        "class_definition")
                .put(NodeConfig.of(SemanticType.FLOW_LOOP), "for_statement")
                .build(strategies);

        assertSame(NOOP, table.lookup("function_definition").strategy());
        assertNull(table.lookup("class_definition").strategy(), "No CLASS strategy registered");
        assertNull(table.lookup("for_statement").strategy());
        assertEquals(3, table.size());
        assertEquals("test", table.language());
    }

    @Test
    void lookupMissesReturnNull() {
        ClassificationTable table = ClassificationTable.builder("test").build(StrategySet.EMPTY);
        assertNull(table.lookup("anything"));
        assertNull(table.lookup(null));
        assertTrue(table.nodeTypes().isEmpty());
    }

    @Test
    void nodeConfigValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.of(SemanticType.FLOW_LOOP).withRefinement(4));
        NodeConfig config = NodeConfig.of(SemanticType.NAME_KEYWORD).asKeywordIfLeaf().withName(NameStrategy.NODE_TEXT);
        assertTrue(config.keywordIfLeaf());
        assertEquals(NameStrategy.NODE_TEXT, config.nameStrategy());
        assertEquals(StrategyCategory.NONE, config.category());
    }
}
