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
import ru.nts.tools.cst.core.extract.ExtractionOutcome;
import ru.nts.tools.cst.core.extract.NativeContext;
import ru.nts.tools.cst.core.extract.NativeStrategy;
import ru.nts.tools.cst.core.extract.StrategyCategory;
import ru.nts.tools.cst.core.extract.StrategySet;
import ru.nts.tools.cst.core.language.LanguageDefinition;
import ru.nts.tools.cst.core.policy.ContextLevel;
import ru.nts.tools.cst.core.policy.ExtractionPolicy;
import ru.nts.tools.cst.core.policy.RecordField;
import ru.nts.tools.cst.core.policy.SourceLevel;
import ru.nts.tools.cst.core.policy.StructureLevel;
import ru.nts.tools.cst.core.preview.PreviewMode;
import ru.nts.tools.cst.core.taxonomy.SemanticType;
import ru.nts.tools.cst.core.taxonomy.UniversalFlag;
import ru.nts.tools.cst.core.treesitter.FixtureNode;
import ru.nts.tools.cst.core.treesitter.FixtureTree;
import ru.nts.tools.cst.core.treesitter.ParseFailureException;
import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;
import ru.nts.tools.cst.core.treesitter.SyntaxTree;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.cst.core.treesitter.FixtureNode.leaf;
import static ru.nts.tools.cst.core.treesitter.FixtureNode.node;

class FlatteningEngineTest {

    private final FlatteningEngine engine = new FlatteningEngine();
    private final LanguageDefinition fixture = FixtureLanguage.definition();

    private ParseResult flatten(FixtureTree tree, String source, ExtractionPolicy policy) {
        return engine.flatten(tree, SourceText.of(source), fixture, "fixture.txt", policy);
    }

    private ParseResult flatten(FixtureTree tree, String source, LanguageDefinition language,
                                ExtractionPolicy policy) {
        return engine.flatten(tree, SourceText.of(source), language, "fixture.txt", policy);
    }

    @Test
    void rootWithTwoLeaves() {
        String source = "a b";
        FixtureTree tree = FixtureTree.of("fixture", source,
                node("program", 0, 3, leaf("identifier", 0, 1), leaf("identifier", 2, 3)));

        ParseResult result = flatten(tree, source, ExtractionPolicy.defaults());

        assertEquals(3, result.nodeCount());
        assertEquals(1, result.maxDepth());

        NodeRecord root = result.node(0);
        assertEquals(2, root.childrenCount());
        assertEquals(2, root.descendantCount());
        assertEquals(NodeRecord.NO_PARENT, root.parentId());
        assertEquals(0, root.depth());
        assertTrue(root.isRoot());

        assertEquals(0, result.node(1).descendantCount());
        assertEquals(0, result.node(2).descendantCount());
        assertEquals(0, result.node(1).parentId());
        assertEquals(1, result.node(2).position().siblingIndex());
        assertEquals("a", result.node(1).name());
        assertEquals("b", result.node(2).name());
    }

    @Test
    void preorderDescendantInvariantOnRandomTrees() {
        for (long seed = 1; seed <= 25; seed++) {
            int size = (int) (seed * 13);
            ParseResult result = flatten(FixtureTree.random(seed, size), "", ExtractionPolicy.defaults());
            List<NodeRecord> nodes = result.nodes();
            assertEquals(size, nodes.size());

            for (int i = 0; i < nodes.size(); i++) {
                NodeRecord node = nodes.get(i);
                assertEquals(i, node.id());
                int last = i + node.descendantCount();
                assertTrue(last < nodes.size(), "Descendant range out of bounds at " + i);
                for (int j = i + 1; j <= last; j++) {
                    assertTrue(isDescendant(nodes, j, i), "Node " + j + " must descend from " + i);
                }
                if (last + 1 < nodes.size()) {
                    assertFalse(isDescendant(nodes, last + 1, i), "Node " + (last + 1) + " must not descend from " + i);
                }
                assertTrue(node.childrenCount() <= node.descendantCount(), "children <= descendants at " + i);
                if (i > 0) {
                    assertTrue(node.parentId() < i, "parent precedes child");
                    assertEquals(nodes.get(node.parentId()).depth() + 1, node.depth());
                }
            }
            assertEquals(nodes.size() - 1, result.root().descendantCount());
        }
    }

    private static boolean isDescendant(List<NodeRecord> nodes, int node, int ancestor) {
        int current = nodes.get(node).parentId();
        while (current != NodeRecord.NO_PARENT) {
            if (current == ancestor) {
                return true;
            }
            current = nodes.get(current).parentId();
        }
        return false;
    }

    @Test
    void deepTreeDoesNotOverflowStack() {
        int depth = 100_000;
        ParseResult result = flatten(FixtureTree.chain(depth), "", ExtractionPolicy.minimal()
                .withStructure(StructureLevel.FULL));

        assertEquals(depth + 1, result.nodeCount());
        assertEquals(depth, result.maxDepth());
        assertEquals(depth, result.root().descendantCount());
        assertEquals(0, result.node(depth).descendantCount());
    }

    @Test
    void rootPropertiesForEveryRandomTree() {
        for (long seed = 100; seed < 110; seed++) {
            NodeRecord root = flatten(FixtureTree.random(seed, 40), "", ExtractionPolicy.defaults()).root();
            assertEquals(0, root.depth());
            assertEquals(NodeRecord.NO_PARENT, root.parentId());
        }
    }

    @Test
    void deterministicOutput() {
        ExtractionPolicy policy = ExtractionPolicy.complete();
        ParseResult first = flatten(FixtureTree.random(7, 200), "", policy);
        ParseResult second = flatten(FixtureTree.random(7, 200), "", policy);

        assertEquals(first.nodes(), second.nodes());
        assertEquals(ParseResultJsonWriter.toJson(first).get("nodes"), ParseResultJsonWriter.toJson(second).get("nodes"));
    }

    @Test
    void sourceLocationIsOneBased() {
        String source = "a\n  bc";
        FixtureTree tree = FixtureTree.of("fixture", source,
                node("program", 0, 6, leaf("identifier", 0, 1), leaf("identifier", 4, 6)));

        ParseResult result = flatten(tree, source, ExtractionPolicy.defaults().withSource(SourceLevel.FULL));

        NodeRecord.SourceLocation location = result.node(2).location();
        assertEquals(2, location.startLine());
        assertEquals(2, location.endLine());
        assertEquals(3, location.startColumn());
        assertEquals(5, location.endColumn());
        assertEquals(4, location.startByte());
        assertEquals(6, location.endByte());
        assertEquals("fixture", location.language());
        assertEquals("fixture.txt", location.filePath());
        assertEquals(1, result.root().location().startLine());
        assertEquals(2, result.root().location().endLine());
    }

    @Test
    void keywordIfLeafResolvedAtEmission() {
        String source = "return; return x";
        FixtureTree tree = FixtureTree.of("fixture", source,
                node("program", 0, 16,
                        leaf("return_statement", 0, 6),
                        node("return_statement", 8, 16, leaf("identifier", 15, 16))));

        ParseResult result = flatten(tree, source, ExtractionPolicy.defaults());

        assertTrue(result.node(1).classification().taxonomy().hasFlag(UniversalFlag.KEYWORD));
        assertFalse(result.node(2).classification().taxonomy().hasFlag(UniversalFlag.KEYWORD));
        assertEquals(1, result.node(2).classification().taxonomy().arityBin());
    }

    @Test
    void unknownTypesFallBack() {
        FixtureTree tree = FixtureTree.of("fixture", "", node("program", 0, 0, leaf("weird_node_123", 0, 0)));

        NodeRecord weird = flatten(tree, "", ExtractionPolicy.complete()).node(1);

        assertEquals(SemanticType.UNCLASSIFIED, weird.classification().taxonomy().semanticType());
        assertFalse(weird.extractionAttempted());
        assertTrue(weird.nativeContext().isEmpty());
    }

    @Test
    void strategyFailureIsContained() {
        NativeStrategy throwsRaw = (node, source) -> {
            throw new IllegalStateException("unexpected child shape");
        };
        NativeStrategy guardedFailure = NativeStrategy.guarded((node, source) -> {
            throw new IndexOutOfBoundsException("bad offset");
        });
        StrategySet strategies = StrategySet.builder("fixture")
                .register(StrategyCategory.FUNCTION, throwsRaw)
                .register(StrategyCategory.CALL, guardedFailure)
                .build();

        String source = "f g h";
        FixtureTree tree = FixtureTree.of("fixture", source,
                node("program", 0, 5,
                        node("function_declaration", 0, 1, leaf("identifier", 0, 1)),
                        node("call_expression", 2, 3, leaf("identifier", 2, 3)),
                        leaf("identifier", 4, 5)));

        ParseResult result = flatten(tree, source, FixtureLanguage.definition(strategies), ExtractionPolicy.complete());

        assertEquals(6, result.nodeCount(), "Traversal continues after failures");
        NodeRecord function = result.node(1);
        assertTrue(function.extractionAttempted());
        assertTrue(function.nativeContext().isEmpty());
        assertEquals("f", function.name(), "Other fields stay intact");

        NodeRecord call = result.node(3);
        assertTrue(call.extractionAttempted());
        assertTrue(call.nativeContext().isEmpty());

        NodeRecord plain = result.node(5);
        assertFalse(plain.extractionAttempted(), "No strategy attached to identifiers");
        assertEquals("h", plain.name());
        assertEquals(5, result.root().descendantCount());
    }

    @Test
    void strategyResultIsRecorded() {
        NativeStrategy strategy = NativeStrategy.guarded((node, source) ->
                NativeContext.EMPTY.withQualifiedName("main." + source.text(node.child(0))));
        StrategySet strategies = StrategySet.builder("fixture").register(StrategyCategory.FUNCTION, strategy).build();

        String source = "run";
        FixtureTree tree = FixtureTree.of("fixture", source,
                node("function_declaration", 0, 3, leaf("identifier", 0, 3)));

        NodeRecord record = flatten(tree, source, FixtureLanguage.definition(strategies), ExtractionPolicy.complete())
                .root();

        assertTrue(record.extractionAttempted());
        assertEquals("main.run", record.nativeContext().qualifiedName());
    }

    @Test
    void strategiesNotInvokedBelowNative() {
        AtomicInteger calls = new AtomicInteger();
        NativeStrategy counting = (node, source) -> {
            calls.incrementAndGet();
            return ExtractionOutcome.ok(NativeContext.EMPTY);
        };
        StrategySet strategies = StrategySet.builder("fixture")
                .register(StrategyCategory.FUNCTION, counting)
                .register(StrategyCategory.CALL, counting)
                .build();
        LanguageDefinition language = FixtureLanguage.definition(strategies);

        for (ContextLevel level : List.of(ContextLevel.NONE, ContextLevel.NODE_TYPES_ONLY, ContextLevel.NORMALIZED)) {
            ParseResult result = flatten(FixtureTree.random(3, 300), "", language,
                    ExtractionPolicy.defaults().withContext(level));
            assertEquals(0, calls.get(), "No strategy calls at " + level);
            assertNull(result.root().nativeContext());
        }

        ParseResult result = flatten(FixtureTree.random(3, 300), "", language, ExtractionPolicy.complete());
        long eligible = result.nodes().stream()
                .filter(n -> n.type().equals("function_declaration") || n.type().equals("call_expression"))
                .count();
        assertEquals(eligible, calls.get());
        assertEquals(eligible, result.nodes().stream().filter(NodeRecord::extractionAttempted).count());
    }

    @Test
    void treeReleasedAfterSuccess() {
        FixtureTree tree = FixtureTree.random(1, 20);
        flatten(tree, "", ExtractionPolicy.defaults());
        assertTrue(tree.isClosed());
        assertEquals(1, tree.closeCount());
    }

    @Test
    void treeReleasedAfterFailure() {
        AtomicInteger closed = new AtomicInteger();
        SyntaxTree broken = new SyntaxTree() {
            @Override
            public SyntaxNode root() {
                throw new IllegalStateException("no root");
            }

            @Override
            public String language() {
                return "fixture";
            }

            @Override
            public boolean isClosed() {
                return closed.get() > 0;
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };

        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> engine.flatten(broken, SourceText.of(""), fixture, null, ExtractionPolicy.defaults()));
        assertEquals("fixture", e.getLanguage());
        assertEquals(1, closed.get());
    }

    @Test
    void nullPointerInsideWalkBecomesFileLevelError() {
        AtomicInteger closed = new AtomicInteger();
        SyntaxTree broken = new SyntaxTree() {
            @Override
            public SyntaxNode root() {
                throw new NullPointerException("node type");
            }

            @Override
            public String language() {
                return "fixture";
            }

            @Override
            public boolean isClosed() {
                return closed.get() > 0;
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };

        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> engine.flatten(broken, SourceText.of(""), fixture, null, ExtractionPolicy.defaults()));
        assertInstanceOf(NullPointerException.class, e.getCause());
        assertEquals(1, closed.get());
    }

    @Test
    void nullArgumentsRejectedAndTreeReleased() {
        FixtureTree tree = FixtureTree.random(2, 10);
        assertThrows(NullPointerException.class,
                () -> engine.flatten(tree, SourceText.of(""), fixture, null, null));
        assertTrue(tree.isClosed());
    }

    @Test
    void unknownLanguageIsFileLevelError() {
        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> engine.flatten(SourceText.of("x"), "cobol", null, ExtractionPolicy.defaults()));
        assertEquals("cobol", e.getLanguage());
    }

    @Test
    void minimalStructureSkipsCounts() {
        ParseResult result = flatten(FixtureTree.random(5, 50), "",
                ExtractionPolicy.defaults().withStructure(StructureLevel.MINIMAL));

        for (NodeRecord node : result.nodes()) {
            assertEquals(NodeRecord.UNSET, node.childrenCount());
            assertEquals(NodeRecord.UNSET, node.descendantCount());
            assertTrue(node.depth() >= 0);
        }
        assertEquals(NodeRecord.NO_PARENT, result.root().parentId());
    }

    @Test
    void populatedFieldsFollowPolicy() {
        String source = "f(x)\ny";
        List<ExtractionPolicy> policies = List.of(
                ExtractionPolicy.minimal(),
                ExtractionPolicy.minimal().withSource(SourceLevel.INPUT_ONLY),
                ExtractionPolicy.minimal().withSource(SourceLevel.LINES),
                ExtractionPolicy.minimal().withSource(SourceLevel.FULL),
                ExtractionPolicy.minimal().withStructure(StructureLevel.MINIMAL),
                ExtractionPolicy.minimal().withStructure(StructureLevel.FULL),
                ExtractionPolicy.minimal().withContext(ContextLevel.NODE_TYPES_ONLY),
                ExtractionPolicy.minimal().withContext(ContextLevel.NORMALIZED),
                ExtractionPolicy.minimal().withContext(ContextLevel.NATIVE),
                ExtractionPolicy.minimal().withPreview(PreviewMode.SMART),
                ExtractionPolicy.minimal().withPreview(PreviewMode.CUSTOM, 2),
                ExtractionPolicy.defaults(),
                ExtractionPolicy.complete());

        for (ExtractionPolicy policy : policies) {
            FixtureTree tree = FixtureTree.of("fixture", source,
                    node("program", 0, 6,
                            node("call_expression", 0, 4, leaf("identifier", 0, 1), leaf("identifier", 2, 3)),
                            leaf("identifier", 5, 6)));
            ParseResult result = flatten(tree, source, policy);
            for (NodeRecord node : result.nodes()) {
                for (RecordField field : RecordField.values()) {
                    boolean expected = policy.includes(field);
                    assertEquals(expected, node.value(field) != null,
                            field + " populated=" + !expected + " under " + policy);
                }
            }
        }
    }
}
