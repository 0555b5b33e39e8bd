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

import ru.nts.tools.cst.core.Diagnostics;
import ru.nts.tools.cst.core.classify.NameExtractor;
import ru.nts.tools.cst.core.classify.NodeClassifier;
import ru.nts.tools.cst.core.classify.NodeConfig;
import ru.nts.tools.cst.core.extract.ExtractionOutcome;
import ru.nts.tools.cst.core.extract.NativeContext;
import ru.nts.tools.cst.core.extract.NativeStrategy;
import ru.nts.tools.cst.core.flatten.NodeRecord.Classification;
import ru.nts.tools.cst.core.flatten.NodeRecord.SourceLocation;
import ru.nts.tools.cst.core.flatten.NodeRecord.TreePosition;
import ru.nts.tools.cst.core.language.LanguageDefinition;
import ru.nts.tools.cst.core.language.LanguageRegistry;
import ru.nts.tools.cst.core.policy.ExtractionPolicy;
import ru.nts.tools.cst.core.policy.SourceLevel;
import ru.nts.tools.cst.core.policy.StructureLevel;
import ru.nts.tools.cst.core.preview.PreviewGenerator;
import ru.nts.tools.cst.core.preview.PreviewMode;
import ru.nts.tools.cst.core.taxonomy.Taxonomy;
import ru.nts.tools.cst.core.treesitter.ParseFailureException;
import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;
import ru.nts.tools.cst.core.treesitter.SyntaxTree;
import ru.nts.tools.cst.core.treesitter.TreeSitterManager;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Превращает дерево разбора в плоскую последовательность записей в порядке preorder.
 *
 * <p>Обход идет по явному стеку, каждый узел посещается дважды. При первом посещении
 * выпускается запись и в стек кладутся дети (в обратном порядке). Второе посещение
 * происходит после выпуска всего поддерева: descendant_count = текущий размер результата
 * минус индекс узла минус один. Второе посещение нужно только при structure FULL.
 *
 * <p>Движок не хранит состояния между вызовами и может использоваться из нескольких потоков.
 */
public final class FlatteningEngine {

    private final LanguageRegistry registry;
    private final TreeSitterManager parsers;

    public FlatteningEngine() {
        this(LanguageRegistry.getInstance(), TreeSitterManager.getInstance());
    }

    public FlatteningEngine(LanguageRegistry registry, TreeSitterManager parsers) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.parsers = Objects.requireNonNull(parsers, "parsers");
    }

    /**
     * Разбирает текст и строит результат.
     *
     * @param source исходный текст
     * @param language идентификатор языка или псевдоним
     * @param filePath путь для записей (может быть null)
     * @param policy политика извлечения
     * @throws ParseFailureException если язык не поддерживается или дерево не построено
     */
    public ParseResult flatten(SourceText source, String language, String filePath, ExtractionPolicy policy) {
        Objects.requireNonNull(source, "source");
        LanguageDefinition definition = registry.find(language)
                .orElseThrow(() -> new ParseFailureException(language, "Unsupported language: " + language));
        Instant parseTime = Instant.now();
        SyntaxTree tree = parsers.parse(source, definition.id());
        return flatten(tree, source, definition, filePath, policy, parseTime);
    }

    /**
     * Читает файл, определяет язык (если language == null) и строит результат.
     */
    public ParseResult flattenFile(Path path, String language, ExtractionPolicy policy) throws IOException {
        Instant parseTime = Instant.now();
        TreeSitterManager.ParsedFile parsed = parsers.parseFile(path, language == null ? null
                : registry.find(language).map(LanguageDefinition::id).orElse(language));
        LanguageDefinition definition = registry.find(parsed.langId()).orElse(null);
        if (definition == null) {
            parsed.tree().close();
            throw new ParseFailureException(parsed.langId(), "Unsupported language: " + parsed.langId());
        }
        return flatten(parsed.tree(), parsed.source(), definition, path.toString(), policy, parseTime);
    }

    /**
     * Строит результат по готовому дереву. Дерево закрывается при любом исходе.
     */
    public ParseResult flatten(SyntaxTree tree, SourceText source, LanguageDefinition language,
                               String filePath, ExtractionPolicy policy) {
        return flatten(tree, source, language, filePath, policy, Instant.now());
    }

    private ParseResult flatten(SyntaxTree tree, SourceText source, LanguageDefinition language,
                                String filePath, ExtractionPolicy policy, Instant parseTime) {
        Objects.requireNonNull(tree, "tree");
        try (tree) {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(policy, "policy");
            try {
                return new Walk(source, language, filePath, policy).run(tree.root(), parseTime);
            } catch (ParseFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ParseFailureException(language.id(), "Flattening failed: " + e, e);
            }
        }
    }

    /**
     * Элемент стека обхода.
     */
    private static final class Frame {
        final SyntaxNode node;
        final int parentId;
        final int depth;
        final int siblingIndex;
        boolean visited;
        int index;

        Frame(SyntaxNode node, int parentId, int depth, int siblingIndex) {
            this.node = node;
            this.parentId = parentId;
            this.depth = depth;
            this.siblingIndex = siblingIndex;
        }
    }

    /**
     * Состояние одного обхода. Живет только внутри вызова flatten.
     */
    private static final class Walk {
        private final SourceText source;
        private final LanguageDefinition language;
        private final NodeClassifier classifier;
        private final String filePath;
        private final ExtractionPolicy policy;

        private final SourceLevel sourceLevel;
        private final StructureLevel structureLevel;
        private final boolean wantsTaxonomy;
        private final boolean wantsName;
        private final boolean wantsNative;
        private final PreviewMode previewMode;

        private final List<NodeRecord> nodes = new ArrayList<>();
        private int maxDepth;

        Walk(SourceText source, LanguageDefinition language, String filePath, ExtractionPolicy policy) {
            this.source = source;
            this.language = language;
            this.classifier = language.classifier();
            this.filePath = filePath != null ? filePath : "";
            this.policy = policy;
            this.sourceLevel = policy.source();
            this.structureLevel = policy.structure();
            this.wantsTaxonomy = policy.wantsTaxonomy();
            this.wantsName = policy.wantsName();
            this.wantsNative = policy.wantsNativeContext();
            this.previewMode = policy.previewMode();
        }

        ParseResult run(SyntaxNode root, Instant parseTime) {
            boolean secondVisit = structureLevel == StructureLevel.FULL;
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, NodeRecord.NO_PARENT, 0, 0));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.visited) {
                    stack.pop();
                    int descendants = nodes.size() - frame.index - 1;
                    nodes.set(frame.index, nodes.get(frame.index).withDescendantCount(descendants));
                    continue;
                }

                int index = nodes.size();
                SyntaxNode node = frame.node;
                int childCount = node.childCount();
                nodes.add(emit(node, index, frame, childCount));
                maxDepth = Math.max(maxDepth, frame.depth);

                if (secondVisit) {
                    frame.visited = true;
                    frame.index = index;
                } else {
                    stack.pop();
                }
                for (int i = childCount - 1; i >= 0; i--) {
                    SyntaxNode child = node.child(i);
                    if (child != null) {
                        stack.push(new Frame(child, index, frame.depth + 1, i));
                    }
                }
            }
            return new ParseResult(language.id(), filePath, nodes, maxDepth, parseTime, policy);
        }

        private NodeRecord emit(SyntaxNode node, int index, Frame frame, int childCount) {
            String type = node.type();

            SourceLocation location = sourceLevel == SourceLevel.NONE ? null : location(node);

            TreePosition position = switch (structureLevel) {
                case NONE -> null;
                case MINIMAL -> new TreePosition(frame.parentId, frame.depth, frame.siblingIndex,
                        NodeRecord.UNSET, NodeRecord.UNSET);
                case FULL -> new TreePosition(frame.parentId, frame.depth, frame.siblingIndex, childCount, 0);
            };

            Classification classification = null;
            NativeContext nativeContext = null;
            boolean attempted = false;
            if (wantsTaxonomy) {
                NodeConfig config = classifier.classify(type);
                Taxonomy taxonomy = NodeClassifier.taxonomy(config, childCount);
                String name = wantsName ? NameExtractor.extract(node, source, config.nameStrategy()) : null;
                classification = new Classification(taxonomy, name);
                if (wantsNative) {
                    NativeStrategy strategy = config.strategy();
                    if (strategy == null) {
                        nativeContext = NativeContext.EMPTY;
                    } else {
                        attempted = true;
                        nativeContext = runStrategy(strategy, node, type);
                    }
                }
            }

            String preview = previewMode == PreviewMode.NONE ? null
                    : PreviewGenerator.preview(node, source, previewMode, policy.previewSize());

            return new NodeRecord(index, type, location, position, classification, nativeContext, attempted, preview);
        }

        private SourceLocation location(SyntaxNode node) {
            if (sourceLevel == SourceLevel.INPUT_ONLY) {
                return new SourceLocation(language.id(), filePath, NodeRecord.UNSET, NodeRecord.UNSET,
                        NodeRecord.UNSET, NodeRecord.UNSET, NodeRecord.UNSET, NodeRecord.UNSET);
            }
            SyntaxNode.Point start = node.startPoint();
            SyntaxNode.Point end = node.endPoint();
            if (sourceLevel == SourceLevel.LINES) {
                return new SourceLocation(language.id(), filePath, start.row() + 1, end.row() + 1,
                        NodeRecord.UNSET, NodeRecord.UNSET, NodeRecord.UNSET, NodeRecord.UNSET);
            }
            return new SourceLocation(language.id(), filePath, start.row() + 1, end.row() + 1,
                    start.column() + 1, end.column() + 1, node.startByte(), node.endByte());
        }

        /**
         * Запуск стратегии. Сбой любой природы превращается в пустой контекст.
         */
        private NativeContext runStrategy(NativeStrategy strategy, SyntaxNode node, String type) {
            ExtractionOutcome outcome;
            try {
                outcome = strategy.extract(node, source);
            } catch (RuntimeException e) {
                outcome = ExtractionOutcome.failed(e);
            }
            if (outcome == null) {
                return NativeContext.EMPTY;
            }
            if (outcome.isFailure()) {
                Diagnostics.warn("Native context extraction failed for " + language.id() + " node '" + type
                        + "' at byte " + node.startByte(), outcome.failure());
                return NativeContext.EMPTY;
            }
            return outcome.context();
        }
    }
}
