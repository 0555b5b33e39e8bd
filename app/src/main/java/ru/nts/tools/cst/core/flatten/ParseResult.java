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

import ru.nts.tools.cst.core.policy.ExtractionPolicy;
import ru.nts.tools.cst.core.policy.RecordField;
import ru.nts.tools.cst.core.taxonomy.SemanticType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Результат разбора одного файла: записи узлов в preorder и сводные данные.
 *
 * @param language идентификатор языка
 * @param filePath путь файла (может быть пустым для текста без файла)
 * @param nodes записи узлов, индекс совпадает с id
 * @param maxDepth максимальная глубина
 * @param parseTime время начала разбора
 * @param policy политика, по которой строились записи
 */
public record ParseResult(
        String language,
        String filePath,
        List<NodeRecord> nodes,
        int maxDepth,
        Instant parseTime,
        ExtractionPolicy policy
) {

    public ParseResult {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(policy, "policy");
        filePath = filePath != null ? filePath : "";
        nodes = List.copyOf(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public NodeRecord root() {
        return nodes.get(0);
    }

    public NodeRecord node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("Node id " + id + " out of range [0, " + nodes.size() + ")");
        }
        return nodes.get(id);
    }

    public Optional<NodeRecord> parent(int id) {
        requireStructure();
        int parentId = node(id).parentId();
        return parentId == NodeRecord.NO_PARENT ? Optional.empty() : Optional.of(nodes.get(parentId));
    }

    /**
     * Прямые дети узла. Потомки лежат сразу за узлом, пока глубина больше глубины узла.
     */
    public List<NodeRecord> children(int id) {
        requireStructure();
        NodeRecord node = node(id);
        List<NodeRecord> children = new ArrayList<>();
        for (int i = id + 1; i < nodes.size() && nodes.get(i).depth() > node.depth(); i++) {
            if (nodes.get(i).parentId() == id) {
                children.add(nodes.get(i));
            }
        }
        return children;
    }

    public List<NodeRecord> findByType(String type) {
        return nodes.stream().filter(n -> n.type().equals(type)).toList();
    }

    /**
     * Узлы с указанным семантическим типом (требует context NODE_TYPES_ONLY и выше).
     */
    public List<NodeRecord> findBySemanticType(SemanticType semanticType) {
        return nodes.stream()
                .filter(n -> n.classification() != null
                        && n.classification().taxonomy().semanticType() == semanticType)
                .toList();
    }

    /**
     * Имена заполненных колонок в порядке {@link RecordField}.
     */
    public List<String> columns() {
        return policy.fields().stream().map(RecordField::column).toList();
    }

    private void requireStructure() {
        if (!policy.includes(RecordField.PARENT_ID)) {
            throw new IllegalStateException("Tree navigation requires structure level MINIMAL or higher");
        }
    }
}
