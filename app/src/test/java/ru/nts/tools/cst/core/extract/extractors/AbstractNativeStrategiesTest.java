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
import ru.nts.tools.cst.core.extract.NativeStrategy;
import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;
import ru.nts.tools.cst.core.treesitter.SyntaxTree;
import ru.nts.tools.cst.core.treesitter.TreeSitterManager;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.junit.jupiter.api.Assertions.assertNotNull;

public abstract class AbstractNativeStrategiesTest {

    protected abstract String language();

    /**
     * Разбирает код, находит первый (в прямом порядке) узел типа nodeType и извлекает контекст.
     */
    protected NativeContext extract(String code, String nodeType, NativeStrategy.Extractor extractor) {
        SourceText source = SourceText.of(code);
        try (SyntaxTree tree = TreeSitterManager.getInstance().parse(source, language())) {
            SyntaxNode node = find(tree.root(), nodeType);
            assertNotNull(node, "Node '" + nodeType + "' not found in: " + code);
            return extractor.extract(node, source);
        }
    }

    private static SyntaxNode find(SyntaxNode root, String type) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.type().equals(type)) {
                return node;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
        return null;
    }
}
