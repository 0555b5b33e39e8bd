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
package ru.nts.tools.cst.core.treesitter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Дерево в памяти для тестов. Считает обращения к root() и закрытия.
 */
public final class FixtureTree implements SyntaxTree {

    private final String language;
    private final FixtureNode root;
    private boolean closed;
    private int closeCount;

    private FixtureTree(String language, FixtureNode root) {
        this.language = language;
        this.root = root;
    }

    /**
     * Связывает узлы с родителями и таблицей начала строк текста.
     */
    public static FixtureTree of(String language, String source, FixtureNode root) {
        int[] lineStarts = lineStarts(source != null ? source : "");
        Deque<FixtureNode> stack = new ArrayDeque<>();
        root.attach(null, lineStarts);
        stack.push(root);
        while (!stack.isEmpty()) {
            FixtureNode node = stack.pop();
            for (FixtureNode child : node.children()) {
                child.attach(node, lineStarts);
                stack.push(child);
            }
        }
        return new FixtureTree(language, root);
    }

    /**
     * Случайное дерево из count узлов (детерминировано по seed).
     */
    public static FixtureTree random(long seed, int count) {
        Random random = new Random(seed);
        List<FixtureNode> all = new ArrayList<>();
        FixtureNode root = FixtureNode.node("program", 0, 0);
        all.add(root);
        String[] types = {"function_declaration", "identifier", "call_expression", "(", "weird_node_123", "block"};
        for (int i = 1; i < count; i++) {
            FixtureNode parent = all.get(random.nextInt(all.size()));
            FixtureNode child = FixtureNode.node(types[random.nextInt(types.length)], 0, 0);
            parent.add(child);
            all.add(child);
        }
        return of("fixture", "", root);
    }

    /**
     * Цепочка глубины depth: каждый узел имеет одного ребенка.
     */
    public static FixtureTree chain(int depth) {
        FixtureNode root = FixtureNode.node("block", 0, 0);
        FixtureNode current = root;
        for (int i = 0; i < depth; i++) {
            FixtureNode next = FixtureNode.node("block", 0, 0);
            current.add(next);
            current = next;
        }
        return of("fixture", "", root);
    }

    private static int[] lineStarts(String source) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public SyntaxNode root() {
        if (closed) {
            throw new IllegalStateException("Tree is closed");
        }
        return root;
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    public int closeCount() {
        return closeCount;
    }

    @Override
    public void close() {
        closed = true;
        closeCount++;
    }
}
