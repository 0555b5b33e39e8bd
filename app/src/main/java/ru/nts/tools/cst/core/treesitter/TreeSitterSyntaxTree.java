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

import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

/**
 * Дерево tree-sitter, обернутое в {@link SyntaxTree}.
 * Владеет TSTree эксклюзивно: после close() ссылка на дерево сбрасывается,
 * а любая навигация по ранее выданным узлам бросает IllegalStateException.
 */
public final class TreeSitterSyntaxTree implements SyntaxTree {

    private TSTree tree;
    private final String language;

    TreeSitterSyntaxTree(TSTree tree, String language) {
        this.tree = tree;
        this.language = language;
    }

    @Override
    public SyntaxNode root() {
        ensureOpen();
        return new Node(tree.getRootNode());
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public boolean isClosed() {
        return tree == null;
    }

    @Override
    public void close() {
        // Нативная память освобождается вместе с последней ссылкой на TSTree
        tree = null;
    }

    private void ensureOpen() {
        if (tree == null) {
            throw new IllegalStateException("Syntax tree for " + language + " is already closed");
        }
    }

    /**
     * Узел tree-sitter. Хранит ссылку на владеющее дерево для проверки закрытия.
     */
    private final class Node implements SyntaxNode {

        private final TSNode node;

        private Node(TSNode node) {
            this.node = node;
        }

        @Override
        public String type() {
            ensureOpen();
            return node.getType();
        }

        @Override
        public int startByte() {
            ensureOpen();
            return node.getStartByte();
        }

        @Override
        public int endByte() {
            ensureOpen();
            return node.getEndByte();
        }

        @Override
        public Point startPoint() {
            ensureOpen();
            TSPoint point = node.getStartPoint();
            return new Point(point.getRow(), point.getColumn());
        }

        @Override
        public Point endPoint() {
            ensureOpen();
            TSPoint point = node.getEndPoint();
            return new Point(point.getRow(), point.getColumn());
        }

        @Override
        public int childCount() {
            ensureOpen();
            return node.getChildCount();
        }

        @Override
        public SyntaxNode child(int index) {
            ensureOpen();
            if (index < 0 || index >= node.getChildCount()) {
                return null;
            }
            TSNode child = node.getChild(index);
            if (child == null || child.isNull()) {
                return null;
            }
            return new Node(child);
        }

        @Override
        public SyntaxNode parent() {
            ensureOpen();
            TSNode parent = node.getParent();
            if (parent == null || parent.isNull()) {
                return null;
            }
            return new Node(parent);
        }

        @Override
        public String toString() {
            return tree == null ? "<closed>" : node.getType();
        }
    }
}
