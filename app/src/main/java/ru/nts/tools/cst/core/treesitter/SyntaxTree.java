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

/**
 * Дерево разбора, принадлежащее одному вызову движка.
 * После close() навигация по узлам запрещена.
 */
public interface SyntaxTree extends AutoCloseable {

    /**
     * Корневой узел дерева.
     *
     * @throws IllegalStateException если дерево уже закрыто
     */
    SyntaxNode root();

    /**
     * Идентификатор языка, которым было разобрано дерево.
     */
    String language();

    boolean isClosed();

    @Override
    void close();
}
