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
 * Узел дерева разбора, доступный движку.
 * Навигация ограничена операциями, которые дает любой инкрементальный парсер:
 * тип, байтовый диапазон, позиции, дочерние узлы и родитель.
 * Все позиции 0-based, байтовые смещения считаются в UTF-8.
 */
public interface SyntaxNode {

    /**
     * Тип узла по грамматике (например "method_declaration" или "(").
     */
    String type();

    int startByte();

    int endByte();

    Point startPoint();

    Point endPoint();

    int childCount();

    /**
     * Возвращает дочерний узел по индексу.
     *
     * @param index индекс среди всех (в том числе анонимных) дочерних узлов
     * @return дочерний узел или null если индекс вне диапазона
     */
    SyntaxNode child(int index);

    /**
     * Возвращает родительский узел или null для корня.
     */
    SyntaxNode parent();

    /**
     * Позиция в исходном тексте (строка и колонка, 0-based).
     */
    record Point(int row, int column) {
    }
}
