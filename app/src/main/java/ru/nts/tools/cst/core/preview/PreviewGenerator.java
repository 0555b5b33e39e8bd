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
package ru.nts.tools.cst.core.preview;

import ru.nts.tools.cst.core.treesitter.SourceText;
import ru.nts.tools.cst.core.treesitter.SyntaxNode;

/**
 * Строит короткое текстовое превью узла.
 * Длины считаются в символах, обрезка никогда не разрывает суррогатную пару.
 */
public final class PreviewGenerator {

    private PreviewGenerator() {}

    public static final int DEFAULT_SIZE = 120;

    static final int SMART_WHOLE_LIMIT = 50;
    static final int LINE_WIDTH = 80;
    static final int TRUNCATED_WIDTH = 77;
    static final int COMPACT_SIZE = 60;
    static final int COMPACT_MIN_WORD_CUT = 30;
    static final String ELLIPSIS = "...";

    /**
     * Максимум байт UTF-8 на один char.
     */
    private static final int MAX_BYTES_PER_CHAR = 4;

    /**
     * Превью текста узла. Для ограниченных режимов декодируется только нужный префикс байт.
     */
    public static String preview(SyntaxNode node, SourceText source, PreviewMode mode, int size) {
        if (mode == PreviewMode.NONE) {
            return "";
        }
        int start = node.startByte();
        int end = node.endByte();
        int budget = byteBudget(mode, size);
        if (budget >= 0 && start >= 0 && end - start > budget) {
            end = start + budget;
        }
        return preview(source.slice(start, end), mode, size);
    }

    /**
     * Превью готового текста.
     *
     * @param text текст узла
     * @param mode режим
     * @param size размер для CUSTOM (при size <= 0 используется {@link #DEFAULT_SIZE})
     */
    public static String preview(String text, PreviewMode mode, int size) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return switch (mode) {
            case NONE -> "";
            case FULL -> text;
            case LINE -> firstLine(text);
            case SMART -> smart(text);
            case COMPACT -> compact(text);
            case SIGNATURE -> signature(text);
            case CUSTOM -> cut(text, size > 0 ? size : DEFAULT_SIZE);
        };
    }

    /**
     * Сколько байт нужно декодировать, чтобы результат совпал с превью полного текста.
     * -1 означает весь текст.
     */
    static int byteBudget(PreviewMode mode, int size) {
        return switch (mode) {
            case NONE -> 0;
            case SMART -> MAX_BYTES_PER_CHAR * (LINE_WIDTH + 1);
            case COMPACT -> MAX_BYTES_PER_CHAR * (COMPACT_SIZE + 1);
            case CUSTOM -> customBudget(size > 0 ? size : DEFAULT_SIZE);
            case FULL, LINE, SIGNATURE -> -1;
        };
    }

    private static int customBudget(int size) {
        long budget = (long) MAX_BYTES_PER_CHAR * ((long) size + 1);
        return budget > Integer.MAX_VALUE ? -1 : (int) budget;
    }

    static String smart(String text) {
        if (text.length() <= SMART_WHOLE_LIMIT) {
            return text;
        }
        String line = firstLine(text);
        if (line.length() > LINE_WIDTH) {
            return cut(line, TRUNCATED_WIDTH) + ELLIPSIS;
        }
        return line;
    }

    static String compact(String text) {
        if (text.length() <= COMPACT_SIZE) {
            return text;
        }
        String head = cut(text, COMPACT_SIZE);
        int lastSpace = Math.max(head.lastIndexOf(' '), head.lastIndexOf('\t'));
        if (lastSpace > COMPACT_MIN_WORD_CUT) {
            return head.substring(0, lastSpace) + ELLIPSIS;
        }
        return head + ELLIPSIS;
    }

    static String signature(String text) {
        if (lineBreakIndex(text) < 0) {
            return text;
        }
        int brace = text.indexOf('{');
        String head = brace >= 0 ? text.substring(0, brace) : firstLine(text);
        head = head.strip();
        if (brace < 0 && head.endsWith(":")) {
            head = head.substring(0, head.length() - 1);
        }
        return head.strip().replaceAll("\\s+", " ");
    }

    static String firstLine(String text) {
        int lineBreak = lineBreakIndex(text);
        return lineBreak < 0 ? text : text.substring(0, lineBreak);
    }

    private static int lineBreakIndex(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Первые length символов без разрыва суррогатной пары.
     */
    static String cut(String text, int length) {
        if (text.length() <= length) {
            return text;
        }
        int end = length;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
