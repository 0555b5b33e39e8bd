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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Исходный текст файла в виде UTF-8 байтов.
 * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные,
 * поэтому все срезы делаются по байтам.
 * Экземпляр принадлежит одному вызову движка и не thread-safe.
 */
public final class SourceText {

    private final String content;
    private final byte[] bytes;
    private final CharsetDecoder decoder;

    private SourceText(String content, byte[] bytes) {
        this.content = content;
        this.bytes = bytes;
        this.decoder = newDecoder();
    }

    public static SourceText of(String content) {
        String text = content != null ? content : "";
        return new SourceText(text, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Создает текст из байтов. Некорректные UTF-8 последовательности заменяются на '?'
     * до разбора, чтобы смещения парсера совпадали со срезами.
     */
    public static SourceText of(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return of("");
        }
        return of(decode(newDecoder(), raw, 0, raw.length));
    }

    /**
     * Текст целиком (то, что передается парсеру).
     */
    public String content() {
        return content;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Возвращает срез [start, end). Невалидный диапазон дает пустую строку.
     */
    public String slice(int start, int end) {
        if (start < 0 || end > bytes.length || start >= end) {
            return "";
        }
        return decode(decoder, bytes, start, end - start);
    }

    /**
     * Текст узла по его байтовому диапазону.
     */
    public String text(SyntaxNode node) {
        if (node == null) {
            return "";
        }
        return slice(node.startByte(), node.endByte());
    }

    private static CharsetDecoder newDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .replaceWith("?");
    }

    private static String decode(CharsetDecoder decoder, byte[] source, int offset, int length) {
        try {
            decoder.reset();
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(source, offset, length));
            return chars.toString();
        } catch (CharacterCodingException e) {
            // REPLACE не бросает, но контракт API требует обработки
            throw new IllegalStateException("UTF-8 decoding failed", e);
        }
    }
}
