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
package ru.nts.tools.cst.core.policy;

import ru.nts.tools.cst.core.preview.PreviewGenerator;
import ru.nts.tools.cst.core.preview.PreviewMode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Политика извлечения: четыре независимые оси детализации.
 * Движок не выполняет работу для полей, которые политика не запрашивает.
 *
 * <p>Значения по умолчанию: context NORMALIZED, source LINES, structure FULL,
 * preview SMART, previewSize 120.
 *
 * @param context детализация контекста
 * @param source детализация исходного положения
 * @param structure детализация структуры
 * @param previewMode режим превью
 * @param previewSize размер превью для режима CUSTOM
 */
public record ExtractionPolicy(
        ContextLevel context,
        SourceLevel source,
        StructureLevel structure,
        PreviewMode previewMode,
        int previewSize
) {

    private static final ExtractionPolicy DEFAULTS = new ExtractionPolicy(
            ContextLevel.NORMALIZED, SourceLevel.LINES, StructureLevel.FULL,
            PreviewMode.SMART, PreviewGenerator.DEFAULT_SIZE);

    public ExtractionPolicy {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(previewMode, "previewMode");
        if (previewSize < 0) {
            throw new IllegalArgumentException("Preview size must be non-negative: " + previewSize);
        }
    }

    public static ExtractionPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Только идентификатор и тип узла.
     */
    public static ExtractionPolicy minimal() {
        return new ExtractionPolicy(ContextLevel.NONE, SourceLevel.NONE, StructureLevel.NONE,
                PreviewMode.NONE, PreviewGenerator.DEFAULT_SIZE);
    }

    /**
     * Все поля, включая нативный контекст и полный текст узлов.
     */
    public static ExtractionPolicy complete() {
        return new ExtractionPolicy(ContextLevel.NATIVE, SourceLevel.FULL, StructureLevel.FULL,
                PreviewMode.FULL, PreviewGenerator.DEFAULT_SIZE);
    }

    /**
     * Строит политику из текстовых имен уровней.
     * Нераспознанные или пустые значения заменяются значениями по умолчанию.
     * Превью может быть числом: это режим CUSTOM с таким размером.
     */
    public static ExtractionPolicy parse(String context, String source, String structure, String preview) {
        ContextLevel contextLevel = ContextLevel.fromName(context).orElse(DEFAULTS.context);
        SourceLevel sourceLevel = SourceLevel.fromName(source).orElse(DEFAULTS.source);
        StructureLevel structureLevel = StructureLevel.fromName(structure).orElse(DEFAULTS.structure);

        PreviewMode mode = DEFAULTS.previewMode;
        int size = DEFAULTS.previewSize;
        if (preview != null && !preview.isBlank()) {
            String trimmed = preview.trim();
            if (isInteger(trimmed)) {
                size = parseSize(trimmed);
                // нулевой размер означает отсутствие превью
                mode = size == 0 ? PreviewMode.NONE : PreviewMode.CUSTOM;
                size = size == 0 ? DEFAULTS.previewSize : size;
            } else {
                mode = PreviewMode.fromName(trimmed).orElse(DEFAULTS.previewMode);
            }
        }
        return new ExtractionPolicy(contextLevel, sourceLevel, structureLevel, mode, size);
    }

    private static boolean isInteger(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static int parseSize(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    public PreviewLevel previewLevel() {
        return switch (previewMode) {
            case NONE -> PreviewLevel.NONE;
            case SMART, LINE, COMPACT, SIGNATURE -> PreviewLevel.SMART;
            case FULL -> PreviewLevel.FULL;
            case CUSTOM -> PreviewLevel.CUSTOM;
        };
    }

    /**
     * Поля, которые заполняются при этой политике.
     */
    public Set<RecordField> fields() {
        EnumSet<RecordField> fields = EnumSet.noneOf(RecordField.class);
        for (RecordField field : RecordField.values()) {
            if (field.isIncludedIn(this)) {
                fields.add(field);
            }
        }
        return Collections.unmodifiableSet(fields);
    }

    public boolean includes(RecordField field) {
        return field.isIncludedIn(this);
    }

    public boolean wantsTaxonomy() {
        return context.isAtLeast(ContextLevel.NODE_TYPES_ONLY);
    }

    public boolean wantsName() {
        return context.isAtLeast(ContextLevel.NORMALIZED);
    }

    public boolean wantsNativeContext() {
        return context == ContextLevel.NATIVE;
    }

    public PerformanceTier performanceTier() {
        if (context == ContextLevel.NONE && structure == StructureLevel.NONE) {
            return PerformanceTier.FASTEST;
        }
        if (!context.isAtLeast(ContextLevel.NATIVE) && !structure.isAtLeast(StructureLevel.FULL)) {
            return PerformanceTier.FAST;
        }
        return PerformanceTier.RICH;
    }

    public ExtractionPolicy withContext(ContextLevel value) {
        return new ExtractionPolicy(value, source, structure, previewMode, previewSize);
    }

    public ExtractionPolicy withSource(SourceLevel value) {
        return new ExtractionPolicy(context, value, structure, previewMode, previewSize);
    }

    public ExtractionPolicy withStructure(StructureLevel value) {
        return new ExtractionPolicy(context, source, value, previewMode, previewSize);
    }

    public ExtractionPolicy withPreview(PreviewMode mode, int size) {
        return new ExtractionPolicy(context, source, structure, mode, size);
    }

    public ExtractionPolicy withPreview(PreviewMode mode) {
        return withPreview(mode, previewSize);
    }
}
