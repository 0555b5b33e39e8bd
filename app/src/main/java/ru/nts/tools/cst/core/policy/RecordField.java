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

/**
 * Поле записи узла и минимальный уровень своей оси, при котором оно заполняется.
 * Имя колонки совпадает с именем поля в JSON.
 */
public enum RecordField {
    NODE_ID("node_id", Axis.ALWAYS, 0),
    TYPE("type", Axis.ALWAYS, 0),

    LANGUAGE("language", Axis.SOURCE, SourceLevel.INPUT_ONLY.ordinal()),
    FILE_PATH("file_path", Axis.SOURCE, SourceLevel.INPUT_ONLY.ordinal()),
    START_LINE("start_line", Axis.SOURCE, SourceLevel.LINES.ordinal()),
    END_LINE("end_line", Axis.SOURCE, SourceLevel.LINES.ordinal()),
    START_COLUMN("start_column", Axis.SOURCE, SourceLevel.FULL.ordinal()),
    END_COLUMN("end_column", Axis.SOURCE, SourceLevel.FULL.ordinal()),
    START_BYTE("start_byte", Axis.SOURCE, SourceLevel.FULL.ordinal()),
    END_BYTE("end_byte", Axis.SOURCE, SourceLevel.FULL.ordinal()),

    PARENT_ID("parent_id", Axis.STRUCTURE, StructureLevel.MINIMAL.ordinal()),
    DEPTH("depth", Axis.STRUCTURE, StructureLevel.MINIMAL.ordinal()),
    SIBLING_INDEX("sibling_index", Axis.STRUCTURE, StructureLevel.MINIMAL.ordinal()),
    CHILDREN_COUNT("children_count", Axis.STRUCTURE, StructureLevel.FULL.ordinal()),
    DESCENDANT_COUNT("descendant_count", Axis.STRUCTURE, StructureLevel.FULL.ordinal()),

    SEMANTIC_TYPE("semantic_type", Axis.CONTEXT, ContextLevel.NODE_TYPES_ONLY.ordinal()),
    UNIVERSAL_FLAGS("universal_flags", Axis.CONTEXT, ContextLevel.NODE_TYPES_ONLY.ordinal()),
    ARITY_BIN("arity_bin", Axis.CONTEXT, ContextLevel.NODE_TYPES_ONLY.ordinal()),
    NORMALIZED_TYPE("normalized_type", Axis.CONTEXT, ContextLevel.NODE_TYPES_ONLY.ordinal()),
    NAME("name", Axis.CONTEXT, ContextLevel.NORMALIZED.ordinal()),
    SIGNATURE_TYPE("signature_type", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),
    PARAMETERS("parameters", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),
    MODIFIERS("modifiers", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),
    QUALIFIED_NAME("qualified_name", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),
    ANNOTATIONS("annotations", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),
    EXTRACTION_ATTEMPTED("extraction_attempted", Axis.CONTEXT, ContextLevel.NATIVE.ordinal()),

    PREVIEW("preview", Axis.PREVIEW, PreviewLevel.SMART.ordinal());

    /**
     * Ось политики, которой управляется поле.
     */
    public enum Axis {
        ALWAYS,
        SOURCE,
        STRUCTURE,
        CONTEXT,
        PREVIEW
    }

    private final String column;
    private final Axis axis;
    private final int minimumLevel;

    RecordField(String column, Axis axis, int minimumLevel) {
        this.column = column;
        this.axis = axis;
        this.minimumLevel = minimumLevel;
    }

    public String column() {
        return column;
    }

    public Axis axis() {
        return axis;
    }

    /**
     * Заполняется ли поле при данной политике.
     */
    public boolean isIncludedIn(ExtractionPolicy policy) {
        int level = switch (axis) {
            case ALWAYS -> 0;
            case SOURCE -> policy.source().ordinal();
            case STRUCTURE -> policy.structure().ordinal();
            case CONTEXT -> policy.context().ordinal();
            case PREVIEW -> policy.previewLevel().ordinal();
        };
        return level >= minimumLevel;
    }
}
