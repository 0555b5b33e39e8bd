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

import ru.nts.tools.cst.core.extract.NativeContext;
import ru.nts.tools.cst.core.policy.RecordField;
import ru.nts.tools.cst.core.taxonomy.Taxonomy;

/**
 * Запись об одном узле дерева в порядке preorder.
 * Группы полей, не запрошенные политикой, равны null.
 *
 * @param id позиция в результате (индекс)
 * @param type тип узла по грамматике
 * @param location исходное положение (null при source NONE)
 * @param position положение в дереве (null при structure NONE)
 * @param classification таксономия и имя (null при context NONE)
 * @param nativeContext нативный контекст (null при context ниже NATIVE)
 * @param extractionAttempted запускалась ли стратегия для узла
 * @param preview превью текста (null при preview NONE)
 */
public record NodeRecord(
        int id,
        String type,
        SourceLocation location,
        TreePosition position,
        Classification classification,
        NativeContext nativeContext,
        boolean extractionAttempted,
        String preview
) {

    /**
     * parent_id корня.
     */
    public static final int NO_PARENT = -1;

    /**
     * Значение числового поля, которое не запрошено уровнем своей оси.
     */
    public static final int UNSET = -1;

    /**
     * Исходное положение. Строки и колонки 1-based, байты 0-based.
     */
    public record SourceLocation(
            String language,
            String filePath,
            int startLine,
            int endLine,
            int startColumn,
            int endColumn,
            int startByte,
            int endByte
    ) {}

    /**
     * Положение в дереве. childrenCount и descendantCount равны UNSET при structure MINIMAL.
     */
    public record TreePosition(
            int parentId,
            int depth,
            int siblingIndex,
            int childrenCount,
            int descendantCount
    ) {

        TreePosition withDescendantCount(int value) {
            return new TreePosition(parentId, depth, siblingIndex, childrenCount, value);
        }
    }

    /**
     * Классификация: упакованная таксономия и имя (null при context NODE_TYPES_ONLY).
     */
    public record Classification(Taxonomy taxonomy, String name) {

        public String normalizedType() {
            return taxonomy.normalizedName();
        }
    }

    NodeRecord withDescendantCount(int value) {
        return new NodeRecord(id, type, location, position.withDescendantCount(value),
                classification, nativeContext, extractionAttempted, preview);
    }

    public boolean isRoot() {
        return position != null && position.parentId() == NO_PARENT;
    }

    public int parentId() {
        return position != null ? position.parentId() : UNSET;
    }

    public int depth() {
        return position != null ? position.depth() : UNSET;
    }

    public int childrenCount() {
        return position != null ? position.childrenCount() : UNSET;
    }

    public int descendantCount() {
        return position != null ? position.descendantCount() : UNSET;
    }

    public String name() {
        return classification != null ? classification.name() : null;
    }

    /**
     * Значение поля или null, если поле не заполнено.
     * Числа возвращаются как Integer, таксономия как ее составные части.
     */
    public Object value(RecordField field) {
        return switch (field) {
            case NODE_ID -> id;
            case TYPE -> type;
            case LANGUAGE -> location != null ? location.language() : null;
            case FILE_PATH -> location != null ? location.filePath() : null;
            case START_LINE -> location != null ? set(location.startLine()) : null;
            case END_LINE -> location != null ? set(location.endLine()) : null;
            case START_COLUMN -> location != null ? set(location.startColumn()) : null;
            case END_COLUMN -> location != null ? set(location.endColumn()) : null;
            case START_BYTE -> location != null ? set(location.startByte()) : null;
            case END_BYTE -> location != null ? set(location.endByte()) : null;
            case PARENT_ID -> position != null ? position.parentId() : null;
            case DEPTH -> position != null ? position.depth() : null;
            case SIBLING_INDEX -> position != null ? position.siblingIndex() : null;
            case CHILDREN_COUNT -> position != null ? set(position.childrenCount()) : null;
            case DESCENDANT_COUNT -> position != null ? set(position.descendantCount()) : null;
            case SEMANTIC_TYPE -> classification != null ? classification.taxonomy().semanticCode() : null;
            case UNIVERSAL_FLAGS -> classification != null ? classification.taxonomy().universalFlags() : null;
            case ARITY_BIN -> classification != null ? classification.taxonomy().arityBin() : null;
            case NORMALIZED_TYPE -> classification != null ? classification.normalizedType() : null;
            case NAME -> classification != null ? classification.name() : null;
            case SIGNATURE_TYPE -> nativeContext != null ? nativeContext.signatureType() : null;
            case PARAMETERS -> nativeContext != null ? nativeContext.parameters() : null;
            case MODIFIERS -> nativeContext != null ? nativeContext.modifiers() : null;
            case QUALIFIED_NAME -> nativeContext != null ? nativeContext.qualifiedName() : null;
            case ANNOTATIONS -> nativeContext != null ? nativeContext.annotations() : null;
            case EXTRACTION_ATTEMPTED -> nativeContext != null ? extractionAttempted : null;
            case PREVIEW -> preview;
        };
    }

    private static Integer set(int value) {
        return value == UNSET ? null : value;
    }
}
