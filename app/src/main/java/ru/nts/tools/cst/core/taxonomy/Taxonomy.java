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
package ru.nts.tools.cst.core.taxonomy;

import java.util.Objects;
import java.util.Set;

/**
 * Семантическая классификация узла: тип, универсальные флаги и бин арности.
 * Единственное хранимое представление; упакованный код и KIND/подтип вычисляются.
 *
 * <p>Упакованный формат ({@link #encode()}):
 * биты 0-7 - семантический код (с уточнением), биты 8-11 - флаги, биты 12-14 - бин арности.
 *
 * @param semanticType семантический тип
 * @param refinement уточнение внутри типа (0-3)
 * @param universalFlags разрешенные флаги (только биты {@link UniversalFlag#MASK})
 * @param arityBin бин количества дочерних узлов (0-7)
 */
public record Taxonomy(
        SemanticType semanticType,
        int refinement,
        int universalFlags,
        int arityBin
) {

    public Taxonomy {
        Objects.requireNonNull(semanticType, "semanticType");
        if (refinement < 0 || refinement > 3) {
            throw new IllegalArgumentException("Refinement out of range: " + refinement);
        }
        if ((universalFlags & ~UniversalFlag.MASK) != 0) {
            throw new IllegalArgumentException("Unknown universal flag bits: 0x" + Integer.toHexString(universalFlags));
        }
        if (arityBin < 0 || arityBin > ArityBin.MAX_BIN) {
            throw new IllegalArgumentException("Arity bin out of range: " + arityBin);
        }
    }

    /**
     * 8-битный семантический код вместе с уточнением.
     */
    public int semanticCode() {
        return semanticType.code() | refinement;
    }

    public Kind kind() {
        return semanticType.kind();
    }

    public SuperKind superKind() {
        return semanticType.superKind();
    }

    public int subType() {
        return semanticType.subType();
    }

    public boolean hasFlag(UniversalFlag flag) {
        return flag.isSet(universalFlags);
    }

    public Set<UniversalFlag> flags() {
        return UniversalFlag.fromMask(universalFlags);
    }

    /**
     * Нормализованное имя типа (например "DEFINITION_FUNCTION").
     */
    public String normalizedName() {
        return semanticType.name();
    }

    public int encode() {
        return semanticCode() | (universalFlags << 8) | (arityBin << 12);
    }

    public static Taxonomy decode(int packed) {
        int code = packed & 0xFF;
        return new Taxonomy(
                SemanticType.fromCode(code),
                code & 0x03,
                (packed >> 8) & UniversalFlag.MASK,
                (packed >> 12) & 0x07);
    }
}
