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

/**
 * Четыре концептуальные полосы таксономии (биты 6-7 семантического кода).
 */
public enum SuperKind {
    DATA_STRUCTURE,
    COMPUTATION,
    CONTROL_EFFECTS,
    META_EXTERNAL;

    /**
     * Значение битов 6-7 в семантическом коде.
     */
    public int code() {
        return ordinal() << 6;
    }

    public static SuperKind fromCode(int semanticCode) {
        return values()[(semanticCode & 0xC0) >> 6];
    }
}
