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
 * 3-битное разбиение количества дочерних узлов по Фибоначчи:
 * 0, 1, 2, 3, 4-5, 6-8, 9-13, 14+.
 */
public final class ArityBin {

    public static final int MAX_BIN = 7;

    private ArityBin() {}

    public static int bin(int childCount) {
        if (childCount <= 0) return 0;
        if (childCount == 1) return 1;
        if (childCount == 2) return 2;
        if (childCount == 3) return 3;
        if (childCount <= 5) return 4;
        if (childCount <= 8) return 5;
        if (childCount <= 13) return 6;
        return MAX_BIN;
    }

    /**
     * Наименьшее количество детей, попадающее в бин.
     */
    public static int lowerBound(int bin) {
        return switch (bin) {
            case 0 -> 0;
            case 1 -> 1;
            case 2 -> 2;
            case 3 -> 3;
            case 4 -> 4;
            case 5 -> 6;
            case 6 -> 9;
            case 7 -> 14;
            default -> throw new IllegalArgumentException("Arity bin out of range: " + bin);
        };
    }
}
