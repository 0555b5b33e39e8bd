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

import java.util.EnumSet;
import java.util.Set;

/**
 * Ортогональные KIND булевы свойства узла.
 */
public enum UniversalFlag {
    KEYWORD(0x01),
    PUBLIC(0x02),
    UNSAFE(0x04),
    RESERVED(0x08);

    /**
     * Все биты, допустимые в выходной записи.
     */
    public static final int MASK = 0x0F;

    private final int bit;

    UniversalFlag(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public boolean isSet(int flags) {
        return (flags & bit) != 0;
    }

    public static int mask(UniversalFlag... flags) {
        int result = 0;
        for (UniversalFlag flag : flags) {
            result |= flag.bit;
        }
        return result;
    }

    public static Set<UniversalFlag> fromMask(int flags) {
        EnumSet<UniversalFlag> result = EnumSet.noneOf(UniversalFlag.class);
        for (UniversalFlag flag : values()) {
            if (flag.isSet(flags)) {
                result.add(flag);
            }
        }
        return result;
    }
}
