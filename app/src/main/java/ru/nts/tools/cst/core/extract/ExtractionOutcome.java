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
package ru.nts.tools.cst.core.extract;

import java.util.Objects;

/**
 * Результат запуска стратегии: контекст либо причина сбоя.
 * При сбое контекст всегда пустой.
 *
 * @param context извлеченный контекст (пустой при сбое)
 * @param failure причина сбоя или null
 */
public record ExtractionOutcome(NativeContext context, Throwable failure) {

    public ExtractionOutcome {
        Objects.requireNonNull(context, "context");
        if (failure != null && !context.isEmpty()) {
            throw new IllegalArgumentException("Failed outcome must carry an empty context");
        }
    }

    public static ExtractionOutcome ok(NativeContext context) {
        return new ExtractionOutcome(context != null ? context : NativeContext.EMPTY, null);
    }

    public static ExtractionOutcome failed(Throwable cause) {
        return new ExtractionOutcome(NativeContext.EMPTY, Objects.requireNonNull(cause, "cause"));
    }

    public boolean isFailure() {
        return failure != null;
    }
}
