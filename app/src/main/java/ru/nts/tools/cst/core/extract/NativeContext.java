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

import java.util.List;

/**
 * Структурированный языковой контекст узла: сигнатура, параметры, модификаторы.
 *
 * @param signatureType тип сигнатуры (возвращаемый тип, тип переменной, базовый класс и т.п.)
 * @param parameters параметры в порядке объявления
 * @param modifiers модификаторы в порядке появления (public, static, async...)
 * @param qualifiedName квалифицированное имя (например "Outer.Inner.method")
 * @param annotations прочие аннотации/декораторы в исходном виде
 */
public record NativeContext(
        String signatureType,
        List<ParameterInfo> parameters,
        List<String> modifiers,
        String qualifiedName,
        String annotations
) {

    public static final NativeContext EMPTY = new NativeContext("", List.of(), List.of(), "", "");

    public NativeContext {
        signatureType = signatureType != null ? signatureType : "";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        qualifiedName = qualifiedName != null ? qualifiedName : "";
        annotations = annotations != null ? annotations : "";
    }

    public boolean isEmpty() {
        return signatureType.isEmpty() && parameters.isEmpty() && modifiers.isEmpty()
                && qualifiedName.isEmpty() && annotations.isEmpty();
    }

    public NativeContext withSignatureType(String value) {
        return new NativeContext(value, parameters, modifiers, qualifiedName, annotations);
    }

    public NativeContext withParameters(List<ParameterInfo> value) {
        return new NativeContext(signatureType, value, modifiers, qualifiedName, annotations);
    }

    public NativeContext withModifiers(List<String> value) {
        return new NativeContext(signatureType, parameters, value, qualifiedName, annotations);
    }

    public NativeContext withQualifiedName(String value) {
        return new NativeContext(signatureType, parameters, modifiers, value, annotations);
    }

    public NativeContext withAnnotations(String value) {
        return new NativeContext(signatureType, parameters, modifiers, qualifiedName, value);
    }
}
