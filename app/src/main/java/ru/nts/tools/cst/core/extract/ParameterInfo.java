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

/**
 * Информация о параметре метода/функции.
 * Извлекается из AST tree-sitter стратегией нативного контекста.
 *
 * @param name имя параметра
 * @param type тип параметра (полный, включая generics), пустая строка если не указан
 * @param defaultValue значение по умолчанию, пустая строка если нет
 * @param isOptional true если параметр можно не передавать
 * @param isVariadic true если это varargs/rest параметр (String... args, *args, ...rest)
 * @param annotations аннотации и декораторы параметра в исходном виде
 */
public record ParameterInfo(
        String name,
        String type,
        String defaultValue,
        boolean isOptional,
        boolean isVariadic,
        String annotations
) {

    public ParameterInfo {
        name = name != null ? name : "";
        type = type != null ? type : "";
        defaultValue = defaultValue != null ? defaultValue : "";
        annotations = annotations != null ? annotations : "";
    }

    /**
     * Создает ParameterInfo для обычного параметра.
     */
    public ParameterInfo(String name, String type) {
        this(name, type, "", false, false, "");
    }

    public ParameterInfo withDefault(String value) {
        return new ParameterInfo(name, type, value, true, isVariadic, annotations);
    }

    public ParameterInfo asVariadic() {
        return new ParameterInfo(name, type, defaultValue, isOptional, true, annotations);
    }

    public ParameterInfo withAnnotations(String value) {
        return new ParameterInfo(name, type, defaultValue, isOptional, isVariadic, value);
    }

    @Override
    public String toString() {
        return (type.isEmpty() ? "" : type + " ") + name + (isVariadic ? " (varargs)" : "");
    }
}
