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
package ru.nts.tools.cst.core.classify;

/**
 * Способ получения имени узла при уровне контекста NORMALIZED и выше.
 */
public enum NameStrategy {
    /** Имя не извлекается */
    NONE,
    /** Весь текст узла (для идентификаторов) */
    NODE_TEXT,
    /** Текст первого дочернего узла */
    FIRST_CHILD,
    /** Первый дочерний идентификатор */
    FIND_IDENTIFIER,
    /** Дочерний property/field идентификатор */
    FIND_PROPERTY,
    /** Левая часть присваивания или объявления */
    FIND_ASSIGNMENT_TARGET,
    /** Квалифицированный или составной идентификатор */
    FIND_QUALIFIED_IDENTIFIER,
    /** Идентификатор внутри дочернего declarator-а */
    FIND_IN_DECLARATOR,
    /** Имя вызываемой функции или метода */
    FIND_CALL_TARGET
}
