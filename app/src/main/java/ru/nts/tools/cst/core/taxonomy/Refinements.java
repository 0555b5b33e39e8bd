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
 * Уточнения (биты 0-1 семантического кода) для отдельных семантических типов.
 */
public final class Refinements {

    private Refinements() {}

    public static final int UNSPECIFIED = 0;

    /** DEFINITION_FUNCTION */
    public static final class Function {
        public static final int REGULAR = 0;
        public static final int LAMBDA = 1;
        public static final int CONSTRUCTOR = 2;
        public static final int ASYNC = 3;

        private Function() {}
    }

    /** DEFINITION_VARIABLE */
    public static final class Variable {
        public static final int MUTABLE = 0;
        public static final int IMMUTABLE = 1;
        public static final int PARAMETER = 2;
        public static final int FIELD = 3;

        private Variable() {}
    }

    /** DEFINITION_CLASS */
    public static final class ClassDef {
        public static final int REGULAR = 0;
        public static final int ABSTRACT = 1;
        public static final int GENERIC = 2;
        public static final int ENUM = 3;

        private ClassDef() {}
    }

    /** COMPUTATION_CALL */
    public static final class Call {
        public static final int FUNCTION = 0;
        public static final int METHOD = 1;
        public static final int CONSTRUCTOR = 2;
        public static final int MACRO = 3;

        private Call() {}
    }

    /** EXTERNAL_IMPORT */
    public static final class Import {
        public static final int MODULE = 0;
        public static final int SELECTIVE = 1;
        public static final int WILDCARD = 2;
        public static final int RELATIVE = 3;

        private Import() {}
    }

    /** FLOW_CONDITIONAL */
    public static final class Conditional {
        public static final int BINARY = 0;
        public static final int MULTIWAY = 1;
        public static final int GUARD = 2;
        public static final int TERNARY = 3;

        private Conditional() {}
    }

    /** FLOW_LOOP */
    public static final class Loop {
        public static final int COUNTER = 0;
        public static final int ITERATOR = 1;
        public static final int CONDITIONAL = 2;
        public static final int INFINITE = 3;

        private Loop() {}
    }

    /** FLOW_JUMP */
    public static final class Jump {
        public static final int RETURN = 0;
        public static final int BREAK = 1;
        public static final int CONTINUE = 2;
        public static final int GOTO = 3;

        private Jump() {}
    }

    /** LITERAL_NUMBER */
    public static final class Number {
        public static final int INTEGER = 0;
        public static final int FLOAT = 1;
        public static final int SCIENTIFIC = 2;
        public static final int COMPLEX = 3;

        private Number() {}
    }

    /** LITERAL_STRING */
    public static final class Text {
        public static final int LITERAL = 0;
        public static final int TEMPLATE = 1;
        public static final int REGEX = 2;
        public static final int RAW = 3;

        private Text() {}
    }

    /** LITERAL_STRUCTURED */
    public static final class Structured {
        public static final int GENERIC = 0;
        public static final int SEQUENCE = 1;
        public static final int MAPPING = 2;
        public static final int SET = 3;

        private Structured() {}
    }

    /** OPERATOR_ASSIGNMENT */
    public static final class Assignment {
        public static final int SIMPLE = 0;
        public static final int COMPOUND = 1;
        public static final int DESTRUCTURE = 2;
        public static final int AUGMENTED = 3;

        private Assignment() {}
    }
}
