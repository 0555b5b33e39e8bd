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
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Семантический тип узла: KIND плюс один из четырех подтипов.
 * 8-битный код: [ss kk tt ll], где ss - super kind, kk - kind внутри super kind,
 * tt - подтип, ll - уточнение (refinement), не входящее в сам тип.
 */
public enum SemanticType {
    // LITERAL
    LITERAL_NUMBER(Kind.LITERAL, 0),
    LITERAL_STRING(Kind.LITERAL, 1),
    LITERAL_ATOMIC(Kind.LITERAL, 2),
    LITERAL_STRUCTURED(Kind.LITERAL, 3),

    // NAME
    NAME_KEYWORD(Kind.NAME, 0),
    NAME_IDENTIFIER(Kind.NAME, 1),
    NAME_QUALIFIED(Kind.NAME, 2),
    NAME_SCOPED(Kind.NAME, 3),

    // PATTERN
    PATTERN_DESTRUCTURE(Kind.PATTERN, 0),
    PATTERN_MATCH(Kind.PATTERN, 1),
    PATTERN_TEMPLATE(Kind.PATTERN, 2),
    PATTERN_GUARD(Kind.PATTERN, 3),

    // TYPE
    TYPE_PRIMITIVE(Kind.TYPE, 0),
    TYPE_COMPOSITE(Kind.TYPE, 1),
    TYPE_REFERENCE(Kind.TYPE, 2),
    TYPE_GENERIC(Kind.TYPE, 3),

    // OPERATOR
    OPERATOR_ARITHMETIC(Kind.OPERATOR, 0),
    OPERATOR_LOGICAL(Kind.OPERATOR, 1),
    OPERATOR_COMPARISON(Kind.OPERATOR, 2),
    OPERATOR_ASSIGNMENT(Kind.OPERATOR, 3),

    // COMPUTATION
    COMPUTATION_CALL(Kind.COMPUTATION, 0),
    COMPUTATION_ACCESS(Kind.COMPUTATION, 1),
    COMPUTATION_EXPRESSION(Kind.COMPUTATION, 2),
    COMPUTATION_LAMBDA(Kind.COMPUTATION, 3),

    // TRANSFORM
    TRANSFORM_QUERY(Kind.TRANSFORM, 0),
    TRANSFORM_ITERATION(Kind.TRANSFORM, 1),
    TRANSFORM_PROJECTION(Kind.TRANSFORM, 2),
    TRANSFORM_AGGREGATION(Kind.TRANSFORM, 3),

    // DEFINITION
    DEFINITION_FUNCTION(Kind.DEFINITION, 0),
    DEFINITION_VARIABLE(Kind.DEFINITION, 1),
    DEFINITION_CLASS(Kind.DEFINITION, 2),
    DEFINITION_MODULE(Kind.DEFINITION, 3),

    // EXECUTION
    EXECUTION_STATEMENT(Kind.EXECUTION, 0),
    EXECUTION_DECLARATION(Kind.EXECUTION, 1),
    EXECUTION_INVOCATION(Kind.EXECUTION, 2),
    EXECUTION_MUTATION(Kind.EXECUTION, 3),

    // FLOW_CONTROL
    FLOW_CONDITIONAL(Kind.FLOW_CONTROL, 0),
    FLOW_LOOP(Kind.FLOW_CONTROL, 1),
    FLOW_JUMP(Kind.FLOW_CONTROL, 2),
    FLOW_SYNC(Kind.FLOW_CONTROL, 3),

    // ERROR_HANDLING
    ERROR_TRY(Kind.ERROR_HANDLING, 0),
    ERROR_CATCH(Kind.ERROR_HANDLING, 1),
    ERROR_THROW(Kind.ERROR_HANDLING, 2),
    ERROR_FINALLY(Kind.ERROR_HANDLING, 3),

    // ORGANIZATION
    ORGANIZATION_BLOCK(Kind.ORGANIZATION, 0),
    ORGANIZATION_LIST(Kind.ORGANIZATION, 1),
    ORGANIZATION_SECTION(Kind.ORGANIZATION, 2),
    ORGANIZATION_CONTAINER(Kind.ORGANIZATION, 3),

    // METADATA
    METADATA_COMMENT(Kind.METADATA, 0),
    METADATA_ANNOTATION(Kind.METADATA, 1),
    METADATA_DIRECTIVE(Kind.METADATA, 2),
    METADATA_DEBUG(Kind.METADATA, 3),

    // EXTERNAL
    EXTERNAL_IMPORT(Kind.EXTERNAL, 0),
    EXTERNAL_EXPORT(Kind.EXTERNAL, 1),
    EXTERNAL_FOREIGN(Kind.EXTERNAL, 2),
    EXTERNAL_EMBED(Kind.EXTERNAL, 3),

    // PARSER_SPECIFIC
    PARSER_PUNCTUATION(Kind.PARSER_SPECIFIC, 0),
    PARSER_DELIMITER(Kind.PARSER_SPECIFIC, 1),
    PARSER_SYNTAX(Kind.PARSER_SPECIFIC, 2),
    PARSER_CONSTRUCT(Kind.PARSER_SPECIFIC, 3),

    // RESERVED
    RESERVED_FUTURE1(Kind.RESERVED, 0),
    RESERVED_FUTURE2(Kind.RESERVED, 1),
    RESERVED_FUTURE3(Kind.RESERVED, 2),
    RESERVED_FUTURE4(Kind.RESERVED, 3);

    /**
     * Код, назначаемый нераспознанным типам узлов.
     */
    public static final SemanticType UNCLASSIFIED = PARSER_CONSTRUCT;

    private static final SemanticType[] BY_CODE = new SemanticType[64];

    static {
        for (SemanticType type : values()) {
            BY_CODE[type.code() >> 2] = type;
        }
    }

    private final Kind kind;
    private final int subType;

    SemanticType(Kind kind, int subType) {
        this.kind = kind;
        this.subType = subType;
    }

    public Kind kind() {
        return kind;
    }

    public SuperKind superKind() {
        return kind.superKind();
    }

    /**
     * Подтип внутри KIND (0-3).
     */
    public int subType() {
        return subType;
    }

    /**
     * 8-битный код без битов уточнения.
     */
    public int code() {
        return kind.code() | (subType << 2);
    }

    /**
     * Восстанавливает тип по 8-битному коду; биты уточнения игнорируются.
     */
    public static SemanticType fromCode(int semanticCode) {
        return BY_CODE[(semanticCode & 0xFC) >> 2];
    }

    public static Optional<SemanticType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // ===================== ПРЕДИКАТЫ =====================

    public boolean isDefinition() {
        return kind == Kind.DEFINITION;
    }

    public boolean isCall() {
        return this == COMPUTATION_CALL || this == EXECUTION_INVOCATION;
    }

    public boolean isControlFlow() {
        return kind == Kind.FLOW_CONTROL;
    }

    public boolean isIdentifier() {
        return this == NAME_IDENTIFIER || this == NAME_QUALIFIED || this == NAME_SCOPED;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isOperator() {
        return kind == Kind.OPERATOR;
    }

    public boolean isType() {
        return kind == Kind.TYPE;
    }

    public boolean isExternal() {
        return kind == Kind.EXTERNAL;
    }

    public boolean isError() {
        return kind == Kind.ERROR_HANDLING;
    }

    public boolean isMetadata() {
        return kind == Kind.METADATA;
    }

    // ===================== ГРУППЫ =====================

    public static Set<SemanticType> definitionTypes() {
        return EnumSet.of(DEFINITION_FUNCTION, DEFINITION_VARIABLE, DEFINITION_CLASS, DEFINITION_MODULE);
    }

    public static Set<SemanticType> controlFlowTypes() {
        return EnumSet.of(FLOW_CONDITIONAL, FLOW_LOOP, FLOW_JUMP, FLOW_SYNC);
    }

    /**
     * Типы, по которым обычно ищут в коде.
     */
    public static List<SemanticType> searchableTypes() {
        return List.of(DEFINITION_FUNCTION, DEFINITION_CLASS, DEFINITION_VARIABLE, DEFINITION_MODULE,
                COMPUTATION_CALL, NAME_IDENTIFIER, EXTERNAL_IMPORT, FLOW_CONDITIONAL, FLOW_LOOP,
                ERROR_TRY, ERROR_THROW);
    }
}
