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
package ru.nts.tools.cst.core.classify.languages;

import ru.nts.tools.cst.core.classify.ClassificationTable;
import ru.nts.tools.cst.core.extract.StrategySet;
import ru.nts.tools.cst.core.taxonomy.Refinements;
import ru.nts.tools.cst.core.taxonomy.UniversalFlag;

import static ru.nts.tools.cst.core.classify.NameStrategy.*;
import static ru.nts.tools.cst.core.classify.NodeConfig.of;
import static ru.nts.tools.cst.core.extract.StrategyCategory.*;
import static ru.nts.tools.cst.core.taxonomy.SemanticType.*;

/**
 * Типы узлов грамматики tree-sitter-java.
 */
public final class JavaNodeTypes {

    private JavaNodeTypes() {}

    public static ClassificationTable create(StrategySet strategies) {
        ClassificationTable.Builder b = ClassificationTable.builder("java");

        // Определения
        b.put(of(DEFINITION_CLASS, FIND_IDENTIFIER).withCategory(CLASS),
                "class_declaration", "interface_declaration", "record_declaration", "annotation_type_declaration");
        b.put(of(DEFINITION_CLASS, FIND_IDENTIFIER).withRefinement(Refinements.ClassDef.ENUM).withCategory(CLASS),
                "enum_declaration");
        b.put(of(DEFINITION_FUNCTION, FIND_IDENTIFIER).withCategory(FUNCTION), "method_declaration");
        b.put(of(DEFINITION_FUNCTION, FIND_IDENTIFIER).withRefinement(Refinements.Function.CONSTRUCTOR)
                .withCategory(FUNCTION), "constructor_declaration", "compact_constructor_declaration");
        b.put(of(DEFINITION_FUNCTION).withRefinement(Refinements.Function.LAMBDA).withCategory(FUNCTION),
                "lambda_expression");
        b.put(of(DEFINITION_VARIABLE, FIND_IN_DECLARATOR).withRefinement(Refinements.Variable.FIELD)
                .withCategory(VARIABLE), "field_declaration", "constant_declaration");
        b.put(of(DEFINITION_VARIABLE, FIND_IN_DECLARATOR).withCategory(VARIABLE), "local_variable_declaration");
        b.put(of(DEFINITION_VARIABLE, FIND_IDENTIFIER).withRefinement(Refinements.Variable.PARAMETER),
                "formal_parameter", "spread_parameter", "receiver_parameter");
        b.put(of(DEFINITION_VARIABLE, FIND_IDENTIFIER), "enum_constant");
        b.put(of(DEFINITION_MODULE, FIND_QUALIFIED_IDENTIFIER), "package_declaration", "module_declaration");
        b.put(of(EXECUTION_DECLARATION, FIND_ASSIGNMENT_TARGET), "variable_declarator");

        // Импорт
        b.put(of(EXTERNAL_IMPORT, FIND_QUALIFIED_IDENTIFIER).withCategory(IMPORT), "import_declaration");

        // Вызовы и доступ
        b.put(of(COMPUTATION_CALL, FIND_CALL_TARGET).withRefinement(Refinements.Call.METHOD).withCategory(CALL),
                "method_invocation");
        b.put(of(COMPUTATION_CALL, FIND_IDENTIFIER).withRefinement(Refinements.Call.CONSTRUCTOR).withCategory(CALL),
                "object_creation_expression", "explicit_constructor_invocation");
        b.put(of(COMPUTATION_ACCESS, FIND_PROPERTY), "field_access", "array_access", "method_reference");
        b.put(of(COMPUTATION_EXPRESSION),
                "binary_expression", "unary_expression", "update_expression", "cast_expression",
                "instanceof_expression", "parenthesized_expression", "array_creation_expression");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.TERNARY), "ternary_expression");
        b.put(of(OPERATOR_ASSIGNMENT, FIND_ASSIGNMENT_TARGET), "assignment_expression");

        // Управление потоком
        b.put(of(FLOW_CONDITIONAL), "if_statement");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.MULTIWAY),
                "switch_expression", "switch_statement");
        b.put(of(FLOW_LOOP), "for_statement");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.ITERATOR), "enhanced_for_statement");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.CONDITIONAL), "while_statement", "do_statement");
        b.put(of(FLOW_JUMP), "return_statement", "yield_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.BREAK), "break_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.CONTINUE), "continue_statement");
        b.put(of(FLOW_SYNC), "synchronized_statement");
        b.put(of(ERROR_TRY), "try_statement", "try_with_resources_statement");
        b.put(of(ERROR_CATCH), "catch_clause");
        b.put(of(ERROR_FINALLY), "finally_clause");
        b.put(of(ERROR_THROW), "throw_statement");
        b.put(of(EXECUTION_STATEMENT), "expression_statement", "assert_statement", "labeled_statement");

        // Организация
        b.put(of(ORGANIZATION_CONTAINER), "program");
        b.put(of(ORGANIZATION_BLOCK), "block", "class_body", "interface_body", "enum_body",
                "constructor_body", "switch_block", "annotation_type_body", "record_declaration_body");
        b.put(of(ORGANIZATION_LIST), "formal_parameters", "argument_list", "type_arguments",
                "type_parameters", "inferred_parameters", "resource_specification", "dimensions");
        b.put(of(ORGANIZATION_SECTION), "switch_block_statement_group", "switch_label", "switch_rule");

        // Типы
        b.put(of(TYPE_PRIMITIVE).asKeywordIfLeaf(),
                "integral_type", "floating_point_type", "boolean_type", "void_type");
        b.put(of(TYPE_REFERENCE, NODE_TEXT), "type_identifier", "scoped_type_identifier");
        b.put(of(TYPE_GENERIC), "generic_type", "type_parameter", "wildcard");
        b.put(of(TYPE_COMPOSITE), "array_type");

        // Имена
        b.put(of(NAME_IDENTIFIER, NODE_TEXT), "identifier");
        b.put(of(NAME_QUALIFIED, NODE_TEXT), "scoped_identifier");
        b.put(of(NAME_KEYWORD).asKeywordIfLeaf(), "this", "super");

        // Литералы
        b.put(of(LITERAL_NUMBER), "decimal_integer_literal", "hex_integer_literal",
                "octal_integer_literal", "binary_integer_literal");
        b.put(of(LITERAL_NUMBER).withRefinement(Refinements.Number.FLOAT),
                "decimal_floating_point_literal", "hex_floating_point_literal");
        b.put(of(LITERAL_STRING), "string_literal", "character_literal");
        b.put(of(LITERAL_STRING).withRefinement(Refinements.Text.RAW), "text_block");
        b.put(of(LITERAL_ATOMIC).asKeywordIfLeaf(), "true", "false", "null_literal");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.SEQUENCE), "array_initializer");

        // Метаданные
        b.put(of(METADATA_COMMENT), "line_comment", "block_comment");
        b.put(of(METADATA_ANNOTATION, FIND_IDENTIFIER), "annotation", "marker_annotation");
        b.put(of(METADATA_ANNOTATION), "modifiers");

        // Ключевые слова
        b.put(of(NAME_KEYWORD).withFlags(UniversalFlag.KEYWORD),
                "private", "protected", "static", "final", "abstract", "synchronized", "native",
                "transient", "volatile", "strictfp", "default", "class", "interface", "enum", "record",
                "extends", "implements", "import", "package", "new", "return", "if", "else", "for",
                "while", "do", "switch", "case", "break", "continue", "throw", "throws", "try",
                "catch", "finally", "instanceof", "yield", "assert", "void", "var");
        b.put(of(NAME_KEYWORD).withFlags(UniversalFlag.KEYWORD, UniversalFlag.PUBLIC), "public");

        // Операторы
        b.put(of(OPERATOR_ARITHMETIC), "+", "-", "*", "/", "%", "++", "--", "&", "|", "^", "~", "<<", ">>", ">>>");
        b.put(of(OPERATOR_LOGICAL), "&&", "||", "!");
        b.put(of(OPERATOR_COMPARISON), "==", "!=", "<", ">", "<=", ">=");
        b.put(of(OPERATOR_ASSIGNMENT), "=");
        b.put(of(OPERATOR_ASSIGNMENT).withRefinement(Refinements.Assignment.COMPOUND),
                "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=");

        // Пунктуация
        b.put(of(PARSER_DELIMITER), "(", ")", "{", "}", "[", "]");
        b.put(of(PARSER_PUNCTUATION), ";", ",", ".", "@", "::", "->", "...", "?", ":");

        b.put(of(PARSER_SYNTAX), "ERROR");

        return b.build(strategies);
    }
}
