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
 * Типы узлов грамматики tree-sitter-javascript (без JSX).
 */
public final class JavaScriptNodeTypes {

    private JavaScriptNodeTypes() {}

    public static ClassificationTable create(StrategySet strategies) {
        ClassificationTable.Builder b = ClassificationTable.builder("javascript");

        // Определения
        b.put(of(DEFINITION_FUNCTION, FIND_IDENTIFIER).withCategory(FUNCTION),
                "function_declaration", "generator_function_declaration");
        b.put(of(DEFINITION_FUNCTION, FIND_PROPERTY).withCategory(FUNCTION), "method_definition");
        b.put(of(DEFINITION_FUNCTION).withRefinement(Refinements.Function.LAMBDA).withCategory(FUNCTION),
                "arrow_function", "function_expression", "generator_function");
        // "function" и "class" - и выражение, и ключевое слово
        b.put(of(DEFINITION_FUNCTION).withRefinement(Refinements.Function.LAMBDA).withCategory(FUNCTION)
                .asKeywordIfLeaf(), "function");
        b.put(of(DEFINITION_CLASS, FIND_IDENTIFIER).withCategory(CLASS), "class_declaration");
        b.put(of(DEFINITION_CLASS, FIND_IDENTIFIER).withCategory(CLASS).asKeywordIfLeaf(), "class");
        b.put(of(DEFINITION_VARIABLE, FIND_PROPERTY).withRefinement(Refinements.Variable.FIELD), "field_definition");
        b.put(of(DEFINITION_VARIABLE, FIND_IN_DECLARATOR), "variable_declaration");
        b.put(of(DEFINITION_VARIABLE, FIND_IN_DECLARATOR).withRefinement(Refinements.Variable.IMMUTABLE),
                "lexical_declaration");
        b.put(of(DEFINITION_VARIABLE, FIND_ASSIGNMENT_TARGET).withCategory(VARIABLE), "variable_declarator");
        b.put(of(PATTERN_DESTRUCTURE), "object_pattern", "array_pattern", "rest_pattern");
        b.put(of(DEFINITION_VARIABLE, FIRST_CHILD).withRefinement(Refinements.Variable.PARAMETER),
                "assignment_pattern");

        // Импорт и экспорт
        b.put(of(EXTERNAL_IMPORT).withCategory(IMPORT), "import_statement");
        b.put(of(ORGANIZATION_LIST), "import_clause", "named_imports", "export_clause");
        b.put(of(NAME_IDENTIFIER, FIND_IDENTIFIER), "import_specifier", "namespace_import", "export_specifier");
        b.put(of(EXTERNAL_EXPORT).withFlags(UniversalFlag.PUBLIC), "export_statement");

        // Вызовы и доступ
        b.put(of(COMPUTATION_CALL, FIND_CALL_TARGET).withCategory(CALL), "call_expression");
        b.put(of(COMPUTATION_CALL, FIND_IDENTIFIER).withRefinement(Refinements.Call.CONSTRUCTOR)
                .withCategory(CALL), "new_expression");
        b.put(of(COMPUTATION_ACCESS, FIND_PROPERTY), "member_expression", "subscript_expression");
        b.put(of(COMPUTATION_EXPRESSION), "binary_expression", "unary_expression", "update_expression",
                "parenthesized_expression", "sequence_expression", "spread_element");
        b.put(of(OPERATOR_ASSIGNMENT, FIND_ASSIGNMENT_TARGET), "assignment_expression");
        b.put(of(OPERATOR_ASSIGNMENT, FIND_ASSIGNMENT_TARGET).withRefinement(Refinements.Assignment.COMPOUND),
                "augmented_assignment_expression");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.TERNARY), "ternary_expression");
        b.put(of(FLOW_SYNC), "await_expression");
        b.put(of(FLOW_JUMP), "yield_expression");

        // Управление потоком
        b.put(of(FLOW_CONDITIONAL), "if_statement", "else_clause");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.MULTIWAY), "switch_statement");
        b.put(of(ORGANIZATION_SECTION), "switch_case", "switch_default");
        b.put(of(FLOW_LOOP), "for_statement");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.ITERATOR), "for_in_statement");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.CONDITIONAL), "while_statement", "do_statement");
        b.put(of(FLOW_JUMP), "return_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.BREAK), "break_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.CONTINUE), "continue_statement");
        b.put(of(ERROR_TRY), "try_statement");
        b.put(of(ERROR_CATCH), "catch_clause");
        b.put(of(ERROR_FINALLY), "finally_clause");
        b.put(of(ERROR_THROW), "throw_statement");
        b.put(of(EXECUTION_STATEMENT), "expression_statement", "labeled_statement", "empty_statement",
                "debugger_statement");

        // Организация
        b.put(of(ORGANIZATION_CONTAINER), "program");
        b.put(of(ORGANIZATION_BLOCK), "statement_block", "class_body", "switch_body");
        b.put(of(ORGANIZATION_LIST), "formal_parameters", "arguments");
        b.put(of(TYPE_REFERENCE), "class_heritage");

        // Имена
        b.put(of(NAME_IDENTIFIER, NODE_TEXT), "identifier", "property_identifier",
                "shorthand_property_identifier", "private_property_identifier", "statement_identifier",
                "shorthand_property_identifier_pattern");
        b.put(of(NAME_KEYWORD).asKeywordIfLeaf(), "this", "super");

        // Литералы
        b.put(of(LITERAL_NUMBER), "number");
        b.put(of(LITERAL_STRING), "string", "string_fragment", "escape_sequence");
        b.put(of(LITERAL_STRING).withRefinement(Refinements.Text.TEMPLATE), "template_string");
        b.put(of(PATTERN_TEMPLATE), "template_substitution");
        b.put(of(LITERAL_STRING).withRefinement(Refinements.Text.REGEX), "regex");
        b.put(of(LITERAL_ATOMIC).asKeywordIfLeaf(), "true", "false", "null", "undefined");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.MAPPING), "object", "pair");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.SEQUENCE), "array");

        // Метаданные
        b.put(of(METADATA_COMMENT), "comment");
        b.put(of(METADATA_ANNOTATION, FIND_IDENTIFIER), "decorator");

        // Ключевые слова
        b.put(of(NAME_KEYWORD).withFlags(UniversalFlag.KEYWORD),
                "const", "let", "var", "if", "else", "for", "while", "do", "return", "import",
                "from", "as", "new", "async", "await", "yield", "try", "catch", "finally", "throw",
                "switch", "case", "default", "break", "continue", "extends", "static", "get", "set",
                "of", "debugger", "with");
        b.put(of(NAME_KEYWORD).withFlags(UniversalFlag.KEYWORD, UniversalFlag.PUBLIC), "export");
        b.put(of(OPERATOR_LOGICAL).withFlags(UniversalFlag.KEYWORD), "typeof", "instanceof", "in", "delete", "void");

        // Операторы
        b.put(of(OPERATOR_ARITHMETIC), "+", "-", "*", "/", "%", "**", "++", "--", "&", "|", "^", "~",
                "<<", ">>", ">>>");
        b.put(of(OPERATOR_LOGICAL), "&&", "||", "!", "??");
        b.put(of(OPERATOR_COMPARISON), "==", "!=", "===", "!==", "<", ">", "<=", ">=");
        b.put(of(OPERATOR_ASSIGNMENT), "=");
        b.put(of(OPERATOR_ASSIGNMENT).withRefinement(Refinements.Assignment.COMPOUND),
                "+=", "-=", "*=", "/=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=", ">>>=",
                "&&=", "||=", "??=");

        // Пунктуация
        b.put(of(PARSER_DELIMITER), "(", ")", "{", "}", "[", "]", "`", "\"", "'", "${");
        b.put(of(PARSER_PUNCTUATION), ";", ",", ".", ":", "?", "?.", "=>", "...", "@");

        b.put(of(PARSER_SYNTAX), "ERROR");

        return b.build(strategies);
    }
}
