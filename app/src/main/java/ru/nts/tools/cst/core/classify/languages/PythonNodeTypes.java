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
 * Типы узлов грамматики tree-sitter-python.
 * Некоторые строки ("await", "yield", "lambda") одновременно тип узла и ключевое слово-лист,
 * для них KEYWORD ставится только листьям.
 */
public final class PythonNodeTypes {

    private PythonNodeTypes() {}

    public static ClassificationTable create(StrategySet strategies) {
        ClassificationTable.Builder b = ClassificationTable.builder("python");

        // Определения
        b.put(of(DEFINITION_FUNCTION, FIND_IDENTIFIER).withCategory(FUNCTION), "function_definition");
        b.put(of(DEFINITION_FUNCTION).withRefinement(Refinements.Function.LAMBDA).withCategory(FUNCTION)
                .asKeywordIfLeaf(), "lambda");
        b.put(of(DEFINITION_CLASS, FIND_IDENTIFIER).withCategory(CLASS), "class_definition");
        b.put(of(METADATA_ANNOTATION), "decorated_definition");
        b.put(of(METADATA_ANNOTATION, FIRST_CHILD), "decorator");
        b.put(of(DEFINITION_VARIABLE, FIND_ASSIGNMENT_TARGET).withCategory(VARIABLE), "assignment");
        b.put(of(OPERATOR_ASSIGNMENT, FIND_ASSIGNMENT_TARGET).withRefinement(Refinements.Assignment.AUGMENTED),
                "augmented_assignment");
        b.put(of(OPERATOR_ASSIGNMENT, FIND_ASSIGNMENT_TARGET), "named_expression");
        b.put(of(DEFINITION_VARIABLE, FIND_IDENTIFIER).withRefinement(Refinements.Variable.PARAMETER),
                "typed_parameter", "default_parameter", "typed_default_parameter");
        b.put(of(PATTERN_DESTRUCTURE, FIND_IDENTIFIER), "list_splat_pattern", "dictionary_splat_pattern",
                "pattern_list", "tuple_pattern", "list_pattern");

        // Импорт
        b.put(of(EXTERNAL_IMPORT, FIND_QUALIFIED_IDENTIFIER).withCategory(IMPORT), "import_statement");
        b.put(of(EXTERNAL_IMPORT, FIND_QUALIFIED_IDENTIFIER).withRefinement(Refinements.Import.SELECTIVE)
                .withCategory(IMPORT), "import_from_statement", "future_import_statement");
        b.put(of(NAME_QUALIFIED, NODE_TEXT), "dotted_name", "relative_import", "aliased_import");
        b.put(of(NAME_KEYWORD), "wildcard_import");

        // Вызовы и доступ
        b.put(of(COMPUTATION_CALL, FIND_CALL_TARGET).withCategory(CALL), "call");
        b.put(of(COMPUTATION_ACCESS, FIND_PROPERTY), "attribute", "subscript");
        b.put(of(COMPUTATION_EXPRESSION), "binary_operator", "unary_operator", "parenthesized_expression",
                "expression_list");
        b.put(of(OPERATOR_LOGICAL), "boolean_operator", "not_operator");
        b.put(of(OPERATOR_COMPARISON), "comparison_operator");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.TERNARY), "conditional_expression");
        b.put(of(FLOW_SYNC).asKeywordIfLeaf(), "await");
        b.put(of(FLOW_JUMP).asKeywordIfLeaf(), "yield");
        b.put(of(TRANSFORM_QUERY), "list_comprehension", "dictionary_comprehension", "set_comprehension",
                "generator_expression");
        b.put(of(TRANSFORM_ITERATION), "for_in_clause");
        b.put(of(PATTERN_GUARD), "if_clause");
        b.put(of(EXECUTION_INVOCATION, FIND_IDENTIFIER), "keyword_argument");

        // Управление потоком
        b.put(of(FLOW_CONDITIONAL), "if_statement", "elif_clause", "else_clause");
        b.put(of(FLOW_CONDITIONAL).withRefinement(Refinements.Conditional.MULTIWAY), "match_statement");
        b.put(of(PATTERN_MATCH), "case_clause", "case_pattern");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.ITERATOR), "for_statement");
        b.put(of(FLOW_LOOP).withRefinement(Refinements.Loop.CONDITIONAL), "while_statement");
        b.put(of(FLOW_JUMP).asKeywordIfLeaf(), "return_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.BREAK).asKeywordIfLeaf(), "break_statement");
        b.put(of(FLOW_JUMP).withRefinement(Refinements.Jump.CONTINUE).asKeywordIfLeaf(), "continue_statement");
        b.put(of(EXECUTION_STATEMENT).asKeywordIfLeaf(), "pass_statement");
        b.put(of(ERROR_TRY), "try_statement");
        b.put(of(ERROR_CATCH), "except_clause", "except_group_clause");
        b.put(of(ERROR_FINALLY), "finally_clause");
        b.put(of(ERROR_THROW), "raise_statement");
        b.put(of(FLOW_SYNC), "with_statement", "with_clause", "with_item");
        b.put(of(EXECUTION_STATEMENT), "expression_statement", "assert_statement", "print_statement");
        b.put(of(EXECUTION_DECLARATION, FIND_IDENTIFIER), "global_statement", "nonlocal_statement");
        b.put(of(EXECUTION_MUTATION), "delete_statement");

        // Организация
        b.put(of(ORGANIZATION_CONTAINER), "module");
        b.put(of(ORGANIZATION_BLOCK), "block");
        b.put(of(ORGANIZATION_LIST), "parameters", "lambda_parameters", "argument_list");

        // Типы и имена
        b.put(of(TYPE_REFERENCE), "type");
        b.put(of(TYPE_GENERIC), "generic_type", "type_parameter");
        b.put(of(NAME_IDENTIFIER, NODE_TEXT), "identifier");

        // Литералы
        b.put(of(LITERAL_NUMBER), "integer");
        b.put(of(LITERAL_NUMBER).withRefinement(Refinements.Number.FLOAT), "float");
        b.put(of(LITERAL_STRING), "string", "concatenated_string", "string_content");
        b.put(of(PATTERN_TEMPLATE), "interpolation");
        b.put(of(PARSER_DELIMITER), "string_start", "string_end");
        b.put(of(LITERAL_ATOMIC).asKeywordIfLeaf(), "true", "false", "none", "ellipsis");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.SEQUENCE), "list", "tuple");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.MAPPING), "dictionary", "pair");
        b.put(of(LITERAL_STRUCTURED).withRefinement(Refinements.Structured.SET), "set");

        // Метаданные
        b.put(of(METADATA_COMMENT), "comment");

        // Ключевые слова
        b.put(of(NAME_KEYWORD).withFlags(UniversalFlag.KEYWORD),
                "def", "class", "if", "elif", "else", "for", "while", "return", "import", "from",
                "as", "try", "except", "finally", "with", "raise", "pass", "break", "continue",
                "async", "global", "nonlocal", "assert", "del", "match", "case", "exec", "print");
        b.put(of(OPERATOR_LOGICAL).withFlags(UniversalFlag.KEYWORD), "not", "and", "or", "is", "in");

        // Операторы
        b.put(of(OPERATOR_ARITHMETIC), "+", "-", "*", "/", "//", "%", "**", "@", "&", "|", "^", "~", "<<", ">>");
        b.put(of(OPERATOR_COMPARISON), "==", "!=", "<", ">", "<=", ">=", "<>");
        b.put(of(OPERATOR_ASSIGNMENT), "=", ":=");
        b.put(of(OPERATOR_ASSIGNMENT).withRefinement(Refinements.Assignment.AUGMENTED),
                "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=");

        // Пунктуация
        b.put(of(PARSER_DELIMITER), "(", ")", "{", "}", "[", "]");
        b.put(of(PARSER_PUNCTUATION), ":", ",", ".", ";", "->");

        b.put(of(PARSER_SYNTAX), "ERROR");

        return b.build(strategies);
    }
}
