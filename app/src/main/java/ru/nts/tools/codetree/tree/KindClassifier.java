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
package ru.nts.tools.codetree.tree;

import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps tree-sitter C# construct tags to {@link NodeKind}.
 *
 * <p>Tags cover the grammar releases 0.20 through 0.23, so some kinds have several tags
 * (for example {@code for_each_statement} and {@code foreach_statement}).
 */
public final class KindClassifier {

    static final int EXCERPT_LENGTH = 40;

    private static final Map<String, NodeKind> TABLE = Map.ofEntries(
            entry("ERROR", NodeKind.SYNTAX_ERROR),

            entry("using_directive", NodeKind.USING_DIRECTIVE),
            entry("extern_alias_directive", NodeKind.EXTERN_ALIAS),
            entry("global_attribute", NodeKind.GLOBAL_ATTRIBUTE),
            entry("global_attribute_list", NodeKind.GLOBAL_ATTRIBUTE),
            entry("global_statement", NodeKind.GLOBAL_STATEMENT),
            entry("namespace_declaration", NodeKind.NAMESPACE),
            entry("file_scoped_namespace_declaration", NodeKind.FILE_SCOPED_NAMESPACE),
            entry("shebang_directive", NodeKind.SHEBANG),

            entry("class_declaration", NodeKind.CLASS),
            entry("struct_declaration", NodeKind.STRUCT),
            entry("interface_declaration", NodeKind.INTERFACE),
            entry("record_declaration", NodeKind.RECORD),
            entry("record_struct_declaration", NodeKind.RECORD),
            entry("enum_declaration", NodeKind.ENUM),
            entry("enum_member_declaration", NodeKind.ENUM_MEMBER),
            entry("delegate_declaration", NodeKind.DELEGATE),
            entry("event_declaration", NodeKind.EVENT),
            entry("event_field_declaration", NodeKind.EVENT_FIELD),
            entry("field_declaration", NodeKind.FIELD),
            entry("variable_declaration", NodeKind.VARIABLE_DECLARATION),
            entry("equals_value_clause", NodeKind.EQUALS_VALUE),
            entry("property_declaration", NodeKind.PROPERTY),
            entry("indexer_declaration", NodeKind.INDEXER),
            entry("accessor_list", NodeKind.ACCESSOR_LIST),
            entry("accessor_declaration", NodeKind.ACCESSOR),
            entry("method_declaration", NodeKind.METHOD),
            entry("constructor_declaration", NodeKind.CONSTRUCTOR),
            entry("constructor_initializer", NodeKind.CONSTRUCTOR_INITIALIZER),
            entry("destructor_declaration", NodeKind.DESTRUCTOR),
            entry("operator_declaration", NodeKind.OPERATOR),
            entry("conversion_operator_declaration", NodeKind.CONVERSION_OPERATOR),
            entry("explicit_interface_specifier", NodeKind.EXPLICIT_INTERFACE),
            entry("primary_constructor_base_type", NodeKind.PRIMARY_CONSTRUCTOR_BASE),
            entry("modifier", NodeKind.MODIFIER),
            entry("base_list", NodeKind.BASE_LIST),
            entry("parameter_list", NodeKind.PARAMETER_LIST),
            entry("bracketed_parameter_list", NodeKind.PARAMETER_LIST),
            entry("parameter", NodeKind.PARAMETER),
            entry("implicit_parameter", NodeKind.PARAMETER),
            entry("type_parameter_list", NodeKind.TYPE_PARAMETER_LIST),
            entry("type_parameter", NodeKind.TYPE_PARAMETER),
            entry("type_parameter_constraints_clause", NodeKind.TYPE_CONSTRAINTS),
            entry("type_parameter_constraint", NodeKind.TYPE_CONSTRAINT),
            entry("constructor_constraint", NodeKind.TYPE_CONSTRAINT),
            entry("arrow_expression_clause", NodeKind.ARROW_EXPRESSION),

            entry("attribute_list", NodeKind.ATTRIBUTE_LIST),
            entry("attribute", NodeKind.ATTRIBUTE),
            entry("attribute_argument_list", NodeKind.ATTRIBUTE_ARGUMENT_LIST),
            entry("attribute_argument", NodeKind.ATTRIBUTE_ARGUMENT),
            entry("attribute_target_specifier", NodeKind.ATTRIBUTE_TARGET),

            entry("identifier", NodeKind.IDENTIFIER),
            entry("qualified_name", NodeKind.QUALIFIED_NAME),
            entry("alias_qualified_name", NodeKind.ALIAS_QUALIFIED_NAME),
            entry("generic_name", NodeKind.GENERIC_NAME),
            entry("type_argument_list", NodeKind.TYPE_ARGUMENT_LIST),
            entry("predefined_type", NodeKind.PREDEFINED_TYPE),
            entry("implicit_type", NodeKind.IMPLICIT_TYPE),
            entry("nullable_type", NodeKind.NULLABLE_TYPE),
            entry("array_type", NodeKind.ARRAY_TYPE),
            entry("array_rank_specifier", NodeKind.ARRAY_RANK),
            entry("pointer_type", NodeKind.POINTER_TYPE),
            entry("tuple_type", NodeKind.TUPLE_TYPE),
            entry("tuple_element", NodeKind.TUPLE_ELEMENT),
            entry("ref_type", NodeKind.REF_TYPE),
            entry("scoped_type", NodeKind.SCOPED_TYPE),
            entry("function_pointer_type", NodeKind.FUNCTION_POINTER_TYPE),
            entry("function_pointer_parameter", NodeKind.FUNCTION_POINTER_PARAMETER),
            entry("calling_convention", NodeKind.CALLING_CONVENTION),

            entry("block", NodeKind.BLOCK),
            entry("expression_statement", NodeKind.EXPRESSION_STATEMENT),
            entry("local_declaration_statement", NodeKind.LOCAL_DECLARATION),
            entry("local_function_statement", NodeKind.LOCAL_FUNCTION),
            entry("return_statement", NodeKind.RETURN),
            entry("if_statement", NodeKind.IF),
            entry("else_clause", NodeKind.ELSE),
            entry("switch_statement", NodeKind.SWITCH),
            entry("switch_section", NodeKind.SWITCH_SECTION),
            entry("case_switch_label", NodeKind.CASE_LABEL),
            entry("case_pattern_switch_label", NodeKind.CASE_LABEL),
            entry("default_switch_label", NodeKind.DEFAULT_LABEL),
            entry("while_statement", NodeKind.WHILE),
            entry("do_statement", NodeKind.DO),
            entry("for_statement", NodeKind.FOR),
            entry("for_each_statement", NodeKind.FOREACH),
            entry("foreach_statement", NodeKind.FOREACH),
            entry("break_statement", NodeKind.BREAK),
            entry("continue_statement", NodeKind.CONTINUE),
            entry("goto_statement", NodeKind.GOTO),
            entry("yield_statement", NodeKind.YIELD),
            entry("labeled_statement", NodeKind.LABELED),
            entry("using_statement", NodeKind.USING_STATEMENT),
            entry("lock_statement", NodeKind.LOCK),
            entry("throw_statement", NodeKind.THROW),
            entry("try_statement", NodeKind.TRY),
            entry("catch_clause", NodeKind.CATCH),
            entry("catch_declaration", NodeKind.CATCH_DECLARATION),
            entry("catch_filter_clause", NodeKind.CATCH_FILTER),
            entry("finally_clause", NodeKind.FINALLY),
            entry("empty_statement", NodeKind.EMPTY_STATEMENT),
            entry("checked_statement", NodeKind.CHECKED),
            entry("fixed_statement", NodeKind.FIXED),
            entry("unsafe_statement", NodeKind.UNSAFE),

            entry("invocation_expression", NodeKind.INVOCATION),
            entry("argument_list", NodeKind.ARGUMENT_LIST),
            entry("argument", NodeKind.ARGUMENT),
            entry("bracketed_argument_list", NodeKind.BRACKETED_ARGUMENT_LIST),
            entry("assignment_expression", NodeKind.ASSIGNMENT),
            entry("member_access_expression", NodeKind.MEMBER_ACCESS),
            entry("conditional_access_expression", NodeKind.CONDITIONAL_ACCESS),
            entry("member_binding_expression", NodeKind.MEMBER_BINDING),
            entry("element_access_expression", NodeKind.ELEMENT_ACCESS),
            entry("integer_literal", NodeKind.LITERAL),
            entry("real_literal", NodeKind.LITERAL),
            entry("string_literal", NodeKind.LITERAL),
            entry("verbatim_string_literal", NodeKind.LITERAL),
            entry("raw_string_literal", NodeKind.LITERAL),
            entry("character_literal", NodeKind.LITERAL),
            entry("boolean_literal", NodeKind.LITERAL),
            entry("null_literal", NodeKind.LITERAL),
            entry("string_literal_content", NodeKind.STRING_CONTENT),
            entry("character_literal_content", NodeKind.STRING_CONTENT),
            entry("raw_string_content", NodeKind.STRING_CONTENT),
            entry("string_content", NodeKind.STRING_CONTENT),
            entry("escape_sequence", NodeKind.STRING_CONTENT),
            entry("interpolated_string_expression", NodeKind.INTERPOLATED_STRING),
            entry("interpolation", NodeKind.INTERPOLATION),
            entry("interpolation_alignment_clause", NodeKind.INTERPOLATION_ALIGNMENT),
            entry("interpolation_format_clause", NodeKind.INTERPOLATION_FORMAT),
            entry("interpolation_start", NodeKind.STRING_DELIMITER),
            entry("interpolation_quote", NodeKind.STRING_DELIMITER),
            entry("interpolation_brace", NodeKind.STRING_DELIMITER),
            entry("raw_string_start", NodeKind.STRING_DELIMITER),
            entry("raw_string_end", NodeKind.STRING_DELIMITER),
            entry("string_literal_encoding", NodeKind.STRING_DELIMITER),
            entry("prefix_unary_expression", NodeKind.PREFIX_UNARY),
            entry("unary_expression", NodeKind.PREFIX_UNARY),
            entry("postfix_unary_expression", NodeKind.POSTFIX_UNARY),
            entry("binary_expression", NodeKind.BINARY),
            entry("parenthesized_expression", NodeKind.PARENTHESIZED),
            entry("conditional_expression", NodeKind.CONDITIONAL),
            entry("cast_expression", NodeKind.CAST),
            entry("as_expression", NodeKind.AS_EXPRESSION),
            entry("is_expression", NodeKind.IS_EXPRESSION),
            entry("is_pattern_expression", NodeKind.IS_EXPRESSION),
            entry("constant_pattern", NodeKind.PATTERN),
            entry("declaration_pattern", NodeKind.PATTERN),
            entry("recursive_pattern", NodeKind.PATTERN),
            entry("type_pattern", NodeKind.PATTERN),
            entry("var_pattern", NodeKind.PATTERN),
            entry("relational_pattern", NodeKind.PATTERN),
            entry("and_pattern", NodeKind.PATTERN),
            entry("or_pattern", NodeKind.PATTERN),
            entry("negated_pattern", NodeKind.PATTERN),
            entry("parenthesized_pattern", NodeKind.PATTERN),
            entry("list_pattern", NodeKind.PATTERN),
            entry("tuple_pattern", NodeKind.PATTERN),
            entry("discard", NodeKind.PATTERN),
            entry("positional_pattern_clause", NodeKind.PATTERN_CLAUSE),
            entry("property_pattern_clause", NodeKind.PATTERN_CLAUSE),
            entry("subpattern", NodeKind.SUBPATTERN),
            entry("parenthesized_variable_designation", NodeKind.VARIABLE_DESIGNATION),
            entry("when_clause", NodeKind.WHEN),
            entry("switch_expression", NodeKind.SWITCH_EXPRESSION),
            entry("switch_expression_arm", NodeKind.SWITCH_ARM),
            entry("object_creation_expression", NodeKind.OBJECT_CREATION),
            entry("implicit_object_creation_expression", NodeKind.OBJECT_CREATION),
            entry("anonymous_object_creation_expression", NodeKind.ANONYMOUS_OBJECT),
            entry("array_creation_expression", NodeKind.ARRAY_CREATION),
            entry("implicit_array_creation_expression", NodeKind.ARRAY_CREATION),
            entry("initializer_expression", NodeKind.INITIALIZER),
            entry("with_expression", NodeKind.WITH),
            entry("with_initializer", NodeKind.INITIALIZER),
            entry("element_binding_expression", NodeKind.ELEMENT_BINDING),
            entry("stackalloc_expression", NodeKind.STACKALLOC),
            entry("implicit_stackalloc_expression", NodeKind.STACKALLOC),
            entry("checked_expression", NodeKind.CHECKED),
            entry("ref_expression", NodeKind.REF_EXPRESSION),
            entry("makeref_expression", NodeKind.TYPED_REFERENCE),
            entry("reftype_expression", NodeKind.TYPED_REFERENCE),
            entry("refvalue_expression", NodeKind.TYPED_REFERENCE),
            entry("typeof_expression", NodeKind.TYPEOF),
            entry("sizeof_expression", NodeKind.SIZEOF),
            entry("default_expression", NodeKind.DEFAULT),
            entry("this_expression", NodeKind.THIS),
            entry("this", NodeKind.THIS),
            entry("base_expression", NodeKind.BASE),
            entry("base", NodeKind.BASE),
            entry("lambda_expression", NodeKind.LAMBDA),
            entry("anonymous_method_expression", NodeKind.ANONYMOUS_METHOD),
            entry("await_expression", NodeKind.AWAIT),
            entry("throw_expression", NodeKind.THROW_EXPRESSION),
            entry("tuple_expression", NodeKind.TUPLE),
            entry("declaration_expression", NodeKind.DECLARATION_EXPRESSION),
            entry("range_expression", NodeKind.RANGE),

            entry("query_expression", NodeKind.QUERY),
            entry("from_clause", NodeKind.FROM),
            entry("where_clause", NodeKind.WHERE),
            entry("select_clause", NodeKind.SELECT),
            entry("order_by_clause", NodeKind.ORDER_BY),
            entry("group_clause", NodeKind.GROUP),
            entry("let_clause", NodeKind.LET),
            entry("join_clause", NodeKind.JOIN),
            entry("join_into_clause", NodeKind.JOIN)
    );

    private final CodeTreeConfig config;

    public KindClassifier(CodeTreeConfig config) {
        this.config = config;
    }

    /**
     * Classifies a raw construct.
     *
     * @param tag construct tag reported by the parser
     * @param source construct text, used for the diagnostic excerpt
     * @return the node kind, {@link NodeKind#UNKNOWN} for unmapped tags in lenient mode
     * @throws CodeTreeException with {@link CodeTreeErrorCode#UNMAPPED_NODE_KIND} for unmapped
     *         tags in strict mode
     */
    public NodeKind classify(String tag, String source) {
        NodeKind kind = TABLE.get(tag);
        if (kind != null) {
            return kind;
        }
        String excerpt = excerpt(source, EXCERPT_LENGTH);
        if (config.isStrict()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("tag", tag);
            context.put("excerpt", excerpt);
            throw new CodeTreeException(CodeTreeErrorCode.UNMAPPED_NODE_KIND, context);
        }
        config.debug("Unmapped construct '" + tag + "' classified as UNKNOWN: " + excerpt);
        return NodeKind.UNKNOWN;
    }

    /**
     * Raw tags known to the table, for exhaustiveness checks.
     */
    public static Map<String, NodeKind> table() {
        return TABLE;
    }

    static String excerpt(String source, int limit) {
        if (source == null) {
            return "";
        }
        return source.length() > limit ? source.substring(0, limit) : source;
    }
}
