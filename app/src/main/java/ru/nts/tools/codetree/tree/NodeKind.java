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

/**
 * Closed set of C# constructs a {@link Node} can represent.
 * Each kind carries the keyword that names it in structural queries.
 */
public enum NodeKind {

    UNKNOWN("unknown"),
    SYNTAX_ERROR("error"),

    // ============ Compilation unit ============

    USING_DIRECTIVE("using"),
    EXTERN_ALIAS("externalias"),
    GLOBAL_ATTRIBUTE("globalattribute"),
    GLOBAL_STATEMENT("globalstatement"),
    NAMESPACE("namespace"),
    FILE_SCOPED_NAMESPACE("filenamespace"),
    SHEBANG("shebang"),

    // ============ Types and members ============

    CLASS("class"),
    STRUCT("struct"),
    INTERFACE("interface"),
    RECORD("record"),
    ENUM("enum"),
    ENUM_MEMBER("enummember"),
    DELEGATE("delegate"),
    EVENT("event"),
    EVENT_FIELD("eventfield"),
    FIELD("field"),
    VARIABLE_DECLARATION("vardeclaration"),
    EQUALS_VALUE("equalsvalue"),
    PROPERTY("property"),
    INDEXER("indexer"),
    ACCESSOR_LIST("accessorlist"),
    ACCESSOR("accessor"),
    METHOD("method"),
    CONSTRUCTOR("constructor"),
    CONSTRUCTOR_INITIALIZER("constructorinit"),
    DESTRUCTOR("destructor"),
    OPERATOR("operator"),
    CONVERSION_OPERATOR("conversion"),
    EXPLICIT_INTERFACE("explicitinterface"),
    PRIMARY_CONSTRUCTOR_BASE("primarybase"),
    MODIFIER("modifier"),
    BASE_LIST("baselist"),
    PARAMETER_LIST("paramlist"),
    PARAMETER("param"),
    TYPE_PARAMETER_LIST("typeparams"),
    TYPE_PARAMETER("typeparam"),
    TYPE_CONSTRAINTS("constraints"),
    TYPE_CONSTRAINT("constraint"),
    ARROW_EXPRESSION("arrow"),

    // ============ Attributes ============

    ATTRIBUTE_LIST("attributelist"),
    ATTRIBUTE("attribute"),
    ATTRIBUTE_ARGUMENT_LIST("attributeargs"),
    ATTRIBUTE_ARGUMENT("attributearg"),
    ATTRIBUTE_TARGET("attributetarget"),

    // ============ Names and types ============

    IDENTIFIER("id"),
    QUALIFIED_NAME("name"),
    ALIAS_QUALIFIED_NAME("aliasname"),
    GENERIC_NAME("generic"),
    TYPE_ARGUMENT_LIST("typeargs"),
    PREDEFINED_TYPE("predefinedtype"),
    IMPLICIT_TYPE("var"),
    NULLABLE_TYPE("nullabletype"),
    ARRAY_TYPE("arraytype"),
    ARRAY_RANK("arrayrank"),
    POINTER_TYPE("pointertype"),
    TUPLE_TYPE("tupletype"),
    TUPLE_ELEMENT("tupleelement"),
    REF_TYPE("reftype"),
    SCOPED_TYPE("scopedtype"),
    FUNCTION_POINTER_TYPE("functionpointer"),
    FUNCTION_POINTER_PARAMETER("functionpointerparam"),
    CALLING_CONVENTION("callingconvention"),

    // ============ Statements ============

    BLOCK("block"),
    EXPRESSION_STATEMENT("expression"),
    LOCAL_DECLARATION("localdeclaration"),
    LOCAL_FUNCTION("localfunction"),
    RETURN("return"),
    IF("if"),
    ELSE("else"),
    SWITCH("switch"),
    SWITCH_SECTION("switchsection"),
    CASE_LABEL("case"),
    DEFAULT_LABEL("defaultlabel"),
    WHILE("while"),
    DO("do"),
    FOR("for"),
    FOREACH("foreach"),
    BREAK("break"),
    CONTINUE("continue"),
    GOTO("goto"),
    YIELD("yield"),
    LABELED("labeled"),
    USING_STATEMENT("usingstatement"),
    LOCK("lock"),
    THROW("throw"),
    TRY("try"),
    CATCH("catch"),
    CATCH_DECLARATION("catchdeclaration"),
    CATCH_FILTER("catchfilter"),
    FINALLY("finally"),
    EMPTY_STATEMENT("empty"),
    CHECKED("checked"),
    FIXED("fixed"),
    UNSAFE("unsafe"),

    // ============ Expressions ============

    INVOCATION("invocation"),
    ARGUMENT_LIST("arglist"),
    ARGUMENT("arg"),
    BRACKETED_ARGUMENT_LIST("bracketedargs"),
    ASSIGNMENT("assignment"),
    MEMBER_ACCESS("memberaccess"),
    CONDITIONAL_ACCESS("conditionalaccess"),
    MEMBER_BINDING("memberbinding"),
    ELEMENT_ACCESS("elementaccess"),
    LITERAL("literal"),
    STRING_CONTENT("stringcontent"),
    INTERPOLATED_STRING("interpolatedstring"),
    INTERPOLATION("interpolation"),
    INTERPOLATION_ALIGNMENT("alignment"),
    INTERPOLATION_FORMAT("format"),
    STRING_DELIMITER("delimiter"),
    PREFIX_UNARY("prefixunary"),
    POSTFIX_UNARY("postfixunary"),
    BINARY("binary"),
    PARENTHESIZED("parenthesized"),
    CONDITIONAL("conditional"),
    CAST("cast"),
    AS_EXPRESSION("as"),
    IS_EXPRESSION("is"),
    PATTERN("pattern"),
    PATTERN_CLAUSE("patternclause"),
    SUBPATTERN("subpattern"),
    VARIABLE_DESIGNATION("designation"),
    WHEN("when"),
    SWITCH_EXPRESSION("switchexpression"),
    SWITCH_ARM("switcharm"),
    OBJECT_CREATION("new"),
    ANONYMOUS_OBJECT("anonymousobject"),
    ARRAY_CREATION("newarray"),
    INITIALIZER("initializer"),
    WITH("with"),
    ELEMENT_BINDING("elementbinding"),
    STACKALLOC("stackalloc"),
    REF_EXPRESSION("refexpression"),
    TYPED_REFERENCE("typedref"),
    TYPEOF("typeof"),
    SIZEOF("sizeof"),
    DEFAULT("default"),
    THIS("this"),
    BASE("base"),
    LAMBDA("lambda"),
    ANONYMOUS_METHOD("anonymousmethod"),
    AWAIT("await"),
    THROW_EXPRESSION("throwexpression"),
    TUPLE("tuple"),
    DECLARATION_EXPRESSION("declarationexpression"),
    RANGE("range"),

    // ============ Query expressions ============

    QUERY("query"),
    FROM("from"),
    WHERE("where"),
    SELECT("select"),
    ORDER_BY("orderby"),
    GROUP("group"),
    LET("let"),
    JOIN("join");

    private final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Keyword naming this kind in structural queries and paths.
     */
    public String getKeyword() {
        return keyword;
    }
}
