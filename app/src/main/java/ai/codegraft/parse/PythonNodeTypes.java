package ai.codegraft.parse;

/** Node type names produced by the tree-sitter Python grammar. */
public final class PythonNodeTypes {

    public static final String MODULE = "module";
    public static final String ERROR = "ERROR";
    public static final String COMMENT = "comment";
    public static final String BLOCK = "block";

    // Definitions
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String PARAMETERS = "parameters";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LAMBDA_PARAMETERS = "lambda_parameters";

    // Statements
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String MATCH_STATEMENT = "match_statement";
    public static final String PASS_STATEMENT = "pass_statement";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String IMPORT_PREFIX = "import_prefix";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // Expressions
    public static final String IDENTIFIER = "identifier";
    public static final String ATTRIBUTE = "attribute";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String STRING = "string";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String STRING_CONTENT = "string_content";
    public static final String LIST = "list";
    public static final String TUPLE = "tuple";
    public static final String TYPE = "type";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";

    private PythonNodeTypes() {}
}
