package com.matrixlang.compiler.lexer;

/**
 * Token 类型枚举
 */
public enum TokenType {
    // 字面量
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,

    // 关键词
    KW_LET,
    KW_MUT,
    KW_FN,
    KW_STRUCT,
    KW_IF,
    KW_THEN,
    KW_ELSE,
    KW_MATCH,
    KW_TYPECLASS,
    KW_INSTANCE,
    KW_MODULE,
    KW_IMPORT,
    KW_PARALLEL,
    KW_SPAWN,
    KW_WAIT,
    KW_IN,
    KW_TRUE,
    KW_FALSE,

    // 算术运算符
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    CARET,          // ^

    // 比较运算符
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // 逻辑运算符
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // 赋值与箭头
    ASSIGN,         // =
    DOUBLE_ARROW,   // =>
    ARROW,          // ->

    // 范围
    RANGE,          // ..
    RANGE_INCLUSIVE,// ..=

    // 分隔符
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // :
    DOT,            // .
    PIPE,           // |
    AT,             // @
    UNDERSCORE,     // _

    NEWLINE,
    EOF
}
