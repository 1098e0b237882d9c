package com.matrixlang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 非 NEWLINE 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF && t.getType() != TokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("运算符与标点")
    class OperatorTests {

        @Test
        @DisplayName("全部运算符")
        void testOperators() {
            List<TokenType> expected = Arrays.asList(
                    TokenType.PLUS, TokenType.MINUS, TokenType.MUL, TokenType.DIV, TokenType.MOD,
                    TokenType.CARET, TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.LE,
                    TokenType.GT, TokenType.GE, TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.EOF);
            assertEquals(expected, types("+ - * / % ^ == != < <= > >= && || !"));
        }

        @Test
        @DisplayName("箭头、范围与标点")
        void testPunctuation() {
            List<TokenType> expected = Arrays.asList(
                    TokenType.DOUBLE_ARROW, TokenType.ARROW, TokenType.DOT, TokenType.RANGE,
                    TokenType.RANGE_INCLUSIVE, TokenType.COLON, TokenType.COMMA, TokenType.PIPE,
                    TokenType.AT, TokenType.UNDERSCORE, TokenType.ASSIGN, TokenType.EOF);
            assertEquals(expected, types("=> -> . .. ..= : , | @ _ ="));
        }

        @Test
        @DisplayName("1..5 是范围而不是浮点数")
        void testRangeAfterInteger() {
            List<Token> toks = tokens("1..5");
            assertEquals(3, toks.size());
            assertEquals(TokenType.INT_LITERAL, toks.get(0).getType());
            assertEquals(TokenType.RANGE, toks.get(1).getType());
            assertEquals(5L, toks.get(2).getLiteral());
        }
    }

    @Nested
    @DisplayName("字面量与关键词")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点数")
        void testNumbers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42L);
            assertSingleToken("3.25", TokenType.FLOAT_LITERAL, 3.25);
            assertSingleToken("1.5e3", TokenType.FLOAT_LITERAL, 1500.0);
            assertSingleToken("2.0E-1", TokenType.FLOAT_LITERAL, 0.2);
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertSingleToken("\"a\\tb\\n\\\"c\\\\\"", TokenType.STRING_LITERAL, "a\tb\n\"c\\");
        }

        @Test
        @DisplayName("关键词与标识符")
        void testKeywords() {
            List<Token> toks = tokens("let mut fn struct typeclass instance module import parallel spawn wait letter");
            assertEquals(TokenType.KW_LET, toks.get(0).getType());
            assertEquals(TokenType.KW_MUT, toks.get(1).getType());
            assertEquals(TokenType.KW_FN, toks.get(2).getType());
            assertEquals(TokenType.KW_WAIT, toks.get(10).getType());
            assertEquals(TokenType.IDENTIFIER, toks.get(11).getType());
            assertEquals("letter", toks.get(11).getLexeme());
        }

        @Test
        @DisplayName("下划线开头的标识符")
        void testUnderscoreIdentifier() {
            List<Token> toks = tokens("_tmp _");
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertEquals(TokenType.UNDERSCORE, toks.get(1).getType());
        }
    }

    @Nested
    @DisplayName("注释与换行")
    class TriviaTests {

        @Test
        @DisplayName("行注释与块注释被跳过")
        void testComments() {
            assertEquals(Arrays.asList(TokenType.INT_LITERAL, TokenType.NEWLINE, TokenType.INT_LITERAL, TokenType.EOF),
                    types("1 -- one\n/* two\n lines */ 2"));
        }

        @Test
        @DisplayName("圆括号和方括号内的换行被忽略，花括号内保留")
        void testNewlineInsideGroups() {
            assertEquals(Arrays.asList(TokenType.LPAREN, TokenType.INT_LITERAL, TokenType.COMMA,
                    TokenType.INT_LITERAL, TokenType.RPAREN, TokenType.EOF), types("(1,\n2)"));
            assertTrue(types("{\n1\n}").contains(TokenType.NEWLINE));
            // 括号内嵌的块恢复换行
            assertTrue(types("f((x) => {\n1\n})").contains(TokenType.NEWLINE));
        }

        @Test
        @DisplayName("token 位置")
        void testPositions() {
            List<Token> toks = tokens("let x = 1\n  foo");
            assertEquals(1, toks.get(1).getLine());
            assertEquals(5, toks.get(1).getColumn());
            Token foo = toks.get(4);
            assertEquals(2, foo.getLine());
            assertEquals(3, foo.getColumn());
        }
    }

    @Nested
    @DisplayName("惰性可重复遍历")
    class IterationTests {

        @Test
        @DisplayName("每次 iterator() 都从头扫描")
        void testRestartable() {
            Lexer lexer = new Lexer("a + b");
            List<TokenType> first = new ArrayList<TokenType>();
            for (Token t : lexer) first.add(t.getType());
            List<TokenType> second = new ArrayList<TokenType>();
            for (Token t : lexer) second.add(t.getType());
            assertEquals(first, second);
            assertEquals(TokenType.EOF, first.get(first.size() - 1));
        }

        @Test
        @DisplayName("错误在遍历到时才抛出")
        void testLazyFailure() {
            Iterator<Token> it = new Lexer("a $").iterator();
            assertEquals(TokenType.IDENTIFIER, it.next().getType());
            assertThrows(LexException.class, it::next);
        }
    }

    @Nested
    @DisplayName("词法错误")
    class ErrorTests {

        @Test
        @DisplayName("未闭合字符串报告起始行")
        void testUnterminatedString() {
            LexException e = assertThrows(LexException.class, () -> scan("let s = 1\nlet t = \"abc"));
            assertEquals(LexErrorKind.UnterminatedString, e.getKind());
            assertEquals(2, e.getLine());
            assertEquals(9, e.getColumn());
            assertEquals("LexError", e.getCategory());
        }

        @Test
        @DisplayName("非法字符带字符、行、列")
        void testInvalidCharacter() {
            LexException e = assertThrows(LexException.class, () -> scan("let a = 1\nlet b = #"));
            assertEquals(LexErrorKind.InvalidCharacter, e.getKind());
            assertEquals(Character.valueOf('#'), e.getOffendingChar());
            assertEquals(2, e.getLine());
            assertEquals(9, e.getColumn());
            assertEquals("InvalidCharacter: Invalid character '#' at line 2, column 9", e.getMessage());
        }

        @Test
        @DisplayName("单个 & 非法")
        void testLoneAmpersand() {
            LexException e = assertThrows(LexException.class, () -> scan("a & b"));
            assertEquals(LexErrorKind.InvalidCharacter, e.getKind());
        }

        @Test
        @DisplayName("数字后紧跟字母")
        void testInvalidNumber() {
            LexException e = assertThrows(LexException.class, () -> scan("12abc"));
            assertEquals(LexErrorKind.InvalidNumber, e.getKind());
        }

        @Test
        @DisplayName("整数溢出")
        void testIntegerOverflow() {
            LexException e = assertThrows(LexException.class, () -> scan("99999999999999999999"));
            assertEquals(LexErrorKind.InvalidNumber, e.getKind());
            assertThrows(LexException.class, () -> scan("9223372036854775809"));
        }

        @Test
        @DisplayName("2^63 保留为待取负的字面量")
        void testMinIntMagnitude() {
            List<Token> tokens = scan("9223372036854775808");
            assertEquals(TokenType.INT_LITERAL, tokens.get(0).getType());
            assertEquals(Lexer.MIN_INT_MAGNITUDE, tokens.get(0).getLiteral());
        }

        @Test
        @DisplayName("未闭合块注释")
        void testUnterminatedComment() {
            LexException e = assertThrows(LexException.class, () -> scan("1 /* never closed"));
            assertEquals(LexErrorKind.UnterminatedComment, e.getKind());
        }
    }
}
