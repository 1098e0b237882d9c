package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Expression;
import com.matrixlang.compiler.ast.pattern.Pattern;
import com.matrixlang.compiler.ast.stmt.Statement;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.lexer.LexErrorKind;
import com.matrixlang.compiler.lexer.LexException;
import com.matrixlang.compiler.lexer.Lexer;
import com.matrixlang.compiler.lexer.Token;
import com.matrixlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.matrixlang.compiler.lexer.TokenType.*;

/**
 * matrix-lang 递归下降语法分析器
 *
 * <p>各语法类别由辅助类负责：{@link ExprParser}、{@link StmtParser}、
 * {@link PatternParser}、{@link TypeParser}。本类提供共享的 token 游标。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position = 0;
    Token current;
    Token previous;

    // 已消费的开括号嵌套深度；match 守卫所在层级上的 '=>' 属于分支而非 lambda
    private int nesting = 0;
    private int guardNesting = -1;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final PatternParser patternParser = new PatternParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.current = tokens.get(0);
    }

    public Parser(String source, String fileName) {
        this(new Lexer(source, fileName), fileName);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        switch (previous.getType()) {
            case LPAREN:
            case LBRACKET:
            case LBRACE:
                nesting++;
                break;
            case RPAREN:
            case RBRACKET:
            case RBRACE:
                nesting--;
                break;
            default:
                break;
        }
        return previous;
    }

    /**
     * 解析 match 守卫：守卫顶层的 {@code x =>} 与 {@code (...) =>} 不作为 lambda
     */
    Expression parseGuard() {
        int saved = guardNesting;
        guardNesting = nesting;
        try {
            return parseExpression();
        } finally {
            guardNesting = saved;
        }
    }

    /** 当前位置的 '=>' 可以开始 lambda */
    boolean lambdaAllowed() {
        return nesting != guardNesting;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return peekAt(1);
    }

    /**
     * 查看当前位置之后第 n 个 token
     */
    Token peekAt(int n) {
        int index = Math.min(position + n, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 从 offset 处的开括号出发，返回与之匹配的闭括号之后的 token 偏移；未闭合返回 -1
     */
    int offsetAfterMatching(int offset, TokenType open, TokenType close) {
        int depth = 0;
        for (int i = position + offset; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).getType();
            if (type == open) {
                depth++;
            } else if (type == close) {
                depth--;
                if (depth == 0) return i + 1 - position;
            } else if (type == EOF) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw ParseException.unexpected(expected, current);
    }

    /**
     * 期望闭合 token；在输入结束处缺失时报告 UnterminatedConstruct
     */
    Token expectClosing(TokenType type, Token opener, String construct) {
        skipNewlines();
        if (check(type)) {
            return advance();
        }
        String expected = "'" + closingText(type) + "'";
        if (isAtEnd()) {
            throw ParseException.unterminated(construct, opener, expected);
        }
        throw ParseException.unexpected(expected, current);
    }

    private static String closingText(TokenType type) {
        switch (type) {
            case RPAREN: return ")";
            case RBRACKET: return "]";
            case RBRACE: return "}";
            case GT: return ">";
            default: return type.name();
        }
    }

    /**
     * 当前 token 的源码位置
     */
    SourceLocation location() {
        return current.getLocation();
    }

    /**
     * 上一个 token 的源码位置
     */
    SourceLocation previousLocation() {
        return previous.getLocation();
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    /** 跳过换行后当前 token 是否为 type（不消费） */
    boolean checkAfterNewlines(TokenType type) {
        int i = 0;
        while (peekAt(i).is(NEWLINE)) i++;
        return peekAt(i).is(type);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序：以换行或分号分隔的顶层语句序列
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(parseStatement());
            if (!isAtEnd() && !checkAny(NEWLINE, SEMICOLON)) {
                throw ParseException.unexpected("newline or ';'", current);
            }
            skipSeparators();
        }
        return new Program(loc, statements);
    }

    /**
     * 解析单个表达式（必须消费全部输入）
     */
    public Expression parseStandaloneExpression() {
        skipSeparators();
        Expression expr = parseExpression();
        skipSeparators();
        if (!isAtEnd()) {
            throw ParseException.unexpected("end of input", current);
        }
        return expr;
    }

    /**
     * 解析单个类型（必须消费全部输入），用于内置函数签名文本
     */
    public TypeRef parseStandaloneType() {
        TypeRef type = parseType();
        if (!isAtEnd()) {
            throw ParseException.unexpected("end of type", current);
        }
        return type;
    }

    // ============ 委托 ============

    TypeRef parseType() { return typeParser.parseType(); }

    Pattern parsePattern() { return patternParser.parsePattern(); }

    Statement parseStatement() { return stmtParser.parseStatement(); }

    Expression parseExpression() { return exprParser.parseExpression(); }

    // ============ 整数字面量 ============

    /** 负号后的整数字面量取反；2^63 折叠为 Long.MIN_VALUE */
    static long negatedInt(Token number) {
        Object value = number.getLiteral();
        if (value instanceof Long) {
            return -((Long) value);
        }
        return Long.MIN_VALUE;
    }

    static LexException intOutOfRange(Token number) {
        return new LexException(LexErrorKind.InvalidNumber,
                "Integer literal out of range: " + number.getLexeme(), number.getLocation());
    }
}
