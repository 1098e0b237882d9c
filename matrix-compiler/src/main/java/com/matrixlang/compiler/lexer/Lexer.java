package com.matrixlang.compiler.lexer;

import com.matrixlang.compiler.ast.SourceLocation;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * matrix-lang 词法分析器
 *
 * <p>既可通过 {@link #nextToken()} 流式读取，也可通过 {@link #scanTokens()} 一次性扫描。
 * 每次调用 {@link #iterator()} 都从源码开头重新扫描，因此 token 序列可重复遍历。
 * 遇到第一个错误立即抛出 {@link LexException}。</p>
 */
public class Lexer implements Iterable<Token> {
    /** Long.MIN_VALUE 的绝对值；以此为字面量值的 INT_LITERAL 只在紧跟一元负号时合法 */
    public static final BigInteger MIN_INT_MAGNITUDE = BigInteger.ONE.shiftLeft(63);

    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 括号嵌套栈：栈顶为 ( 或 [ 时换行不产生 NEWLINE，栈顶为 { 时恢复
    private final Deque<Character> groups = new ArrayDeque<Character>();
    private boolean emittedEof = false;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明
        map.put("let", TokenType.KW_LET);
        map.put("mut", TokenType.KW_MUT);
        map.put("fn", TokenType.KW_FN);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("typeclass", TokenType.KW_TYPECLASS);
        map.put("instance", TokenType.KW_INSTANCE);
        map.put("module", TokenType.KW_MODULE);
        map.put("import", TokenType.KW_IMPORT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("then", TokenType.KW_THEN);
        map.put("else", TokenType.KW_ELSE);
        map.put("match", TokenType.KW_MATCH);
        map.put("in", TokenType.KW_IN);

        // 并发语法（顺序执行）
        map.put("parallel", TokenType.KW_PARALLEL);
        map.put("spawn", TokenType.KW_SPAWN);
        map.put("wait", TokenType.KW_WAIT);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 每次返回一个从头开始的新迭代器（最后一个元素为 EOF）
     */
    @Override
    public Iterator<Token> iterator() {
        final Lexer fresh = new Lexer(source, fileName);
        return new Iterator<Token>() {
            @Override
            public boolean hasNext() {
                return !fresh.emittedEof;
            }

            @Override
            public Token next() {
                if (fresh.emittedEof) throw new NoSuchElementException();
                return fresh.nextToken();
            }
        };
    }

    /**
     * 执行词法分析，返回 Token 列表（含 EOF）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * 获取下一个 Token（流式接口）
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                emittedEof = true;
                return new Token(TokenType.EOF, "", null, fileName, line, column, current);
            }
            start = current;
            startLine = line;
            startColumn = column;
            Token token = scanToken();
            if (token != null) return token;
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else {
                break;
            }
        }
    }

    /** 扫描一个 token；注释和被抑制的换行返回 null */
    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': groups.push('('); return make(TokenType.LPAREN);
            case ')': closeGroup(); return make(TokenType.RPAREN);
            case '[': groups.push('['); return make(TokenType.LBRACKET);
            case ']': closeGroup(); return make(TokenType.RBRACKET);
            case '{': groups.push('{'); return make(TokenType.LBRACE);
            case '}': closeGroup(); return make(TokenType.RBRACE);
            case ',': return make(TokenType.COMMA);
            case ';': return make(TokenType.SEMICOLON);
            case ':': return make(TokenType.COLON);
            case '@': return make(TokenType.AT);
            case '+': return make(TokenType.PLUS);
            case '*': return make(TokenType.MUL);
            case '%': return make(TokenType.MOD);
            case '^': return make(TokenType.CARET);
            case '_':
                if (isAlphaNumeric(peek())) {
                    return identifier();
                }
                return make(TokenType.UNDERSCORE);

            case '.':
                if (match('.')) {
                    return make(match('=') ? TokenType.RANGE_INCLUSIVE : TokenType.RANGE);
                }
                return make(TokenType.DOT);

            case '-':
                if (match('-')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                    return null;
                }
                return make(match('>') ? TokenType.ARROW : TokenType.MINUS);

            case '/':
                if (match('*')) {
                    blockComment();
                    return null;
                }
                return make(TokenType.DIV);

            case '=':
                if (match('=')) return make(TokenType.EQ);
                if (match('>')) return make(TokenType.DOUBLE_ARROW);
                return make(TokenType.ASSIGN);

            case '!':
                return make(match('=') ? TokenType.NE : TokenType.NOT);

            case '<':
                return make(match('=') ? TokenType.LE : TokenType.LT);

            case '>':
                return make(match('=') ? TokenType.GE : TokenType.GT);

            case '&':
                if (match('&')) return make(TokenType.AND);
                throw invalidCharacter('&');

            case '|':
                return make(match('|') ? TokenType.OR : TokenType.PIPE);

            case '\n':
                Token newline = insideGroup() ? null : make(TokenType.NEWLINE);
                newLine();
                return newline;

            case '"':
                return string();

            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                throw invalidCharacter(c);
        }
    }

    // === 复合 token ===

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                newLine();
                value.append(c);
            } else if (c == '\\') {
                if (isAtEnd()) break;
                char esc = advance();
                switch (esc) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case 'r': value.append('\r'); break;
                    case '0': value.append('\0'); break;
                    case '\\': value.append('\\'); break;
                    case '"': value.append('"'); break;
                    default:
                        throw new LexException(LexErrorKind.InvalidCharacter,
                                "Invalid escape sequence '\\" + esc + "'",
                                location(line, column - 2), esc);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            throw new LexException(LexErrorKind.UnterminatedString,
                    "Unterminated string starting on line " + startLine,
                    location(startLine, startColumn));
        }
        advance(); // 结束引号
        return make(TokenType.STRING_LITERAL, value.toString());
    }

    private Token number() {
        while (isDigit(peek())) advance();

        boolean isFloat = false;
        // 1..5 是范围而非浮点数
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();

            if (peek() == 'e' || peek() == 'E') {
                char sign = peekNext();
                if (isDigit(sign) || ((sign == '+' || sign == '-') && current + 2 < source.length()
                        && isDigit(source.charAt(current + 2)))) {
                    advance();
                    if (peek() == '+' || peek() == '-') advance();
                    while (isDigit(peek())) advance();
                }
            }
        }

        String text = source.substring(start, current);
        if (isAlpha(peek())) {
            throw new LexException(LexErrorKind.InvalidNumber,
                    "Invalid numeric literal '" + text + peek() + "'",
                    location(startLine, startColumn));
        }
        if (isFloat) {
            return make(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
        }
        try {
            return make(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            // 2^63 只能作为 -9223372036854775808 出现，由解析器折叠负号
            if (new BigInteger(text).equals(MIN_INT_MAGNITUDE)) {
                return make(TokenType.INT_LITERAL, MIN_INT_MAGNITUDE);
            }
            throw new LexException(LexErrorKind.InvalidNumber,
                    "Integer literal out of range: " + text,
                    location(startLine, startColumn));
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        return make(type != null ? type : TokenType.IDENTIFIER);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
        throw new LexException(LexErrorKind.UnterminatedComment,
                "Unterminated block comment", location(startLine, startColumn));
    }

    // === 辅助方法 ===

    private void closeGroup() {
        if (!groups.isEmpty()) groups.pop();
    }

    private boolean insideGroup() {
        return !groups.isEmpty() && groups.peek() != '{';
    }

    private Token make(TokenType type) {
        return make(type, null);
    }

    private Token make(TokenType type, Object literal) {
        String text = source.substring(start, current);
        return new Token(type, text, literal, fileName, startLine, startColumn, start);
    }

    private LexException invalidCharacter(char c) {
        return new LexException(LexErrorKind.InvalidCharacter,
                "Invalid character '" + c + "'", location(startLine, startColumn), c);
    }

    private SourceLocation location(int l, int c) {
        return new SourceLocation(fileName, l, c, start, current - start);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
