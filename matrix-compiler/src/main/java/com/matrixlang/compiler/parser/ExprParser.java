package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.Parameter;
import com.matrixlang.compiler.ast.expr.*;
import com.matrixlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.matrixlang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.matrixlang.compiler.ast.pattern.Pattern;
import com.matrixlang.compiler.ast.stmt.ExpressionStmt;
import com.matrixlang.compiler.ast.stmt.Statement;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.lexer.Token;
import com.matrixlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.matrixlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析（优先级由低到高）
 *
 * <pre>
 * let-in &lt; 范围 &lt; || &lt; &amp;&amp; &lt; == != &lt; &lt; &lt;= &gt; &gt;= &lt; + - &lt; * / %
 *        &lt; 一元 - ! &lt; ^（右结合）&lt; 后缀（调用、索引、字段访问）
 * </pre>
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        if (parser.check(KW_LET)) {
            return parseLetIn();
        }
        return parseRangeExpr();
    }

    /**
     * let [mut] x [: T] = value in body
     */
    private Expression parseLetIn() {
        SourceLocation loc = parser.location();
        parser.advance();
        boolean mutable = parser.match(KW_MUT);
        String name = parser.expect(IDENTIFIER, "binding name").getLexeme();
        TypeRef type = parser.match(COLON) ? parser.parseType() : null;
        parser.expect(ASSIGN, "'='");
        parser.skipNewlines();
        Expression value = parser.parseExpression();
        parser.skipNewlines();
        parser.expect(KW_IN, "'in'");
        parser.skipNewlines();
        Expression body = parser.parseExpression();
        return new LetExpr(loc, name, mutable, type, value, body);
    }

    private Expression parseRangeExpr() {
        Expression left = parseDisjunctionExpr();
        if (parser.checkAny(RANGE, RANGE_INCLUSIVE)) {
            boolean inclusive = parser.advance().is(RANGE_INCLUSIVE);
            parser.skipNewlines();
            Expression right = parseDisjunctionExpr();
            return new RangeExpr(left.getLocation(), left, right, inclusive);
        }
        return left;
    }

    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();
        while (parser.check(OR)) {
            left = binaryTail(left, BinaryOp.OR, parseNextAfterOperator(1));
        }
        return left;
    }

    private Expression parseConjunctionExpr() {
        Expression left = parseEqualityExpr();
        while (parser.check(AND)) {
            left = binaryTail(left, BinaryOp.AND, parseNextAfterOperator(2));
        }
        return left;
    }

    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();
        while (parser.checkAny(EQ, NE)) {
            BinaryOp op = parser.check(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            left = binaryTail(left, op, parseNextAfterOperator(3));
        }
        return left;
    }

    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.checkAny(LT, LE, GT, GE)) {
            BinaryOp op = comparisonOp(parser.current.getType());
            left = binaryTail(left, op, parseNextAfterOperator(4));
        }
        return left;
    }

    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryOp op = parser.check(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            left = binaryTail(left, op, parseNextAfterOperator(5));
        }
        return left;
    }

    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrefixExpr();
        while (parser.checkAny(MUL, DIV, MOD)) {
            BinaryOp op = parser.check(MUL) ? BinaryOp.MUL : parser.check(DIV) ? BinaryOp.DIV : BinaryOp.MOD;
            left = binaryTail(left, op, parseNextAfterOperator(6));
        }
        return left;
    }

    /** 消费运算符与其后的换行，然后解析下一优先级的右操作数 */
    private Expression parseNextAfterOperator(int level) {
        parser.advance();
        parser.skipNewlines();
        switch (level) {
            case 1: return parseConjunctionExpr();
            case 2: return parseEqualityExpr();
            case 3: return parseComparisonExpr();
            case 4: return parseAdditiveExpr();
            case 5: return parseMultiplicativeExpr();
            default: return parsePrefixExpr();
        }
    }

    private Expression binaryTail(Expression left, BinaryOp op, Expression right) {
        return new BinaryExpr(left.getLocation(), left, op, right);
    }

    private static BinaryOp comparisonOp(TokenType type) {
        switch (type) {
            case LT: return BinaryOp.LT;
            case LE: return BinaryOp.LE;
            case GT: return BinaryOp.GT;
            default: return BinaryOp.GE;
        }
    }

    /**
     * 一元运算：- 和 !（优先级低于 ^，故 -2^2 == -(2^2)）
     *
     * <p>-9223372036854775808 直接折叠为字面量，其绝对值本身无法用 Int 表示。</p>
     */
    private Expression parsePrefixExpr() {
        if (parser.check(MINUS) && parser.peek().is(INT_LITERAL)
                && !(parser.peek().getLiteral() instanceof Long) && !parser.peekAt(2).is(CARET)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Token number = parser.advance();
            return new Literal(loc, Parser.negatedInt(number), Literal.LiteralKind.INT);
        }
        if (parser.checkAny(MINUS, NOT)) {
            SourceLocation loc = parser.location();
            UnaryOp op = parser.advance().is(MINUS) ? UnaryOp.NEG : UnaryOp.NOT;
            return new UnaryExpr(loc, op, parsePrefixExpr());
        }
        return parsePowerExpr();
    }

    /**
     * 幂运算，右结合；指数允许带一元符号（2 ^ -1）
     */
    private Expression parsePowerExpr() {
        Expression base = parsePostfixExpr();
        if (parser.check(CARET)) {
            parser.advance();
            parser.skipNewlines();
            Expression exponent = parsePrefixExpr();
            return new BinaryExpr(base.getLocation(), base, BinaryOp.POW, exponent);
        }
        return base;
    }

    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();
        while (true) {
            if (parser.check(LPAREN)) {
                SourceLocation loc = parser.location();
                expr = new CallExpr(loc, expr, parseCallArgs());
            } else if (parser.check(LBRACKET)) {
                SourceLocation loc = parser.location();
                Token open = parser.advance();
                Expression index = parser.parseExpression();
                parser.expectClosing(RBRACKET, open, "index expression");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.check(DOT)) {
                SourceLocation loc = parser.location();
                parser.advance();
                String field = parser.expect(IDENTIFIER, "field name").getLexeme();
                expr = new FieldAccessExpr(loc, expr, field);
            } else {
                break;
            }
        }
        return expr;
    }

    private List<Expression> parseCallArgs() {
        Token open = parser.expect(LPAREN, "'('");
        List<Expression> args = new ArrayList<Expression>();
        while (!parser.check(RPAREN) && !parser.isAtEnd()) {
            args.add(parser.parseExpression());
            if (!parser.match(COMMA)) break;
        }
        parser.expectClosing(RPAREN, open, "argument list");
        return args;
    }

    // ============ 基本表达式 ============

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
                return parser.patternParser.parseLiteral();

            case IDENTIFIER:
                if (parser.peek().is(DOUBLE_ARROW) && parser.lambdaAllowed()) {
                    return parseSingleParamLambda();
                }
                if (isStructLiteralStart()) {
                    return parseStructLiteral();
                }
                parser.advance();
                return new Identifier(loc, token.getLexeme());

            case LPAREN:
                if (parser.lambdaAllowed() && isLambdaStart()) {
                    return parseLambda();
                }
                parser.advance();
                if (parser.match(RPAREN)) {
                    return new Literal(loc, null, Literal.LiteralKind.UNIT);
                }
                Expression inner = parser.parseExpression();
                parser.expectClosing(RPAREN, token, "parenthesized expression");
                return inner;

            case LBRACKET:
                return parseArrayLike();

            case LBRACE:
                return parseBlock();

            case KW_IF:
                return parseIf();

            case KW_MATCH:
                return parseMatch();

            case KW_LET:
                return parseLetIn();

            case KW_PARALLEL: {
                parser.advance();
                BlockExpr block = parseBlock();
                List<Statement> statements = new ArrayList<Statement>(block.getStatements());
                if (block.getTrailing() != null) {
                    statements.add(new ExpressionStmt(block.getTrailing().getLocation(), block.getTrailing()));
                }
                return new ParallelExpr(loc, statements);
            }

            case KW_SPAWN:
                parser.advance();
                return new SpawnExpr(loc, parser.parseExpression());

            case KW_WAIT:
                parser.advance();
                return new WaitExpr(loc, parser.parseExpression());

            default:
                throw ParseException.unexpected("expression", token);
        }
    }

    /** '(' ... ')' 之后紧跟 '=>' 或 '->' 时为 lambda */
    private boolean isLambdaStart() {
        int after = parser.offsetAfterMatching(0, LPAREN, RPAREN);
        return after > 0 && parser.peekAt(after).isOneOf(DOUBLE_ARROW, ARROW);
    }

    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        List<Parameter> params = parser.stmtParser.parseParameters();
        TypeRef returnType = parser.match(ARROW) ? parser.parseType() : null;
        parser.expect(DOUBLE_ARROW, "'=>'");
        parser.skipNewlines();
        return new LambdaExpr(loc, params, returnType, parser.parseExpression());
    }

    /** x => body */
    private Expression parseSingleParamLambda() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();
        parser.advance();
        parser.skipNewlines();
        Parameter param = new Parameter(loc, name, null);
        return new LambdaExpr(loc, Collections.singletonList(param), null, parser.parseExpression());
    }

    /** 大写标识符 + '{' + ('}' | IDENT ':') 视为结构体字面量 */
    private boolean isStructLiteralStart() {
        String name = parser.current.getLexeme();
        if (!Character.isUpperCase(name.charAt(0)) || !parser.peek().is(LBRACE)) {
            return false;
        }
        int i = 2;
        while (parser.peekAt(i).is(NEWLINE)) i++;
        if (parser.peekAt(i).is(RBRACE)) return true;
        return parser.peekAt(i).is(IDENTIFIER) && parser.peekAt(i + 1).is(COLON);
    }

    private Expression parseStructLiteral() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();
        Token open = parser.advance();
        List<FieldInit> fields = new ArrayList<FieldInit>();
        skipFieldSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldLoc = parser.location();
            String field = parser.expect(IDENTIFIER, "field name").getLexeme();
            parser.expect(COLON, "':'");
            parser.skipNewlines();
            fields.add(new FieldInit(fieldLoc, field, parser.parseExpression()));
            skipFieldSeparators();
        }
        parser.expectClosing(RBRACE, open, "struct literal");
        return new StructLiteral(loc, name, fields);
    }

    private void skipFieldSeparators() {
        while (parser.matchAny(COMMA, NEWLINE)) {
            // 字段之间用逗号或换行分隔
        }
    }

    /**
     * 数组字面量、矩阵候选字面量或推导式
     */
    private Expression parseArrayLike() {
        SourceLocation loc = parser.location();
        Token open = parser.advance();
        if (parser.match(RBRACKET)) {
            return new ArrayLiteral(loc, Collections.<Expression>emptyList());
        }

        Expression first = parser.parseExpression();
        if (parser.match(PIPE)) {
            return parseComprehension(loc, open, first);
        }

        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parser.parseExpression());
        }
        parser.expectClosing(RBRACKET, open, "array literal");

        List<List<Expression>> rows = asMatrixRows(elements);
        if (rows != null) {
            return new MatrixLiteral(loc, rows);
        }
        return new ArrayLiteral(loc, elements);
    }

    /** 所有元素都是等长非空数组字面量时返回行列表，否则返回 null */
    private static List<List<Expression>> asMatrixRows(List<Expression> elements) {
        List<List<Expression>> rows = new ArrayList<List<Expression>>();
        int width = -1;
        for (Expression element : elements) {
            if (!(element instanceof ArrayLiteral)) return null;
            List<Expression> row = ((ArrayLiteral) element).getElements();
            if (row.isEmpty() || (width >= 0 && row.size() != width)) return null;
            width = row.size();
            rows.add(row);
        }
        return rows;
    }

    /**
     * [element | x in xs, y in ys, cond]
     */
    private Expression parseComprehension(SourceLocation loc, Token open, Expression element) {
        List<ComprehensionClause> clauses = new ArrayList<ComprehensionClause>();
        do {
            SourceLocation clauseLoc = parser.location();
            if (parser.check(IDENTIFIER) && parser.peek().is(KW_IN)) {
                String variable = parser.advance().getLexeme();
                parser.advance();
                clauses.add(new ComprehensionClause(clauseLoc, variable, parser.parseExpression()));
            } else {
                parser.match(KW_IF);
                clauses.add(new ComprehensionClause(clauseLoc, null, parser.parseExpression()));
            }
        } while (parser.matchAny(COMMA, PIPE) || parser.check(KW_IF));
        parser.expectClosing(RBRACKET, open, "comprehension");

        if (!clauses.get(0).isGenerator()) {
            throw ParseException.unexpected("generator 'x in expr'", open);
        }
        return new ComprehensionExpr(loc, element, clauses);
    }

    /**
     * '{' statements [trailing expression] '}'
     *
     * <p>最后一条表达式语句后没有分号时作为块的值。</p>
     */
    BlockExpr parseBlock() {
        SourceLocation loc = parser.location();
        Token open = parser.expect(LBRACE, "'{'");
        List<Statement> statements = new ArrayList<Statement>();
        boolean endsWithSemicolon = false;
        parser.skipSeparators();
        while (!parser.check(RBRACE)) {
            if (parser.isAtEnd()) {
                throw ParseException.unterminated("block", open, "'}'");
            }
            statements.add(parser.parseStatement());
            endsWithSemicolon = parser.check(SEMICOLON);
            if (!parser.checkAny(RBRACE, NEWLINE, SEMICOLON)) {
                if (parser.isAtEnd()) {
                    throw ParseException.unterminated("block", open, "'}'");
                }
                throw ParseException.unexpected("newline, ';' or '}'", parser.current);
            }
            parser.skipSeparators();
        }
        parser.advance();

        Expression trailing = null;
        if (!statements.isEmpty() && !endsWithSemicolon) {
            Statement last = statements.get(statements.size() - 1);
            if (last instanceof ExpressionStmt) {
                trailing = ((ExpressionStmt) last).getExpression();
                statements.remove(statements.size() - 1);
            }
        }
        return new BlockExpr(loc, statements, trailing);
    }

    /**
     * if cond then a [else b] | if cond { ... } [else ...]
     */
    private Expression parseIf() {
        SourceLocation loc = parser.location();
        parser.advance();
        parser.skipNewlines();
        Expression condition = parser.parseExpression();
        parser.skipNewlines();

        Expression thenBranch;
        if (parser.match(KW_THEN)) {
            parser.skipNewlines();
            thenBranch = parser.parseExpression();
        } else if (parser.check(LBRACE)) {
            thenBranch = parseBlock();
        } else {
            throw ParseException.unexpected("'then' or '{'", parser.current);
        }

        Expression elseBranch = null;
        if (parser.checkAfterNewlines(KW_ELSE)) {
            parser.skipNewlines();
            parser.advance();
            parser.skipNewlines();
            elseBranch = parser.parseExpression();
        }
        return new IfExpr(loc, condition, thenBranch, elseBranch);
    }

    /**
     * match e { pattern [if guard] => body, ... }
     */
    private Expression parseMatch() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression scrutinee = parser.parseExpression();
        Token open = parser.expect(LBRACE, "'{'");
        List<MatchArm> arms = new ArrayList<MatchArm>();
        skipArmSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation armLoc = parser.location();
            Pattern pattern = parser.parsePattern();
            Expression guard = parser.match(KW_IF) ? parser.parseGuard() : null;
            parser.expect(DOUBLE_ARROW, "'=>'");
            parser.skipNewlines();
            Expression body = parser.parseExpression();
            arms.add(new MatchArm(armLoc, pattern, guard, body));
            skipArmSeparators();
        }
        parser.expectClosing(RBRACE, open, "match expression");
        if (arms.isEmpty()) {
            throw ParseException.unexpected("at least one match arm", parser.previous);
        }
        return new MatchExpr(loc, scrutinee, arms);
    }

    private void skipArmSeparators() {
        while (parser.matchAny(COMMA, NEWLINE, SEMICOLON)) {
            // 分支之间用逗号、分号或换行分隔
        }
    }
}
