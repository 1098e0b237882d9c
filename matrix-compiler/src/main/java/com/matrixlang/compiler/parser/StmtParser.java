package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.*;
import com.matrixlang.compiler.ast.expr.Expression;
import com.matrixlang.compiler.ast.expr.LambdaExpr;
import com.matrixlang.compiler.ast.expr.LetExpr;
import com.matrixlang.compiler.ast.stmt.AssignStmt;
import com.matrixlang.compiler.ast.stmt.ExpressionStmt;
import com.matrixlang.compiler.ast.stmt.LetStmt;
import com.matrixlang.compiler.ast.stmt.Statement;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.matrixlang.compiler.lexer.TokenType.*;

/**
 * 语句与声明解析
 */
class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        List<String> attributes = parseAttributes();

        switch (parser.current.getType()) {
            case KW_LET:
                return parseLet(attributes);
            case KW_FN:
                return parseFn(attributes);
            default:
                break;
        }

        if (parser.check(IDENTIFIER) && isShortFunctionStart()) {
            return parseShortFunction(attributes);
        }
        if (!attributes.isEmpty()) {
            throw ParseException.unexpected("definition after attribute", parser.current);
        }

        switch (parser.current.getType()) {
            case KW_STRUCT:
                return parseStruct();
            case KW_TYPECLASS:
                return parseTypeclass();
            case KW_INSTANCE:
                return parseInstance();
            case KW_MODULE:
                return parseModule();
            case KW_IMPORT:
                return parseImport();
            default:
                break;
        }

        if (parser.check(IDENTIFIER) && parser.peek().is(ASSIGN)) {
            SourceLocation loc = parser.location();
            String name = parser.advance().getLexeme();
            parser.advance();
            parser.skipNewlines();
            return new AssignStmt(loc, name, parser.parseExpression());
        }

        SourceLocation loc = parser.location();
        return new ExpressionStmt(loc, parser.parseExpression());
    }

    private List<String> parseAttributes() {
        List<String> attributes = new ArrayList<String>();
        while (parser.match(AT)) {
            attributes.add(parser.expect(IDENTIFIER, "attribute name").getLexeme());
            parser.skipNewlines();
        }
        return attributes.isEmpty() ? Collections.<String>emptyList() : attributes;
    }

    /**
     * let [mut] name [: Type] = value [in body]
     */
    private Statement parseLet(List<String> attributes) {
        SourceLocation loc = parser.location();
        parser.expect(KW_LET, "'let'");
        boolean mutable = parser.match(KW_MUT);
        String name = parser.expect(IDENTIFIER, "binding name").getLexeme();
        TypeRef type = parser.match(COLON) ? parser.parseType() : null;
        parser.expect(ASSIGN, "'='");
        parser.skipNewlines();
        Expression value = parser.parseExpression();

        if (parser.match(KW_IN)) {
            parser.skipNewlines();
            Expression body = parser.parseExpression();
            return new ExpressionStmt(loc, new LetExpr(loc, name, mutable, type, value, body));
        }
        return new LetStmt(loc, name, mutable, type, value, attributes);
    }

    /**
     * fn name(params) [-> Type] = body
     */
    private Statement parseFn(List<String> attributes) {
        SourceLocation loc = parser.location();
        parser.expect(KW_FN, "'fn'");
        String name = parser.expect(IDENTIFIER, "function name").getLexeme();
        return functionBinding(loc, name, attributes);
    }

    /**
     * name(params) = body
     */
    private Statement parseShortFunction(List<String> attributes) {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();
        return functionBinding(loc, name, attributes);
    }

    private Statement functionBinding(SourceLocation loc, String name, List<String> attributes) {
        SourceLocation lambdaLoc = parser.location();
        List<Parameter> params = parseParameters();
        TypeRef returnType = parser.match(ARROW) ? parser.parseType() : null;
        parser.expect(ASSIGN, "'='");
        parser.skipNewlines();
        Expression body = parser.parseExpression();
        LambdaExpr lambda = new LambdaExpr(lambdaLoc, params, returnType, body);
        return new LetStmt(loc, name, false, null, lambda, attributes);
    }

    /** IDENT '(' ... ')' ('=' | '->') 形式的函数定义 */
    private boolean isShortFunctionStart() {
        if (!parser.peek().is(LPAREN)) return false;
        int after = parser.offsetAfterMatching(1, LPAREN, RPAREN);
        if (after < 0) return false;
        return parser.peekAt(after).isOneOf(ASSIGN, ARROW);
    }

    /**
     * '(' [name [: Type] {, name [: Type]}] ')'
     */
    List<Parameter> parseParameters() {
        Token open = parser.expect(LPAREN, "'('");
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(RPAREN) && !parser.isAtEnd()) {
            SourceLocation loc = parser.location();
            String name = parser.expect(IDENTIFIER, "parameter name").getLexeme();
            TypeRef type = parser.match(COLON) ? parser.parseType() : null;
            params.add(new Parameter(loc, name, type));
            if (!parser.match(COMMA)) break;
        }
        parser.expectClosing(RPAREN, open, "parameter list");
        return params;
    }

    // ============ 声明 ============

    /**
     * struct Name { field: Type [= default], ... }
     */
    private Statement parseStruct() {
        SourceLocation loc = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "struct name").getLexeme();
        Token open = parser.expect(LBRACE, "'{'");
        List<StructField> fields = new ArrayList<StructField>();
        skipMemberSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldLoc = parser.location();
            String field = parser.expect(IDENTIFIER, "field name").getLexeme();
            parser.expect(COLON, "':'");
            TypeRef type = parser.parseType();
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.parseExpression();
            }
            fields.add(new StructField(fieldLoc, field, type, defaultValue));
            skipMemberSeparators();
        }
        parser.expectClosing(RBRACE, open, "struct declaration");
        return new StructDecl(loc, name, fields);
    }

    /**
     * typeclass Name<T> { method: Type ... }
     */
    private Statement parseTypeclass() {
        SourceLocation loc = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "typeclass name").getLexeme();
        Token lt = parser.expect(LT, "'<'");
        String typeParam = parser.expect(IDENTIFIER, "type parameter").getLexeme();
        parser.expectClosing(GT, lt, "type parameter list");
        Token open = parser.expect(LBRACE, "'{'");
        List<MethodSignature> methods = new ArrayList<MethodSignature>();
        skipMemberSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation methodLoc = parser.location();
            String method = parser.expect(IDENTIFIER, "method name").getLexeme();
            parser.expect(COLON, "':'");
            methods.add(new MethodSignature(methodLoc, method, parser.parseType()));
            skipMemberSeparators();
        }
        parser.expectClosing(RBRACE, open, "typeclass declaration");
        return new TypeclassDecl(loc, name, typeParam, methods);
    }

    /**
     * instance Name<Type> { method = expr | method(params) = expr ... }
     */
    private Statement parseInstance() {
        SourceLocation loc = parser.location();
        parser.advance();
        String typeclass = parser.expect(IDENTIFIER, "typeclass name").getLexeme();
        Token lt = parser.expect(LT, "'<'");
        TypeRef type = parser.parseType();
        parser.expectClosing(GT, lt, "instance type");
        Token open = parser.expect(LBRACE, "'{'");
        List<MethodImpl> methods = new ArrayList<MethodImpl>();
        skipMemberSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation methodLoc = parser.location();
            String method = parser.expect(IDENTIFIER, "method name").getLexeme();
            Expression value;
            if (parser.check(LPAREN)) {
                SourceLocation lambdaLoc = parser.location();
                List<Parameter> params = parseParameters();
                TypeRef returnType = parser.match(ARROW) ? parser.parseType() : null;
                parser.expect(ASSIGN, "'='");
                parser.skipNewlines();
                value = new LambdaExpr(lambdaLoc, params, returnType, parser.parseExpression());
            } else {
                parser.expect(ASSIGN, "'='");
                parser.skipNewlines();
                value = parser.parseExpression();
            }
            methods.add(new MethodImpl(methodLoc, method, value));
            skipMemberSeparators();
        }
        parser.expectClosing(RBRACE, open, "instance declaration");
        return new InstanceDecl(loc, typeclass, type, methods);
    }

    /**
     * module Name { statements }
     */
    private Statement parseModule() {
        SourceLocation loc = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "module name").getLexeme();
        Token open = parser.expect(LBRACE, "'{'");
        List<Statement> body = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            body.add(parseStatement());
            if (!parser.checkAny(RBRACE, NEWLINE, SEMICOLON, EOF)) {
                throw ParseException.unexpected("newline or ';'", parser.current);
            }
            parser.skipSeparators();
        }
        parser.expectClosing(RBRACE, open, "module");
        return new ModuleDecl(loc, name, body);
    }

    /**
     * import M | import M.member | import M.{a, b}
     */
    private Statement parseImport() {
        SourceLocation loc = parser.location();
        parser.advance();
        String module = parser.expect(IDENTIFIER, "module name").getLexeme();
        List<String> items = null;
        if (parser.match(DOT)) {
            items = new ArrayList<String>();
            if (parser.check(LBRACE)) {
                Token open = parser.advance();
                do {
                    parser.skipNewlines();
                    items.add(parser.expect(IDENTIFIER, "imported name").getLexeme());
                    parser.skipNewlines();
                } while (parser.match(COMMA));
                parser.expectClosing(RBRACE, open, "import list");
            } else {
                items.add(parser.expect(IDENTIFIER, "imported name").getLexeme());
            }
        }
        return new ImportDecl(loc, module, items);
    }

    private void skipMemberSeparators() {
        while (parser.matchAny(NEWLINE, SEMICOLON, COMMA)) {
            // 成员之间可用逗号、分号或换行分隔
        }
    }
}
