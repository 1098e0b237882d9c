package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Literal;
import com.matrixlang.compiler.ast.pattern.*;
import com.matrixlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.matrixlang.compiler.lexer.TokenType.*;

/**
 * match 模式解析
 */
class PatternParser {

    private final Parser parser;

    PatternParser(Parser parser) {
        this.parser = parser;
    }

    Pattern parsePattern() {
        SourceLocation loc = parser.location();

        if (parser.match(UNDERSCORE)) {
            return new WildcardPattern(loc);
        }

        if (parser.check(MINUS) && parser.peek().isOneOf(INT_LITERAL, FLOAT_LITERAL)) {
            parser.advance();
            Token number = parser.advance();
            if (number.is(INT_LITERAL)) {
                return new LiteralPattern(loc, new Literal(loc, Parser.negatedInt(number), Literal.LiteralKind.INT));
            }
            return new LiteralPattern(loc, new Literal(loc, -((Double) number.getLiteral()), Literal.LiteralKind.FLOAT));
        }

        if (parser.checkAny(INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE)) {
            return new LiteralPattern(loc, parseLiteral());
        }

        if (parser.check(LBRACKET)) {
            Token open = parser.advance();
            List<Pattern> elements = new ArrayList<Pattern>();
            if (!parser.check(RBRACKET)) {
                do {
                    if (parser.check(RBRACKET)) break;
                    elements.add(parsePattern());
                } while (parser.match(COMMA));
            }
            parser.expectClosing(RBRACKET, open, "array pattern");
            return new ArrayPattern(loc, elements);
        }

        if (parser.check(IDENTIFIER)) {
            Token name = parser.advance();
            if (parser.check(LBRACE)) {
                return parseStructPattern(loc, name.getLexeme());
            }
            return new BindingPattern(loc, name.getLexeme());
        }

        throw ParseException.unexpected("pattern", parser.current);
    }

    /** Name { field: pattern, shorthand } */
    private Pattern parseStructPattern(SourceLocation loc, String structName) {
        Token open = parser.advance();
        List<FieldPattern> fields = new ArrayList<FieldPattern>();
        parser.skipNewlines();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldLoc = parser.location();
            String field = parser.expect(IDENTIFIER, "field name").getLexeme();
            Pattern sub = parser.match(COLON)
                    ? parsePattern()
                    : new BindingPattern(fieldLoc, field);
            fields.add(new FieldPattern(fieldLoc, field, sub));
            parser.skipNewlines();
            if (!parser.match(COMMA)) break;
            parser.skipNewlines();
        }
        parser.expectClosing(RBRACE, open, "struct pattern");
        return new StructPattern(loc, structName, fields);
    }

    Literal parseLiteral() {
        Token token = parser.advance();
        SourceLocation loc = token.getLocation();
        switch (token.getType()) {
            case INT_LITERAL:
                if (!(token.getLiteral() instanceof Long)) {
                    throw Parser.intOutOfRange(token);
                }
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case FLOAT_LITERAL: return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT);
            case STRING_LITERAL: return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case KW_TRUE: return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOL);
            case KW_FALSE: return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOL);
            default: throw ParseException.unexpected("literal", token);
        }
    }
}
