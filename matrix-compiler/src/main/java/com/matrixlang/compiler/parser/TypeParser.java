package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.type.ArrayTypeRef;
import com.matrixlang.compiler.ast.type.FunctionTypeRef;
import com.matrixlang.compiler.ast.type.SimpleType;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.matrixlang.compiler.lexer.TokenType.*;

/**
 * 类型注解解析
 */
class TypeParser {

    private final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * type := '[' type ']' | '(' types ')' '->' type | IDENT ['<' types '>']
     */
    TypeRef parseType() {
        SourceLocation loc = parser.location();

        if (parser.check(LBRACKET)) {
            Token open = parser.advance();
            TypeRef element = parseType();
            parser.expectClosing(RBRACKET, open, "array type");
            return new ArrayTypeRef(loc, element);
        }

        if (parser.check(LPAREN)) {
            Token open = parser.advance();
            List<TypeRef> params = new ArrayList<TypeRef>();
            if (!parser.check(RPAREN)) {
                do {
                    params.add(parseType());
                } while (parser.match(COMMA));
            }
            parser.expectClosing(RPAREN, open, "parameter type list");
            if (parser.match(ARROW)) {
                return new FunctionTypeRef(loc, params, parseType());
            }
            if (params.size() == 1) {
                return params.get(0);
            }
            throw ParseException.unexpected("'->'", parser.current);
        }

        Token name = parser.expect(IDENTIFIER, "type");
        List<TypeRef> args = null;
        if (parser.check(LT)) {
            Token open = parser.advance();
            args = parseTypeArgs(open);
        }
        return new SimpleType(loc, name.getLexeme(), args);
    }

    /** 解析 '<' 之后的类型实参列表（含闭合 '>'） */
    List<TypeRef> parseTypeArgs(Token open) {
        List<TypeRef> args = new ArrayList<TypeRef>();
        do {
            args.add(parseType());
        } while (parser.match(COMMA));
        parser.expectClosing(GT, open, "type argument list");
        return args;
    }
}
