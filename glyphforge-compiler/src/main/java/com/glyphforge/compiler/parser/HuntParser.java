/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.parser;

import com.glyphforge.api.exceptions.ParseException;
import com.glyphforge.compiler.ast.AlphaBracket;
import com.glyphforge.compiler.ast.BetaBracket;
import com.glyphforge.compiler.ast.DeltaBracket;
import com.glyphforge.compiler.ast.ExecClause;
import com.glyphforge.compiler.ast.ExecParam;
import com.glyphforge.compiler.ast.GammaBracket;
import com.glyphforge.compiler.ast.Literal;
import com.glyphforge.compiler.ast.Program;
import com.glyphforge.compiler.lexer.Token;
import com.glyphforge.compiler.lexer.TokenKind;
import com.glyphforge.compiler.lexer.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the bracket DSL.
 *
 * <pre>
 * program := alpha+ EOF
 * alpha   := '&lt;' NAME NAME* [':' [NAME]] beta* '&gt;' [exec]
 * beta    := '[' NAME NAME* ['=' [VALUE]] gamma* ']'
 * gamma   := '{' NAME NAME* [':' [NAME]] ['=' [VALUE]] delta* '}'
 * delta   := '(' NAME [','] [VALUE (',' VALUE)* [',']] ')'
 * exec    := ['&lt;'] 'EXEC' [(':' | '@@') param ('@@' param)*] ['&gt;' if opened with '&lt;']
 * param   := NAME ['=' [VALUE]] [gamma] | gamma
 * </pre>
 *
 * NAME is an identifier or keyword, VALUE additionally a quoted string. Names following
 * the command are modifiers. A value or target after {@code =} or {@code :} may be left
 * out only when a bracket follows. Indentation tokens carry no meaning here and are
 * skipped.
 *
 * <p>Parsing is strict: every error raises a {@link ParseException} naming the expected
 * and actual token kinds and the line.
 */
public final class HuntParser {

    private List<Token> tokens;
    private int pos;

    public Program parse(String source) {
        return parse(new Tokenizer().tokenize(source));
    }

    public Program parse(List<Token> input) {
        this.tokens = new ArrayList<>(input.size());
        for (Token token : input) {
            if (!token.kind().isLayout()) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
            int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
            tokens.add(new Token(TokenKind.EOF, "", line));
        }
        this.pos = 0;

        List<AlphaBracket> statements = new ArrayList<>();
        do {
            statements.add(parseAlpha());
        } while (peek().kind() != TokenKind.EOF);
        return new Program(statements);
    }

    private AlphaBracket parseAlpha() {
        int line = expect(TokenKind.ALPHA_OPEN).line();
        String command = expectName();
        List<String> modifiers = parseModifiers();

        boolean bridged = false;
        String target = null;
        if (peek().kind() == TokenKind.BRIDGE) {
            advance();
            bridged = true;
            target = optionalName(TokenKind.ALPHA_CLOSE);
        }

        List<BetaBracket> betas = new ArrayList<>();
        while (peek().kind() == TokenKind.BETA_OPEN) {
            betas.add(parseBeta());
        }
        expect(TokenKind.ALPHA_CLOSE);

        return new AlphaBracket(command, modifiers, bridged, target, betas, parseExec(), line);
    }

    private ExecClause parseExec() {
        boolean opened;
        if (peek().kind() == TokenKind.ALPHA_OPEN && isExecKeyword(peek(1))) {
            advance();
            opened = true;
        } else if (isExecKeyword(peek())) {
            opened = false;
        } else {
            return null;
        }
        int line = advance().line();

        List<ExecParam> params = new ArrayList<>();
        if (peek().kind() == TokenKind.BRIDGE || peek().kind() == TokenKind.CHAIN) {
            advance();
            params.add(parseExecParam());
            while (peek().kind() == TokenKind.CHAIN) {
                advance();
                params.add(parseExecParam());
            }
        }
        if (opened) {
            expect(TokenKind.ALPHA_CLOSE);
        }
        return new ExecClause(params, line);
    }

    private ExecParam parseExecParam() {
        Token start = peek();
        if (start.kind() == TokenKind.GAMMA_OPEN) {
            GammaBracket gamma = parseGamma();
            return new ExecParam(gamma.command(), null, gamma, start.line());
        }
        String name = expectName();
        Literal value = null;
        if (peek().kind() == TokenKind.ASSIGN) {
            advance();
            value = optionalValue(TokenKind.ALPHA_CLOSE);
        }
        GammaBracket nested = peek().kind() == TokenKind.GAMMA_OPEN ? parseGamma() : null;
        return new ExecParam(name, value, nested, start.line());
    }

    private BetaBracket parseBeta() {
        int line = expect(TokenKind.BETA_OPEN).line();
        String command = expectName();
        List<String> modifiers = parseModifiers();

        boolean assigned = false;
        Literal value = null;
        if (peek().kind() == TokenKind.ASSIGN) {
            advance();
            assigned = true;
            value = optionalValue(TokenKind.BETA_CLOSE);
        }

        List<GammaBracket> gammas = new ArrayList<>();
        while (peek().kind() == TokenKind.GAMMA_OPEN) {
            gammas.add(parseGamma());
        }
        expect(TokenKind.BETA_CLOSE);
        return new BetaBracket(command, modifiers, assigned, value, gammas, line);
    }

    private GammaBracket parseGamma() {
        int line = expect(TokenKind.GAMMA_OPEN).line();
        String command = expectName();
        List<String> modifiers = parseModifiers();

        boolean bridged = false;
        String target = null;
        if (peek().kind() == TokenKind.BRIDGE) {
            advance();
            bridged = true;
            target = optionalName(TokenKind.GAMMA_CLOSE);
        }

        boolean assigned = false;
        Literal value = null;
        if (peek().kind() == TokenKind.ASSIGN) {
            advance();
            assigned = true;
            value = optionalValue(TokenKind.GAMMA_CLOSE);
        }

        List<DeltaBracket> deltas = new ArrayList<>();
        while (peek().kind() == TokenKind.DELTA_OPEN) {
            deltas.add(parseDelta());
        }
        expect(TokenKind.GAMMA_CLOSE);
        return new GammaBracket(command, modifiers, bridged, target, assigned, value, deltas, line);
    }

    private DeltaBracket parseDelta() {
        int line = expect(TokenKind.DELTA_OPEN).line();
        String command = expectName();
        if (peek().kind() == TokenKind.COMMA) {
            advance();
        }

        List<Literal> values = new ArrayList<>();
        if (peek().kind() != TokenKind.DELTA_CLOSE) {
            values.add(expectValue());
            while (peek().kind() == TokenKind.COMMA) {
                advance();
                if (peek().kind() == TokenKind.DELTA_CLOSE) {
                    break;
                }
                values.add(expectValue());
            }
        }
        expect(TokenKind.DELTA_CLOSE);
        return new DeltaBracket(command, values, line);
    }

    private List<String> parseModifiers() {
        List<String> modifiers = new ArrayList<>();
        while (peek().kind().isName()) {
            modifiers.add(advance().text());
        }
        return modifiers;
    }

    /**
     * Target after ':'; may be omitted before an opening bracket or the enclosing close.
     */
    private String optionalName(TokenKind closing) {
        Token next = peek();
        if (next.kind().isValue()) {
            return advance().text();
        }
        if (next.kind().isOpeningBracket() || next.kind() == closing) {
            return null;
        }
        throw new ParseException("NAME", next.kind().name(), next.line());
    }

    /**
     * Value after '='; may be omitted before an opening bracket or the enclosing close.
     */
    private Literal optionalValue(TokenKind closing) {
        Token next = peek();
        if (next.kind().isValue()) {
            return expectValue();
        }
        if (next.kind().isOpeningBracket() || next.kind() == closing) {
            return null;
        }
        throw new ParseException("VALUE", next.kind().name(), next.line());
    }

    private Literal expectValue() {
        Token token = peek();
        Literal.Kind kind = switch (token.kind()) {
            case STRING -> Literal.Kind.STRING;
            case IDENTIFIER -> Literal.Kind.IDENTIFIER;
            case KEYWORD -> Literal.Kind.KEYWORD;
            default -> throw new ParseException("VALUE", token.kind().name(), token.line());
        };
        advance();
        return new Literal(token.text(), kind);
    }

    private String expectName() {
        Token token = peek();
        if (!token.kind().isName()) {
            throw new ParseException("NAME", token.kind().name(), token.line());
        }
        return advance().text();
    }

    private Token expect(TokenKind kind) {
        Token token = peek();
        if (token.kind() != kind) {
            throw new ParseException(kind.name(), token.kind().name(), token.line());
        }
        return advance();
    }

    private static boolean isExecKeyword(Token token) {
        return token.kind() == TokenKind.KEYWORD && token.text().equals("EXEC");
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = peek();
        if (token.kind() != TokenKind.EOF) {
            pos++;
        }
        return token;
    }
}
