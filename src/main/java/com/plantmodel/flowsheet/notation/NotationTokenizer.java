package com.plantmodel.flowsheet.notation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.notation.NotationToken.TokenType;

/**
 * Tokenizer shared by both notation grammars.
 *
 * Whitespace runs, semicolons and line breaks collapse into a single SEPARATOR token.
 * A hyphen is part of an identifier unless it starts an arrow.
 */
public class NotationTokenizer {
    private static final Logger log = LoggerFactory.getLogger(NotationTokenizer.class);

    private final String source;
    private int pos = 0;

    public NotationTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<NotationToken> tokenize() {
        List<NotationToken> tokens = new ArrayList<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == ';') {
                readSeparator(tokens);
            } else if (c == '#') {
                skipComment();
            } else if (c == '-' && peek(1) == '>') {
                tokens.add(new NotationToken(TokenType.ARROW, "->", pos));
                pos += 2;
            } else if (c == '\'' || c == '"') {
                tokens.add(readString(c));
            } else if (isIdentifierChar(c)) {
                tokens.add(readIdentifier());
            } else {
                tokens.add(new NotationToken(punctuation(c), String.valueOf(c), pos));
                pos++;
            }
        }
        tokens.add(new NotationToken(TokenType.EOF, "", pos));
        log.debug("Tokenized {} chars into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '+' || c == '*';
    }

    private void readSeparator(List<NotationToken> tokens) {
        int start = pos;
        while (pos < source.length() && (Character.isWhitespace(source.charAt(pos)) || source.charAt(pos) == ';')) {
            pos++;
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).is(TokenType.SEPARATOR)) {
            return;
        }
        tokens.add(new NotationToken(TokenType.SEPARATOR, " ", start));
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private NotationToken readString(char quote) {
        int start = pos;
        pos++;
        while (pos < source.length() && source.charAt(pos) != quote) {
            pos++;
        }
        // unterminated literals run to the end of input
        pos = Math.min(pos + 1, source.length());
        return new NotationToken(TokenType.STRING_LITERAL, source.substring(start, pos), start);
    }

    private NotationToken readIdentifier() {
        int start = pos;
        while (pos < source.length() && isIdentifierChar(source.charAt(pos))) {
            if (source.charAt(pos) == '-' && peek(1) == '>') {
                break;
            }
            pos++;
        }
        return new NotationToken(TokenType.IDENTIFIER, source.substring(start, pos), start);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '=' -> TokenType.EQUALS;
            case ',' -> TokenType.COMMA;
            case ':' -> TokenType.COLON;
            case '<' -> TokenType.LESS_THAN;
            case '|' -> TokenType.PIPE;
            case '&' -> TokenType.AMPERSAND;
            default -> TokenType.UNKNOWN;
        };
    }
}
