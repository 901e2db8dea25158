package com.fedquery.query;

import com.fedquery.exception.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * 查询文本词法分析
 */
final class QueryLexer {
    private final String text;
    private int pos;

    QueryLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() throws QuerySyntaxException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && pos + 1 < text.length() && text.charAt(pos + 1) == '-') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token next() throws QuerySyntaxException {
        int start = pos;
        char c = text.charAt(pos);

        if (isIdentifierStart(c)) {
            return new Token(Token.Type.WORD, readIdentifierChars(), start);
        }
        if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return readNumber(start);
        }
        switch (c) {
            case '\'':
            case '"':
                return new Token(Token.Type.STRING, readQuoted(c), start);
            case '`':
                return new Token(Token.Type.QUOTED_IDENTIFIER, readQuoted('`'), start);
            case ':':
                pos++;
                if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
                    throw new QuerySyntaxException("Parameter name expected after ':'", start);
                }
                return new Token(Token.Type.PARAMETER, readIdentifierChars(), start);
            case '*':
                pos++;
                return new Token(Token.Type.STAR, "*", start);
            case ',':
                pos++;
                return new Token(Token.Type.COMMA, ",", start);
            case '.':
                pos++;
                return new Token(Token.Type.DOT, ".", start);
            case '(':
                pos++;
                return new Token(Token.Type.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(Token.Type.RPAREN, ")", start);
            case ';':
                pos++;
                return new Token(Token.Type.SEMICOLON, ";", start);
            case '=':
                pos++;
                if (peekChar('=')) {
                    pos++;
                }
                return new Token(Token.Type.OPERATOR, "=", start);
            case '!':
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '=') {
                    pos += 2;
                    return new Token(Token.Type.OPERATOR, "!=", start);
                }
                break;
            case '<':
                pos++;
                if (peekChar('=')) {
                    pos++;
                    return new Token(Token.Type.OPERATOR, "<=", start);
                }
                if (peekChar('>')) {
                    pos++;
                    return new Token(Token.Type.OPERATOR, "<>", start);
                }
                return new Token(Token.Type.OPERATOR, "<", start);
            case '>':
                pos++;
                if (peekChar('=')) {
                    pos++;
                    return new Token(Token.Type.OPERATOR, ">=", start);
                }
                return new Token(Token.Type.OPERATOR, ">", start);
            default:
                break;
        }
        throw new QuerySyntaxException("Unexpected character '" + c + "'", start);
    }

    private boolean peekChar(char expected) {
        return pos < text.length() && text.charAt(pos) == expected;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private String readIdentifierChars() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private Token readNumber(int start) throws QuerySyntaxException {
        if (text.charAt(pos) == '-') {
            pos++;
        }
        readDigits();
        if (peekChar('.') && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))) {
            pos++;
            readDigits();
        }
        if (peekChar('e') || peekChar('E')) {
            int mark = pos;
            pos++;
            if (peekChar('+') || peekChar('-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                readDigits();
            } else {
                pos = mark;
            }
        }
        if (pos < text.length() && isIdentifierStart(text.charAt(pos))) {
            throw new QuerySyntaxException("Malformed number '" + text.substring(start, pos + 1) + "'", start);
        }
        return new Token(Token.Type.NUMBER, text.substring(start, pos), start);
    }

    private void readDigits() {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    /**
     * 读取引号内容，引号字符连写两次表示转义
     */
    private String readQuoted(char quote) throws QuerySyntaxException {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == quote) {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == quote) {
                    sb.append(quote);
                    pos += 2;
                    continue;
                }
                pos++;
                return sb.toString();
            }
            sb.append(c);
            pos++;
        }
        throw new QuerySyntaxException("Unterminated " + (quote == '`' ? "identifier" : "string literal"), start);
    }
}
