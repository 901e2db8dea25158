package com.fedquery.query;

import java.util.Locale;

/**
 * 词法单元
 */
final class Token {

    enum Type {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        PARAMETER,
        STAR,
        COMMA,
        DOT,
        LPAREN,
        RPAREN,
        SEMICOLON,
        OPERATOR,
        EOF
    }

    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    int getPosition() {
        return position;
    }

    /**
     * 未加引号的单词是否为给定关键字（大小写不敏感）
     */
    boolean isKeyword(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    String upperText() {
        return text.toUpperCase(Locale.ROOT);
    }

    String describe() {
        switch (type) {
            case EOF:
                return "end of query";
            case STRING:
                return "string '" + text + "'";
            case PARAMETER:
                return "parameter :" + text;
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
