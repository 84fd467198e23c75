package com.expertagent.authz.condition;

/**
 * A lexical token of the condition language.
 *
 * @param position zero-based offset of the token's first character
 */
record Token(Type type, String text, int position) {

    enum Type {
        IDENTIFIER,
        STRING,
        NUMBER,
        OPERATOR,
        AND,
        OR,
        NOT,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        DOT,
        COMMA,
        END
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equals(keyword);
    }
}
