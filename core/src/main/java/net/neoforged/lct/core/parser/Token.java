package net.neoforged.lct.core.parser;

/**
 * A span of the lexed input. {@code end} is exclusive.
 */
public record Token(TokenType type, int start, int end) {
    public Token {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid token span " + start + ".." + end);
        }
    }

    public String text(String input) {
        return input.substring(start, end);
    }

    public int length() {
        return end - start;
    }
}
