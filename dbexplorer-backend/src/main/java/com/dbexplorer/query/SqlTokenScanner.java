package com.dbexplorer.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lexical scanner used to vet SQL text without parsing it.
 *
 * <p>It knows just enough SQL to keep string literals and quoted identifiers out of keyword and
 * separator checks: single-quoted literals ({@code ''} escapes), {@code E'...'} literals (backslash
 * escapes as well), dollar-quoted literals, double-quoted identifiers, words, numbers, parentheses
 * and the statement separator. Literal boundaries follow PostgreSQL with
 * {@code standard_conforming_strings} on. Comment openers are recorded but their content
 * is still scanned as code, and an unterminated quote is scanned as code too, so anything that could
 * hide a keyword from the scanner ends up visible to it.
 */
public final class SqlTokenScanner {

    /**
     * Statements that change data, schema, privileges or server state.
     */
    public static final Set<String> BLOCKED_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "TRUNCATE", "GRANT",
            "REVOKE", "CREATE", "CALL", "COPY", "EXECUTE", "MERGE"
    );

    public enum TokenType {
        WORD, NUMBER, LITERAL, QUOTED_IDENTIFIER, SEPARATOR, SYMBOL
    }

    @Value
    public static class Token {
        TokenType type;
        String text;
        int depth;

        public boolean isWord(String upperCaseWord) {
            return type == TokenType.WORD && text.equalsIgnoreCase(upperCaseWord);
        }
    }

    private SqlTokenScanner() {
    }

    public static Scan scan(String sql) {
        List<Token> tokens = new ArrayList<>();
        boolean comment = false;
        int separators = 0;
        int depth = 0;
        int i = 0;
        int n = sql.length();

        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                int end = findClosingQuote(sql, i, c);
                if (end < 0) {
                    tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), depth));
                    i++;
                } else {
                    TokenType type = c == '\'' ? TokenType.LITERAL : TokenType.QUOTED_IDENTIFIER;
                    tokens.add(new Token(type, sql.substring(i, end + 1), depth));
                    i = end + 1;
                }
            } else if ((c == '-' && next == '-') || (c == '/' && next == '*')) {
                comment = true;
                i += 2;
            } else if (c == ';') {
                separators++;
                tokens.add(new Token(TokenType.SEPARATOR, ";", depth));
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_' || sql.charAt(i) == '$')) {
                    i++;
                }
                String word = sql.substring(start, i);
                if (word.equalsIgnoreCase("E") && i < n && sql.charAt(i) == '\'') {
                    int end = findClosingEscapeQuote(sql, i);
                    if (end < 0) {
                        tokens.add(new Token(TokenType.WORD, word, depth));
                        tokens.add(new Token(TokenType.SYMBOL, "'", depth));
                        i++;
                    } else {
                        tokens.add(new Token(TokenType.LITERAL, sql.substring(start, end + 1), depth));
                        i = end + 1;
                    }
                } else {
                    tokens.add(new Token(TokenType.WORD, word, depth));
                }
            } else if (c == '$' && dollarTagEnd(sql, i) > 0) {
                int tagEnd = dollarTagEnd(sql, i);
                String tag = sql.substring(i, tagEnd + 1);
                int close = sql.indexOf(tag, tagEnd + 1);
                if (close < 0) {
                    tokens.add(new Token(TokenType.SYMBOL, "$", depth));
                    i++;
                } else {
                    tokens.add(new Token(TokenType.LITERAL, sql.substring(i, close + tag.length()), depth));
                    i = close + tag.length();
                }
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, sql.substring(start, i), depth));
            } else if (c == '(') {
                tokens.add(new Token(TokenType.SYMBOL, "(", depth));
                depth++;
                i++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                tokens.add(new Token(TokenType.SYMBOL, ")", depth));
                i++;
            } else {
                tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), depth));
                i++;
            }
        }
        return new Scan(Collections.unmodifiableList(tokens), separators, comment);
    }

    private static int findClosingQuote(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static int findClosingEscapeQuote(String sql, int open) {
        int i = open + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Index of the {@code $} closing a dollar-quote opener such as {@code $$} or {@code $tag$}.
     *
     * @return -1 when the text at {@code open} is not an opener ({@code $1} is a parameter)
     */
    private static int dollarTagEnd(String sql, int open) {
        int i = open + 1;
        if (i < sql.length() && Character.isDigit(sql.charAt(i))) {
            return -1;
        }
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '$') {
                return i;
            }
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return -1;
            }
            i++;
        }
        return -1;
    }

    /**
     * Result of scanning one piece of SQL text.
     */
    public static final class Scan {
        private final List<Token> tokens;
        private final int separatorCount;
        private final boolean comment;

        private Scan(List<Token> tokens, int separatorCount, boolean comment) {
            this.tokens = tokens;
            this.separatorCount = separatorCount;
            this.comment = comment;
        }

        public List<Token> getTokens() {
            return tokens;
        }

        public int getSeparatorCount() {
            return separatorCount;
        }

        public boolean hasComment() {
            return comment;
        }

        public Optional<Token> firstToken() {
            return tokens.isEmpty() ? Optional.empty() : Optional.of(tokens.get(0));
        }

        /**
         * First word that is a blocked keyword, matched as a whole token in any letter case.
         *
         * @return the keyword in upper case
         */
        public Optional<String> firstBlockedKeyword() {
            for (Token t : tokens) {
                if (t.getType() == TokenType.WORD) {
                    String upper = t.getText().toUpperCase(Locale.ROOT);
                    if (BLOCKED_KEYWORDS.contains(upper)) {
                        return Optional.of(upper);
                    }
                }
            }
            return Optional.empty();
        }

        /**
         * Row limit of the outermost query: {@code LIMIT n} or {@code FETCH FIRST|NEXT [n] ROW|ROWS}.
         *
         * @return the limit clause found at parenthesis depth zero, the last one if several
         */
        public RowLimit topLevelRowLimit() {
            RowLimit found = RowLimit.NONE;
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.getDepth() != 0 || t.getType() != TokenType.WORD) {
                    continue;
                }
                if (t.isWord("LIMIT")) {
                    found = RowLimit.of(literalAt(i + 1));
                } else if (t.isWord("FETCH") && i + 1 < tokens.size()
                        && (tokens.get(i + 1).isWord("FIRST") || tokens.get(i + 1).isWord("NEXT"))) {
                    Token count = i + 2 < tokens.size() ? tokens.get(i + 2) : null;
                    if (count != null && (count.isWord("ROW") || count.isWord("ROWS"))) {
                        found = RowLimit.of(1L);
                    } else {
                        found = RowLimit.of(literalAt(i + 2));
                    }
                }
            }
            return found;
        }

        private Long literalAt(int index) {
            if (index >= tokens.size()) {
                return null;
            }
            Token t = tokens.get(index);
            if (t.getType() != TokenType.NUMBER) {
                return null;
            }
            try {
                return Long.parseLong(t.getText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    /**
     * A row limit clause. {@code value} is null when the clause is present but not a plain integer
     * ({@code LIMIT ALL}, a parameter, an expression), which means it cannot be checked.
     */
    @Value
    public static class RowLimit {
        static final RowLimit NONE = new RowLimit(false, null);

        boolean present;
        Long value;

        static RowLimit of(Long value) {
            return new RowLimit(true, value);
        }
    }
}
