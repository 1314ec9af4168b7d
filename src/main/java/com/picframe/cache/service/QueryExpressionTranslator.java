package com.picframe.cache.service;

import com.picframe.cache.model.SqlCondition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Turns the caller's filter and sort expressions into SQL for the {@code all_data} view.
 * <p>
 * Only {@link QueryField} names and a fixed set of operators are accepted; every literal becomes a
 * bind parameter. Filter syntax, keywords case-insensitive:
 * <pre>
 *   captureTime &gt; 1600000000 AND (make LIKE '%canon%' OR NOT isPortrait)
 *   location IS NOT NULL AND rating IN (4, 5)
 *   width BETWEEN 1000 AND 4000
 * </pre>
 * Sort syntax: {@code field [ASC|DESC], ...}. A blank filter matches everything and a blank sort
 * means {@value #DEFAULT_SORT}.
 */
@Service
public class QueryExpressionTranslator {

    public static final String DEFAULT_SORT = "captureTime ASC";

    /**
     * Translates a filter expression into a WHERE condition with bound values.
     *
     * @throws InvalidQueryExpressionException if the text is not a valid filter
     */
    public SqlCondition translateFilter(String filter) {
        if (filter == null || filter.isBlank()) {
            return SqlCondition.ALWAYS;
        }
        FilterParser parser = new FilterParser(tokenize(filter));
        String sql = parser.expression();
        parser.expect(Kind.END, "end of filter");
        return new SqlCondition(sql, parser.parameters);
    }

    /**
     * Translates a sort expression into ORDER BY text. {@code file_id} is appended as the last key
     * unless already present, so equal sort values always come back in the same order.
     *
     * @throws InvalidQueryExpressionException if the text is not a valid sort
     */
    public String translateSort(String sort) {
        String text = (sort == null || sort.isBlank()) ? DEFAULT_SORT : sort;
        List<Token> tokens = tokenize(text);
        StringJoiner orderBy = new StringJoiner(", ");
        boolean hasFileId = false;
        int i = 0;
        while (true) {
            Token token = tokens.get(i++);
            if (token.kind != Kind.WORD) {
                throw invalid("Expected a field name", token);
            }
            QueryField field = QueryField.lookup(token.text)
                    .orElseThrow(() -> invalid("Unknown field '" + token.text + "'", token));
            hasFileId |= field == QueryField.FILE_ID;
            String direction = "ASC";
            Token next = tokens.get(i);
            if (next.isKeyword("ASC") || next.isKeyword("DESC")) {
                direction = next.text.toUpperCase(Locale.ROOT);
                next = tokens.get(++i);
            }
            orderBy.add(field.getColumn() + " " + direction);
            if (next.kind == Kind.END) {
                break;
            }
            if (next.kind != Kind.COMMA) {
                throw invalid("Expected ',' or end of sort", next);
            }
            i++;
        }
        if (!hasFileId) {
            orderBy.add(QueryField.FILE_ID.getColumn() + " ASC");
        }
        return orderBy.toString();
    }

    private static InvalidQueryExpressionException invalid(String message, Token at) {
        return new InvalidQueryExpressionException(message + " at position " + at.position);
    }

    // ---------------------------------------------------------------- tokens

    private enum Kind {
        WORD, NUMBER, STRING, OPERATOR, LPAREN, RPAREN, COMMA, END
    }

    private record Token(Kind kind, String text, int position) {
        boolean isKeyword(String keyword) {
            return kind == Kind.WORD && text.equalsIgnoreCase(keyword);
        }
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == ',') {
                tokens.add(new Token(Kind.COMMA, ",", i++));
            } else if (c == '\'' || c == '"') {
                i = readString(text, i, tokens);
            } else if (startsNumber(text, i)) {
                i = readNumber(text, i, tokens);
            } else if ("<>=!".indexOf(c) >= 0) {
                i = readOperator(text, i, tokens);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.WORD, text.substring(start, i), start));
            } else {
                throw new InvalidQueryExpressionException("Unexpected character '" + c + "' at position " + i);
            }
        }
        tokens.add(new Token(Kind.END, "", length));
        return tokens;
    }

    private static int readString(String text, int start, List<Token> tokens) {
        char quote = text.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == quote) {
                // a doubled quote stands for one quote character
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    value.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new Token(Kind.STRING, value.toString(), start));
                return i + 1;
            }
            value.append(c);
            i++;
        }
        throw new InvalidQueryExpressionException("Unterminated string starting at position " + start);
    }

    private static boolean startsNumber(String text, int i) {
        char c = text.charAt(i);
        if (Character.isDigit(c)) {
            return true;
        }
        boolean signOrPoint = c == '-' || c == '+' || c == '.';
        return signOrPoint && i + 1 < text.length()
                && (Character.isDigit(text.charAt(i + 1)) || (c != '.' && text.charAt(i + 1) == '.'));
    }

    private static int readNumber(String text, int start, List<Token> tokens) {
        int i = start;
        if (text.charAt(i) == '-' || text.charAt(i) == '+') {
            i++;
        }
        while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
            i++;
        }
        if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            i++;
            if (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
                i++;
            }
            while (i < text.length() && Character.isDigit(text.charAt(i))) {
                i++;
            }
        }
        tokens.add(new Token(Kind.NUMBER, text.substring(start, i), start));
        return i;
    }

    private static int readOperator(String text, int start, List<Token> tokens) {
        String two = start + 1 < text.length() ? text.substring(start, start + 2) : "";
        switch (two) {
            case "<=", ">=", "<>", "!=", "==" -> {
                tokens.add(new Token(Kind.OPERATOR, two, start));
                return start + 2;
            }
            default -> {
                char c = text.charAt(start);
                if (c == '!') {
                    throw new InvalidQueryExpressionException("Unexpected character '!' at position " + start);
                }
                tokens.add(new Token(Kind.OPERATOR, String.valueOf(c), start));
                return start + 1;
            }
        }
    }

    // ---------------------------------------------------------------- filter grammar

    private static final class FilterParser {

        private final List<Token> tokens;
        private final List<Object> parameters = new ArrayList<>();
        private int position;

        FilterParser(List<Token> tokens) {
            this.tokens = tokens;
        }

        String expression() {
            String left = conjunction();
            while (peek().isKeyword("OR")) {
                next();
                left = "(" + left + " OR " + conjunction() + ")";
            }
            return left;
        }

        private String conjunction() {
            String left = unary();
            while (peek().isKeyword("AND")) {
                next();
                left = "(" + left + " AND " + unary() + ")";
            }
            return left;
        }

        private String unary() {
            if (peek().isKeyword("NOT")) {
                next();
                return "NOT (" + unary() + ")";
            }
            return primary();
        }

        private String primary() {
            Token token = next();
            if (token.kind == Kind.LPAREN) {
                String inner = expression();
                expect(Kind.RPAREN, "')'");
                return "(" + inner + ")";
            }
            if (token.isKeyword("TRUE")) {
                return "TRUE";
            }
            if (token.isKeyword("FALSE")) {
                return "FALSE";
            }
            if (token.kind != Kind.WORD) {
                throw invalid("Expected a field name or '('", token);
            }
            QueryField field = QueryField.lookup(token.text)
                    .orElseThrow(() -> invalid("Unknown field '" + token.text + "'", token));
            return predicate(field);
        }

        private String predicate(QueryField field) {
            String column = field.getColumn();
            // a file without a meta row has no flags; it counts as false
            String value = field.getType() == QueryField.ValueType.BOOLEAN
                    ? "COALESCE(" + column + ", FALSE)"
                    : column;
            Token token = peek();

            if (token.kind == Kind.OPERATOR) {
                next();
                String operator = switch (token.text) {
                    case "==" -> "=";
                    case "!=" -> "<>";
                    default -> token.text;
                };
                return value + " " + operator + " " + literal(field);
            }
            if (token.isKeyword("IS")) {
                next();
                boolean negated = acceptKeyword("NOT");
                Token nullToken = next();
                if (!nullToken.isKeyword("NULL")) {
                    throw invalid("Expected NULL", nullToken);
                }
                return column + (negated ? " IS NOT NULL" : " IS NULL");
            }

            boolean negated = false;
            if (token.isKeyword("NOT")) {
                next();
                negated = true;
                token = peek();
            }
            String not = negated ? "NOT " : "";
            if (token.isKeyword("LIKE")) {
                next();
                if (field.getType() != QueryField.ValueType.TEXT) {
                    throw invalid("LIKE needs a text field, not '" + field.getName() + "'", token);
                }
                Token pattern = next();
                if (pattern.kind != Kind.STRING) {
                    throw invalid("LIKE needs a quoted pattern", pattern);
                }
                parameters.add(pattern.text);
                return column + " " + not + "LIKE ?";
            }
            if (token.isKeyword("IN")) {
                next();
                expect(Kind.LPAREN, "'('");
                StringJoiner values = new StringJoiner(", ", "(", ")");
                values.add(literal(field));
                while (peek().kind == Kind.COMMA) {
                    next();
                    values.add(literal(field));
                }
                expect(Kind.RPAREN, "')'");
                return value + " " + not + "IN " + values;
            }
            if (token.isKeyword("BETWEEN")) {
                next();
                String low = literal(field);
                Token and = next();
                if (!and.isKeyword("AND")) {
                    throw invalid("Expected AND in BETWEEN", and);
                }
                return value + " " + not + "BETWEEN " + low + " AND " + literal(field);
            }
            if (negated) {
                throw invalid("Expected LIKE, IN or BETWEEN after NOT", token);
            }
            if (field.getType() == QueryField.ValueType.BOOLEAN) {
                return value;
            }
            throw invalid("Expected an operator after '" + field.getName() + "'", token);
        }

        /**
         * Binds one literal, checked against the field's type, and returns its placeholder.
         */
        private String literal(QueryField field) {
            Token token = next();
            Object value;
            QueryField.ValueType type;
            if (token.kind == Kind.NUMBER) {
                value = parseNumber(token);
                type = QueryField.ValueType.NUMBER;
            } else if (token.kind == Kind.STRING) {
                value = token.text;
                type = QueryField.ValueType.TEXT;
            } else if (token.isKeyword("TRUE") || token.isKeyword("FALSE")) {
                value = Boolean.valueOf(token.text.toLowerCase(Locale.ROOT));
                type = QueryField.ValueType.BOOLEAN;
            } else {
                throw invalid("Expected a value", token);
            }
            if (type != field.getType()) {
                throw invalid("Field '" + field.getName() + "' takes a " + field.getType().name().toLowerCase(Locale.ROOT)
                        + " value", token);
            }
            parameters.add(value);
            return "?";
        }

        private Number parseNumber(Token token) {
            try {
                if (token.text.contains(".") || token.text.contains("e") || token.text.contains("E")) {
                    return Double.valueOf(token.text);
                }
                return Long.valueOf(token.text);
            } catch (NumberFormatException e) {
                throw invalid("Malformed number '" + token.text + "'", token);
            }
        }

        private boolean acceptKeyword(String keyword) {
            if (peek().isKeyword(keyword)) {
                next();
                return true;
            }
            return false;
        }

        void expect(Kind kind, String description) {
            Token token = next();
            if (token.kind != kind) {
                throw invalid("Expected " + description, token);
            }
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token next() {
            Token token = tokens.get(position);
            if (token.kind != Kind.END) {
                position++;
            }
            return token;
        }
    }
}
