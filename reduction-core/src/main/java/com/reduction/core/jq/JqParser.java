package com.reduction.core.jq;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Recursive-descent parser; precedence from loosest: {@code |}, {@code ,}, {@code == !=}, postfix. */
final class JqParser {
    private enum TokenType {
        DOT, FIELD, IDENT, STRING, NUMBER,
        LBRACKET, RBRACKET, LPAREN, RPAREN,
        PIPE, COMMA, QUESTION, EQ, NEQ, EOF
    }

    private record Token(TokenType type, String text, int position) {}

    private final String expression;
    private final List<Token> tokens;
    private int cursor;

    JqParser(String expression) throws JqException {
        this.expression = expression;
        this.tokens = tokenize(expression);
    }

    JqExpr parse() throws JqException {
        if (peek().type() == TokenType.EOF) throw error("empty filter", peek());
        JqExpr expr = parsePipe();
        if (peek().type() != TokenType.EOF) throw error("unexpected '" + peek().text() + "'", peek());
        return expr;
    }

    private JqExpr parsePipe() throws JqException {
        JqExpr left = parseComma();
        while (accept(TokenType.PIPE)) {
            left = JqTerms.pipe(left, parseComma());
        }
        return left;
    }

    private JqExpr parseComma() throws JqException {
        JqExpr left = parseEquality();
        while (accept(TokenType.COMMA)) {
            left = JqTerms.comma(left, parseEquality());
        }
        return left;
    }

    private JqExpr parseEquality() throws JqException {
        JqExpr left = parsePostfix();
        if (accept(TokenType.EQ)) return JqTerms.equality(left, parsePostfix(), false);
        if (accept(TokenType.NEQ)) return JqTerms.equality(left, parsePostfix(), true);
        return left;
    }

    private JqExpr parsePostfix() throws JqException {
        JqExpr expr = parsePrimary();
        while (true) {
            Token next = peek();
            if (next.type() == TokenType.FIELD) {
                cursor++;
                expr = JqTerms.field(expr, next.text());
            } else if (next.type() == TokenType.DOT && peekAhead(1) == TokenType.STRING) {
                cursor++;
                expr = JqTerms.field(expr, next().text());
            } else if (next.type() == TokenType.DOT && peekAhead(1) == TokenType.LBRACKET) {
                cursor += 2;
                expr = parseBracket(expr);
            } else if (next.type() == TokenType.LBRACKET) {
                cursor++;
                expr = parseBracket(expr);
            } else if (next.type() == TokenType.QUESTION) {
                cursor++;
                expr = JqTerms.optional(expr);
            } else {
                return expr;
            }
        }
    }

    private JqExpr parsePrimary() throws JqException {
        Token token = next();
        switch (token.type()) {
            case FIELD -> {
                return JqTerms.field(JqTerms.identity(), token.text());
            }
            case DOT -> {
                if (peek().type() == TokenType.STRING) return JqTerms.field(JqTerms.identity(), next().text());
                if (accept(TokenType.LBRACKET)) return parseBracket(JqTerms.identity());
                return JqTerms.identity();
            }
            case LBRACKET -> {
                if (accept(TokenType.RBRACKET)) return JqTerms.emptyArray();
                JqExpr body = parsePipe();
                expect(TokenType.RBRACKET);
                return JqTerms.collect(body);
            }
            case LPAREN -> {
                JqExpr inner = parsePipe();
                expect(TokenType.RPAREN);
                return inner;
            }
            case STRING -> {
                return JqTerms.literal(JsonNodeFactory.instance.textNode(token.text()));
            }
            case NUMBER -> {
                try {
                    return JqTerms.literal(JsonNodeFactory.instance.numberNode(new BigDecimal(token.text())));
                } catch (NumberFormatException badNumber) {
                    throw error("invalid number '" + token.text() + "'", token);
                }
            }
            case IDENT -> {
                return parseIdentifier(token);
            }
            default -> throw error("unexpected '" + token.text() + "'", token);
        }
    }

    private JqExpr parseIdentifier(Token token) throws JqException {
        return switch (token.text()) {
            case "true" -> JqTerms.literal(BooleanNode.TRUE);
            case "false" -> JqTerms.literal(BooleanNode.FALSE);
            case "null" -> JqTerms.literal(NullNode.getInstance());
            case "select" -> JqTerms.select(parseArgument(token));
            case "map" -> JqTerms.map(parseArgument(token));
            case "flatten" -> JqTerms.flatten();
            case "length" -> JqTerms.length();
            case "keys" -> JqTerms.keys();
            case "not" -> JqTerms.not();
            case "empty" -> JqTerms.empty();
            default -> {
                int arity = peek().type() == TokenType.LPAREN ? 1 : 0;
                throw error(token.text() + "/" + arity + " is not defined", token);
            }
        };
    }

    private JqExpr parseArgument(Token function) throws JqException {
        if (!accept(TokenType.LPAREN)) throw error(function.text() + "/0 is not defined", function);
        JqExpr argument = parsePipe();
        expect(TokenType.RPAREN);
        return argument;
    }

    // Called with the opening '[' already consumed.
    private JqExpr parseBracket(JqExpr target) throws JqException {
        if (accept(TokenType.RBRACKET)) return JqTerms.iterate(target);
        Token key = next();
        JqExpr expr;
        if (key.type() == TokenType.NUMBER) {
            try {
                expr = JqTerms.index(target, new BigDecimal(key.text()).intValueExact());
            } catch (ArithmeticException | NumberFormatException notAnIndex) {
                throw error("invalid array index '" + key.text() + "'", key);
            }
        } else if (key.type() == TokenType.STRING) {
            expr = JqTerms.field(target, key.text());
        } else {
            throw error("unsupported index '" + key.text() + "'", key);
        }
        expect(TokenType.RBRACKET);
        return expr;
    }

    private Token peek() {
        return tokens.get(cursor);
    }

    private TokenType peekAhead(int offset) {
        int index = Math.min(cursor + offset, tokens.size() - 1);
        return tokens.get(index).type();
    }

    private Token next() {
        Token token = tokens.get(cursor);
        if (token.type() != TokenType.EOF) cursor++;
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().type() != type) return false;
        cursor++;
        return true;
    }

    private void expect(TokenType type) throws JqException {
        Token token = peek();
        if (token.type() != type) throw error("expected " + type.name().toLowerCase() + " but found '" + token.text() + "'", token);
        cursor++;
    }

    private JqException error(String message, Token at) {
        return new JqException("jq: error: " + message + " at position " + at.position() + " in '" + expression + "'");
    }

    private static List<Token> tokenize(String expression) throws JqException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
                case '.' -> {
                    if (i + 1 < n && isIdentStart(expression.charAt(i + 1))) {
                        i = scanIdentifier(expression, i + 1);
                        tokens.add(new Token(TokenType.FIELD, expression.substring(start + 1, i), start));
                    } else if (i + 1 < n && expression.charAt(i + 1) == '.') {
                        throw new JqException("jq: error: recursive descent '..' is not supported in '" + expression + "'");
                    } else {
                        tokens.add(new Token(TokenType.DOT, ".", start));
                        i++;
                    }
                    continue;
                }
                case '"' -> {
                    StringBuilder text = new StringBuilder();
                    i = scanString(expression, i + 1, text);
                    tokens.add(new Token(TokenType.STRING, text.toString(), start));
                    continue;
                }
                case '[' -> tokens.add(new Token(TokenType.LBRACKET, "[", start));
                case ']' -> tokens.add(new Token(TokenType.RBRACKET, "]", start));
                case '(' -> tokens.add(new Token(TokenType.LPAREN, "(", start));
                case ')' -> tokens.add(new Token(TokenType.RPAREN, ")", start));
                case '|' -> tokens.add(new Token(TokenType.PIPE, "|", start));
                case ',' -> tokens.add(new Token(TokenType.COMMA, ",", start));
                case '?' -> tokens.add(new Token(TokenType.QUESTION, "?", start));
                case '=', '!' -> {
                    if (i + 1 >= n || expression.charAt(i + 1) != '=') {
                        throw new JqException("jq: error: unexpected '" + c + "' at position " + start + " in '" + expression + "'");
                    }
                    tokens.add(new Token(c == '=' ? TokenType.EQ : TokenType.NEQ, c + "=", start));
                    i += 2;
                    continue;
                }
                default -> {
                    if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(expression.charAt(i + 1)))) {
                        i = scanNumber(expression, i + 1);
                        tokens.add(new Token(TokenType.NUMBER, expression.substring(start, i), start));
                        continue;
                    }
                    if (isIdentStart(c)) {
                        i = scanIdentifier(expression, i);
                        tokens.add(new Token(TokenType.IDENT, expression.substring(start, i), start));
                        continue;
                    }
                    throw new JqException("jq: error: unexpected '" + c + "' at position " + start + " in '" + expression + "'");
                }
            }
            i++;
        }
        tokens.add(new Token(TokenType.EOF, "<end>", n));
        return tokens;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static int scanIdentifier(String s, int i) {
        while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
        return i;
    }

    private static int scanNumber(String s, int i) {
        while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) i++;
        return i;
    }

    private static int scanString(String s, int i, StringBuilder out) throws JqException {
        while (i < s.length()) {
            char c = s.charAt(i++);
            if (c == '"') return i;
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i >= s.length()) break;
            char escaped = s.charAt(i++);
            switch (escaped) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case '"', '\\', '/' -> out.append(escaped);
                case 'u' -> {
                    if (i + 4 > s.length()) throw new JqException("jq: error: truncated \\u escape in '" + s + "'");
                    try {
                        out.append((char) Integer.parseInt(s.substring(i, i + 4), 16));
                    } catch (NumberFormatException badEscape) {
                        throw new JqException("jq: error: invalid \\u escape in '" + s + "'");
                    }
                    i += 4;
                }
                default -> throw new JqException("jq: error: invalid escape '\\" + escaped + "' in '" + s + "'");
            }
        }
        throw new JqException("jq: error: unterminated string in '" + s + "'");
    }
}
