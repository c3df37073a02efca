package com.deckscript.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for the arithmetic form of the expression evaluator.
 *
 * Identifier paths (a.b[0]) become single IDENTIFIER tokens and a path followed by an argument
 * list becomes a single CALL token; both are resolved later by the parser through the evaluator.
 */
public class ExpressionLexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("null", TokenType.NULL);
        map.put("undefined", TokenType.UNDEFINED);
        keywords = Collections.unmodifiableMap(map);
    }

    public ExpressionLexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '!':
                if (match('=')) {
                    match('=');
                    addToken(TokenType.BANG_EQUAL);
                } else {
                    addToken(TokenType.BANG);
                }
                break;
            case '=':
                if (!match('=')) throw error("assignment is not an expression");
                match('=');
                addToken(TokenType.EQUAL_EQUAL);
                break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("unexpected '&'");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("unexpected '|'");
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"': case '\'':
                string();
                break;
            case '`':
                current = DelimiterScanner.skipString(source, start) + 1;
                addToken(TokenType.TEMPLATE);
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) number();
                else if (isAlpha(c)) path();
                else throw error("unexpected character '" + c + "'");
        }
    }

    private void path() {
        while (isAlphaNumeric(peek())) advance();
        String head = source.substring(start, current);
        TokenType keyword = keywords.get(head);
        if (keyword != null) {
            addToken(keyword);
            return;
        }

        while (!isAtEnd()) {
            if (peek() == '.' && isAlpha(peekNext())) {
                advance();
                while (isAlphaNumeric(peek())) advance();
            } else if (peek() == '[') {
                current = DelimiterScanner.readEnclosed(source, current).close + 1;
            } else {
                break;
            }
        }

        int afterPath = current;
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
        if (peek() == '(') {
            current = DelimiterScanner.readEnclosed(source, current).close + 1;
            addToken(TokenType.CALL);
        } else {
            current = afterPath;
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                while (isDigit(peek())) advance();
            } else {
                current = mark;
            }
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        int close = DelimiterScanner.skipString(source, start);
        current = close + 1;
        addToken(TokenType.STRING, decodeString(source.substring(start, current)));
    }

    /** Decodes a quoted literal (including its quotes) into its string value. */
    public static String decodeString(String quoted) {
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 1; i < quoted.length() - 1; i++) {
            char ch = quoted.charAt(i);
            if (ch != '\\' || i + 1 >= quoted.length() - 1) {
                sb.append(ch);
                continue;
            }
            char esc = quoted.charAt(++i);
            switch (esc) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case '0': sb.append('\0'); break;
                case 'u':
                    if (isHex(quoted, i + 1, 4)) {
                        sb.append((char) Integer.parseInt(quoted.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        sb.append('u');
                    }
                    break;
                case '\n':
                    break;
                default:
                    sb.append(esc);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int from, int count) {
        // the closing quote is never part of an escape
        if (from + count > s.length() - 1) return false;
        for (int i = from; i < from + count; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }
    static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || (c >= '0' && c <= '9');
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private SnippetSyntaxException error(String msg) {
        return new SnippetSyntaxException("Unsupported expression: " + source + " (" + msg + " at " + start + ")");
    }
}
