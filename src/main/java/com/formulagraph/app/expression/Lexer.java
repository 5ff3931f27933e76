package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.EvaluationErrorType;
import com.formulagraph.app.models.QualifiedAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a formula body (without the leading '=') into tokens.
 * Recognizes numbers, "strings", TRUE/FALSE, cell and range references with an optional
 * sheet qualifier (Sheet1!A1, 'Load Data'!A1:B3), names, operators, parentheses and
 * argument separators (',' or ';').
 */
final class Lexer {

    private static final Pattern CELL = Pattern.compile("\\$?[A-Z]{1,3}\\$?\\d+");

    private final String input;
    private int pos;

    Lexer(String input) {
        this.input = input;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return number();
        }
        if (c == '"') {
            return string();
        }
        if (c == '\'') {
            String sheet = quotedSheet();
            expect('!');
            return reference(sheet, start);
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            return word();
        }
        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LEFT_PAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RIGHT_PAREN, ")", start);
            case ',':
            case ';':
                pos++;
                return new Token(TokenType.SEPARATOR, String.valueOf(c), start);
            case '<':
                if (peek(1) == '=' || peek(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.OPERATOR, input.substring(start, pos), start);
                }
                pos++;
                return new Token(TokenType.OPERATOR, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.OPERATOR, ">=", start);
                }
                pos++;
                return new Token(TokenType.OPERATOR, ">", start);
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '%':
            case '=':
                pos++;
                return new Token(TokenType.OPERATOR, String.valueOf(c), start);
            default:
                throw malformed("Unexpected character '" + c + "' at position " + start);
        }
    }

    private Token number() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        if (pos < input.length() && (Character.isLetter(input.charAt(pos)) || input.charAt(pos) == '_')) {
            throw malformed("Malformed number at position " + start);
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token string() {
        int start = pos;
        pos++; // opening quote
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                // "" is an escaped quote
                if (peek(1) == '"') {
                    text.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, text.toString(), start);
            }
            text.append(c);
            pos++;
        }
        throw malformed("Unterminated string starting at position " + start);
    }

    private String quotedSheet() {
        int start = pos;
        pos++; // opening quote
        while (pos < input.length()) {
            if (input.charAt(pos) == '\'') {
                if (peek(1) == '\'') {
                    pos += 2;
                    continue;
                }
                pos++;
                return QualifiedAddress.unquoteSheet(input.substring(start, pos));
            }
            pos++;
        }
        throw malformed("Unterminated sheet name starting at position " + start);
    }

    private Token word() {
        int start = pos;
        String word = readWord();
        if (pos < input.length() && input.charAt(pos) == '!') {
            pos++;
            return reference(word, start);
        }
        boolean call = nextNonSpace() == '(';
        if (!call && CELL.matcher(word).matches()) {
            return rangeOrCell(null, word, start);
        }
        String upper = word.toUpperCase(Locale.ROOT);
        if (!call && (upper.equals("TRUE") || upper.equals("FALSE"))) {
            return new Token(TokenType.BOOLEAN, upper, start);
        }
        return new Token(TokenType.NAME, word, start);
    }

    private Token reference(String sheet, int start) {
        String cell = readWord();
        if (!CELL.matcher(cell).matches()) {
            throw malformed("Expected a cell after '" + sheet + "!' at position " + start);
        }
        return rangeOrCell(sheet, cell, start);
    }

    private Token rangeOrCell(String sheet, String first, int start) {
        if (pos < input.length() && input.charAt(pos) == ':') {
            int mark = pos;
            pos++;
            String second = readWord();
            if (CELL.matcher(second).matches()) {
                return new Token(TokenType.RANGE, first + ":" + second, sheet, start);
            }
            pos = mark;
            throw malformed("Malformed range at position " + start);
        }
        return new Token(TokenType.CELL, first, sheet, start);
    }

    private String readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$') {
                pos++;
            } else {
                break;
            }
        }
        return input.substring(start, pos);
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw malformed("Expected '" + expected + "' at position " + pos);
        }
        pos++;
    }

    private char peek(int offset) {
        int at = pos + offset;
        return at < input.length() ? input.charAt(at) : '\0';
    }

    private char nextNonSpace() {
        int at = pos;
        while (at < input.length() && Character.isWhitespace(input.charAt(at))) {
            at++;
        }
        return at < input.length() ? input.charAt(at) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static EvaluationException malformed(String message) {
        return new EvaluationException(EvaluationErrorType.MALFORMED_EXPRESSION, message);
    }
}
