/*
 *  FormulaLexer
 */
package net.genomicbreeding.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula into tokens. Identifiers are letters, digits, '_' and '.'
 * not starting with a digit, or any text between backticks.
 */
final class FormulaLexer {

    private static final String OPERATORS = "+-*/%^";

    private FormulaLexer() {
        // utility
    }

    static List<Token> tokenize(String formula) {

        List<Token> result = new ArrayList<>();
        int length = formula.length();
        int index = 0;
        while (index < length) {

            char current = formula.charAt(index);
            if (Character.isWhitespace(current)) {
                index++;
            } else if (Character.isDigit(current) || (current == '.' && index + 1 < length && Character.isDigit(formula.charAt(index + 1)))) {
                int end = scanNumber(formula, index);
                result.add(new Token(Token.Type.NUMBER, formula.substring(index, end), index));
                index = end;
            } else if (Character.isLetter(current) || current == '_' || current == '.') {
                int end = index + 1;
                while (end < length && isIdentifierPart(formula.charAt(end))) {
                    end++;
                }
                result.add(new Token(Token.Type.IDENTIFIER, formula.substring(index, end), index));
                index = end;
            } else if (current == '`') {
                int end = formula.indexOf('`', index + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("FormulaLexer: tokenize: unterminated quoted name at position " + index + " in: " + formula);
                }
                if (end == index + 1) {
                    throw new IllegalArgumentException("FormulaLexer: tokenize: empty quoted name at position " + index + " in: " + formula);
                }
                result.add(new Token(Token.Type.IDENTIFIER, formula.substring(index + 1, end), index));
                index = end + 1;
            } else if (OPERATORS.indexOf(current) >= 0) {
                result.add(new Token(Token.Type.OPERATOR, String.valueOf(current), index));
                index++;
            } else if (current == '(') {
                result.add(new Token(Token.Type.LEFT_PAREN, "(", index));
                index++;
            } else if (current == ')') {
                result.add(new Token(Token.Type.RIGHT_PAREN, ")", index));
                index++;
            } else {
                throw new IllegalArgumentException("FormulaLexer: tokenize: unexpected character '" + current + "' at position " + index + " in: " + formula);
            }

        }
        result.add(new Token(Token.Type.END, "", length));
        return result;

    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    // digits, optional fraction and optional exponent
    private static int scanNumber(String formula, int start) {
        int length = formula.length();
        int end = start;
        while (end < length && Character.isDigit(formula.charAt(end))) {
            end++;
        }
        if (end < length && formula.charAt(end) == '.') {
            end++;
            while (end < length && Character.isDigit(formula.charAt(end))) {
                end++;
            }
        }
        if (end < length && (formula.charAt(end) == 'e' || formula.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < length && (formula.charAt(exponent) == '+' || formula.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && Character.isDigit(formula.charAt(exponent))) {
                end = exponent;
                while (end < length && Character.isDigit(formula.charAt(end))) {
                    end++;
                }
            }
        }
        return end;
    }

}
