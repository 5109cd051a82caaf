/*
 *  FormulaParser
 */
package net.genomicbreeding.formula;

import java.util.List;

/**
 * Recursive descent parser for arithmetic formulae.
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('^' unary)?
 * primary    := number | name | function '(' expression ')' | '(' expression ')'
 * </pre>
 * '^' is right associative and binds tighter than a leading minus, so
 * {@code -a^2} is {@code -(a^2)} and {@code a^-b} is allowed.
 */
final class FormulaParser {

    private final String myFormula;
    private final List<Token> myTokens;
    private int myIndex = 0;

    private FormulaParser(String formula) {
        myFormula = formula;
        myTokens = FormulaLexer.tokenize(formula);
    }

    static Expression parse(String formula) {
        FormulaParser parser = new FormulaParser(formula);
        Expression result = parser.expression();
        Token last = parser.peek();
        if (last.type() != Token.Type.END) {
            throw parser.error("unexpected " + last, last);
        }
        return result;
    }

    private Expression expression() {
        Expression result = term();
        while (peek().isOperator('+') || peek().isOperator('-')) {
            Operator operator = Operator.fromSymbol(next().text().charAt(0));
            result = new BinaryOperation(operator, result, term());
        }
        return result;
    }

    private Expression term() {
        Expression result = unary();
        while (peek().isOperator('*') || peek().isOperator('/') || peek().isOperator('%')) {
            Operator operator = Operator.fromSymbol(next().text().charAt(0));
            result = new BinaryOperation(operator, result, unary());
        }
        return result;
    }

    private Expression unary() {
        if (peek().isOperator('-')) {
            next();
            return new Negation(unary());
        } else if (peek().isOperator('+')) {
            next();
            return unary();
        }
        return power();
    }

    private Expression power() {
        Expression base = primary();
        if (peek().isOperator('^')) {
            next();
            return new BinaryOperation(Operator.POWER, base, unary());
        }
        return base;
    }

    private Expression primary() {

        Token token = next();
        switch (token.type()) {
            case NUMBER:
                try {
                    return new Constant(Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    throw error("malformed number " + token, token);
                }
            case IDENTIFIER:
                if (peek().type() == Token.Type.LEFT_PAREN) {
                    MathFunction function = MathFunction.fromName(token.text());
                    if (function == null) {
                        throw error("unknown function " + token, token);
                    }
                    next();
                    Expression argument = expression();
                    expect(Token.Type.RIGHT_PAREN);
                    return new FunctionCall(function, argument);
                }
                return new Variable(token.text());
            case LEFT_PAREN:
                Expression result = expression();
                expect(Token.Type.RIGHT_PAREN);
                return result;
            default:
                throw error("unexpected " + token, token);
        }

    }

    private void expect(Token.Type type) {
        Token token = next();
        if (token.type() != type) {
            throw error("expected ')' but found " + token, token);
        }
    }

    private Token peek() {
        return myTokens.get(myIndex);
    }

    private Token next() {
        Token result = myTokens.get(myIndex);
        if (result.type() != Token.Type.END) {
            myIndex++;
        }
        return result;
    }

    private IllegalArgumentException error(String message, Token token) {
        return new IllegalArgumentException("FormulaParser: parse: " + message + " at position " + token.position() + " in: " + myFormula);
    }

}
