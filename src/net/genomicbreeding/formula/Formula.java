/*
 *  Formula
 */
package net.genomicbreeding.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Parsed arithmetic formula over named variables. Supports
 * {@code + - * / % ^}, parentheses and the functions of
 * {@link MathFunction}.
 */
public final class Formula {

    private final String myText;
    private final Expression myExpression;
    private final Set<String> myVariables;

    private Formula(String text, Expression expression) {
        myText = text;
        myExpression = expression;
        Set<String> variables = new LinkedHashSet<>();
        expression.collectVariables(variables);
        myVariables = Collections.unmodifiableSet(variables);
    }

    /**
     * @throws IllegalArgumentException if the formula is empty or not well
     * formed, naming the offending position
     */
    public static Formula parse(String formula) {
        if (formula == null || formula.trim().isEmpty()) {
            throw new IllegalArgumentException("Formula: parse: formula is empty.");
        }
        return new Formula(formula, FormulaParser.parse(formula));
    }

    /**
     * @return names of the variables in order of first appearance
     */
    public Set<String> variables() {
        return myVariables;
    }

    public double evaluate(ToDoubleFunction<String> variables) {
        return myExpression.evaluate(variables);
    }

    public Expression expression() {
        return myExpression;
    }

    @Override
    public String toString() {
        return myText;
    }

}
