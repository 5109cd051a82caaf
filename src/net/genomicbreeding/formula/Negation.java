/*
 *  Negation
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

final class Negation implements Expression {

    private final Expression myOperand;

    Negation(Expression operand) {
        myOperand = operand;
    }

    @Override
    public double evaluate(ToDoubleFunction<String> variables) {
        return -myOperand.evaluate(variables);
    }

    @Override
    public void collectVariables(Set<String> names) {
        myOperand.collectVariables(names);
    }

    @Override
    public String toString() {
        return "(-" + myOperand + ")";
    }

}
