/*
 *  BinaryOperation
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

final class BinaryOperation implements Expression {

    private final Operator myOperator;
    private final Expression myLeft;
    private final Expression myRight;

    BinaryOperation(Operator operator, Expression left, Expression right) {
        myOperator = operator;
        myLeft = left;
        myRight = right;
    }

    @Override
    public double evaluate(ToDoubleFunction<String> variables) {
        return myOperator.apply(myLeft.evaluate(variables), myRight.evaluate(variables));
    }

    @Override
    public void collectVariables(Set<String> names) {
        myLeft.collectVariables(names);
        myRight.collectVariables(names);
    }

    @Override
    public String toString() {
        return "(" + myLeft + " " + myOperator.symbol() + " " + myRight + ")";
    }

}
