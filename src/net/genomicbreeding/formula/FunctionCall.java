/*
 *  FunctionCall
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

final class FunctionCall implements Expression {

    private final MathFunction myFunction;
    private final Expression myArgument;

    FunctionCall(MathFunction function, Expression argument) {
        myFunction = function;
        myArgument = argument;
    }

    @Override
    public double evaluate(ToDoubleFunction<String> variables) {
        return myFunction.apply(myArgument.evaluate(variables));
    }

    @Override
    public void collectVariables(Set<String> names) {
        myArgument.collectVariables(names);
    }

    @Override
    public String toString() {
        return myFunction.functionName() + "(" + myArgument + ")";
    }

}
