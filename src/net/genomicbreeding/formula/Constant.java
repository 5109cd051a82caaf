/*
 *  Constant
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

final class Constant implements Expression {

    private final double myValue;

    Constant(double value) {
        myValue = value;
    }

    @Override
    public double evaluate(ToDoubleFunction<String> variables) {
        return myValue;
    }

    @Override
    public void collectVariables(Set<String> names) {
        // none
    }

    @Override
    public String toString() {
        return Double.toString(myValue);
    }

}
