/*
 *  Variable
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

final class Variable implements Expression {

    private final String myName;

    Variable(String name) {
        myName = name;
    }

    String name() {
        return myName;
    }

    @Override
    public double evaluate(ToDoubleFunction<String> variables) {
        return variables.applyAsDouble(myName);
    }

    @Override
    public void collectVariables(Set<String> names) {
        names.add(myName);
    }

    @Override
    public String toString() {
        return "`" + myName + "`";
    }

}
