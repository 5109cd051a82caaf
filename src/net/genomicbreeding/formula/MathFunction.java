/*
 *  MathFunction
 */
package net.genomicbreeding.formula;

import java.util.function.DoubleUnaryOperator;

/**
 * Functions callable from a formula.
 */
public enum MathFunction {

    ABS("abs", Math::abs),
    SQRT("sqrt", Math::sqrt),
    LOG("log", Math::log),
    LOG2("log2", x -> Math.log(x) / Math.log(2.0)),
    LOG10("log10", Math::log10);

    private final String myName;
    private final DoubleUnaryOperator myFunction;

    MathFunction(String name, DoubleUnaryOperator function) {
        myName = name;
        myFunction = function;
    }

    public String functionName() {
        return myName;
    }

    public double apply(double value) {
        return myFunction.applyAsDouble(value);
    }

    /**
     * @return the function with this name, null if there is none
     */
    public static MathFunction fromName(String name) {
        for (MathFunction current : values()) {
            if (current.myName.equals(name)) {
                return current;
            }
        }
        return null;
    }

}
