/*
 *  Expression
 */
package net.genomicbreeding.formula;

import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Node of a parsed formula.
 */
public interface Expression {

    /**
     * @param variables value of each variable by name
     *
     * @return IEEE result, which may be NaN or infinite
     */
    double evaluate(ToDoubleFunction<String> variables);

    /**
     * Adds the names of the variables this expression refers to.
     */
    void collectVariables(Set<String> names);

}
