/*
 *  Operator
 */
package net.genomicbreeding.formula;

/**
 * Binary arithmetic operators.
 */
enum Operator {

    ADD('+') {
        @Override
        double apply(double left, double right) {
            return left + right;
        }
    },
    SUBTRACT('-') {
        @Override
        double apply(double left, double right) {
            return left - right;
        }
    },
    MULTIPLY('*') {
        @Override
        double apply(double left, double right) {
            return left * right;
        }
    },
    DIVIDE('/') {
        @Override
        double apply(double left, double right) {
            return left / right;
        }
    },
    // sign follows the dividend
    REMAINDER('%') {
        @Override
        double apply(double left, double right) {
            return left % right;
        }
    },
    POWER('^') {
        @Override
        double apply(double left, double right) {
            return Math.pow(left, right);
        }
    };

    private final char mySymbol;

    Operator(char symbol) {
        mySymbol = symbol;
    }

    char symbol() {
        return mySymbol;
    }

    abstract double apply(double left, double right);

    static Operator fromSymbol(char symbol) {
        for (Operator current : values()) {
            if (current.mySymbol == symbol) {
                return current;
            }
        }
        throw new IllegalArgumentException("Operator: fromSymbol: unknown operator: " + symbol);
    }

}
