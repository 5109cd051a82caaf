/*
 *  Token
 */
package net.genomicbreeding.formula;

/**
 * Lexical unit of a formula.
 */
final class Token {

    enum Type {
        NUMBER, IDENTIFIER, OPERATOR, LEFT_PAREN, RIGHT_PAREN, END
    }

    private final Type myType;
    private final String myText;
    private final int myPosition;

    Token(Type type, String text, int position) {
        myType = type;
        myText = text;
        myPosition = position;
    }

    Type type() {
        return myType;
    }

    String text() {
        return myText;
    }

    /**
     * @return 0 based offset of the token in the formula
     */
    int position() {
        return myPosition;
    }

    boolean isOperator(char operator) {
        return myType == Type.OPERATOR && myText.charAt(0) == operator;
    }

    @Override
    public String toString() {
        return myType == Type.END ? "end of formula" : "'" + myText + "'";
    }

}
