package com.nilsson.promptsyntax.model;

/**
 Raised when a {@code .name(} suffix names an operator the grammar does not know.
 */
public class UnrecognizedOperatorException extends ParsingException {

    private final String operatorName;

    public UnrecognizedOperatorException(String operatorName, String near) {
        super("Unrecognized operator '." + operatorName + "()'", near);
        this.operatorName = operatorName;
    }

    public String getOperatorName() {
        return operatorName;
    }
}
