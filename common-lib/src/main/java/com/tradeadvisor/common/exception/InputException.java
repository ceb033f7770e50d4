package com.tradeadvisor.common.exception;

/** Malformed or missing caller input: bad chart image, non-positive equity, empty symbol. */
public class InputException extends PlannerException {

    public InputException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INPUT;
    }
}
