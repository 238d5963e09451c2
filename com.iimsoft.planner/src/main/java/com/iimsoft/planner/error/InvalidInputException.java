package com.iimsoft.planner.error;

import java.util.Objects;

public class InvalidInputException extends PlanningException {

    private final ErrorCode code;

    public InvalidInputException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "InvalidInputException{" + code + ": " + getMessage() + "}";
    }
}
