package com.deepansh.gateway.context;

public class DeadlineExceededException extends CancelledException {

    public DeadlineExceededException(String message) {
        super(message);
    }

    @Override
    public String getErrorType() {
        return "deadline_exceeded";
    }
}
