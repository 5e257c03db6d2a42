package com.prospect.leadengine.qualify.model;

public class InvalidLeadException extends RuntimeException {
    public InvalidLeadException(String message) {
        super(message);
    }
}
