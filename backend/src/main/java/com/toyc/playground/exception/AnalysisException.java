package com.toyc.playground.exception;

public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }
}
