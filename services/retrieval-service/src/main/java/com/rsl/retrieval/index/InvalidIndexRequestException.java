package com.rsl.retrieval.index;

public class InvalidIndexRequestException extends RuntimeException {
    public InvalidIndexRequestException(String message) {
        super(message);
    }
}
