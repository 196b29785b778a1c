package com.poc.svc.treasury.exception;

public class PoolNotFoundException extends RuntimeException {

    public PoolNotFoundException(String message) {
        super(message);
    }
}
