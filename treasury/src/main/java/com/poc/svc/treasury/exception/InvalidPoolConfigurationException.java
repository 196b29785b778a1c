package com.poc.svc.treasury.exception;

public class InvalidPoolConfigurationException extends RuntimeException {

    private final String poolName;

    public InvalidPoolConfigurationException(String poolName, String message) {
        super(message);
        this.poolName = poolName;
    }

    public String poolName() {
        return poolName;
    }
}
