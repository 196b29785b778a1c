package com.poc.svc.treasury.exception;

public class NettingTransactionNotFoundException extends RuntimeException {

    public NettingTransactionNotFoundException(String transactionId) {
        super("Netting transaction not found: " + transactionId);
    }
}
