package com.plyoox.stream.notifier.exceptions;

public class LockAcquiringFail extends ConcurrencyException {

    public LockAcquiringFail(String message) {
        super(message);
    }
}
