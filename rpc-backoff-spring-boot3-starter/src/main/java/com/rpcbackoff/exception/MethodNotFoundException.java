package com.rpcbackoff.exception;

public class MethodNotFoundException extends RuntimeException {

    public MethodNotFoundException(String service, String method) {
        super(service + "." + method);
    }
}
