package com.rpcbackoff.model.enums;

public enum Severity {
    INFO, WARNING, ERROR, CRITICAL
}
