package com.rpcbackoff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 某次投递中 Backoff 的记录, 随重投递消息的 header 传递
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackoffTrace {

    /** 第几次投递(从0开始) */
    private int attempt;

    /** Backoff 类全限定名 */
    private String type;

    private String message;

    /** cause 链, 形如 "com.acme.NotYet: try again later" */
    private List<String> causes;

    public static BackoffTrace of(int attempt, Throwable backoff) {
        List<String> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable c = backoff.getCause(); c != null && seen.add(c); c = c.getCause()) {
            chain.add(c.toString());
        }
        return new BackoffTrace(attempt, backoff.getClass().getName(), backoff.getMessage(), chain);
    }

    @JsonIgnore
    public String describe() {
        StringBuilder sb = new StringBuilder("attempt ").append(attempt).append(": ").append(type);
        if (causes != null) {
            causes.forEach(c -> sb.append(" <- ").append(c));
        }
        return sb.toString();
    }
}
