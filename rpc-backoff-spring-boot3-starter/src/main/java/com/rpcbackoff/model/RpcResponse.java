package com.rpcbackoff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RPC响应, result 与 error 二选一
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RpcResponse {

    private Object result;

    private RpcError error;

    public static RpcResponse success(Object result) {
        return new RpcResponse(result, null);
    }

    public static RpcResponse failure(Throwable t) {
        return new RpcResponse(null, RpcError.of(t));
    }

    public boolean isError() {
        return error != null;
    }
}
