package com.rpcbackoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RPC错误响应体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RpcError {

    @JsonProperty("exc_type")
    private String excType;

    @JsonProperty("exc_path")
    private String excPath;

    @JsonProperty("exc_message")
    private String excMessage;

    public static RpcError of(Throwable t) {
        return new RpcError(t.getClass().getSimpleName(), t.getClass().getName(), t.getMessage());
    }
}
