package com.rpcbackoff.core.spi;

import com.rpcbackoff.model.RpcMessage;

@FunctionalInterface
public interface MessageHandler {

    void onMessage(RpcMessage message);
}
