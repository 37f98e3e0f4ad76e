package com.rpcbackoff.core.backoff;

import com.fasterxml.jackson.core.type.TypeReference;
import com.rpcbackoff.core.spi.PayloadSerializer;
import com.rpcbackoff.model.BackoffTrace;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.model.RpcMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 读取/递增消息 header 中的重试次数
 * 只依赖消息本身, 重复投递读到的是同一个值
 */
@Slf4j
public class AttemptTracker {

    private static final TypeReference<List<BackoffTrace>> HISTORY_TYPE = new TypeReference<>() {};

    private final PayloadSerializer serializer;

    public AttemptTracker(PayloadSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * 当前次数, 无header(首次投递)为0
     */
    public int read(RpcMessage message) {
        Object raw = message.header(RpcHeaders.RETRY_COUNT);
        if (raw == null) {
            return 0;
        }
        // 不同传输层会把header重新编码成 Integer/Long/String
        long count;
        if (raw instanceof Number n) {
            count = n.longValue();
        } else {
            try {
                count = Long.parseLong(raw.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("[Backoff] malformed {} header '{}' on message id={}, treated as 0",
                        RpcHeaders.RETRY_COUNT, raw, message.getMessageId());
                return 0;
            }
        }
        return (int) Math.max(0, Math.min(count, Integer.MAX_VALUE));
    }

    /**
     * 返回次数+1的新消息, payload/id/correlation 不变
     */
    public RpcMessage next(RpcMessage message) {
        return message.withHeader(RpcHeaders.RETRY_COUNT, read(message) + 1);
    }

    /**
     * 之前各次投递的退避记录
     */
    public List<BackoffTrace> history(RpcMessage message) {
        Object raw = message.header(RpcHeaders.BACKOFF_HISTORY);
        if (raw == null) {
            return List.of();
        }
        try {
            List<BackoffTrace> traces = serializer.deserialize(raw.toString(), HISTORY_TYPE);
            return traces == null ? List.of() : traces;
        } catch (IllegalStateException e) {
            // 仅用于诊断, 损坏时从头记录
            log.warn("[Backoff] unreadable {} header on message id={}, history restarted",
                    RpcHeaders.BACKOFF_HISTORY, message.getMessageId(), e);
            return List.of();
        }
    }

    /**
     * 追加一条记录, 超出上限丢弃最早的
     */
    public RpcMessage appendHistory(RpcMessage message, List<BackoffTrace> history, BackoffTrace trace, int limit) {
        List<BackoffTrace> next = new ArrayList<>(history);
        next.add(trace);
        int max = Math.max(1, limit);
        if (next.size() > max) {
            next = new ArrayList<>(next.subList(next.size() - max, next.size()));
        }
        return message.withHeader(RpcHeaders.BACKOFF_HISTORY, serializer.serialize(next));
    }
}
