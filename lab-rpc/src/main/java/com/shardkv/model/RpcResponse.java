package com.shardkv.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 在模拟网络中传递的响应
 *
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RpcResponse {

    /**
     * 是否送达并成功处理
     */
    private boolean ok;

    /**
     * 序列化后的响应体
     */
    private byte[] reply;

    /**
     * 失败原因
     */
    private String message;

    public static RpcResponse success(byte[] reply) {
        return new RpcResponse(true, reply, "ok");
    }

    public static RpcResponse fail(String message) {
        return new RpcResponse(false, null, message);
    }

}
