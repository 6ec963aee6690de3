package com.shardkv.exception;

/**
 * 超时类异常
 * 传输超时、服务端不负责该 key、重试超过截止时间都用它表示，调用方无需区分
 *
 * @author sakame
 * @version 1.0
 */
public class RpcTimeoutException extends RuntimeException {

    public RpcTimeoutException(String message) {
        super(message);
    }

    public RpcTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

}
