package com.shardkv.common;

import com.shardkv.constant.KVConstant;

/**
 * 命令类型
 *
 * @author sakame
 * @version 1.0
 */
public enum CommandType {

    GET("Get"),
    PUT("Put"),
    APPEND("Append");

    private final String method;

    CommandType(String method) {
        this.method = method;
    }

    /**
     * @return 网络上的调用名称，如 KVServer.Get
     */
    public String getRpcName() {
        return KVConstant.SERVICE_NAME + "." + method;
    }

}
