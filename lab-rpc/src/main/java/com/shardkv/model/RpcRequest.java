package com.shardkv.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 在模拟网络中传递的请求
 *
 * @author sakame
 * @version 1.0
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RpcRequest {

    /**
     * 发出请求的端点名称
     */
    private String endName;

    /**
     * 服务名称，如 KVServer
     */
    private String serviceName;

    /**
     * 方法名称，如 Get
     */
    private String methodName;

    /**
     * 序列化后的参数
     */
    private byte[] args;

}
