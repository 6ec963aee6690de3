package com.shardkv.network;

import com.shardkv.exception.RpcTimeoutException;
import com.shardkv.model.RpcRequest;
import com.shardkv.model.RpcResponse;
import com.shardkv.serializer.Serializer;

import java.io.IOException;

/**
 * 客户端端点，通过所属网络向连接的服务器发起调用
 *
 * @author sakame
 * @version 1.0
 */
public class ClientEnd {

    private final String name;

    private final Network network;

    ClientEnd(String name, Network network) {
        this.name = name;
        this.network = network;
    }

    public String getName() {
        return name;
    }

    /**
     * 发起一次 rpc 调用
     *
     * @param svcMeth   服务与方法，如 KVServer.Get
     * @param args      参数
     * @param replyType 响应类型
     * @param <T>
     * @return 响应
     * @throws RpcTimeoutException 端点不可用、服务端不可达、请求或响应丢失、服务端处理失败
     */
    public <T> T call(String svcMeth, Object args, Class<T> replyType) {
        int dot = svcMeth.lastIndexOf('.');
        if (dot <= 0 || dot == svcMeth.length() - 1) {
            throw new IllegalArgumentException("malformed service method " + svcMeth);
        }

        Serializer serializer = network.getSerializer();
        byte[] argBytes;
        try {
            argBytes = serializer.serialize(args);
        } catch (IOException e) {
            throw new RuntimeException("fail to encode args of " + svcMeth, e);
        }

        RpcRequest request = RpcRequest.builder()
                .endName(name)
                .serviceName(svcMeth.substring(0, dot))
                .methodName(svcMeth.substring(dot + 1))
                .args(argBytes)
                .build();
        RpcResponse response = network.processRequest(request);
        if (!response.isOk()) {
            throw new RpcTimeoutException(String.format("%s -> %s: %s", name, svcMeth, response.getMessage()));
        }

        try {
            return serializer.deserialize(response.getReply(), replyType);
        } catch (IOException e) {
            throw new RuntimeException("fail to decode reply of " + svcMeth, e);
        }
    }

}
