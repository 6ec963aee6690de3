package com.shardkv.constant;

/**
 * @author sakame
 * @version 1.0
 */
public interface KVConstant {

    /**
     * 配置前缀
     */
    String CONFIG_PREFIX = "shardkv";

    /**
     * KVServer 在网络上的服务名
     */
    String SERVICE_NAME = "KVServer";

    /**
     * 转发端点名称前缀
     */
    String FORWARD_END_PREFIX = "fwd";

    /**
     * 客户端端点名称前缀
     */
    String CLIENT_END_PREFIX = "clerk";

    /**
     * 客户端 id 的上界，即 62 位随机数
     */
    long MAX_CLIENT_ID = 1L << 62;

}
