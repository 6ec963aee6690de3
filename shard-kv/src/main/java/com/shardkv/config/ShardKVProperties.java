package com.shardkv.config;

import com.shardkv.constant.KVConstant;
import com.shardkv.constant.TimeConstant;
import com.shardkv.utils.ConfigUtils;
import lombok.Data;

/**
 * 集群配置，对应 application.properties 中 shardkv 前缀的配置项
 *
 * @author sakame
 * @version 1.0
 */
@Data
public class ShardKVProperties {

    /**
     * 服务器总数
     */
    private int servers = 3;

    /**
     * 每个分片的副本数，包含 primary
     */
    private int replicas = 2;

    /**
     * 是否使用不可靠网络
     */
    private boolean unreliable = false;

    private long clerkTimeout = TimeConstant.CLERK_TIMEOUT;

    private long clerkRetryInterval = TimeConstant.CLERK_RETRY_INTERVAL;

    private long forwardTimeout = TimeConstant.FORWARD_TIMEOUT;

    private long forwardRetryInterval = TimeConstant.FORWARD_RETRY_INTERVAL;

    public static ShardKVProperties load() {
        return ConfigUtils.loadConfig(ShardKVProperties.class, KVConstant.CONFIG_PREFIX);
    }

}
