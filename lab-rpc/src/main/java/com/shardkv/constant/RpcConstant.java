package com.shardkv.constant;

/**
 * rpc 相关常量
 *
 * @author sakame
 * @version 1.0
 */
public interface RpcConstant {

    /**
     * 默认配置文件加载前缀
     */
    String DEFAULT_CONFIG_PREFIX = "rpc";

    /**
     * 不可靠网络下请求或响应被丢弃的概率（千分比）
     */
    int DROP_PERMILLE = 100;

    /**
     * 不可靠网络下的最大随机延迟
     */
    int UNRELIABLE_MAX_DELAY = 27;

    /**
     * 不可达时的最大等待时间
     */
    int SHORT_TIMEOUT = 100;

    /**
     * 开启长延迟后不可达时的最大等待时间
     */
    int LONG_TIMEOUT = 7000;

    /**
     * 等待服务端处理时检查服务端存活的间隔
     */
    int DEAD_CHECK_INTERVAL = 100;

}
