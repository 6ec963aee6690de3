package com.shardkv.constant;

/**
 * 时间相关默认值，单位毫秒
 *
 * @author sakame
 * @version 1.0
 */
public interface TimeConstant {

    /**
     * 客户端一次操作的总时限
     */
    int CLERK_TIMEOUT = 2000;

    /**
     * 客户端遍历完一轮副本仍失败后的等待时间
     */
    int CLERK_RETRY_INTERVAL = 50;

    /**
     * 非 primary 转发请求的总时限
     */
    int FORWARD_TIMEOUT = 2000;

    /**
     * 转发失败后的等待时间
     */
    int FORWARD_RETRY_INTERVAL = 50;

}
