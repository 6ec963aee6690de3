package com.shardkv.model;

import com.shardkv.network.ClientEnd;
import lombok.Data;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 客户端会话
 *
 * @author sakame
 * @version 1.0
 */
@Data
public class ClientSession {

    /**
     * 保护 seqId
     */
    private Lock lock = new ReentrantLock();

    /**
     * 到每台服务器的端点，下标即服务器编号
     */
    private ClientEnd[] servers;

    /**
     * client 标识，62 位随机数
     */
    private long clientId;

    /**
     * 最后一次分配的序列 id
     */
    private long seqId;

    /**
     * 分片 => 最近一次成功的副本偏移，只用于减少重试
     */
    private Map<Integer, Integer> lastReplica = new ConcurrentHashMap<>();

}
