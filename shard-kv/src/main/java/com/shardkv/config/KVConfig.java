package com.shardkv.config;

import com.shardkv.KVServer;
import com.shardkv.network.Network;
import lombok.Data;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 集群配置，客户端和服务端共享的静态拓扑与网络
 *
 * @author sakame
 * @version 1.0
 */
@Data
public class KVConfig {

    /**
     * 锁，保护 kvServers 与 connected
     */
    private Lock lock = new ReentrantLock();

    /**
     * server 数量
     */
    private int nServers;

    /**
     * 每个分片的副本数
     */
    private int nReplicas;

    /**
     * KVServer 实例数组，下标即服务器编号
     */
    private KVServer[] kvServers;

    /**
     * 正在运行的服务器编号
     */
    private Set<Integer> runningServers = ConcurrentHashMap.newKeySet();

    /**
     * 服务器之间的连通性，转发请求时使用
     */
    private boolean[][] connected;

    /**
     * 模拟网络
     */
    private Network network;

    /**
     * 成功执行的操作个数
     */
    private AtomicInteger opCount = new AtomicInteger(0);

    /**
     * 已分配的最大 epoch，每启动一个 KVServer 加一
     */
    private AtomicLong epoch = new AtomicLong(0);

    /**
     * 超时等配置
     */
    private ShardKVProperties properties = new ShardKVProperties();

    /**
     * 每成功执行一次读或写调用一次
     */
    public void op() {
        opCount.incrementAndGet();
    }

    public long nextEpoch() {
        return epoch.incrementAndGet();
    }

    public boolean isRunning(int server) {
        return runningServers.contains(server);
    }

    public KVServer getServer(int server) {
        lock.lock();
        try {
            return kvServers[server];
        } finally {
            lock.unlock();
        }
    }

    public boolean isConnected(int from, int to) {
        lock.lock();
        try {
            return connected == null || connected[from][to];
        } finally {
            lock.unlock();
        }
    }

}
