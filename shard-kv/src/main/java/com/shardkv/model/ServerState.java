package com.shardkv.model;

import com.shardkv.KV;
import com.shardkv.common.CommandContext;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * KVServer 状态，kvMap 与 lastCmdContext 只在持有 lock 时读写
 *
 * @author sakame
 * @version 1.0
 */
@Data
public class ServerState {

    /**
     * 锁，只保护内存中的读写，不跨越网络调用
     */
    private Lock lock = new ReentrantLock();

    /**
     * 自身编号
     */
    private int me;

    /**
     * 状态标识，原子化
     */
    private AtomicInteger dead = new AtomicInteger(0);

    /**
     * 该 server 所使用的 kv 存储对象
     */
    private KV kvMap;

    /**
     * clientId 对应的最后一次执行的写命令
     */
    private Map<Long, CommandContext> lastCmdContext = new HashMap<>();

}
