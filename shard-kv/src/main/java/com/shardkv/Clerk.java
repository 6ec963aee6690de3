package com.shardkv;

import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import com.shardkv.common.CommandType;
import com.shardkv.config.KVConfig;
import com.shardkv.constant.KVConstant;
import com.shardkv.exception.RpcTimeoutException;
import com.shardkv.model.ClientSession;
import com.shardkv.model.dto.GetArgs;
import com.shardkv.model.dto.GetReply;
import com.shardkv.model.dto.PutAppendArgs;
import com.shardkv.model.dto.PutAppendReply;
import com.shardkv.network.ClientEnd;
import com.shardkv.utils.ShardUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * 客户端，负责把操作路由到 key 所在分片的副本并在失败时重试
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class Clerk {

    private final ClientSession session = new ClientSession();

    private final KVConfig config;

    public Clerk(ClientEnd[] servers, KVConfig config) {
        this.config = config;
        session.setServers(servers);
        session.setClientId(RandomUtil.randomLong(0, KVConstant.MAX_CLIENT_ID));
    }

    /**
     * 获取 key 的值，读不需要去重，不分配序列 id
     *
     * @param key 键值
     * @return key 不存在时返回空串
     */
    public String get(String key) {
        int shard = ShardUtils.shardOf(key, config.getNServers());
        GetReply reply = call(CommandType.GET, new GetArgs(key), GetReply.class, shard);
        return reply == null ? "" : StrUtil.nullToEmpty(reply.getValue());
    }

    public void put(String key, String value) {
        putAppend(key, value, CommandType.PUT);
    }

    /**
     * 在 key 的值后追加
     *
     * @return 追加前的值
     */
    public String append(String key, String value) {
        return putAppend(key, value, CommandType.APPEND);
    }

    /**
     * put 与 append 共用，分配新的序列 id 供服务端去重
     *
     * @param key   键值
     * @param value 值
     * @param type  命令类型
     * @return 服务端的响应值
     */
    String putAppend(String key, String value, CommandType type) {
        int shard = ShardUtils.shardOf(key, config.getNServers());
        PutAppendArgs args;
        session.getLock().lock();
        try {
            session.setSeqId(session.getSeqId() + 1);
            args = new PutAppendArgs(key, value, session.getClientId(), session.getSeqId());
        } finally {
            session.getLock().unlock();
        }

        PutAppendReply reply = call(type, args, PutAppendReply.class, shard);
        return reply == null ? "" : StrUtil.nullToEmpty(reply.getValue());
    }

    /**
     * 从上次成功的副本开始依次尝试分片内的副本，一轮全部失败则稍等后再来一轮，超过总时限抛出超时
     *
     * @param type      命令类型
     * @param args      请求体
     * @param replyType 响应类型
     * @param shard     分片
     * @param <T>
     * @return 响应体
     */
    private <T> T call(CommandType type, Object args, Class<T> replyType, int shard) {
        int n = config.getNServers();
        int r = config.getNReplicas();
        int offset = session.getLastReplica().getOrDefault(shard, 0);
        long timeout = config.getProperties().getClerkTimeout();
        long deadline = System.currentTimeMillis() + timeout;

        while (System.currentTimeMillis() < deadline) {
            for (int attempt = 0; attempt < r; attempt++) {
                int replicaOffset = (offset + attempt) % r;
                int server = ShardUtils.replicaOf(shard, replicaOffset, n);
                try {
                    T reply = session.getServers()[server].call(type.getRpcName(), args, replyType);
                    session.getLastReplica().put(shard, replicaOffset);
                    return reply;
                } catch (RpcTimeoutException e) {
                    log.debug("client {} {} on server {} failed: {}", session.getClientId(), type, server, e.getMessage());
                }
            }
            try {
                Thread.sleep(config.getProperties().getClerkRetryInterval());
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }

        log.warn("client {} gives up {} on shard {} after {} ms", session.getClientId(), type, shard, timeout);
        throw new RpcTimeoutException(String.format("%s on shard %d failed across all replicas within %d ms", type.getRpcName(), shard, timeout));
    }

    public long getClientId() {
        return session.getClientId();
    }

}
