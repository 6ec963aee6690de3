package com.shardkv;

import cn.hutool.core.util.IdUtil;
import com.shardkv.common.CommandContext;
import com.shardkv.common.CommandType;
import com.shardkv.config.KVConfig;
import com.shardkv.constant.KVConstant;
import com.shardkv.exception.RpcTimeoutException;
import com.shardkv.model.ServerState;
import com.shardkv.model.dto.GetArgs;
import com.shardkv.model.dto.GetReply;
import com.shardkv.model.dto.PutAppendArgs;
import com.shardkv.model.dto.PutAppendReply;
import com.shardkv.model.dto.ReplicateArgs;
import com.shardkv.network.ClientEnd;
import com.shardkv.network.Network;
import com.shardkv.service.KVServerService;
import com.shardkv.utils.ShardUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * 存储节点
 * 对每个 key，编号等于其分片的节点是 primary，其后 nReplicas - 1 个节点是 backup
 * primary 执行写命令并同步给 backup；其他节点收到写命令时经网络转发给 primary
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class KVServer implements KVServerService {

    private final ServerState state = new ServerState();

    private final KVConfig config;

    public KVServer(int me, KVConfig config) {
        state.setMe(me);
        state.setKvMap(new KV(config.nextEpoch()));
        this.config = config;
    }

    @Override
    public GetReply get(GetArgs args) {
        String key = args.getKey();
        checkAlive();
        if (!isResponsibleFor(key)) {
            throw new RpcTimeoutException(String.format("server %d is not responsible for key %s", state.getMe(), key));
        }

        String value;
        state.getLock().lock();
        try {
            value = state.getKvMap().get(key);
            config.op();
        } finally {
            state.getLock().unlock();
        }
        return new GetReply(value);
    }

    @Override
    public PutAppendReply put(PutAppendArgs args) {
        return putAppend(CommandType.PUT, args);
    }

    @Override
    public PutAppendReply append(PutAppendArgs args) {
        return putAppend(CommandType.APPEND, args);
    }

    /**
     * 执行写命令
     * 非 primary 转发；primary 持锁去重并执行，释放锁后同步给所有 backup 再返回
     *
     * @param type 命令类型
     * @param args 请求体
     * @return 响应体
     */
    private PutAppendReply putAppend(CommandType type, PutAppendArgs args) {
        String key = args.getKey();
        checkAlive();
        if (!isPrimaryFor(key)) {
            return forward(type, args);
        }

        ReplicateArgs replicateArgs;
        state.getLock().lock();
        try {
            if (isDuplicated(args.getClientId(), args.getSeqId())) {
                CommandContext context = state.getLastCmdContext().get(args.getClientId());
                log.debug("{} ignores duplicated {} from client {} seq {}", state.getMe(), type, args.getClientId(), args.getSeqId());
                return new PutAppendReply(context.getReply());
            }

            KV kv = state.getKvMap();
            String reply = kv.opt(type, key, args.getValue());
            state.getLastCmdContext().put(args.getClientId(), new CommandContext(args.getSeqId(), reply));
            config.op();
            replicateArgs = new ReplicateArgs(key, kv.get(key), kv.getVersion(key), args.getClientId(), args.getSeqId(), reply);
        } finally {
            state.getLock().unlock();
        }

        replicate(replicateArgs);
        return new PutAppendReply(replicateArgs.getReply());
    }

    /**
     * 进程内直接调用每个运行中的 backup，不经过模拟网络
     *
     * @param args 已执行的结果
     */
    private void replicate(ReplicateArgs args) {
        int n = config.getNServers();
        int shard = ShardUtils.shardOf(args.getKey(), n);
        for (int offset = 1; offset < config.getNReplicas(); offset++) {
            int backup = ShardUtils.replicaOf(shard, offset, n);
            if (backup == state.getMe()) {
                continue;
            }
            KVServer follower = config.getServer(backup);
            if (follower == null || !config.isRunning(backup)) {
                log.debug("{} skips replication of key {} to stopped backup {}", state.getMe(), args.getKey(), backup);
                continue;
            }
            follower.applyReplica(args);
        }
    }

    /**
     * backup 接收 primary 已执行的结果
     * 与 primary 使用相同的去重规则；只写入比本地更新的版本，不重新计算拼接
     *
     * @param args 已执行的结果
     */
    public void applyReplica(ReplicateArgs args) {
        if (killed()) {
            return;
        }
        state.getLock().lock();
        try {
            if (isDuplicated(args.getClientId(), args.getSeqId())) {
                return;
            }
            if (!state.getKvMap().install(args.getKey(), args.getValue(), args.getVersion())) {
                log.debug("{} keeps newer version of key {} than {}", state.getMe(), args.getKey(), args.getVersion());
            }
            state.getLastCmdContext().put(args.getClientId(), new CommandContext(args.getSeqId(), args.getReply()));
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * 经网络把写命令转发给 primary
     * 每次尝试都新建端点，结束后无论成败都删除；超时后稍等重试，超过总时限抛出超时
     *
     * @param type 命令类型
     * @param args 请求体
     * @return primary 的响应
     */
    private PutAppendReply forward(CommandType type, PutAppendArgs args) {
        int primary = ShardUtils.shardOf(args.getKey(), config.getNServers());
        Network network = config.getNetwork();
        long deadline = System.currentTimeMillis() + config.getProperties().getForwardTimeout();

        while (System.currentTimeMillis() < deadline) {
            String endName = String.format("%s-%d-%s", KVConstant.FORWARD_END_PREFIX, state.getMe(), IdUtil.fastSimpleUUID());
            ClientEnd end = network.makeEnd(endName);
            try {
                network.connect(endName, primary);
                network.enable(endName, config.isRunning(primary) && config.isConnected(state.getMe(), primary));
                return end.call(type.getRpcName(), args, PutAppendReply.class);
            } catch (RpcTimeoutException e) {
                log.debug("{} fails to forward {} to {}: {}", state.getMe(), type, primary, e.getMessage());
                sleep(config.getProperties().getForwardRetryInterval());
            } finally {
                network.deleteEnd(endName);
            }
        }

        log.warn("{} gives up forwarding {} of key {} to {}", state.getMe(), type, args.getKey(), primary);
        throw new RpcTimeoutException(String.format("server %d cannot forward %s to primary %d", state.getMe(), type, primary));
    }

    /**
     * 已关闭的实例不再处理请求
     */
    private void checkAlive() {
        if (killed()) {
            throw new RpcTimeoutException(String.format("server %d is down", state.getMe()));
        }
    }

    /**
     * 序列 id 不大于已记录的值即为重复
     */
    private boolean isDuplicated(long clientId, long seqId) {
        CommandContext context = state.getLastCmdContext().get(clientId);
        return context != null && context.getSeqId() >= seqId;
    }

    public boolean isPrimaryFor(String key) {
        return ShardUtils.isPrimary(state.getMe(), key, config.getNServers());
    }

    public boolean isResponsibleFor(String key) {
        return ShardUtils.isResponsible(state.getMe(), key, config.getNServers(), config.getNReplicas());
    }

    public int getMe() {
        return state.getMe();
    }

    /**
     * 不经过去重和计数直接读取本地值，供检查副本一致性使用
     */
    String localValue(String key) {
        state.getLock().lock();
        try {
            return state.getKvMap().get(key);
        } finally {
            state.getLock().unlock();
        }
    }

    public void kill() {
        state.getDead().set(1);
    }

    public boolean killed() {
        return state.getDead().get() == 1;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

}
