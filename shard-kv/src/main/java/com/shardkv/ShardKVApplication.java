package com.shardkv;

import cn.hutool.core.lang.Assert;
import cn.hutool.core.util.IdUtil;
import com.shardkv.config.KVConfig;
import com.shardkv.config.ShardKVProperties;
import com.shardkv.constant.KVConstant;
import com.shardkv.network.ClientEnd;
import com.shardkv.network.Network;
import com.shardkv.network.Server;
import com.shardkv.network.Service;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * 集群装配：创建网络、服务器与客户端，并提供宕机、分区、断开客户端等故障注入
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class ShardKVApplication {

    private final KVConfig config = new KVConfig();

    /**
     * 客户端 => 到各服务器的端点名称
     */
    private final Map<Clerk, String[]> clientEnds = new HashMap<>();

    /**
     * 按 application.properties 初始化
     */
    public void init() {
        ShardKVProperties properties = ShardKVProperties.load();
        init(properties.getServers(), properties.getReplicas(), properties.isUnreliable(), properties);
    }

    public void init(int nServers, int nReplicas, boolean unreliable) {
        init(nServers, nReplicas, unreliable, ShardKVProperties.load());
    }

    public void init(int nServers, int nReplicas, boolean unreliable, ShardKVProperties properties) {
        Assert.isTrue(nServers > 0, "server count must be positive, got {}", nServers);
        Assert.isTrue(nReplicas >= 1 && nReplicas <= nServers,
                "replicas per shard must be in [1, {}], got {}", nServers, nReplicas);

        config.setNServers(nServers);
        config.setNReplicas(nReplicas);
        config.setProperties(properties);
        config.setKvServers(new KVServer[nServers]);
        config.setConnected(new boolean[nServers][nServers]);
        Network network = new Network();
        network.setReliable(!unreliable);
        config.setNetwork(network);
        log.info("init {} servers, {} replicas per shard, unreliable = {}", nServers, nReplicas, unreliable);

        for (int i = 0; i < nServers; i++) {
            startServer(i);
        }
        connectAll();
    }

    /**
     * 启动一个 kvServer，新的实例不保留任何之前的数据
     *
     * @param server 服务器编号
     */
    public void startServer(int server) {
        config.getLock().lock();
        try {
            KVServer kvServer = new KVServer(server, config);
            config.getKvServers()[server] = kvServer;
            Server rpcServer = new Server();
            rpcServer.addService(new Service(kvServer));
            config.getNetwork().addServer(server, rpcServer);
            config.getRunningServers().add(server);
        } finally {
            config.getLock().unlock();
        }
        log.info("start kv server {}", server);
    }

    /**
     * 关闭一个 kvServer，之后发往它的请求和复制都会被跳过
     *
     * @param server 服务器编号
     */
    public void shutdownServer(int server) {
        config.getLock().lock();
        try {
            config.getRunningServers().remove(server);
            config.getNetwork().deleteServer(server);
            KVServer kvServer = config.getKvServers()[server];
            if (kvServer != null) {
                kvServer.kill();
            }
        } finally {
            config.getLock().unlock();
        }
        log.info("shutdown kv server {}", server);
    }

    /**
     * 根据 p1 和 p2 两个数组制造服务器之间的分区，只影响服务器间的转发
     *
     * @param p1 第一个分区
     * @param p2 第二个分区
     */
    public void partition(int[] p1, int[] p2) {
        config.getLock().lock();
        try {
            setLinks(p1, p1, true);
            setLinks(p2, p2, true);
            setLinks(p1, p2, false);
            setLinks(p2, p1, false);
        } finally {
            config.getLock().unlock();
        }
        log.info("partition {} | {}", Arrays.toString(p1), Arrays.toString(p2));
    }

    /**
     * 恢复服务器之间的所有连接
     */
    public void connectAll() {
        config.getLock().lock();
        try {
            setLinks(all(), all(), true);
        } finally {
            config.getLock().unlock();
        }
    }

    private void setLinks(int[] from, int[] to, boolean connected) {
        for (int i : from) {
            for (int j : to) {
                config.getConnected()[i][j] = connected;
            }
        }
    }

    /**
     * 构建一个 client，到每台服务器各有一个可用端点
     *
     * @return client
     */
    public Clerk makeClient() {
        Network network = config.getNetwork();
        int n = config.getNServers();
        ClientEnd[] ends = new ClientEnd[n];
        String[] endNames = new String[n];
        for (int i = 0; i < n; i++) {
            endNames[i] = KVConstant.CLIENT_END_PREFIX + "-" + IdUtil.fastSimpleUUID();
            ends[i] = network.makeEnd(endNames[i]);
            network.connect(endNames[i], i);
            network.enable(endNames[i], true);
        }

        Clerk clerk = new Clerk(ends, config);
        config.getLock().lock();
        try {
            clientEnds.put(clerk, endNames);
        } finally {
            config.getLock().unlock();
        }
        return clerk;
    }

    public void connectClient(Clerk clerk, int[] to) {
        setClientEnds(clerk, to, true);
    }

    public void disconnectClient(Clerk clerk, int[] from) {
        setClientEnds(clerk, from, false);
    }

    private void setClientEnds(Clerk clerk, int[] servers, boolean enable) {
        String[] endNames;
        config.getLock().lock();
        try {
            endNames = clientEnds.get(clerk);
        } finally {
            config.getLock().unlock();
        }
        Assert.notNull(endNames, "unknown client {}", clerk.getClientId());
        for (int server : servers) {
            config.getNetwork().enable(endNames[server], enable);
        }
    }

    public void setUnreliable(boolean unreliable) {
        config.getNetwork().setReliable(!unreliable);
    }

    public KVServer getServer(int server) {
        return config.getServer(server);
    }

    public int getNServers() {
        return config.getNServers();
    }

    public int getNReplicas() {
        return config.getNReplicas();
    }

    /**
     * @return 成功执行的读写操作个数
     */
    public int getOpCount() {
        return config.getOpCount().get();
    }

    /**
     * @return 网络上发起过的 rpc 个数
     */
    public int getRpcTotal() {
        return config.getNetwork().getTotalCount();
    }

    public int[] all() {
        return IntStream.range(0, config.getNServers()).toArray();
    }

    public void cleanup() {
        for (int i = 0; i < config.getNServers(); i++) {
            KVServer kvServer = config.getServer(i);
            if (kvServer != null) {
                kvServer.kill();
            }
        }
        config.getNetwork().cleanup();
    }

}
