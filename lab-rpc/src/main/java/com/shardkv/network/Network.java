package com.shardkv.network;

import cn.hutool.core.lang.Assert;
import cn.hutool.core.thread.ThreadFactoryBuilder;
import cn.hutool.core.util.RandomUtil;
import com.shardkv.config.RpcConfig;
import com.shardkv.constant.RpcConstant;
import com.shardkv.model.RpcRequest;
import com.shardkv.model.RpcResponse;
import com.shardkv.serializer.Serializer;
import com.shardkv.serializer.SerializerFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内模拟网络
 * 端点（ClientEnd）通过 connect 指向某台服务器，enable 控制端点是否可用，用于制造故障和分区
 * 参数和响应都经过序列化，调用方与服务端不共享对象
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class Network {

    private final ReentrantLock lock = new ReentrantLock();

    private final Serializer serializer;

    private boolean reliable;

    private boolean longDelays;

    /**
     * 端点名称 => 端点
     */
    private final Map<String, ClientEnd> ends = new HashMap<>();

    /**
     * 端点名称 => 是否可用
     */
    private final Map<String, Boolean> enabled = new HashMap<>();

    /**
     * 服务器名称 => 服务器
     */
    private final Map<Object, Server> servers = new HashMap<>();

    /**
     * 端点名称 => 服务器名称
     */
    private final Map<String, Object> connections = new HashMap<>();

    /**
     * 所有端点发起过的 rpc 个数
     */
    private final AtomicInteger totalCount = new AtomicInteger(0);

    /**
     * 处理请求的线程池，服务端处理中可能再发起 rpc，所以不限制线程数
     */
    private final ExecutorService executor = Executors.newCachedThreadPool(
            ThreadFactoryBuilder.create().setNamePrefix("lab-rpc-").setDaemon(true).build());

    public Network() {
        this(RpcConfig.getRpcConfig());
    }

    public Network(RpcConfig rpcConfig) {
        this.serializer = SerializerFactory.getInstance(rpcConfig.getSerializer());
        this.reliable = rpcConfig.isReliable();
        this.longDelays = rpcConfig.isLongDelays();
    }

    public Serializer getSerializer() {
        return serializer;
    }

    /**
     * 新建一个端点，新端点不连接任何服务器且不可用
     *
     * @param endName 端点名称，不能重复
     * @return 端点
     */
    public ClientEnd makeEnd(String endName) {
        lock.lock();
        try {
            Assert.isFalse(ends.containsKey(endName), "duplicate end name {}", endName);
            ClientEnd end = new ClientEnd(endName, this);
            ends.put(endName, end);
            enabled.put(endName, false);
            return end;
        } finally {
            lock.unlock();
        }
    }

    public void deleteEnd(String endName) {
        lock.lock();
        try {
            ends.remove(endName);
            enabled.remove(endName);
            connections.remove(endName);
        } finally {
            lock.unlock();
        }
    }

    public void addServer(Object serverName, Server server) {
        lock.lock();
        try {
            servers.put(serverName, server);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除服务器，之后发往它的请求都会失败，正在处理的请求也会被视为失败
     *
     * @param serverName 服务器名称
     */
    public void deleteServer(Object serverName) {
        lock.lock();
        try {
            servers.remove(serverName);
        } finally {
            lock.unlock();
        }
    }

    public void connect(String endName, Object serverName) {
        lock.lock();
        try {
            connections.put(endName, serverName);
        } finally {
            lock.unlock();
        }
    }

    public void enable(String endName, boolean enable) {
        lock.lock();
        try {
            if (ends.containsKey(endName)) {
                enabled.put(endName, enable);
            }
        } finally {
            lock.unlock();
        }
    }

    public void setReliable(boolean reliable) {
        lock.lock();
        try {
            this.reliable = reliable;
        } finally {
            lock.unlock();
        }
    }

    public void setLongDelays(boolean longDelays) {
        lock.lock();
        try {
            this.longDelays = longDelays;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 某台服务器收到的 rpc 个数
     *
     * @param serverName 服务器名称
     * @return 不存在时返回 0
     */
    public int getCount(Object serverName) {
        Server server;
        lock.lock();
        try {
            server = servers.get(serverName);
        } finally {
            lock.unlock();
        }
        return server == null ? 0 : server.getCount();
    }

    public int getTotalCount() {
        return totalCount.get();
    }

    public void cleanup() {
        executor.shutdownNow();
    }

    /**
     * 投递一个请求并等待响应
     * 端点不可用或未连接时随机等待后返回失败；不可靠模式下随机延迟并丢弃部分请求和响应；
     * 等待期间若服务器被删除或端点被停用，同样返回失败
     *
     * @param request 请求
     * @return 响应
     */
    RpcResponse processRequest(RpcRequest request) {
        String endName = request.getEndName();
        boolean endEnabled;
        Object serverName;
        Server server = null;
        boolean isReliable;
        boolean isLongDelays;
        lock.lock();
        try {
            endEnabled = Boolean.TRUE.equals(enabled.get(endName));
            serverName = connections.get(endName);
            if (serverName != null) {
                server = servers.get(serverName);
            }
            isReliable = reliable;
            isLongDelays = longDelays;
        } finally {
            lock.unlock();
        }
        totalCount.incrementAndGet();

        if (!endEnabled || server == null) {
            // 模拟无法连接时的超时
            sleep(RandomUtil.randomInt(isLongDelays ? RpcConstant.LONG_TIMEOUT : RpcConstant.SHORT_TIMEOUT));
            return RpcResponse.fail(String.format("%s cannot reach %s", endName, serverName));
        }

        if (!isReliable) {
            sleep(RandomUtil.randomInt(RpcConstant.UNRELIABLE_MAX_DELAY));
            if (RandomUtil.randomInt(1000) < RpcConstant.DROP_PERMILLE) {
                log.debug("drop request {}.{} from {}", request.getServiceName(), request.getMethodName(), endName);
                return RpcResponse.fail("request dropped");
            }
        }

        final Server target = server;
        Future<RpcResponse> future = executor.submit(() -> target.dispatch(request, serializer));
        RpcResponse response = null;
        while (response == null) {
            try {
                response = future.get(RpcConstant.DEAD_CHECK_INTERVAL, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (isServerDead(endName, serverName, target)) {
                    return RpcResponse.fail(String.format("%s is gone", serverName));
                }
            } catch (ExecutionException e) {
                log.error("dispatch of {}.{} to {} failed", request.getServiceName(), request.getMethodName(), serverName, e.getCause());
                return RpcResponse.fail(String.valueOf(e.getCause()));
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }

        if (isServerDead(endName, serverName, target)) {
            return RpcResponse.fail(String.format("%s is gone", serverName));
        }
        if (response.isOk() && !isReliable && RandomUtil.randomInt(1000) < RpcConstant.DROP_PERMILLE) {
            log.debug("drop reply of {}.{} to {}", request.getServiceName(), request.getMethodName(), endName);
            return RpcResponse.fail("reply dropped");
        }
        return response;
    }

    /**
     * 端点被停用或删除、服务器被删除或替换，都视为服务器已不可达
     */
    private boolean isServerDead(String endName, Object serverName, Server server) {
        lock.lock();
        try {
            return !Boolean.TRUE.equals(enabled.get(endName)) || servers.get(serverName) != server;
        } finally {
            lock.unlock();
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

}
