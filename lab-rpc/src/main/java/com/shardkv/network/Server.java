package com.shardkv.network;

import com.shardkv.model.RpcRequest;
import com.shardkv.model.RpcResponse;
import com.shardkv.serializer.Serializer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模拟网络中的一台服务器，持有若干服务
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class Server {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Service> services = new HashMap<>();

    /**
     * 收到的 rpc 个数
     */
    private int count;

    public void addService(Service service) {
        lock.lock();
        try {
            services.put(service.getName(), service);
        } finally {
            lock.unlock();
        }
    }

    public RpcResponse dispatch(RpcRequest request, Serializer serializer) {
        Service service;
        Set<String> known;
        lock.lock();
        try {
            count++;
            service = services.get(request.getServiceName());
            known = new HashSet<>(services.keySet());
        } finally {
            lock.unlock();
        }

        if (service == null) {
            log.error("unknown service {} in {}.{}, expecting one of {}",
                    request.getServiceName(), request.getServiceName(), request.getMethodName(), known);
            return RpcResponse.fail("unknown service " + request.getServiceName());
        }
        return service.dispatch(request.getMethodName(), request.getArgs(), serializer);
    }

    public int getCount() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

}
