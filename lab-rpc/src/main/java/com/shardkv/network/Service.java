package com.shardkv.network;

import cn.hutool.core.util.StrUtil;
import com.shardkv.exception.RpcTimeoutException;
import com.shardkv.model.RpcResponse;
import com.shardkv.serializer.Serializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/**
 * 把一个对象包装成可被远程调用的服务
 * 服务名取类的简单名称，方法 Foo 对应对象上只有一个参数且有返回值的 public 方法 foo
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class Service {

    private final String name;

    private final Object receiver;

    private final Map<String, Method> methods = new HashMap<>();

    public Service(Object receiver) {
        this.receiver = receiver;
        this.name = receiver.getClass().getSimpleName();
        for (Method method : receiver.getClass().getMethods()) {
            if (method.getDeclaringClass() == Object.class
                    || Modifier.isStatic(method.getModifiers())
                    || method.getParameterCount() != 1
                    || method.getReturnType() == void.class) {
                continue;
            }
            methods.put(method.getName(), method);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * 反序列化参数，反射调用方法并序列化返回值
     * 方法抛出超时类异常时以失败响应返回，其他异常记录后同样以失败响应返回
     *
     * @param methodName 方法名称
     * @param args       序列化后的参数
     * @param serializer 序列化器
     * @return 响应
     */
    public RpcResponse dispatch(String methodName, byte[] args, Serializer serializer) {
        Method method = methods.get(StrUtil.lowerFirst(methodName));
        if (method == null) {
            log.error("unknown method {} in {}, expecting one of {}", methodName, name, methods.keySet());
            return RpcResponse.fail(String.format("unknown method %s.%s", name, methodName));
        }

        try {
            Object arg = serializer.deserialize(args, method.getParameterTypes()[0]);
            Object reply = method.invoke(receiver, arg);
            return RpcResponse.success(serializer.serialize(reply));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof RpcTimeoutException) {
                log.debug("{}.{} timed out: {}", name, methodName, cause.getMessage());
            } else {
                log.error("{}.{} failed", name, methodName, cause);
            }
            return RpcResponse.fail(String.valueOf(cause.getMessage()));
        } catch (IOException | IllegalAccessException e) {
            log.error("fail to dispatch {}.{}", name, methodName, e);
            return RpcResponse.fail(e.getMessage());
        }
    }

}
