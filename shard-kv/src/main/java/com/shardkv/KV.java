package com.shardkv;

import com.shardkv.common.CommandType;
import com.shardkv.common.Version;

import java.util.HashMap;
import java.util.Map;

/**
 * 单机键值存储，不加锁，由 KVServer 在持锁时调用
 * 每个 key 带一个版本，primary 每次写入时用自己的 epoch 生成下一个版本，backup 只接受更新的版本
 *
 * @author sakame
 * @version 1.0
 */
public class KV {

    private final Map<String, String> kvMap = new HashMap<>();

    private final Map<String, Version> versions = new HashMap<>();

    /**
     * 所属 KVServer 实例的 epoch
     */
    private final long epoch;

    public KV(long epoch) {
        this.epoch = epoch;
    }

    /**
     * @return key 不存在时返回空串
     */
    public String get(String key) {
        return kvMap.getOrDefault(key, "");
    }

    public Version getVersion(String key) {
        return versions.getOrDefault(key, Version.initial());
    }

    /**
     * 覆盖写入
     */
    public void put(String key, String value) {
        kvMap.put(key, value);
        versions.put(key, getVersion(key).next(epoch));
    }

    /**
     * 在旧值后拼接
     *
     * @return 拼接前的值
     */
    public String append(String key, String value) {
        String pre = get(key);
        put(key, pre + value);
        return pre;
    }

    /**
     * 执行一条写命令
     *
     * @return put 返回 null，append 返回拼接前的值
     */
    public String opt(CommandType type, String key, String value) {
        switch (type) {
            case PUT:
                put(key, value);
                return null;
            case APPEND:
                return append(key, value);
            default:
                throw new IllegalArgumentException("not a mutation: " + type);
        }
    }

    /**
     * 写入 primary 计算好的值
     *
     * @return 版本不比本地新时不写入，返回 false
     */
    public boolean install(String key, String value, Version version) {
        if (version.compareTo(getVersion(key)) <= 0) {
            return false;
        }
        kvMap.put(key, value);
        versions.put(key, version);
        return true;
    }

}
