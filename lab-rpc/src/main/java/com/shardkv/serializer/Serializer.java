package com.shardkv.serializer;

import java.io.IOException;

/**
 * 序列化器
 *
 * @author sakame
 * @version 1.0
 */
public interface Serializer {

    /**
     * 序列化
     *
     * @param object 对象，可以为 null
     * @param <T>
     * @return 字节数组
     * @throws IOException
     */
    <T> byte[] serialize(T object) throws IOException;

    /**
     * 反序列化
     *
     * @param bytes 字节数组
     * @param type  目标类型
     * @param <T>
     * @return 对象
     * @throws IOException
     */
    <T> T deserialize(byte[] bytes, Class<T> type) throws IOException;

}
