package com.shardkv.serializer;

/**
 * 序列化器常量
 *
 * @author sakame
 * @version 1.0
 */
public interface SerializerKeys {

    String JDK = "jdk";

    String KRYO = "kryo";

    String HESSIAN = "hessian";

}
