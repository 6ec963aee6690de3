package com.shardkv.service;

import com.shardkv.model.dto.GetArgs;
import com.shardkv.model.dto.GetReply;
import com.shardkv.model.dto.PutAppendArgs;
import com.shardkv.model.dto.PutAppendReply;

/**
 * KVServer 对外提供的 rpc，分别对应 KVServer.Get、KVServer.Put、KVServer.Append
 *
 * @author sakame
 * @version 1.0
 */
public interface KVServerService {

    /**
     * 读取 key 的值
     *
     * @param args 请求体
     * @return 响应体，key 不存在时值为空串
     * @throws com.shardkv.exception.RpcTimeoutException 本机不负责该 key
     */
    GetReply get(GetArgs args);

    /**
     * 覆盖写入，非 primary 时转发给 primary
     *
     * @param args 请求体
     * @return 响应体，值为 null
     */
    PutAppendReply put(PutAppendArgs args);

    /**
     * 追加写入，非 primary 时转发给 primary
     *
     * @param args 请求体
     * @return 响应体，值为追加前的值
     */
    PutAppendReply append(PutAppendArgs args);

}
