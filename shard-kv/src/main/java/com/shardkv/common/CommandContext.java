package com.shardkv.common;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 命令上下文，KVServer 为每个客户端记录最后一次执行的写命令
 *
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
public class CommandContext {

    /**
     * 已执行的最大序列 id
     */
    private long seqId;

    /**
     * 该序列 id 对应的响应值，put 为 null，append 为追加前的值
     */
    private String reply;

}
