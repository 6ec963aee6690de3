package com.shardkv.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Put 与 Append 共用的请求体
 *
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PutAppendArgs implements Serializable {

    private String key;

    private String value;

    /**
     * 客户端 id
     */
    private long clientId;

    /**
     * 序列 id，同一客户端严格递增
     */
    private long seqId;

}
