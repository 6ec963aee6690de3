package com.shardkv.model.dto;

import com.shardkv.common.Version;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * primary 同步给 backup 的已执行结果，backup 直接写入不再重新计算
 *
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ReplicateArgs implements Serializable {

    private String key;

    /**
     * 执行后的最终值
     */
    private String value;

    /**
     * primary 为该 key 分配的版本
     */
    private Version version;

    private long clientId;

    private long seqId;

    /**
     * primary 返回给客户端的响应值
     */
    private String reply;

}
