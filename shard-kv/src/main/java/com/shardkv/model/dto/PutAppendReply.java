package com.shardkv.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PutAppendReply implements Serializable {

    /**
     * put 为 null，append 为追加前的值
     */
    private String value;

}
