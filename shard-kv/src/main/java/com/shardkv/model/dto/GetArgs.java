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
public class GetArgs implements Serializable {

    private String key;

}
