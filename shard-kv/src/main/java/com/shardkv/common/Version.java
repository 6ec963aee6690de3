package com.shardkv.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * key 的版本，先比较 epoch 再比较 counter
 * 每次启动 KVServer 都会分配一个更大的 epoch，重启后的 primary 写入的版本总是比之前的新
 *
 * @author sakame
 * @version 1.0
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Version implements Comparable<Version>, Serializable {

    /**
     * 写入该版本的 primary 实例
     */
    private long epoch;

    /**
     * 该 key 被写入的次数
     */
    private long counter;

    public static Version initial() {
        return new Version(0, 0);
    }

    /**
     * @param epoch 当前 primary 的 epoch
     * @return 下一个版本
     */
    public Version next(long epoch) {
        return new Version(epoch, counter + 1);
    }

    @Override
    public int compareTo(Version o) {
        int cmp = Long.compare(epoch, o.epoch);
        return cmp != 0 ? cmp : Long.compare(counter, o.counter);
    }

}
