package com.shardkv.utils;

import cn.hutool.core.util.StrUtil;

import java.math.BigInteger;

/**
 * key 到分片、分片到副本的映射，客户端与所有服务端使用同一套计算
 *
 * @author sakame
 * @version 1.0
 */
public class ShardUtils {

    private ShardUtils() {
    }

    /**
     * key 所属分片，全数字的 key 取其数值，否则取各字符码点之和，再对服务器数取模
     *
     * @param key      键值
     * @param nServers 服务器总数
     * @return 分片编号，也是该分片 primary 的编号
     */
    public static int shardOf(String key, int nServers) {
        if (StrUtil.isNotEmpty(key) && key.codePoints().allMatch(Character::isDigit)) {
            // 按码点取数字，兼容辅助平面的数字字符；数值可能超出 long
            StringBuilder digits = new StringBuilder();
            key.codePoints().forEach(cp -> digits.append(Character.digit(cp, 10)));
            return new BigInteger(digits.toString()).mod(BigInteger.valueOf(nServers)).intValue();
        }
        long sum = key.codePoints().asLongStream().sum();
        return (int) (sum % nServers);
    }

    /**
     * 分片的第 offset 个副本，offset 为 0 时即 primary
     *
     * @param shard    分片编号
     * @param offset   副本偏移
     * @param nServers 服务器总数
     * @return 服务器编号
     */
    public static int replicaOf(int shard, int offset, int nServers) {
        return (shard + offset) % nServers;
    }

    /**
     * server 在 shard 副本组中的偏移
     */
    public static int offsetOf(int server, int shard, int nServers) {
        return Math.floorMod(server - shard, nServers);
    }

    public static boolean isPrimary(int server, String key, int nServers) {
        return server == shardOf(key, nServers);
    }

    /**
     * server 是否是 key 所在分片的 primary 或 backup
     */
    public static boolean isResponsible(int server, String key, int nServers, int nReplicas) {
        return offsetOf(server, shardOf(key, nServers), nServers) < nReplicas;
    }

}
