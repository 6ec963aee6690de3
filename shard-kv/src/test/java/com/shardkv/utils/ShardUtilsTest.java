package com.shardkv.utils;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * @author sakame
 * @version 1.0
 */
class ShardUtilsTest {

    @Test
    void testNumericKeysUseTheirValue() {
        Assertions.assertEquals(2, ShardUtils.shardOf("5", 3));
        Assertions.assertEquals(0, ShardUtils.shardOf("0", 3));
        Assertions.assertEquals(1, ShardUtils.shardOf("007", 3));
        // 超过 long 的数值
        Assertions.assertEquals(0, ShardUtils.shardOf("123456789012345678901234567890", 10));
        Assertions.assertEquals(1, ShardUtils.shardOf("99999999999999999999", 7));
    }

    @Test
    void testDigitsOutsideTheBasicPlane() {
        // U+1D7D5 MATHEMATICAL BOLD DIGIT SEVEN
        String boldSeven = new String(Character.toChars(0x1D7D5));
        Assertions.assertEquals(1, ShardUtils.shardOf(boldSeven, 3));
        Assertions.assertEquals(2, ShardUtils.shardOf("1" + boldSeven, 5));
        // 全角数字
        Assertions.assertEquals(2, ShardUtils.shardOf("\uFF15", 3));
    }

    @Test
    void testOtherKeysUseCodePointSum() {
        // 'a' + 'b' = 97 + 98 = 195
        Assertions.assertEquals(195 % 7, ShardUtils.shardOf("ab", 7));
        // 负号不是数字
        Assertions.assertEquals(('-' + '1') % 5, ShardUtils.shardOf("-1", 5));
        Assertions.assertEquals(0, ShardUtils.shardOf("", 3));
        Assertions.assertEquals(0x1F600 % 4, ShardUtils.shardOf("😀", 4));
    }

    @Test
    void testShardIsStable() {
        for (String key : new String[]{"x", "42", "hello world", "x 0 1 y"}) {
            int shard = ShardUtils.shardOf(key, 5);
            for (int i = 0; i < 10; i++) {
                Assertions.assertEquals(shard, ShardUtils.shardOf(key, 5));
            }
            Assertions.assertTrue(shard >= 0 && shard < 5);
        }
    }

    @Test
    void testReplicaSet() {
        // n = 3, r = 2, key "5" => primary 2, backup 0
        Assertions.assertEquals(2, ShardUtils.replicaOf(2, 0, 3));
        Assertions.assertEquals(0, ShardUtils.replicaOf(2, 1, 3));
        Assertions.assertTrue(ShardUtils.isPrimary(2, "5", 3));
        Assertions.assertFalse(ShardUtils.isPrimary(0, "5", 3));
        Assertions.assertTrue(ShardUtils.isResponsible(2, "5", 3, 2));
        Assertions.assertTrue(ShardUtils.isResponsible(0, "5", 3, 2));
        Assertions.assertFalse(ShardUtils.isResponsible(1, "5", 3, 2));
        Assertions.assertEquals(2, ShardUtils.offsetOf(1, 4, 5));
    }

}
