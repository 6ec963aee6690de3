package com.shardkv.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * @author sakame
 * @version 1.0
 */
class ChannelTest {

    @Test
    void testUnbufferedHandOff() throws InterruptedException {
        Channel<Integer> channel = new Channel<>();
        Assertions.assertFalse(channel.isBuffered());
        // 没有读者时写入超时
        Assertions.assertFalse(channel.write(1, 50));

        Thread writer = new Thread(() -> channel.writeOne(42));
        writer.start();
        Assertions.assertEquals(42, channel.readOne());
        writer.join();
    }

    @Test
    void testBufferedReadTimesOut() {
        Channel<String> channel = new Channel<>(1);
        Assertions.assertTrue(channel.isBuffered());
        Assertions.assertNull(channel.read());

        Assertions.assertTrue(channel.write("a"));
        // 已满
        Assertions.assertFalse(channel.write("b", 10));
        Assertions.assertEquals("a", channel.read());
    }

}
