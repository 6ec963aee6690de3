package com.shardkv.model;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * 线程间通信通道
 * 无容量时为同步通道，写入会阻塞直到被读取；有容量时为有界队列，读写都带超时
 *
 * @author sakame
 * @version 1.0
 */
public class Channel<T> {

    private static final long DEFAULT_WAIT_MILLIS = 100;

    private final BlockingQueue<T> queue;

    private final boolean buffered;

    public Channel() {
        queue = new SynchronousQueue<>();
        buffered = false;
    }

    public Channel(int capacity) {
        queue = new LinkedBlockingQueue<>(capacity);
        buffered = true;
    }

    /**
     * 阻塞写入，直到对端取走（同步通道）或队列有空位
     *
     * @param o 消息
     */
    public void writeOne(T o) {
        try {
            queue.put(o);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * 阻塞读取，直到有消息
     *
     * @return 消息
     */
    public T readOne() {
        try {
            return queue.take();
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * 限时写入
     *
     * @param o 消息
     * @return 超时未写入返回 false
     */
    public boolean write(T o) {
        return write(o, DEFAULT_WAIT_MILLIS);
    }

    public boolean write(T o, long millis) {
        try {
            return queue.offer(o, millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * 限时读取
     *
     * @return 超时返回 null
     */
    public T read() {
        return read(DEFAULT_WAIT_MILLIS);
    }

    public T read(long millis) {
        try {
            return queue.poll(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    public boolean isBuffered() {
        return buffered;
    }

}
