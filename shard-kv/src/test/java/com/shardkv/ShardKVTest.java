package com.shardkv;

import cn.hutool.core.date.StopWatch;
import cn.hutool.core.util.ArrayUtil;
import com.shardkv.config.ShardKVProperties;
import com.shardkv.exception.RpcTimeoutException;
import com.shardkv.model.Channel;
import com.shardkv.utils.ShardUtils;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * 多客户端并发读写整个集群
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ShardKVTest {

    private static final Random random = new Random();

    /**
     * 等待复制追上的时间
     */
    private static final int SETTLE_TIME = 200;

    /**
     * 每个客户端一个线程，全部结束后返回
     *
     * @param application
     * @param clients
     * @param fn          返回是否成功
     * @return 所有客户端是否都成功
     */
    boolean spawnClientsAndWait(ShardKVApplication application, int clients, BiFunction<Integer, Clerk, Boolean> fn) {
        Channel<Boolean>[] ca = new Channel[clients];
        for (int i = 0; i < clients; i++) {
            ca[i] = new Channel<>(1);
            final int me = i;
            new Thread(() -> runClient(application, me, ca[me], fn)).start();
        }
        boolean ok = true;
        for (int i = 0; i < clients; i++) {
            if (!ca[i].readOne()) {
                log.error("client {} failed", i);
                ok = false;
            }
        }
        return ok;
    }

    void runClient(ShardKVApplication application, int me, Channel<Boolean> ca, BiFunction<Integer, Clerk, Boolean> fn) {
        boolean ok = false;
        try {
            Clerk clerk = application.makeClient();
            ok = fn.apply(me, clerk);
        } catch (RuntimeException e) {
            log.error("client {} stops on error", me, e);
        } finally {
            ca.writeOne(ok);
        }
    }

    /**
     * 在信号量为 0 时一直在服务器之间制造随机分区
     */
    void partitioner(ShardKVApplication application, Channel<Boolean> ch, AtomicInteger done) {
        while (done.get() == 0) {
            int n = application.getNServers();
            Integer[][] pa = new Integer[][]{new Integer[0], new Integer[0]};
            for (int j = 0; j < n; j++) {
                int side = random.nextInt(2);
                pa[side] = ArrayUtil.append(pa[side], j);
            }
            int[] p1 = Arrays.stream(pa[0]).mapToInt(Integer::intValue).toArray();
            int[] p2 = Arrays.stream(pa[1]).mapToInt(Integer::intValue).toArray();
            application.partition(p1, p2);
            try {
                Thread.sleep(random.nextInt(200));
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }
        ch.writeOne(true);
    }

    /**
     * 检查每一次 append 的值是否恰好出现一次且顺序正确
     */
    boolean checkClntAppends(int client, String value, int count) {
        int lastOff = -1;
        boolean ok = true;
        for (int i = 0; i < count; i++) {
            String wanted = "x " + client + " " + i + " y";
            int off = value.indexOf(wanted, lastOff + 1);
            if (off < 0) {
                log.error("{} missing element {} in Append result {}", client, wanted, value);
                return false;
            }
            if (value.lastIndexOf(wanted) != off) {
                log.error("duplicate element {} in Append result", wanted);
                ok = false;
            }
            lastOff = off;
        }
        return ok;
    }

    /**
     * 检查 key 的所有副本是否一致
     */
    boolean checkReplicas(ShardKVApplication application, String key) {
        int n = application.getNServers();
        int shard = ShardUtils.shardOf(key, n);
        String primaryValue = application.getServer(shard).localValue(key);
        for (int offset = 1; offset < application.getNReplicas(); offset++) {
            int backup = ShardUtils.replicaOf(shard, offset, n);
            String value = application.getServer(backup).localValue(key);
            if (!primaryValue.equals(value)) {
                log.error("key {} diverges: primary {} has {}, backup {} has {}", key, shard, primaryValue, backup, value);
                return false;
            }
        }
        return true;
    }

    void genericTest(int clients, int servers, int replicas, boolean unreliable, boolean partitions, boolean randomKeys) throws InterruptedException {
        String title = "Test: ";
        if (unreliable) {
            title += "unreliable net, ";
        }
        if (partitions) {
            title += "partitions, ";
        }
        if (randomKeys) {
            title += "random keys, ";
        }
        title += clients > 1 ? "many clients" : "one client";
        log.info(title);

        ShardKVApplication application = new ShardKVApplication();
        application.init(servers, replicas, unreliable, new ShardKVProperties());
        Clerk checker = application.makeClient();

        AtomicInteger doneClients = new AtomicInteger(0);
        AtomicInteger donePartitioner = new AtomicInteger(0);
        Channel<Integer>[] counts = new Channel[clients];
        for (int i = 0; i < clients; i++) {
            counts[i] = new Channel<>(1);
        }
        Channel<Boolean> partitionerCh = new Channel<>(1);
        Channel<Boolean> clientsCh = new Channel<>(1);

        BiFunction<Integer, Clerk, Boolean> function = (me, clerk) -> {
            int cnt = 0;
            String last = "";
            boolean ok = true;
            if (!randomKeys) {
                clerk.put(String.valueOf(me), last);
            }
            while (doneClients.get() == 0) {
                String key = randomKeys ? String.valueOf(random.nextInt(clients)) : String.valueOf(me);
                String value = "x " + me + " " + cnt + " y";
                int dice = random.nextInt(1000);
                if (dice < 500) {
                    String pre = clerk.append(key, value);
                    if (!randomKeys) {
                        // append 返回的旧值就是上一次的结果
                        if (!pre.equals(last)) {
                            log.error("client {} append got {}, expected {}", me, pre, last);
                            ok = false;
                        }
                        last = last + value;
                    }
                    cnt++;
                } else if (randomKeys && dice < 600) {
                    clerk.put(key, value);
                    cnt++;
                } else {
                    String ret = clerk.get(key);
                    if (!randomKeys && !ret.equals(last)) {
                        log.error("client {} get {}, expected {}", me, ret, last);
                        ok = false;
                    }
                }
            }
            counts[me].writeOne(cnt);
            return ok;
        };
        new Thread(() -> clientsCh.writeOne(spawnClientsAndWait(application, clients, function))).start();

        if (partitions) {
            Thread.sleep(500);
            new Thread(() -> partitioner(application, partitionerCh, donePartitioner)).start();
        }
        Thread.sleep(2000);

        doneClients.set(1);
        donePartitioner.set(1);
        if (partitions) {
            partitionerCh.readOne();
            application.connectAll();
        }
        Assertions.assertTrue(clientsCh.readOne());

        for (int j = 0; j < clients; j++) {
            int count = counts[j].readOne();
            Assertions.assertTrue(count > 0);
            if (!randomKeys) {
                String value = checker.get(String.valueOf(j));
                Assertions.assertTrue(checkClntAppends(j, value, count));
            }
        }

        application.setUnreliable(false);
        Thread.sleep(SETTLE_TIME);
        for (int j = 0; j < clients; j++) {
            Assertions.assertTrue(checkReplicas(application, String.valueOf(j)));
        }
        log.info("{} ops, {} rpcs", application.getOpCount(), application.getRpcTotal());
        application.cleanup();
    }

    @Test
    @Order(1)
    void testBasic() throws InterruptedException {
        genericTest(1, 5, 2, false, false, false);
    }

    @Test
    @Order(2)
    void testSpeed() {
        ShardKVApplication application = new ShardKVApplication();
        application.init(3, 2, false);
        Clerk clerk = application.makeClient();
        log.info("Test: ops complete fast enough");

        final int numOps = 200;
        clerk.put("x", "");
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        for (int i = 0; i < numOps; i++) {
            clerk.append("x", "x 0 " + i + " y");
        }
        stopWatch.stop();
        log.info("time per operation: {} ms", stopWatch.getTotalTimeMillis() / numOps);
        Assertions.assertTrue(checkClntAppends(0, clerk.get("x"), numOps));
        Assertions.assertTrue(stopWatch.getTotalTimeMillis() < 10_000);
        application.cleanup();
    }

    @Test
    @Order(3)
    void testConcurrent() throws InterruptedException {
        genericTest(5, 5, 3, false, false, false);
    }

    @Test
    @Order(4)
    void testUnreliable() throws InterruptedException {
        genericTest(5, 5, 2, true, false, false);
    }

    @Test
    @Order(5)
    void testRandomKeys() throws InterruptedException {
        genericTest(5, 5, 3, false, false, true);
    }

    @Test
    @Order(6)
    void testUnreliableRandomKeys() throws InterruptedException {
        genericTest(5, 5, 3, true, false, true);
    }

    @Test
    @Order(7)
    void testPartitions() throws InterruptedException {
        genericTest(5, 5, 2, false, true, false);
    }

    @Test
    @Order(8)
    void testCrashedServer() {
        ShardKVProperties properties = new ShardKVProperties();
        properties.setClerkTimeout(800);
        properties.setForwardTimeout(300);
        ShardKVApplication application = new ShardKVApplication();
        application.init(3, 2, false, properties);
        Clerk clerk = application.makeClient();
        log.info("Test: a crashed server");

        // key "3" 属于分片 0，key "5" 属于分片 2，server 0 是前者的 primary、后者的 backup
        clerk.put("3", "a");
        clerk.put("5", "b");
        application.shutdownServer(0);

        // backup 仍然可以读
        Assertions.assertEquals("a", clerk.get("3"));
        // primary 宕机后无法写入
        Assertions.assertThrows(RpcTimeoutException.class, () -> clerk.append("3", "c"));
        // 另一个分片不受影响
        Assertions.assertEquals("b", clerk.append("5", "c"));
        Assertions.assertEquals("bc", clerk.get("5"));
        application.cleanup();
    }

}
