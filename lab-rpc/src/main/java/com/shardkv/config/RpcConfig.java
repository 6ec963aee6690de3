package com.shardkv.config;

import com.shardkv.constant.RpcConstant;
import com.shardkv.serializer.SerializerKeys;
import com.shardkv.utils.ConfigUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 模拟网络配置，对应 application.properties 中 rpc 前缀的配置项
 *
 * @author sakame
 * @version 1.0
 */
@Data
@Slf4j
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RpcConfig {

    /**
     * 参数与响应在网络上传输时使用的序列化器
     */
    @Builder.Default
    private String serializer = SerializerKeys.KRYO;

    /**
     * 是否可靠，不可靠时会随机延迟和丢弃请求、响应
     */
    @Builder.Default
    private boolean reliable = true;

    /**
     * 不可达时是否长时间等待后再返回失败
     */
    @Builder.Default
    private boolean longDelays = false;

    private static volatile RpcConfig rpcConfig;

    public static RpcConfig getRpcConfig() {
        if (rpcConfig == null) {
            synchronized (RpcConfig.class) {
                if (rpcConfig == null) {
                    rpcConfig = ConfigUtils.loadConfig(RpcConfig.class, RpcConstant.DEFAULT_CONFIG_PREFIX);
                    log.info("rpc init, config = {}", rpcConfig);
                }
            }
        }
        return rpcConfig;
    }

}
