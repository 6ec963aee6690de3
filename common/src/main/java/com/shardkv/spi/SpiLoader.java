package com.shardkv.spi;

import cn.hutool.core.io.IoUtil;
import cn.hutool.core.io.resource.ResourceUtil;
import cn.hutool.core.util.ReflectUtil;
import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 key=实现类 的格式加载扩展实现
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class SpiLoader {

    /**
     * 接口名 => (key => 实现类)
     */
    private static final Map<String, Map<String, Class<?>>> loaderMap = new ConcurrentHashMap<>();

    /**
     * 实现类名 => 实例
     */
    private static final Map<String, Object> instanceCache = new ConcurrentHashMap<>();

    private static final String RPC_SYSTEM_SPI_DIR = "META-INF/rpc/system/";

    private static final String RPC_CUSTOM_SPI_DIR = "META-INF/rpc/custom/";

    /**
     * 后扫描的目录会覆盖先扫描的同名 key
     */
    private static final String[] SCAN_DIRS = new String[]{RPC_SYSTEM_SPI_DIR, RPC_CUSTOM_SPI_DIR};

    /**
     * 加载某个接口的全部实现
     *
     * @param loadClass 接口
     * @return key => 实现类
     */
    public static Map<String, Class<?>> load(Class<?> loadClass) {
        log.info("load SPI of type {}", loadClass.getName());
        Map<String, Class<?>> keyClassMap = new HashMap<>();
        for (String scanDir : SCAN_DIRS) {
            List<URL> resources = ResourceUtil.getResources(scanDir + loadClass.getName());
            for (URL resource : resources) {
                try (BufferedReader reader = IoUtil.getReader(resource.openStream(), StandardCharsets.UTF_8)) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        line = StrUtil.trim(line);
                        if (StrUtil.isEmpty(line) || line.startsWith("#")) {
                            continue;
                        }
                        String[] strArray = line.split("=");
                        if (strArray.length > 1) {
                            keyClassMap.put(StrUtil.trim(strArray[0]), Class.forName(StrUtil.trim(strArray[1])));
                        }
                    }
                } catch (Exception e) {
                    log.error("spi resource load error, resource = {}", resource, e);
                }
            }
        }
        loaderMap.put(loadClass.getName(), keyClassMap);
        return keyClassMap;
    }

    /**
     * 获取接口 key 对应实现类的单例
     *
     * @param tClass 接口
     * @param key    实现的 key
     * @param <T>
     * @return 实例
     */
    @SuppressWarnings("unchecked")
    public static <T> T getInstance(Class<T> tClass, String key) {
        String tClassName = tClass.getName();
        Map<String, Class<?>> keyClassMap = loaderMap.get(tClassName);
        if (keyClassMap == null) {
            throw new RuntimeException(String.format("SpiLoader did not load type %s", tClassName));
        }
        Class<?> implClass = keyClassMap.get(key);
        if (implClass == null) {
            throw new RuntimeException(String.format("SpiLoader found no implementation of %s for key %s", tClassName, key));
        }
        return (T) instanceCache.computeIfAbsent(implClass.getName(), name -> ReflectUtil.newInstance(implClass));
    }

}
