package com.shardkv.utils;

import cn.hutool.core.io.resource.NoResourceException;
import cn.hutool.core.util.ReflectUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.setting.dialect.Props;
import lombok.extern.slf4j.Slf4j;

/**
 * 配置加载工具，读取 classpath 下的 application[-env].properties
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class ConfigUtils {

    private static final String BASE_NAME = "application";

    private static final String SUFFIX = ".properties";

    public static <T> T loadConfig(Class<T> tClass, String prefix) {
        return loadConfig(tClass, prefix, "");
    }

    /**
     * 以 prefix 为前缀将配置项填入对象，缺失的配置文件或配置项保留字段默认值
     *
     * @param tClass      配置类
     * @param prefix      配置前缀
     * @param environment 环境，如 test
     * @param <T>
     * @return 配置对象
     */
    public static <T> T loadConfig(Class<T> tClass, String prefix, String environment) {
        StringBuilder configFileBuilder = new StringBuilder(BASE_NAME);
        if (StrUtil.isNotBlank(environment)) {
            configFileBuilder.append("-").append(environment);
        }
        configFileBuilder.append(SUFFIX);
        String fileName = configFileBuilder.toString();
        try {
            Props props = new Props(fileName);
            return props.toBean(tClass, prefix);
        } catch (NoResourceException e) {
            log.warn("{} not found, use default {}", fileName, tClass.getSimpleName());
            return ReflectUtil.newInstance(tClass);
        }
    }

}
