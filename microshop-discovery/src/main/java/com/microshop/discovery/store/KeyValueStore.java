package com.microshop.discovery.store;

import java.time.Duration;
import java.util.List;

/**
 * 支持租约的一致性键值存储
 * 实现必须线程安全：注册、发现、注销共享同一个连接
 * 所有失败以 {@link com.microshop.discovery.RegistryException} 抛出
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * 创建租约
     *
     * @param ttl 租约时长
     * @return 新租约
     */
    Lease grant(Duration ttl);

    /**
     * 发送一次续约
     *
     * @param lease 租约
     */
    void keepAlive(Lease lease);

    /**
     * 写入绑定到租约的键值，已存在时覆盖
     *
     * @param key   键
     * @param value 值
     * @param lease 绑定的租约
     */
    void put(String key, String value, Lease lease);

    /**
     * 按前缀查询所有值
     *
     * @param prefix  键前缀
     * @param timeout 查询超时
     * @return 值列表，无匹配时为空列表
     */
    List<String> getPrefix(String prefix, Duration timeout);

    /**
     * 删除键
     *
     * @param key 键
     */
    void delete(String key);

    /**
     * 释放底层连接，不撤销租约
     */
    @Override
    void close();
}
