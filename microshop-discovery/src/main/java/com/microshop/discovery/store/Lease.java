package com.microshop.discovery.store;

import java.time.Duration;

/**
 * 存储颁发的限时租约
 * 过期时间由存储维护，持有者必须在过期前续约，否则绑定的记录会被存储回收
 *
 * @param id  租约句柄
 * @param ttl 租约时长
 */
public record Lease(long id, Duration ttl) {
}
