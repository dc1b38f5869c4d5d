package com.microshop.actor.order;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于时间的订单号生成器
 * 形如 ORD-&lt;纳秒时间戳&gt;，同一进程内严格递增
 */
final class OrderIds {

    private static final AtomicLong LAST = new AtomicLong();

    private OrderIds() {
    }

    static String next() {
        return next(Clock.systemUTC());
    }

    static String next(Clock clock) {
        Instant now = clock.instant();
        long candidate = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        long issued = LAST.accumulateAndGet(candidate, (last, c) -> Math.max(last + 1, c));
        return "ORD-" + issued;
    }
}
