package com.microshop.discovery;

import com.microshop.common.config.RegistryConfig;
import com.microshop.common.model.ServiceInstance;
import com.microshop.discovery.store.EtcdKeyValueStore;
import com.microshop.discovery.store.InMemoryKeyValueStore;
import com.microshop.discovery.store.KeyValueStore;
import com.microshop.discovery.store.Lease;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于租约的服务注册发现客户端
 * <p>
 * 注册记录的键为 {@code <prefix><serviceName>/<host>:<port>}，值为 {@code <host>:<port>}，
 * 每条记录绑定一个租约。注册后由后台任务在每个TTL窗口内续约三次，直到注销或关闭。
 * 关闭时不撤销租约，崩溃进程与正常退出进程统一依赖TTL过期回收。
 */
@Slf4j
public class ServiceDiscovery implements AutoCloseable {

    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    private final KeyValueStore store;
    private final RegistryConfig config;
    private final ScheduledExecutorService keepAliveExecutor;

    // 注册键 -> 注册信息
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public ServiceDiscovery(KeyValueStore store, RegistryConfig config) {
        this.store = store;
        this.config = config;
        int index = INSTANCE_COUNTER.incrementAndGet();
        this.keepAliveExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "registry-keepalive-" + index);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 严格连接：服务提供方无法被发现时不能安全启动
     *
     * @param config 注册中心配置
     * @return 已连接的客户端
     * @throws RegistryException 存储不可达
     */
    public static ServiceDiscovery connect(RegistryConfig config) {
        return new ServiceDiscovery(openStore(config), config);
    }

    /**
     * 宽松连接：存在静态地址兜底的调用方在存储不可达时继续运行
     *
     * @param config 注册中心配置
     * @return 已连接的客户端，不可达时为空
     */
    public static Optional<ServiceDiscovery> tryConnect(RegistryConfig config) {
        try {
            return Optional.of(connect(config));
        } catch (RegistryException e) {
            log.warn("Failed to connect to registry, continuing without service discovery: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static KeyValueStore openStore(RegistryConfig config) {
        switch (config.getStore()) {
            case MEMORY:
                log.info("Using in-memory registry store");
                return new InMemoryKeyValueStore();
            case ETCD:
            default:
                return EtcdKeyValueStore.connect(config.getEndpoints(), config.getDialTimeout(),
                    config.getRequestTimeout());
        }
    }

    /**
     * 使用配置的TTL注册实例
     *
     * @param instance 服务实例
     */
    public void register(ServiceInstance instance) {
        register(instance, config.getLeaseTtl().toSeconds());
    }

    /**
     * 注册服务实例并启动续约任务
     * 对同一实例重复调用视为重新注册：覆盖值并复用已有租约
     *
     * @param instance   服务实例
     * @param ttlSeconds 租约TTL（秒）
     * @throws RegistryException 创建租约或写入记录失败
     */
    public synchronized void register(ServiceInstance instance, long ttlSeconds) {
        ensureOpen();
        String key = instanceKey(instance);
        String value = instance.address();

        Registration existing = registrations.get(key);
        if (existing != null && renew(existing.lease())) {
            store.put(key, value, existing.lease());
            log.info("Service re-registered: key={}, address={}, leaseId={}", key, value, existing.lease().id());
            return;
        }
        if (existing != null) {
            existing.cancel();
            registrations.remove(key);
        }

        Lease lease = store.grant(Duration.ofSeconds(ttlSeconds));
        store.put(key, value, lease);

        long period = Math.max(1, lease.ttl().toMillis() / 3);
        ScheduledFuture<?> renewal = keepAliveExecutor.scheduleAtFixedRate(
            () -> keepAlive(key, lease), period, period, TimeUnit.MILLISECONDS);
        registrations.put(key, new Registration(instance, lease, renewal));

        log.info("Service registered: key={}, address={}, leaseId={}, ttl={}s", key, value, lease.id(), ttlSeconds);
    }

    /**
     * 使用默认超时发现服务
     *
     * @param serviceName 服务名
     * @return 拨号地址列表
     */
    public List<String> discover(String serviceName) {
        return discover(serviceName, config.getDiscoverTimeout());
    }

    /**
     * 查询服务前缀下的所有拨号地址
     *
     * @param serviceName 服务名
     * @param timeout     查询超时
     * @return 拨号地址列表，没有存活实例时为空列表
     * @throws RegistryException 存储不可达
     */
    public List<String> discover(String serviceName, Duration timeout) {
        ensureOpen();
        String prefix = servicePrefix(serviceName);
        try {
            List<String> addresses = store.getPrefix(prefix, timeout);
            log.debug("Discovered service: name={}, instances={}", serviceName, addresses.size());
            return addresses;
        } catch (RegistryException e) {
            throw new RegistryException("failed to discover service " + serviceName, e);
        }
    }

    /**
     * 注销服务实例，尽力而为
     * 存储不可达时仅记录日志，租约TTL负责最终清理
     *
     * @param instance 服务实例
     */
    public synchronized void deregister(ServiceInstance instance) {
        String key = instanceKey(instance);
        Registration registration = registrations.remove(key);
        if (registration != null) {
            registration.cancel();
        }
        try {
            store.delete(key);
            log.info("Service deregistered: key={}", key);
        } catch (RegistryException e) {
            log.error("Failed to deregister service, relying on lease expiry: key={}", key, e);
        }
    }

    /**
     * 停止全部续约任务并等待结束，然后释放存储连接
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            registrations.values().forEach(Registration::cancel);
            registrations.clear();
        }

        keepAliveExecutor.shutdown();
        try {
            if (!keepAliveExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Keep-alive executor did not terminate in time, forcing shutdown");
                keepAliveExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            keepAliveExecutor.shutdownNow();
        }

        store.close();
        log.info("Service discovery closed");
    }

    /**
     * 当前进程持有的注册数
     */
    public int getRegistrationCount() {
        return registrations.size();
    }

    String instanceKey(ServiceInstance instance) {
        return servicePrefix(instance.name()) + instance.address();
    }

    String servicePrefix(String serviceName) {
        return config.getPrefix() + serviceName + "/";
    }

    private void keepAlive(String key, Lease lease) {
        try {
            store.keepAlive(lease);
            log.trace("Lease renewed: key={}, leaseId={}", key, lease.id());
        } catch (RegistryException e) {
            log.warn("Failed to renew lease: key={}, leaseId={}, reason={}", key, lease.id(), e.getMessage());
        }
    }

    private boolean renew(Lease lease) {
        try {
            store.keepAlive(lease);
            return true;
        } catch (RegistryException e) {
            log.warn("Existing lease is no longer alive, granting a new one: leaseId={}", lease.id());
            return false;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("service discovery is closed");
        }
    }

    private record Registration(ServiceInstance instance, Lease lease, ScheduledFuture<?> renewal) {

        void cancel() {
            renewal.cancel(false);
        }
    }
}
