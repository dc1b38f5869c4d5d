package com.microshop.discovery.store;

import com.microshop.discovery.RegistryException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.lease.LeaseGrantResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 基于 jetcd 的键值存储
 */
@Slf4j
public class EtcdKeyValueStore implements KeyValueStore {

    private final Client client;
    private final Duration requestTimeout;

    EtcdKeyValueStore(Client client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    /**
     * 连接 etcd 并在拨号超时内完成一次探测请求
     *
     * @param endpoints      端点列表
     * @param dialTimeout    拨号超时
     * @param requestTimeout 单次请求超时
     * @return 已验证可用的存储
     * @throws RegistryException 在超时内无法访问 etcd
     */
    public static EtcdKeyValueStore connect(List<String> endpoints, Duration dialTimeout, Duration requestTimeout) {
        Client client;
        try {
            client = Client.builder()
                .endpoints(endpoints.toArray(new String[0]))
                .connectTimeout(dialTimeout)
                .build();
        } catch (RuntimeException e) {
            throw new RegistryException("failed to connect to etcd: " + endpoints, e);
        }

        EtcdKeyValueStore store = new EtcdKeyValueStore(client, requestTimeout);
        try {
            ByteSequence probe = bytes("/");
            store.await(client.getKVClient().get(probe, GetOption.builder().withCountOnly(true).build()),
                dialTimeout, "failed to connect to etcd: " + endpoints);
        } catch (RegistryException e) {
            client.close();
            throw e;
        }
        log.info("Connected to etcd: endpoints={}", endpoints);
        return store;
    }

    @Override
    public Lease grant(Duration ttl) {
        LeaseGrantResponse response = await(client.getLeaseClient().grant(ttl.toSeconds()),
            requestTimeout, "failed to create lease");
        return new Lease(response.getID(), Duration.ofSeconds(response.getTTL()));
    }

    @Override
    public void keepAlive(Lease lease) {
        await(client.getLeaseClient().keepAliveOnce(lease.id()), requestTimeout,
            "failed to keep alive lease " + lease.id());
    }

    @Override
    public void put(String key, String value, Lease lease) {
        PutOption option = PutOption.builder().withLeaseId(lease.id()).build();
        await(client.getKVClient().put(bytes(key), bytes(value), option), requestTimeout,
            "failed to put key " + key);
    }

    @Override
    public List<String> getPrefix(String prefix, Duration timeout) {
        GetOption option = GetOption.builder().isPrefix(true).build();
        GetResponse response = await(client.getKVClient().get(bytes(prefix), option), timeout,
            "failed to query prefix " + prefix);
        return response.getKvs().stream()
            .map(KeyValue::getValue)
            .map(value -> value.toString(StandardCharsets.UTF_8))
            .collect(Collectors.toList());
    }

    @Override
    public void delete(String key) {
        await(client.getKVClient().delete(bytes(key)), requestTimeout, "failed to delete key " + key);
    }

    @Override
    public void close() {
        client.close();
        log.info("etcd client closed");
    }

    private <T> T await(CompletableFuture<T> future, Duration timeout, String context) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RegistryException(context + ": interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RegistryException(context + ": timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw new RegistryException(context, e.getCause());
        }
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }
}
