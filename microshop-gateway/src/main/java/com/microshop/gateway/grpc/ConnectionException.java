package com.microshop.gateway.grpc;

import com.microshop.common.exception.MicroshopException;

/**
 * 下游服务通道建立或关闭失败
 */
public class ConnectionException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    public ConnectionException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public ConnectionException(String message) {
        super(message);
        this.serviceName = null;
    }

    /**
     * 失败的服务名，聚合的关闭错误为 null
     */
    public String getServiceName() {
        return serviceName;
    }
}
