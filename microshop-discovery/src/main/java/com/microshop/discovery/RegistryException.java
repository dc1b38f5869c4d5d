package com.microshop.discovery;

import com.microshop.common.exception.MicroshopException;

/**
 * 注册中心不可用或存储操作失败
 * 与“无结果”严格区分：没有实例时发现操作返回空列表而不是抛出此异常
 */
public class RegistryException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
