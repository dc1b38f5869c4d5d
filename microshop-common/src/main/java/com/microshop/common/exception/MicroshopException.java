package com.microshop.common.exception;

/**
 * 所有核心组件异常的基类
 */
public class MicroshopException extends RuntimeException {

    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;

    public MicroshopException(String message) {
        super(message);
    }

    public MicroshopException(String message, Throwable cause) {
        super(message, cause);
    }
}
