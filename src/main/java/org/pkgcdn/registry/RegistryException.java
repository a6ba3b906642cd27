package org.pkgcdn.registry;

/**
 * 上游注册中心访问失败（网络错误、非预期响应、元数据不完整）。不会在内部重试。
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
