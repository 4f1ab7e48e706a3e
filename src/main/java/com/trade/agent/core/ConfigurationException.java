package com.trade.agent.core;

/**
 * 配置错误：缺少配置项或取值非法
 * 属于启动期缺陷，应直接暴露给调用方，不做重试
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
