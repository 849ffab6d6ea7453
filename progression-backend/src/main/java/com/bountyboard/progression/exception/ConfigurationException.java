package com.bountyboard.progression.exception;

/**
 * 阈值表 / 徽章注册表配置错误，启动时直接失败
 */
public class ConfigurationException extends ProgressionException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_ERROR, message);
    }
}
