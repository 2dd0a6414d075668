package net.leasehold.core.error;

/** 잘못된 스케줄, 미등록 kind 등. 잡 생성 시점이나 기동 검증에서 던진다. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
