package com.afsun.omop2graph.core.exceptions;

import lombok.Getter;

/**
 * 迁移异常基类
 * 提供统一的错误码和错误信息格式
 *
 * @author afsun
 */
@Getter
public class MigrationException extends RuntimeException {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 建议解决方案
     */
    private final String suggestion;

    public MigrationException(String message) {
        this("MIGRATION_ERROR", message, null, null);
    }

    public MigrationException(String message, Throwable cause) {
        this("MIGRATION_ERROR", message, null, cause);
    }

    public MigrationException(String errorCode, String message, String suggestion) {
        this(errorCode, message, suggestion, null);
    }

    public MigrationException(String errorCode, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.suggestion = suggestion;
    }

    /**
     * 获取格式化的错误信息
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode).append("] ").append(getMessage());
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n建议: ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
