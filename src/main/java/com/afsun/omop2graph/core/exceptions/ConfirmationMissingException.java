package com.afsun.omop2graph.core.exceptions;

/**
 * 破坏性操作未获得确认
 */
public class ConfirmationMissingException extends MigrationException {

    public ConfirmationMissingException(String message) {
        super("CONFIRMATION_MISSING", message, "交互确认或使用 --yes 参数");
    }
}
