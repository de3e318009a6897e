package com.afsun.omop2graph.core.exceptions;

import org.slf4j.helpers.MessageFormatter;

/**
 * 行数据不合法（缺少主键字段、数值或日期无法解析等）。
 * 读取器捕获后转换为跳过记录，不会中断整个运行。
 */
public class MalformedRowException extends MigrationException {

    public MalformedRowException(String message, Object... args) {
        super("MALFORMED_ROW", MessageFormatter.arrayFormat(message, args).getMessage(), null);
    }
}
