package com.afsun.omop2graph.core.exceptions;

/**
 * 图数据库不可达，状态机立即终止
 */
public class ConnectivityException extends MigrationException {

    public ConnectivityException(String message, Throwable cause) {
        super("CONNECTIVITY_ERROR", message, "检查 spring.neo4j.uri 以及账号密码配置", cause);
    }
}
