package com.afsun.omop2graph.loader;

/**
 * 加载状态机的状态，声明顺序即规范流转顺序
 */
public enum LoaderState {
    IDLE,
    CONFIRM_WIPE,
    WIPE,
    SCHEMA_APPLY,
    LOAD,
    VALIDATE,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
