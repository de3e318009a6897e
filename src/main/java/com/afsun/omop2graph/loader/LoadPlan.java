package com.afsun.omop2graph.loader;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 各命令经过的状态。未包含的状态按规范顺序直接跳过。
 * 每次加载都是全量替换，不做增量合并。
 */
public enum LoadPlan {

    FULL_RELOAD(EnumSet.of(LoaderState.CONFIRM_WIPE, LoaderState.WIPE, LoaderState.SCHEMA_APPLY,
            LoaderState.LOAD, LoaderState.VALIDATE)),
    CLEAR(EnumSet.of(LoaderState.CONFIRM_WIPE, LoaderState.WIPE)),
    SCHEMA(EnumSet.of(LoaderState.SCHEMA_APPLY)),
    VALIDATE(EnumSet.of(LoaderState.VALIDATE)),
    /**
     * 离线：只根据清单生成导入命令，不访问图库
     */
    BULK_COMMAND(EnumSet.of(LoaderState.LOAD));

    private final Set<LoaderState> states;

    LoadPlan(Set<LoaderState> states) {
        this.states = Collections.unmodifiableSet(states);
    }

    public Set<LoaderState> getStates() {
        return states;
    }

    public boolean includes(LoaderState state) {
        return states.contains(state);
    }

    public boolean isOffline() {
        return this == BULK_COMMAND;
    }

    /**
     * 当前状态之后的下一个状态；没有剩余状态时为 DONE
     */
    public LoaderState next(LoaderState current) {
        LoaderState[] all = LoaderState.values();
        for (int i = current.ordinal() + 1; i < all.length; i++) {
            if (all[i].isTerminal()) {
                break;
            }
            if (states.contains(all[i])) {
                return all[i];
            }
        }
        return LoaderState.DONE;
    }
}
