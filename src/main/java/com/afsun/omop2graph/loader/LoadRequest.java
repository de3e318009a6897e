package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.validation.ValidationBaseline;
import lombok.Builder;
import lombok.Getter;

/**
 * 一次编排运行的输入
 */
@Getter
@Builder
public class LoadRequest {

    private final LoadPlan plan;

    /**
     * --yes：跳过交互确认
     */
    private final boolean confirmed;

    @Builder.Default
    private final ConfirmationPrompt prompt = ConfirmationPrompt.DENY;

    /**
     * FULL_RELOAD、VALIDATE 需要
     */
    private final OnlineArtifacts onlineArtifacts;

    /**
     * VALIDATE 的期望值来源；为空时取 onlineArtifacts
     */
    private final ValidationBaseline validationBaseline;

    /**
     * BULK_COMMAND 需要
     */
    private final ImportManifest manifest;
}
