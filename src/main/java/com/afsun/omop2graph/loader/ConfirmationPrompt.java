package com.afsun.omop2graph.loader;

/**
 * 破坏性操作前的确认
 */
public interface ConfirmationPrompt {

    ConfirmationPrompt DENY = message -> false;

    boolean confirm(String message);
}
