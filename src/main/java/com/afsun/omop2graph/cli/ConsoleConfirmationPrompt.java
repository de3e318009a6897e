package com.afsun.omop2graph.cli;

import com.afsun.omop2graph.loader.ConfirmationPrompt;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 控制台交互确认，只有输入 y / yes 才算确认
 */
@Slf4j
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(String message) {
        out.print(message + " [y/N]: ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && ("y".equalsIgnoreCase(answer.trim()) || "yes".equalsIgnoreCase(answer.trim()));
        } catch (IOException e) {
            log.warn("读取确认输入失败，按未确认处理: {}", e.getMessage());
            return false;
        }
    }
}
