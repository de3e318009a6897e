package com.afsun.omop2graph.cli;

import com.afsun.omop2graph.config.MigrationProperties;
import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import com.afsun.omop2graph.core.transform.ArtifactStore;
import com.afsun.omop2graph.core.transform.GraphTransformationEngine;
import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.core.transform.TransformReport;
import com.afsun.omop2graph.loader.ConfirmationPrompt;
import com.afsun.omop2graph.loader.GraphStore;
import com.afsun.omop2graph.loader.LoadPlan;
import com.afsun.omop2graph.loader.LoadRequest;
import com.afsun.omop2graph.loader.LoadResult;
import com.afsun.omop2graph.loader.LoaderOrchestrator;
import com.afsun.omop2graph.validation.GraphValidator;
import com.afsun.omop2graph.validation.ValidationBaseline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 命令行入口：transform、load-csv、prepare-bulk、clear-db、create-indexes、validate。
 * clear-db 和 load-csv 需要交互确认或 --yes；任何失败都以非零退出码结束。
 *
 * @author afsun
 */
@Component
@Slf4j
public class MigrationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    public static final String IMPORT_COMMAND_FILE = "import-command.txt";

    private static final String USAGE = "用法: omop2graph <transform|load-csv|prepare-bulk|clear-db|create-indexes|validate>"
            + " [--yes] [--batch-size=N] [--chunk-size=N] [--concept-id=N]";

    private final MigrationProperties properties;
    private final GraphStore graphStore;
    private final LabelResolver labelResolver;
    private final ArtifactStore artifactStore;
    private final ConfirmationPrompt confirmationPrompt;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public MigrationCommandRunner(MigrationProperties properties, GraphStore graphStore, LabelResolver labelResolver,
                                  ArtifactStore artifactStore, ConfirmationPrompt confirmationPrompt) {
        this(properties, graphStore, labelResolver, artifactStore, confirmationPrompt, System.out);
    }

    public MigrationCommandRunner(MigrationProperties properties, GraphStore graphStore, LabelResolver labelResolver,
                                  ArtifactStore artifactStore, ConfirmationPrompt confirmationPrompt, PrintStream out) {
        this.properties = properties;
        this.graphStore = graphStore;
        this.labelResolver = labelResolver;
        this.artifactStore = artifactStore;
        this.confirmationPrompt = confirmationPrompt;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1) {
            out.println(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        MigrationSettings settings;
        try {
            settings = settings(args);
        } catch (IllegalArgumentException e) {
            out.println("参数错误: " + e.getMessage());
            out.println(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        boolean confirmed = args.containsOption("yes");
        String command = commands.get(0);
        log.info("CLI: 开始执行 {}", command);
        try {
            exitCode = execute(command, settings, confirmed);
        } catch (MigrationException e) {
            log.error("CLI: {} 执行失败: {}", command, e.getFormattedMessage(), e);
            out.println(e.getFormattedMessage());
            exitCode = EXIT_FAILED;
        }
        log.info("CLI: {} 结束, 退出码 {}", command, exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(String command, MigrationSettings settings, boolean confirmed) {
        GraphTransformationEngine engine = new GraphTransformationEngine(labelResolver, artifactStore, settings);
        LoaderOrchestrator orchestrator = new LoaderOrchestrator(graphStore, new GraphValidator(graphStore, settings), settings);
        switch (command) {
            case "transform": {
                OnlineArtifacts artifacts = engine.transformOnline(settings.getExportDir(), settings.getOnlineDir());
                printTransformSummary(artifacts.getReport());
                return EXIT_OK;
            }
            case "load-csv": {
                OnlineArtifacts artifacts = engine.transformOnline(settings.getExportDir(), settings.getOnlineDir());
                printTransformSummary(artifacts.getReport());
                return finish(orchestrator.run(request(LoadPlan.FULL_RELOAD, confirmed).onlineArtifacts(artifacts).build()));
            }
            case "prepare-bulk": {
                ImportManifest manifest = engine.prepareBulkImport(settings.getExportDir(), settings.getImportDir());
                LoadResult result = orchestrator.run(request(LoadPlan.BULK_COMMAND, confirmed).manifest(manifest).build());
                if (result.succeeded()) {
                    writeImportCommand(settings.getImportDir(), result.getBulkCommand());
                    out.println(result.getBulkCommand());
                }
                return finish(result);
            }
            case "clear-db":
                return finish(orchestrator.run(request(LoadPlan.CLEAR, confirmed).build()));
            case "create-indexes":
                return finish(orchestrator.run(request(LoadPlan.SCHEMA, confirmed).build()));
            case "validate": {
                ValidationBaseline baseline = ValidationBaseline.locate(artifactStore, settings.getOnlineDir(),
                        settings.getImportDir(), settings.getLoadBatchSize());
                return finish(orchestrator.run(request(LoadPlan.VALIDATE, confirmed).validationBaseline(baseline).build()));
            }
            default:
                out.println("未知命令: " + command);
                out.println(USAGE);
                return EXIT_USAGE;
        }
    }

    private LoadRequest.LoadRequestBuilder request(LoadPlan plan, boolean confirmed) {
        return LoadRequest.builder().plan(plan).confirmed(confirmed).prompt(confirmationPrompt);
    }

    /**
     * 输出结果；失败时列出失败前已完成的步骤
     */
    private int finish(LoadResult result) {
        if (result.getValidationReport() != null) {
            out.print(result.getValidationReport().summary());
        }
        if (result.succeeded()) {
            out.println("完成: " + result.getPlan());
            return EXIT_OK;
        }
        out.println("失败: " + result.getPlan() + " -> " + result.failureMessage());
        if (result.getCheckpoint() != null) {
            out.println("最后成功提交: " + result.getCheckpoint());
        }
        for (String line : result.getProgress()) {
            out.println("  已完成: " + line);
        }
        return EXIT_FAILED;
    }

    private void printTransformSummary(TransformReport report) {
        out.println("转换完成: 写入 " + report.totalWritten() + " 行, 跳过 " + report.totalSkipped() + " 行");
        report.getSkippedRows().forEach(row ->
                out.println("  SKIPPED " + row.getSource() + "#" + row.getRecordNumber() + " " + row.getReason()));
    }

    private void writeImportCommand(Path importDir, String command) {
        Path file = importDir.resolve(IMPORT_COMMAND_FILE);
        try {
            Files.write(file, (command + "\n").getBytes(StandardCharsets.UTF_8));
            log.info("导入命令已写入 {}", file);
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "写入导入命令失败: " + file, null, e);
        }
    }

    private MigrationSettings settings(ApplicationArguments args) {
        MigrationSettings.MigrationSettingsBuilder builder = properties.toSettings().toBuilder();
        if (args.containsOption("batch-size")) {
            builder.loadBatchSize(positive("batch-size", args));
        }
        if (args.containsOption("chunk-size")) {
            builder.chunkSize(positive("chunk-size", args));
        }
        if (args.containsOption("concept-id")) {
            builder.sampleConceptId(Long.parseLong(args.getOptionValues("concept-id").get(0)));
        }
        return builder.build();
    }

    private static int positive(String option, ApplicationArguments args) {
        int value = Integer.parseInt(args.getOptionValues(option).get(0));
        if (value < 1) {
            throw new IllegalArgumentException("--" + option + " 必须大于0: " + value);
        }
        return value;
    }
}
