package com.vtb.discovery.cli;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.config.InvalidDiscoveryConfigurationException;
import com.vtb.discovery.core.DiscoveryService;
import com.vtb.discovery.models.DiscoveryReport;
import com.vtb.discovery.models.GapPriorityScore;
import com.vtb.discovery.reports.JsonReportGenerator;
import com.vtb.discovery.reports.ReportAssembler;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда обнаружения баз данных
 */
@Slf4j
@Command(
    name = "db-discovery",
    mixinStandardHelpOptions = true,
    version = "VTB Database Discovery 1.0.0",
    description = """

        VTB Database Discovery

        Поиск баз данных и хранилищ в рабочем окружении (только чтение)

        Возможности:
          • Docker Compose, сетевые порты, файлы БД, исходный код
          • Сверка наблюдений в единый инвентарь
          • Анализ пробелов: владельцы, документация, соответствие
          • Приоритизация и JSON отчет

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    @Option(names = {"-c", "--config"}, description = "Файл конфигурации YAML (по умолчанию встроенный)")
    private Path configPath;

    @Option(names = {"--docs"}, description = "Индекс документации (YAML/JSON)")
    private Path documentationPath;

    @Option(names = {"--rules"}, description = "Правила соответствия (YAML/JSON)")
    private Path rulesPath;

    @Option(names = {"-o", "--output"}, description = "Директория для сохранения отчета")
    private String outputDir;

    @Option(names = {"--timeout"}, description = "Общий лимит времени прогона, секунды")
    private Integer timeoutSeconds;

    @Option(names = {"--workers"}, description = "Число параллельных модулей")
    private Integer workers;

    @Option(names = {"-p", "--path"}, description = "Корни сканирования (можно указать несколько раз)")
    private List<String> scanPaths;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            DiscoveryConfig config = buildConfig();
            DiscoveryService service = new DiscoveryService(config);
            DiscoveryReport report = service.run(documentationPath, rulesPath);

            Path target = new ReportAssembler().write(report, new JsonReportGenerator(),
                Paths.get(config.getOutput().getDirectory()), config.getOutput().getFileNamePrefix());
            printSummary(report, target);
            return EXIT_OK;
        } catch (InvalidDiscoveryConfigurationException e) {
            log.error("Некорректная конфигурация: {}", e.getMessage());
            return EXIT_INVALID_CONFIG;
        } catch (IOException e) {
            log.error("Ошибка ввода-вывода: {}", e.getMessage(), e);
            return EXIT_IO_ERROR;
        }
    }

    DiscoveryConfig buildConfig() {
        DiscoveryConfig config = configPath != null ? DiscoveryConfig.load(configPath) : DiscoveryConfig.loadDefaults();
        if (outputDir != null) {
            config.getOutput().setDirectory(outputDir);
        }
        if (timeoutSeconds != null) {
            config.getPerformance().setMaxExecutionTimeSeconds(timeoutSeconds);
        }
        if (workers != null) {
            config.getPerformance().setMaxWorkers(workers);
        }
        if (scanPaths != null && !scanPaths.isEmpty()) {
            config.getScope().setScanPaths(scanPaths);
        }
        config.validate();
        return config;
    }

    private void printSummary(DiscoveryReport report, Path target) {
        System.out.println();
        System.out.println("Активов обнаружено: " + report.getAssets().size());
        System.out.println("Пробелов найдено:   " + report.getGaps().size());
        System.out.println("Ошибок и замечаний: " + report.getIssues().size());
        if (report.getStatistics() != null && report.getStatistics().getInaccessibleAssets() > 0) {
            System.out.println("Недоступных активов: " + report.getStatistics().getInaccessibleAssets());
        }
        if (report.isTruncated()) {
            System.out.println("ВНИМАНИЕ: прогон усечен по времени или бюджету");
        }
        int shown = 0;
        for (GapPriorityScore score : report.getPrioritizedGaps()) {
            if (shown++ >= 5) {
                break;
            }
            System.out.printf("  [%s] %.2f %s%n", score.getPriorityLevel(), score.getCompositeScore(),
                score.getGap().getDescription());
        }
        System.out.println("Отчет: " + target.toAbsolutePath());
    }
}
