package com.vtb.discovery.reports;

import com.vtb.discovery.models.DiscoveryReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param report     снимок результата прогона
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(DiscoveryReport report, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
