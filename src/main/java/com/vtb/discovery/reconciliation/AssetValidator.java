package com.vtb.discovery.reconciliation;

import com.vtb.discovery.models.DiscoveryMethod;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Проверка доступности сверенного актива без изменения окружения.
 * Файловые движки проверяются по наличию файла, серверные - по ответу
 * сетевого модуля. Остальные активы остаются непроверенными.
 */
@Slf4j
public class AssetValidator {

    public static final String VALIDATED = "validated";
    public static final String ACCESSIBLE = "accessible";
    public static final String VALIDATION_ERRORS = "validation_errors";

    /**
     * Атрибуты проверки для группы: пустая карта, если проверить нечем
     */
    public Map<String, String> validate(Collection<IdentityKey> keys, Set<DiscoveryMethod> methods) {
        Map<String, String> result = new TreeMap<>();
        List<String> files = new ArrayList<>();
        boolean hasEndpoint = false;
        for (IdentityKey key : keys) {
            if (key.getKind() == IdentityKey.Kind.FILE) {
                files.add(key.getValue());
            } else if (key.getKind() == IdentityKey.Kind.ENDPOINT) {
                hasEndpoint = true;
            }
        }

        if (!files.isEmpty()) {
            List<String> errors = new ArrayList<>();
            boolean accessible = false;
            for (String file : files) {
                String problem = checkFile(file);
                if (problem == null) {
                    accessible = true;
                } else {
                    errors.add(problem);
                }
            }
            result.put(VALIDATED, "true");
            result.put(ACCESSIBLE, String.valueOf(accessible));
            if (!accessible) {
                log.debug("Файловый актив недоступен: {}", errors);
                result.put(VALIDATION_ERRORS, String.join("; ", errors));
            }
        } else if (hasEndpoint && methods.contains(DiscoveryMethod.NETWORK)) {
            result.put(VALIDATED, "true");
            result.put(ACCESSIBLE, "true");
        }
        return result;
    }

    private static String checkFile(String file) {
        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            return "Некорректный путь: " + file;
        }
        if (!Files.exists(path)) {
            return "Файл не найден: " + file;
        }
        if (!Files.isRegularFile(path)) {
            return "Не является файлом: " + file;
        }
        if (!Files.isReadable(path)) {
            return "Нет прав на чтение: " + file;
        }
        return null;
    }
}
