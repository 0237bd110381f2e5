package com.vtb.discovery.modules;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

@Slf4j
final class FileNames {

    private FileNames() {
    }

    static String lowerName(Path file) {
        Path name = file.getFileName();
        return name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
    }

    static String extension(Path file) {
        String name = lowerName(file);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }

    static boolean hasExtension(Path file, Collection<String> extensions) {
        String name = lowerName(file);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Канонический абсолютный путь; если файл недоступен - нормализованный абсолютный
     */
    static Path canonical(Path file) {
        try {
            return file.toRealPath();
        } catch (IOException | SecurityException e) {
            return file.toAbsolutePath().normalize();
        }
    }

    /**
     * Путь относительно корня с прямыми слешами
     */
    static String relative(Path root, Path file) {
        if (root == null) {
            return file.toString().replace('\\', '/');
        }
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Прочитать текстовый файл построчно. Некорректные байты UTF-8 заменяются,
     * ошибка чтения дает пустой список.
     */
    static List<String> readLines(Path file) {
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return List.of(content.split("\\r?\\n", -1));
        } catch (IOException | SecurityException e) {
            log.debug("Не удалось прочитать {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Разрешить путь из литерала относительно базового каталога.
     * Возвращает null для строк, не являющихся путем.
     */
    static Path resolveLiteral(Path base, String literal) {
        Path path;
        try {
            path = Path.of(literal);
        } catch (java.nio.file.InvalidPathException e) {
            return null;
        }
        if (!path.isAbsolute() && base != null) {
            path = base.resolve(path);
        }
        return canonical(path);
    }
}
