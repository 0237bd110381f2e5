package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ленивый обход файлов в границах scope: корни, исключения, глубина, размер.
 * Каждый каталог читается только когда до него дошла очередь,
 * порядок внутри каталога детерминирован (по имени).
 * Символические ссылки на каталоги не обходятся.
 */
@Slf4j
public class ScopedFileWalker implements Iterator<Path> {

    private final List<String> excludePatterns;
    private final int maxDepth;
    private final long maxFileSizeBytes;
    private final Predicate<Path> fileFilter;

    private final Deque<Entry> pending = new ArrayDeque<>();
    private final Set<Path> visitedRoots = new LinkedHashSet<>();
    private Path nextFile;

    public ScopedFileWalker(DiscoveryConfig config, Predicate<Path> fileFilter) {
        DiscoveryConfig.Scope scope = config.getScope();
        this.excludePatterns = new ArrayList<>();
        for (String pattern : scope.getExcludePatterns()) {
            if (pattern != null && !pattern.isBlank()) {
                excludePatterns.add(pattern.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.maxDepth = scope.getMaxDepth();
        this.maxFileSizeBytes = scope.maxFileSizeBytes();
        this.fileFilter = fileFilter;

        List<Entry> roots = new ArrayList<>();
        for (String root : scope.getScanPaths()) {
            Path path = Path.of(root).toAbsolutePath().normalize();
            if (!Files.exists(path)) {
                log.debug("Путь сканирования не существует: {}", path);
                continue;
            }
            if (visitedRoots.add(path)) {
                roots.add(new Entry(path, 0));
            }
        }
        // Обход в порядке объявления корней
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }
    }

    /**
     * Существует ли хотя бы один корень сканирования
     */
    public static boolean anyRootExists(DiscoveryConfig config) {
        for (String root : config.getScope().getScanPaths()) {
            if (root != null && Files.exists(Path.of(root))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Корень сканирования, которому принадлежит файл
     */
    public Path rootOf(Path file) {
        Path best = null;
        for (Path root : visitedRoots) {
            if (file.startsWith(root) && (best == null || root.getNameCount() > best.getNameCount())) {
                best = root;
            }
        }
        return best;
    }

    @Override
    public boolean hasNext() {
        while (nextFile == null && !pending.isEmpty()) {
            Entry entry = pending.pop();
            Path path = entry.path;
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                if (entry.depth > 0 && isExcluded(path)) {
                    continue;
                }
                if (entry.depth >= maxDepth) {
                    continue;
                }
                expand(entry);
            } else if (Files.isRegularFile(path) && acceptFile(path)) {
                nextFile = path;
            }
        }
        return nextFile != null;
    }

    @Override
    public Path next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Path result = nextFile;
        nextFile = null;
        return result;
    }

    private void expand(Entry directory) {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory.path)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException | SecurityException e) {
            log.debug("Нет доступа к каталогу {}: {}", directory.path, e.getMessage());
            return;
        }
        children.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(new Entry(children.get(i), directory.depth + 1));
        }
    }

    private boolean acceptFile(Path file) {
        if (isExcluded(file)) {
            return false;
        }
        if (!fileFilter.test(file)) {
            return false;
        }
        try {
            long size = Files.size(file);
            if (size > maxFileSizeBytes) {
                log.debug("Файл {} превышает лимит размера ({} байт), пропущен", file, size);
                return false;
            }
        } catch (IOException e) {
            log.debug("Не удалось получить размер {}: {}", file, e.getMessage());
            return false;
        }
        return true;
    }

    private boolean isExcluded(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        for (String pattern : excludePatterns) {
            if (fileName.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static final class Entry {
        private final Path path;
        private final int depth;

        private Entry(Path path, int depth) {
            this.path = path;
            this.depth = depth;
        }
    }
}
