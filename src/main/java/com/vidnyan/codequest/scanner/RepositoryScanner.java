package com.vidnyan.codequest.scanner;

import com.vidnyan.codequest.domain.model.Language;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scans a repository for source files of one language.
 * Hidden directories and common virtual-env / build output directories are skipped.
 * Results are sorted by path so every run sees files in the same order.
 */
@Component
public class RepositoryScanner {

    static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            "__pycache__", "venv", ".venv", "node_modules", "target", "build");

    /**
     * Scan and return all source files for the language under the root, in lexicographic path order.
     */
    public List<Path> scanSourceFiles(Path root, Language language) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> language.matches(p.getFileName().toString()))
                    .filter(p -> !insideExcludedDirectory(root.relativize(p)))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }
    }

    private static boolean insideExcludedDirectory(Path relative) {
        Path parent = relative.getParent();
        if (parent == null) {
            return false;
        }
        for (Path part : parent) {
            String name = part.toString();
            if (name.startsWith(".") || EXCLUDED_DIRECTORIES.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
