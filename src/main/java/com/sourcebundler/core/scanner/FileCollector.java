package com.sourcebundler.core.scanner;

import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.security.FilterRuleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Walks a source directory and returns the files a merge should bundle.
 * <p>
 * Any file or directory below the root whose name starts with {@code "."} is
 * excluded, as is any entry matched by an active filter rule. Symbolic links are
 * followed; a link cycle is logged and skipped.
 */
@Service
public class FileCollector {

    private static final Logger log = LoggerFactory.getLogger(FileCollector.class);

    /**
     * Collects matching files below {@code sourceRoot}.
     *
     * @param sourceRoot the directory to walk
     * @param extensions extensions to include, matched case-insensitively
     * @param filters    exclusion rules matched against every name below the root
     * @return absolute paths in walk order; callers sort as they need
     * @throws IOException if the root is not a directory or the walk fails
     */
    public List<Path> collect(Path sourceRoot, ExtensionSet extensions, List<FilterRule> filters) throws IOException {
        Path root = sourceRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        var matcher = new FilterRuleMatcher(filters);
        var files = new ArrayList<Path>();

        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (!dir.equals(root) && shouldIgnore(dir.getFileName().toString(), matcher)) {
                            log.debug("Skipping directory {}", dir);
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        String name = file.getFileName().toString();
                        if (attrs.isRegularFile() && extensions.matches(name) && !shouldIgnore(name, matcher)) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                        if (e instanceof FileSystemLoopException) {
                            log.warn("Skipping symbolic link cycle at {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        throw e;
                    }
                });

        log.debug("Collected {} files under {}", files.size(), root);
        return files;
    }

    /**
     * Returns {@code true} if a name below the root is hidden or matched by a filter rule.
     */
    private static boolean shouldIgnore(String name, FilterRuleMatcher matcher) {
        return name.startsWith(".") || matcher.matchesSegment(name);
    }
}
