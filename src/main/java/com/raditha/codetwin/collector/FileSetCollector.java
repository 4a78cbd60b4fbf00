package com.raditha.codetwin.collector;

import com.raditha.codetwin.config.GrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects the source files of one collection.
 * Walks the directory tree, prunes excluded directory names and keeps files
 * whose extension has a registered grammar. Paths are returned relative to
 * the root, '/' separated and sorted.
 */
public class FileSetCollector {

    private static final Logger logger = LoggerFactory.getLogger(FileSetCollector.class);

    private final Set<String> excludedDirectories;
    private final GrammarRegistry grammars;

    public FileSetCollector(Set<String> excludedDirectories, GrammarRegistry grammars) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.grammars = grammars;
    }

    /**
     * @param root collection root directory
     * @return sorted relative paths of the files to compare
     * @throws IllegalArgumentException if root is not a directory
     * @throws IOException              if the walk itself fails
     */
    public List<String> collect(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<String> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && excludedDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!grammars.supports(file.getFileName().toString())) {
                    return FileVisitResult.CONTINUE;
                }
                // links to files are kept, links to directories are not descended
                if (attrs.isRegularFile() || (attrs.isSymbolicLink() && Files.isRegularFile(file))) {
                    files.add(toRelative(root, file));
                } else {
                    logger.debug("Skipping non-regular file: {}", file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                if (exc instanceof AccessDeniedException) {
                    logger.warn("Skipping inaccessible file/directory: {}", file);
                } else {
                    logger.warn("Error visiting file: {}", file, exc);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        logger.debug("Collected {} files under {}", files.size(), root);
        return files;
    }

    static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
