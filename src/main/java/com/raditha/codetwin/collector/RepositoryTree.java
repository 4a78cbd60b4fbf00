package com.raditha.codetwin.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Folder and file structure of a collection, rendered as an ASCII tree for
 * verbose output. Unlike {@link FileSetCollector} every file is listed, not
 * only the ones that will be compared.
 */
public class RepositoryTree {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryTree.class);

    /**
     * Directories first, then case-insensitive name order.
     */
    private static final Comparator<Map.Entry<String, Node>> DISPLAY_ORDER = Comparator
            .comparing((Map.Entry<String, Node> e) -> e.getValue().isFile())
            .thenComparing(e -> e.getKey().toLowerCase())
            .thenComparing(Map.Entry::getKey);

    private final Node root;

    private RepositoryTree(Node root) {
        this.root = root;
    }

    /**
     * Walk {@code rootDir}, skipping directories whose name is in
     * {@code excludedDirectories}.
     */
    public static RepositoryTree scan(Path rootDir, Set<String> excludedDirectories) throws IOException {
        if (rootDir == null || !Files.isDirectory(rootDir)) {
            throw new IllegalArgumentException("Not a directory: " + rootDir);
        }
        Node top = Node.directory();
        Files.walkFileTree(rootDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(rootDir)) {
                    return FileVisitResult.CONTINUE;
                }
                if (excludedDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                nodeFor(top, rootDir.relativize(dir));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path relative = rootDir.relativize(file);
                Node parent = relative.getParent() == null ? top : nodeFor(top, relative.getParent());
                parent.children.putIfAbsent(relative.getFileName().toString(), Node.file());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Leaving unreadable entry out of tree: {}", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
        return new RepositoryTree(top);
    }

    private static Node nodeFor(Node top, Path relativeDir) {
        Node current = top;
        for (Path part : relativeDir) {
            current = current.children.computeIfAbsent(part.toString(), k -> Node.directory());
        }
        return current;
    }

    /**
     * Render the tree with {@code rootName} on the first line.
     */
    public String render(String rootName) {
        StringBuilder sb = new StringBuilder();
        sb.append(rootName).append('\n');
        renderChildren(root, "", sb);
        return sb.toString();
    }

    private static void renderChildren(Node node, String prefix, StringBuilder sb) {
        List<Map.Entry<String, Node>> items = new ArrayList<>(node.children.entrySet());
        items.sort(DISPLAY_ORDER);
        for (int i = 0; i < items.size(); i++) {
            boolean last = i == items.size() - 1;
            Map.Entry<String, Node> item = items.get(i);
            sb.append(prefix).append(last ? "└── " : "├── ").append(item.getKey()).append('\n');
            if (!item.getValue().isFile()) {
                renderChildren(item.getValue(), prefix + (last ? "    " : "│   "), sb);
            }
        }
    }

    private static final class Node {
        private final Map<String, Node> children;

        private Node(Map<String, Node> children) {
            this.children = children;
        }

        static Node directory() {
            return new Node(new TreeMap<>());
        }

        static Node file() {
            return new Node(null);
        }

        boolean isFile() {
            return children == null;
        }
    }
}
