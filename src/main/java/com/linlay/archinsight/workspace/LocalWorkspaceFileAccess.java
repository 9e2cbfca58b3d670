package com.linlay.archinsight.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link WorkspaceFileAccess} over a directory on the local file system. Paths that resolve
 * outside the root, lexically or through a symbolic link, are reported as missing. Grep does not
 * descend into linked directories.
 */
public class LocalWorkspaceFileAccess implements WorkspaceFileAccess {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkspaceFileAccess.class);
    public static final Set<String> DEFAULT_SKIPPED_DIRECTORIES = Set.of("node_modules", "dist", "build", "target");
    private static final int CONTEXT_LINES = 2;

    private final Path root;
    private final Set<String> skippedDirectories;

    public LocalWorkspaceFileAccess(Path root) {
        this(root, DEFAULT_SKIPPED_DIRECTORIES);
    }

    public LocalWorkspaceFileAccess(Path root, Set<String> skippedDirectories) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        this.root = root.toAbsolutePath().normalize();
        this.skippedDirectories = skippedDirectories == null ? Set.of() : Set.copyOf(skippedDirectories);
    }

    public Path root() {
        return root;
    }

    @Override
    public List<FileResponse> readFiles(List<String> paths) {
        if (paths == null) {
            return List.of();
        }
        List<FileResponse> responses = new ArrayList<>();
        for (String path : paths) {
            responses.add(readFile(path));
        }
        return responses;
    }

    public FileResponse readFile(String relativePath) {
        if (!StringUtils.hasText(relativePath)) {
            return FileResponse.missing(relativePath);
        }
        Path resolved;
        try {
            resolved = root.resolve(relativePath.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            log.debug("Rejecting invalid path \"{}\": {}", relativePath, ex.getReason());
            return FileResponse.missing(relativePath);
        }
        if (!resolved.startsWith(root) || !Files.isRegularFile(resolved) || !isInsideRoot(resolved)) {
            return FileResponse.missing(relativePath);
        }
        try {
            String content = Files.readString(resolved, StandardCharsets.UTF_8);
            return new FileResponse(relativePath, content, content.split("\n", -1).length, true);
        } catch (MalformedInputException ex) {
            log.debug("Skipping non-UTF-8 file {}", relativePath);
            return FileResponse.missing(relativePath);
        } catch (IOException ex) {
            throw new ToolFulfillmentException("Failed to read " + relativePath, ex);
        }
    }

    @Override
    public GrepResponse grep(String pattern, String filePattern, int maxResults) {
        if (!StringUtils.hasText(pattern)) {
            return GrepResponse.empty(pattern);
        }
        Pattern regex;
        try {
            regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            log.warn("Invalid grep pattern \"{}\": {}", pattern, ex.getDescription());
            return GrepResponse.empty(pattern);
        }
        Pattern fileFilter = StringUtils.hasText(filePattern) ? globToRegex(filePattern.trim()) : null;
        int cap = maxResults > 0 ? maxResults : 20;

        GrepCollector collector = new GrepCollector(regex, fileFilter, cap);
        try {
            collector.searchDirectory(root);
        } catch (UncheckedIOException ex) {
            throw new ToolFulfillmentException("Failed to search workspace for \"" + pattern + "\"", ex.getCause());
        }
        return new GrepResponse(pattern, collector.matches, collector.totalMatches, collector.limited);
    }

    private boolean isInsideRoot(Path path) {
        try {
            return path.toRealPath().startsWith(root.toRealPath());
        } catch (IOException ex) {
            log.debug("Cannot resolve real path of {}: {}", path, ex.getMessage());
            return false;
        }
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (int i = 0; i < glob.length(); i++) {
            char ch = glob.charAt(i);
            if (ch == '*') {
                if (glob.startsWith("**/", i)) {
                    regex.append("(?:.*/)?");
                    i += 2;
                } else if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (ch == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }

    private final class GrepCollector {

        private final Pattern regex;
        private final Pattern fileFilter;
        private final int cap;
        private final List<GrepMatch> matches = new ArrayList<>();
        private int totalMatches;
        private boolean limited;

        private GrepCollector(Pattern regex, Pattern fileFilter, int cap) {
            this.regex = regex;
            this.fileFilter = fileFilter;
            this.cap = cap;
        }

        private void searchDirectory(Path directory) {
            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                stream.forEach(entries::add);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            entries.sort(Comparator.comparing(path -> path.getFileName().toString()));
            for (Path entry : entries) {
                if (limited) {
                    return;
                }
                String name = entry.getFileName().toString();
                if (name.startsWith(".") || skippedDirectories.contains(name)) {
                    continue;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    searchDirectory(entry);
                } else if (Files.isRegularFile(entry)
                        && (!Files.isSymbolicLink(entry) || isInsideRoot(entry))) {
                    String relative = root.relativize(entry).toString().replace('\\', '/');
                    if (fileFilter == null || fileFilter.matcher(relative).matches()) {
                        searchFile(entry, relative);
                    }
                }
            }
        }

        private void searchFile(Path file, String relative) {
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (MalformedInputException ex) {
                return;
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            for (int i = 0; i < lines.size(); i++) {
                if (!regex.matcher(lines.get(i)).find()) {
                    continue;
                }
                if (matches.size() >= cap) {
                    limited = true;
                    return;
                }
                totalMatches++;
                matches.add(new GrepMatch(
                        relative,
                        i + 1,
                        lines.get(i).trim(),
                        lines.subList(Math.max(0, i - CONTEXT_LINES), i),
                        lines.subList(i + 1, Math.min(lines.size(), i + 1 + CONTEXT_LINES))
                ));
            }
        }
    }
}
