package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File operations inside a sandbox directory: read, write, list, exists.
 *
 * Security model:
 * - every path is resolved against the base directory and must stay inside it
 * - writes are limited to an extension allowlist and a size cap
 * - reads are limited by the same size cap
 *
 * The base directory is created on first use.
 */
@Slf4j
public class FileSystemTool implements AgentTool {

    private final ToolProperties.Filesystem properties;

    public FileSystemTool() {
        this(new ToolProperties.Filesystem());
    }

    public FileSystemTool(ToolProperties.Filesystem properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "filesystem";
    }

    @Override
    public String getDescription() {
        return """
                Perform file system operations like read, write, list files, or check whether a path exists.
                Paths are relative to the agent's working directory.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "operation", Map.of(
                                "type", "string",
                                "enum", List.of("read", "write", "list", "exists"),
                                "description", "The operation to perform"
                        ),
                        "path", Map.of(
                                "type", "string",
                                "description", "File or directory path, e.g. 'notes/plan.md'"
                        ),
                        "content", Map.of(
                                "type", "string",
                                "description", "File content for write operations"
                        )
                ),
                "required", List.of("operation", "path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object operation = arguments.get("operation");
        if (operation == null || operation.toString().isBlank()) {
            return "ERROR: 'operation' is required (read, write, list, exists)";
        }

        try {
            Files.createDirectories(getBaseDir());
            return switch (operation.toString().toLowerCase()) {
                case "read" -> readFile(arguments);
                case "write" -> writeFile(arguments);
                case "list" -> listDirectory(arguments);
                case "exists" -> exists(arguments);
                default -> "ERROR: Unsupported operation '" + operation + "'";
            };
        } catch (SecurityException | IOException e) {
            log.warn("Filesystem operation failed [operation={}]: {}", operation, e.getMessage());
            return "ERROR: File system error: " + e.getMessage();
        }
    }

    private String readFile(Map<String, Object> args) throws IOException {
        Path path = resolveSafePath(args.get("path"));
        if (path == null) return "ERROR: 'path' is required for read";

        if (!Files.isRegularFile(path)) {
            return "ERROR: File not found: " + args.get("path");
        }

        long sizeKb = Files.size(path) / 1024;
        if (sizeKb > properties.getMaxFileSizeKb()) {
            return String.format("ERROR: File too large (%d KB). Max allowed: %d KB",
                    sizeKb, properties.getMaxFileSizeKb());
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private String writeFile(Map<String, Object> args) throws IOException {
        Path path = resolveSafePath(args.get("path"));
        if (path == null) return "ERROR: 'path' is required for write";

        Object content = args.get("content");
        String text = content == null ? "" : content.toString();

        String ext = getExtension(path.getFileName().toString());
        if (!properties.getAllowedExtensionList().contains(ext)) {
            return "ERROR: Extension '." + ext + "' not allowed. Allowed: " + properties.getAllowedExtensionList();
        }

        int maxBytes = properties.getMaxFileSizeKb() * 1024;
        if (text.length() > maxBytes) {
            return String.format("ERROR: Content too large (%d bytes). Max: %d KB",
                    text.length(), properties.getMaxFileSizeKb());
        }

        Files.createDirectories(path.getParent());
        Files.writeString(path, text, StandardCharsets.UTF_8);
        log.info("Written file: {} ({} bytes)", path.getFileName(), text.length());
        return "Successfully wrote to: " + args.get("path");
    }

    private String listDirectory(Map<String, Object> args) throws IOException {
        Object requested = args.get("path");
        Path dir = requested == null || requested.toString().isBlank() ? getBaseDir() : resolveSafePath(requested);

        if (dir == null || !Files.isDirectory(dir)) {
            return "ERROR: Directory not found: " + requested;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            String listing = entries
                    .map(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : ""))
                    .sorted()
                    .collect(Collectors.joining("\n"));
            return "Contents of " + (requested == null ? "/" : requested) + ":\n" + listing;
        }
    }

    private String exists(Map<String, Object> args) throws IOException {
        Path path = resolveSafePath(args.get("path"));
        if (path == null) return "ERROR: 'path' is required for exists";
        return "Path exists: " + Files.exists(path);
    }

    /**
     * Resolves a path inside the base directory. Returns null if the path is
     * missing; throws SecurityException if it escapes the base directory.
     */
    private Path resolveSafePath(Object raw) throws IOException {
        if (raw == null || raw.toString().isBlank()) return null;

        Path base = getBaseDir().toRealPath(LinkOption.NOFOLLOW_LINKS);
        Path resolved = base.resolve(raw.toString()).normalize();

        if (!resolved.startsWith(base)) {
            throw new SecurityException("Path escapes the working directory: '" + raw + "'");
        }
        return resolved;
    }

    private Path getBaseDir() {
        return Paths.get(properties.getBaseDirectory()).toAbsolutePath();
    }

    private String getExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1).toLowerCase() : "";
    }
}
