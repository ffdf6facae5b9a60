package com.semsearch.ingest;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extension allow-list deciding which files are indexed, plus a MIME type hint for stored metadata.
 */
public class FileTypes {
    public static final List<String> DEFAULT_EXTENSIONS = List.of(
            "txt", "md", "js", "ts", "tsx", "jsx", "json", "yml", "yaml", "py", "java", "cs", "go", "rs",
            "rb", "php", "sh", "bat", "ps1", "csv", "tsv", "css", "html", "xml", "sql");

    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("js", "text/javascript"),
            Map.entry("jsx", "text/javascript"),
            Map.entry("ts", "text/typescript"),
            Map.entry("tsx", "text/tsx"),
            Map.entry("json", "application/json"),
            Map.entry("yml", "text/yaml"),
            Map.entry("yaml", "text/yaml"),
            Map.entry("py", "text/x-python"),
            Map.entry("java", "text/x-java-source"),
            Map.entry("cs", "text/x-csharp"),
            Map.entry("go", "text/x-go"),
            Map.entry("rs", "text/rust"),
            Map.entry("rb", "text/x-ruby"),
            Map.entry("php", "application/x-httpd-php"),
            Map.entry("sh", "application/x-sh"),
            Map.entry("bat", "application/x-msdos-program"),
            Map.entry("ps1", "text/plain"),
            Map.entry("csv", "text/csv"),
            Map.entry("tsv", "text/tab-separated-values"),
            Map.entry("css", "text/css"),
            Map.entry("html", "text/html"),
            Map.entry("xml", "application/xml"),
            Map.entry("sql", "application/sql"));

    private final Set<String> extensions;

    public FileTypes(Collection<String> extensions) {
        this.extensions = extensions.stream()
                .map(FileTypes::normalizeExtension)
                .filter(extension -> !extension.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static FileTypes defaults() {
        return new FileTypes(DEFAULT_EXTENSIONS);
    }

    public boolean isTextLike(Path file) {
        return extensions.contains(extension(file));
    }

    /**
     * Best-effort MIME type from the file extension, {@code null} when unknown.
     */
    public static String mimeType(Path file) {
        return MIME_TYPES.get(extension(file));
    }

    static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String filename = name.toString();
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String normalizeExtension(String extension) {
        String trimmed = extension == null ? "" : extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
