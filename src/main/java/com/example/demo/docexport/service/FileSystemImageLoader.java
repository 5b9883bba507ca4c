package com.example.demo.docexport.service;

import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.RenderAsset;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves content-list image paths against a job's output directory.
 * Paths that leave the directory resolve to nothing.
 */
@Slf4j
public class FileSystemImageLoader implements ImageLoader {

    private static final String DEFAULT_MIME = "application/octet-stream";

    private static final Map<String, String> MIME_BY_EXTENSION = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "bmp", "image/bmp",
            "tif", "image/tiff",
            "tiff", "image/tiff",
            "webp", "image/webp",
            "svg", "image/svg+xml");

    private final Path baseDir;

    public FileSystemImageLoader(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public Optional<RenderAsset> load(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        Path resolved;
        try {
            resolved = baseDir.resolve(path).normalize();
        } catch (RuntimeException e) {
            log.debug("Invalid image path {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        if (!resolved.startsWith(baseDir)) {
            log.warn("Image path {} escapes {}, ignoring", path, baseDir);
            return Optional.empty();
        }
        if (!Files.isRegularFile(resolved)) {
            log.debug("Image {} not found under {}", path, baseDir);
            return Optional.empty();
        }
        try {
            byte[] data = Files.readAllBytes(resolved);
            return Optional.of(new RenderAsset(resolved.getFileName().toString(), data, mimeType(resolved)));
        } catch (IOException e) {
            log.warn("Failed to read image {}: {}", resolved, e.getMessage());
            return Optional.empty();
        }
    }

    static String mimeType(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_MIME;
        }
        return MIME_BY_EXTENSION.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), DEFAULT_MIME);
    }
}
