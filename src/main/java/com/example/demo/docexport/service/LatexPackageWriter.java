package com.example.demo.docexport.service;

import com.example.demo.docexport.config.ExportProperties;
import com.example.demo.docexport.exception.ExportException;
import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.LatexExport;
import com.example.demo.docexport.model.RenderAsset;
import com.example.demo.docexport.util.PackagePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Bundles LaTeX source and the images it includes into one zip. Each image is
 * stored under the same relative name the source includes it by.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LatexPackageWriter {

    private final ExportProperties properties;

    public byte[] write(LatexExport export, ImageLoader imageLoader) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            zip.putNextEntry(new ZipEntry(properties.getLatex().getMainFileName()));
            zip.write(export.getSource().getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();

            Set<String> written = new HashSet<>();
            for (String path : export.getReferencedImages()) {
                String entryName = PackagePaths.relativeName(path);
                if (entryName.isEmpty() || !written.add(entryName)) {
                    continue;
                }
                Optional<RenderAsset> asset = imageLoader.load(path);
                if (asset.isEmpty()) {
                    log.warn("Referenced image {} is missing from the package", path);
                    continue;
                }
                zip.putNextEntry(new ZipEntry(entryName));
                zip.write(asset.get().getData());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new ExportException("Failed to write LaTeX package", e);
        }
        return buffer.toByteArray();
    }
}
