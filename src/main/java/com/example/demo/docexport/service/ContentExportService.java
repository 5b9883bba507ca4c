package com.example.demo.docexport.service;

import com.example.demo.docexport.aspect.LogExecutionTime;
import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.ExportArtifact;
import com.example.demo.docexport.model.ExportFormat;
import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.LatexExport;
import com.example.demo.docexport.renderer.DocxRenderer;
import com.example.demo.docexport.renderer.HtmlRenderer;
import com.example.demo.docexport.renderer.LatexSourceRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers that persist exports: runs one backend per
 * {@link ExportFormat} and wraps the result with a file name and MIME type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentExportService {
    static final String CONTENT_LIST_SUFFIX = "_content_list.json";

    private final HtmlRenderer htmlRenderer;
    private final DocxRenderer docxRenderer;
    private final LatexSourceRenderer latexRenderer;
    private final LatexPackageWriter latexPackageWriter;
    private final ContentListReader contentListReader;

    @LogExecutionTime("Content Export")
    public ExportArtifact export(List<ContentBlock> blocks, ExportFormat format, ImageLoader imageLoader, String baseName) {
        log.info("Exporting {} blocks of '{}' as {}", blocks.size(), baseName, format);
        byte[] data;
        switch (format) {
            case HTML:
                data = htmlRenderer.render(blocks, imageLoader).getBytes(StandardCharsets.UTF_8);
                break;
            case DOCX:
                data = docxRenderer.render(blocks, imageLoader);
                break;
            case LATEX: {
                LatexExport latex = latexRenderer.render(blocks, imageLoader);
                data = latexPackageWriter.write(latex, imageLoader);
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported export format " + format);
        }
        return new ExportArtifact(format, fileName(baseName, format), format.getMimeType(), data);
    }

    /**
     * Every format, in declaration order.
     */
    public Map<ExportFormat, ExportArtifact> exportAll(List<ContentBlock> blocks, ImageLoader imageLoader, String baseName) {
        Map<ExportFormat, ExportArtifact> artifacts = new EnumMap<>(ExportFormat.class);
        for (ExportFormat format : ExportFormat.values()) {
            artifacts.put(format, export(blocks, format, imageLoader, baseName));
        }
        return artifacts;
    }

    /**
     * Exports a content-list file, resolving images relative to its directory.
     */
    public ExportArtifact export(Path contentListFile, ExportFormat format) {
        List<ContentBlock> blocks = contentListReader.read(contentListFile);
        Path dir = contentListFile.toAbsolutePath().getParent();
        return export(blocks, format, new FileSystemImageLoader(dir), baseName(contentListFile));
    }

    static String baseName(Path contentListFile) {
        String name = contentListFile.getFileName().toString();
        if (name.endsWith(CONTENT_LIST_SUFFIX)) {
            return name.substring(0, name.length() - CONTENT_LIST_SUFFIX.length());
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String fileName(String baseName, ExportFormat format) {
        String base = baseName == null || baseName.isBlank() ? "export" : baseName;
        if (format == ExportFormat.LATEX) {
            return base + "_latex." + format.getExtension();
        }
        return base + "." + format.getExtension();
    }
}
