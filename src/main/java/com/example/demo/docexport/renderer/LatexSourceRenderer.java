package com.example.demo.docexport.renderer;

import com.example.demo.docexport.aspect.LogExecutionTime;
import com.example.demo.docexport.config.ExportProperties;
import com.example.demo.docexport.latex.MathExpressionPipeline;
import com.example.demo.docexport.model.CodeBlock;
import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.EquationBlock;
import com.example.demo.docexport.model.ExportFormat;
import com.example.demo.docexport.model.ImageBlock;
import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.LatexExport;
import com.example.demo.docexport.model.ListBlock;
import com.example.demo.docexport.model.MathExpression;
import com.example.demo.docexport.model.TableBlock;
import com.example.demo.docexport.model.TextBlock;
import com.example.demo.docexport.util.HtmlFragments;
import com.example.demo.docexport.util.LatexEscaper;
import com.example.demo.docexport.util.ListClassifier;
import com.example.demo.docexport.util.PackagePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a content list as a LaTeX article (ctex, for CJK text) and reports
 * which image files the source includes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LatexSourceRenderer implements ContentRenderer<LatexExport> {

    private static final List<String> PREAMBLE = List.of(
            "\\documentclass{article}",
            "\\usepackage[UTF8]{ctex}",
            "\\usepackage{amsmath, amssymb}",
            "\\usepackage{graphicx}",
            "\\usepackage{float}",
            "\\usepackage{microtype}",
            "\\usepackage{hyperref}",
            "\\setlength{\\emergencystretch}{3em}",
            "\\sloppy",
            "\\begin{document}");

    private static final String[] SECTIONING = {"section", "subsection", "subsubsection", "paragraph"};

    private final MathExpressionPipeline mathPipeline;
    private final ExportProperties properties;

    @Override
    public ExportFormat format() {
        return ExportFormat.LATEX;
    }

    /**
     * Renders every block; each image path is referenced whether or not the
     * file exists.
     */
    @LogExecutionTime("LaTeX Rendering")
    public LatexExport render(List<ContentBlock> blocks) {
        return renderInternal(blocks, null);
    }

    /**
     * Renders every block, omitting figures whose image the loader cannot
     * resolve.
     */
    @Override
    @LogExecutionTime("LaTeX Rendering")
    public LatexExport render(List<ContentBlock> blocks, ImageLoader imageLoader) {
        return renderInternal(blocks, imageLoader);
    }

    private LatexExport renderInternal(List<ContentBlock> blocks, ImageLoader imageLoader) {
        List<String> lines = new ArrayList<>();
        Set<String> images = new LinkedHashSet<>();
        for (int index = 0; index < blocks.size(); index++) {
            ContentBlock block = blocks.get(index);
            switch (block.getType()) {
                case TEXT:
                    appendText(lines, (TextBlock) block);
                    break;
                case EQUATION:
                    appendEquation(lines, (EquationBlock) block, index);
                    break;
                case LIST:
                    appendList(lines, (ListBlock) block);
                    break;
                case IMAGE: {
                    ImageBlock image = (ImageBlock) block;
                    if (isAvailable(image.getPath(), imageLoader, index)) {
                        images.add(image.getPath());
                        appendFigure(lines, PackagePaths.relativeName(image.getPath()), image.getCaptions());
                    }
                    break;
                }
                case TABLE:
                    appendTable(lines, (TableBlock) block, images, imageLoader, index);
                    break;
                case CODE:
                    appendCode(lines, (CodeBlock) block);
                    break;
                default:
                    log.debug("Skipping block {} of type {}", index, block.getType());
            }
        }

        List<String> document = new ArrayList<>(PREAMBLE);
        document.addAll(lines);
        document.add("\\end{document}");
        return new LatexExport(String.join("\n", document), List.copyOf(images));
    }

    private void appendText(List<String> lines, TextBlock block) {
        String escaped = LatexEscaper.escapeText(HtmlFragments.normalizeInline(block.getText()));
        if (block.isHeading()) {
            lines.add("\\" + SECTIONING[block.getLevel() - 1] + "{" + escaped + "}");
        } else {
            lines.add(escaped + "\n");
        }
    }

    private void appendEquation(List<String> lines, EquationBlock block, int index) {
        MathExpression math = mathPipeline.process(block.getText());
        if (math.isEmpty()) {
            log.debug("Skipping empty equation at block {}", index);
            return;
        }
        if (math.hasTag()) {
            lines.add("\\begin{equation}");
            lines.add("  " + math.getBody());
            lines.add("\\end{equation}");
        } else {
            lines.add("\\[");
            lines.add("  " + math.getBody());
            lines.add("\\]");
        }
    }

    private void appendList(List<String> lines, ListBlock block) {
        if (block.getItems().isEmpty()) {
            return;
        }
        String env = ListClassifier.isNumbered(block.getItems()) ? "enumerate" : "itemize";
        lines.add("\\begin{" + env + "}");
        for (String item : block.getItems()) {
            lines.add("  \\item " + LatexEscaper.escapeText(HtmlFragments.normalizeInline(item)));
        }
        lines.add("\\end{" + env + "}");
    }

    private void appendTable(List<String> lines, TableBlock block, Set<String> images,
                             ImageLoader imageLoader, int index) {
        List<List<String>> rows = block.hasHtmlBody()
                ? HtmlFragments.tableRows(block.getHtmlBody())
                : List.of();
        if (!rows.isEmpty() && !rows.get(0).isEmpty()) {
            appendTabular(lines, rows);
            if (!block.getCaptions().isEmpty()) {
                lines.add(LatexEscaper.escapeText(String.join(" ", block.getCaptions())) + "\n");
            }
        } else if (isAvailable(block.getPath(), imageLoader, index)) {
            images.add(block.getPath());
            appendFigure(lines, PackagePaths.relativeName(block.getPath()), block.getCaptions());
        }
    }

    /**
     * Column count comes from the first row; every other row is cut or padded
     * to match.
     */
    private void appendTabular(List<String> lines, List<List<String>> rows) {
        int columns = rows.get(0).size();
        lines.add("\\begin{tabular}{" + String.join("|", Collections.nCopies(columns, "l")) + "}");
        lines.add("\\hline");
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++) {
                cells.add(c < row.size()
                        ? LatexEscaper.escapeText(HtmlFragments.normalizeInline(row.get(c)))
                        : "");
            }
            lines.add(String.join(" & ", cells) + " \\\\ \\hline");
        }
        lines.add("\\end{tabular}");
    }

    private void appendFigure(List<String> lines, String path, List<String> captions) {
        lines.add("\\begin{figure}[htbp]");
        lines.add("  \\centering");
        lines.add("  \\includegraphics[width=" + properties.getLatex().getImageWidth() + "]{" + path + "}");
        if (!captions.isEmpty()) {
            lines.add("  \\caption{" + LatexEscaper.escapeText(String.join(" ", captions)) + "}");
        }
        lines.add("\\end{figure}");
    }

    private void appendCode(List<String> lines, CodeBlock block) {
        lines.add("\\begin{verbatim}");
        lines.add(block.getBody() == null ? "" : block.getBody());
        lines.add("\\end{verbatim}");
    }

    /**
     * Without a loader every non-blank path inside the package counts as
     * available.
     */
    private static boolean isAvailable(String path, ImageLoader imageLoader, int index) {
        if (path == null || path.isBlank()) {
            return false;
        }
        if (PackagePaths.relativeName(path).isEmpty()) {
            log.warn("Image path {} of block {} leaves the package, omitting figure", path, index);
            return false;
        }
        if (imageLoader == null) {
            return true;
        }
        if (imageLoader.load(path).isPresent()) {
            return true;
        }
        log.debug("Image {} of block {} did not resolve, omitting figure", path, index);
        return false;
    }
}
