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
import com.example.demo.docexport.model.ListBlock;
import com.example.demo.docexport.model.MathExpression;
import com.example.demo.docexport.model.RenderAsset;
import com.example.demo.docexport.model.TableBlock;
import com.example.demo.docexport.model.TextBlock;
import com.example.demo.docexport.util.HtmlFragments;
import com.example.demo.docexport.util.ListClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Renders a content list as a standalone HTML5 page. Math is left as TeX
 * source for MathJax to typeset in the browser; images are inlined as data
 * URIs so the page has no external files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HtmlRenderer implements ContentRenderer<String> {

    private static final String STYLESHEET = String.join("\n",
            "    body { font-family: 'Helvetica Neue', Arial, 'Microsoft YaHei', sans-serif; padding: 2rem; line-height: 1.6; }",
            "    h1, h2, h3, h4 { font-weight: 600; margin-top: 2em; }",
            "    .equation { text-align: center; margin: 1.5em 0; font-family: 'CMU Serif', 'Times New Roman', serif; }",
            "    figure.image { text-align: center; margin: 1.5em auto; }",
            "    figure.image img { max-width: 90%; height: auto; }",
            "    figcaption { font-size: 0.9em; color: #555; margin-top: 0.5em; }",
            "    .table-caption { font-size: 0.9em; color: #555; margin: 0.5em 0 1.5em 0; }",
            "    .code-caption { font-size: 0.9em; color: #555; margin: 1em 0 0.5em 0; }",
            "    pre { background: #1f1f1f; color: #f8f8f2; padding: 1rem; border-radius: 0.5rem; overflow-x: auto; }",
            "    table { border-collapse: collapse; width: 100%; margin: 1.5em 0; }",
            "    table, th, td { border: 1px solid #ddd; }",
            "    th, td { padding: 0.75em; text-align: left; }");

    private static final String MATHJAX_CONFIG = String.join("\n",
            "    window.MathJax = {",
            "      tex: {",
            "        inlineMath: [['$', '$'], ['\\\\(', '\\\\)']],",
            "        displayMath: [['$$', '$$'], ['\\\\[', '\\\\]']],",
            "      },",
            "      svg: { fontCache: 'global' }",
            "    };");

    private final MathExpressionPipeline mathPipeline;
    private final ExportProperties properties;

    @Override
    public ExportFormat format() {
        return ExportFormat.HTML;
    }

    @Override
    @LogExecutionTime("HTML Rendering")
    public String render(List<ContentBlock> blocks, ImageLoader imageLoader) {
        List<String> body = new ArrayList<>();
        for (int index = 0; index < blocks.size(); index++) {
            ContentBlock block = blocks.get(index);
            switch (block.getType()) {
                case TEXT:
                    appendText(body, (TextBlock) block);
                    break;
                case EQUATION:
                    appendEquation(body, (EquationBlock) block, index);
                    break;
                case LIST:
                    appendList(body, (ListBlock) block);
                    break;
                case IMAGE:
                    appendImage(body, (ImageBlock) block, imageLoader, index);
                    break;
                case TABLE:
                    appendTable(body, (TableBlock) block, imageLoader, index);
                    break;
                case CODE:
                    appendCode(body, (CodeBlock) block);
                    break;
                default:
                    log.debug("Skipping block {} of type {}", index, block.getType());
            }
        }
        return wrapDocument(body);
    }

    private void appendText(List<String> body, TextBlock block) {
        String raw = block.getText() == null ? "" : block.getText();
        if (block.isHeading()) {
            body.add("<h" + block.getLevel() + ">" + raw + "</h" + block.getLevel() + ">");
        } else {
            body.add("<p>" + raw.replace("\n", "<br/>") + "</p>");
        }
    }

    private void appendEquation(List<String> body, EquationBlock block, int index) {
        MathExpression math = mathPipeline.process(block.getText());
        if (math.isEmpty()) {
            log.debug("Skipping empty equation at block {}", index);
            return;
        }
        String wrapped = math.isDisplay() || math.hasTag()
                ? "$$" + math.getBody() + "$$"
                : "$" + math.getBody() + "$";
        body.add("<div class=\"equation\">");
        body.add(HtmlFragments.escapeHtml(wrapped));
        body.add("</div>");
    }

    private void appendList(List<String> body, ListBlock block) {
        List<String> items = block.getItems();
        if (items.isEmpty()) {
            return;
        }
        String tag = ListClassifier.isNumbered(items) ? "ol" : "ul";
        body.add("<" + tag + ">");
        for (String item : items) {
            body.add("<li>" + item + "</li>");
        }
        body.add("</" + tag + ">");
    }

    private void appendImage(List<String> body, ImageBlock block, ImageLoader imageLoader, int index) {
        Optional<RenderAsset> asset = resolve(block.getPath(), imageLoader, index);
        if (asset.isEmpty()) {
            return;
        }
        body.add("<figure class=\"image\">");
        body.add("<img src=\"" + dataUri(asset.get()) + "\" alt=\"figure\"/>");
        if (!block.getCaptions().isEmpty()) {
            body.add("<figcaption>" + String.join("<br/>", block.getCaptions()) + "</figcaption>");
        }
        body.add("</figure>");
    }

    private void appendTable(List<String> body, TableBlock block, ImageLoader imageLoader, int index) {
        if (block.hasHtmlBody()) {
            body.add(block.getHtmlBody());
        } else if (block.hasPath()) {
            resolve(block.getPath(), imageLoader, index)
                    .ifPresent(asset -> body.add("<img src=\"" + dataUri(asset) + "\" alt=\"table\"/>"));
        }
        if (!block.getCaptions().isEmpty()) {
            body.add("<p class=\"table-caption\">" + String.join("<br/>", block.getCaptions()) + "</p>");
        }
    }

    private void appendCode(List<String> body, CodeBlock block) {
        String language = block.getLanguage() == null ? "" : block.getLanguage();
        if (!block.getCaptions().isEmpty()) {
            body.add("<p class=\"code-caption\">" + String.join("<br/>", block.getCaptions()) + "</p>");
        }
        body.add("<pre><code class=\"language-" + language + "\">"
                + HtmlFragments.escapeHtml(block.getBody()) + "</code></pre>");
    }

    private Optional<RenderAsset> resolve(String path, ImageLoader imageLoader, int index) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        Optional<RenderAsset> asset = imageLoader.load(path);
        if (asset.isEmpty()) {
            log.debug("Image {} of block {} did not resolve, skipping", path, index);
        }
        return asset;
    }

    private static String dataUri(RenderAsset asset) {
        return "data:" + asset.getMime() + ";base64," + Base64.getEncoder().encodeToString(asset.getData());
    }

    private String wrapDocument(List<String> body) {
        ExportProperties.Html html = properties.getHtml();
        List<String> parts = new ArrayList<>();
        parts.add("<!DOCTYPE html>");
        parts.add("<html lang=\"" + html.getLang() + "\">");
        parts.add("<head>");
        parts.add("  <meta charset=\"utf-8\" />");
        parts.add("  <title>" + HtmlFragments.escapeHtml(html.getTitle()) + "</title>");
        parts.add("  <style>");
        parts.add(STYLESHEET);
        parts.add("  </style>");
        parts.add("  <script>");
        parts.add(MATHJAX_CONFIG);
        parts.add("  </script>");
        parts.add("  <script async src=\"" + html.getMathjaxUrl() + "\"></script>");
        parts.add("</head>");
        parts.add("<body>");
        parts.addAll(body);
        parts.add("</body>");
        parts.add("</html>");
        return String.join("\n", parts);
    }
}
