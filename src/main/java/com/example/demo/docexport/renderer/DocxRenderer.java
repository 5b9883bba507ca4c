package com.example.demo.docexport.renderer;

import com.example.demo.docexport.aspect.LogExecutionTime;
import com.example.demo.docexport.config.ExportProperties;
import com.example.demo.docexport.exception.ExportException;
import com.example.demo.docexport.exception.MathConversionException;
import com.example.demo.docexport.latex.MathExpressionPipeline;
import com.example.demo.docexport.math.MathConversionChain;
import com.example.demo.docexport.math.MathMarkupFragment;
import com.example.demo.docexport.math.PlainTextMathFallback;
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
import com.example.demo.docexport.util.InlineMathSplitter;
import com.example.demo.docexport.util.InlineMathSplitter.Segment;
import com.example.demo.docexport.util.ListClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a content list into a .docx document with Apache POI.
 *
 * Math is converted to native Office Math and spliced into the paragraph XML;
 * an expression the conversion chain rejects is written as readable plain
 * text instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocxRenderer implements ContentRenderer<byte[]> {

    /**
     * Tallest picture, in inches; taller ones are scaled down to fit.
     */
    private static final double MAX_IMAGE_HEIGHT_INCHES = 9.0;

    private static final Map<Integer, Integer> HEADING_FONT_SIZES = Map.of(1, 16, 2, 14, 3, 13, 4, 12);

    private static final Map<String, Integer> PICTURE_TYPES = Map.of(
            "image/png", Document.PICTURE_TYPE_PNG,
            "image/jpeg", Document.PICTURE_TYPE_JPEG,
            "image/jpg", Document.PICTURE_TYPE_JPEG,
            "image/gif", Document.PICTURE_TYPE_GIF,
            "image/bmp", Document.PICTURE_TYPE_BMP,
            "image/tiff", Document.PICTURE_TYPE_TIFF,
            "image/x-emf", Document.PICTURE_TYPE_EMF,
            "image/x-wmf", Document.PICTURE_TYPE_WMF);

    private final MathExpressionPipeline mathPipeline;
    private final MathConversionChain mathChain;
    private final ExportProperties properties;

    @Override
    public ExportFormat format() {
        return ExportFormat.DOCX;
    }

    @Override
    @LogExecutionTime("DOCX Rendering")
    public byte[] render(List<ContentBlock> blocks, ImageLoader imageLoader) {
        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            DocxStyles styles = DocxStyles.install(document, properties.getDocx().getTableStyle());
            for (int index = 0; index < blocks.size(); index++) {
                ContentBlock block = blocks.get(index);
                switch (block.getType()) {
                    case TEXT:
                        appendText(document, (TextBlock) block, index);
                        break;
                    case EQUATION:
                        appendEquation(document, (EquationBlock) block, index);
                        break;
                    case LIST:
                        appendList(document, (ListBlock) block, styles);
                        break;
                    case IMAGE:
                        appendImage(document, (ImageBlock) block, imageLoader, index);
                        break;
                    case TABLE:
                        appendTable(document, (TableBlock) block, imageLoader, index);
                        break;
                    case CODE:
                        appendCode(document, (CodeBlock) block);
                        break;
                    default:
                        log.debug("Skipping block {} of type {}", index, block.getType());
                }
            }
            document.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new ExportException("Failed to write DOCX document", e);
        }
    }

    // ---- text ----

    private void appendText(XWPFDocument document, TextBlock block, int index) {
        String raw = block.getText() == null ? "" : block.getText();
        List<Segment> segments = InlineMathSplitter.split(raw);
        boolean hasMath = segments.stream().anyMatch(Segment::isMath);

        if (!hasMath) {
            String text = HtmlFragments.toPlainText(raw);
            if (text.isBlank()) {
                return;
            }
            XWPFParagraph paragraph = newTextParagraph(document, block);
            addTextRun(paragraph, text, block);
            return;
        }

        // Resolve every piece first so an all-empty body never creates a paragraph.
        List<Object> pieces = new ArrayList<>();
        for (Segment segment : segments) {
            if (!segment.isMath()) {
                String plain = HtmlFragments.toPlainText(segment.getText());
                if (!plain.isEmpty()) {
                    pieces.add(plain);
                }
                continue;
            }
            MathExpression math = mathPipeline.process(segment.getText());
            if (math.isEmpty()) {
                continue;
            }
            try {
                pieces.add(mathChain.renderMath(math.getBody(), true));
            } catch (MathConversionException e) {
                log.debug("Inline math in block {} fell back to plain text: {}", index, e.getMessage());
                pieces.add(PlainTextMathFallback.render(math.getBody()));
            }
        }
        if (pieces.isEmpty()) {
            return;
        }

        XWPFParagraph paragraph = newTextParagraph(document, block);
        for (Object piece : pieces) {
            if (piece instanceof MathMarkupFragment) {
                MathMarkupFragment fragment = (MathMarkupFragment) piece;
                appendMath(paragraph, fragment.getOmml());
                if (!fragment.tagSuffix().isEmpty()) {
                    addTextRun(paragraph, fragment.tagSuffix(), block);
                }
            } else {
                addTextRun(paragraph, (String) piece, block);
            }
        }
    }

    private XWPFParagraph newTextParagraph(XWPFDocument document, TextBlock block) {
        XWPFParagraph paragraph = document.createParagraph();
        if (block.isHeading()) {
            paragraph.setStyle(DocxStyles.headingStyleId(block.getLevel()));
        } else {
            paragraph.setAlignment(ParagraphAlignment.BOTH);
        }
        return paragraph;
    }

    private void addTextRun(XWPFParagraph paragraph, String text, TextBlock block) {
        XWPFRun run = newRun(paragraph, text);
        if (block.isHeading()) {
            run.setBold(true);
            run.setFontSize(HEADING_FONT_SIZES.get(block.getLevel()));
        }
        moveToParagraphEnd(paragraph, run);
    }

    // ---- equations ----

    private void appendEquation(XWPFDocument document, EquationBlock block, int index) {
        MathExpression math = mathPipeline.process(block.getText());
        if (math.isEmpty()) {
            log.debug("Skipping empty equation at block {}", index);
            return;
        }
        MathMarkupFragment fragment;
        try {
            fragment = mathChain.renderMath(math.getBody(), false);
        } catch (MathConversionException e) {
            log.warn("Equation at block {} fell back to plain text: {}", index, e.getMessage());
            String fallback = PlainTextMathFallback.render(math.getBody());
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            newRun(paragraph, fallback.isBlank() ? math.getBody() : fallback);
            return;
        }
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        appendMath(paragraph, fragment.getOmml());
        if (!fragment.tagSuffix().isEmpty()) {
            moveToParagraphEnd(paragraph, newRun(paragraph, fragment.tagSuffix()));
        }
    }

    /**
     * Copies the OMML element to the end of the paragraph's XML.
     */
    private static void appendMath(XWPFParagraph paragraph, XmlObject math) {
        try (XmlCursor source = math.newCursor();
             XmlCursor target = paragraph.getCTP().newCursor()) {
            source.toFirstContentToken();
            target.toEndToken();
            source.copyXml(target);
        }
    }

    // ---- lists ----

    private void appendList(XWPFDocument document, ListBlock block, DocxStyles styles) {
        if (block.getItems().isEmpty()) {
            return;
        }
        boolean numbered = ListClassifier.isNumbered(block.getItems());
        BigInteger numId = numbered ? styles.newNumberedList() : styles.bulletList();
        for (String item : block.getItems()) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setStyle(numbered ? DocxStyles.LIST_NUMBER : DocxStyles.LIST_BULLET);
            paragraph.setNumID(numId);
            paragraph.setNumILvl(BigInteger.ZERO);
            newRun(paragraph, HtmlFragments.toPlainText(item));
        }
    }

    // ---- images and tables ----

    private void appendImage(XWPFDocument document, ImageBlock block, ImageLoader imageLoader, int index) {
        if (!embedPicture(document, block.getPath(), imageLoader, index)) {
            return;
        }
        appendCaption(document, block.getCaptions());
    }

    private void appendTable(XWPFDocument document, TableBlock block, ImageLoader imageLoader, int index) {
        boolean rendered = false;
        if (block.hasHtmlBody()) {
            rendered = appendNativeTable(document, HtmlFragments.tableRows(block.getHtmlBody()), index);
        }
        if (!rendered && block.hasPath()) {
            embedPicture(document, block.getPath(), imageLoader, index);
        }
        appendCaption(document, block.getCaptions());
    }

    private boolean appendNativeTable(XWPFDocument document, List<List<String>> rows, int index) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            log.debug("Table body of block {} has no usable rows", index);
            return false;
        }
        // the first row fixes the column count; longer rows are cut, shorter ones padded
        int columns = rows.get(0).size();
        XWPFTable table = document.createTable(rows.size(), columns);
        String style = properties.getDocx().getTableStyle();
        if (style != null && document.getStyles() != null && document.getStyles().styleExist(style)) {
            table.setStyleID(style);
        }
        for (int r = 0; r < rows.size(); r++) {
            List<String> cells = rows.get(r);
            for (int c = 0; c < Math.min(columns, cells.size()); c++) {
                table.getRow(r).getCell(c).setText(HtmlFragments.toPlainText(cells.get(c)).strip());
            }
        }
        return true;
    }

    private boolean embedPicture(XWPFDocument document, String path, ImageLoader imageLoader, int index) {
        if (path == null || path.isBlank()) {
            return false;
        }
        Optional<RenderAsset> loaded = imageLoader.load(path);
        if (loaded.isEmpty()) {
            log.debug("Image {} of block {} did not resolve, skipping", path, index);
            return false;
        }
        RenderAsset asset = loaded.get();
        Integer pictureType = PICTURE_TYPES.get(asset.getMime().toLowerCase(Locale.ROOT));
        if (pictureType == null) {
            log.warn("Unsupported picture type {} for {} in block {}", asset.getMime(), path, index);
            return false;
        }

        double width = Units.toEMU(properties.getDocx().getImageWidthInches() * Units.POINT_DPI);
        double height = width * aspectRatio(asset.getData());
        double maxHeight = Units.toEMU(MAX_IMAGE_HEIGHT_INCHES * Units.POINT_DPI);
        if (height > maxHeight) {
            width = width * maxHeight / height;
            height = maxHeight;
        }

        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        try (ByteArrayInputStream in = new ByteArrayInputStream(asset.getData())) {
            String name = asset.getName() != null ? asset.getName() : path;
            paragraph.createRun().addPicture(in, pictureType, name,
                    (int) Math.max(1, Math.round(width)), (int) Math.max(1, Math.round(height)));
            return true;
        } catch (InvalidFormatException | IOException e) {
            log.warn("Failed to embed picture {} in block {}: {}", path, index, e.getMessage());
            document.removeBodyElement(document.getPosOfParagraph(paragraph));
            return false;
        }
    }

    /**
     * Height over width, 1 when the image cannot be decoded.
     */
    private static double aspectRatio(byte[] data) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image != null && image.getWidth() > 0) {
                return (double) image.getHeight() / image.getWidth();
            }
        } catch (IOException e) {
            log.debug("Could not read image dimensions: {}", e.getMessage());
        }
        return 1.0;
    }

    private void appendCaption(XWPFDocument document, List<String> captions) {
        if (captions.isEmpty()) {
            return;
        }
        XWPFParagraph caption = document.createParagraph();
        caption.setAlignment(ParagraphAlignment.CENTER);
        newRun(caption, String.join(" ", captions));
    }

    // ---- code ----

    private void appendCode(XWPFDocument document, CodeBlock block) {
        if (!block.getCaptions().isEmpty()) {
            newRun(document.createParagraph(), String.join(" ", block.getCaptions()));
        }
        XWPFRun run = newRun(document.createParagraph(), block.getBody() == null ? "" : block.getBody());
        run.setFontFamily(properties.getDocx().getCodeFont());
    }

    /**
     * Adds a run holding {@code text}, with newlines written as line breaks.
     */
    private static XWPFRun newRun(XWPFParagraph paragraph, String text) {
        XWPFRun run = paragraph.createRun();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i], i);
        }
        return run;
    }

    /**
     * New runs are inserted after the last run, which may precede math already
     * in the paragraph. Moving the run keeps document order.
     */
    private static void moveToParagraphEnd(XWPFParagraph paragraph, XWPFRun run) {
        try (XmlCursor source = run.getCTR().newCursor();
             XmlCursor target = paragraph.getCTP().newCursor()) {
            target.toEndToken();
            source.moveXml(target);
        }
    }
}
