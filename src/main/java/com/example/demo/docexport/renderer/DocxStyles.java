package com.example.demo.docexport.renderer;

import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTNumLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import java.math.BigInteger;

/**
 * Style and numbering definitions for a document created from scratch. A blank
 * {@link XWPFDocument} has neither part, so style ids set on paragraphs would
 * point at nothing.
 */
final class DocxStyles {
    static final String LIST_NUMBER = "ListNumber";
    static final String LIST_BULLET = "ListBullet";
    static final int HEADING_LEVELS = 4;

    private static final BigInteger LIST_INDENT = BigInteger.valueOf(720);
    private static final BigInteger LIST_HANGING = BigInteger.valueOf(360);

    private final XWPFNumbering numbering;
    private final BigInteger decimalAbstractId;
    private final BigInteger bulletNumId;

    private DocxStyles(XWPFNumbering numbering, BigInteger decimalAbstractId, BigInteger bulletNumId) {
        this.numbering = numbering;
        this.decimalAbstractId = decimalAbstractId;
        this.bulletNumId = bulletNumId;
    }

    /**
     * Adds heading, list and table styles plus the list numbering to
     * {@code document}.
     *
     * @param tableStyleId id of the bordered table style, skipped when blank
     */
    static DocxStyles install(XWPFDocument document, String tableStyleId) {
        XWPFStyles styles = document.createStyles();
        for (int level = 1; level <= HEADING_LEVELS; level++) {
            styles.addStyle(new XWPFStyle(headingStyle(level), styles));
        }
        styles.addStyle(new XWPFStyle(listStyle(LIST_NUMBER, "List Number"), styles));
        styles.addStyle(new XWPFStyle(listStyle(LIST_BULLET, "List Bullet"), styles));
        if (tableStyleId != null && !tableStyleId.isBlank()) {
            styles.addStyle(new XWPFStyle(tableStyle(tableStyleId), styles));
        }

        XWPFNumbering numbering = document.createNumbering();
        BigInteger decimalId = numbering.addAbstractNum(
                new XWPFAbstractNum(abstractNum(BigInteger.ONE, STNumberFormat.DECIMAL, "%1.")));
        BigInteger bulletId = numbering.addAbstractNum(
                new XWPFAbstractNum(abstractNum(BigInteger.TWO, STNumberFormat.BULLET, "•")));
        return new DocxStyles(numbering, decimalId, numbering.addNum(bulletId));
    }

    static String headingStyleId(int level) {
        return "Heading" + level;
    }

    /**
     * Numbering instance for one numbered list. Each list restarts at 1.
     */
    BigInteger newNumberedList() {
        BigInteger numId = numbering.addNum(decimalAbstractId);
        CTNumLvl override = numbering.getNum(numId).getCTNum().addNewLvlOverride();
        override.setIlvl(BigInteger.ZERO);
        override.addNewStartOverride().setVal(BigInteger.ONE);
        return numId;
    }

    BigInteger bulletList() {
        return bulletNumId;
    }

    private static CTStyle headingStyle(int level) {
        CTStyle style = newStyle(headingStyleId(level), "heading " + level, STStyleType.PARAGRAPH);
        style.addNewQFormat();
        CTPPrGeneral paragraph = style.addNewPPr();
        paragraph.addNewKeepNext();
        paragraph.addNewOutlineLvl().setVal(BigInteger.valueOf(level - 1L));
        return style;
    }

    private static CTStyle listStyle(String id, String name) {
        CTStyle style = newStyle(id, name, STStyleType.PARAGRAPH);
        style.addNewPPr().addNewContextualSpacing();
        return style;
    }

    private static CTStyle tableStyle(String id) {
        CTStyle style = newStyle(id, id, STStyleType.TABLE);
        CTTblBorders borders = style.addNewTblPr().addNewTblBorders();
        for (CTBorder border : new CTBorder[]{borders.addNewTop(), borders.addNewLeft(),
                borders.addNewBottom(), borders.addNewRight(), borders.addNewInsideH(), borders.addNewInsideV()}) {
            border.setVal(STBorder.SINGLE);
            border.setSz(BigInteger.valueOf(4));
        }
        return style;
    }

    private static CTStyle newStyle(String id, String name, STStyleType.Enum type) {
        CTStyle style = CTStyle.Factory.newInstance();
        style.setStyleId(id);
        style.setType(type);
        style.addNewName().setVal(name);
        return style;
    }

    private static CTAbstractNum abstractNum(BigInteger id, STNumberFormat.Enum format, String text) {
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(id);
        CTLvl level = abstractNum.addNewLvl();
        level.setIlvl(BigInteger.ZERO);
        level.addNewStart().setVal(BigInteger.ONE);
        level.addNewNumFmt().setVal(format);
        level.addNewLvlText().setVal(text);
        level.addNewPPr().addNewInd();
        level.getPPr().getInd().setLeft(LIST_INDENT);
        level.getPPr().getInd().setHanging(LIST_HANGING);
        return abstractNum;
    }
}
