package com.fitplan.backend.sheet.render;

import com.fitplan.backend.sheet.layout.PageHeader;
import com.fitplan.backend.sheet.layout.Placement;
import com.fitplan.backend.sheet.layout.SheetEntry;
import com.fitplan.backend.sheet.layout.SheetGeometry;
import com.fitplan.backend.sheet.layout.SheetLayout;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 把 {@link SheetLayout} 畫成可填寫的 PDF。
 * 只負責畫：頁次與 y 座標都由 layout 決定好了。
 */
public class PdfSheetRenderer {

    private static final PDFont TITLE_FONT = PDType1Font.HELVETICA_BOLD;
    private static final PDFont NAME_FONT = PDType1Font.HELVETICA_BOLD;
    private static final PDFont META_FONT = PDType1Font.HELVETICA;
    private static final PDFont BOX_FONT = PDType1Font.HELVETICA;

    private static final float TITLE_SIZE = 14f;
    private static final float NAME_SIZE = 10f;
    private static final float META_SIZE = 7f;
    private static final float BOX_LABEL_SIZE = 6f;

    private static final float BOX_W = mm(14);
    private static final float BOX_H = mm(8);
    private static final float BOX_GAP = mm(4);
    private static final float BOXES_OFFSET_X = mm(50);

    private final float leftMargin;
    private final float partnerIndent;

    public PdfSheetRenderer(double leftMargin, double partnerIndent) {
        this.leftMargin = (float) leftMargin;
        this.partnerIndent = (float) partnerIndent;
    }

    public byte[] render(SheetLayout layout, SheetGeometry geometry) {
        PDRectangle size = new PDRectangle(PDRectangle.A4.getWidth(), (float) geometry.pageHeight());
        try (PDDocument doc = new PDDocument()) {
            for (PageHeader header : layout.headers()) {
                PDPage page = new PDPage(size);
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    drawHeader(cs, header);
                    for (Placement p : layout.placementsOn(header.pageIndex())) {
                        drawEntry(cs, p.entry(), (float) p.y());
                    }
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new SheetRenderException("SHEET_RENDER_FAILED", e);
        }
    }

    private void drawHeader(PDPageContentStream cs, PageHeader header) throws IOException {
        text(cs, TITLE_FONT, TITLE_SIZE, leftMargin, (float) header.y(), header.title());
    }

    private void drawEntry(PDPageContentStream cs, SheetEntry e, float y) throws IOException {
        float x = leftMargin + (e.isPartner() ? partnerIndent : 0f);
        text(cs, NAME_FONT, NAME_SIZE, x, y + mm(1), e.name());

        String meta = metaLine(e);
        if (!meta.isEmpty()) {
            text(cs, META_FONT, META_SIZE, x, y - mm(2), meta);
        }
        drawBoxes(cs, leftMargin + BOXES_OFFSET_X, y + mm(6), e.sets());
    }

    /** 每組一對格子：reps | kg */
    private void drawBoxes(PDPageContentStream cs, float x, float top, int sets) throws IOException {
        float startX = x;
        for (int i = 0; i < sets; i++) {
            box(cs, startX, top, "reps");
            startX += BOX_W;
            box(cs, startX, top, "kg");
            startX += BOX_W + BOX_GAP;
        }
    }

    private void box(PDPageContentStream cs, float x, float top, String label) throws IOException {
        cs.addRect(x, top - BOX_H, BOX_W, BOX_H);
        cs.stroke();
        float w = BOX_FONT.getStringWidth(label) / 1000f * BOX_LABEL_SIZE;
        text(cs, BOX_FONT, BOX_LABEL_SIZE, x + (BOX_W - w) / 2f, top - BOX_H + mm(1.5), label);
    }

    /** "8-12 reps, 90s rest, comment" */
    static String metaLine(SheetEntry e) {
        List<String> parts = new ArrayList<>(3);
        if (e.repsText() != null) parts.add(e.repsText() + " reps");
        if (e.restSeconds() != null) parts.add(e.restSeconds() + "s rest");
        if (e.comment() != null && !e.comment().isBlank()) parts.add(e.comment());
        return String.join(", ", parts);
    }

    private static void text(PDPageContentStream cs, PDFont font, float size, float x, float y, String s)
            throws IOException {
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(x, y);
        cs.showText(encodable(font, s));
        cs.endText();
    }

    /** 標準 14 字型只支援 WinAnsi；其他字元換成 '?' */
    static String encodable(PDFont font, String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            sb.append(canEncode(font, ch) ? ch : "?");
        });
        return sb.toString();
    }

    private static boolean canEncode(PDFont font, String ch) {
        try {
            font.encode(ch);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private static float mm(double v) {
        return (float) SheetGeometry.mm(v);
    }
}
