package com.fitplan.backend.sheet.render;

import com.fitplan.backend.sheet.config.SheetProperties;
import com.fitplan.backend.sheet.layout.EntryRole;
import com.fitplan.backend.sheet.layout.ExerciseLookup;
import com.fitplan.backend.sheet.layout.ExerciseSpec;
import com.fitplan.backend.sheet.layout.PageFlowController;
import com.fitplan.backend.sheet.layout.RepRange;
import com.fitplan.backend.sheet.layout.SheetEntry;
import com.fitplan.backend.sheet.layout.SheetEntryFactory;
import com.fitplan.backend.sheet.layout.SheetGeometry;
import com.fitplan.backend.sheet.layout.SheetLayout;
import com.fitplan.backend.sheet.layout.SheetLayoutEngine;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PdfSheetRendererTest {

    private final SheetGeometry geometry = new SheetProperties().toGeometry();
    private final SheetLayoutEngine engine = new SheetLayoutEngine(new PageFlowController(geometry));
    private final PdfSheetRenderer renderer = new PdfSheetRenderer(SheetGeometry.mm(12), SheetGeometry.mm(4));

    @Test
    void one_pdf_page_per_layout_page_with_title_on_each() throws Exception {
        List<Long> ids = new ArrayList<>();
        for (long i = 1; i <= 40; i++) ids.add(i);
        ExerciseLookup lookup = ExerciseLookup.of(Map.of(
                1L, new ExerciseSpec(1L, "Squat", 5, RepRange.of(3, 5), "belt", 180)
        ));

        SheetLayout layout = engine.layout("Leg Day", ids, List.of(List.of(1L, 2L)), lookup);
        assertThat(layout.pageCount()).isGreaterThan(1);

        byte[] pdf = renderer.render(layout, geometry);

        try (PDDocument doc = PDDocument.load(pdf)) {
            assertEquals(layout.pageCount(), doc.getNumberOfPages());
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= doc.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                assertThat(stripper.getText(doc)).contains("Leg Day");
            }

            stripper.setStartPage(1);
            stripper.setEndPage(1);
            String first = stripper.getText(doc);
            assertThat(first).contains("Squat");
            assertThat(first).contains("3-5 reps, 180s rest, belt");
            assertThat(first).contains("Exercise #2 (missing)");
        }
    }

    @Test
    void empty_layout_still_renders_a_titled_page() throws Exception {
        SheetLayout layout = engine.layout("Rest Day", List.of(), List.of(), id -> java.util.Optional.empty());

        try (PDDocument doc = PDDocument.load(renderer.render(layout, geometry))) {
            assertEquals(1, doc.getNumberOfPages());
            assertThat(new PDFTextStripper().getText(doc)).contains("Rest Day");
        }
    }

    @Test
    void unencodable_characters_are_replaced() throws Exception {
        SheetLayout layout = engine.layout("深蹲日 A", List.of(1L), List.of(), ExerciseLookup.of(Map.of(
                1L, new ExerciseSpec(1L, "Front squat 前蹲", 3, null, null, null))));

        try (PDDocument doc = PDDocument.load(renderer.render(layout, geometry))) {
            String text = new PDFTextStripper().getText(doc);
            assertThat(text).contains("??? A");
            assertThat(text).contains("Front squat ??");
        }
        assertEquals("Café", PdfSheetRenderer.encodable(PDType1Font.HELVETICA, "Café"));
        assertEquals("", PdfSheetRenderer.encodable(PDType1Font.HELVETICA, null));
    }

    @Test
    void meta_line_joins_only_present_parts() {
        SheetEntry full = new SheetEntry(1L, "Row", 3, "8-12", "slow", 90, EntryRole.PRIMARY, false);
        SheetEntry repsOnly = new SheetEntry(2L, "Curl", 3, "10", null, null, EntryRole.PARTNER, false);
        SheetEntry restAndComment = new SheetEntry(3L, "Dip", 3, null, "  ", 60, EntryRole.PRIMARY, false);

        assertEquals("8-12 reps, 90s rest, slow", PdfSheetRenderer.metaLine(full));
        assertEquals("10 reps", PdfSheetRenderer.metaLine(repsOnly));
        assertEquals("60s rest", PdfSheetRenderer.metaLine(restAndComment));
        assertEquals("", PdfSheetRenderer.metaLine(SheetEntryFactory.placeholder(9L, EntryRole.PRIMARY)));
    }
}
