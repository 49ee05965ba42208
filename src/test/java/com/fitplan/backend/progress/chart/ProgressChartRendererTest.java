package com.fitplan.backend.progress.chart;

import com.fitplan.backend.progress.dto.ExerciseProgressPanel;
import com.fitplan.backend.progress.dto.ProgressPoint;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressChartRendererTest {

    // 小尺寸，跑快一點
    private static final int COLS = 2, PW = 400, PH = 200, EW = 500, EH = 250;

    private final ProgressChartRenderer renderer = new ProgressChartRenderer(COLS, PW, PH, EW, EH);

    private static ExerciseProgressPanel withData(long id, String title) {
        return new ExerciseProgressPanel(id, title, "sets=3, reps=8-12, rest=90s", List.of(
                new ProgressPoint(LocalDate.of(2026, 3, 1), 8.0, 50.0),
                new ProgressPoint(LocalDate.of(2026, 3, 4), 9.5, 52.5),
                new ProgressPoint(LocalDate.of(2026, 3, 8), 10.0, null)
        ));
    }

    private static ExerciseProgressPanel noData(long id) {
        return new ExerciseProgressPanel(id, "exercise_" + id, "", List.of());
    }

    private static BufferedImage read(byte[] png) throws IOException {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(img).isNotNull();
        return img;
    }

    /** 格子裡有沒有畫東西（整格白 = 空格） */
    private static boolean cellHasInk(BufferedImage img, int x0, int y0, int w, int h) {
        int white = Color.WHITE.getRGB();
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) {
                if (img.getRGB(x, y) != white) return true;
            }
        }
        return false;
    }

    private static boolean contains(BufferedImage img, Color c) {
        int rgb = c.getRGB();
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                if (img.getRGB(x, y) == rgb) return true;
            }
        }
        return false;
    }

    @Test
    void workout_figure_is_a_grid_with_one_panel_per_exercise() throws IOException {
        WorkoutProgressResponse wp = new WorkoutProgressResponse(1L, "Push (id=1)", List.of(
                withData(1, "Bench"), noData(2), withData(3, "Dips")));

        BufferedImage img = read(renderer.workoutPng(wp));

        // 3 panels / 2 columns → 2 rows
        assertThat(img.getWidth()).isEqualTo(COLS * PW);
        assertThat(img.getHeight()).isEqualTo(ProgressChartRenderer.TITLE_BAND + 2 * PH);

        int drawn = 0;
        for (int row = 0; row < 2; row++) {
            for (int col = 0; col < COLS; col++) {
                if (cellHasInk(img, col * PW, ProgressChartRenderer.TITLE_BAND + row * PH, PW, PH)) drawn++;
            }
        }
        assertThat(drawn).isEqualTo(3);

        // 標題列
        assertThat(cellHasInk(img, 0, 0, COLS * PW, ProgressChartRenderer.TITLE_BAND)).isTrue();
    }

    @Test
    void panel_without_data_still_gets_a_cell() throws IOException {
        WorkoutProgressResponse wp = new WorkoutProgressResponse(9L, "Empty (id=9)", List.of(noData(1)));

        BufferedImage img = read(renderer.workoutPng(wp));

        assertThat(img.getHeight()).isEqualTo(ProgressChartRenderer.TITLE_BAND + PH);
        assertThat(cellHasInk(img, 0, ProgressChartRenderer.TITLE_BAND, PW, PH)).isTrue();
        assertThat(cellHasInk(img, PW, ProgressChartRenderer.TITLE_BAND, PW, PH)).isFalse();
        assertThat(contains(img, ProgressChartRenderer.REPS_COLOR)).isFalse();
    }

    @Test
    void exercise_chart_has_configured_size_and_both_series() throws IOException {
        BufferedImage img = read(renderer.exercisePng(withData(1, "Bench")));

        assertThat(img.getWidth()).isEqualTo(EW);
        assertThat(img.getHeight()).isEqualTo(EH);
        assertThat(contains(img, ProgressChartRenderer.REPS_COLOR)).isTrue();
        assertThat(contains(img, ProgressChartRenderer.WEIGHT_COLOR)).isTrue();
    }

    @Test
    void panel_title_carries_meta_when_present() {
        assertThat(ProgressChartRenderer.titleOf(withData(1, "Bench")))
                .isEqualTo("Bench (sets=3, reps=8-12, rest=90s)");
        assertThat(ProgressChartRenderer.titleOf(noData(7))).isEqualTo("exercise_7");
    }

    @Test
    void no_data_panel_hides_legend() {
        assertThat(renderer.panelChart(noData(1)).getLegend()).isNull();
        assertThat(renderer.panelChart(withData(1, "Bench")).getLegend()).isNotNull();
    }

    @Test
    void grid_rows_round_up() {
        assertThat(ProgressChartRenderer.gridRows(0, 2)).isEqualTo(0);
        assertThat(ProgressChartRenderer.gridRows(1, 2)).isEqualTo(1);
        assertThat(ProgressChartRenderer.gridRows(4, 2)).isEqualTo(2);
        assertThat(ProgressChartRenderer.gridRows(5, 2)).isEqualTo(3);
        assertThat(ProgressChartRenderer.gridRows(5, 1)).isEqualTo(5);
    }

    @Test
    void rejects_non_positive_sizes() {
        assertThatThrownBy(() -> new ProgressChartRenderer(0, PW, PH, EW, EH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("INVALID_CHART_SIZE");
    }
}
