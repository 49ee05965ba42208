package com.fitplan.backend.progress.chart;

import com.fitplan.backend.progress.dto.ExerciseProgressPanel;
import com.fitplan.backend.progress.dto.ProgressPoint;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.time.Day;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.text.SimpleDateFormat;
import java.time.LocalDate;
import java.util.List;

/**
 * 進度圖：每個動作一張雙 Y 軸折線圖（左 avg reps、右 avg weight）。
 * workout 圖 = 標題列 + panel 格狀排列；沒資料的 panel 印 "no data"。
 */
public class ProgressChartRenderer {

    static final int TITLE_BAND = 40;

    private static final Font FIGURE_TITLE_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 18);
    private static final Font PANEL_TITLE_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 13);

    static final Color REPS_COLOR = new Color(0x1F, 0x77, 0xB4);
    static final Color WEIGHT_COLOR = new Color(0xFF, 0x7F, 0x0E);
    private static final Color GRID_COLOR = new Color(0xDD, 0xDD, 0xDD);

    private final int columns;
    private final int panelWidth;
    private final int panelHeight;
    private final int exerciseWidth;
    private final int exerciseHeight;

    public ProgressChartRenderer(int columns, int panelWidth, int panelHeight, int exerciseWidth, int exerciseHeight) {
        if (columns < 1 || panelWidth < 1 || panelHeight < 1 || exerciseWidth < 1 || exerciseHeight < 1) {
            throw new IllegalArgumentException("INVALID_CHART_SIZE");
        }
        this.columns = columns;
        this.panelWidth = panelWidth;
        this.panelHeight = panelHeight;
        this.exerciseWidth = exerciseWidth;
        this.exerciseHeight = exerciseHeight;
    }

    /** 單一動作（跨 workout）的圖 */
    public byte[] exercisePng(ExerciseProgressPanel panel) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ChartUtils.writeChartAsPNG(out, panelChart(panel), exerciseWidth, exerciseHeight);
        } catch (IOException e) {
            throw new ChartRenderException("CHART_RENDER_FAILED", e);
        }
        return out.toByteArray();
    }

    public byte[] workoutPng(WorkoutProgressResponse progress) {
        List<ExerciseProgressPanel> panels = progress.panels();
        int rows = gridRows(panels.size(), columns);
        int width = columns * panelWidth;
        int height = TITLE_BAND + rows * panelHeight;

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);

            g.setColor(Color.BLACK);
            g.setFont(FIGURE_TITLE_FONT);
            FontMetrics fm = g.getFontMetrics();
            String title = progress.title() == null ? "" : progress.title();
            g.drawString(title, Math.max(0, (width - fm.stringWidth(title)) / 2), (TITLE_BAND + fm.getAscent()) / 2);

            for (int i = 0; i < panels.size(); i++) {
                int col = i % columns;
                int row = i / columns;
                Rectangle2D cell = new Rectangle2D.Double(
                        col * panelWidth, TITLE_BAND + row * panelHeight, panelWidth, panelHeight);
                panelChart(panels.get(i)).draw(g, cell);
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ChartUtils.writeBufferedImageAsPNG(out, image);
        } catch (IOException e) {
            throw new ChartRenderException("CHART_RENDER_FAILED", e);
        }
        return out.toByteArray();
    }

    JFreeChart panelChart(ExerciseProgressPanel panel) {
        TimeSeries reps = new TimeSeries("avg reps");
        TimeSeries weight = new TimeSeries("avg weight");
        for (ProgressPoint p : panel.points()) {
            Day day = dayOf(p.date());
            if (p.avgReps() != null) reps.addOrUpdate(day, p.avgReps());
            if (p.avgWeight() != null) weight.addOrUpdate(day, p.avgWeight());
        }

        DateAxis dates = new DateAxis();
        dates.setDateFormatOverride(new SimpleDateFormat("yyyy-MM-dd"));

        NumberAxis repsAxis = integerAxis("avg reps");
        NumberAxis weightAxis = integerAxis("avg weight (kg)");

        XYLineAndShapeRenderer repsLine = new XYLineAndShapeRenderer(true, true);
        repsLine.setSeriesPaint(0, REPS_COLOR);
        repsLine.setSeriesStroke(0, new BasicStroke(2f));

        XYLineAndShapeRenderer weightLine = new XYLineAndShapeRenderer(true, true);
        weightLine.setSeriesPaint(0, WEIGHT_COLOR);
        weightLine.setSeriesStroke(0, new BasicStroke(2f));
        weightLine.setSeriesShape(0, new Rectangle2D.Double(-3, -3, 6, 6));

        XYPlot plot = new XYPlot(new TimeSeriesCollection(reps), dates, repsAxis, repsLine);
        plot.setDataset(1, new TimeSeriesCollection(weight));
        plot.setRangeAxis(1, weightAxis);
        plot.mapDatasetToRangeAxis(1, 1);
        plot.setRenderer(1, weightLine);
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(GRID_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);
        plot.setNoDataMessage("no data");

        JFreeChart chart = new JFreeChart(titleOf(panel), PANEL_TITLE_FONT, plot, panel.hasData());
        chart.setBackgroundPaint(Color.WHITE);
        return chart;
    }

    /** "Bench (sets=3, reps=8-12, rest=90s)"；沒有 meta 就只有名稱 */
    static String titleOf(ExerciseProgressPanel panel) {
        String meta = panel.meta();
        return (meta == null || meta.isBlank()) ? panel.title() : panel.title() + " (" + meta + ")";
    }

    static int gridRows(int panels, int columns) {
        return (panels + columns - 1) / columns;
    }

    private static NumberAxis integerAxis(String label) {
        NumberAxis axis = new NumberAxis(label);
        axis.setStandardTickUnits(NumberAxis.createIntegerTickUnits());
        axis.setAutoRangeIncludesZero(false);
        return axis;
    }

    private static Day dayOf(LocalDate d) {
        return new Day(d.getDayOfMonth(), d.getMonthValue(), d.getYear());
    }
}
