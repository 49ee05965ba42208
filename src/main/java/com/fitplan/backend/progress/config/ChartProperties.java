package com.fitplan.backend.progress.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 進度圖輸出設定（單位 px）。
 */
@ConfigurationProperties(prefix = "app.chart")
public class ChartProperties {

    /** PNG 輸出目錄 */
    private String outputDir = "output/visualizations";

    /** workout 圖一列幾個 panel */
    private int columns = 2;

    private int panelWidth = 800;
    private int panelHeight = 300;

    private int exerciseWidth = 1000;
    private int exerciseHeight = 500;

    // getters/setters
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public int getColumns() { return columns; }
    public void setColumns(int columns) { this.columns = columns; }

    public int getPanelWidth() { return panelWidth; }
    public void setPanelWidth(int panelWidth) { this.panelWidth = panelWidth; }

    public int getPanelHeight() { return panelHeight; }
    public void setPanelHeight(int panelHeight) { this.panelHeight = panelHeight; }

    public int getExerciseWidth() { return exerciseWidth; }
    public void setExerciseWidth(int exerciseWidth) { this.exerciseWidth = exerciseWidth; }

    public int getExerciseHeight() { return exerciseHeight; }
    public void setExerciseHeight(int exerciseHeight) { this.exerciseHeight = exerciseHeight; }
}
