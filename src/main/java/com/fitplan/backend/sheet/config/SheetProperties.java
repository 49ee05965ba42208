package com.fitplan.backend.sheet.config;

import com.fitplan.backend.sheet.layout.SheetGeometry;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 表單版面設定（單位 mm，建 {@link SheetGeometry} 時轉成 point）。
 * 預設值 = A4 直式。
 */
@ConfigurationProperties(prefix = "app.sheet")
public class SheetProperties {

    /** PDF 輸出目錄 */
    private String outputDir = "output";

    /** render-all 平行度 */
    private int renderThreads = 2;

    private double pageHeightMm = 297;
    private double leftMarginMm = 12;
    private double topMarginMm = 12;
    private double bottomMarginMm = 12;
    private double headerHeightMm = 10;
    private double primaryRowMm = 8;
    private double partnerRowMm = 7;

    /** 超級組結束後的間距（含 1mm 額外分隔） */
    private double pairedGapMm = 8;
    private double singleGapMm = 7;

    /** 畫下一列前，列底到頁底至少要留的空間 */
    private double breakThresholdMm = 22;

    /** partner 列往右縮排；0 = 與 primary 對齊 */
    private double partnerIndentMm = 0;

    public SheetGeometry toGeometry() {
        return new SheetGeometry(
                SheetGeometry.mm(pageHeightMm),
                SheetGeometry.mm(topMarginMm),
                SheetGeometry.mm(bottomMarginMm),
                SheetGeometry.mm(headerHeightMm),
                SheetGeometry.mm(primaryRowMm),
                SheetGeometry.mm(partnerRowMm),
                SheetGeometry.mm(pairedGapMm),
                SheetGeometry.mm(singleGapMm),
                SheetGeometry.mm(breakThresholdMm)
        );
    }

    // getters/setters
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public int getRenderThreads() { return renderThreads; }
    public void setRenderThreads(int renderThreads) { this.renderThreads = renderThreads; }

    public double getPageHeightMm() { return pageHeightMm; }
    public void setPageHeightMm(double pageHeightMm) { this.pageHeightMm = pageHeightMm; }

    public double getLeftMarginMm() { return leftMarginMm; }
    public void setLeftMarginMm(double leftMarginMm) { this.leftMarginMm = leftMarginMm; }

    public double getTopMarginMm() { return topMarginMm; }
    public void setTopMarginMm(double topMarginMm) { this.topMarginMm = topMarginMm; }

    public double getBottomMarginMm() { return bottomMarginMm; }
    public void setBottomMarginMm(double bottomMarginMm) { this.bottomMarginMm = bottomMarginMm; }

    public double getHeaderHeightMm() { return headerHeightMm; }
    public void setHeaderHeightMm(double headerHeightMm) { this.headerHeightMm = headerHeightMm; }

    public double getPrimaryRowMm() { return primaryRowMm; }
    public void setPrimaryRowMm(double primaryRowMm) { this.primaryRowMm = primaryRowMm; }

    public double getPartnerRowMm() { return partnerRowMm; }
    public void setPartnerRowMm(double partnerRowMm) { this.partnerRowMm = partnerRowMm; }

    public double getPairedGapMm() { return pairedGapMm; }
    public void setPairedGapMm(double pairedGapMm) { this.pairedGapMm = pairedGapMm; }

    public double getSingleGapMm() { return singleGapMm; }
    public void setSingleGapMm(double singleGapMm) { this.singleGapMm = singleGapMm; }

    public double getBreakThresholdMm() { return breakThresholdMm; }
    public void setBreakThresholdMm(double breakThresholdMm) { this.breakThresholdMm = breakThresholdMm; }

    public double getPartnerIndentMm() { return partnerIndentMm; }
    public void setPartnerIndentMm(double partnerIndentMm) { this.partnerIndentMm = partnerIndentMm; }
}
