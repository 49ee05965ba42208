package com.fitplan.backend.sheet.config;

import com.fitplan.backend.sheet.layout.PageFlowController;
import com.fitplan.backend.sheet.layout.SheetGeometry;
import com.fitplan.backend.sheet.layout.SheetLayoutEngine;
import com.fitplan.backend.sheet.render.PdfSheetRenderer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(SheetProperties.class)
public class SheetConfig {

    /** 版面設定錯誤 → 這裡就丟 IllegalArgumentException，app 起不來 */
    @Bean
    public SheetGeometry sheetGeometry(SheetProperties props) {
        return props.toGeometry();
    }

    @Bean
    public SheetLayoutEngine sheetLayoutEngine(SheetGeometry geometry) {
        return new SheetLayoutEngine(new PageFlowController(geometry));
    }

    @Bean
    public PdfSheetRenderer pdfSheetRenderer(SheetProperties props) {
        return new PdfSheetRenderer(
                SheetGeometry.mm(props.getLeftMarginMm()),
                SheetGeometry.mm(props.getPartnerIndentMm())
        );
    }

    @Bean("sheetRenderExecutor")
    public TaskExecutor sheetRenderExecutor(SheetProperties props) {
        int n = Math.max(1, props.getRenderThreads());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(n);
        ex.setMaxPoolSize(n);
        ex.setQueueCapacity(100);
        // queue 滿了 → 呼叫端自己 render，不丟 TaskRejectedException
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        ex.setThreadNamePrefix("sheet-render-");
        ex.initialize();
        return ex;
    }
}
