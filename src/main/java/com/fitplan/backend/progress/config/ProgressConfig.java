package com.fitplan.backend.progress.config;

import com.fitplan.backend.progress.chart.ProgressChartRenderer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChartProperties.class)
public class ProgressConfig {

    @Bean
    public ProgressChartRenderer progressChartRenderer(ChartProperties props) {
        return new ProgressChartRenderer(
                Math.max(1, props.getColumns()),
                props.getPanelWidth(),
                props.getPanelHeight(),
                props.getExerciseWidth(),
                props.getExerciseHeight()
        );
    }
}
