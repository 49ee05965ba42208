package com.fitplan.backend.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.catalog")
public class CatalogProperties {

    /** 動作定義 YAML */
    private String exercisesPath = "data/exercises.yaml";

    /** 課表定義 YAML */
    private String workoutsPath = "data/workouts.yaml";

    /** 啟動時自動匯入（檔案不存在就跳過） */
    private boolean loadOnStartup = true;

    // getters/setters
    public String getExercisesPath() { return exercisesPath; }
    public void setExercisesPath(String exercisesPath) { this.exercisesPath = exercisesPath; }

    public String getWorkoutsPath() { return workoutsPath; }
    public void setWorkoutsPath(String workoutsPath) { this.workoutsPath = workoutsPath; }

    public boolean isLoadOnStartup() { return loadOnStartup; }
    public void setLoadOnStartup(boolean loadOnStartup) { this.loadOnStartup = loadOnStartup; }
}
