package com.fitplan.backend;

import com.fitplan.backend.catalog.dto.CatalogStats;
import com.fitplan.backend.catalog.service.CatalogService;
import com.fitplan.backend.common.web.ApiExceptionHandler;
import com.fitplan.backend.common.web.RequestIdFilter;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = InfoController.class)
@Import({ApiExceptionHandler.class, RequestIdFilter.class})
class InfoControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean CatalogService catalog;

    @Test
    void info_reports_catalog_counts() throws Exception {
        Mockito.when(catalog.stats()).thenReturn(new CatalogStats(12, 3));

        mvc.perform(get("/api/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("FitPlan backend is up"))
                .andExpect(jsonPath("$.exercises").value(12))
                .andExpect(jsonPath("$.workouts").value(3))
                .andExpect(jsonPath("$.serverTime").exists());
    }

    @Test
    void info_flags_empty_catalog() throws Exception {
        Mockito.when(catalog.stats()).thenReturn(new CatalogStats(0, 0));

        mvc.perform(get("/api/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("FitPlan backend is up, catalog is empty"))
                .andExpect(jsonPath("$.workouts").value(0));
    }
}
