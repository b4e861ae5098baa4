package com.propertyintel.leads;

import com.propertyintel.leads.scheduler.CacheRefreshScheduler;
import com.propertyintel.leads.service.CacheMirror;
import com.propertyintel.leads.service.RawPropertySource;
import com.propertyintel.leads.service.ScoringWeights;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "lead-radar.scheduling.enabled=false",
        "lead-radar.scoring.recency-weight=0"
})
@AutoConfigureMockMvc
class LeadRadarApplicationTest {

    @MockBean
    private RawPropertySource source;

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MockMvc mvc;

    @Test
    void memoryBackendHasNoMirror() {
        assertTrue(context.getBeansOfType(CacheMirror.class).isEmpty());
        assertFalse(context.getBean(CacheRefreshScheduler.class).isRunning());
    }

    @Test
    void weightsComeFromConfiguration() {
        ScoringWeights weights = context.getBean(ScoringWeights.class);
        assertEquals(0.0, weights.recency());
        assertEquals(0.45 / 0.80, weights.equity(), 1e-12);
    }

    @Test
    void servesSnakeCaseJson() throws Exception {
        when(source.fetchAll(anyInt())).thenReturn(Fixtures.sampleRecords());

        mvc.perform(get("/api/properties").param("state", "tx"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.items[0].property_id").value("prop-1"))
                .andExpect(jsonPath("$.items[0].transfer_date").value("2024-01-15"))
                .andExpect(jsonPath("$.items[0].score_breakdown.value_gap").value(1.0));
    }
}
