package com.eventanalytics.pipeline.api;

import com.eventanalytics.pipeline.analytics.MinuteCount;
import com.eventanalytics.pipeline.analytics.MinuteWindowQuery;
import com.eventanalytics.pipeline.exception.TransientStoreException;
import com.eventanalytics.pipeline.status.PartitionFileInfo;
import com.eventanalytics.pipeline.status.PipelineStatus;
import com.eventanalytics.pipeline.status.PipelineStatusReporter;
import com.eventanalytics.pipeline.testutil.MutableClock;
import com.eventanalytics.pipeline.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ReadEndpointsTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T14:05:30Z"));
    private MinuteWindowQuery query;
    private PipelineStatusReporter reporter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        query = mock(MinuteWindowQuery.class);
        reporter = mock(PipelineStatusReporter.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new AnalyticsController(query),
                        new PersistenceController(reporter, clock),
                        new HealthController(clock))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(TestFactory.objectMapper()))
                .build();
    }

    @Test
    void testPageViewsPerMinute() throws Exception {
        when(query.recentMinutes(5)).thenReturn(List.of(
                new MinuteCount("2024-01-15T14:05:00Z", "page_view_2024-01-15_14:05", 3, 2)));

        mockMvc.perform(get("/analytics/page_views_per_minute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].minute_timestamp").value("2024-01-15T14:05:00Z"))
                .andExpect(jsonPath("$[0].count").value(3));
    }

    @Test
    void testMinuteBucketIsKeyedByItsName() throws Exception {
        when(query.bucketCount("page_view_2024-01-15_14:05")).thenReturn(7L);

        mockMvc.perform(get("/analytics/minute-buckets/page_view_2024-01-15_14:05"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['page_view_2024-01-15_14:05']").value(7));
    }

    @Test
    void testStoreOutageOnReadIsServiceUnavailable() throws Exception {
        when(query.recentMinutes(5)).thenThrow(new TransientStoreException("connection refused", null));

        mockMvc.perform(get("/analytics/page_views_per_minute"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testStatusReportsStoppedProcessor() throws Exception {
        when(reporter.report()).thenReturn(new PipelineStatus(5L, 1L, false, 2, 2048, 0.0, null));

        mockMvc.perform(get("/persistent/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("stopped"))
                .andExpect(jsonPath("$.stats.stream_length").value(5))
                .andExpect(jsonPath("$.stats.is_processor_running").value(false))
                .andExpect(jsonPath("$.timestamp").value("2024-01-15T14:05:30Z"));
    }

    @Test
    void testFilesListingWithTotals() throws Exception {
        when(reporter.listFiles()).thenReturn(List.of(
                new PartitionFileInfo("2024/01/15/events_2024-01-15-14.jsonl", 1048576, 1.0,
                        Instant.parse("2024-01-15T14:59:00Z"), 4000),
                new PartitionFileInfo("2024/01/15/events_2024-01-15-15.jsonl", 1048576, 1.0,
                        Instant.parse("2024-01-15T15:10:00Z"), -1)));

        mockMvc.perform(get("/persistent/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_files").value(2))
                .andExpect(jsonPath("$.total_size_mb").value(2.0))
                .andExpect(jsonPath("$.files[1].event_count").value(-1));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value(HealthController.SERVICE_NAME));
    }

    @Test
    void testRootListsTheApi() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Welcome to Event Analytics API"))
                .andExpect(jsonPath("$.version").value(HealthController.API_VERSION))
                .andExpect(jsonPath("$.events").value("/events"))
                .andExpect(jsonPath("$.analytics").value("/analytics"));
    }
}
