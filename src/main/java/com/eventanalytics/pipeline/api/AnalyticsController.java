package com.eventanalytics.pipeline.api;

import com.eventanalytics.pipeline.analytics.MinuteCount;
import com.eventanalytics.pipeline.analytics.MinuteWindowQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final int RECENT_MINUTES = 5;

    private final MinuteWindowQuery query;

    @GetMapping("/page_views_per_minute")
    public List<MinuteCount> pageViewsPerMinute() {
        return query.recentMinutes(RECENT_MINUTES);
    }

    @GetMapping("/minute-buckets/{key}")
    public Map<String, Long> minuteBucket(@PathVariable("key") String key) {
        long count = query.bucketCount(key);
        log.info("Retrieved count {} for bucket {}", count, key);
        return Map.of(key, count);
    }
}
