package com.optionengine.api.controller;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.model.DailySummary;
import com.optionengine.reporting.DailySummaryService;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session reports.
 *
 * <ul>
 *   <li>GET /api/reports/daily?date=yyyy-MM-dd -- daily summary; today when no date is given.
 *       Today's figures are always recomputed, past dates come from the store when saved.</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reports")
public class ReportsController {

    private final DailySummaryService dailySummaryService;
    private final MarketClock marketClock;

    public ReportsController(DailySummaryService dailySummaryService, MarketClock marketClock) {
        this.dailySummaryService = dailySummaryService;
        this.marketClock = marketClock;
    }

    @GetMapping("/daily")
    public ResponseEntity<DailySummary> getDailySummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate today = marketClock.today();
        if (date == null || date.equals(today)) {
            return ResponseEntity.ok(dailySummaryService.summarize(today));
        }
        return ResponseEntity.ok(dailySummaryService.findOrSummarize(date));
    }
}
