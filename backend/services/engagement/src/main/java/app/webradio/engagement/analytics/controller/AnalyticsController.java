package app.webradio.engagement.analytics.controller;

import app.webradio.engagement.analytics.AnalyticsReport;
import app.webradio.engagement.analytics.DailyReport;
import app.webradio.engagement.analytics.ListeningAnalytics;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    private final ListeningAnalytics analytics;

    public AnalyticsController(ListeningAnalytics analytics) {
        this.analytics = analytics;
    }

    @GetMapping
    public AnalyticsReport snapshot() {
        return analytics.snapshot();
    }

    @GetMapping("/listeners")
    public List<AnalyticsReport.ActiveListener> listeners() {
        return analytics.listeners();
    }

    @GetMapping("/songs")
    public List<AnalyticsReport.SongPlayStats> songs() {
        return analytics.songs();
    }

    @GetMapping("/reports")
    public List<DailyReport> reports(@RequestParam(defaultValue = "7") int period) {
        try {
            return analytics.reports(period);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
