package app.webradio.engagement.ingest.controller;

import app.webradio.engagement.ingest.ActivityEvent;
import app.webradio.engagement.ingest.ConnectionEvent;
import app.webradio.engagement.ingest.EngagementEventIngestor;
import app.webradio.engagement.ingest.SongStartEvent;
import app.webradio.engagement.ingest.controller.dto.IngestResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events")
public class IngestController {

    private final EngagementEventIngestor ingestor;

    public IngestController(EngagementEventIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @PostMapping("/activity")
    public IngestResponse activity(@Valid @RequestBody ActivityEvent event) {
        return new IngestResponse(ingestor.accept(event));
    }

    @PostMapping("/connection")
    public IngestResponse connection(@Valid @RequestBody ConnectionEvent event) {
        return new IngestResponse(ingestor.accept(event));
    }

    @PostMapping("/song-start")
    public IngestResponse songStart(@Valid @RequestBody SongStartEvent event) {
        return new IngestResponse(ingestor.accept(event));
    }
}
