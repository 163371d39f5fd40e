package app.webradio.engagement.ingest.controller.dto;

import app.webradio.engagement.ingest.IngestOutcome;

public record IngestResponse(
        IngestOutcome outcome
) {
}
