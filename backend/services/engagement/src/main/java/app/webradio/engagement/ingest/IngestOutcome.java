package app.webradio.engagement.ingest;

public enum IngestOutcome {
    ACCEPTED,
    IGNORED,
    USER_NOT_FOUND,
    DROPPED,
    FAILED
}
