package app.webradio.engagement.ingest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ConnectionEvent(
        @NotBlank String connectionId,
        @NotNull Kind kind,
        String displayName
) {
    public enum Kind {
        CONNECT,
        DISCONNECT,
        IDENTIFY
    }
}
