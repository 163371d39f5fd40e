package app.webradio.engagement.ingest;

import jakarta.validation.constraints.NotBlank;

public record SongStartEvent(
        @NotBlank String songId,
        String title
) {
}
