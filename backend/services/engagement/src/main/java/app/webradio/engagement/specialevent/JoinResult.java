package app.webradio.engagement.specialevent;

public record JoinResult(
        Outcome outcome,
        SpecialEvent event
) {
    public enum Outcome {
        JOINED,
        ALREADY_JOINED,
        EVENT_NOT_FOUND,
        USER_NOT_FOUND,
        OUTSIDE_WINDOW
    }
}
