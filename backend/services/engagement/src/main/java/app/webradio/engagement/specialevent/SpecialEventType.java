package app.webradio.engagement.specialevent;

public final class SpecialEventType {

    public static final String DOUBLE_POINTS = "double_points";
    public static final String GENRE_EXPLORATION = "genre_exploration";
    public static final String CUSTOM = "custom";

    private SpecialEventType() {
    }
}
