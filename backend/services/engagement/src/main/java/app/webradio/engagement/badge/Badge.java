package app.webradio.engagement.badge;

public record Badge(
        String id,
        String displayName,
        String description,
        int bonusPoints,
        BadgeCategory category
) {
}
