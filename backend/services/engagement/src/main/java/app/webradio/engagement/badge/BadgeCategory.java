package app.webradio.engagement.badge;

public enum BadgeCategory {
    MILESTONE,
    SOCIAL,
    LISTENING,
    ENGAGEMENT,
    SPECIAL,
    EXPLORATION
}
