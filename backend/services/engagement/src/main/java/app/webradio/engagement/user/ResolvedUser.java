package app.webradio.engagement.user;

public record ResolvedUser(
        String id,
        String displayName
) {
}
