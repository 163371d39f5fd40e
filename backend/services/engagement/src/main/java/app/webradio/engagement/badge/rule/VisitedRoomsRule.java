package app.webradio.engagement.badge.rule;

import java.util.Set;

/**
 * Every room in {@code rooms} visited at least once.
 */
public record VisitedRoomsRule(Set<String> rooms) implements BadgeRule {

    public VisitedRoomsRule {
        if (rooms == null || rooms.isEmpty()) {
            throw new IllegalArgumentException("rooms are required");
        }
        rooms = Set.copyOf(rooms);
    }

    @Override
    public boolean isSatisfied(BadgeContext context) {
        return context.visitedRooms().containsAll(rooms);
    }

    @Override
    public int progressPercent(BadgeContext context) {
        long visited = rooms.stream().filter(context.visitedRooms()::contains).count();
        return BadgeRule.percent(visited, rooms.size());
    }
}
