package app.webradio.engagement.user;

import java.util.Optional;

/**
 * Lookup into the user registry. The engagement core never creates or deletes users through it.
 */
public interface UserDirectory {

    Optional<ResolvedUser> resolve(String userId);
}
