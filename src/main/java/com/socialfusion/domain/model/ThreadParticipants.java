package com.socialfusion.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Unique identities that authored any post of a thread (root, ancestors, descendants).
 *
 * @param rootAuthor author of the thread's first post, when the resolver saw it
 */
public record ThreadParticipants(Set<UserIdentity> identities, Optional<UserIdentity> rootAuthor) {

    public ThreadParticipants {
        identities = Set.copyOf(identities);
        rootAuthor = rootAuthor == null ? Optional.empty() : rootAuthor;
    }

    public static ThreadParticipants of(Set<UserIdentity> identities) {
        return new ThreadParticipants(identities, Optional.empty());
    }

    public static ThreadParticipants of(Set<UserIdentity> identities, UserIdentity rootAuthor) {
        Objects.requireNonNull(rootAuthor, "rootAuthor");
        return new ThreadParticipants(identities, Optional.of(rootAuthor));
    }

    public int countFollowed(Set<UserIdentity> followed) {
        return (int) identities.stream().filter(followed::contains).count();
    }

    public boolean isStartedBy(UserIdentity author) {
        return rootAuthor.isPresent() && rootAuthor.get().equals(author);
    }

    public int size() {
        return identities.size();
    }
}
