package com.socialfusion.domain.error;

/**
 * Errors of the following-set aggregation. A failure for one linked account never fails the
 * aggregate; it is reported and that account contributes nothing, or only the part that was fetched.
 */
public sealed interface FollowingError {

    record PartialFollowingFailure(String accountId, ResolutionError cause) implements FollowingError {
        @Override
        public String message() {
            return "Following list of account " + accountId + " unavailable: " + cause.message();
        }

        @Override
        public String code() {
            return "PARTIAL_FOLLOWING_FAILURE";
        }
    }

    /**
     * Paging stopped at the page limit; the fetched part is used but not cached.
     */
    record TruncatedFollowingList(String accountId, int fetched) implements FollowingError {
        @Override
        public String message() {
            return "Following list of account " + accountId + " incomplete, page limit reached after " + fetched + " accounts";
        }

        @Override
        public String code() {
            return "TRUNCATED_FOLLOWING_LIST";
        }
    }

    String message();

    String code();
}
