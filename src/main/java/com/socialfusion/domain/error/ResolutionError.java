package com.socialfusion.domain.error;

import com.socialfusion.domain.model.Platform;

/**
 * Expected failures of a platform call. None of them are fatal: the feed filter turns every
 * one into an include decision.
 */
public sealed interface ResolutionError {

    /**
     * Timeout, connection failure or an HTTP status other than 404.
     */
    record Network(Platform platform, String detail) implements ResolutionError {
        @Override
        public String message() {
            return platform + " request failed: " + detail;
        }

        @Override
        public String code() {
            return "NETWORK_ERROR";
        }
    }

    /**
     * The referenced post or thread no longer exists, or the post carries no id the platform accepts.
     */
    record NotFound(Platform platform, String reference) implements ResolutionError {
        @Override
        public String message() {
            return platform + " has no post or thread for " + reference;
        }

        @Override
        public String code() {
            return "NOT_FOUND";
        }
    }

    record Decode(Platform platform, String detail) implements ResolutionError {
        @Override
        public String message() {
            return "Malformed " + platform + " payload: " + detail;
        }

        @Override
        public String code() {
            return "DECODE_ERROR";
        }
    }

    String message();

    String code();
}
