package com.socialfusion.domain.model;

/**
 * Social platforms whose timelines are aggregated.
 * MASTODON covers any ActivityPub server speaking the Mastodon client API;
 * BLUESKY covers AT Protocol app views speaking the app.bsky lexicon.
 */
public enum Platform {
    MASTODON,
    BLUESKY
}
