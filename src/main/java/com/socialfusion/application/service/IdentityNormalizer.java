package com.socialfusion.application.service;

import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.PlatformAccount;
import com.socialfusion.domain.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps native account representations to {@link UserIdentity}.
 * <ul>
 *   <li>Mastodon: lower-cased {@code user@instance}; bare local handles are qualified with the
 *       host they were fetched from.</li>
 *   <li>Bluesky: the DID, which survives handle changes; the handle only when no DID is known.</li>
 * </ul>
 * Never fails: when the preferred field is empty the other native id is used instead. An account
 * with neither gets a placeholder that equals no other identity, so unidentifiable authors never
 * merge into one participant or match a followed account.
 */
@Component
public class IdentityNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IdentityNormalizer.class);

    static final String UNKNOWN_PREFIX = "unknown#";

    private final AtomicLong unknownSequence = new AtomicLong();

    public UserIdentity normalize(PlatformAccount account, Platform platform) {
        if (account == null) {
            log.debug("Normalizing missing {} account to placeholder identity", platform);
            return new UserIdentity(unknown(), platform);
        }
        return switch (platform) {
            case MASTODON -> new UserIdentity(mastodonValue(account), platform);
            case BLUESKY -> new UserIdentity(blueskyValue(account), platform);
        };
    }

    private String mastodonValue(PlatformAccount account) {
        String acct = stripAt(account.handle());
        if (acct.isEmpty()) {
            return fallback(account.id(), Platform.MASTODON);
        }
        if (!acct.contains("@") && !isBlank(account.host())) {
            acct = acct + "@" + account.host();
        }
        return acct.toLowerCase(Locale.ROOT);
    }

    private String blueskyValue(PlatformAccount account) {
        if (!isBlank(account.id()) && account.id().startsWith("did:")) {
            return account.id();
        }
        String handle = stripAt(account.handle());
        if (!handle.isEmpty()) {
            return handle.toLowerCase(Locale.ROOT);
        }
        return fallback(account.id(), Platform.BLUESKY);
    }

    private String fallback(String id, Platform platform) {
        if (isBlank(id)) {
            log.debug("{} account has neither handle nor id", platform);
            return unknown();
        }
        log.debug("{} account without handle, falling back to native id {}", platform, id);
        return id.trim();
    }

    private String unknown() {
        return UNKNOWN_PREFIX + unknownSequence.incrementAndGet();
    }

    private static String stripAt(String handle) {
        if (handle == null) {
            return "";
        }
        String trimmed = handle.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
