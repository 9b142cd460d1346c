package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.adapter.out.platform.AccountSelector;
import com.socialfusion.application.service.IdentityNormalizer;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.PlatformAccount;
import com.socialfusion.domain.model.PostCounts;
import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import org.springframework.stereotype.Component;

/**
 * Maps Mastodon statuses to {@link UnifiedPost}.
 * Status ids are only unique per server, so unified ids and thread keys are qualified with the server host.
 * A status only names its parent, never the thread root, so replies carry neither root id nor
 * root author; the thread resolver learns the root author from the status context.
 */
@Component
public class MastodonPostMapper {

    private final IdentityNormalizer identityNormalizer;

    public MastodonPostMapper(IdentityNormalizer identityNormalizer) {
        this.identityNormalizer = identityNormalizer;
    }

    public UnifiedPost toUnifiedPost(MastodonSchema.Status status, LinkedAccount source) {
        String host = hostOf(source);
        if (status.reblog() != null) {
            UnifiedPost original = toUnifiedPost(status.reblog(), source);
            return UnifiedPost.builder(unifiedId(host, status.id()), Platform.MASTODON, identityOf(status.account(), host))
                .createdAt(status.createdAt())
                .platformSpecificId(status.id())
                .server(host)
                .originalPost(original)
                .reposted(Boolean.TRUE.equals(status.reblogged()))
                .sourceAccountId(source.id())
                .build();
        }

        UserIdentity author = identityOf(status.account(), host);
        UnifiedPost.Builder builder = UnifiedPost.builder(unifiedId(host, status.id()), Platform.MASTODON, author)
            .content(status.content())
            .createdAt(status.createdAt())
            .counts(new PostCounts(status.favouritesCount(), status.reblogsCount(), status.repliesCount()))
            .liked(Boolean.TRUE.equals(status.favourited()))
            .reposted(Boolean.TRUE.equals(status.reblogged()))
            .platformSpecificId(status.id())
            .server(host)
            .sourceAccountId(source.id());

        if (status.inReplyToId() != null) {
            builder.replyTo(ReplyReference.toParent(status.inReplyToId()));
        }
        if (status.quote() != null && status.quote().quotedStatus() != null) {
            builder.quotedPostRef(unifiedId(host, status.quote().quotedStatus().id()));
        }
        return builder.build();
    }

    public UserIdentity identityOf(MastodonSchema.Account account, String host) {
        if (account == null) {
            return identityNormalizer.normalize(null, Platform.MASTODON);
        }
        return identityNormalizer.normalize(new PlatformAccount(account.id(), account.acct(), host), Platform.MASTODON);
    }

    static String unifiedId(String host, String statusId) {
        return "mastodon:" + host + ":" + statusId;
    }

    public static String hostOf(LinkedAccount account) {
        return AccountSelector.hostOf(account);
    }
}
