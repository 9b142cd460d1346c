package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.adapter.out.platform.AccountSelector;
import com.socialfusion.adapter.out.platform.PlatformErrors;
import com.socialfusion.application.port.out.ThreadParticipantResolver;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.ThreadParticipants;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Collects thread participants from {@code GET /api/v1/statuses/:id/context}: the authors of
 * every ancestor and descendant plus the post's own author. The context is asked for the
 * thread root when the post names one, else for the post itself. The first ancestor is the
 * thread root, so its author is reported as the root author.
 */
@Component
public class MastodonThreadResolver implements ThreadParticipantResolver {

    private static final Logger log = LoggerFactory.getLogger(MastodonThreadResolver.class);

    private final MastodonApiClient client;
    private final MastodonPostMapper mapper;
    private final AccountSelector accountSelector;

    public MastodonThreadResolver(MastodonApiClient client, MastodonPostMapper mapper, AccountSelector accountSelector) {
        this.client = client;
        this.mapper = mapper;
        this.accountSelector = accountSelector;
    }

    @Override
    public Platform platform() {
        return Platform.MASTODON;
    }

    @Override
    public Result<ThreadParticipants, ResolutionError> resolveParticipants(UnifiedPost post) {
        Optional<String> anchor = post.replyTo().flatMap(ReplyReference::rootId).or(post::platformSpecificId);
        if (post.platform() != Platform.MASTODON || anchor.isEmpty()) {
            return Result.failure(new ResolutionError.NotFound(Platform.MASTODON, "post " + post.id() + " has no Mastodon status id"));
        }
        String statusId = anchor.get();

        Optional<LinkedAccount> account = accountSelector.accountFor(post);
        if (account.isEmpty()) {
            return Result.failure(new ResolutionError.NotFound(Platform.MASTODON, "no linked Mastodon account for " + post.id()));
        }

        MastodonSchema.Context context;
        try {
            context = client.getContext(account.get(), statusId);
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.MASTODON, "status " + statusId, e));
        }

        if (context == null || context.ancestors() == null || context.descendants() == null) {
            return Result.failure(PlatformErrors.malformed(Platform.MASTODON, "context of status " + statusId + " lacks ancestors or descendants"));
        }

        String host = MastodonPostMapper.hostOf(account.get());
        Set<UserIdentity> participants = new HashSet<>();
        participants.add(post.author());
        collectAuthors(context.ancestors(), host, participants);
        collectAuthors(context.descendants(), host, participants);

        log.debug("Status {} context: {} ancestors, {} descendants, {} participants",
            statusId, context.ancestors().size(), context.descendants().size(), participants.size());
        if (context.ancestors().isEmpty() || context.ancestors().get(0) == null || context.ancestors().get(0).account() == null) {
            return Result.success(ThreadParticipants.of(participants));
        }
        UserIdentity rootAuthor = mapper.identityOf(context.ancestors().get(0).account(), host);
        return Result.success(ThreadParticipants.of(participants, rootAuthor));
    }

    private void collectAuthors(List<MastodonSchema.Status> statuses, String host, Set<UserIdentity> into) {
        for (MastodonSchema.Status status : statuses) {
            if (status != null && status.account() != null) {
                into.add(mapper.identityOf(status.account(), host));
            }
        }
    }
}
