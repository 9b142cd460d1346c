package com.socialfusion.adapter.out.platform.bluesky;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Collects thread participants from {@code app.bsky.feed.getPostThread}, anchored at the thread
 * root when the post names one. Parent chain and reply tree are both walked; deleted and blocked
 * nodes are skipped.
 */
@Component
public class BlueskyThreadResolver implements ThreadParticipantResolver {

    private static final Logger log = LoggerFactory.getLogger(BlueskyThreadResolver.class);

    private final BlueskyApiClient client;
    private final BlueskyPostMapper mapper;
    private final AccountSelector accountSelector;

    public BlueskyThreadResolver(BlueskyApiClient client, BlueskyPostMapper mapper, AccountSelector accountSelector) {
        this.client = client;
        this.mapper = mapper;
        this.accountSelector = accountSelector;
    }

    @Override
    public Platform platform() {
        return Platform.BLUESKY;
    }

    @Override
    public Result<ThreadParticipants, ResolutionError> resolveParticipants(UnifiedPost post) {
        Optional<String> anchor = post.replyTo().flatMap(ReplyReference::rootId).or(post::platformSpecificId);
        if (post.platform() != Platform.BLUESKY || anchor.isEmpty()) {
            return Result.failure(new ResolutionError.NotFound(Platform.BLUESKY, "post " + post.id() + " has no AT URI"));
        }

        Optional<LinkedAccount> account = accountSelector.accountFor(post);
        if (account.isEmpty()) {
            return Result.failure(new ResolutionError.NotFound(Platform.BLUESKY, "no linked Bluesky account for " + post.id()));
        }

        BlueskySchema.ThreadResponse response;
        try {
            response = client.getPostThread(account.get(), anchor.get());
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.BLUESKY, anchor.get(), e));
        }

        if (response == null || response.thread() == null) {
            return Result.failure(PlatformErrors.malformed(Platform.BLUESKY, "thread response for " + anchor.get() + " has no thread"));
        }
        BlueskySchema.ThreadNode root = response.thread();
        if (root.isNotFound()) {
            return Result.failure(new ResolutionError.NotFound(Platform.BLUESKY, anchor.get()));
        }
        if (!root.isPost()) {
            return Result.failure(PlatformErrors.malformed(Platform.BLUESKY, "thread root for " + anchor.get() + " is " + root.type()));
        }

        Set<UserIdentity> participants = new HashSet<>();
        participants.add(post.author());
        collectParents(root.parent(), participants);
        collectTree(root, participants);

        log.debug("Thread {}: {} participants", anchor.get(), participants.size());
        return Result.success(ThreadParticipants.of(participants));
    }

    private void collectParents(BlueskySchema.ThreadNode node, Set<UserIdentity> into) {
        for (BlueskySchema.ThreadNode current = node; current != null; current = current.parent()) {
            if (current.isPost()) {
                into.add(mapper.identityOf(current.post().author()));
            }
        }
    }

    private void collectTree(BlueskySchema.ThreadNode root, Set<UserIdentity> into) {
        Deque<BlueskySchema.ThreadNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            BlueskySchema.ThreadNode node = pending.pop();
            if (!node.isPost()) {
                continue;
            }
            into.add(mapper.identityOf(node.post().author()));
            if (node.replies() != null) {
                for (BlueskySchema.ThreadNode reply : node.replies()) {
                    if (reply != null) {
                        pending.push(reply);
                    }
                }
            }
        }
    }
}
