package com.socialfusion.adapter.out.platform;

import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.UnifiedPost;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Optional;

/**
 * Picks the linked account to call a platform with on behalf of a post: the account whose
 * timeline delivered it, else any account on the same platform and, where post ids are
 * server-local, on the same server.
 */
@Component
public class AccountSelector {

    private final LinkedAccountRepository linkedAccountRepository;

    public AccountSelector(LinkedAccountRepository linkedAccountRepository) {
        this.linkedAccountRepository = linkedAccountRepository;
    }

    public Optional<LinkedAccount> accountFor(UnifiedPost post) {
        Platform platform = post.platform();
        return post.sourceAccountId()
            .flatMap(linkedAccountRepository::findById)
            .filter(a -> a.platform() == platform)
            .or(() -> linkedAccountRepository.findByPlatform(platform).stream()
                .filter(a -> post.server().isEmpty() || post.server().get().equalsIgnoreCase(hostOf(a)))
                .findFirst());
    }

    public static String hostOf(LinkedAccount account) {
        String host = URI.create(account.serverUrl()).getHost();
        return host != null ? host : account.serverUrl();
    }
}
