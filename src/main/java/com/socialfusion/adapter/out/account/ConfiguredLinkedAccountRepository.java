package com.socialfusion.adapter.out.account;

import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Linked accounts declared under {@code app.accounts}. Tokens are expected to come in through
 * the environment; storing or refreshing them is not this service's job.
 */
@Repository
public class ConfiguredLinkedAccountRepository implements LinkedAccountRepository {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredLinkedAccountRepository.class);

    private final List<LinkedAccount> accounts;

    public ConfiguredLinkedAccountRepository(AppProperties appProperties) {
        this.accounts = appProperties.getAccounts().stream()
            .filter(this::isUsable)
            .map(a -> new LinkedAccount(a.getId(), a.getPlatform(), a.getHandle(),
                a.getPlatformUserId(), stripTrailingSlash(a.getServerUrl()), a.getAccessToken()))
            .toList();
        log.info("Loaded {} linked accounts", accounts.size());
    }

    @Override
    public List<LinkedAccount> findAll() {
        return accounts;
    }

    @Override
    public Optional<LinkedAccount> findById(String id) {
        return accounts.stream().filter(a -> a.id().equals(id)).findFirst();
    }

    @Override
    public List<LinkedAccount> findByPlatform(Platform platform) {
        return accounts.stream().filter(a -> a.platform() == platform).toList();
    }

    private boolean isUsable(AppProperties.Account account) {
        if (isBlank(account.getId()) || account.getPlatform() == null || isBlank(account.getServerUrl())) {
            log.warn("Skipping linked account with missing id, platform or server-url: id={}", account.getId());
            return false;
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
