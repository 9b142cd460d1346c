package com.socialfusion.application.port.in;

import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.UserIdentity;

import java.util.List;
import java.util.Set;

public interface GetFollowedAccountsUseCase {
    Set<UserIdentity> getFollowedAccounts(List<LinkedAccount> linkedAccounts);
}
