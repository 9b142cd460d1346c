package com.socialfusion.application.port.out;

import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.FollowingList;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;

/**
 * Fetches the following list of one linked account from its platform. A list cut short by the
 * configured page limit is returned flagged as incomplete.
 */
public interface FollowingListPort {

    Platform platform();

    Result<FollowingList, ResolutionError> fetchFollowing(LinkedAccount account);
}
