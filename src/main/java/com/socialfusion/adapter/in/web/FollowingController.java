package com.socialfusion.adapter.in.web;

import com.socialfusion.application.port.in.GetFollowedAccountsUseCase;
import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.model.UserIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Following", description = "Accounts followed across linked accounts")
public class FollowingController {

    private final GetFollowedAccountsUseCase getFollowedAccountsUseCase;
    private final LinkedAccountRepository linkedAccountRepository;

    public FollowingController(GetFollowedAccountsUseCase getFollowedAccountsUseCase,
                               LinkedAccountRepository linkedAccountRepository) {
        this.getFollowedAccountsUseCase = getFollowedAccountsUseCase;
        this.linkedAccountRepository = linkedAccountRepository;
    }

    @GetMapping("/following")
    @Operation(summary = "List followed identities",
        description = "Union of the following lists of every linked account; accounts whose list is unavailable contribute nothing")
    public ResponseEntity<FollowingResponse> getFollowing() {
        Set<UserIdentity> followed = getFollowedAccountsUseCase.getFollowedAccounts(linkedAccountRepository.findAll());
        List<IdentityResponse> identities = followed.stream()
            .sorted(Comparator.comparing(UserIdentity::platform).thenComparing(UserIdentity::value))
            .map(IdentityResponse::from)
            .toList();
        return ResponseEntity.ok(new FollowingResponse(identities, identities.size()));
    }

    public record FollowingResponse(List<IdentityResponse> identities, int count) {}

    public record IdentityResponse(String platform, String value) {
        static IdentityResponse from(UserIdentity identity) {
            return new IdentityResponse(identity.platform().name().toLowerCase(), identity.value());
        }
    }
}
