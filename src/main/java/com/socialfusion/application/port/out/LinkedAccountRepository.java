package com.socialfusion.application.port.out;

import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;

import java.util.List;
import java.util.Optional;

public interface LinkedAccountRepository {

    List<LinkedAccount> findAll();

    Optional<LinkedAccount> findById(String id);

    List<LinkedAccount> findByPlatform(Platform platform);
}
