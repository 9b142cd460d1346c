package com.socialfusion.admin.application.port.in;

import java.util.Map;

public interface ClearCachesUseCase {

    Map<String, Integer> clearCaches();
}
