package com.socialfusion.application.port.in;

import com.socialfusion.domain.model.Page;
import com.socialfusion.domain.model.UnifiedPost;

public interface GetTimelineUseCase {
    Page<UnifiedPost> getTimeline(int limit);
}
