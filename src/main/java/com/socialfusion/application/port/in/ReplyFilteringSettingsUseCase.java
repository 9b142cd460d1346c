package com.socialfusion.application.port.in;

/**
 * Runtime switch for reply filtering. Changes apply to the next decision, no restart needed.
 */
public interface ReplyFilteringSettingsUseCase {

    boolean isReplyFilteringEnabled();

    void setReplyFilteringEnabled(boolean enabled);
}
