package com.linkfolio.auth.domain.model;

import lombok.Value;

/**
 * Outcome of a combined window and burst check. {@code windowCount} is the window counter after the
 * call; it is unchanged when the request was not acquired.
 */
@Value
public class QuotaAcquisition {
    boolean acquired;
    long windowCount;
}
