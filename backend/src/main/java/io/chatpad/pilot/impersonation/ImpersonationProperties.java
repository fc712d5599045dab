package io.chatpad.pilot.impersonation;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Impersonation limits under {@code pilot.impersonation}.
 *
 * @param sessionDuration how long a session stays valid after it starts
 * @param maxSessionsPerHour sessions one admin may start within a rolling hour
 * @param minReasonLength minimum trimmed length of the stated reason
 */
@ConfigurationProperties(prefix = "pilot.impersonation")
public record ImpersonationProperties(
    @DefaultValue("30m") Duration sessionDuration,
    @DefaultValue("5") int maxSessionsPerHour,
    @DefaultValue("10") int minReasonLength) {}
