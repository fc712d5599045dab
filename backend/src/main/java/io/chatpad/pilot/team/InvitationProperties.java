package io.chatpad.pilot.team;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Team invitation settings under {@code pilot.invitations}. */
@ConfigurationProperties(prefix = "pilot.invitations")
public record InvitationProperties(@DefaultValue("7d") Duration ttl) {}
