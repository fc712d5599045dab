package io.chatpad.pilot.team;

import java.util.UUID;

/**
 * A principal accepted an invitation and is now a member of {@code ownerId}'s team. Published
 * inside the accepting transaction.
 */
public record TeamMemberJoinedEvent(
    UUID ownerId, UUID memberId, UUID invitedBy, String email, String role) {}
