package io.chatpad.pilot.resource;

import java.util.UUID;

/** A tenant resource row. {@code userId} is the owning account, never a member's id. */
public interface AccountOwned {

  UUID getId();

  UUID getUserId();
}
