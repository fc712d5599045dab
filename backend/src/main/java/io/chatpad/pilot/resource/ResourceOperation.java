package io.chatpad.pilot.resource;

public enum ResourceOperation {
  CREATE,
  READ,
  UPDATE,
  DELETE,
  SENSITIVE_UPDATE
}
