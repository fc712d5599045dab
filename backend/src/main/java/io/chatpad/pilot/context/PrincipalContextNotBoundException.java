package io.chatpad.pilot.context;

public class PrincipalContextNotBoundException extends RuntimeException {

  public PrincipalContextNotBoundException() {
    super("Principal context not available: PRINCIPAL_ID not bound by filter chain");
  }
}
