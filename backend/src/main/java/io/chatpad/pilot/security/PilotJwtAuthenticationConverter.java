package io.chatpad.pilot.security;

import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Every verified token maps to the single {@code ROLE_AUTHENTICATED} authority. Team and platform
 * roles live in the database and are never taken from token claims.
 */
@Component
public class PilotJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  public static final String AUTHORITY_AUTHENTICATED = "ROLE_AUTHENTICATED";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(
        jwt, List.of(new SimpleGrantedAuthority(AUTHORITY_AUTHENTICATED)), jwt.getSubject());
  }
}
