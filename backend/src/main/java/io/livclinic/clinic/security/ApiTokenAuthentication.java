package io.livclinic.clinic.security;

import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

public class ApiTokenAuthentication extends AbstractAuthenticationToken {

  private final ApiTokenPrincipal principal;

  public ApiTokenAuthentication(ApiTokenPrincipal principal) {
    super(List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_API_TOKEN)));
    this.principal = principal;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public ApiTokenPrincipal getPrincipal() {
    return principal;
  }

  @Override
  public String getName() {
    return principal.name();
  }
}
