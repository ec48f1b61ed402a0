package io.livclinic.clinic.security;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static identities for the clinic backend.
 *
 * <p>User passwords carry a delegating-encoder prefix, e.g. {@code {bcrypt}$2a$10$...} or {@code
 * {noop}secret} for local setups.
 */
@ConfigurationProperties("clinic.security")
public record ClinicSecurityProperties(List<UserAccount> users, List<ApiToken> apiTokens) {

  public ClinicSecurityProperties {
    users = users == null ? List.of() : List.copyOf(users);
    apiTokens = apiTokens == null ? List.of() : List.copyOf(apiTokens);
  }

  public record UserAccount(Long id, String username, String password, boolean admin) {}

  public record ApiToken(Long id, String name, String token) {}
}
