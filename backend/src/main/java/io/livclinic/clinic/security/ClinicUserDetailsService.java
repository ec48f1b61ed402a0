package io.livclinic.clinic.security;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

/** Looks up staff accounts declared under {@code clinic.security.users}. */
@Service
public class ClinicUserDetailsService implements UserDetailsService {

  private final Map<String, ClinicSecurityProperties.UserAccount> accounts = new LinkedHashMap<>();

  public ClinicUserDetailsService(ClinicSecurityProperties properties) {
    for (var account : properties.users()) {
      if (account.username() != null && !account.username().isBlank()) {
        accounts.putIfAbsent(account.username(), account);
      }
    }
  }

  @Override
  public UserDetails loadUserByUsername(String username) {
    var account = accounts.get(username);
    if (account == null) {
      throw new UsernameNotFoundException("Unknown user: " + username);
    }
    return new ClinicUser(account.id(), account.username(), account.password(), account.admin());
  }
}
