package io.livclinic.clinic.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.security.core.CredentialsContainer;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

/** A staff member signed in with a username and password. */
public final class ClinicUser implements UserDetails, CredentialsContainer {

  private final Long id;
  private final String username;
  private String password;
  private final boolean admin;

  public ClinicUser(Long id, String username, String password, boolean admin) {
    this.id = id;
    this.username = username;
    this.password = password;
    this.admin = admin;
  }

  public Long getId() {
    return id;
  }

  public boolean isAdmin() {
    return admin;
  }

  @Override
  public String getUsername() {
    return username;
  }

  @Override
  public String getPassword() {
    return password;
  }

  @Override
  public Collection<? extends GrantedAuthority> getAuthorities() {
    List<GrantedAuthority> authorities = new ArrayList<>(2);
    authorities.add(new SimpleGrantedAuthority(Roles.AUTHORITY_STAFF));
    if (admin) {
      authorities.add(new SimpleGrantedAuthority(Roles.AUTHORITY_ADMIN));
    }
    return authorities;
  }

  @Override
  public void eraseCredentials() {
    password = null;
  }

  @Override
  public String toString() {
    return "ClinicUser[id=" + id + ", username=" + username + ", admin=" + admin + "]";
  }
}
