package io.livclinic.clinic.security;

import io.livclinic.clinic.note.NoteRequester;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * The authenticated caller of the current request. API-token callers have no user id and are
 * never admins.
 */
public record CurrentUser(Long id, String username, boolean admin) {

  /** Reads the caller from the security context. Throws if the request is unauthenticated. */
  public static CurrentUser require() {
    return from(SecurityContextHolder.getContext().getAuthentication());
  }

  public static CurrentUser from(Authentication authentication) {
    if (authentication == null
        || authentication instanceof AnonymousAuthenticationToken
        || !authentication.isAuthenticated()) {
      throw new AuthenticationCredentialsNotFoundException("No authenticated caller");
    }
    String label = ActorResolver.labelFor(authentication);
    if (authentication.getPrincipal() instanceof ClinicUser user) {
      return new CurrentUser(user.getId(), label, user.isAdmin());
    }
    if (authentication.getPrincipal() instanceof ApiTokenPrincipal) {
      return new CurrentUser(null, label, false);
    }
    boolean admin =
        authentication.getAuthorities().stream()
            .anyMatch(authority -> Roles.AUTHORITY_ADMIN.equals(authority.getAuthority()));
    return new CurrentUser(null, label, admin);
  }

  public NoteRequester asNoteRequester() {
    return new NoteRequester(id, username, admin);
  }
}
