package io.livclinic.clinic.security;

import io.livclinic.clinic.activity.ActivityJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

/**
 * Produces the human label recorded as an event's actor.
 *
 * <p>Signed-in users resolve to their username, API tokens to their friendly name. When either is
 * blank the label falls back to {@code user-<id>} or {@code token-<id>}. Anything else, including
 * a failure while reading the security context, resolves to {@value ActivityJournal#UNKNOWN_ACTOR}.
 */
@Component
public class ActorResolver {

  private static final Logger log = LoggerFactory.getLogger(ActorResolver.class);

  public String resolve() {
    try {
      return resolve(SecurityContextHolder.getContext().getAuthentication());
    } catch (RuntimeException e) {
      log.debug("Could not read security context, using fallback actor", e);
      return ActivityJournal.UNKNOWN_ACTOR;
    }
  }

  public String resolve(Authentication authentication) {
    try {
      return labelFor(authentication);
    } catch (RuntimeException e) {
      log.debug("Could not resolve actor label, using fallback actor", e);
      return ActivityJournal.UNKNOWN_ACTOR;
    }
  }

  static String labelFor(Authentication authentication) {
    if (authentication == null
        || authentication instanceof AnonymousAuthenticationToken
        || !authentication.isAuthenticated()) {
      return ActivityJournal.UNKNOWN_ACTOR;
    }
    Object principal = authentication.getPrincipal();
    if (principal instanceof ClinicUser user) {
      return firstNonBlank(user.getUsername(), idLabel("user-", user.getId()));
    }
    if (principal instanceof ApiTokenPrincipal token) {
      return firstNonBlank(token.name(), idLabel("token-", token.id()));
    }
    if (principal instanceof UserDetails details) {
      return firstNonBlank(details.getUsername(), null);
    }
    return firstNonBlank(authentication.getName(), null);
  }

  private static String idLabel(String prefix, Long id) {
    return id != null ? prefix + id : null;
  }

  private static String firstNonBlank(String preferred, String fallback) {
    if (preferred != null && !preferred.isBlank()) {
      return preferred.strip();
    }
    return fallback != null ? fallback : ActivityJournal.UNKNOWN_ACTOR;
  }
}
