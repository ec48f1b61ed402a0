package io.livclinic.clinic.security;

/** Granted authority names used by the identity layer. */
public final class Roles {

  public static final String AUTHORITY_STAFF = "ROLE_STAFF";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_API_TOKEN = "ROLE_API_TOKEN";

  private Roles() {}
}
