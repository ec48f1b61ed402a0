package io.livclinic.clinic.security;

/** An integration calling with a static API token. */
public record ApiTokenPrincipal(Long id, String name) {}
