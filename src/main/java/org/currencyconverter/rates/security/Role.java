package org.currencyconverter.rates.security;

import java.util.Arrays;

/** Roles a caller can hold; written to the token's {@code roles} claim. */
public enum Role {
  USER("User"),
  ADMIN("Admin");

  private final String claimValue;

  Role(String claimValue) {
    this.claimValue = claimValue;
  }

  /** Value stored in the token and checked by {@code hasRole(...)} expressions. */
  public String claimValue() {
    return claimValue;
  }

  /**
   * Looks up a role by its claim value, ignoring case.
   *
   * @param value claim value such as {@code "Admin"}
   * @return the matching role
   * @throws IllegalArgumentException if no role matches
   */
  public static Role fromClaimValue(String value) {
    return Arrays.stream(values())
        .filter(role -> role.claimValue.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
  }
}
