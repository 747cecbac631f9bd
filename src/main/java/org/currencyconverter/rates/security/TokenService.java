package org.currencyconverter.rates.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import org.currencyconverter.rates.config.CurrencyConverterProperties;
import org.currencyconverter.rates.config.SecurityConfig;

/**
 * Issues signed bearer tokens for the configured demo account.
 *
 * <p>This stands in for a real identity provider: one username/password pair is accepted and the
 * caller picks the role written to the token.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final JwtEncoder jwtEncoder;
  private final CurrencyConverterProperties.Security securityConfig;
  private final Clock clock;

  public TokenService(
      JwtEncoder jwtEncoder, CurrencyConverterProperties properties, Clock clock) {
    this.jwtEncoder = jwtEncoder;
    this.securityConfig = properties.getSecurity();
    this.clock = clock;
  }

  /**
   * Issues a token after checking the credentials.
   *
   * @param username caller username
   * @param password caller password
   * @param role role written to the token
   * @return signed token with its expiry
   * @throws BadCredentialsException if the credentials do not match the demo account
   */
  public IssuedToken issueToken(String username, String password, Role role) {
    if (!matches(securityConfig.getDemoUsername(), username)
        || !matches(securityConfig.getDemoPassword(), password)) {
      log.warn("Rejected token request for user: {}", username);
      throw new BadCredentialsException("Invalid credentials");
    }

    // JWT timestamps carry whole seconds
    var issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    var expiresAt = issuedAt.plus(securityConfig.getTokenTtl());

    var claims =
        JwtClaimsSet.builder()
            .issuer(securityConfig.getIssuer())
            .audience(List.of(securityConfig.getAudience()))
            .subject(username)
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .claim(SecurityConfig.ROLES_CLAIM, List.of(role.claimValue()))
            .build();
    var header = JwsHeader.with(MacAlgorithm.HS256).build();

    var token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    log.info("Auth token created for {} with role {}", username, role.claimValue());

    return new IssuedToken(token, expiresAt);
  }

  private static boolean matches(String expected, String actual) {
    if (actual == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * A signed token.
   *
   * @param token compact JWS serialization
   * @param expiresAt instant the token stops being accepted
   */
  public record IssuedToken(String token, Instant expiresAt) {}
}
