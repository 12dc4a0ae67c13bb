package org.waabox.fanout.source.postgres;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of the PostgreSQL source store.
 *
 * <p>Accepts JDBC URLs ({@code jdbc:postgresql://host/db}) as well as the
 * libpq style {@code postgresql://} and {@code postgres://} URLs, which are
 * turned into JDBC URLs. The driver does not read credentials from the
 * authority part, so a libpq {@code user:password@} prefix is moved out of
 * the URL into {@link #user()} and {@link #password()}. Credentials given
 * explicitly override the ones in the URL.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PgSourceConfig {

  /** The JDBC URL prefix of the driver. */
  private static final String JDBC_PREFIX = "jdbc:postgresql://";

  /** Default bound on opening a connection. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The JDBC URL, never null. */
  private final String jdbcUrl;

  /** The user, null to use the one in the URL. */
  private final String user;

  /** The password, null to use the one in the URL. */
  private final String password;

  /** Bound on opening a connection, never null. */
  private final Duration connectTimeout;

  /** Private constructor; use static factories.
   *
   * @param theJdbcUrl the JDBC URL
   * @param theUser the user
   * @param thePassword the password
   * @param theConnectTimeout the connect timeout
   */
  private PgSourceConfig(final String theJdbcUrl, final String theUser,
      final String thePassword, final Duration theConnectTimeout) {
    jdbcUrl = theJdbcUrl;
    user = theUser;
    password = thePassword;
    connectTimeout = theConnectTimeout;
  }

  /**
   * Creates a configuration with credentials taken from the URL.
   *
   * @param url the database URL, never null
   *
   * @return a new configuration instance, never null
   */
  public static PgSourceConfig create(final String url) {
    return create(url, null, null);
  }

  /**
   * Creates a configuration with explicit credentials.
   *
   * @param url the database URL, never null
   * @param user the user, may be null
   * @param password the password, may be null
   *
   * @return a new configuration instance, never null
   */
  public static PgSourceConfig create(final String url, final String user,
      final String password) {
    return create(url, user, password, DEFAULT_CONNECT_TIMEOUT);
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param url the database URL, never null
   * @param user the user, null or empty to use the one in the URL
   * @param password the password, null or empty to use the one in the URL
   * @param connectTimeout bound on opening a connection, never null
   *
   * @return a new configuration instance, never null
   *
   * @throws IllegalArgumentException if the URL is not a PostgreSQL URL
   */
  public static PgSourceConfig create(final String url, final String user,
      final String password, final Duration connectTimeout) {
    Objects.requireNonNull(url, "url cannot be null");
    Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");

    final String trimmed = url.strip();
    if (trimmed.startsWith(JDBC_PREFIX)) {
      return new PgSourceConfig(trimmed, emptyToNull(user),
          emptyToNull(password), connectTimeout);
    }
    if (!trimmed.startsWith("postgresql://")
        && !trimmed.startsWith("postgres://")) {
      throw new IllegalArgumentException("Not a PostgreSQL URL: "
          + redact(trimmed));
    }

    final URI uri;
    try {
      uri = new URI(trimmed);
    } catch (final URISyntaxException e) {
      throw new IllegalArgumentException("Malformed PostgreSQL URL: "
          + redact(trimmed), e);
    }
    final String authority = uri.getRawAuthority();
    if (authority == null) {
      throw new IllegalArgumentException("PostgreSQL URL has no host: "
          + redact(trimmed));
    }

    String urlUser = null;
    String urlPassword = null;
    String hosts = authority;
    final int at = authority.lastIndexOf('@');
    if (at >= 0) {
      final String userInfo = authority.substring(0, at);
      hosts = authority.substring(at + 1);
      final int colon = userInfo.indexOf(':');
      if (colon >= 0) {
        urlUser = decode(userInfo.substring(0, colon));
        urlPassword = decode(userInfo.substring(colon + 1));
      } else {
        urlUser = decode(userInfo);
      }
    }

    final StringBuilder jdbc = new StringBuilder(JDBC_PREFIX).append(hosts);
    if (uri.getRawPath() != null) {
      jdbc.append(uri.getRawPath());
    }
    if (uri.getRawQuery() != null) {
      jdbc.append('?').append(uri.getRawQuery());
    }

    return new PgSourceConfig(jdbc.toString(),
        emptyToNull(user) != null ? user : emptyToNull(urlUser),
        emptyToNull(password) != null ? password : urlPassword,
        connectTimeout);
  }

  /**
   * Returns the JDBC URL.
   *
   * @return the URL, never null
   */
  public String jdbcUrl() {
    return jdbcUrl;
  }

  /**
   * Returns the user.
   *
   * @return the user, null when taken from the URL
   */
  public String user() {
    return user;
  }

  /**
   * Returns the password.
   *
   * @return the password, null when taken from the URL
   */
  public String password() {
    return password;
  }

  /**
   * Returns the bound on opening a connection.
   *
   * @return the connect timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /** Percent-decodes a userinfo part; a '+' stays a '+'. */
  private static String decode(final String part) {
    return URLDecoder.decode(part.replace("+", "%2B"),
        StandardCharsets.UTF_8);
  }

  private static String emptyToNull(final String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  /** Drops the userinfo of a URL so it can be shown in errors. */
  private static String redact(final String url) {
    final int scheme = url.indexOf("://");
    final int at = url.lastIndexOf('@');
    if (scheme < 0 || at < scheme) {
      return url;
    }
    return url.substring(0, scheme + 3) + "***@" + url.substring(at + 1);
  }

  @Override
  public String toString() {
    return "PgSourceConfig{url=" + jdbcUrl + ", user=" + user + "}";
  }
}
