package de.ialistannen.glancesync.config;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings of one image store and the identity service it authenticates against.
 *
 * @param url the base url of the image service, e.g. {@code http://glance.example.com}
 * @param port the port of the image service, default 9292
 * @param version the image API version, default {@code v2}
 * @param username the user, default {@code admin}
 * @param password the password
 * @param tenant the project to scope tokens to, default {@code admin}
 * @param domain the domain id of user and project, default {@code default}
 * @param authUrl the base url of the identity service, default the image service url
 * @param authPort the port of the identity service, default 5000
 * @param authVersion the identity API version, default {@code v3}
 * @param timeoutSeconds the timeout of metadata requests, default 60
 * @param transferTimeoutSeconds the timeout of image data requests, default six hours
 */
public record ServerConfig(
  String url,
  Integer port,
  String version,
  String username,
  String password,
  String tenant,
  String domain,
  String authUrl,
  Integer authPort,
  String authVersion,
  Integer timeoutSeconds,
  Integer transferTimeoutSeconds
) {

  public static final int DEFAULT_PORT = 9292;
  public static final String DEFAULT_VERSION = "v2";
  public static final int DEFAULT_AUTH_PORT = 5000;
  public static final String DEFAULT_AUTH_VERSION = "v3";
  public static final int DEFAULT_TIMEOUT_SECONDS = 60;
  public static final int DEFAULT_TRANSFER_TIMEOUT_SECONDS = (int) Duration.ofHours(6).toSeconds();

  public ServerConfig {
    if (url == null || url.isBlank()) {
      throw new ConfigException("Every glance server needs an url");
    }
    port = port == null ? DEFAULT_PORT : port;
    version = version == null ? DEFAULT_VERSION : version;
    username = username == null ? "admin" : username;
    password = password == null ? "" : password;
    tenant = tenant == null ? "admin" : tenant;
    domain = domain == null ? "default" : domain;
    authUrl = authUrl == null ? url : authUrl;
    authPort = authPort == null ? DEFAULT_AUTH_PORT : authPort;
    authVersion = authVersion == null ? DEFAULT_AUTH_VERSION : authVersion;
    timeoutSeconds = timeoutSeconds == null ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
    transferTimeoutSeconds = transferTimeoutSeconds == null ? DEFAULT_TRANSFER_TIMEOUT_SECONDS : transferTimeoutSeconds;
  }

  /**
   * @return the versioned image endpoint, e.g. {@code http://glance:9292/v2}
   */
  public URI imageEndpoint() {
    return joinUrl(url, port, version);
  }

  /**
   * @return the versioned identity endpoint, e.g. {@code http://glance:5000/v3}
   */
  public URI identityEndpoint() {
    return joinUrl(authUrl, authPort, authVersion);
  }

  public Duration timeout() {
    return Duration.ofSeconds(timeoutSeconds);
  }

  public Duration transferTimeout() {
    return Duration.ofSeconds(transferTimeoutSeconds);
  }

  @Override
  public String toString() {
    return "ServerConfig{" + imageEndpoint() + ", user=" + username + ", tenant=" + tenant + "}";
  }

  private static URI joinUrl(String url, int port, String version) {
    try {
      return URI.create(url.replaceFirst("/+$", "") + ":" + port + "/" + version);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid url '" + url + "'", e);
    }
  }
}
