package de.ialistannen.glancesync.store.glance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches tokens from a Keystone v3 identity service using password authentication. Tokens are cached until shortly
 * before they expire.
 */
public class KeystoneAuthenticator {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeystoneAuthenticator.class);

  private static final String TOKEN_KEY = "token";
  private static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofHours(1);
  private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);

  private final HttpClient client;
  private final URI authUrl;
  private final KeystoneCredentials credentials;
  private final Duration timeout;
  private final ObjectMapper objectMapper;
  private final Cache<String, IssuedToken> cache;

  /**
   * @param client the http client to use
   * @param authUrl the versioned identity endpoint, e.g. {@code http://keystone:5000/v3}
   * @param credentials the credentials to authenticate with
   * @param timeout the timeout for a single token request
   */
  public KeystoneAuthenticator(HttpClient client, URI authUrl, KeystoneCredentials credentials, Duration timeout) {
    this.client = client;
    this.authUrl = authUrl;
    this.credentials = credentials;
    this.timeout = timeout;

    this.objectMapper = new ObjectMapper();
    this.cache = Caffeine.newBuilder()
      .expireAfter(new TokenExpiry())
      .build();
  }

  /**
   * Returns a valid token, requesting a new one if the cached one is missing or about to expire.
   *
   * @return the token to pass as {@code X-Auth-Token}
   * @throws StoreUnavailableException if no token could be obtained
   */
  public String token() {
    return cache.get(TOKEN_KEY, ignored -> fetchTokenSilent()).token();
  }

  /**
   * Drops the cached token, e.g. after the store rejected it.
   */
  public void invalidate() {
    LOGGER.debug("Invalidating token for {}", authUrl);
    cache.invalidateAll();
  }

  private IssuedToken fetchTokenSilent() {
    try {
      return fetchToken();
    } catch (IOException e) {
      throw new StoreUnavailableException("Error fetching auth token from " + authUrl, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException("Interrupted while fetching auth token from " + authUrl, e);
    }
  }

  private IssuedToken fetchToken() throws IOException, InterruptedException {
    LOGGER.debug("Fetching token for user '{}' from {}", credentials.username(), authUrl);

    HttpRequest request = HttpRequest.newBuilder(URI.create(authUrl + "/auth/tokens"))
      .header("Content-Type", "application/json")
      .header("User-Agent", "glance-sync")
      .timeout(timeout)
      .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(buildAuthRequest())))
      .build();

    HttpResponse<String> response = client.send(request, BodyHandlers.ofString());
    if (response.statusCode() != 201 && response.statusCode() != 200) {
      LOGGER.error(
        "Unsuccessful request to identity service at {} with status {}. Body: {}",
        authUrl, response.statusCode(), response.body()
      );
      throw new StoreUnavailableException(
        "Could not fetch token as response returned status " + response.statusCode(),
        response.statusCode()
      );
    }

    String token = response.headers()
      .firstValue("X-Subject-Token")
      .orElseThrow(() -> new StoreUnavailableException("Could not find X-Subject-Token header"));

    return new IssuedToken(token, parseExpiry(response.body()));
  }

  private ObjectNode buildAuthRequest() {
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode auth = root.putObject("auth");

    ObjectNode identity = auth.putObject("identity");
    identity.putArray("methods").add("password");
    ObjectNode user = identity.putObject("password").putObject("user");
    user.put("name", credentials.username());
    user.put("password", credentials.password());
    user.putObject("domain").put("id", credentials.domain());

    ObjectNode project = auth.putObject("scope").putObject("project");
    project.put("name", credentials.tenant());
    project.putObject("domain").put("id", credentials.domain());

    return root;
  }

  private Instant parseExpiry(String body) {
    Instant fallback = Instant.now().plus(DEFAULT_TOKEN_LIFETIME);
    try {
      JsonNode expiresAt = objectMapper.readTree(body).path("token").path("expires_at");
      if (expiresAt.isMissingNode() || expiresAt.isNull()) {
        return fallback;
      }
      return Instant.parse(expiresAt.asText());
    } catch (IOException | DateTimeParseException e) {
      LOGGER.warn("Could not read token expiry, assuming {}", DEFAULT_TOKEN_LIFETIME, e);
      return fallback;
    }
  }

  /**
   * The credentials used for password authentication.
   *
   * @param username the user name
   * @param password the password
   * @param tenant the project (tenant) to scope the token to
   * @param domain the domain id of user and project
   */
  public record KeystoneCredentials(String username, String password, String tenant, String domain) {

  }

  private record IssuedToken(String token, Instant expiresAt) {

  }

  private static class TokenExpiry implements Expiry<String, IssuedToken> {

    @Override
    public long expireAfterCreate(String key, IssuedToken value, long currentTime) {
      Duration remaining = Duration.between(Instant.now(), value.expiresAt()).minus(EXPIRY_MARGIN);
      return remaining.isNegative() ? 0 : remaining.toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, IssuedToken value, long currentTime, long currentDuration) {
      return expireAfterCreate(key, value, currentTime);
    }

    @Override
    public long expireAfterRead(String key, IssuedToken value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
