package de.ialistannen.glancesync.store.glance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.glancesync.model.ImageProperties;
import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.store.ImageContent;
import de.ialistannen.glancesync.store.ImageStore;
import de.ialistannen.glancesync.store.StoreException;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import de.ialistannen.glancesync.store.TransferException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the {@link ImageStore} operations against the OpenStack Image (Glance) v2 API.
 *
 * @see <a href="https://docs.openstack.org/api-ref/image/v2/">Image API v2</a>
 */
public class GlanceImageStore implements ImageStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlanceImageStore.class);

  private static final int PAGE_SIZE = 100;
  private static final int MAX_ERROR_BODY_LENGTH = 1000;
  private static final String JSON_PATCH = "application/openstack-images-v2.1-json-patch";

  private final String name;
  private final String endpoint;
  private final KeystoneAuthenticator authenticator;
  private final HttpClient client;
  private final Duration timeout;
  private final Duration transferTimeout;
  private final ObjectMapper objectMapper;

  /**
   * @param name the configured name of the store
   * @param endpoint the versioned image endpoint, e.g. {@code http://glance:9292/v2}
   * @param authenticator the authenticator providing tokens for this store
   * @param client the http client to use
   * @param timeout the timeout for metadata requests
   * @param transferTimeout the timeout for image data requests
   */
  public GlanceImageStore(
    String name,
    URI endpoint,
    KeystoneAuthenticator authenticator,
    HttpClient client,
    Duration timeout,
    Duration transferTimeout
  ) {
    this.name = name;
    this.endpoint = endpoint.toString().replaceFirst("/+$", "");
    this.authenticator = authenticator;
    this.client = client;
    this.timeout = timeout;
    this.transferTimeout = transferTimeout;

    this.objectMapper = new ObjectMapper();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<ImageRecord> listImages() {
    List<ImageRecord> images = new ArrayList<>();
    URI next = uri("/images?limit=" + PAGE_SIZE);

    while (next != null) {
      HttpResponse<String> response;
      try {
        response = send(HttpRequest.newBuilder(next).GET(), BodyHandlers.ofString(), timeout, "list images");
      } catch (StoreUnavailableException e) {
        throw e;
      } catch (StoreException e) {
        throw new StoreUnavailableException("Could not list images of '" + name + "'", e);
      }
      if (response.statusCode() != 200) {
        LOGGER.error("Listing images of '{}' failed ({}): {}", name, response.statusCode(), shorten(response.body()));
        throw new StoreUnavailableException(
          "Could not list images of '" + name + "', got status code " + response.statusCode(),
          response.statusCode()
        );
      }

      JsonNode root = readJson(response.body());
      for (JsonNode image : root.path("images")) {
        images.add(parseImage(image));
      }

      JsonNode nextNode = root.get("next");
      next = nextNode == null || nextNode.isNull() ? null : URI.create(endpoint).resolve(nextNode.asText());
    }

    LOGGER.debug("Listed {} image(s) on '{}'", images.size(), name);
    return images;
  }

  @Override
  public ImageRecord getImage(String id) {
    HttpResponse<String> response = send(
      HttpRequest.newBuilder(uri("/images/" + id)).GET(),
      BodyHandlers.ofString(),
      timeout,
      "get image " + id
    );
    expectStatus(response.statusCode(), response.body(), "get image " + id, 200);

    return parseImage(readJson(response.body()));
  }

  @Override
  public ImageContent downloadImage(String id) {
    HttpResponse<InputStream> response = send(
      HttpRequest.newBuilder(uri("/images/" + id + "/file")).GET(),
      BodyHandlers.ofInputStream(),
      transferTimeout,
      "download image " + id
    );
    if (response.statusCode() == 204) {
      closeQuietly(response.body());
      throw new StoreException("Image " + id + " on '" + name + "' has no data", 204);
    }
    if (response.statusCode() != 200) {
      expectStatus(response.statusCode(), drain(response.body()), "download image " + id, 200);
    }

    return new ImageContent(response.body());
  }

  @Override
  public ImageRecord createImage(ImageProperties properties) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("name", properties.name());
    ArrayNode tags = body.putArray("tags");
    properties.tags().forEach(tags::add);
    body.put("min_ram", properties.minRam());
    body.put("min_disk", properties.minDisk());
    body.put("protected", properties.isProtected());
    if (properties.containerFormat() != null) {
      body.put("container_format", properties.containerFormat());
    }
    if (properties.diskFormat() != null) {
      body.put("disk_format", properties.diskFormat());
    }
    if (properties.visibility() != null) {
      body.put("visibility", properties.visibility());
    }

    HttpResponse<String> response = send(
      HttpRequest.newBuilder(uri("/images"))
        .header("Content-Type", "application/json")
        .POST(BodyPublishers.ofString(body.toString())),
      BodyHandlers.ofString(),
      timeout,
      "create image " + properties.name()
    );
    expectStatus(response.statusCode(), response.body(), "create image " + properties.name(), 201);

    ImageRecord created = parseImage(readJson(response.body()));
    LOGGER.debug("Created image '{}' with id {} on '{}'", created.name(), created.id(), name);
    return created;
  }

  @Override
  public void uploadImage(String id, Path file) {
    BodyPublisher publisher;
    try {
      publisher = BodyPublishers.ofFile(file);
    } catch (FileNotFoundException e) {
      throw new TransferException("Can not upload missing file " + file, e);
    }

    HttpResponse<String> response;
    try {
      response = send(
        HttpRequest.newBuilder(uri("/images/" + id + "/file"))
          .header("Content-Type", "application/octet-stream")
          .PUT(publisher),
        BodyHandlers.ofString(),
        transferTimeout,
        "upload image " + id
      );
    } catch (StoreException e) {
      if (e.getCause() instanceof IOException) {
        throw new TransferException("Upload of " + file + " to image " + id + " on '" + name + "' failed", e);
      }
      throw e;
    }
    expectStatus(response.statusCode(), response.body(), "upload image " + id, 204, 200, 201);
  }

  @Override
  public void renameImage(String id, String newName) {
    ArrayNode patch = objectMapper.createArrayNode();
    patch.addObject()
      .put("op", "replace")
      .put("path", "/name")
      .put("value", newName);

    HttpResponse<String> response = send(
      HttpRequest.newBuilder(uri("/images/" + id))
        .header("Content-Type", JSON_PATCH)
        .method("PATCH", BodyPublishers.ofString(patch.toString())),
      BodyHandlers.ofString(),
      timeout,
      "rename image " + id
    );
    expectStatus(response.statusCode(), response.body(), "rename image " + id, 200);
  }

  @Override
  public void deleteImage(String id) {
    HttpResponse<String> response = send(
      HttpRequest.newBuilder(uri("/images/" + id)).DELETE(),
      BodyHandlers.ofString(),
      timeout,
      "delete image " + id
    );
    expectStatus(response.statusCode(), response.body(), "delete image " + id, 204, 200);
  }

  private <T> HttpResponse<T> send(
    HttpRequest.Builder builder,
    BodyHandler<T> bodyHandler,
    Duration requestTimeout,
    String action
  ) {
    HttpRequest request = builder
      .header("X-Auth-Token", authenticator.token())
      .header("User-Agent", "glance-sync")
      .timeout(requestTimeout)
      .build();

    LOGGER.debug("Sending request to {} ({})", request.uri(), request.method());
    try {
      HttpResponse<T> response = client.send(request, bodyHandler);
      LOGGER.debug("Got response {}-{}", response.uri(), response.statusCode());
      if (response.statusCode() == 401) {
        authenticator.invalidate();
      }
      return response;
    } catch (IOException e) {
      throw new StoreException("Failed to " + action + " on '" + name + "'", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while trying to " + action + " on '" + name + "'", e);
    }
  }

  private void expectStatus(int statusCode, String body, String action, int... expected) {
    for (int code : expected) {
      if (code == statusCode) {
        return;
      }
    }
    LOGGER.info("Failed to {} on '{}' ({}): {}", action, name, statusCode, shorten(body));
    throw new StoreException(
      "Failed to " + action + " on '" + name + "', got status code " + statusCode,
      statusCode
    );
  }

  private JsonNode readJson(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new StoreException("Received invalid JSON from '" + name + "'", e);
    }
  }

  private URI uri(String path) {
    return URI.create(endpoint + path);
  }

  /**
   * Converts a Glance v2 image document to an {@link ImageRecord}.
   *
   * @param node the image document
   * @return the parsed record
   */
  static ImageRecord parseImage(JsonNode node) {
    List<String> tags = new ArrayList<>();
    node.path("tags").forEach(tag -> tags.add(tag.asText()));

    return new ImageRecord(
      node.path("id").asText(),
      textOrNull(node, "name"),
      node.hasNonNull("size") ? node.get("size").asLong() : null,
      textOrNull(node, "checksum"),
      textOrNull(node, "container_format"),
      textOrNull(node, "disk_format"),
      textOrNull(node, "visibility"),
      node.path("protected").asBoolean(false),
      node.path("min_ram").asInt(0),
      node.path("min_disk").asInt(0),
      tags,
      textOrNull(node, "status")
    );
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static String drain(InputStream body) {
    try (body) {
      return new String(body.readNBytes(MAX_ERROR_BODY_LENGTH), StandardCharsets.UTF_8);
    } catch (IOException e) {
      return "<unreadable: " + e.getMessage() + ">";
    }
  }

  private static void closeQuietly(InputStream body) {
    try {
      body.close();
    } catch (IOException e) {
      LOGGER.debug("Failed to close response body", e);
    }
  }

  private static String shorten(String body) {
    if (body == null || body.length() <= MAX_ERROR_BODY_LENGTH) {
      return body;
    }
    return body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
  }
}
