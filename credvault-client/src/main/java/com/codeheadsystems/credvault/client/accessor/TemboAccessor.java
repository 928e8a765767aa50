package com.codeheadsystems.credvault.client.accessor;

import com.codeheadsystems.credvault.client.config.TemboClientConfig;
import com.codeheadsystems.credvault.client.model.MeResponse;
import com.codeheadsystems.credvault.server.exception.ValidationRejectedException;
import com.codeheadsystems.credvault.server.exception.ValidationUnavailableException;
import com.codeheadsystems.credvault.server.model.RemoteIdentityClaims;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Tembo {@code /me} endpoint, used to validate API keys.
 * <p>
 * Stateless: the credential is passed per call and only ever placed in the
 * {@code Authorization} header. HTTP 401 and 403 surface as
 * {@link ValidationRejectedException}. Any other error status, I/O failure, timeout,
 * interruption or unreadable body surfaces as {@link ValidationUnavailableException}.
 */
@Singleton
public class TemboAccessor {

  private static final Logger log = LoggerFactory.getLogger(TemboAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final TemboClientConfig config;

  /**
   * Instantiates a new Tembo accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the base URI and timeout
   */
  @Inject
  public TemboAccessor(final HttpClient httpClient,
                       final ObjectMapper objectMapper,
                       final TemboClientConfig config) {
    log.info("TemboAccessor({})", config.baseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * Asks Tembo who owns the credential.
   *
   * @param credential the API key
   * @return the claims in the response, possibly incomplete
   * @throws ValidationRejectedException    on HTTP 401 or 403, or a key that cannot be sent
   * @throws ValidationUnavailableException on anything else that is not a readable 2xx
   */
  public RemoteIdentityClaims currentUser(final String credential) {
    log.debug("currentUser()");
    URI uri = meUri();
    HttpRequest request = buildRequest(uri, credential);
    long start = System.nanoTime();
    HttpResponse<String> response = send(uri, request);
    log.debug("GET {} -> {} in {} ms", uri, response.statusCode(),
        (System.nanoTime() - start) / 1_000_000);
    int status = response.statusCode();
    if (status == 401 || status == 403) {
      throw new ValidationRejectedException("Tembo rejected the API key: HTTP " + status);
    }
    if (status < 200 || status >= 300) {
      throw new ValidationUnavailableException("Unexpected HTTP " + status + " from " + uri);
    }
    try {
      MeResponse me = objectMapper.readValue(response.body(), MeResponse.class);
      if (me == null) {
        throw new ValidationUnavailableException("Empty response body from " + uri);
      }
      return me.toClaims();
    } catch (JsonProcessingException e) {
      throw new ValidationUnavailableException("Unreadable response body from " + uri, e);
    }
  }

  private HttpRequest buildRequest(final URI uri, final String credential) {
    try {
      return HttpRequest.newBuilder(uri)
          .timeout(config.requestTimeout())
          .header("Authorization", "Bearer " + credential)
          .header("Accept", "application/json")
          .GET()
          .build();
    } catch (IllegalArgumentException e) {
      // the JDK quotes the rejected header value, so neither the message nor the cause is kept
      throw new ValidationRejectedException("Malformed API key");
    }
  }

  private HttpResponse<String> send(final URI uri, final HttpRequest request) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new ValidationUnavailableException("Timed out calling " + uri, e);
    } catch (IOException e) {
      throw new ValidationUnavailableException("I/O error calling " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ValidationUnavailableException("Interrupted calling " + uri, e);
    }
  }

  private URI meUri() {
    String base = config.baseUri().toString();
    return URI.create(base.endsWith("/") ? base + "me" : base + "/me");
  }
}
