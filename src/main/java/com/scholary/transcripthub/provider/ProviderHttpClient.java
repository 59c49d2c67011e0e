package com.scholary.transcripthub.provider;

import com.scholary.transcripthub.exception.ProviderException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends provider requests with bounded retries.
 *
 * <p>Network errors, {@code 429} and {@code 5xx} responses are retried with exponential backoff
 * and jitter. Any other non-2xx response fails immediately. Every failure surfaces as a {@link
 * ProviderException} tagged with the provider name.
 */
public class ProviderHttpClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderHttpClient.class);

  private final String provider;
  private final HttpClient httpClient;
  private final Duration readTimeout;
  private final int maxRetries;
  private final Duration backoffBase;

  public ProviderHttpClient(
      String provider, Duration connectTimeout, Duration readTimeout, int maxRetries) {
    this(provider, connectTimeout, readTimeout, maxRetries, Duration.ofSeconds(1));
  }

  public ProviderHttpClient(
      String provider,
      Duration connectTimeout,
      Duration readTimeout,
      int maxRetries,
      Duration backoffBase) {
    this.provider = provider;
    this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    this.readTimeout = readTimeout;
    this.maxRetries = Math.max(1, maxRetries);
    this.backoffBase = backoffBase;
  }

  /** A request builder with the configured read timeout applied. */
  public HttpRequest.Builder request(URI uri) {
    return HttpRequest.newBuilder().uri(uri).timeout(readTimeout);
  }

  /**
   * Send {@code request} and return the response body.
   *
   * @throws ProviderException if the call does not succeed within the retry budget
   */
  public String send(HttpRequest request) {
    return exchange(request).body();
  }

  /**
   * Send {@code request} and return the whole successful response, for callers that need its
   * headers.
   *
   * @throws ProviderException if the call does not succeed within the retry budget
   */
  public HttpResponse<String> exchange(HttpRequest request) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      attempt++;
      try {
        HttpResponse<String> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response;
        }
        if (status != 429 && status < 500) {
          throw new ProviderException(
              provider,
              String.format("%s returned status %d: %s", provider, status, response.body()));
        }
        lastException =
            new IOException(String.format("%s returned status %d", provider, status));
      } catch (IOException e) {
        lastException = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProviderException(provider, provider + " request interrupted", e);
      }

      if (attempt < maxRetries) {
        long backoffMs = backoffMillis(attempt);
        LOGGER.warn(
            "{} attempt {}/{} failed, retrying in {}ms: {}",
            provider,
            attempt,
            maxRetries,
            backoffMs,
            lastException.getMessage());
        sleep(backoffMs);
      }
    }

    throw new ProviderException(
        provider,
        String.format(
            "%s request failed after %d attempts: %s",
            provider, maxRetries, lastException.getMessage()),
        lastException);
  }

  private long backoffMillis(int attempt) {
    long base = backoffBase.toMillis();
    if (base <= 0) {
      return 0;
    }
    return (long) (Math.pow(2, attempt - 1) * base) + ThreadLocalRandom.current().nextLong(base);
  }

  private void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(provider, provider + " retry interrupted", e);
    }
  }
}
