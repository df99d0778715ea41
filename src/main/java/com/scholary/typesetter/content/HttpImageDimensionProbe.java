package com.scholary.typesetter.content;

import com.scholary.typesetter.measure.ImageDimensions;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.Iterator;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads image headers over HTTP, or from inline {@code data:} URIs, to learn their size.
 *
 * <p>Only the image header is decoded. Relative URLs cannot be resolved on the server and report
 * an unknown size.
 */
public class HttpImageDimensionProbe implements ImageDimensionProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpImageDimensionProbe.class);

  private final HttpClient httpClient;
  private final Duration requestTimeout;

  public HttpImageDimensionProbe(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public Optional<ImageDimensions> probe(String src) {
    try {
      if (src.startsWith("data:")) {
        return readDimensions(new ByteArrayInputStream(decodeDataUri(src)));
      }
      if (!src.startsWith("http://") && !src.startsWith("https://")) {
        LOGGER.debug("Image source is not fetchable: {}", src);
        return Optional.empty();
      }
      HttpRequest request =
          HttpRequest.newBuilder().uri(URI.create(src)).timeout(requestTimeout).GET().build();
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream body = response.body()) {
        if (response.statusCode() != 200) {
          LOGGER.debug("Image request failed: src={}, status={}", src, response.statusCode());
          return Optional.empty();
        }
        return readDimensions(body);
      }
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.debug("Could not read image size: src={}, error={}", src, e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  private static byte[] decodeDataUri(String src) {
    int comma = src.indexOf(',');
    if (comma < 0 || !src.substring(0, comma).endsWith(";base64")) {
      throw new IllegalArgumentException("Unsupported data URI");
    }
    return Base64.getDecoder().decode(src.substring(comma + 1));
  }

  private static Optional<ImageDimensions> readDimensions(InputStream input) throws IOException {
    try (ImageInputStream stream = ImageIO.createImageInputStream(input)) {
      if (stream == null) {
        return Optional.empty();
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
      if (!readers.hasNext()) {
        return Optional.empty();
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(stream, true, true);
        return Optional.of(new ImageDimensions(reader.getWidth(0), reader.getHeight(0)));
      } finally {
        reader.dispose();
      }
    }
  }
}
