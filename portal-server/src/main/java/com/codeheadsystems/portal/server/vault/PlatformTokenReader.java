package com.codeheadsystems.portal.server.vault;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Reads the platform-mounted workload identity token. Read on every login since the platform
 * rotates the file.
 */
public class PlatformTokenReader implements Supplier<String> {

  /** Kubernetes' default service account token location. */
  public static final Path DEFAULT_PATH = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

  private final Path path;

  /**
   * Instantiates a new Platform token reader.
   *
   * @param path the token file
   */
  public PlatformTokenReader(final Path path) {
    this.path = path;
  }

  @Override
  public String get() {
    try {
      return Files.readString(path, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "platform identity token unreadable: " + path, e);
    }
  }
}
