package com.codeheadsystems.portal.server.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends JSON lines to a file, syncing each write to disk before returning.
 */
public class FileAuditSink implements AuditSink {

  private final Path path;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new File audit sink.
   *
   * @param path         the file, created if missing
   * @param objectMapper the object mapper
   */
  public FileAuditSink(final Path path, final ObjectMapper objectMapper) {
    this.path = path;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized void write(final AuditEvent event) throws IOException {
    byte[] line = (objectMapper.writeValueAsString(event.fields()) + "\n").getBytes(StandardCharsets.UTF_8);
    Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
        StandardOpenOption.WRITE, StandardOpenOption.SYNC);
  }

  @Override
  public String toString() {
    return "FileAuditSink[" + path + "]";
  }
}
