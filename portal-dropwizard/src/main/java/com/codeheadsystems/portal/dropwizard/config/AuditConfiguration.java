package com.codeheadsystems.portal.dropwizard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code audit:} block. Events always go to the {@code audit} logger; {@code file} adds an
 * append-only JSON-lines file.
 */
public class AuditConfiguration {

  private String file;

  @JsonProperty
  public String getFile() {
    return file;
  }

  @JsonProperty
  public void setFile(final String file) {
    this.file = file;
  }
}
