package com.codeheadsystems.portal.server.ssh;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the SSH wire encoding (RFC 4251 section 5). Every malformed read raises
 * {@link IllegalArgumentException}.
 */
final class SshWireReader {

  private final ByteBuffer buffer;

  SshWireReader(final byte[] data) {
    this.buffer = ByteBuffer.wrap(data);
  }

  long readUint64() {
    try {
      return buffer.getLong();
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("truncated uint64", e);
    }
  }

  int readUint32() {
    try {
      return buffer.getInt();
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("truncated uint32", e);
    }
  }

  byte[] readBytes() {
    int length = readUint32();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("string length " + Integer.toUnsignedString(length)
          + " exceeds remaining " + buffer.remaining());
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  String readString() {
    return new String(readBytes(), StandardCharsets.UTF_8);
  }

  /**
   * A string whose content is itself a sequence of strings, as used for principals.
   */
  List<String> readStringList() {
    SshWireReader inner = new SshWireReader(readBytes());
    List<String> values = new ArrayList<>();
    while (inner.hasRemaining()) {
      values.add(inner.readString());
    }
    return values;
  }

  /**
   * A string holding (name, data) pairs, as used for options and extensions. Returns the names.
   */
  List<String> readOptionNames() {
    SshWireReader inner = new SshWireReader(readBytes());
    List<String> names = new ArrayList<>();
    while (inner.hasRemaining()) {
      names.add(inner.readString());
      inner.readBytes();
    }
    return names;
  }

  boolean hasRemaining() {
    return buffer.hasRemaining();
  }
}
