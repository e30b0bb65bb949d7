package com.aino.http;

import java.util.Objects;

/** A single header as a name/value pair. Headers are kept as ordered lists of these. */
public final class Header {
  private final String name;
  private final String value;

  /**
   * Creates a new header.
   *
   * @param name the header name
   * @param value the header value
   */
  public Header(String name, String value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Header)) {
      return false;
    }
    Header other = (Header) o;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + ": " + value;
  }
}
