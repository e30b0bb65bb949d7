package com.aino.http;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The outbound response triple handed back to the host server. */
public class Response {
  private final int status;
  private final List<Header> headers;
  private final Object body;

  /**
   * Creates a new response.
   *
   * @param status the status code
   * @param headers the ordered headers, duplicates allowed
   * @param body the body, either a {@link String} or a {@code byte[]}
   */
  public Response(int status, List<Header> headers, Object body) {
    if (!(body instanceof String) && !(body instanceof byte[])) {
      throw new IllegalArgumentException(
          "Response body must be a String or byte[], got " + body.getClass().getName());
    }
    this.status = status;
    this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    this.body = body;
  }

  public int getStatus() {
    return status;
  }

  public List<Header> getHeaders() {
    return headers;
  }

  /**
   * Gets the first value of a header, compared case-insensitively.
   *
   * @param name the header name
   * @return the value or null if not present
   */
  public String getHeader(String name) {
    for (Header header : headers) {
      if (header.getName().equalsIgnoreCase(name)) {
        return header.getValue();
      }
    }
    return null;
  }

  public Object getBody() {
    return body;
  }

  /**
   * Gets the body as bytes, encoding string bodies as UTF-8.
   *
   * @return the body bytes
   */
  public byte[] getBodyBytes() {
    if (body instanceof byte[]) {
      return (byte[]) body;
    }
    return ((String) body).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Gets the body as a string, decoding byte bodies as UTF-8.
   *
   * @return the body text
   */
  public String getBodyText() {
    if (body instanceof String) {
      return (String) body;
    }
    return new String((byte[]) body, StandardCharsets.UTF_8);
  }
}
