package io.kurrent.client.model;

/** Keys of the system metadata the server attaches to every recorded event. */
public final class SystemMetadata {
  public static final String TYPE = "type";
  public static final String CONTENT_TYPE = "content-type";
  public static final String CREATED = "created";

  public static final String CONTENT_TYPE_JSON = "application/json";
  public static final String CONTENT_TYPE_OCTET_STREAM = "application/octet-stream";

  private SystemMetadata() {}
}
