package com.example.audit.archive;

public enum ArchiveFormat {
  JSON("json", "application/json"),
  CSV("csv", "text/csv");

  private final String extension;
  private final String contentType;

  ArchiveFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  public static ArchiveFormat fromExtension(String extension) {
    for (ArchiveFormat format : values()) {
      if (format.extension.equalsIgnoreCase(extension)) {
        return format;
      }
    }
    throw new IllegalArgumentException("unknown archive extension: " + extension);
  }
}
