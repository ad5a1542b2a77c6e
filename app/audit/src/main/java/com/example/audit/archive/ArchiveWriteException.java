package com.example.audit.archive;

public class ArchiveWriteException extends RuntimeException {

  public ArchiveWriteException(String message) {
    super(message);
  }

  public ArchiveWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
