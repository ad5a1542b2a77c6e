package com.example.audit.archive;

public class ArchiveNotFoundException extends RuntimeException {

  public ArchiveNotFoundException(String fileName) {
    super("archive not found: " + fileName);
  }
}
