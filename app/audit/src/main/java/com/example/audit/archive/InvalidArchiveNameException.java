package com.example.audit.archive;

public class InvalidArchiveNameException extends RuntimeException {

  public InvalidArchiveNameException(String fileName) {
    super("invalid archive file name: " + fileName);
  }
}
