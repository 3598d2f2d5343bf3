package io.intellixity.schemata.yaml;

/** Raised when a document or schema declaration file cannot be read or has the wrong shape. */
public final class DocumentException extends RuntimeException {
  public DocumentException(String message) {
    super(message);
  }

  public DocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
