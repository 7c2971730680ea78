package io.cardwatch.exceptions;

public class HistoryPersistenceException extends Exception {
  public HistoryPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
