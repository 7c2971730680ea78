package io.cardwatch.exceptions;

import lombok.Getter;

@Getter
public class RemoteListingException extends RuntimeException {
  private final int statusCode;

  public RemoteListingException(Throwable cause) {
    super(cause);
    this.statusCode = 0;
  }

  public RemoteListingException(String message) {
    this(message, 0);
  }

  public RemoteListingException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }
}
