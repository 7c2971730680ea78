package io.cardwatch.storage.models;

import java.util.Locale;
import javax.annotation.Nullable;

public enum ItemKind {
  DOCUMENT,
  IMAGE;

  private static final String IMAGE_MIME_PREFIX = "image/";

  /** Derives the kind from the MIME type, falling back to the file extension when it is unknown. */
  public static ItemKind from(@Nullable String mimeType, String name) {
    if (mimeType != null && !mimeType.isEmpty()) {
      return mimeType.toLowerCase(Locale.ROOT).startsWith(IMAGE_MIME_PREFIX) ? IMAGE : DOCUMENT;
    }
    String lowerCaseName = name.toLowerCase(Locale.ROOT);
    return lowerCaseName.endsWith(".png")
            || lowerCaseName.endsWith(".jpg")
            || lowerCaseName.endsWith(".jpeg")
        ? IMAGE
        : DOCUMENT;
  }
}
