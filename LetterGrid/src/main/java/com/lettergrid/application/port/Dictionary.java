package com.lettergrid.application.port;

/** Word-validity oracle. Implementations must be side-effect free from the caller's view. */
public interface Dictionary {
  boolean isValidWord(String word);
}
