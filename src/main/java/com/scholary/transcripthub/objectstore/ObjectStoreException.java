package com.scholary.transcripthub.objectstore;

import com.scholary.transcripthub.exception.TranscriptHubException;

/** Object storage failure: missing object, bad credentials, or an unreachable endpoint. */
public class ObjectStoreException extends TranscriptHubException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
