package com.vimbiso.backend.messaging.api;

/** Shape of the user's inbound message as normalized by the channel adapter. */
public enum MessageKind {
  TEXT,
  BUTTON,
  LIST,
  FORM
}
