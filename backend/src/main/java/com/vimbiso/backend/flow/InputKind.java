package com.vimbiso.backend.flow;

public enum InputKind {
  TEXT,
  BUTTON,
  LIST
}
