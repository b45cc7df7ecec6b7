package com.flamingo.ai.edigrammar.domain.model;

/** Discriminant for the two kinds of entries a segment can hold. */
public enum NodeKind {
  /** A simple data element, identified by a 4-digit code. */
  ELEMENT,
  /** A composite group, identified by {@code S} or {@code C} followed by 3 digits. */
  GROUP
}
