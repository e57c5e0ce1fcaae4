package io.boxofports.table;

/** How a column's cells should be interpreted for sorting. */
public enum SemanticHint {
  TIMESTAMP,
  PORT,
  GENERIC
}
