package io.boxofports.ports;

import java.util.List;

/**
 * Non-fatal observation made while resolving a specification. The resolver never prompts; callers
 * decide whether to show the warning or ask the operator to confirm.
 *
 * @param kind warning category
 * @param message human readable summary
 * @param sources the fragments or CSV rows that triggered it
 */
public record ResolveWarning(Kind kind, String message, List<String> sources) {

  /** Warning categories. */
  public enum Kind {
    /** One or more ports were given without a slot and slot 1 was assumed. */
    DEFAULT_SLOT_ASSUMED
  }

  public ResolveWarning {
    sources = List.copyOf(sources);
  }

  static ResolveWarning defaultSlotAssumed(List<String> sources) {
    return new ResolveWarning(
        Kind.DEFAULT_SLOT_ASSUMED,
        "No slot given for "
            + String.join(", ", sources)
            + "; assuming slot 1 (A). Use 1A or 1.01 to be explicit.",
        sources);
  }
}
