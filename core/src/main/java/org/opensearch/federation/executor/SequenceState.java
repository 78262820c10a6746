/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of a sequence step during execution. */
public enum SequenceState {
  /** Not started */
  PENDING,

  /** First operation sent */
  FIRST_DISPATCHED,

  /** First operation merged, representations for the next operation extracted */
  KEYS_EXTRACTED,

  /** A dependent operation sent */
  SECOND_DISPATCHED,

  /** Every operation merged */
  MERGED,

  /** An operation failed; terminal and limited to the sequence's own subtree */
  FAILED;

  /** Returns true if moving from this state to {@code next} is a legal transition. */
  public boolean canTransitionTo(SequenceState next) {
    return successors().contains(next);
  }

  private Set<SequenceState> successors() {
    switch (this) {
      case PENDING:
        return EnumSet.of(FIRST_DISPATCHED);
      case FIRST_DISPATCHED:
        return EnumSet.of(KEYS_EXTRACTED, FAILED);
      case KEYS_EXTRACTED:
        return EnumSet.of(SECOND_DISPATCHED, FAILED);
      case SECOND_DISPATCHED:
        return EnumSet.of(KEYS_EXTRACTED, MERGED, FAILED);
      default:
        return EnumSet.noneOf(SequenceState.class);
    }
  }
}
