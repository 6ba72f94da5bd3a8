package br.rio.confere.domain.navigation;

/**
 * Position of the discovery walk inside the contracts portal hierarchy.
 *
 * <p>The forward order is {@code INIT → FILTERED → COMPANY_SELECTED → ORGAN_SELECTED →
 * UNIT_SELECTED → LEAF_COLLECTED}; {@link #RESET} can be entered from any state and returns to
 * {@link #INIT}.</p>
 */
public enum NavigationState {
  INIT,
  FILTERED,
  COMPANY_SELECTED,
  ORGAN_SELECTED,
  UNIT_SELECTED,
  LEAF_COLLECTED,
  RESET;

  /**
   * Checks whether {@code next} is a legal transition from this state.
   *
   * @param next requested state
   * @return {@code true} when the transition is allowed
   */
  public boolean canTransitionTo(NavigationState next) {
    if (next == RESET) {
      return true;
    }
    return switch (this) {
      case INIT -> next == FILTERED;
      case FILTERED -> next == COMPANY_SELECTED;
      case COMPANY_SELECTED -> next == ORGAN_SELECTED || next == LEAF_COLLECTED;
      case ORGAN_SELECTED -> next == UNIT_SELECTED || next == LEAF_COLLECTED;
      case UNIT_SELECTED -> next == LEAF_COLLECTED;
      case LEAF_COLLECTED -> false;
      case RESET -> next == INIT;
    };
  }
}
