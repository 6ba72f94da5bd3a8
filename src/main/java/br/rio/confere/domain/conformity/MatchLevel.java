package br.rio.confere.domain.conformity;

/**
 * Discrete agreement level for one compared field.
 */
public enum MatchLevel {
  /** Ratio exactly 1.0. */
  EXATO,
  /** Ratio in {@code [0.8, 1.0)}. */
  ALTO,
  /** Ratio in {@code [0.5, 0.8)}. */
  MEDIO,
  /** Ratio in {@code [0.2, 0.5)}. */
  BAIXO,
  /** Ratio below 0.2. */
  NENHUM;

  private static final double ALTO_FLOOR = 0.8;
  private static final double MEDIO_FLOOR = 0.5;
  private static final double BAIXO_FLOOR = 0.2;

  /**
   * Maps a similarity ratio to its level.
   *
   * @param ratio similarity in {@code [0, 1]}
   * @return level for the ratio
   * @throws IllegalArgumentException when the ratio is outside {@code [0, 1]} or NaN
   */
  public static MatchLevel fromRatio(double ratio) {
    if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
      throw new IllegalArgumentException("ratio must be within [0, 1] (was " + ratio + ")");
    }
    if (ratio == 1.0) {
      return EXATO;
    }
    if (ratio >= ALTO_FLOOR) {
      return ALTO;
    }
    if (ratio >= MEDIO_FLOOR) {
      return MEDIO;
    }
    if (ratio >= BAIXO_FLOOR) {
      return BAIXO;
    }
    return NENHUM;
  }

  /** Returns {@code true} for {@link #EXATO} and {@link #ALTO}. */
  public boolean atLeastAlto() {
    return this == EXATO || this == ALTO;
  }

  /** Returns {@code true} for {@link #BAIXO} and {@link #NENHUM}. */
  public boolean weak() {
    return this == BAIXO || this == NENHUM;
  }
}
