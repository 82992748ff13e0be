package org.npsim.base.util.machine;

/**
 * A deterministic single-tape transition function.  The simulator treats it as a black box.
 */
public interface TransitionOracle
{
  /**
   * @return the transition taken from the given state when the head reads the given symbol.  Never null - machines
   *         encode "no rule" as a move into their reject state.
   *
   * @param xiState  - the current state.
   * @param xiSymbol - the symbol under the head.
   */
  public abstract Transition delta(String xiState, String xiSymbol);
}
