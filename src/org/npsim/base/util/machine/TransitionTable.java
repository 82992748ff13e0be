package org.npsim.base.util.machine;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * A table of raw transition rules, keyed by (state, symbol).
 *
 * Either key may be a pattern rather than a concrete value - e.g. a state family such as "Dec.N" or a symbol class
 * such as "D" (any decimal digit) or "*" (any symbol).  The table itself does no matching.  The machine owning it
 * decides which keys to try and how to instantiate the placeholders in the rule it finds.
 */
public class TransitionTable
{
  private final Table<String, String, Transition> mRules = HashBasedTable.create();

  /**
   * Add a rule, replacing any existing rule for the same key.
   *
   * @return this table, for chaining.
   *
   * @param xiState     - the (pattern) state.
   * @param xiSymbol    - the (pattern) symbol.
   * @param xiNextState - the (pattern) next state.
   * @param xiOutput    - the (pattern) output symbol.
   * @param xiMove      - the head movement.
   */
  public TransitionTable rule(String xiState, String xiSymbol, String xiNextState, String xiOutput, int xiMove)
  {
    mRules.put(xiState, xiSymbol, new Transition(xiNextState, xiOutput, xiMove));
    return this;
  }

  /**
   * @return the rule for exactly this key, or null if there isn't one.
   *
   * @param xiState  - the (pattern) state.
   * @param xiSymbol - the (pattern) symbol.
   */
  public Transition get(String xiState, String xiSymbol)
  {
    if (xiState == null)
    {
      return null;
    }
    return mRules.get(xiState, xiSymbol);
  }
}
