package org.npsim.base.util.machine;

/**
 * Result of one application of a transition function: the next state, the symbol written and the head movement.
 *
 * Transition tables also use this class for their raw rules, in which case the state and output may still contain
 * pattern placeholders.
 */
public final class Transition
{
  /**
   * Head movement to the left.
   */
  public static final int LEFT = -1;

  /**
   * Head movement to the right.
   */
  public static final int RIGHT = +1;

  private final String mNextState;
  private final String mOutput;
  private final int    mMove;

  /**
   * Create a transition.
   *
   * @param xiNextState - the state entered.
   * @param xiOutput    - the symbol written to the current cell.
   * @param xiMove      - the head movement, LEFT or RIGHT.
   */
  public Transition(String xiNextState, String xiOutput, int xiMove)
  {
    mNextState = xiNextState;
    mOutput = xiOutput;
    mMove = xiMove;
  }

  public String getNextState()
  {
    return mNextState;
  }

  public String getOutput()
  {
    return mOutput;
  }

  public int getMove()
  {
    return mMove;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof Transition))
    {
      return false;
    }
    Transition lOther = (Transition)xiOther;
    return (mMove == lOther.mMove) && mNextState.equals(lOther.mNextState) && mOutput.equals(lOther.mOutput);
  }

  @Override
  public int hashCode()
  {
    return (mNextState.hashCode() * 31 + mOutput.hashCode()) * 31 + mMove;
  }

  @Override
  public String toString()
  {
    return "(" + mNextState + "," + mOutput + "," + (mMove > 0 ? "+1" : "" + mMove) + ")";
  }
}
