package org.npsim.base.util.graph;

import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;

/**
 * A machine configuration at one tape cell and tier: the state on entering the cell and the symbol found there,
 * together with the oracle's answer for that pair.
 *
 * Identity is (index, tier, state, symbol).  Instances are obtained from a {@link ConfigurationSpace}.
 */
public final class TransitionCase
{
  private final int        mIndex;
  private final int        mTier;
  private final String     mState;
  private final String     mSymbol;
  private final Transition mTransition;
  private final int        mHashCode;

  TransitionCase(int xiIndex, int xiTier, String xiState, String xiSymbol, Transition xiTransition)
  {
    if (xiTier < 0)
    {
      throw new IllegalArgumentException("Negative tier " + xiTier);
    }
    mIndex = xiIndex;
    mTier = xiTier;
    mState = xiState;
    mSymbol = xiSymbol;
    mTransition = xiTransition;
    mHashCode = ((mIndex * 31 + mTier) * 31 + mState.hashCode()) * 31 + mSymbol.hashCode();
  }

  public int getIndex()
  {
    return mIndex;
  }

  public int getTier()
  {
    return mTier;
  }

  public String getState()
  {
    return mState;
  }

  public String getSymbol()
  {
    return mSymbol;
  }

  public String getNextState()
  {
    return mTransition.getNextState();
  }

  public String getOutput()
  {
    return mTransition.getOutput();
  }

  /**
   * @return the head movement, -1 or +1.
   */
  public int getMove()
  {
    return mTransition.getMove();
  }

  /**
   * @return the cell the head moves to.
   */
  public int getNextIndex()
  {
    return mIndex + mTransition.getMove();
  }

  /**
   * @return whether this configuration is on the floor (tier 0), i.e. anchored directly to the input tape.
   */
  public boolean isFloor()
  {
    return mTier == 0;
  }

  /**
   * @return whether the state is a halt state.
   */
  public boolean isHalting()
  {
    return MachineSpecification.isHalting(mState);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof TransitionCase))
    {
      return false;
    }
    TransitionCase lOther = (TransitionCase)xiOther;
    return (mIndex == lOther.mIndex) &&
           (mTier == lOther.mTier) &&
           mState.equals(lOther.mState) &&
           mSymbol.equals(lOther.mSymbol);
  }

  @Override
  public int hashCode()
  {
    return mHashCode;
  }

  @Override
  public String toString()
  {
    return "(" + mIndex + "," + mTier + "," + mState + "," + mSymbol + ")";
  }
}
