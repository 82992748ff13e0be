package org.npsim.base.util.graph;

/**
 * A node of the computation graph: a {@link TransitionCase} together with the configuration one tier below, at the
 * same cell, whose transition justified reaching this tier.
 *
 * Floor vertices (tier 0) have no predecessor.  Identity is (index, tier, state, symbol[, predecessor state,
 * predecessor symbol]).  Vertices are immutable and obtained from a {@link ConfigurationSpace}.
 */
public final class Vertex
{
  private final TransitionCase mCase;
  private final TransitionCase mPredecessor;
  private final int            mHashCode;

  Vertex(TransitionCase xiCase, TransitionCase xiPredecessor)
  {
    if (xiCase.isFloor())
    {
      if (xiPredecessor != null)
      {
        throw new IllegalArgumentException("Floor vertex " + xiCase + " cannot have predecessor " + xiPredecessor);
      }
    }
    else
    {
      if (xiPredecessor == null)
      {
        throw new IllegalArgumentException("Vertex " + xiCase + " above the floor needs a predecessor");
      }
      if (xiPredecessor.getIndex() != xiCase.getIndex())
      {
        throw new IllegalArgumentException("Wrong index for predecessor " + xiPredecessor + " of " + xiCase);
      }
      if (xiPredecessor.getTier() != xiCase.getTier() - 1)
      {
        throw new IllegalArgumentException("Wrong tier for predecessor " + xiPredecessor + " of " + xiCase);
      }
    }

    mCase = xiCase;
    mPredecessor = xiPredecessor;
    mHashCode = mCase.hashCode() * 31 + ((mPredecessor == null) ? 0 : mPredecessor.hashCode());
  }

  public TransitionCase getCase()
  {
    return mCase;
  }

  /**
   * @return the configuration which justified this vertex, or null for a floor vertex.
   */
  public TransitionCase getPredecessor()
  {
    return mPredecessor;
  }

  public int getIndex()
  {
    return mCase.getIndex();
  }

  public int getTier()
  {
    return mCase.getTier();
  }

  public String getState()
  {
    return mCase.getState();
  }

  public String getSymbol()
  {
    return mCase.getSymbol();
  }

  public String getOutput()
  {
    return mCase.getOutput();
  }

  public String getNextState()
  {
    return mCase.getNextState();
  }

  public int getNextIndex()
  {
    return mCase.getNextIndex();
  }

  public String getLastState()
  {
    return mPredecessor.getState();
  }

  public String getLastSymbol()
  {
    return mPredecessor.getSymbol();
  }

  public boolean isFloor()
  {
    return mCase.isFloor();
  }

  public boolean isHalting()
  {
    return mCase.isHalting();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Vertex))
    {
      return false;
    }
    Vertex lOther = (Vertex)xiOther;
    if (!mCase.equals(lOther.mCase))
    {
      return false;
    }
    return (mPredecessor == null) ? (lOther.mPredecessor == null) : mPredecessor.equals(lOther.mPredecessor);
  }

  @Override
  public int hashCode()
  {
    return mHashCode;
  }

  @Override
  public String toString()
  {
    if (mPredecessor == null)
    {
      return mCase.toString();
    }
    return "(" + getIndex() + "," + getTier() + "," + getState() + "," + getSymbol() + "," +
           mPredecessor.getState() + "," + mPredecessor.getSymbol() + ")";
  }
}
