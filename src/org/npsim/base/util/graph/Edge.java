package org.npsim.base.util.graph;

/**
 * A transition between configurations at adjacent cells: the machine leaves the cell of {@link #getFrom} and enters
 * the cell of {@link #getTo}.
 */
public final class Edge
{
  private final Vertex mFrom;
  private final Vertex mTo;

  /**
   * Create an edge.
   *
   * @param xiFrom - the vertex left.
   * @param xiTo   - the vertex entered.
   *
   * @throws IllegalArgumentException if the vertices aren't at adjacent cells.
   */
  public Edge(Vertex xiFrom, Vertex xiTo)
  {
    if (Math.abs(xiFrom.getIndex() - xiTo.getIndex()) != 1)
    {
      throw new IllegalArgumentException("Index difference of edge (" + xiFrom + "," + xiTo + ") is not +1/-1");
    }
    mFrom = xiFrom;
    mTo = xiTo;
  }

  public Vertex getFrom()
  {
    return mFrom;
  }

  public Vertex getTo()
  {
    return mTo;
  }

  /**
   * @return the lower of the two cell indices.  Edges are stored in the slice with this index.
   */
  public int getIndex()
  {
    return Math.min(mFrom.getIndex(), mTo.getIndex());
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Edge))
    {
      return false;
    }
    Edge lOther = (Edge)xiOther;
    return mFrom.equals(lOther.mFrom) && mTo.equals(lOther.mTo);
  }

  @Override
  public int hashCode()
  {
    return mFrom.hashCode() * 31 + mTo.hashCode();
  }

  @Override
  public String toString()
  {
    return "(" + mFrom + "," + mTo + ")";
  }
}
