package org.npsim.base.util.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The edges of one vertex within one {@link EdgeSlice}, split by side and role.
 *
 * "Left" lists hold neighbours at the lower cell of the slice (so the vertex itself is at the upper cell), "right"
 * lists hold neighbours at the upper cell.
 */
public final class EdgeListOf
{
  /**
   * Shared empty list-set for vertices without edges in a slice.  Immutable.
   */
  static final EdgeListOf EMPTY = new EdgeListOf(null, true);

  private final Vertex       mVertex;
  private final List<Vertex> mLeftIncoming;
  private final List<Vertex> mLeftOutgoing;
  private final List<Vertex> mRightIncoming;
  private final List<Vertex> mRightOutgoing;

  EdgeListOf(Vertex xiVertex)
  {
    this(xiVertex, false);
  }

  private EdgeListOf(Vertex xiVertex, boolean xiEmpty)
  {
    mVertex = xiVertex;
    if (xiEmpty)
    {
      mLeftIncoming = Collections.emptyList();
      mLeftOutgoing = Collections.emptyList();
      mRightIncoming = Collections.emptyList();
      mRightOutgoing = Collections.emptyList();
    }
    else
    {
      mLeftIncoming = new ArrayList<>(2);
      mLeftOutgoing = new ArrayList<>(2);
      mRightIncoming = new ArrayList<>(2);
      mRightOutgoing = new ArrayList<>(2);
    }
  }

  /**
   * @return the vertex these lists belong to.
   */
  public Vertex getVertex()
  {
    return mVertex;
  }

  /**
   * @return the vertices at the lower cell with an edge into this vertex.
   */
  public List<Vertex> getLeftIncoming()
  {
    return mLeftIncoming;
  }

  /**
   * @return the vertices at the lower cell this vertex has an edge to.
   */
  public List<Vertex> getLeftOutgoing()
  {
    return mLeftOutgoing;
  }

  /**
   * @return the vertices at the upper cell with an edge into this vertex.
   */
  public List<Vertex> getRightIncoming()
  {
    return mRightIncoming;
  }

  /**
   * @return the vertices at the upper cell this vertex has an edge to.
   */
  public List<Vertex> getRightOutgoing()
  {
    return mRightOutgoing;
  }

  @Override
  public String toString()
  {
    return "EdgeListOf " + mVertex + " left in/out " + mLeftIncoming.size() + "/" + mLeftOutgoing.size() +
           ", right in/out " + mRightIncoming.size() + "/" + mRightOutgoing.size();
  }
}
