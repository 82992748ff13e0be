package org.npsim.base.util.graph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A set of edges bucketed by edge index.
 */
public class IndexedEdgeSet
{
  private final CellArray<Set<Edge>> mBuckets = new CellArray<>(new CellArray.CellFactory<Set<Edge>>()
  {
    @Override
    public Set<Edge> create(int xiIndex)
    {
      return new LinkedHashSet<>();
    }
  });

  private int mSize;

  public IndexedEdgeSet()
  {
  }

  /**
   * Create a set holding the given edges.
   *
   * @param xiEdges - the initial edges.
   */
  public IndexedEdgeSet(Iterable<Edge> xiEdges)
  {
    for (Edge lEdge : xiEdges)
    {
      add(lEdge);
    }
  }

  /**
   * @return whether the edge was added (i.e. wasn't present already).
   *
   * @param xiEdge - the edge.
   */
  public boolean add(Edge xiEdge)
  {
    boolean lAdded = mBuckets.get(xiEdge.getIndex()).add(xiEdge);
    if (lAdded)
    {
      mSize++;
    }
    return lAdded;
  }

  public boolean contains(Edge xiEdge)
  {
    Set<Edge> lBucket = mBuckets.peek(xiEdge.getIndex());
    return (lBucket != null) && lBucket.contains(xiEdge);
  }

  public int size()
  {
    return mSize;
  }
}
