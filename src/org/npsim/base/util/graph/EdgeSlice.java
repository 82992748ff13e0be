package org.npsim.base.util.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The edges between cell i and cell i+1, held as per-vertex {@link EdgeListOf}s for the vertices at either cell.
 */
public final class EdgeSlice
{
  private final int                      mIndex;
  private final Map<Vertex, EdgeListOf>  mLists = new LinkedHashMap<>();
  private int                            mEdgeCount;

  EdgeSlice(int xiIndex)
  {
    mIndex = xiIndex;
  }

  public int getIndex()
  {
    return mIndex;
  }

  /**
   * @return the edge lists of a vertex, creating them if necessary.
   *
   * @param xiVertex - a vertex at cell i or i+1.
   */
  EdgeListOf get(Vertex xiVertex)
  {
    assert (xiVertex.getIndex() == mIndex) || (xiVertex.getIndex() == mIndex + 1) :
      "Vertex " + xiVertex + " doesn't belong to slice " + mIndex;

    EdgeListOf lLists = mLists.get(xiVertex);
    if (lLists == null)
    {
      lLists = new EdgeListOf(xiVertex);
      mLists.put(xiVertex, lLists);
    }
    return lLists;
  }

  /**
   * @return the edge lists of a vertex.  Lists are empty (and immutable) for a vertex without any.
   *
   * @param xiVertex - the vertex.
   */
  public EdgeListOf peek(Vertex xiVertex)
  {
    EdgeListOf lLists = mLists.get(xiVertex);
    return (lLists == null) ? EdgeListOf.EMPTY : lLists;
  }

  /**
   * @return all the edge lists held in this slice, in creation order.
   */
  public Collection<EdgeListOf> getEdgeLists()
  {
    return Collections.unmodifiableCollection(mLists.values());
  }

  /**
   * @return every edge in this slice, each exactly once.
   */
  public List<Edge> getAllEdges()
  {
    List<Edge> lEdges = new ArrayList<>(mEdgeCount);
    for (EdgeListOf lLists : mLists.values())
    {
      Vertex lVertex = lLists.getVertex();
      if (lVertex.getIndex() == mIndex)
      {
        for (Vertex lOther : lLists.getRightIncoming())
        {
          lEdges.add(new Edge(lOther, lVertex));
        }
        for (Vertex lOther : lLists.getRightOutgoing())
        {
          lEdges.add(new Edge(lVertex, lOther));
        }
      }
    }
    return lEdges;
  }

  void incrementEdgeCount()
  {
    mEdgeCount++;
  }

  void decrementEdgeCount()
  {
    mEdgeCount--;
  }

  /**
   * @return the number of edges in this slice.
   */
  public int size()
  {
    return mEdgeCount;
  }

  @Override
  public String toString()
  {
    return "EdgeSlice " + mIndex + " (" + mEdgeCount + " edges)";
  }
}
