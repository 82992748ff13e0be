package org.npsim.base.util.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A computation graph over a {@link ConfigurationSpace}: a set of edges between vertices at adjacent cells.
 *
 * Edges are stored once, in the {@link EdgeSlice} of their lower cell index, and recorded in the edge lists of both
 * endpoints so that they can be queried from either end.  The slice array grows on demand in both directions.
 *
 * Besides plain edge operations, the graph answers the tier queries the simulation is built on.  The precedents of
 * a vertex are the registered vertices of its predecessor configuration (tier - 1, same cell); its succedents are
 * the registered vertices whose predecessor is its configuration (tier + 1, same cell).
 */
public class DynamicComputationGraph
{
  private final ConfigurationSpace   mSpace;
  private final VertexRegistry       mRegistry;
  private final CellArray<EdgeSlice> mSlices;
  private int                        mSize;

  /**
   * Create an empty graph with its own vertex registry.
   *
   * @param xiSpace - the configurations of the run.
   */
  public DynamicComputationGraph(ConfigurationSpace xiSpace)
  {
    this(xiSpace, new VertexRegistry());
  }

  private DynamicComputationGraph(ConfigurationSpace xiSpace, VertexRegistry xiRegistry)
  {
    mSpace = xiSpace;
    mRegistry = xiRegistry;
    mSlices = new CellArray<>(new CellArray.CellFactory<EdgeSlice>()
    {
      @Override
      public EdgeSlice create(int xiIndex)
      {
        return new EdgeSlice(xiIndex);
      }
    });
    mSize = 0;
  }

  /**
   * @return a copy of this graph.  The copy has its own edges but shares this graph's vertex registry.
   */
  public DynamicComputationGraph copy()
  {
    DynamicComputationGraph lCopy = new DynamicComputationGraph(mSpace, mRegistry);
    if (mSize == 0)
    {
      return lCopy;
    }

    for (EdgeSlice lSlice : mSlices)
    {
      if (lSlice.size() == 0)
      {
        continue;
      }
      for (EdgeListOf lLists : lSlice.getEdgeLists())
      {
        Vertex lVertex = lLists.getVertex();
        for (Vertex lOther : lLists.getRightIncoming())
        {
          lCopy.addEdge(new Edge(lOther, lVertex));
        }
        for (Vertex lOther : lLists.getRightOutgoing())
        {
          lCopy.addEdge(new Edge(lVertex, lOther));
        }
      }
    }
    return lCopy;
  }

  /**
   * @return a new, empty graph over the same configuration space (with a registry of its own).
   */
  public DynamicComputationGraph createEmpty()
  {
    return new DynamicComputationGraph(mSpace);
  }

  public ConfigurationSpace getSpace()
  {
    return mSpace;
  }

  public VertexRegistry getRegistry()
  {
    return mRegistry;
  }

  /**
   * @return the number of edges.
   */
  public int size()
  {
    return mSize;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Edge storage
  //---------------------------------------------------------------------------------------------------------------

  private EdgeListOf listsOf(int xiSliceIndex, Vertex xiVertex)
  {
    EdgeSlice lSlice = mSlices.peek(xiSliceIndex);
    return (lSlice == null) ? EdgeListOf.EMPTY : lSlice.peek(xiVertex);
  }

  /**
   * @return the slice holding edges between cell xiIndex and xiIndex + 1, or null if nothing was ever stored there.
   *
   * @param xiIndex - the lower cell index.
   */
  public EdgeSlice getSlice(int xiIndex)
  {
    return mSlices.peek(xiIndex);
  }

  /**
   * Add an edge, registering both endpoints.  Does nothing if the edge is already present.
   *
   * @return whether the edge was added.
   *
   * @param xiEdge - the edge.
   */
  public boolean addEdge(Edge xiEdge)
  {
    if (hasEdge(xiEdge))
    {
      return false;
    }

    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    mRegistry.register(lFrom);
    mRegistry.register(lTo);

    EdgeSlice lSlice = mSlices.get(xiEdge.getIndex());
    if (lFrom.getIndex() < lTo.getIndex())
    {
      lSlice.get(lFrom).getRightOutgoing().add(lTo);
      lSlice.get(lTo).getLeftIncoming().add(lFrom);
    }
    else
    {
      lSlice.get(lFrom).getLeftOutgoing().add(lTo);
      lSlice.get(lTo).getRightIncoming().add(lFrom);
    }
    lSlice.incrementEdgeCount();
    mSize++;
    return true;
  }

  /**
   * Remove an edge.  Does nothing if the edge isn't present.  The endpoints stay registered.
   *
   * @return whether the edge was removed.
   *
   * @param xiEdge - the edge.
   */
  public boolean removeEdge(Edge xiEdge)
  {
    if (!hasEdge(xiEdge))
    {
      return false;
    }

    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    EdgeSlice lSlice = mSlices.get(xiEdge.getIndex());
    if (lFrom.getIndex() < lTo.getIndex())
    {
      lSlice.get(lFrom).getRightOutgoing().remove(lTo);
      lSlice.get(lTo).getLeftIncoming().remove(lFrom);
    }
    else
    {
      lSlice.get(lFrom).getLeftOutgoing().remove(lTo);
      lSlice.get(lTo).getRightIncoming().remove(lFrom);
    }
    lSlice.decrementEdgeCount();
    mSize--;
    return true;
  }

  public boolean hasEdge(Edge xiEdge)
  {
    int lIndex = xiEdge.getIndex();
    if (listsOf(lIndex, xiEdge.getFrom()).getRightOutgoing().contains(xiEdge.getTo()))
    {
      return true;
    }
    return listsOf(lIndex, xiEdge.getTo()).getRightIncoming().contains(xiEdge.getFrom());
  }

  /**
   * @return the edges into a vertex, from the cell above first.
   *
   * @param xiVertex - the vertex.
   */
  public List<Edge> getIncomingEdges(Vertex xiVertex)
  {
    int lIndex = xiVertex.getIndex();
    List<Vertex> lFromAbove = listsOf(lIndex, xiVertex).getRightIncoming();
    List<Vertex> lFromBelow = listsOf(lIndex - 1, xiVertex).getLeftIncoming();

    List<Edge> lEdges = new ArrayList<>(lFromAbove.size() + lFromBelow.size());
    for (Vertex lOther : lFromAbove)
    {
      lEdges.add(new Edge(lOther, xiVertex));
    }
    for (Vertex lOther : lFromBelow)
    {
      lEdges.add(new Edge(lOther, xiVertex));
    }
    return lEdges;
  }

  /**
   * @return the edges out of a vertex, to the cell above first.
   *
   * @param xiVertex - the vertex.
   */
  public List<Edge> getOutgoingEdges(Vertex xiVertex)
  {
    int lIndex = xiVertex.getIndex();
    List<Vertex> lToAbove = listsOf(lIndex, xiVertex).getRightOutgoing();
    List<Vertex> lToBelow = listsOf(lIndex - 1, xiVertex).getLeftOutgoing();

    List<Edge> lEdges = new ArrayList<>(lToAbove.size() + lToBelow.size());
    for (Vertex lOther : lToAbove)
    {
      lEdges.add(new Edge(xiVertex, lOther));
    }
    for (Vertex lOther : lToBelow)
    {
      lEdges.add(new Edge(xiVertex, lOther));
    }
    return lEdges;
  }

  /**
   * @return the edges that can follow an edge - those out of its target.
   *
   * @param xiEdge - the edge.
   */
  public List<Edge> getNextEdges(Edge xiEdge)
  {
    return getOutgoingEdges(xiEdge.getTo());
  }

  /**
   * @return the edges that can precede an edge - those into its source.
   *
   * @param xiEdge - the edge.
   */
  public List<Edge> getPrevEdges(Edge xiEdge)
  {
    return getIncomingEdges(xiEdge.getFrom());
  }

  /**
   * @return every edge, ordered by edge index.
   */
  public List<Edge> getAllEdges()
  {
    List<Edge> lEdges = new ArrayList<>(mSize);
    for (EdgeSlice lSlice : mSlices)
    {
      lEdges.addAll(lSlice.getAllEdges());
    }
    return lEdges;
  }

  /**
   * @return the sum of the per-slice edge counts.  Always equal to {@link #size()}.
   */
  public int countSliceEdges()
  {
    int lCount = 0;
    for (EdgeSlice lSlice : mSlices)
    {
      lCount += lSlice.size();
    }
    return lCount;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Classification
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return whether a vertex has both an incoming and an outgoing edge on the same side.  This can only happen on
   *         one side at a time.
   *
   * @param xiVertex - the vertex.
   */
  public boolean isFoldingNode(Vertex xiVertex)
  {
    int lIndex = xiVertex.getIndex();
    EdgeListOf lBelow = listsOf(lIndex - 1, xiVertex);
    if (!lBelow.getLeftIncoming().isEmpty() && !lBelow.getLeftOutgoing().isEmpty())
    {
      return true;
    }
    EdgeListOf lAbove = listsOf(lIndex, xiVertex);
    return !lAbove.getRightIncoming().isEmpty() && !lAbove.getRightOutgoing().isEmpty();
  }

  /**
   * @return whether the target of an edge has more than one incoming edge from the edge's side.
   *
   * @param xiEdge - an edge of this graph.
   */
  public boolean isMergingEdge(Edge xiEdge)
  {
    assert hasEdge(xiEdge) : "No edge " + xiEdge + " for merging edge check";

    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    if (lFrom.getIndex() < lTo.getIndex())
    {
      return listsOf(lFrom.getIndex(), lTo).getLeftIncoming().size() > 1;
    }
    return listsOf(lTo.getIndex(), lTo).getRightIncoming().size() > 1;
  }

  /**
   * @return whether the source of an edge has more than one outgoing edge to the edge's side.
   *
   * @param xiEdge - an edge of this graph.
   */
  public boolean isSplittingEdge(Edge xiEdge)
  {
    assert hasEdge(xiEdge) : "No edge " + xiEdge + " for splitting edge check";

    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    if (lFrom.getIndex() < lTo.getIndex())
    {
      return listsOf(lFrom.getIndex(), lFrom).getRightOutgoing().size() > 1;
    }
    return listsOf(lTo.getIndex(), lFrom).getLeftOutgoing().size() > 1;
  }

  /**
   * @return whether another vertex of the target's configuration (different predecessor) is entered in this slice
   *         from a different configuration than the edge's source, or folds where the target doesn't (or vice
   *         versa).
   *
   * @param xiEdge - an edge of this graph.
   */
  public boolean isCombiningEdge(Edge xiEdge)
  {
    assert hasEdge(xiEdge) : "No edge " + xiEdge + " for combining edge check";

    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    int lIndex = xiEdge.getIndex();
    boolean lToFolds = isFoldingNode(lTo);

    for (Vertex lSibling : mSpace.getVerticesOf(lTo.getCase()))
    {
      if (lSibling.equals(lTo))
      {
        continue;
      }

      EdgeListOf lLists = listsOf(lIndex, lSibling);
      for (Vertex lOther : lLists.getLeftIncoming())
      {
        if (!lOther.getCase().equals(lFrom.getCase()))
        {
          return true;
        }
      }
      for (Vertex lOther : lLists.getRightIncoming())
      {
        if (!lOther.getCase().equals(lFrom.getCase()))
        {
          return true;
        }
      }

      if (isFoldingNode(lSibling) != lToFolds)
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return whether the target of an edge doesn't fold but one of its succedents does.
   *
   * @param xiEdge - the edge.
   */
  public boolean isPseudoCombiningEdge(Edge xiEdge)
  {
    Vertex lTo = xiEdge.getTo();
    if (isFoldingNode(lTo))
    {
      return false;
    }
    for (Vertex lSuccedent : getSuccedents(lTo))
    {
      if (isFoldingNode(lSuccedent))
      {
        return true;
      }
    }
    return false;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Tier relations
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return the vertices of the configuration which justified a vertex.  For a vertex on tier 1 that's always the
   *         single floor vertex below it; above that, only vertices registered with this graph count.  Empty for a
   *         floor vertex.
   *
   * @param xiVertex - the vertex.
   */
  public Set<Vertex> getPrecedents(Vertex xiVertex)
  {
    if (xiVertex.isFloor())
    {
      return Collections.emptySet();
    }

    TransitionCase lPredecessor = xiVertex.getPredecessor();
    if (lPredecessor.isFloor())
    {
      return Collections.singleton(mSpace.getVertex(lPredecessor, null));
    }
    return mRegistry.getVerticesOf(lPredecessor);
  }

  /**
   * @return the registered vertices justified by a vertex's configuration.
   *
   * @param xiVertex - the vertex.
   */
  public Set<Vertex> getSuccedents(Vertex xiVertex)
  {
    return mRegistry.getVerticesAbove(xiVertex.getCase());
  }

  /**
   * @return the number of edges in the edge's slice leaving a precedent of the edge's target.
   *
   * @param xiEdge - the edge.
   */
  public int countIPrecedents(Edge xiEdge)
  {
    int lIndex = xiEdge.getIndex();
    int lCount = 0;
    for (Vertex lPrecedent : getPrecedents(xiEdge.getTo()))
    {
      EdgeListOf lLists = listsOf(lIndex, lPrecedent);
      lCount += lLists.getRightOutgoing().size() + lLists.getLeftOutgoing().size();
    }
    return lCount;
  }

  /**
   * @return the number of edges in the edge's slice entering a succedent of the edge's source.
   *
   * @param xiEdge - the edge.
   */
  public int countISuccedents(Edge xiEdge)
  {
    int lIndex = xiEdge.getIndex();
    int lCount = 0;
    for (Vertex lSuccedent : getSuccedents(xiEdge.getFrom()))
    {
      EdgeListOf lLists = listsOf(lIndex, lSuccedent);
      lCount += lLists.getLeftIncoming().size() + lLists.getRightIncoming().size();
    }
    return lCount;
  }

  /**
   * @return the edges one tier below which support an edge: edges out of a precedent of its target that end at a
   *         precedent of its source, at its source itself, or more than one tier below its source.
   *
   * @param xiEdge - the edge.
   */
  public Set<Edge> getIPrecedents(Edge xiEdge)
  {
    Set<Edge> lResult = new LinkedHashSet<>();
    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();
    if (lTo.isFloor())
    {
      return lResult;
    }

    Set<Vertex> lFromPrecedents = getPrecedents(lFrom);
    for (Vertex lPrecedent : getPrecedents(lTo))
    {
      for (Edge lEdge : getOutgoingEdges(lPrecedent))
      {
        Vertex lEnd = lEdge.getTo();
        if (lFromPrecedents.contains(lEnd) || lEnd.equals(lFrom) || (lEnd.getTier() < lFrom.getTier() - 1))
        {
          lResult.add(lEdge);
        }
      }
    }
    return lResult;
  }

  /**
   * @return the edges one tier above which an edge supports: edges into a succedent of its source that start at a
   *         succedent of its target, at its target itself, or more than one tier above its target.
   *
   * @param xiEdge - the edge.
   */
  public Set<Edge> getISuccedents(Edge xiEdge)
  {
    Set<Edge> lResult = new LinkedHashSet<>();
    Vertex lFrom = xiEdge.getFrom();
    Vertex lTo = xiEdge.getTo();

    Set<Vertex> lToSuccedents = getSuccedents(lTo);
    for (Vertex lSuccedent : getSuccedents(lFrom))
    {
      for (Edge lEdge : getIncomingEdges(lSuccedent))
      {
        Vertex lStart = lEdge.getFrom();
        if (lToSuccedents.contains(lStart) || lStart.equals(lTo) || (lStart.getTier() > lTo.getTier() + 1))
        {
          lResult.add(lEdge);
        }
      }
    }
    return lResult;
  }

  @Override
  public String toString()
  {
    return "DynamicComputationGraph(" + mSize + " edges)";
  }
}
