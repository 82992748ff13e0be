package org.npsim.base.util.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Adjacency between edges of different tiers.
 *
 * The ceiling of an edge is made of the edges which were in force at the same cells when the edge was taken: for
 * the source vertex, its incoming edges; where a vertex folds (or is the target of the edge itself) the search
 * drops through to the vertices of its predecessor configuration instead.
 */
public final class CeilingAdjacency
{
  private CeilingAdjacency()
  {
  }

  /**
   * @return the edges weakly ceiling-adjacent to an edge, looking down from its source (and also from its target if
   *         it's one of the final edges).
   *
   * @param xiGraph      - the graph.
   * @param xiEdge       - the edge.
   * @param xiFinalEdges - the final edges.
   */
  public static Set<Edge> getWeakCeilingAdjacentEdges(DynamicComputationGraph xiGraph,
                                                      Edge xiEdge,
                                                      Collection<Edge> xiFinalEdges)
  {
    Deque<Vertex> lQueue = new ArrayDeque<>();
    lQueue.add(xiEdge.getFrom());
    if (xiFinalEdges.contains(xiEdge))
    {
      lQueue.add(xiEdge.getTo());
    }
    return collectCeiling(xiGraph, lQueue, xiEdge.getTo());
  }

  /**
   * @return the edges weakly ceiling-adjacent to an edge, looking down from its target.  Empty if the target halts.
   *
   * @param xiGraph - the graph.
   * @param xiEdge  - the edge.
   */
  public static Set<Edge> getForwardWeakCeilingAdjacentEdges(DynamicComputationGraph xiGraph, Edge xiEdge)
  {
    if (xiEdge.getTo().isHalting())
    {
      return new LinkedHashSet<>();
    }

    Deque<Vertex> lQueue = new ArrayDeque<>();
    lQueue.add(xiEdge.getTo());
    return collectCeiling(xiGraph, lQueue, xiEdge.getTo());
  }

  private static Set<Edge> collectCeiling(DynamicComputationGraph xiGraph, Deque<Vertex> xiQueue, Vertex xiTarget)
  {
    Set<Edge> lCeiling = new LinkedHashSet<>();
    Set<Vertex> lVisited = new HashSet<>();
    while (!xiQueue.isEmpty())
    {
      Vertex lVertex = xiQueue.poll();
      if (!lVisited.add(lVertex))
      {
        continue;
      }

      if (xiGraph.isFoldingNode(lVertex) || lVertex.equals(xiTarget))
      {
        xiQueue.addAll(xiGraph.getPrecedents(lVertex));
      }
      else
      {
        lCeiling.addAll(xiGraph.getIncomingEdges(lVertex));
      }
    }
    return lCeiling;
  }

  /**
   * @return those of the candidate edges from which the given edge can be reached going backwards without crossing
   *         the cell the edge's target leaves through.
   *
   * @param xiGraph      - the graph.
   * @param xiFinalEdge  - the edge to search back from.
   * @param xiCandidates - the candidate edges.
   */
  public static Set<Edge> filterWithPathBackward(DynamicComputationGraph xiGraph,
                                                 Edge xiFinalEdge,
                                                 Collection<Edge> xiCandidates)
  {
    Set<Edge> lResult = new LinkedHashSet<>();
    if (xiCandidates.isEmpty())
    {
      return lResult;
    }

    Vertex lTarget = xiFinalEdge.getTo();
    int lStopIndex = Math.min(lTarget.getIndex(), lTarget.getNextIndex());

    Deque<Edge> lStack = new ArrayDeque<>();
    Set<Edge> lVisited = new HashSet<>();
    lStack.addLast(xiFinalEdge);
    while (!lStack.isEmpty())
    {
      Edge lEdge = lStack.pollLast();
      if (!lVisited.add(lEdge))
      {
        continue;
      }
      if (xiCandidates.contains(lEdge))
      {
        lResult.add(lEdge);
      }
      if (lEdge.getIndex() == lStopIndex)
      {
        continue;
      }
      lStack.addAll(xiGraph.getPrevEdges(lEdge));
    }
    return lResult;
  }

  /**
   * @return those of the candidate edges reachable going forwards from the given edge without returning to its
   *         slice.
   *
   * @param xiGraph      - the graph.
   * @param xiStartEdge  - the edge to search forward from.
   * @param xiCandidates - the candidate edges.
   */
  public static Set<Edge> filterWithPathForward(DynamicComputationGraph xiGraph,
                                                Edge xiStartEdge,
                                                Collection<Edge> xiCandidates)
  {
    Set<Edge> lResult = new LinkedHashSet<>();
    int lStartIndex = xiStartEdge.getIndex();

    Deque<Edge> lStack = new ArrayDeque<>();
    Set<Edge> lVisited = new HashSet<>();
    lStack.addLast(xiStartEdge);
    while (!lStack.isEmpty())
    {
      Edge lEdge = lStack.pollLast();
      if (!lVisited.add(lEdge))
      {
        continue;
      }
      if (xiCandidates.contains(lEdge))
      {
        lResult.add(lEdge);
      }
      if (!lEdge.equals(xiStartEdge) && (lEdge.getIndex() == lStartIndex))
      {
        continue;
      }
      lStack.addAll(xiGraph.getNextEdges(lEdge));
    }
    return lResult;
  }
}
