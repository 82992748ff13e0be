package org.npsim.base.util.graph.analysis;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.npsim.base.util.graph.CeilingAdjacency;
import org.npsim.base.util.graph.DynamicComputationGraph;
import org.npsim.base.util.graph.Edge;
import org.npsim.base.util.graph.IndexedEdgeSet;
import org.npsim.base.util.graph.Vertex;
import org.npsim.base.util.logging.SimulationLogging;

/**
 * Computes feasible graphs: the part of a computation graph that can still take part in a walk from the initial
 * vertices to one of a set of final edges.
 *
 * An edge survives only if it's reachable from the initial vertices, can reach a final edge, and is supported by an
 * edge of the tier below (and, unless it's a cover edge, supports an edge of the tier above).  Removing one edge can
 * strand its neighbours, so removal is propagated through a worklist until nothing changes.
 */
public class FeasibleGraphAnalyser
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final int mMaxIterations;

  /**
   * Create an analyser with no iteration limit.
   */
  public FeasibleGraphAnalyser()
  {
    this(-1);
  }

  /**
   * Create an analyser.
   *
   * @param xiMaxIterations - limit on the worklist iterations of one computation, or a negative value for no limit.
   */
  public FeasibleGraphAnalyser(int xiMaxIterations)
  {
    mMaxIterations = xiMaxIterations;
  }

  /**
   * @return those of the cover edges from which a final edge can be reached.
   *
   * @param xiGraph      - the graph.
   * @param xiCover      - the cover edges.
   * @param xiFinalEdges - the final edges.
   */
  public static IndexedEdgeSet collectEdgesWithPath(DynamicComputationGraph xiGraph,
                                                    IndexedEdgeSet xiCover,
                                                    Collection<Edge> xiFinalEdges)
  {
    IndexedEdgeSet lResult = new IndexedEdgeSet();
    Set<Edge> lVisited = new HashSet<>();
    Deque<Edge> lStack = new ArrayDeque<>(xiFinalEdges);
    while (!lStack.isEmpty())
    {
      Edge lEdge = lStack.pollLast();
      if (!lVisited.add(lEdge))
      {
        continue;
      }
      if (xiCover.contains(lEdge))
      {
        lResult.add(lEdge);
      }
      lStack.addAll(xiGraph.getIncomingEdges(lEdge.getFrom()));
    }
    return lResult;
  }

  /**
   * @return the cover edges of a set of final edges: the final edges plus everything transitively weakly
   *         ceiling-adjacent to them, restricted to edges with a path to a final edge.
   *
   * @param xiGraph      - the graph.
   * @param xiFinalEdges - the final edges.
   */
  public static IndexedEdgeSet computeCoverEdges(DynamicComputationGraph xiGraph, Collection<Edge> xiFinalEdges)
  {
    IndexedEdgeSet lCover = new IndexedEdgeSet(xiFinalEdges);
    Deque<Edge> lQueue = new ArrayDeque<>(xiFinalEdges);
    while (!lQueue.isEmpty())
    {
      Edge lEdge = lQueue.poll();
      for (Edge lCeiling : CeilingAdjacency.getWeakCeilingAdjacentEdges(xiGraph, lEdge, xiFinalEdges))
      {
        if (lCover.add(lCeiling))
        {
          lQueue.add(lCeiling);
        }
      }
    }
    return collectEdgesWithPath(xiGraph, lCover, xiFinalEdges);
  }

  /**
   * Copy the part of a graph reachable from the initial vertices (following edges in both directions, but not
   * beyond a final edge or back past an initial vertex) and find the step-pendant edges in it - those that can't
   * be part of a feasible walk on their own account.
   *
   * @return the reachable graph.
   *
   * @param xiGraph      - the graph.
   * @param xiCover      - the cover edges.
   * @param xiInitial    - the initial vertices.
   * @param xiFinalEdges - the final edges.
   * @param xoRemovable  - set to which the step-pendant edges are added.
   */
  public DynamicComputationGraph computeStepPendantEdges(DynamicComputationGraph xiGraph,
                                                         IndexedEdgeSet xiCover,
                                                         Collection<Vertex> xiInitial,
                                                         Collection<Edge> xiFinalEdges,
                                                         Set<Edge> xoRemovable)
  {
    DynamicComputationGraph lReachable = xiGraph.createEmpty();

    Deque<Edge> lStack = new ArrayDeque<>();
    for (Vertex lInitial : xiInitial)
    {
      lStack.addAll(xiGraph.getOutgoingEdges(lInitial));
    }

    int lIterations = 0;
    while (!lStack.isEmpty())
    {
      lIterations = checkIterations(lIterations);
      Edge lEdge = lStack.pollLast();
      if (!lReachable.addEdge(lEdge))
      {
        continue;
      }

      if (!xiCover.contains(lEdge) && (xiGraph.countISuccedents(lEdge) == 0))
      {
        xoRemovable.add(lEdge);
      }
      if ((lEdge.getTo().getTier() > 0) && (xiGraph.countIPrecedents(lEdge) == 0))
      {
        xoRemovable.add(lEdge);
      }

      if (!xiFinalEdges.contains(lEdge))
      {
        Collection<Edge> lNext = xiGraph.getNextEdges(lEdge);
        if (lNext.isEmpty())
        {
          xoRemovable.add(lEdge);
        }
        else
        {
          lStack.addAll(lNext);
        }
      }

      if (!xiInitial.contains(lEdge.getFrom()))
      {
        Collection<Edge> lPrev = xiGraph.getPrevEdges(lEdge);
        if (lPrev.isEmpty())
        {
          xoRemovable.add(lEdge);
        }
        else
        {
          lStack.addAll(lPrev);
        }
      }
    }
    return lReachable;
  }

  /**
   * @return the feasible graph of a graph with respect to initial vertices and final edges.  The result is a new
   *         graph (the input isn't changed) and is empty if no final edge survives.
   *
   * @param xiGraph      - the graph.
   * @param xiInitial    - the initial vertices.
   * @param xiFinalEdges - the final edges.
   */
  public DynamicComputationGraph computeFeasibleGraph(DynamicComputationGraph xiGraph,
                                                      Collection<Vertex> xiInitial,
                                                      Collection<Edge> xiFinalEdges)
  {
    return computeFeasibleGraph(xiGraph, xiInitial, xiFinalEdges, Collections.<Edge>emptySet());
  }

  /**
   * @return the feasible graph of a graph with respect to initial vertices and final edges, additionally removing
   *         the given edges.
   *
   * @param xiGraph      - the graph.
   * @param xiInitial    - the initial vertices.
   * @param xiFinalEdges - the final edges.
   * @param xiRemovable  - extra edges to remove.
   */
  public DynamicComputationGraph computeFeasibleGraph(DynamicComputationGraph xiGraph,
                                                      Collection<Vertex> xiInitial,
                                                      Collection<Edge> xiFinalEdges,
                                                      Collection<Edge> xiRemovable)
  {
    LOGGER.log(SimulationLogging.VERBOSE,
               "Start to compute feasible graph |E(G)|=" + xiGraph.size() + " with respect to " + xiFinalEdges);

    Set<Edge> lFinalEdges = new LinkedHashSet<>(xiFinalEdges);
    Set<Vertex> lInitial = new LinkedHashSet<>(xiInitial);
    IndexedEdgeSet lCover = computeCoverEdges(xiGraph, lFinalEdges);

    Set<Edge> lRemovable = new LinkedHashSet<>();
    DynamicComputationGraph lFeasible = computeStepPendantEdges(xiGraph, lCover, lInitial, lFinalEdges, lRemovable);
    lRemovable.addAll(xiRemovable);
    LOGGER.log(SimulationLogging.VERBOSE, "After computing step-pendant edges |E(H)|=" + lFeasible.size());

    Set<Edge> lRemainingFinal = new HashSet<>(lFinalEdges);
    Deque<Edge> lStack = new ArrayDeque<>(lRemovable);
    int lIterations = 0;
    while (!lStack.isEmpty())
    {
      lIterations = checkIterations(lIterations);
      Edge lEdge = lStack.pollLast();
      if (!lFeasible.hasEdge(lEdge))
      {
        continue;
      }

      if (!lFeasible.isMergingEdge(lEdge))
      {
        lStack.addAll(lFeasible.getNextEdges(lEdge));
      }

      for (Edge lSuccedent : lFeasible.getISuccedents(lEdge))
      {
        if (lFeasible.countIPrecedents(lSuccedent) == 1)
        {
          lStack.addLast(lSuccedent);
        }
      }

      for (Edge lPrecedent : lFeasible.getIPrecedents(lEdge))
      {
        if (lCover.contains(lPrecedent))
        {
          continue;
        }
        if (lFeasible.countISuccedents(lPrecedent) == 1)
        {
          lStack.addLast(lPrecedent);
        }
      }

      if (!lFeasible.isSplittingEdge(lEdge))
      {
        // Final edges are never removed on account of their neighbours.
        for (Edge lPrev : lFeasible.getPrevEdges(lEdge))
        {
          if (!lFinalEdges.contains(lPrev))
          {
            lStack.addLast(lPrev);
          }
        }
      }

      int lSizeBefore = lFeasible.size();
      lFeasible.removeEdge(lEdge);
      assert lFeasible.size() < lSizeBefore : "Feasible graph didn't shrink removing " + lEdge;

      if (lRemainingFinal.remove(lEdge) && lRemainingFinal.isEmpty())
      {
        LOGGER.log(SimulationLogging.VERBOSE, "Every final edge removed - no feasible graph");
        return xiGraph.createEmpty();
      }
    }
    return lFeasible;
  }

  private int checkIterations(int xiIterations)
  {
    int lIterations = xiIterations + 1;
    if ((mMaxIterations >= 0) && (lIterations > mMaxIterations))
    {
      throw new IllegalStateException("Feasible graph computation exceeded " + mMaxIterations + " iterations");
    }
    return lIterations;
  }
}
