package org.npsim.base.util.graph.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.npsim.base.simulation.SimulationStatistics;
import org.npsim.base.util.graph.CellArray;
import org.npsim.base.util.graph.DynamicComputationGraph;
import org.npsim.base.util.graph.Edge;
import org.npsim.base.util.graph.TransitionCase;
import org.npsim.base.util.graph.Vertex;
import org.npsim.base.util.logging.SimulationLogging;

/**
 * Decides whether a computation graph contains a consistent computation walk from the initial vertex to a given
 * edge.
 *
 * The feasible graph can contain walks that only look feasible: each of their edges is supported by some edge of
 * the tier below, but not all by the same walk.  The verifier repeatedly takes an arbitrary consistent walk and
 * either finds the target edge on it, or prunes the walk away and recomputes the feasible graph.  Walks that end
 * somewhere else (obsolete walks) are kept in play by temporarily treating their last edges as final edges.
 */
public class WalkVerifier
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Result of {@link WalkVerifier#findFeasibleOrDisjointEdge}: the edge found, and the walk it was found on.
   */
  public static final class EdgeOnWalk
  {
    private final Edge       mEdge;
    private final List<Edge> mWalk;

    EdgeOnWalk(Edge xiEdge, List<Edge> xiWalk)
    {
      mEdge = xiEdge;
      mWalk = xiWalk;
    }

    /**
     * @return the edge, or null if neither a feasible nor a disjoint edge was found.
     */
    public Edge getEdge()
    {
      return mEdge;
    }

    /**
     * @return the walk, or null if no walk could be taken.
     */
    public List<Edge> getWalk()
    {
      return mWalk;
    }
  }

  private static final EdgeOnWalk NOT_FOUND = new EdgeOnWalk(null, null);

  private final FeasibleGraphAnalyser mAnalyser;
  private final SimulationStatistics  mStatistics;
  private final int                   mMaxIterations;
  private final int                   mMaxWalkLength;

  /**
   * Create a walk verifier with no limits.
   *
   * @param xiStatistics - statistics to update.
   */
  public WalkVerifier(SimulationStatistics xiStatistics)
  {
    this(new FeasibleGraphAnalyser(), xiStatistics, -1, -1);
  }

  /**
   * Create a walk verifier.
   *
   * @param xiAnalyser      - the feasible graph analyser to use.
   * @param xiStatistics    - statistics to update.
   * @param xiMaxIterations - limit on walk/prune iterations of one verification, or negative for no limit.
   * @param xiMaxWalkLength - limit on the length of one walk, or negative for no limit.
   */
  public WalkVerifier(FeasibleGraphAnalyser xiAnalyser,
                      SimulationStatistics xiStatistics,
                      int xiMaxIterations,
                      int xiMaxWalkLength)
  {
    mAnalyser = xiAnalyser;
    mStatistics = xiStatistics;
    mMaxIterations = xiMaxIterations;
    mMaxWalkLength = xiMaxWalkLength;
  }

  /**
   * Add to a graph the first edges, beyond what it already has, of walks which the unpruned graph still offers.
   * Only edges supported from the tier below qualify.
   *
   * @return the edges added.
   *
   * @param xiUnpruned - the graph before pruning.
   * @param xioGraph   - the pruned graph.  Updated.
   * @param xiInitial  - the initial vertices.
   */
  public Set<Edge> addFinalEdgesOfObsoleteWalks(DynamicComputationGraph xiUnpruned,
                                                DynamicComputationGraph xioGraph,
                                                Collection<Vertex> xiInitial)
  {
    Set<Edge> lAdded = new LinkedHashSet<>();
    Set<Edge> lVisited = new HashSet<>();
    Deque<Edge> lStack = new ArrayDeque<>();
    for (Vertex lInitial : xiInitial)
    {
      lStack.addAll(xiUnpruned.getOutgoingEdges(lInitial));
    }

    while (!lStack.isEmpty())
    {
      Edge lEdge = lStack.pollLast();
      if (!lVisited.add(lEdge))
      {
        continue;
      }

      if (xioGraph.hasEdge(lEdge))
      {
        lStack.addAll(xiUnpruned.getNextEdges(lEdge));
      }
      else if ((lEdge.getTo().getTier() > 0) && (xioGraph.countIPrecedents(lEdge) > 0))
      {
        xioGraph.addEdge(lEdge);
        lAdded.add(lEdge);
      }
    }
    return lAdded;
  }

  /**
   * @return the first merging edge of a walk, ignoring its last edge, or its last edge if there isn't one.
   *
   * @param xiGraph - the graph the walk belongs to.
   * @param xiWalk  - the walk.  Not empty.
   */
  public static Edge findFirstMergingEdgeOrFinalEdge(DynamicComputationGraph xiGraph, List<Edge> xiWalk)
  {
    for (int lii = 0; lii < xiWalk.size() - 1; lii++)
    {
      Edge lEdge = xiWalk.get(lii);
      if (xiGraph.isMergingEdge(lEdge))
      {
        LOGGER.log(SimulationLogging.VERBOSE, "First merging edge: " + lEdge);
        return lEdge;
      }
    }
    return xiWalk.get(xiWalk.size() - 1);
  }

  /**
   * Prune a walk from a graph: drop its first merging edge (or its final edge) and recompute the feasible graph.
   *
   * @return the pruned feasible graph.  May be empty.
   *
   * @param xiUnpruned         - the graph before any pruning.
   * @param xiGraph            - the graph to prune.  Left as it was.
   * @param xiInitial          - the initial vertices.
   * @param xiFinalEdges       - the final edges.
   * @param xiWalk             - the walk to prune.
   * @param xiPreserveObsolete - whether to keep obsolete walks in play while pruning.
   */
  public DynamicComputationGraph pruneWalk(DynamicComputationGraph xiUnpruned,
                                           DynamicComputationGraph xiGraph,
                                           Collection<Vertex> xiInitial,
                                           Collection<Edge> xiFinalEdges,
                                           List<Edge> xiWalk,
                                           boolean xiPreserveObsolete)
  {
    Edge lPruneEdge = findFirstMergingEdgeOrFinalEdge(xiGraph, xiWalk);
    Set<Edge> lObsolete = Collections.emptySet();
    if (xiPreserveObsolete)
    {
      lObsolete = addFinalEdgesOfObsoleteWalks(xiUnpruned, xiGraph, xiInitial);
      LOGGER.debug("Obsolete edges extended |Eo|=" + lObsolete.size());
    }
    mStatistics.prunedWalk();

    Set<Edge> lFinalEdges = new LinkedHashSet<>(lObsolete);
    lFinalEdges.addAll(xiFinalEdges);

    xiGraph.removeEdge(lPruneEdge);
    DynamicComputationGraph lPruned = mAnalyser.computeFeasibleGraph(xiGraph, xiInitial, lFinalEdges);
    xiGraph.addEdge(lPruneEdge);

    if (lPruned.size() > 0)
    {
      boolean lFinalPresent = false;
      for (Edge lFinal : xiFinalEdges)
      {
        if (xiGraph.hasEdge(lFinal))
        {
          lFinalPresent = true;
          break;
        }
      }
      if (lFinalPresent)
      {
        for (Edge lEdge : lObsolete)
        {
          lPruned.removeEdge(lEdge);
        }
      }
    }

    LOGGER.debug("Walk pruned by edge " + lPruneEdge + ", preserving obsolete walks: " + xiPreserveObsolete +
                 ", |E(G)| -> |E(G')| = " + xiGraph.size() + " -> " + lPruned.size());
    return lPruned;
  }

  /**
   * Take a walk from the first initial vertex, always following the first next edge that's consistent with the
   * configurations the walk has left behind it.
   *
   * @return the walk.  Empty if the initial vertex has no outgoing edge.
   *
   * @param xiGraph   - the graph.
   * @param xiInitial - the initial vertices.  Not empty.
   */
  public List<Edge> takeArbitraryWalk(DynamicComputationGraph xiGraph, Collection<Vertex> xiInitial)
  {
    List<Edge> lWalk = new ArrayList<>();
    Vertex lStart = xiInitial.iterator().next();
    List<Edge> lStartEdges = xiGraph.getOutgoingEdges(lStart);
    if (lStartEdges.isEmpty())
    {
      LOGGER.warn("The initial edge is missing. Empty walk returned!");
      return lWalk;
    }

    CellArray<TransitionCase> lSurface = new CellArray<>();
    Edge lEdge = lStartEdges.get(0);
    while (lEdge != null)
    {
      if ((mMaxWalkLength >= 0) && (lWalk.size() >= mMaxWalkLength))
      {
        throw new IllegalStateException("Walk exceeded " + mMaxWalkLength + " edges");
      }

      Vertex lFrom = lEdge.getFrom();
      lSurface.set(lFrom.getIndex(), lFrom.getCase());
      lWalk.add(lEdge);

      Edge lNextEdge = null;
      for (Edge lCandidate : xiGraph.getNextEdges(lEdge))
      {
        Vertex lTo = lCandidate.getTo();
        if ((lTo.getTier() == 0) || lTo.getPredecessor().equals(lSurface.peek(lTo.getIndex())))
        {
          lNextEdge = lCandidate;
          break;
        }
      }
      lEdge = lNextEdge;
    }
    return lWalk;
  }

  /**
   * @return the first edge of a walk that isn't in a graph, or null if they all are.
   *
   * @param xiGraph - the graph.
   * @param xiWalk  - the walk.
   */
  public static Edge findDisjointEdge(DynamicComputationGraph xiGraph, List<Edge> xiWalk)
  {
    for (Edge lEdge : xiWalk)
    {
      if (!xiGraph.hasEdge(lEdge))
      {
        return lEdge;
      }
    }
    return null;
  }

  /**
   * Look for a walk through a final edge, pruning walks that don't reach it.  Once a walk has been found that can't
   * be pruned without losing the final edge, the next walk taken yields a disjoint edge instead: one not on that
   * walk, whose removal from the graph is safe.
   *
   * @return the final edge and the walk through it, a disjoint edge and the walk it's on, or a result with neither.
   *
   * @param xiUnpruned  - the graph before pruning.
   * @param xiGraph     - the feasible graph.  Not changed.
   * @param xiInitial   - the initial vertices.
   * @param xiFinalEdge - the final edge.
   */
  public EdgeOnWalk findFeasibleOrDisjointEdge(DynamicComputationGraph xiUnpruned,
                                               DynamicComputationGraph xiGraph,
                                               Collection<Vertex> xiInitial,
                                               Edge xiFinalEdge)
  {
    DynamicComputationGraph lGraph = xiGraph.copy();
    Set<Edge> lFinalEdges = Collections.singleton(xiFinalEdge);
    DynamicComputationGraph lRetained = xiGraph.createEmpty();
    LOGGER.debug("Start to find feasible/disjoint edge.  |E(G)|=" + lGraph.size());

    int lIterations = 0;
    while (lGraph.size() > 0)
    {
      lIterations = checkIterations(lIterations);
      List<Edge> lWalk = takeArbitraryWalk(lGraph, xiInitial);
      if (lWalk.isEmpty())
      {
        return NOT_FOUND;
      }

      if (lWalk.contains(xiFinalEdge))
      {
        return new EdgeOnWalk(xiFinalEdge, lWalk);
      }

      if (lRetained.size() > 0)
      {
        Edge lDisjoint = findDisjointEdge(lRetained, lWalk);
        LOGGER.log(SimulationLogging.VERBOSE, "Disjoint edge: " + lDisjoint);
        return new EdgeOnWalk(lDisjoint, lWalk);
      }

      DynamicComputationGraph lPruned = pruneWalk(xiUnpruned, lGraph, xiInitial, lFinalEdges, lWalk, false);
      if (lPruned.size() == 0)
      {
        for (Edge lEdge : lWalk)
        {
          lRetained.addEdge(lEdge);
        }
        lGraph = pruneWalk(xiUnpruned, lGraph, xiInitial, lFinalEdges, lWalk, true);
      }
      else
      {
        lGraph = lPruned;
      }
    }
    LOGGER.log(SimulationLogging.VERBOSE, "Pruned to size 0");
    return NOT_FOUND;
  }

  /**
   * Verify that a graph contains a consistent computation walk from the initial vertices through a final edge.
   *
   * @return the walk, or null if there's none.
   *
   * @param xiGraph     - the computation graph, including the final edge.
   * @param xiInitial   - the initial vertices.
   * @param xiFinalEdge - the final edge.
   */
  public List<Edge> verifyExistenceOfWalk(DynamicComputationGraph xiGraph,
                                          Collection<Vertex> xiInitial,
                                          Edge xiFinalEdge)
  {
    LOGGER.log(SimulationLogging.VERBOSE, "Verifying walk to " + xiFinalEdge);
    Set<Edge> lFinalEdges = Collections.singleton(xiFinalEdge);
    DynamicComputationGraph lGraph = mAnalyser.computeFeasibleGraph(xiGraph, xiInitial, lFinalEdges);
    LOGGER.debug("Start to verify walk.  |E(G0)| -> |E(G)| = " + xiGraph.size() + " -> " + lGraph.size());

    int lIterations = 0;
    while (lGraph.size() > 0)
    {
      lIterations = checkIterations(lIterations);
      EdgeOnWalk lFound = findFeasibleOrDisjointEdge(xiGraph, lGraph, xiInitial, xiFinalEdge);
      Edge lEdge = lFound.getEdge();
      if (xiFinalEdge.equals(lEdge))
      {
        LOGGER.log(SimulationLogging.VERBOSE, "Walk verified ending at " + lEdge);
        return lFound.getWalk();
      }
      if (lEdge == null)
      {
        LOGGER.log(SimulationLogging.VERBOSE, "Walk not verified");
        return null;
      }

      mStatistics.removedDisjointEdge();
      lGraph.removeEdge(lEdge);
      lGraph = mAnalyser.computeFeasibleGraph(lGraph, xiInitial, lFinalEdges);
      LOGGER.debug("Removed disjoint edge " + lEdge + ".  |E(G0)| -> |E(G)| = " + xiGraph.size() + " -> " +
                   lGraph.size());
    }
    LOGGER.log(SimulationLogging.VERBOSE, "No walk - empty feasible graph");
    return null;
  }

  private int checkIterations(int xiIterations)
  {
    int lIterations = xiIterations + 1;
    if ((mMaxIterations >= 0) && (lIterations > mMaxIterations))
    {
      throw new IllegalStateException("Walk verification exceeded " + mMaxIterations + " iterations");
    }
    return lIterations;
  }
}
