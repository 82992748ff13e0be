package org.npsim.base.simulation;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.npsim.base.simulation.SimulationConfiguration.CfgItem;
import org.npsim.base.util.graph.CeilingAdjacency;
import org.npsim.base.util.graph.CellArray;
import org.npsim.base.util.graph.ConfigurationSpace;
import org.npsim.base.util.graph.DynamicComputationGraph;
import org.npsim.base.util.graph.Edge;
import org.npsim.base.util.graph.Vertex;
import org.npsim.base.util.graph.analysis.FeasibleGraphAnalyser;
import org.npsim.base.util.graph.analysis.WalkVerifier;
import org.npsim.base.util.logging.SimulationLogging;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.VerifierMachine;

/**
 * Simulates a verifier on an input for every certificate of a given length at once.
 *
 * The simulation grows a single computation graph from the initial vertex.  Edges into certificate cells branch
 * over the certificate alphabet; every candidate edge is only added once the walk verifier has shown that a
 * consistent computation reaches it, and from there computations are followed directly until they halt or merge
 * into the graph.  The input is accepted for some certificate exactly when an accepting edge gets added.
 */
public class CertificateSimulator
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * An extended edge together with the ceiling edge it was taken above (null for the floor).
   */
  private static final class ExtendedEdge
  {
    final Edge mCeiling;
    final Edge mEdge;

    ExtendedEdge(Edge xiCeiling, Edge xiEdge)
    {
      mCeiling = xiCeiling;
      mEdge = xiEdge;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (!(xiOther instanceof ExtendedEdge))
      {
        return false;
      }
      ExtendedEdge lOther = (ExtendedEdge)xiOther;
      return mEdge.equals(lOther.mEdge) &&
             ((mCeiling == null) ? (lOther.mCeiling == null) : mCeiling.equals(lOther.mCeiling));
    }

    @Override
    public int hashCode()
    {
      return 31 * mEdge.hashCode() + ((mCeiling == null) ? 0 : mCeiling.hashCode());
    }
  }

  /**
   * A computation walk waiting to be followed: its next edge, its surface and the symbols it has read.
   */
  private static final class PendingWalk
  {
    final Edge              mEdge;
    final CellArray<Edge>   mSurface;
    final CellArray<String> mRead;

    PendingWalk(Edge xiEdge, CellArray<Edge> xiSurface, CellArray<String> xiRead)
    {
      mEdge = xiEdge;
      mSurface = xiSurface;
      mRead = xiRead;
    }
  }

  private final VerifierComputationGraph mGraph;
  private final DynamicComputationGraph  mComputation;
  private final Set<Vertex>              mInitial;
  private final SimulationStatistics     mStatistics = new SimulationStatistics();
  private final WalkVerifier             mVerifier;
  private final int                      mMaxWalkLength;
  private final int                      mTapeLogLength;
  private boolean                        mHasRun;

  /**
   * Create a simulator for one run.
   *
   * @param xiSpecification     - the verifier.
   * @param xiTape              - the input.  Not empty.
   * @param xiCertificateLength - the certificate length.
   */
  public CertificateSimulator(MachineSpecification xiSpecification, String xiTape, int xiCertificateLength)
  {
    ConfigurationSpace lSpace = new ConfigurationSpace(xiSpecification);
    mGraph = new VerifierComputationGraph(lSpace, MachineSpecification.splitSymbols(xiTape), xiCertificateLength);
    mComputation = new DynamicComputationGraph(lSpace);
    mInitial = Collections.singleton(mGraph.getInitialVertex());

    mMaxWalkLength = SimulationConfiguration.getCfgInt(CfgItem.MAX_WALK_LENGTH);
    mTapeLogLength = SimulationConfiguration.getCfgInt(CfgItem.TAPE_LOG_LENGTH);
    mVerifier = new WalkVerifier(
                   new FeasibleGraphAnalyser(SimulationConfiguration.getCfgInt(CfgItem.MAX_FEASIBLE_ITERATIONS)),
                   mStatistics,
                   SimulationConfiguration.getCfgInt(CfgItem.MAX_VERIFIER_ITERATIONS),
                   mMaxWalkLength);
  }

  /**
   * Simulate a verifier for all certificates.
   *
   * @return the result.
   *
   * @param xiSpecification     - the verifier.
   * @param xiTape              - the input, including any given certificate.  Not empty.
   * @param xiCertificateLength - the number of certificate cells following the input.
   */
  public static SimulationResult simulate(MachineSpecification xiSpecification,
                                          String xiTape,
                                          int xiCertificateLength)
  {
    return new CertificateSimulator(xiSpecification, xiTape, xiCertificateLength).run();
  }

  /**
   * Simulate a verifier for all certificates.
   *
   * @return the result.
   *
   * @param xiMachine           - the verifier.
   * @param xiTape              - the input, including any given certificate.  Not empty.
   * @param xiCertificateLength - the number of certificate cells following the input.
   */
  public static SimulationResult simulate(VerifierMachine xiMachine, String xiTape, int xiCertificateLength)
  {
    LOGGER.info("Simulating " + xiMachine);
    return simulate(xiMachine.getSpecification(), xiTape, xiCertificateLength);
  }

  /**
   * Run the simulation.  A simulator can only be run once.
   *
   * @return the result.
   */
  public SimulationResult run()
  {
    if (mHasRun)
    {
      throw new IllegalStateException("Simulator has already been run");
    }
    mHasRun = true;

    LOGGER.info("Tape string: " + StringUtils.join(mGraph.getInput(), ""));
    LOGGER.info("Tape input length: " + mGraph.getInput().size());
    LOGGER.info("Certificate length: " + mGraph.getCertificateLength());

    long lStartTime = System.currentTimeMillis();
    String lAcceptedTape = isAcceptedOnFootmarks();
    mStatistics.finish(mComputation.size(), System.currentTimeMillis() - lStartTime);

    SimulationResult.Answer lAnswer = (lAcceptedTape != null) ? SimulationResult.Answer.YES :
                                                                SimulationResult.Answer.NO;
    String lWitness = null;
    if ((lAcceptedTape != null) && (mGraph.getCertificateLength() > 0))
    {
      lWitness = StringUtils.substringAfter(lAcceptedTape, "#");
      LOGGER.info("Witness for accepted certificate: " + lWitness);
    }

    if (SimulationConfiguration.getCfgBool(CfgItem.LOG_STATISTICS))
    {
      mStatistics.log(LOGGER);
    }
    LOGGER.info("Result: " + lAnswer);
    return new SimulationResult(lAnswer, lAcceptedTape, lWitness, mStatistics);
  }

  /**
   * @return the computation graph built so far.
   */
  public DynamicComputationGraph getComputationGraph()
  {
    return mComputation;
  }

  public SimulationStatistics getStatistics()
  {
    return mStatistics;
  }

  private String isAcceptedOnFootmarks()
  {
    Set<Edge> lCandidates = new LinkedHashSet<>();
    for (Vertex lInitial : mInitial)
    {
      lCandidates.addAll(mGraph.getFloorNextEdges(lInitial));
    }

    while (!lCandidates.isEmpty())
    {
      Set<ExtendedEdge> lExtended = new LinkedHashSet<>();
      CellArray<String> lRead = extendByVerifiableEdges(lCandidates, lExtended);
      if (lRead != null)
      {
        return readTape(lRead);
      }
      if (lExtended.isEmpty())
      {
        return null;
      }

      lCandidates = collectRestrictedBoundaryEdges(lExtended);
      LOGGER.debug("Collected boundary edges: " + lCandidates.size());
    }
    return null;
  }

  private CellArray<String> extendByVerifiableEdges(Collection<Edge> xiCandidates, Set<ExtendedEdge> xoExtended)
  {
    Deque<Edge> lQueue = new ArrayDeque<>(xiCandidates);
    while (!lQueue.isEmpty())
    {
      Edge lCandidate = lQueue.poll();
      if (mComputation.hasEdge(lCandidate))
      {
        continue;
      }

      mComputation.addEdge(lCandidate);
      mStatistics.candidateVerified();
      List<Edge> lWalk = mVerifier.verifyExistenceOfWalk(mComputation, mInitial, lCandidate);
      mComputation.removeEdge(lCandidate);

      if (lWalk != null)
      {
        LOGGER.info("Extended: " + lCandidate + ", candidate edges remaining: " + lQueue.size());
        mStatistics.extendedByVerification();
        CellArray<String> lRead = extendEdgeDirectlyWithWalk(lWalk, xoExtended);
        if (lRead != null)
        {
          return lRead;
        }
      }
      else
      {
        LOGGER.debug("Not extended: " + lCandidate + " - candidate edges remaining: " + lQueue.size());
      }
    }
    return null;
  }

  /**
   * Follow a verified walk past the end of the computation graph, adding edges until each computation halts.
   *
   * @return the symbols read by an accepting computation, or null if none accepted.
   */
  private CellArray<String> extendEdgeDirectlyWithWalk(List<Edge> xiWalk, Set<ExtendedEdge> xoExtended)
  {
    CellArray<Edge> lSurface = new CellArray<>();
    CellArray<String> lRead = new CellArray<>();
    Edge lStart = null;
    for (Edge lEdge : xiWalk)
    {
      lStart = lEdge;
      Vertex lFrom = lEdge.getFrom();
      if (lFrom.getTier() == 0)
      {
        lRead.set(lFrom.getIndex(), lFrom.getSymbol());
      }
      if (!mComputation.hasEdge(lEdge))
      {
        if (!lEdge.equals(xiWalk.get(xiWalk.size() - 1)))
        {
          LOGGER.info("Extended edge " + lEdge + " is a merging edge.");
        }
        break;
      }
      lSurface.set(lEdge.getIndex(), lEdge);
    }

    Deque<PendingWalk> lPending = new ArrayDeque<>();
    lPending.addLast(new PendingWalk(lStart, lSurface, lRead));
    while (!lPending.isEmpty())
    {
      PendingWalk lWalk = lPending.pollLast();
      Edge lEdge = lWalk.mEdge;
      CellArray<Edge> lWalkSurface = lWalk.mSurface;
      CellArray<String> lWalkRead = lWalk.mRead;
      if (mComputation.hasEdge(lEdge))
      {
        continue;
      }
      LOGGER.debug("Restarted from: " + lEdge);

      int lWalkLength = 0;
      while (true)
      {
        boolean lIsNew = mComputation.addEdge(lEdge);
        Vertex lFrom = lEdge.getFrom();
        Vertex lTo = lEdge.getTo();
        lWalkSurface.set(lEdge.getIndex(), lEdge);
        if (lTo.getTier() == 0)
        {
          lWalkRead.set(lTo.getIndex(), lTo.getSymbol());
        }

        if (lIsNew && mComputation.isMergingEdge(lEdge))
        {
          addExtendableEdgesOnCeilingEdges(lWalkSurface, xoExtended);
        }

        lWalkLength++;
        if ((mMaxWalkLength >= 0) && (lWalkLength > mMaxWalkLength))
        {
          throw new IllegalStateException("Computation walk exceeded " + mMaxWalkLength + " edges");
        }
        if (lTo.isHalting())
        {
          mStatistics.haltingEdge();
          break;
        }

        Edge lCeiling = lWalkSurface.peek(Math.min(lTo.getIndex(), lTo.getNextIndex()));
        if (lIsNew && (lCeiling != null) && (lTo.getNextIndex() != lFrom.getIndex()) && isCombinable(lCeiling))
        {
          xoExtended.add(new ExtendedEdge(null, lEdge));
        }

        Iterator<Edge> lNext =
                      mGraph.getNextEdgesAbovePreds(lTo, Collections.singleton(lCeiling)).iterator();
        lEdge = lNext.next();
        while (lNext.hasNext())
        {
          Edge lSplit = lNext.next();
          if (!mComputation.hasEdge(lSplit))
          {
            LOGGER.debug("Splitted: " + lSplit);
            lPending.addLast(new PendingWalk(lSplit, lWalkSurface.copy(), lWalkRead.copy()));
          }
        }
      }

      mStatistics.extendedWalk(lWalkLength);
      String lState = lEdge.getTo().getState();
      if (MachineSpecification.ACCEPT_STATE.equals(lState))
      {
        LOGGER.info("Accepted edge: " + lEdge);
        return lWalkRead;
      }
      if (MachineSpecification.REJECT_STATE.equals(lState))
      {
        LOGGER.info("End of walk: " + lEdge + ", rejected: " +
                    SimulationLogging.abbreviateTape(readTape(lWalkRead), mTapeLogLength));
      }
    }
    return null;
  }

  private static String readTape(CellArray<String> xiRead)
  {
    StringBuilder lTape = new StringBuilder();
    for (String lSymbol : xiRead)
    {
      if (lSymbol != null)
      {
        lTape.append(lSymbol);
      }
    }
    return StringUtils.strip(lTape.toString(), MachineSpecification.BLANK);
  }

  private boolean isCombinable(Edge xiEdge)
  {
    return mComputation.isMergingEdge(xiEdge) ||
           mComputation.isPseudoCombiningEdge(xiEdge) ||
           mComputation.isCombiningEdge(xiEdge);
  }

  /**
   * Record, for each combinable edge of the surface, the edges above it which the computation can now continue
   * from.
   */
  private void addExtendableEdgesOnCeilingEdges(CellArray<Edge> xiSurface, Set<ExtendedEdge> xoExtended)
  {
    for (Edge lEdge : xiSurface)
    {
      if ((lEdge == null) || !isCombinable(lEdge))
      {
        continue;
      }

      Vertex lFrom = lEdge.getFrom();
      Set<Vertex> lQueue = new LinkedHashSet<>(mComputation.getSuccedents(lEdge.getTo()));
      while (!lQueue.isEmpty())
      {
        Iterator<Vertex> lIterator = lQueue.iterator();
        Vertex lVertex = lIterator.next();
        lIterator.remove();

        if (mComputation.isFoldingNode(lVertex))
        {
          lQueue.addAll(mComputation.getSuccedents(lVertex));
        }
        else if (lVertex.getNextIndex() == lFrom.getIndex())
        {
          for (Edge lContinuation : CeilingAdjacency.filterWithPathForward(mComputation,
                                                                           lEdge,
                                                                           mComputation.getIncomingEdges(lVertex)))
          {
            xoExtended.add(new ExtendedEdge(lEdge, lContinuation));
          }
        }
      }
    }
  }

  private Set<Edge> collectRestrictedBoundaryEdges(Set<ExtendedEdge> xiExtended)
  {
    LOGGER.log(SimulationLogging.VERBOSE, "Collecting for " + xiExtended.size() + " extended edges");
    Set<Edge> lBoundary = new LinkedHashSet<>();
    for (ExtendedEdge lExtended : xiExtended)
    {
      Edge lEdge = lExtended.mEdge;
      Vertex lTo = lEdge.getTo();
      if ((lTo.getNextIndex() == lEdge.getFrom().getIndex()) || lTo.isHalting())
      {
        continue;
      }

      Collection<Edge> lCeilings;
      if (lExtended.mCeiling == null)
      {
        lCeilings = CeilingAdjacency.filterWithPathBackward(
                                   mComputation,
                                   lEdge,
                                   CeilingAdjacency.getForwardWeakCeilingAdjacentEdges(mComputation, lEdge));
      }
      else
      {
        lCeilings = Collections.singleton(lExtended.mCeiling);
      }

      for (Edge lNext : mGraph.getNextEdgesAbovePreds(lTo, lCeilings))
      {
        if (!mComputation.hasEdge(lNext))
        {
          lBoundary.add(lNext);
        }
      }
    }
    return lBoundary;
  }
}
