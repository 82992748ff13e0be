package org.npsim.base.simulation;

import org.apache.logging.log4j.Logger;
import org.npsim.base.util.stats.LengthStatistic;

/**
 * Counters for one simulation run.
 */
public class SimulationStatistics
{
  private int                    mCandidatesVerified;
  private int                    mExtendedByVerification;
  private int                    mRemovedDisjointEdges;
  private int                    mPrunedWalks;
  private int                    mHaltingEdges;
  private final LengthStatistic  mWalkLength = new LengthStatistic();
  private int                    mTotalEdges;
  private long                   mElapsedTime;

  public void candidateVerified()
  {
    mCandidatesVerified++;
  }

  public void extendedByVerification()
  {
    mExtendedByVerification++;
  }

  public void removedDisjointEdge()
  {
    mRemovedDisjointEdges++;
  }

  public void prunedWalk()
  {
    mPrunedWalks++;
  }

  public void haltingEdge()
  {
    mHaltingEdges++;
  }

  /**
   * Record a maximal computation walk extended directly into the graph.
   *
   * @param xiLength - the number of edges it added or followed.
   */
  public void extendedWalk(int xiLength)
  {
    mWalkLength.record(xiLength);
  }

  /**
   * Record the end of the run.
   *
   * @param xiTotalEdges  - the number of edges in the final computation graph.
   * @param xiElapsedTime - the elapsed time, in milliseconds.
   */
  public void finish(int xiTotalEdges, long xiElapsedTime)
  {
    mTotalEdges = xiTotalEdges;
    mElapsedTime = xiElapsedTime;
  }

  /**
   * @return the number of candidate edges handed to the walk verifier.  The same edge may be counted more than once.
   */
  public int getCandidatesVerified()
  {
    return mCandidatesVerified;
  }

  public int getExtendedByVerification()
  {
    return mExtendedByVerification;
  }

  public int getRemovedDisjointEdges()
  {
    return mRemovedDisjointEdges;
  }

  public int getPrunedWalks()
  {
    return mPrunedWalks;
  }

  public int getHaltingEdges()
  {
    return mHaltingEdges;
  }

  public int getExtendedWalks()
  {
    return mWalkLength.getCount();
  }

  public LengthStatistic getWalkLength()
  {
    return mWalkLength;
  }

  public int getTotalEdges()
  {
    return mTotalEdges;
  }

  /**
   * @return the number of edges added while following computation walks, rather than by verification.
   */
  public int getExtendedDirectly()
  {
    return mTotalEdges - mExtendedByVerification;
  }

  /**
   * @return the elapsed time of the run, in milliseconds.
   */
  public long getElapsedTime()
  {
    return mElapsedTime;
  }

  /**
   * Log the statistics at INFO.
   *
   * @param xiLogger - the logger to use.
   */
  public void log(Logger xiLogger)
  {
    xiLogger.info("Total edge count: " + mTotalEdges);
    xiLogger.info("Edges extended directly: " + getExtendedDirectly());
    xiLogger.info("Edges extended by verification: " + mExtendedByVerification);
    xiLogger.info("Candidate edges verified: " + mCandidatesVerified + " (may be counted multiple times)");
    xiLogger.info("Disjoint edges computed: " + mRemovedDisjointEdges);
    xiLogger.info("Pruned walks: " + mPrunedWalks);
    xiLogger.info("Halting edges (Accept/Reject): " + mHaltingEdges);
    xiLogger.info("Extended maximal computation walks: " + getExtendedWalks());
    xiLogger.info("Computation walk length: " + mWalkLength);
    xiLogger.info(String.format("Elapsed time: %d.%03ds", mElapsedTime / 1000, mElapsedTime % 1000));
  }
}
