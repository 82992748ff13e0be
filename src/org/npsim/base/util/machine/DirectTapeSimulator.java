package org.npsim.base.util.machine;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.npsim.base.util.graph.CellArray;

/**
 * Runs a machine on one concrete tape, one step at a time.  Cells outside the written tape are blank.
 *
 * This is the plain deterministic semantics that the computation graph simulates for every certificate at once, so
 * it is a convenient cross-check for machines and for the graph simulator.
 */
public class DirectTapeSimulator
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final MachineSpecification mSpecification;
  private final CellArray<String>    mTape;
  private String                     mState;
  private int                        mHead;
  private int                        mSteps;

  /**
   * Create a simulator positioned at cell 0 in the initial state.
   *
   * @param xiSpecification - the machine.
   * @param xiTape          - the initial tape content, starting at cell 0.
   */
  public DirectTapeSimulator(MachineSpecification xiSpecification, String xiTape)
  {
    mSpecification = xiSpecification;
    mTape = new CellArray<>(new CellArray.CellFactory<String>()
    {
      @Override
      public String create(int xiIndex)
      {
        return MachineSpecification.BLANK;
      }
    });

    List<String> lSymbols = MachineSpecification.splitSymbols(xiTape);
    for (int lii = 0; lii < lSymbols.size(); lii++)
    {
      mSpecification.checkSymbol(lSymbols.get(lii));
      mTape.set(lii, lSymbols.get(lii));
    }

    mState = xiSpecification.getInitialState();
    mHead = 0;
    mSteps = 0;
  }

  /**
   * Perform a single transition.
   *
   * @return the state entered.
   */
  public String step()
  {
    Transition lTransition = mSpecification.delta(mState, mTape.get(mHead));
    mTape.set(mHead, lTransition.getOutput());
    mHead += lTransition.getMove();
    mState = lTransition.getNextState();
    mSteps++;
    return mState;
  }

  /**
   * Run until the machine halts or the step limit is reached.
   *
   * @return the halt state, or null if the machine was still running after xiMaxSteps steps.
   *
   * @param xiMaxSteps - the step limit.
   */
  public String run(int xiMaxSteps)
  {
    while (!MachineSpecification.isHalting(mState))
    {
      if (mSteps >= xiMaxSteps)
      {
        LOGGER.debug("Still running in state " + mState + " after " + mSteps + " steps");
        return null;
      }
      step();
    }
    LOGGER.debug("Halted in " + mState + " after " + mSteps + " steps");
    return mState;
  }
}
