package org.npsim.base.test;

import org.junit.Assert;
import org.junit.Test;
import org.npsim.base.util.machine.DirectTapeSimulator;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;
import org.npsim.base.util.machine.VerifierMachine;
import org.npsim.base.util.machine.exceptions.MachineDefinitionException;
import org.npsim.base.util.machine.implementation.SatFixedStateCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SatFixedStateMachine;
import org.npsim.base.util.machine.implementation.SatInputDependentCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SatInputDependentMachine;
import org.npsim.base.util.machine.implementation.SubsetSumCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SubsetSumMachine;

/**
 * Tests for the verifier machines, run directly on tapes with a certificate.
 */
public class VerifierMachineTest extends Assert
{
  private static final int MAX_STEPS = 1000000;

  private static final Object[][] SAT_TAPES =
  {
    {"1_2_3&4_5_6&7_8_9&-9_10_1&-2_6_1&3_5_1&-4_2_10#TTFFTFTFFT", true},
    {"1&-1&2_3&4_5&7#TTTTTTT", false},
    {"-1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#TTTFTFTFTF", true},
    {"1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#TTTFTFTFTF", true},
    {"2&-2&1_3_1&4_6_5&-9_10#FFFFFFFFFF", false},
    {"1_2&-1_3#TFT", true},
    {"1&-1#T", false},
  };

  private static final Object[][] SUBSET_SUM_TAPES =
  {
    {"28_@_1_3_5_7_10_20#1_20_7_;", true},
    {"15_@_1_3_5_7_10_20#3_5_7_;", true},
    {"15_@_1_3_5_7_10_20#5_10_;", true},
    {"20_@_1_3_5_7_10_20#3_10_7_;", true},
    {"45_@_1_3_5_37_100_20#3_5_37_;", true},
    {"100_@_1_3_27_100#37_45_;", false},
    {"82_@_1_3_37_100_45#37_45_;", true},
    {"18_@_42_20_3_5#5_3_15_;", false},
    {"33_@_42_20_3_5#5_5_3_20_;", false},
    {"15_@_1_3_5_7_10_20#3_5_07_;", false},
    {"28_@_42_20_3_5#20_5_3_42;", false},
  };

  private static String run(VerifierMachine xiMachine, String xiTape)
  {
    DirectTapeSimulator lSimulator = new DirectTapeSimulator(xiMachine.getSpecification(), xiTape);
    String lHaltState = lSimulator.run(MAX_STEPS);
    assertNotNull(xiMachine + " didn't halt on " + xiTape, lHaltState);
    return lHaltState;
  }

  private static void checkTapes(VerifierMachine xiMachine, String xiTape, boolean xiExpected)
  {
    String lExpected = xiExpected ? MachineSpecification.ACCEPT_STATE : MachineSpecification.REJECT_STATE;
    assertEquals(xiMachine + " on " + xiTape, lExpected, run(xiMachine, xiTape));
  }

  @Test
  public void testSatInputDependent()
  {
    for (Object[] lCase : SAT_TAPES)
    {
      String lTape = (String)lCase[0];
      int lBound = SatInputDependentMachine.getVariableCount(lTape);
      checkTapes(new SatInputDependentMachine(lBound), lTape, (Boolean)lCase[1]);
      checkTapes(new SatInputDependentCertificateCheckMachine(lBound), lTape, (Boolean)lCase[1]);
    }
  }

  @Test
  public void testSatFixedState()
  {
    for (Object[] lCase : SAT_TAPES)
    {
      checkTapes(new SatFixedStateMachine(), (String)lCase[0], (Boolean)lCase[1]);
      checkTapes(new SatFixedStateCertificateCheckMachine(), (String)lCase[0], (Boolean)lCase[1]);
    }
  }

  @Test
  public void testSubsetSum()
  {
    for (Object[] lCase : SUBSET_SUM_TAPES)
    {
      checkTapes(new SubsetSumMachine(), (String)lCase[0], (Boolean)lCase[1]);
      checkTapes(new SubsetSumCertificateCheckMachine(), (String)lCase[0], (Boolean)lCase[1]);
    }
  }

  @Test
  public void testCertificateCheckRejectsForeignSymbols()
  {
    // The plain verifier never reads beyond the last variable.
    assertEquals(MachineSpecification.ACCEPT_STATE, run(new SatInputDependentMachine(3), "1_2&-1_3#TFT?"));
    assertEquals(MachineSpecification.REJECT_STATE,
                 run(new SatInputDependentCertificateCheckMachine(3), "1_2&-1_3#TFT?"));
  }

  @Test
  public void testAddressStates()
  {
    SatInputDependentMachine lMachine = new SatInputDependentMachine(3);
    MachineSpecification lSpecification = lMachine.getSpecification();

    assertEquals(new Transition("Inc.1", "?", Transition.RIGHT), lSpecification.delta("Check", "1"));
    assertEquals(new Transition("Inc.2", "!", Transition.RIGHT), lSpecification.delta("Not", "2"));
    assertEquals(new Transition("Forward.3", "_", Transition.RIGHT), lSpecification.delta("Inc.3", "_"));
    assertEquals(new Transition("Forward.2", "&", Transition.RIGHT), lSpecification.delta("Inc.2", "&"));
    assertEquals(new Transition("Forward.1", "T", Transition.RIGHT), lSpecification.delta("Forward.1", "T"));
    assertEquals(new Transition("Dec.0", "#", Transition.RIGHT), lSpecification.delta("Forward.1", "#"));
    assertEquals(new Transition("Dec.2", "#", Transition.RIGHT), lSpecification.delta("Inc.3", "#"));
    assertEquals(new Transition("Dec.2", "T", Transition.RIGHT), lSpecification.delta("Dec.3", "T"));
    assertEquals(new Transition("Backward.F", "F", Transition.LEFT), lSpecification.delta("Dec.0", "F"));

    // Variable 12 is beyond the address bound.
    assertEquals(new Transition(MachineSpecification.REJECT_STATE, VerifierMachine.DELIM, Transition.LEFT),
                 lSpecification.delta("Inc.1", "2"));
  }

  @Test
  public void testMultiDigitAddress()
  {
    MachineSpecification lSpecification = new SatInputDependentMachine(10).getSpecification();
    assertEquals(new Transition("Inc.10", "_", Transition.RIGHT), lSpecification.delta("Inc.1", "0"));
    assertEquals(new Transition("Forward.10", "_", Transition.RIGHT), lSpecification.delta("Inc.10", "_"));
    assertEquals(new Transition("Dec.9", "#", Transition.RIGHT), lSpecification.delta("Forward.10", "#"));
  }

  @Test
  public void testFixedStateTransitions()
  {
    MachineSpecification lSpecification = new SatFixedStateMachine().getSpecification();

    // ".S" families carry the Free/Forwarded suffix.
    assertEquals(new Transition("UnknownTerm.Forwarded", "1", Transition.RIGHT),
                 lSpecification.delta("Check.Forwarded", "1"));
    assertEquals(new Transition("CheckNot.Free", "-", Transition.RIGHT), lSpecification.delta("Check.Free", "-"));
    assertEquals(new Transition("Unknown.Free", "_", Transition.RIGHT), lSpecification.delta("Check.Free", "0"));
    assertEquals(new Transition("Skip.Forwarded", "T", Transition.RIGHT),
                 lSpecification.delta("Unknown.Forwarded", "T"));
    assertEquals(new Transition("Check.Free", "&", Transition.RIGHT),
                 lSpecification.delta("UnknownTerm.Forwarded", "&"));
    assertEquals(new Transition(MachineSpecification.ACCEPT_STATE, "#", Transition.RIGHT),
                 lSpecification.delta("Skip.Forwarded", "#"));
    assertEquals(new Transition("Fetch", "#", Transition.RIGHT), lSpecification.delta("Skip.Free", "#"));

    // ".B" families carry the fetched truth value.
    assertEquals(new Transition("Backward.T", "_", Transition.LEFT), lSpecification.delta("Fetch", "T"));
    assertEquals(new Transition("BackwardInTerm.T", "2", Transition.LEFT), lSpecification.delta("Backward.T", "3"));
    assertEquals(new Transition("BackwardFrom1.F", "0", Transition.LEFT), lSpecification.delta("Backward.F", "1"));
    assertEquals(new Transition("Borrow.T", "9", Transition.LEFT), lSpecification.delta("Backward.T", "0"));
    assertEquals(new Transition("Assign.F", "_", Transition.RIGHT), lSpecification.delta("BackwardFrom1.F", "_"));
    assertEquals(new Transition("Backward.F", "F", Transition.LEFT), lSpecification.delta("Assign.F", "0"));
    assertEquals(new Transition("Check.Forwarded", MachineSpecification.BLANK, Transition.RIGHT),
                 lSpecification.delta("Backward.T", MachineSpecification.BLANK));
  }

  @Test
  public void testSubsetSumTransitions()
  {
    MachineSpecification lSpecification = new SubsetSumMachine().getSpecification();

    // ".M" families carry a digit.
    assertEquals(new Transition("BackwardToMatch.4", "~", Transition.LEFT),
                 lSpecification.delta("FindDigitToMatch", "4"));
    assertEquals(new Transition("BackwardToMatch.4", "\u2463", Transition.LEFT),
                 lSpecification.delta("MatchPosition.4", "4"));
    assertEquals(new Transition("BackwardToMatch.4", "3", Transition.LEFT),
                 lSpecification.delta("MatchPosition.4", "3"));
    assertEquals(new Transition("MatchPosition.7", "|", Transition.RIGHT),
                 lSpecification.delta("BackwardToMatch.7", "_"));
    assertEquals(new Transition("SumArea.2", "@", Transition.LEFT),
                 lSpecification.delta("BackwardToSubtract.2", "@"));

    // Subtraction writes the circled difference and records the borrow.
    assertEquals(new Transition("Borrow.0", "\u2461", Transition.LEFT), lSpecification.delta("Subtract.3", "5"));
    assertEquals(new Transition("Borrow.1", "\u2464", Transition.LEFT), lSpecification.delta("Subtract.7", "2"));
    assertEquals(new Transition("Forward", "5", Transition.RIGHT), lSpecification.delta("Borrow.1", "6"));
  }

  @Test
  public void testSpecificationContents()
  {
    MachineSpecification lSpecification = new SubsetSumMachine().getSpecification();
    assertTrue(lSpecification.getStates().contains(MachineSpecification.ACCEPT_STATE));
    assertTrue(lSpecification.getStates().contains(MachineSpecification.REJECT_STATE));
    assertTrue(lSpecification.getSymbols().contains(MachineSpecification.BLANK));
    assertEquals(12, lSpecification.getCertificateSymbols().size());
    assertEquals("Forward", lSpecification.getInitialState());

    lSpecification = new SatFixedStateMachine().getSpecification();
    assertEquals("Check.Forwarded", lSpecification.getInitialState());
  }

  @Test
  public void testTapeHelpers()
  {
    assertEquals(3, SatInputDependentMachine.getVariableCount("1_2&-1_3#TFT"));
    assertEquals(10, SatInputDependentMachine.getVariableCount("-1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#"));
    assertEquals(7, SubsetSumMachine.getCertificateLength("10_@_3_4_12#"));
    assertEquals(10, SubsetSumMachine.getCertificateLength("28_@_42_20_3_5#"));
  }

  @Test(expected = MachineDefinitionException.class)
  public void testForeignTapeSymbolRejected()
  {
    new DirectTapeSimulator(new SatFixedStateMachine().getSpecification(), "1_2#TX");
  }
}
