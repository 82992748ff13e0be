package org.npsim.base.test;

import java.util.ArrayList;
import java.util.List;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import org.npsim.base.apps.runner.SimulationRunner;
import org.npsim.base.simulation.CertificateSimulator;
import org.npsim.base.simulation.SimulationConfiguration;
import org.npsim.base.simulation.SimulationResult;

/**
 * Regression tests for the Subset-Sum verifiers.
 */
@RunWith(Parameterized.class)
public class SubsetSumRegressionTest extends Assert
{
  private static final Object[][] TAPES =
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

  private static final Object[][] EXISTENCE_TAPES =
  {
    {"10_@_3_4_12#", false},
    {"28_@_42_20_3_5#", true},
  };

  @Parameters(name="{0}: {1}")
  public static Iterable<? extends Object> data()
  {
    List<Object[]> lTests = new ArrayList<>();
    for (String lMachine : new String[] {"subsetsum", "subsetsum-check"})
    {
      for (Object[] lCase : TAPES)
      {
        lTests.add(new Object[] {lMachine, lCase[0], lCase[1]});
      }
    }
    for (Object[] lCase : EXISTENCE_TAPES)
    {
      lTests.add(new Object[] {"subsetsum", lCase[0], lCase[1]});
    }
    return lTests;
  }

  private final String  mMachine;
  private final String  mTape;
  private final boolean mExpected;

  /**
   * Create a test case.
   *
   * @param xiMachine  - the machine name, as understood by the runner.
   * @param xiTape     - the tape.
   * @param xiExpected - whether some certificate should be accepted.
   */
  public SubsetSumRegressionTest(String xiMachine, String xiTape, boolean xiExpected)
  {
    mMachine = xiMachine;
    mTape = xiTape;
    mExpected = xiExpected;
  }

  @Before
  public void setUp()
  {
    CertificateSimulatorTest.setIterationCaps();
  }

  @After
  public void tearDown()
  {
    SimulationConfiguration.utResetCfg();
  }

  @Test
  public void testSimulation()
  {
    SimulationResult lResult = CertificateSimulator.simulate(SimulationRunner.createMachine(mMachine, mTape),
                                                             mTape,
                                                             SimulationRunner.getCertificateLength(mMachine, mTape));
    assertEquals(mMachine + " on " + mTape, mExpected, lResult.isAccepted());
  }
}
