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
import org.npsim.base.util.machine.DirectTapeSimulator;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.VerifierMachine;

/**
 * Regression tests for the SAT verifiers, in verifier mode (certificate on the tape) and existence mode (certificate
 * enumerated).
 */
@RunWith(Parameterized.class)
public class SatRegressionTest extends Assert
{
  private static final String[] MACHINES = {"sat", "sat-check", "sat-fixed", "sat-fixed-check"};

  private static final Object[][] VERIFIER_TAPES =
  {
    {"1_2_3&4_5_6&7_8_9&-9_10_1&-2_6_1&3_5_1&-4_2_10#TTFFTFTFFT", true},
    {"1&-1&2_3&4_5&7#TTTTTTT", false},
    {"-1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#TTTFTFTFTF", true},
    {"1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#TTTFTFTFTF", true},
    {"2&-2&1_3_1&4_6_5&-9_10#FFFFFFFFFF", false},
    {"1_2&-1_3#TFT", true},
    {"1&-1#T", false},
  };

  private static final Object[][] SMALL_EXISTENCE_TAPES =
  {
    {"1_2&-1_3#", true},
    {"1&-1#", false},
  };

  private static final Object[][] EXISTENCE_TAPES =
  {
    {"1_2_3&4_5_6&7_8_9&-9_10_1&-2_6_1&3_5_1&-4_2_10#", true},
    {"1&-1&2_3&4_5&7#", false},
    {"-1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#", true},
    {"1_3_5&5_2_1&7_9_10&-6_1_-4&2_-6_1#", true},
    {"2&-2&1_3_1&4_6_5&-9_10#", false},
  };

  /**
   * Every SAT machine runs the certificate tapes and the small formulas.  The ten-variable formulas run on the
   * input-dependent machine and on the fixed-state machine with certificate check.
   */
  @Parameters(name="{0}: {1}")
  public static Iterable<? extends Object> data()
  {
    List<Object[]> lTests = new ArrayList<>();
    for (String lMachine : MACHINES)
    {
      addCases(lTests, lMachine, VERIFIER_TAPES);
      addCases(lTests, lMachine, SMALL_EXISTENCE_TAPES);
    }
    addCases(lTests, "sat", EXISTENCE_TAPES);
    addCases(lTests, "sat-fixed-check", EXISTENCE_TAPES);
    return lTests;
  }

  private static void addCases(List<Object[]> xioTests, String xiMachine, Object[][] xiCases)
  {
    for (Object[] lCase : xiCases)
    {
      xioTests.add(new Object[] {xiMachine, lCase[0], lCase[1]});
    }
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
  public SatRegressionTest(String xiMachine, String xiTape, boolean xiExpected)
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
    int lCertificateLength = SimulationRunner.getCertificateLength(mMachine, mTape);
    VerifierMachine lMachine = SimulationRunner.createMachine(mMachine, mTape);
    SimulationResult lResult = CertificateSimulator.simulate(lMachine, mTape, lCertificateLength);
    assertEquals(mMachine + " on " + mTape, mExpected, lResult.isAccepted());

    if (mExpected && (lCertificateLength > 0))
    {
      // The witness must convince the machine on its own.
      assertTrue(lResult.getWitness().length() <= lCertificateLength);
      DirectTapeSimulator lCheck = new DirectTapeSimulator(lMachine.getSpecification(),
                                                           mTape + lResult.getWitness());
      assertEquals(MachineSpecification.ACCEPT_STATE, lCheck.run(1000000));
    }
  }
}
