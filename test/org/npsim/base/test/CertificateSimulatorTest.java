package org.npsim.base.test;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.npsim.base.simulation.CertificateSimulator;
import org.npsim.base.simulation.SimulationConfiguration;
import org.npsim.base.simulation.SimulationConfiguration.CfgItem;
import org.npsim.base.simulation.SimulationResult;
import org.npsim.base.util.machine.DirectTapeSimulator;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.implementation.SatInputDependentMachine;
import org.npsim.base.util.machine.implementation.SubsetSumCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SubsetSumMachine;

/**
 * End-to-end tests of simulation over all certificates.
 */
public class CertificateSimulatorTest extends Assert
{
  /**
   * Set limits that a terminating simulation never gets near.
   */
  static void setIterationCaps()
  {
    SimulationConfiguration.utOverrideCfgVal(CfgItem.MAX_FEASIBLE_ITERATIONS, 10000000);
    SimulationConfiguration.utOverrideCfgVal(CfgItem.MAX_VERIFIER_ITERATIONS, 100000);
    SimulationConfiguration.utOverrideCfgVal(CfgItem.MAX_WALK_LENGTH, 1000000);
  }

  @Before
  public void setUp()
  {
    setIterationCaps();
  }

  @After
  public void tearDown()
  {
    SimulationConfiguration.utResetCfg();
  }

  private static SimulationResult simulateSat(String xiTape, int xiCertificateLength)
  {
    SatInputDependentMachine lMachine =
                         new SatInputDependentMachine(SatInputDependentMachine.getVariableCount(xiTape));
    return CertificateSimulator.simulate(lMachine, xiTape, xiCertificateLength);
  }

  @Test
  public void testSatVerifierAcceptsSatisfyingCertificate()
  {
    SimulationResult lResult = simulateSat("1_2_3&4_5_6&7_8_9&-9_10_1&-2_6_1&3_5_1&-4_2_10#TTFFTFTFFT", 0);
    assertEquals(SimulationResult.Answer.YES, lResult.getAnswer());
    assertEquals("Yes", lResult.toString());

    // The certificate was on the tape, so there's nothing to report.
    assertNull(lResult.getWitness());
    assertNotNull(lResult.getAcceptedTape());
  }

  @Test
  public void testSatVerifierRejectsContradiction()
  {
    SimulationResult lResult = simulateSat("1&-1&2_3&4_5&7#TTTTTTT", 0);
    assertEquals(SimulationResult.Answer.NO, lResult.getAnswer());
    assertEquals("No", lResult.toString());
    assertNull(lResult.getAcceptedTape());
  }

  @Test
  public void testSatisfiableFormulaFound()
  {
    String lTape = "1_2_3&4_5_6&7_8_9&-9_10_1&-2_6_1&3_5_1&-4_2_10#";
    SimulationResult lResult = simulateSat(lTape, 10);
    assertTrue(lResult.isAccepted());
    assertNotNull(lResult.getWitness());
  }

  @Test
  public void testUnsatisfiableFormulaNotFound()
  {
    SimulationResult lResult = simulateSat("1&-1&2_3&4_5&7#", 7);
    assertFalse(lResult.isAccepted());
    assertNull(lResult.getWitness());
  }

  @Test
  public void testSubsetSumVerifierAcceptsWitness()
  {
    SimulationResult lResult = CertificateSimulator.simulate(new SubsetSumMachine(),
                                                             "28_@_1_3_5_7_10_20#1_20_7_;",
                                                             0);
    assertEquals(SimulationResult.Answer.YES, lResult.getAnswer());
  }

  @Test
  public void testSubsetSumVerifierRejectsMalformedCertificate()
  {
    SimulationResult lResult = CertificateSimulator.simulate(new SubsetSumMachine(),
                                                             "15_@_1_3_5_7_10_20#3_5_07_;",
                                                             0);
    assertEquals(SimulationResult.Answer.NO, lResult.getAnswer());
  }

  /**
   * The certificate check rereads every certificate cell before verifying, which makes this the most expensive run
   * of the suite.  It's bounded by time rather than by the iteration caps.
   */
  @Test(timeout = 300000)
  public void testCheckedSubsetSumExistence()
  {
    SimulationConfiguration.utResetCfg();

    String lTape = "28_@_42_20_3_5#";
    SubsetSumCertificateCheckMachine lMachine = new SubsetSumCertificateCheckMachine();
    SimulationResult lResult = CertificateSimulator.simulate(lMachine,
                                                             lTape,
                                                             SubsetSumMachine.getCertificateLength(lTape));
    assertTrue(lResult.isAccepted());

    DirectTapeSimulator lCheck = new DirectTapeSimulator(lMachine.getSpecification(), lTape + lResult.getWitness());
    assertEquals(MachineSpecification.ACCEPT_STATE, lCheck.run(1000000));
  }

  @Test
  public void testWitnessSatisfiesFormula()
  {
    String lTape = "1_2&-1_3#";
    SimulationResult lResult = simulateSat(lTape, 3);
    assertTrue(lResult.isAccepted());

    String lWitness = lResult.getWitness();
    assertEquals(3, lWitness.length());
    assertEquals(lTape + lWitness, lResult.getAcceptedTape());

    DirectTapeSimulator lCheck = new DirectTapeSimulator(new SatInputDependentMachine(3).getSpecification(),
                                                         lTape + lWitness);
    assertEquals(MachineSpecification.ACCEPT_STATE, lCheck.run(10000));
  }

  @Test
  public void testStatistics()
  {
    CertificateSimulator lSimulator = new CertificateSimulator(new SatInputDependentMachine(3).getSpecification(),
                                                               "1_2&-1_3#",
                                                               3);
    SimulationResult lResult = lSimulator.run();
    assertSame(lSimulator.getStatistics(), lResult.getStatistics());
    assertEquals(lSimulator.getComputationGraph().size(), lResult.getStatistics().getTotalEdges());
    assertTrue(lResult.getStatistics().getCandidatesVerified() > 0);
    assertTrue(lResult.getStatistics().getExtendedByVerification() > 0);
    assertTrue(lResult.getStatistics().getExtendedWalks() > 0);
    assertEquals(lResult.getStatistics().getExtendedWalks(), lResult.getStatistics().getWalkLength().getCount());
    assertTrue(lResult.getStatistics().getWalkLength().getLongest() > 0);
    assertTrue(lResult.getStatistics().getHaltingEdges() > 0);
  }

  @Test(expected = IllegalStateException.class)
  public void testSimulatorRunsOnce()
  {
    CertificateSimulator lSimulator = new CertificateSimulator(new SatInputDependentMachine(1).getSpecification(),
                                                               "1&-1#T",
                                                               0);
    lSimulator.run();
    lSimulator.run();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyTapeRejected()
  {
    CertificateSimulator.simulate(new SatInputDependentMachine(1), "", 0);
  }
}
