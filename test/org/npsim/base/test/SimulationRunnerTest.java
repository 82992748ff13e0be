package org.npsim.base.test;

import org.junit.Assert;
import org.junit.Test;
import org.npsim.base.apps.runner.SimulationRunner;
import org.npsim.base.util.machine.implementation.SatFixedStateMachine;
import org.npsim.base.util.machine.implementation.SatInputDependentMachine;
import org.npsim.base.util.machine.implementation.SubsetSumCertificateCheckMachine;

public class SimulationRunnerTest extends Assert
{
  @Test
  public void testCertificateLength()
  {
    assertEquals(0, SimulationRunner.getCertificateLength("sat", "1_2&-1_3#TFT"));
    assertEquals(3, SimulationRunner.getCertificateLength("sat", "1_2&-1_3#"));
    assertEquals(10, SimulationRunner.getCertificateLength("sat-fixed", "2&-2&1_3_1&4_6_5&-9_10#"));
    assertEquals(7, SimulationRunner.getCertificateLength("subsetsum", "10_@_3_4_12#"));
    assertEquals(0, SimulationRunner.getCertificateLength("subsetsum-check", "15_@_1_3_5_7_10_20#5_10_;"));
  }

  @Test
  public void testCreateMachine()
  {
    assertTrue(SimulationRunner.createMachine("sat", "1_2#") instanceof SatInputDependentMachine);
    assertTrue(SimulationRunner.createMachine("sat-fixed", "1_2#") instanceof SatFixedStateMachine);
    assertTrue(SimulationRunner.createMachine("subsetsum-check", "10_@_3#") instanceof
                                                                         SubsetSumCertificateCheckMachine);
  }

  @Test(expected=IllegalArgumentException.class)
  public void testUnknownMachine()
  {
    SimulationRunner.createMachine("knapsack", "1#");
  }
}
