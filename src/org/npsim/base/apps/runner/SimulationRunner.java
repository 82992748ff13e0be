package org.npsim.base.apps.runner;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.npsim.base.simulation.CertificateSimulator;
import org.npsim.base.simulation.SimulationConfiguration;
import org.npsim.base.simulation.SimulationResult;
import org.npsim.base.util.machine.VerifierMachine;
import org.npsim.base.util.machine.exceptions.MachineDefinitionException;
import org.npsim.base.util.machine.implementation.SatFixedStateCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SatFixedStateMachine;
import org.npsim.base.util.machine.implementation.SatInputDependentCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SatInputDependentMachine;
import org.npsim.base.util.machine.implementation.SubsetSumCertificateCheckMachine;
import org.npsim.base.util.machine.implementation.SubsetSumMachine;

/**
 * This is a simple command line app for simulating a verifier over all certificates.
 *
 * Exits with 0 if some certificate is accepted, 1 if none is and 2 for bad arguments or an invalid tape.
 */
public final class SimulationRunner
{
  private static final int NUM_FIXED_ARGS = 2;

  private static final List<String> MACHINES = Arrays.asList("sat",
                                                             "sat-check",
                                                             "sat-fixed",
                                                             "sat-fixed-check",
                                                             "subsetsum",
                                                             "subsetsum-check");

  private SimulationRunner()
  {
  }

  public static void main(String[] args)
  {
    if (args.length < NUM_FIXED_ARGS || args.length > NUM_FIXED_ARGS + 1)
    {
      System.out.println("SimulationRunner [machine] [tape] [<certificate length>]");
      System.out.println("machines: " + StringUtils.join(MACHINES, ", "));
      System.out.println("example: SimulationRunner sat 1_2&-1_3#");
      System.exit(2);
    }

    String lName = args[0];
    String lTape = args[1];
    if (!MACHINES.contains(lName))
    {
      System.out.println("Unknown machine " + lName + ". Available choices are: " + MACHINES);
      System.exit(2);
    }

    int lExitCode;
    try
    {
      int lCertificateLength = (args.length > NUM_FIXED_ARGS) ? Integer.parseInt(args[NUM_FIXED_ARGS]) :
                                                                getCertificateLength(lName, lTape);
      SimulationConfiguration.logConfig();

      SimulationResult lResult = CertificateSimulator.simulate(createMachine(lName, lTape), lTape, lCertificateLength);
      System.out.println(lResult);
      if (lResult.getWitness() != null)
      {
        System.out.println("Witness: " + lResult.getWitness());
      }
      lExitCode = lResult.isAccepted() ? 0 : 1;
    }
    catch (IllegalArgumentException | MachineDefinitionException lEx)
    {
      System.err.println("Invalid input: " + lEx.getMessage());
      lExitCode = 2;
    }
    System.exit(lExitCode);
  }

  /**
   * @return the certificate length to simulate with: 0 if the tape already carries a certificate, otherwise the
   *         length the machine's certificate must have.
   *
   * @param xiName - the machine name.
   * @param xiTape - the tape.
   */
  public static int getCertificateLength(String xiName, String xiTape)
  {
    if (!StringUtils.substringAfter(xiTape, "#").isEmpty())
    {
      return 0;
    }
    if (xiName.startsWith("subsetsum"))
    {
      return SubsetSumMachine.getCertificateLength(xiTape);
    }
    return SatInputDependentMachine.getVariableCount(xiTape);
  }

  /**
   * @return the named machine, sized for the tape where it needs to be.
   *
   * @param xiName - the machine name.
   * @param xiTape - the tape.
   */
  public static VerifierMachine createMachine(String xiName, String xiTape)
  {
    switch (xiName)
    {
      case "sat":
        return new SatInputDependentMachine(SatInputDependentMachine.getVariableCount(xiTape));
      case "sat-check":
        return new SatInputDependentCertificateCheckMachine(SatInputDependentMachine.getVariableCount(xiTape));
      case "sat-fixed":
        return new SatFixedStateMachine();
      case "sat-fixed-check":
        return new SatFixedStateCertificateCheckMachine();
      case "subsetsum":
        return new SubsetSumMachine();
      case "subsetsum-check":
        return new SubsetSumCertificateCheckMachine();
      default:
        throw new IllegalArgumentException("Unknown machine " + xiName);
    }
  }
}
