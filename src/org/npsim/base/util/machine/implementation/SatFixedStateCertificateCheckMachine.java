package org.npsim.base.util.machine.implementation;

/**
 * {@link SatFixedStateMachine} preceded by a phase that rejects any certificate containing something other than
 * 'T' or 'F'.
 */
public class SatFixedStateCertificateCheckMachine extends SatFixedStateMachine
{
  public SatFixedStateCertificateCheckMachine()
  {
    super(true);
  }

  @Override
  public String getName()
  {
    return "SAT (fixed state with certificate check)";
  }
}
