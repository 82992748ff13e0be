package org.npsim.base.util.machine.implementation;

/**
 * {@link SatInputDependentMachine} preceded by a phase that rejects any certificate containing something other than
 * 'T' or 'F'.
 */
public class SatInputDependentCertificateCheckMachine extends SatInputDependentMachine
{
  public SatInputDependentCertificateCheckMachine(int xiAddressBound)
  {
    super(xiAddressBound, true);
  }

  @Override
  public String getName()
  {
    return "SAT (input dependent with certificate check, address bound " + getAddressBound() + ")";
  }
}
