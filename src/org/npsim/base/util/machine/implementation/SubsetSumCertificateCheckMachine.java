package org.npsim.base.util.machine.implementation;

/**
 * {@link SubsetSumMachine} preceded by a phase that rejects any certificate containing something other than digits
 * and delimiters before its terminating ';'.
 */
public class SubsetSumCertificateCheckMachine extends SubsetSumMachine
{
  public SubsetSumCertificateCheckMachine()
  {
    super(true);
  }

  @Override
  public String getName()
  {
    return "Subset-Sum (with certificate check)";
  }
}
