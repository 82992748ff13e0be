package org.npsim.base.util.machine.exceptions;

/**
 * Thrown when a verifier machine breaks its own definition - the transition oracle produced a state, symbol or
 * direction outside the declared machine, or a configuration was requested for a symbol the machine doesn't know.
 *
 * This indicates a bug in the machine or in the caller and aborts the run.
 */
public class MachineDefinitionException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  public MachineDefinitionException(String xiMessage)
  {
    super(xiMessage);
  }
}
