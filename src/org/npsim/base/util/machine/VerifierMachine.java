package org.npsim.base.util.machine;

import java.util.List;
import java.util.Set;

/**
 * A deterministic single-tape verifier machine, defined by a table of pattern rules.
 *
 * Sub-classes fill in {@link #mTable} from their constructor and implement {@link #delta} to match and instantiate
 * the patterns.
 */
public abstract class VerifierMachine implements TransitionOracle
{
  /**
   * The symbol written by the default reject transitions.
   */
  public static final String DELIM = "_";

  /**
   * The machine's raw rules.
   */
  protected final TransitionTable mTable = new TransitionTable();

  private MachineSpecification mSpecification;

  /**
   * @return a short name for the machine, for logging.
   */
  public abstract String getName();

  /**
   * @return the initial state.
   */
  public abstract String getInitialState();

  /**
   * @return all the states the machine can enter.  The halt states are included.
   */
  public abstract Set<String> getStates();

  /**
   * @return the tape alphabet, blank included.
   */
  public abstract List<String> getSymbols();

  /**
   * @return the symbols a certificate cell may hold.
   */
  public abstract List<String> getCertificateSymbols();

  /**
   * @return the immutable specification of this machine, suitable for simulation.
   */
  public MachineSpecification getSpecification()
  {
    if (mSpecification == null)
    {
      mSpecification = new MachineSpecification(getInitialState(),
                                                getStates(),
                                                getSymbols(),
                                                getCertificateSymbols(),
                                                this);
    }
    return mSpecification;
  }

  /**
   * @return whether the symbol is one of the ASCII digits 0-9.
   *
   * @param xiSymbol - the symbol.
   */
  protected static boolean isDecimalDigit(String xiSymbol)
  {
    return (xiSymbol.length() == 1) && (xiSymbol.charAt(0) >= '0') && (xiSymbol.charAt(0) <= '9');
  }

  /**
   * @return the state with a pattern suffix replaced by a concrete one, keeping the separating dot.  "Inc.D"
   *         instantiated with "1" is "Inc.1".
   *
   * @param xiState   - the state, ending in xiPattern.
   * @param xiPattern - the suffix to replace, starting with the dot.
   * @param xiValue   - the replacement for the part after the dot.
   */
  protected static String instantiate(String xiState, String xiPattern, String xiValue)
  {
    return xiState.substring(0, xiState.length() - xiPattern.length() + 1) + xiValue;
  }

  @Override
  public String toString()
  {
    return getName();
  }
}
