package org.npsim.base.util.machine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.npsim.base.util.machine.exceptions.MachineDefinitionException;

/**
 * Immutable description of the verifier machine under simulation: its states, its tape alphabet, the alphabet that
 * certificate cells range over and the transition oracle.
 *
 * One specification is built per run and handed to every graph of that run.  Nothing here is global, so independent
 * runs may use different machines at the same time.
 */
public final class MachineSpecification
{
  /**
   * Blank symbol - the background of the infinite tape.  Always a member of the alphabet.
   */
  public static final String BLANK = "ϵ";

  /**
   * Name of the accepting halt state.
   */
  public static final String ACCEPT_STATE = "Accept";

  /**
   * Name of the rejecting halt state.
   */
  public static final String REJECT_STATE = "Reject";

  private final String           mInitialState;
  private final Set<String>      mStates;
  private final Set<String>      mSymbols;
  private final List<String>     mCertificateSymbols;
  private final TransitionOracle mOracle;

  /**
   * Create a machine specification.
   *
   * @param xiInitialState      - the initial state.
   * @param xiStates            - the finite state set.  The halt states are added if missing.
   * @param xiSymbols           - the tape alphabet.  The blank symbol is added if missing.
   * @param xiCertificateSymbols - the symbols a certificate cell may hold, or an empty collection to let certificate
   *                               cells range over the whole of xiSymbols.
   * @param xiOracle            - the transition function.
   */
  public MachineSpecification(String xiInitialState,
                              Collection<String> xiStates,
                              Collection<String> xiSymbols,
                              Collection<String> xiCertificateSymbols,
                              TransitionOracle xiOracle)
  {
    Set<String> lStates = new LinkedHashSet<>(xiStates);
    lStates.add(ACCEPT_STATE);
    lStates.add(REJECT_STATE);

    Set<String> lSymbols = new LinkedHashSet<>(xiSymbols);
    lSymbols.add(BLANK);

    if (!lStates.contains(xiInitialState))
    {
      throw new MachineDefinitionException("Initial state " + xiInitialState + " is not a declared state");
    }

    List<String> lCertificateSymbols = new ArrayList<>(xiCertificateSymbols.isEmpty() ? xiSymbols :
                                                                                       xiCertificateSymbols);
    for (String lSymbol : lCertificateSymbols)
    {
      if (!lSymbols.contains(lSymbol))
      {
        throw new MachineDefinitionException("Certificate symbol " + lSymbol + " is not in the alphabet");
      }
    }

    mInitialState = xiInitialState;
    mStates = Collections.unmodifiableSet(lStates);
    mSymbols = Collections.unmodifiableSet(lSymbols);
    mCertificateSymbols = Collections.unmodifiableList(lCertificateSymbols);
    mOracle = xiOracle;
  }

  public String getInitialState()
  {
    return mInitialState;
  }

  public Set<String> getStates()
  {
    return mStates;
  }

  public Set<String> getSymbols()
  {
    return mSymbols;
  }

  public List<String> getCertificateSymbols()
  {
    return mCertificateSymbols;
  }

  /**
   * @return whether the state is one of the two halt states.
   *
   * @param xiState - the state.
   */
  public static boolean isHalting(String xiState)
  {
    return ACCEPT_STATE.equals(xiState) || REJECT_STATE.equals(xiState);
  }

  /**
   * Check that a symbol belongs to the alphabet.
   *
   * @param xiSymbol - the symbol.
   *
   * @throws MachineDefinitionException if it doesn't.
   */
  public void checkSymbol(String xiSymbol)
  {
    if (!mSymbols.contains(xiSymbol))
    {
      throw new MachineDefinitionException("Symbol " + xiSymbol + " is not in the alphabet " + mSymbols);
    }
  }

  /**
   * Apply the transition oracle, checking that its answer stays inside this machine.
   *
   * @return the transition for the given state and symbol.
   *
   * @param xiState  - the current state.
   * @param xiSymbol - the symbol under the head.
   *
   * @throws MachineDefinitionException if the state or symbol is undeclared or the oracle's answer leaves the
   *                                    machine.
   */
  public Transition delta(String xiState, String xiSymbol)
  {
    if (!mStates.contains(xiState))
    {
      throw new MachineDefinitionException("State " + xiState + " is not a declared state");
    }
    checkSymbol(xiSymbol);

    Transition lTransition = mOracle.delta(xiState, xiSymbol);
    if (lTransition == null)
    {
      throw new MachineDefinitionException("No transition for (" + xiState + "," + xiSymbol + ")");
    }
    if (!mStates.contains(lTransition.getNextState()))
    {
      throw new MachineDefinitionException("Transition " + lTransition + " from (" + xiState + "," + xiSymbol +
                                           ") enters an undeclared state");
    }
    if (!mSymbols.contains(lTransition.getOutput()))
    {
      throw new MachineDefinitionException("Transition " + lTransition + " from (" + xiState + "," + xiSymbol +
                                           ") writes a symbol outside the alphabet");
    }
    if ((lTransition.getMove() != Transition.LEFT) && (lTransition.getMove() != Transition.RIGHT))
    {
      throw new MachineDefinitionException("Transition " + lTransition + " from (" + xiState + "," + xiSymbol +
                                           ") doesn't move the head by exactly one cell");
    }
    return lTransition;
  }

  /**
   * Split a tape string into its symbols.  Every symbol is a single code point.
   *
   * @return the symbols, in tape order.
   *
   * @param xiTape - the tape string.
   */
  public static List<String> splitSymbols(String xiTape)
  {
    List<String> lSymbols = new ArrayList<>(xiTape.length());
    int lOffset = 0;
    while (lOffset < xiTape.length())
    {
      int lCodePoint = xiTape.codePointAt(lOffset);
      lSymbols.add(new String(Character.toChars(lCodePoint)));
      lOffset += Character.charCount(lCodePoint);
    }
    return lSymbols;
  }
}
