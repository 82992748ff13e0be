package org.npsim.base.util.machine.implementation;

import static org.npsim.base.util.machine.MachineSpecification.ACCEPT_STATE;
import static org.npsim.base.util.machine.MachineSpecification.REJECT_STATE;
import static org.npsim.base.util.machine.Transition.LEFT;
import static org.npsim.base.util.machine.Transition.RIGHT;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;
import org.npsim.base.util.machine.VerifierMachine;

/**
 * SAT verifier whose finite control holds a decimal variable address.
 *
 * The tape holds a formula in conjunctive normal form followed by a certificate: clauses separated by '&', literals
 * by '_', negation by a leading '-', then '#' and one 'T'/'F' per variable.  For each literal the machine parses the
 * variable number into an address state (Inc.N), runs forward to the certificate (Forward.N), counts down to the
 * variable's cell (Dec.N) and carries the value back (Backward.T / Backward.F).  A satisfied clause is skipped; a
 * clause whose literals are all false rejects.
 *
 * The number of address states grows with the address bound, so the state set depends on the instance.
 */
public class SatInputDependentMachine extends VerifierMachine
{
  private static final String CHECK = "Check";

  private static final Transition DEFAULT_REJECT = new Transition(REJECT_STATE, DELIM, LEFT);

  private static final List<String> SYMBOLS = MachineSpecification.splitSymbols("_-&#TF?!0123456789" +
                                                                                MachineSpecification.BLANK);
  private static final List<String> CERTIFICATE_SYMBOLS = Arrays.asList("T", "F");

  private final int         mAddressBound;
  private final String      mInitialState;
  private final Set<String> mStates;

  /**
   * Create a machine able to address variables 1 to xiAddressBound.
   *
   * @param xiAddressBound - the largest variable number.
   */
  public SatInputDependentMachine(int xiAddressBound)
  {
    this(xiAddressBound, false);
  }

  protected SatInputDependentMachine(int xiAddressBound, boolean xiCheckCertificate)
  {
    mAddressBound = xiAddressBound;

    mTable.rule(CHECK, "_", CHECK, "_", RIGHT)
          .rule(CHECK, "-", "Not", "-", RIGHT)
          .rule(CHECK, "D", "Inc.D", "?", RIGHT)
          .rule("Not", "D", "Inc.D", "!", RIGHT)
          .rule("Skip", "&", CHECK, "_", RIGHT)
          .rule("Skip", "#", ACCEPT_STATE, "_", RIGHT)
          .rule("Skip", "*", "Skip", "_", RIGHT)
          .rule(CHECK, "&", REJECT_STATE, "_", RIGHT)
          .rule(CHECK, "#", REJECT_STATE, "_", RIGHT)

          .rule("Inc.N", "_", "Forward.N", "_", RIGHT)
          .rule("Inc.N", "&", "Forward.N", "&", RIGHT)
          .rule("Inc.N", "#", "Dec.(N-1)", "#", RIGHT)
          .rule("Inc.N", "D", "Inc.(10N+D)", "_", RIGHT)

          .rule("Forward.N", "*", "Forward.N", "*", RIGHT)
          .rule("Forward.N", "#", "Dec.(N-1)", "#", RIGHT)

          .rule("Dec.N", "T", "Dec.(N-1)", "T", RIGHT)
          .rule("Dec.N", "F", "Dec.(N-1)", "F", RIGHT)
          .rule("Dec.0", "T", "Backward.T", "T", LEFT)
          .rule("Dec.0", "F", "Backward.F", "F", LEFT)

          .rule("Backward.T", "*", "Backward.T", "*", LEFT)
          .rule("Backward.F", "*", "Backward.F", "*", LEFT)
          .rule("Backward.T", "?", "Skip", "_", RIGHT)
          .rule("Backward.F", "?", CHECK, "_", RIGHT)
          .rule("Backward.T", "!", CHECK, "_", RIGHT)
          .rule("Backward.F", "!", "Skip", "_", RIGHT);

    Set<String> lStates = new LinkedHashSet<>(Arrays.asList(CHECK, "Not", "Skip", "Backward.T", "Backward.F",
                                                            REJECT_STATE, ACCEPT_STATE));
    if (xiCheckCertificate)
    {
      CertificateCheckRules.addTruthValueRules(mTable, CHECK);
      lStates.addAll(CertificateCheckRules.STATES);
      mInitialState = CertificateCheckRules.INPUT_CHECK;
    }
    else
    {
      mInitialState = CHECK;
    }

    for (int lAddress = 0; lAddress <= xiAddressBound; lAddress++)
    {
      lStates.add("Inc." + lAddress);
      lStates.add("Dec." + lAddress);
      lStates.add("Forward." + lAddress);
    }
    mStates = Collections.unmodifiableSet(lStates);
  }

  /**
   * @return the largest variable number mentioned by the formula part of a tape (the part before '#', if any).
   *
   * @param xiTape - the tape, e.g. "1_2&-1_3#TFT".
   */
  public static int getVariableCount(String xiTape)
  {
    String lFormula = (xiTape.indexOf('#') >= 0) ? xiTape.substring(0, xiTape.indexOf('#')) : xiTape;
    lFormula = StringUtils.strip(lFormula.replace("-", "").replace('&', '_'), "_");

    int lMax = 0;
    for (String lToken : StringUtils.split(lFormula, '_'))
    {
      lMax = Math.max(lMax, Integer.parseInt(lToken));
    }
    return lMax;
  }

  public int getAddressBound()
  {
    return mAddressBound;
  }

  @Override
  public String getName()
  {
    return "SAT (input dependent, address bound " + mAddressBound + ")";
  }

  @Override
  public String getInitialState()
  {
    return mInitialState;
  }

  @Override
  public Set<String> getStates()
  {
    return mStates;
  }

  @Override
  public List<String> getSymbols()
  {
    return SYMBOLS;
  }

  @Override
  public List<String> getCertificateSymbols()
  {
    return CERTIFICATE_SYMBOLS;
  }

  @Override
  public Transition delta(String xiState, String xiSymbol)
  {
    String lAddress = "";
    String lFamily = null;
    int lDot = xiState.indexOf('.');
    if (lDot >= 0)
    {
      lAddress = xiState.substring(lDot + 1);
      lFamily = xiState.substring(0, lDot) + ".N";
    }

    boolean lDigit = isDecimalDigit(xiSymbol);
    List<String> lPatterns = new ArrayList<>(3);
    lPatterns.add(xiSymbol);
    if (lDigit)
    {
      lPatterns.add("D");
    }
    lPatterns.add("*");

    for (String lPattern : lPatterns)
    {
      Transition lRule = mTable.get(xiState, lPattern);
      if (lRule == null)
      {
        lRule = mTable.get(lFamily, lPattern);
      }
      if (lRule == null)
      {
        continue;
      }

      String lNextState = lRule.getNextState();
      if (lNextState.endsWith(".D") && lDigit)
      {
        lNextState = instantiate(lNextState, ".D", xiSymbol);
      }

      if (lNextState.endsWith(".N"))
      {
        lNextState = instantiate(lNextState, ".N", lAddress);
      }
      else if (lNextState.endsWith(".(N-1)"))
      {
        lNextState = instantiate(lNextState, ".(N-1)", String.valueOf(Integer.parseInt(lAddress) - 1));
      }
      else if (lNextState.endsWith(".(10N+D)"))
      {
        lNextState = instantiate(lNextState,
                                 ".(10N+D)",
                                 String.valueOf(Integer.parseInt(lAddress) * 10 + Integer.parseInt(xiSymbol)));
      }

      // Address out of range.
      if (!mStates.contains(lNextState))
      {
        return DEFAULT_REJECT;
      }

      String lOutput = "*".equals(lRule.getOutput()) ? xiSymbol : lRule.getOutput();
      return new Transition(lNextState, lOutput, lRule.getMove());
    }

    return DEFAULT_REJECT;
  }
}
