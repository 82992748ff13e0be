package org.npsim.base.util.machine.implementation;

import static org.npsim.base.util.machine.MachineSpecification.ACCEPT_STATE;
import static org.npsim.base.util.machine.MachineSpecification.BLANK;
import static org.npsim.base.util.machine.MachineSpecification.REJECT_STATE;
import static org.npsim.base.util.machine.Transition.LEFT;
import static org.npsim.base.util.machine.Transition.RIGHT;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;
import org.npsim.base.util.machine.VerifierMachine;

/**
 * SAT verifier with a state set independent of the instance.
 *
 * Variable numbers are decremented in place on the tape each time the machine fetches the next certificate value,
 * so a literal whose number reaches zero is the one the fetched value belongs to.  Same tape format as
 * {@link SatInputDependentMachine}.
 *
 * State families are written with a pattern suffix in the rule table: ".S" stands for either ".Free" or
 * ".Forwarded" and ".B" for either ".T" or ".F".  Symbol classes are "D" (a digit), "B" (a truth value) and "*".
 */
public class SatFixedStateMachine extends VerifierMachine
{
  private static final String CHECK_FORWARDED = "Check.Forwarded";

  private static final Transition DEFAULT_REJECT = new Transition(REJECT_STATE, DELIM, RIGHT);

  private static final List<String> SYMBOLS = MachineSpecification.splitSymbols("_-&#TF0123456789" + BLANK);
  private static final List<String> CERTIFICATE_SYMBOLS = Arrays.asList("T", "F");

  private static final List<String> FIXED_STATES = Arrays.asList(
    "Check.Free", "CheckNot.Free", "Unknown.Free", "UnknownNot.Free", "UnknownTerm.Free", "Skip.Free",
    CHECK_FORWARDED, "CheckNot.Forwarded", "Unknown.Forwarded", "UnknownNot.Forwarded", "UnknownTerm.Forwarded",
    "Skip.Forwarded", "Fetch", "Backward.T", "Backward.F", "BackwardInTerm.T", "BackwardInTerm.F", "Borrow.T",
    "Borrow.F", "BackwardFrom1.T", "BackwardFrom1.F", "Assign.T", "Assign.F", REJECT_STATE, ACCEPT_STATE);

  private final String      mInitialState;
  private final Set<String> mStates;

  public SatFixedStateMachine()
  {
    this(false);
  }

  protected SatFixedStateMachine(boolean xiCheckCertificate)
  {
    // Scan a clause.  Leading zeros are blanked; a literal with a non-zero number isn't known yet.
    mTable.rule("Check.S", "_", "Check.S", "_", RIGHT)
          .rule("Check.S", "-", "CheckNot.S", "-", RIGHT)
          .rule("Check.S", "0", "Unknown.S", "_", RIGHT)
          .rule("Check.S", "D", "UnknownTerm.S", "D", RIGHT)
          .rule("Check.S", "T", "Skip.S", "T", RIGHT)
          .rule("Check.S", "F", "Check.S", "F", RIGHT)
          .rule("Check.S", "&", REJECT_STATE, "_", RIGHT)
          .rule("Check.S", "#", REJECT_STATE, "_", RIGHT)
          .rule("CheckNot.S", "_", "CheckNot.S", "_", RIGHT)
          .rule("CheckNot.S", "T", "Check.S", "T", RIGHT)
          .rule("CheckNot.S", "D", "UnknownTerm.S", "D", RIGHT)
          .rule("CheckNot.S", "0", "Unknown.S", "_", RIGHT)
          .rule("CheckNot.S", "F", "Skip.S", "F", RIGHT)
          .rule("Unknown.S", "_", "Unknown.S", "_", RIGHT)
          .rule("Unknown.S", "0", "Unknown.S", "_", RIGHT)
          .rule("Unknown.S", "D", "UnknownTerm.S", "D", RIGHT)
          .rule("Unknown.S", "T", "Skip.S", "T", RIGHT)
          .rule("Unknown.S", "F", "Unknown.S", "F", RIGHT)
          .rule("Unknown.S", "-", "UnknownNot.S", "-", RIGHT)
          .rule("UnknownTerm.S", "D", "UnknownTerm.S", "D", RIGHT)
          .rule("UnknownTerm.S", "_", "Unknown.S", "_", RIGHT)
          .rule("UnknownTerm.S", "&", "Check.Free", "&", RIGHT)
          .rule("UnknownTerm.S", "#", "Fetch", "#", RIGHT)
          .rule("UnknownNot.S", "T", "Unknown.S", "T", RIGHT)
          .rule("UnknownNot.S", "0", "Unknown.S", "_", RIGHT)
          .rule("UnknownNot.S", "D", "UnknownTerm.S", "D", RIGHT)
          .rule("UnknownNot.S", "F", "Skip.S", "F", RIGHT)
          .rule("UnknownNot.S", "_", "UnknownNot.S", "_", RIGHT)
          .rule("Unknown.S", "&", "Check.Free", "&", RIGHT)
          .rule("Unknown.S", "#", "Fetch", "#", RIGHT)
          .rule("Skip.Free", "&", "Check.Free", "&", RIGHT)
          .rule("Skip.Free", "#", "Fetch", "#", RIGHT)
          .rule("Skip.Forwarded", "&", CHECK_FORWARDED, "&", RIGHT)
          .rule("Skip.Forwarded", "#", ACCEPT_STATE, "#", RIGHT)
          .rule("Skip.S", "*", "Skip.S", "_", RIGHT)

          // Consume the next certificate value.
          .rule("Fetch", "_", "Fetch", "_", RIGHT)
          .rule("Fetch", "T", "Backward.T", "_", LEFT)
          .rule("Fetch", "F", "Backward.F", "_", LEFT)

          // Run back to the start, decrementing every variable number on the way.
          .rule("Backward.B", BLANK, CHECK_FORWARDED, BLANK, RIGHT)
          .rule("BackwardInTerm.B", BLANK, CHECK_FORWARDED, BLANK, RIGHT)
          .rule("Backward.B", "*", "Backward.B", "*", LEFT)
          .rule("BackwardInTerm.B", "D", "BackwardInTerm.B", "D", LEFT)
          .rule("Backward.B", "1", "BackwardFrom1.B", "0", LEFT)
          .rule("Backward.B", "0", "Borrow.B", "9", LEFT)
          .rule("Backward.B", "D", "BackwardInTerm.B", "D-1", LEFT)
          .rule("Borrow.B", "D", "BackwardInTerm.B", "D-1", LEFT)
          .rule("Borrow.B", "0", "Borrow.B", "9", LEFT)
          .rule("BackwardFrom1.B", "D", "BackwardInTerm.B", "D", LEFT)
          .rule("BackwardInTerm.B", "_", "Backward.B", "_", LEFT)
          .rule("BackwardInTerm.B", "&", "Backward.B", "&", LEFT)
          .rule("BackwardInTerm.B", "-", "Backward.B", "-", LEFT)

          // A number just reached zero: write the fetched value over it.
          .rule("BackwardFrom1.B", "_", "Assign.B", "_", RIGHT)
          .rule("BackwardFrom1.B", "-", "Assign.B", "-", RIGHT)
          .rule("BackwardFrom1.B", "&", "Assign.B", "&", RIGHT)
          .rule("BackwardFrom1.B", BLANK, "Assign.B", BLANK, RIGHT)
          .rule("Assign.B", "0", "Backward.B", "B", LEFT);

    Set<String> lStates = new LinkedHashSet<>(FIXED_STATES);
    if (xiCheckCertificate)
    {
      CertificateCheckRules.addTruthValueRules(mTable, CHECK_FORWARDED);
      lStates.addAll(CertificateCheckRules.STATES);
      mInitialState = CertificateCheckRules.INPUT_CHECK;
    }
    else
    {
      mInitialState = CHECK_FORWARDED;
    }
    mStates = Collections.unmodifiableSet(lStates);
  }

  @Override
  public String getName()
  {
    return "SAT (fixed state)";
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

  private static boolean isTruthValue(String xiSymbol)
  {
    return "T".equals(xiSymbol) || "F".equals(xiSymbol);
  }

  @Override
  public Transition delta(String xiState, String xiSymbol)
  {
    String lSuffix = "";
    String lFamily = null;
    int lDot = xiState.indexOf('.');
    if (lDot >= 0)
    {
      lSuffix = xiState.substring(lDot + 1);
      String lAction = xiState.substring(0, lDot);
      if (isDecimalDigit(lSuffix))
      {
        lFamily = lAction + ".D";
      }
      else if (isTruthValue(lSuffix))
      {
        lFamily = lAction + ".B";
      }
      else
      {
        lFamily = lAction + ".S";
      }
    }

    boolean lDigit = isDecimalDigit(xiSymbol);
    List<String> lPatterns = new ArrayList<>(3);
    lPatterns.add(xiSymbol);
    if (lDigit)
    {
      lPatterns.add("D");
    }
    else if (isTruthValue(xiSymbol))
    {
      lPatterns.add("B");
    }
    lPatterns.add("*");

    for (String lPattern : lPatterns)
    {
      String lNextState;
      String lOutput;
      Transition lRule = mTable.get(xiState, lPattern);
      if (lRule != null)
      {
        lNextState = lRule.getNextState();
        lOutput = lRule.getOutput();
      }
      else
      {
        lRule = mTable.get(lFamily, lPattern);
        if (lRule == null)
        {
          continue;
        }
        lNextState = lRule.getNextState();
        lOutput = lRule.getOutput();

        // A truth value carried in the current state is carried on.
        if (lFamily.endsWith(".B"))
        {
          if (lNextState.endsWith(".B"))
          {
            lNextState = instantiate(lNextState, ".B", lSuffix);
          }
          if ("B".equals(lOutput))
          {
            lOutput = lSuffix;
          }
        }
      }

      if (lNextState.endsWith(".B") && isTruthValue(xiSymbol))
      {
        lNextState = instantiate(lNextState, ".B", xiSymbol);
      }
      else if (lNextState.endsWith(".S"))
      {
        lNextState = instantiate(lNextState, ".S", lSuffix);
      }

      if ("D".equals(lOutput) && lDigit)
      {
        lOutput = xiSymbol;
      }
      else if ("D-1".equals(lOutput) && lDigit)
      {
        lOutput = String.valueOf(Integer.parseInt(xiSymbol) - 1);
      }
      if ("*".equals(lOutput))
      {
        lOutput = xiSymbol;
      }
      return new Transition(lNextState, lOutput, lRule.getMove());
    }

    return DEFAULT_REJECT;
  }
}
