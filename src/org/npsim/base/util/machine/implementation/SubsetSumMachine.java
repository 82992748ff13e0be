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
 * Base-10 Subset-Sum verifier.
 *
 * The tape is "&lt;target&gt;_@_&lt;a&gt;_&lt;b&gt;...#&lt;c&gt;_&lt;d&gt;..._;" - the target, the multiset and,
 * after '#', the certificate listing the chosen elements.  For each certificate element the machine marks its
 * digits against an element of the multiset (circled digits), subtracts the matched element from the target with
 * decimal borrow, and erases it.  It accepts when the certificate is used up and the target has become zero.
 *
 * Rule patterns: a ".M" state carries one digit; symbol classes are "M" and "D" (plain digits, "M" only matching
 * the digit carried in the state), "Ⓜ" and "Ⓓ" (circled digits) and "*".  The output "Ⓓ-Ⓜ" is the circled
 * difference of the two digits, with the borrow recorded in the next state.
 */
public class SubsetSumMachine extends VerifierMachine
{
  private static final String FORWARD = "Forward";

  private static final char CIRCLED_ZERO = '⓪';
  private static final char CIRCLED_ONE = '①';
  private static final char CIRCLED_NINE = '⑨';

  private static final String PLAIN_M = "M";
  private static final String PLAIN_D = "D";
  private static final String CIRCLED_M = "Ⓜ";
  private static final String CIRCLED_D = "Ⓓ";
  private static final String DIFFERENCE = CIRCLED_D + "-" + CIRCLED_M;

  private static final Transition DEFAULT_REJECT = new Transition(REJECT_STATE, DELIM, LEFT);

  private static final List<String> SYMBOLS = MachineSpecification.splitSymbols(
    "#$;|_~@0123456789⓪①②③④⑤⑥⑦⑧⑨" + BLANK);
  private static final List<String> CERTIFICATE_SYMBOLS = MachineSpecification.splitSymbols(";_0123456789");

  private static final List<String> FIXED_STATES = Arrays.asList(
    FORWARD, "FindDigitToMatch", "SubtractionDigit", "MatchedDigits", "BackwardAfterMatching", "CheckForward",
    "BackwardToCheckMatch", "CheckSum", "BackwardToCheckSum", "Borrow.0", "Borrow.1", REJECT_STATE, ACCEPT_STATE);

  private static final List<String> DIGIT_FAMILIES = Arrays.asList(
    "BackwardToMatch", "MatchPosition", "BackwardToSubtract", "SumArea", "Subtract");

  private final String      mInitialState;
  private final Set<String> mStates;

  public SubsetSumMachine()
  {
    this(false);
  }

  protected SubsetSumMachine(boolean xiCheckCertificate)
  {
    // Find the next certificate digit to match.
    mTable.rule(FORWARD, "#", "FindDigitToMatch", "#", RIGHT)
          .rule(FORWARD, "*", FORWARD, "*", RIGHT)
          .rule("FindDigitToMatch", "~", "FindDigitToMatch", "~", RIGHT)
          .rule("FindDigitToMatch", PLAIN_M, "BackwardToMatch.M", "~", LEFT)
          .rule("FindDigitToMatch", CIRCLED_D, "FindDigitToMatch", CIRCLED_D, RIGHT)
          .rule("FindDigitToMatch", "_", "BackwardToCheckMatch", "~", LEFT)
          .rule("FindDigitToMatch", ";", "BackwardToCheckSum", ";", LEFT)

          // Match it against the next free digit of some element.
          .rule("BackwardToMatch.M", "_", "MatchPosition.M", "|", RIGHT)
          .rule("BackwardToMatch.M", PLAIN_D, "BackwardToMatch.M", PLAIN_D, LEFT)
          .rule("BackwardToMatch.M", "|", "BackwardToMatch.M", "|", LEFT)
          .rule("BackwardToMatch.M", "~", "BackwardToMatch.M", "~", LEFT)
          .rule("BackwardToMatch.M", "#", "BackwardToMatch.M", "#", LEFT)
          .rule("BackwardToMatch.M", CIRCLED_D, "MatchPosition.M", PLAIN_D, RIGHT)
          .rule("MatchPosition.M", "|", "BackwardToMatch.M", "|", LEFT)
          .rule("MatchPosition.M", "~", "BackwardToMatch.M", "~", LEFT)
          .rule("MatchPosition.M", PLAIN_M, "BackwardToMatch.M", CIRCLED_M, LEFT)
          .rule("MatchPosition.M", PLAIN_D, "BackwardToMatch.M", PLAIN_D, LEFT)
          .rule("BackwardToMatch.M", "@", "CheckForward", "@", LEFT)

          .rule("CheckForward", CIRCLED_D, FORWARD, CIRCLED_D, RIGHT)
          .rule("CheckForward", "*", "CheckForward", "*", RIGHT)
          .rule("CheckForward", "#", REJECT_STATE, "_", LEFT)

          // Check that a whole element matched and restore its marks.
          .rule("BackwardToCheckMatch", "#", "MatchedDigits", "#", LEFT)
          .rule("BackwardToCheckMatch", "|", "MatchedDigits", "_", LEFT)
          .rule("BackwardToCheckMatch", CIRCLED_D, "BackwardToCheckMatch", PLAIN_D, LEFT)
          .rule("BackwardToCheckMatch", "*", "BackwardToCheckMatch", "*", LEFT)
          .rule("BackwardToCheckMatch", "@", REJECT_STATE, "_", LEFT)
          .rule("MatchedDigits", CIRCLED_M, "BackwardToSubtract.M", "$", LEFT)
          .rule("MatchedDigits", PLAIN_D, "BackwardToCheckMatch", PLAIN_D, LEFT)
          .rule("MatchedDigits", "~", "BackwardToCheckMatch", "~", LEFT)
          .rule("BackwardToSubtract.M", "*", "BackwardToSubtract.M", "*", LEFT)

          // Subtract the matched element digit by digit.
          .rule("BackwardToSubtract.M", "@", "SumArea.M", "@", LEFT)
          .rule(FORWARD, "$", "SubtractionDigit", "~", LEFT)
          .rule("SubtractionDigit", PLAIN_M, "BackwardToSubtract.M", "$", LEFT)
          .rule("SubtractionDigit", "|", "BackwardAfterMatching", "_", LEFT)

          // Erase the matched element.
          .rule("BackwardAfterMatching", "|", "BackwardAfterMatching", "_", LEFT)
          .rule("BackwardAfterMatching", CIRCLED_D, "BackwardAfterMatching", PLAIN_D, LEFT)
          .rule("BackwardAfterMatching", BLANK, FORWARD, BLANK, RIGHT)
          .rule("BackwardAfterMatching", "*", "BackwardAfterMatching", "*", LEFT)

          // The remaining target must be zero.
          .rule("BackwardToCheckSum", "@", "CheckSum", "@", LEFT)
          .rule("BackwardToCheckSum", CIRCLED_D, REJECT_STATE, "_", LEFT)
          .rule("BackwardToCheckSum", "*", "BackwardToCheckSum", "*", LEFT)
          .rule("CheckSum", "_", "CheckSum", "_", LEFT)
          .rule("CheckSum", "0", "CheckSum", "0", LEFT)
          .rule("CheckSum", BLANK, ACCEPT_STATE, "_", LEFT)
          .rule("CheckSum", "*", REJECT_STATE, "_", LEFT)

          .rule("SumArea.M", PLAIN_D, "SumArea.M", PLAIN_D, LEFT)
          .rule("SumArea.M", "|", "SumArea.M", "|", LEFT)
          .rule("SumArea.M", "_", "Subtract.M", "|", LEFT)
          .rule("SumArea.M", CIRCLED_D, "Subtract.M", PLAIN_D, LEFT)
          .rule("Subtract.M", PLAIN_D, "Borrow.B", DIFFERENCE, LEFT)
          .rule("Borrow.0", "*", FORWARD, "*", RIGHT)
          .rule("Borrow.1", "0", "Borrow.1", "9", LEFT)
          .rule("Borrow.1", PLAIN_D, FORWARD, "D-1", RIGHT)
          .rule("Borrow.1", BLANK, REJECT_STATE, "_", LEFT);

    Set<String> lStates = new LinkedHashSet<>(FIXED_STATES);
    for (int lDigit = 0; lDigit < 10; lDigit++)
    {
      for (String lFamily : DIGIT_FAMILIES)
      {
        lStates.add(lFamily + "." + lDigit);
      }
    }
    if (xiCheckCertificate)
    {
      CertificateCheckRules.addDecimalRules(mTable, FORWARD);
      lStates.addAll(CertificateCheckRules.STATES);
      mInitialState = CertificateCheckRules.INPUT_CHECK;
    }
    else
    {
      mInitialState = FORWARD;
    }
    mStates = Collections.unmodifiableSet(lStates);
  }

  /**
   * @return the certificate length to simulate for a tape with an empty certificate: the number of characters
   *         between '@' and '#'.
   *
   * @param xiTape - the tape, e.g. "28_@_42_20_3_5#".
   */
  public static int getCertificateLength(String xiTape)
  {
    return xiTape.indexOf('#') - xiTape.indexOf('@') - 1;
  }

  @Override
  public String getName()
  {
    return "Subset-Sum";
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

  /**
   * @return the value of a circled digit, or -1 if the symbol isn't one.
   */
  private static int circledValue(String xiSymbol)
  {
    if (xiSymbol.length() != 1)
    {
      return -1;
    }
    char lChar = xiSymbol.charAt(0);
    if (lChar == CIRCLED_ZERO)
    {
      return 0;
    }
    if ((lChar >= CIRCLED_ONE) && (lChar <= CIRCLED_NINE))
    {
      return lChar - CIRCLED_ONE + 1;
    }
    return -1;
  }

  private static String circled(int xiValue)
  {
    return String.valueOf(xiValue == 0 ? CIRCLED_ZERO : (char)(CIRCLED_ONE + xiValue - 1));
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
      if (isDecimalDigit(lAddress))
      {
        lFamily = xiState.substring(0, lDot) + ".M";
      }
    }

    List<String> lPatterns = new ArrayList<>(4);
    lPatterns.add(xiSymbol);
    if (isDecimalDigit(xiSymbol))
    {
      lPatterns.add(PLAIN_M);
      lPatterns.add(PLAIN_D);
    }
    else if (circledValue(xiSymbol) >= 0)
    {
      lPatterns.add(CIRCLED_M);
      lPatterns.add(CIRCLED_D);
    }
    lPatterns.add("*");

    for (String lPattern : lPatterns)
    {
      Transition lResult = tryRule(xiState, lFamily, lAddress, xiSymbol, lPattern);
      if (lResult != null)
      {
        return lResult;
      }
    }
    return DEFAULT_REJECT;
  }

  private Transition tryRule(String xiState, String xiFamily, String xiAddress, String xiSymbol, String xiPattern)
  {
    int lM = -1;
    int lD = -1;

    Transition lRule = mTable.get(xiState, xiPattern);
    if (lRule == null)
    {
      lRule = mTable.get(xiFamily, xiPattern);
      if (lRule == null)
      {
        return null;
      }

      // "M" against a digit-carrying state only matches that digit.
      if (PLAIN_M.equals(xiPattern) && !xiAddress.equals(xiSymbol))
      {
        return null;
      }
      lM = Integer.parseInt(xiAddress);
    }

    if (PLAIN_M.equals(xiPattern))
    {
      lM = Integer.parseInt(xiSymbol);
    }
    else if (CIRCLED_M.equals(xiPattern))
    {
      lM = circledValue(xiSymbol);
    }
    else if (PLAIN_D.equals(xiPattern))
    {
      lD = Integer.parseInt(xiSymbol);
    }
    else if (CIRCLED_D.equals(xiPattern))
    {
      lD = circledValue(xiSymbol);
    }

    String lNextState = lRule.getNextState();
    String lOutput = lRule.getOutput();

    if (lNextState.endsWith(".M") && (lM >= 0))
    {
      lNextState = instantiate(lNextState, ".M", String.valueOf(lM));
    }
    else if (lNextState.endsWith(".B") && DIFFERENCE.equals(lOutput) && (lD >= 0) && (lM >= 0))
    {
      int lBorrow = (lD < lM) ? 1 : 0;
      return new Transition(instantiate(lNextState, ".B", String.valueOf(lBorrow)),
                            circled((10 + lD - lM) % 10),
                            lRule.getMove());
    }

    if (CIRCLED_M.equals(lOutput))
    {
      lOutput = circled(lM);
    }
    else if (PLAIN_D.equals(lOutput) && (lD >= 0))
    {
      lOutput = String.valueOf(lD);
    }
    else if ("D-1".equals(lOutput) && (lD >= 0))
    {
      lOutput = String.valueOf(lD - 1);
    }
    else if (CIRCLED_D.equals(lOutput) && (lD >= 0))
    {
      lOutput = circled(lD);
    }
    else if ("*".equals(lOutput))
    {
      lOutput = xiSymbol;
    }

    assert !lOutput.equals(PLAIN_M) && !lOutput.equals(PLAIN_D) &&
           !lOutput.equals(CIRCLED_M) && !lOutput.equals(CIRCLED_D) :
           "Uninstantiated output " + lOutput + " from (" + xiState + "," + xiSymbol + ")";

    return new Transition(lNextState, lOutput, lRule.getMove());
  }
}
