package org.npsim.base.util.machine.implementation;

import static org.npsim.base.util.machine.MachineSpecification.BLANK;
import static org.npsim.base.util.machine.MachineSpecification.REJECT_STATE;
import static org.npsim.base.util.machine.Transition.LEFT;
import static org.npsim.base.util.machine.Transition.RIGHT;
import static org.npsim.base.util.machine.VerifierMachine.DELIM;

import java.util.Arrays;
import java.util.List;

import org.npsim.base.util.machine.TransitionTable;

/**
 * Rules for the input-check phase shared by the checking machines.  The phase skips the instance, validates every
 * certificate cell, rewinds to the start of the tape and then hands over to the verifying part of the machine.
 */
final class CertificateCheckRules
{
  static final String INPUT_CHECK = "InputCheck";
  static final String CERTIFICATE_CHECK = "CertificateCheck";
  static final String BACK_TO_BEGINNING = "BackToBeginning";

  static final List<String> STATES = Arrays.asList(INPUT_CHECK, CERTIFICATE_CHECK, BACK_TO_BEGINNING);

  private CertificateCheckRules()
  {
  }

  /**
   * Add rules accepting a certificate of truth values that runs up to the first blank.
   *
   * @param xiTable       - the table to add to.
   * @param xiResumeState - the state in which verification starts at cell 0.
   */
  static void addTruthValueRules(TransitionTable xiTable, String xiResumeState)
  {
    addCommonRules(xiTable, xiResumeState);
    xiTable.rule(CERTIFICATE_CHECK, "T", CERTIFICATE_CHECK, "T", RIGHT)
           .rule(CERTIFICATE_CHECK, "F", CERTIFICATE_CHECK, "F", RIGHT)
           .rule(CERTIFICATE_CHECK, BLANK, BACK_TO_BEGINNING, BLANK, LEFT);
  }

  /**
   * Add rules accepting a certificate of digits and delimiters terminated by ';'.
   *
   * @param xiTable       - the table to add to.
   * @param xiResumeState - the state in which verification starts at cell 0.
   */
  static void addDecimalRules(TransitionTable xiTable, String xiResumeState)
  {
    addCommonRules(xiTable, xiResumeState);
    xiTable.rule(CERTIFICATE_CHECK, "D", CERTIFICATE_CHECK, "D", RIGHT)
           .rule(CERTIFICATE_CHECK, DELIM, CERTIFICATE_CHECK, DELIM, RIGHT)
           .rule(CERTIFICATE_CHECK, ";", BACK_TO_BEGINNING, ";", LEFT);
  }

  private static void addCommonRules(TransitionTable xiTable, String xiResumeState)
  {
    xiTable.rule(INPUT_CHECK, "#", CERTIFICATE_CHECK, "#", RIGHT)
           .rule(INPUT_CHECK, "*", INPUT_CHECK, "*", RIGHT)
           .rule(CERTIFICATE_CHECK, "*", REJECT_STATE, DELIM, LEFT)
           .rule(BACK_TO_BEGINNING, "*", BACK_TO_BEGINNING, "*", LEFT)
           .rule(BACK_TO_BEGINNING, BLANK, xiResumeState, BLANK, RIGHT);
  }
}
