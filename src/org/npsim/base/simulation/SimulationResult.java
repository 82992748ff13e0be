package org.npsim.base.simulation;

/**
 * The outcome of simulating a verifier over all certificates.
 */
public class SimulationResult
{
  /**
   * Whether some certificate is accepted.
   */
  public static enum Answer
  {
    YES("Yes"),
    NO("No");

    private final String mText;

    private Answer(String xiText)
    {
      mText = xiText;
    }

    @Override
    public String toString()
    {
      return mText;
    }
  }

  private final Answer               mAnswer;
  private final String               mAcceptedTape;
  private final String               mWitness;
  private final SimulationStatistics mStatistics;

  /**
   * Create a result.
   *
   * @param xiAnswer       - the answer.
   * @param xiAcceptedTape - the tape content the accepting walk read, or null.
   * @param xiWitness      - the accepted certificate, or null.
   * @param xiStatistics   - the run statistics.
   */
  public SimulationResult(Answer xiAnswer,
                          String xiAcceptedTape,
                          String xiWitness,
                          SimulationStatistics xiStatistics)
  {
    mAnswer = xiAnswer;
    mAcceptedTape = xiAcceptedTape;
    mWitness = xiWitness;
    mStatistics = xiStatistics;
  }

  public Answer getAnswer()
  {
    return mAnswer;
  }

  public boolean isAccepted()
  {
    return mAnswer == Answer.YES;
  }

  /**
   * @return the tape content read by the accepting walk, with blanks stripped from both ends, or null if nothing
   *         was accepted.
   */
  public String getAcceptedTape()
  {
    return mAcceptedTape;
  }

  /**
   * @return the accepted certificate (the tape after the '#'), or null if nothing was accepted or the certificate
   *         was given on the tape.
   */
  public String getWitness()
  {
    return mWitness;
  }

  public SimulationStatistics getStatistics()
  {
    return mStatistics;
  }

  @Override
  public String toString()
  {
    return mAnswer.toString();
  }
}
