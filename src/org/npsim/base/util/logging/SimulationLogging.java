package org.npsim.base.util.logging;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.Level;

/**
 * Logging helpers shared by the simulation.
 */
public final class SimulationLogging
{
  /**
   * Per-step tracing of feasible graph computation, walk pruning and verification.  Sits between DEBUG and TRACE.
   */
  public static final Level VERBOSE = Level.forName("VERBOSE", 550);

  private SimulationLogging()
  {
  }

  /**
   * @return the tape content for logging.  If it carries a certificate, the instance part before the '#' is cut to
   *         the given width and marked with an ellipsis.
   *
   * @param xiTape  - the tape content.
   * @param xiWidth - the maximum width of the instance part.
   */
  public static String abbreviateTape(String xiTape, int xiWidth)
  {
    if (!StringUtils.contains(xiTape, '#'))
    {
      return xiTape;
    }
    return StringUtils.left(StringUtils.substringBefore(xiTape, "#"), xiWidth) + "...#" +
           StringUtils.substringAfter(xiTape, "#");
  }
}
