package org.npsim.base.simulation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.npsim.base.util.graph.ConfigurationSpace;
import org.npsim.base.util.graph.DynamicComputationGraph;
import org.npsim.base.util.graph.Edge;
import org.npsim.base.util.graph.TransitionCase;
import org.npsim.base.util.graph.Vertex;
import org.npsim.base.util.logging.SimulationLogging;
import org.npsim.base.util.machine.MachineSpecification;

/**
 * The computation graph of a verifier on a concrete tape: knows the input, the certificate length and the
 * certificate alphabet, and so can say which edges may follow a vertex.
 *
 * Cells 0 to |input| - 1 hold the input, the next m cells hold the certificate (any certificate symbol) and every
 * other cell is blank.
 */
public class VerifierComputationGraph extends DynamicComputationGraph
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final List<String> mInput;
  private final int          mCertificateLength;

  /**
   * Create the graph for a run.
   *
   * @param xiSpace             - the configurations of the run.
   * @param xiInput             - the input symbols.  Not empty.
   * @param xiCertificateLength - the number of certificate cells after the input.
   */
  public VerifierComputationGraph(ConfigurationSpace xiSpace, List<String> xiInput, int xiCertificateLength)
  {
    super(xiSpace);

    if (xiInput.isEmpty())
    {
      throw new IllegalArgumentException("The input must not be empty");
    }
    if (xiCertificateLength < 0)
    {
      throw new IllegalArgumentException("Negative certificate length " + xiCertificateLength);
    }
    for (String lSymbol : xiInput)
    {
      xiSpace.getSpecification().checkSymbol(lSymbol);
    }

    mInput = Collections.unmodifiableList(xiInput);
    mCertificateLength = xiCertificateLength;
  }

  public List<String> getInput()
  {
    return mInput;
  }

  public int getCertificateLength()
  {
    return mCertificateLength;
  }

  /**
   * @return the initial vertex: the initial state reading the first input symbol.
   */
  public Vertex getInitialVertex()
  {
    return getSpace().getFloorVertex(0, getSpace().getSpecification().getInitialState(), mInput.get(0));
  }

  /**
   * @return the edges from a vertex to the floor vertices of the cell it moves to.  More than one only when that
   *         cell holds a certificate symbol.
   *
   * @param xiVertex - the vertex.
   */
  public Set<Edge> getFloorNextEdges(Vertex xiVertex)
  {
    Set<Edge> lEdges = new LinkedHashSet<>();
    ConfigurationSpace lSpace = getSpace();
    int lIndex = xiVertex.getNextIndex();
    String lState = xiVertex.getNextState();

    if ((lIndex < 0) || (lIndex >= mInput.size() + mCertificateLength))
    {
      LOGGER.debug("Empty string area accessed with index " + lIndex);
      lEdges.add(new Edge(xiVertex, lSpace.getFloorVertex(lIndex, lState, MachineSpecification.BLANK)));
    }
    else if (lIndex < mInput.size())
    {
      lEdges.add(new Edge(xiVertex, lSpace.getFloorVertex(lIndex, lState, mInput.get(lIndex))));
    }
    else
    {
      LOGGER.log(SimulationLogging.VERBOSE, "Certificate cell " + lIndex + " entered from " + xiVertex);
      for (String lSymbol : lSpace.getSpecification().getCertificateSymbols())
      {
        lEdges.add(new Edge(xiVertex, lSpace.getFloorVertex(lIndex, lState, lSymbol)));
      }
    }
    return lEdges;
  }

  /**
   * @return the edges from a vertex into the cell it moves to, one above each of the given ceiling edges.  A null
   *         ceiling edge stands for the floor of that cell.
   *
   * @param xiVertex       - the vertex.
   * @param xiCeilingEdges - edges ending at a vertex of xiVertex's cell and starting in the cell xiVertex moves to.
   */
  public Set<Edge> getNextEdgesAbovePreds(Vertex xiVertex, Collection<Edge> xiCeilingEdges)
  {
    Set<Edge> lEdges = new LinkedHashSet<>();
    for (Edge lCeiling : xiCeilingEdges)
    {
      if (lCeiling == null)
      {
        lEdges.addAll(getFloorNextEdges(xiVertex));
        continue;
      }

      Vertex lBelow = lCeiling.getFrom();
      assert (lCeiling.getTo().getIndex() == xiVertex.getIndex()) && (xiVertex.getNextIndex() == lBelow.getIndex()) :
        "Not a ceiling edge of " + xiVertex + ": " + lCeiling;

      TransitionCase lCase = getSpace().getCase(lBelow.getIndex(),
                                                lBelow.getTier() + 1,
                                                xiVertex.getNextState(),
                                                lBelow.getOutput());
      lEdges.add(new Edge(xiVertex, getSpace().getVertex(lCase, lBelow.getCase())));
    }
    return lEdges;
  }

  @Override
  public String toString()
  {
    return "VerifierComputationGraph(|input|=" + mInput.size() + ", m=" + mCertificateLength + ")";
  }
}
