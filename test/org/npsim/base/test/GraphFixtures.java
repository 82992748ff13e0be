package org.npsim.base.test;

import java.util.Arrays;
import java.util.Collections;

import org.npsim.base.util.graph.ConfigurationSpace;
import org.npsim.base.util.graph.Vertex;
import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;
import org.npsim.base.util.machine.TransitionOracle;

/**
 * A two-state toy machine and helpers for building small graphs by hand.
 *
 * State A moves right into B, B moves left into A, and neither changes the symbol.
 */
final class GraphFixtures
{
  static final TransitionOracle ORACLE = new TransitionOracle()
  {
    @Override
    public Transition delta(String xiState, String xiSymbol)
    {
      if ("A".equals(xiState))
      {
        return new Transition("B", xiSymbol, Transition.RIGHT);
      }
      if ("B".equals(xiState))
      {
        return new Transition("A", xiSymbol, Transition.LEFT);
      }
      return new Transition(xiState, xiSymbol, Transition.RIGHT);
    }
  };

  private GraphFixtures()
  {
  }

  static MachineSpecification createSpecification()
  {
    return new MachineSpecification("A",
                                    Arrays.asList("A", "B"),
                                    Arrays.asList("0", "1"),
                                    Collections.<String>emptyList(),
                                    ORACLE);
  }

  static ConfigurationSpace createSpace()
  {
    return new ConfigurationSpace(createSpecification());
  }

  static Vertex floor(ConfigurationSpace xiSpace, int xiIndex, String xiState, String xiSymbol)
  {
    return xiSpace.getFloorVertex(xiIndex, xiState, xiSymbol);
  }

  /**
   * @return two vertices of the same tier-1 configuration at a cell, one above (A,0) and one above (B,0).  The toy
   *         machine writes what it reads, so both predecessors leave the same symbol behind.
   */
  static Vertex[] siblings(ConfigurationSpace xiSpace, int xiIndex, String xiState)
  {
    return new Vertex[] {above(xiSpace, floor(xiSpace, xiIndex, "A", "0"), xiState),
                         above(xiSpace, floor(xiSpace, xiIndex, "B", "0"), xiState)};
  }

  /**
   * @return the vertex one tier above xiBelow, in the given state, reading what xiBelow wrote.
   */
  static Vertex above(ConfigurationSpace xiSpace, Vertex xiBelow, String xiState)
  {
    return xiSpace.getVertex(xiSpace.getCase(xiBelow.getIndex(), xiBelow.getTier() + 1, xiState, xiBelow.getOutput()),
                             xiBelow.getCase());
  }
}
