package org.npsim.base.util.graph;

import java.util.Collections;
import java.util.Set;

import org.npsim.base.util.machine.MachineSpecification;
import org.npsim.base.util.machine.Transition;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Table;

/**
 * The configurations of one simulation run: the machine, a memo of its transitions and every vertex created so far.
 *
 * All the graphs of a run share one space.  Vertices are never forgotten, so the set of vertices for a given
 * {@link TransitionCase} only ever grows as new ways of reaching that configuration are discovered.
 */
public class ConfigurationSpace
{
  private final MachineSpecification                 mSpecification;
  private final Table<String, String, Transition>    mTransitions = HashBasedTable.create();
  private final SetMultimap<TransitionCase, Vertex>  mVertices = LinkedHashMultimap.create();

  /**
   * Create an empty configuration space.
   *
   * @param xiSpecification - the machine under simulation.
   */
  public ConfigurationSpace(MachineSpecification xiSpecification)
  {
    mSpecification = xiSpecification;
  }

  public MachineSpecification getSpecification()
  {
    return mSpecification;
  }

  /**
   * @return the configuration with the given coordinates.
   *
   * @param xiIndex  - the cell index.
   * @param xiTier   - the tier.
   * @param xiState  - the state.
   * @param xiSymbol - the symbol in the cell.
   *
   * @throws org.npsim.base.util.machine.exceptions.MachineDefinitionException if the state or symbol is unknown to
   *         the machine, or the machine's transition for them is malformed.
   */
  public TransitionCase getCase(int xiIndex, int xiTier, String xiState, String xiSymbol)
  {
    Transition lTransition = mTransitions.get(xiState, xiSymbol);
    if (lTransition == null)
    {
      lTransition = mSpecification.delta(xiState, xiSymbol);
      mTransitions.put(xiState, xiSymbol, lTransition);
    }
    return new TransitionCase(xiIndex, xiTier, xiState, xiSymbol, lTransition);
  }

  /**
   * @return the floor vertex with the given coordinates.
   *
   * @param xiIndex  - the cell index.
   * @param xiState  - the state.
   * @param xiSymbol - the symbol in the cell.
   */
  public Vertex getFloorVertex(int xiIndex, String xiState, String xiSymbol)
  {
    return getVertex(getCase(xiIndex, 0, xiState, xiSymbol), null);
  }

  /**
   * @return the vertex for a configuration and its predecessor.
   *
   * @param xiCase        - the configuration.
   * @param xiPredecessor - the configuration one tier below which justifies it, or null for a floor configuration.
   *
   * @throws IllegalArgumentException if the predecessor doesn't fit the configuration.
   */
  public Vertex getVertex(TransitionCase xiCase, TransitionCase xiPredecessor)
  {
    Vertex lVertex = new Vertex(xiCase, xiPredecessor);
    mVertices.put(xiCase, lVertex);
    return lVertex;
  }

  /**
   * @return every vertex created so far for the given configuration.
   *
   * @param xiCase - the configuration.
   */
  public Set<Vertex> getVerticesOf(TransitionCase xiCase)
  {
    return Collections.unmodifiableSet(mVertices.get(xiCase));
  }
}
