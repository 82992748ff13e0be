package org.npsim.base.util.graph;

import java.util.Collections;
import java.util.Set;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * The vertices a graph has seen, indexed by configuration and by predecessor configuration.
 *
 * A vertex is registered when the first edge touching it is added.  Registration is never undone, even when the
 * edge is removed again.  A graph and its copies share one registry; every fresh graph starts with its own.
 */
public class VertexRegistry
{
  private final SetMultimap<TransitionCase, Vertex> mByCase = LinkedHashMultimap.create();
  private final SetMultimap<TransitionCase, Vertex> mByPredecessor = LinkedHashMultimap.create();

  /**
   * Register a vertex.  Idempotent.
   *
   * @param xiVertex - the vertex.
   */
  public void register(Vertex xiVertex)
  {
    if (mByCase.put(xiVertex.getCase(), xiVertex) && (xiVertex.getPredecessor() != null))
    {
      mByPredecessor.put(xiVertex.getPredecessor(), xiVertex);
    }
  }

  public boolean isRegistered(Vertex xiVertex)
  {
    return mByCase.containsEntry(xiVertex.getCase(), xiVertex);
  }

  /**
   * @return the registered vertices for a configuration.
   *
   * @param xiCase - the configuration.
   */
  public Set<Vertex> getVerticesOf(TransitionCase xiCase)
  {
    return Collections.unmodifiableSet(mByCase.get(xiCase));
  }

  /**
   * @return the registered vertices justified by a configuration.
   *
   * @param xiPredecessor - the configuration one tier below.
   */
  public Set<Vertex> getVerticesAbove(TransitionCase xiPredecessor)
  {
    return Collections.unmodifiableSet(mByPredecessor.get(xiPredecessor));
  }

  public int size()
  {
    return mByCase.size();
  }
}
