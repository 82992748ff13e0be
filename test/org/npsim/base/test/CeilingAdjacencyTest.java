package org.npsim.base.test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.npsim.base.util.graph.CeilingAdjacency;
import org.npsim.base.util.graph.ConfigurationSpace;
import org.npsim.base.util.graph.DynamicComputationGraph;
import org.npsim.base.util.graph.Edge;
import org.npsim.base.util.graph.Vertex;

/**
 * Unit tests for ceiling adjacency and the path filters.
 */
public class CeilingAdjacencyTest extends Assert
{
  private ConfigurationSpace      mSpace;
  private DynamicComputationGraph mGraph;

  // A floor walk right along cells 0..3.
  private Vertex c0, c1, c2, c3;
  private Edge   e01, e12, e23;

  @Before
  public void setUp()
  {
    mSpace = GraphFixtures.createSpace();
    mGraph = new DynamicComputationGraph(mSpace);

    c0 = GraphFixtures.floor(mSpace, 0, "A", "0");
    c1 = GraphFixtures.floor(mSpace, 1, "A", "0");
    c2 = GraphFixtures.floor(mSpace, 2, "A", "0");
    c3 = GraphFixtures.floor(mSpace, 3, "A", "0");
    e01 = new Edge(c0, c1);
    e12 = new Edge(c1, c2);
    e23 = new Edge(c2, c3);
  }

  private void addChain()
  {
    mGraph.addEdge(e01);
    mGraph.addEdge(e12);
    mGraph.addEdge(e23);
  }

  @Test
  public void testForwardCeilingStopsAtNonFoldingPrecedent()
  {
    Vertex lBelow = GraphFixtures.floor(mSpace, 0, "A", "0");
    Vertex lTarget = GraphFixtures.above(mSpace, lBelow, "B");
    Edge lFloorEdge = new Edge(GraphFixtures.floor(mSpace, 1, "B", "0"), lBelow);
    Edge lEdge = new Edge(GraphFixtures.floor(mSpace, 1, "A", "0"), lTarget);
    mGraph.addEdge(lFloorEdge);
    mGraph.addEdge(lEdge);

    Set<Edge> lCeiling = CeilingAdjacency.getForwardWeakCeilingAdjacentEdges(mGraph, lEdge);
    assertEquals(Collections.singleton(lFloorEdge), lCeiling);

    // Once the precedent folds the search drops through it, and there's nothing under the floor.
    mGraph.addEdge(new Edge(lBelow, GraphFixtures.floor(mSpace, 1, "A", "1")));
    assertTrue(mGraph.isFoldingNode(lBelow));
    assertTrue(CeilingAdjacency.getForwardWeakCeilingAdjacentEdges(mGraph, lEdge).isEmpty());
  }

  @Test
  public void testForwardCeilingOfHaltingEdgeIsEmpty()
  {
    Vertex lHalt = GraphFixtures.floor(mSpace, 0, "Accept", "0");
    Edge lEdge = new Edge(GraphFixtures.floor(mSpace, 1, "B", "0"), lHalt);
    mGraph.addEdge(lEdge);
    mGraph.addEdge(new Edge(GraphFixtures.floor(mSpace, 1, "A", "1"), lHalt));

    assertTrue(lHalt.isHalting());
    assertTrue(CeilingAdjacency.getForwardWeakCeilingAdjacentEdges(mGraph, lEdge).isEmpty());
  }

  @Test
  public void testFilterWithPathBackward()
  {
    addChain();
    Edge lUnrelated = new Edge(GraphFixtures.floor(mSpace, 2, "B", "1"), GraphFixtures.floor(mSpace, 1, "B", "1"));
    mGraph.addEdge(lUnrelated);

    assertEquals(Collections.singleton(e01),
                 CeilingAdjacency.filterWithPathBackward(mGraph, e23, Arrays.asList(e01, lUnrelated)));
    assertTrue(CeilingAdjacency.filterWithPathBackward(mGraph, e23, Collections.<Edge>emptyList()).isEmpty());
  }

  @Test
  public void testFilterWithPathBackwardStopsWhereTargetLeaves()
  {
    addChain();

    // The target moves back left, so the search doesn't go past the edge's own slice.
    Vertex lTurn = GraphFixtures.floor(mSpace, 3, "B", "0");
    Edge lTurnEdge = new Edge(c2, lTurn);
    mGraph.addEdge(lTurnEdge);
    assertEquals(2, lTurn.getNextIndex());

    Set<Edge> lFiltered = CeilingAdjacency.filterWithPathBackward(mGraph, lTurnEdge, Arrays.asList(e12, lTurnEdge));
    assertEquals(Collections.singleton(lTurnEdge), lFiltered);
  }

  @Test
  public void testFilterWithPathForward()
  {
    addChain();
    Edge lUnrelated = new Edge(GraphFixtures.floor(mSpace, 2, "B", "1"), GraphFixtures.floor(mSpace, 1, "B", "1"));
    mGraph.addEdge(lUnrelated);

    assertEquals(Collections.singleton(e23),
                 CeilingAdjacency.filterWithPathForward(mGraph, e01, Arrays.asList(e23, lUnrelated)));
  }

  @Test
  public void testFilterWithPathForwardDoesNotReturnToStartSlice()
  {
    addChain();
    Vertex lBack = GraphFixtures.floor(mSpace, 0, "B", "1");
    Edge lReturn = new Edge(c1, lBack);
    Edge lBeyond = new Edge(lBack, GraphFixtures.floor(mSpace, 1, "B", "1"));
    mGraph.addEdge(lReturn);
    mGraph.addEdge(lBeyond);

    // The returning edge is found, but nothing after it.
    Set<Edge> lFiltered = CeilingAdjacency.filterWithPathForward(mGraph, e01, Arrays.asList(lReturn, lBeyond, e23));
    assertEquals(2, lFiltered.size());
    assertTrue(lFiltered.contains(lReturn));
    assertTrue(lFiltered.contains(e23));
    assertFalse(lFiltered.contains(lBeyond));
  }
}
