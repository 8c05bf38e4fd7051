 /*
    This file is part of coalescence.

    coalescence is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    coalescence is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with coalescence.  If not, see <http://www.gnu.org/licenses/>.
  */


package edu.berkeley.coalescence.genealogy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.OutOfRangeException;

import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongIntHashMap;

/**
 * Undirected graph with weighted edges, whose nodes are labeled by (generation, representative).
 * Only built inside this package; outside it the graph is read-only.
 */
public class AncestryGraph {

	public static class Node {
		public final int generation;
		public final int representative;

		public Node (int generation, int representative) {
			this.generation = generation;
			this.representative = representative;
		}

		public boolean equals (Object o) {
			if (o == null || this.getClass() != o.getClass()) return false;
			Node other = (Node) o;
			return this.generation == other.generation && this.representative == other.representative;
		}

		public int hashCode() {
			return 31 * this.generation + this.representative;
		}

		public String toString () {
			return "(" + this.generation + ", " + this.representative + ")";
		}
	}

	public static class Edge {
		public final int firstNode;
		public final int secondNode;
		public final double weight;

		public Edge (int firstNode, int secondNode, double weight) {
			this.firstNode = firstNode;
			this.secondNode = secondNode;
			this.weight = weight;
		}

		public int opposite (int node) {
			assert (node == this.firstNode || node == this.secondNode);
			return node == this.firstNode ? this.secondNode : this.firstNode;
		}

		public String toString () {
			return this.firstNode + " -- " + this.secondNode + " [" + this.weight + "]";
		}
	}

	private final List<Node> nodes = new ArrayList<Node>();
	private final List<Edge> edges = new ArrayList<Edge>();
	// edge indices incident to each node
	private final List<TIntArrayList> incidentEdges = new ArrayList<TIntArrayList>();
	private final TLongIntHashMap nodeIndex = new TLongIntHashMap (Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, Long.MIN_VALUE, -1);

	int addNode (int generation, int representative) {
		long key = nodeKey (generation, representative);
		assert (!this.nodeIndex.containsKey (key));
		int idx = this.nodes.size();
		this.nodes.add (new Node (generation, representative));
		this.incidentEdges.add (new TIntArrayList());
		this.nodeIndex.put (key, idx);
		return idx;
	}

	int addEdge (int firstNode, int secondNode, double weight) {
		this.checkNode (firstNode);
		this.checkNode (secondNode);
		int idx = this.edges.size();
		this.edges.add (new Edge (firstNode, secondNode, weight));
		this.incidentEdges.get (firstNode).add (idx);
		if (secondNode != firstNode) this.incidentEdges.get (secondNode).add (idx);
		return idx;
	}

	public int getNodeCount() {
		return this.nodes.size();
	}

	public int getEdgeCount() {
		return this.edges.size();
	}

	public Node getNode (int idx) {
		this.checkNode (idx);
		return this.nodes.get (idx);
	}

	public Edge getEdge (int idx) {
		if (idx < 0 || idx >= this.edges.size()) throw new OutOfRangeException (idx, 0, this.edges.size() - 1);
		return this.edges.get (idx);
	}

	public List<Node> getNodes() {
		return Collections.unmodifiableList (this.nodes);
	}

	public List<Edge> getEdges() {
		return Collections.unmodifiableList (this.edges);
	}

	/**
	 * Index of the node with this label, or -1 if there is none.
	 */
	public int indexOf (int generation, int representative) {
		return this.nodeIndex.get (nodeKey (generation, representative));
	}

	public int[] getNeighbors (int node) {
		this.checkNode (node);
		TIntArrayList incident = this.incidentEdges.get (node);
		int[] neighbors = new int[incident.size()];
		for (int i = 0; i < incident.size(); i++) {
			neighbors[i] = this.edges.get (incident.get (i)).opposite (node);
		}
		return neighbors;
	}

	public int getDegree (int node) {
		this.checkNode (node);
		return this.incidentEdges.get (node).size();
	}

	public double getTotalWeight() {
		double total = 0d;
		for (Edge edge : this.edges) total += edge.weight;
		return total;
	}

	private void checkNode (int idx) {
		if (idx < 0 || idx >= this.nodes.size()) throw new OutOfRangeException (idx, 0, this.nodes.size() - 1);
	}

	private static long nodeKey (int generation, int representative) {
		return (((long) generation) << 32) | (representative & 0xffffffffL);
	}
}
