package lltool.analysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import guru.nidi.graphviz.attribute.Color;
import guru.nidi.graphviz.attribute.Font;
import guru.nidi.graphviz.attribute.Style;
import guru.nidi.graphviz.engine.Engine;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.Graph;
import guru.nidi.graphviz.model.MutableNode;

import lltool.grammar.Grammar;
import lltool.grammar.NonTerminal;
import lltool.grammar.Production;
import lltool.grammar.Symbol;

import static guru.nidi.graphviz.model.Factory.*;

/**
 * Graph that links a non terminal A to a non terminal B if a production of A starts with B, possibly after
 * nullable non terminals. A is left recursive (directly or indirectly) iff it lies on a cycle of this graph.
 */
public class LeftReferenceGraph {

	/**
	 * An edge of the graph
	 */
	public static class Edge {

		public final NonTerminal from;
		public final NonTerminal to;
		/**
		 * Is the target preceded by nullable non terminals?
		 */
		public final boolean afterNullablePrefix;

		Edge(NonTerminal from, NonTerminal to, boolean afterNullablePrefix) {
			this.from = from;
			this.to = to;
			this.afterNullablePrefix = afterNullablePrefix;
		}

		@Override
		public String toString() {
			return from + " -> " + to;
		}
	}

	private final Grammar grammar;

	private final Map<NonTerminal, List<Edge>> edges = new LinkedHashMap<>();

	public LeftReferenceGraph(Grammar grammar, FirstSets firstSets) {
		this.grammar = grammar;
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			List<Edge> outgoing = new ArrayList<>();
			Set<NonTerminal> targets = new HashSet<>();
			for (Production production : grammar.productionsOf(nonTerminal)) {
				for (int i = 0; i < production.rightSize(); i++) {
					Symbol symbol = production.right.get(i);
					if (!symbol.isNonTerminal()){
						break;
					}
					if (targets.add((NonTerminal)symbol)){
						outgoing.add(new Edge(nonTerminal, (NonTerminal)symbol, i > 0));
					}
					if (!firstSets.isNullable(symbol)){
						break;
					}
				}
			}
			edges.put(nonTerminal, Collections.unmodifiableList(outgoing));
		}
	}

	public LeftReferenceGraph(Grammar grammar) {
		this(grammar, grammar.firstSets());
	}

	public List<Edge> edgesFrom(NonTerminal nonTerminal){
		return edges.getOrDefault(nonTerminal, Collections.emptyList());
	}

	/**
	 * Shortest cycle through the passed non terminal, the list starts and ends with it.
	 *
	 * @return the cycle or an empty list if the non terminal isn't left recursive
	 */
	public List<NonTerminal> cycleThrough(NonTerminal nonTerminal){
		Map<NonTerminal, NonTerminal> predecessors = new HashMap<>();
		Deque<NonTerminal> queue = new ArrayDeque<>();
		queue.add(nonTerminal);
		while (!queue.isEmpty()){
			NonTerminal current = queue.poll();
			for (Edge edge : edgesFrom(current)) {
				if (edge.to.equals(nonTerminal)){
					LinkedList<NonTerminal> cycle = new LinkedList<>();
					cycle.addFirst(nonTerminal);
					for (NonTerminal n = current; n != null; n = predecessors.get(n)){
						cycle.addFirst(n);
					}
					return cycle;
				}
				if (!predecessors.containsKey(edge.to) && !edge.to.equals(nonTerminal)){
					predecessors.put(edge.to, current);
					queue.add(edge.to);
				}
			}
		}
		return Collections.emptyList();
	}

	public boolean isLeftRecursive(NonTerminal nonTerminal){
		return !cycleThrough(nonTerminal).isEmpty();
	}

	/**
	 * Left recursive non terminals in grammar order
	 */
	public Set<NonTerminal> leftRecursiveNonTerminals(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			if (isLeftRecursive(nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}

	/**
	 * Graphviz version of this graph, left recursive non terminals are colored red and
	 * edges behind nullable prefixes are dashed.
	 */
	public Graph toDotGraph(String name){
		Set<NonTerminal> leftRecursive = leftRecursiveNonTerminals();
		Map<NonTerminal, MutableNode> nodes = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.allNonTerminals()) {
			MutableNode node = mutNode(nonTerminal.name);
			if (leftRecursive.contains(nonTerminal)){
				node.add(Color.RED, Color.RED.font());
			}
			nodes.put(nonTerminal, node);
		}
		for (List<Edge> outgoing : edges.values()) {
			for (Edge edge : outgoing) {
				MutableNode target = nodes.get(edge.to);
				if (edge.afterNullablePrefix){
					nodes.get(edge.from).addLink(to(target).with(Style.DASHED));
				} else {
					nodes.get(edge.from).addLink(target);
				}
			}
		}
		return graph(name).directed().nodeAttr().with(Font.name("Helvetica"))
				.with((MutableNode[])nodes.values().toArray(new MutableNode[0]));
	}

	/**
	 * Writes the graph to the passed file, the format is derived from the file extension
	 * (<pre>.dot</pre>, <pre>.svg</pre> or <pre>.png</pre>). Only the dot format works without a graphviz engine.
	 */
	public void toFile(Path file) throws IOException {
		String fileName = file.getFileName().toString();
		String name = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
		Graph graph = toDotGraph(name);
		if (fileName.endsWith(".dot")){
			Files.write(file, graph.toString().getBytes(StandardCharsets.UTF_8));
			return;
		}
		Format format = fileName.endsWith(".png") ? Format.PNG : Format.SVG;
		Graphviz.fromGraph(graph).engine(Engine.DOT).render(format).toFile(file.toFile());
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (List<Edge> outgoing : edges.values()) {
			for (Edge edge : outgoing) {
				if (builder.length() > 0){
					builder.append("\n");
				}
				builder.append(edge);
			}
		}
		return builder.toString();
	}
}
