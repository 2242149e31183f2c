package com.hartwig.varpipe.workflow;

import org.jgrapht.graph.DefaultEdge;

/**
 * Dependency edge from producing to consuming stage, labelled with the artifact that flows along it.
 */
class NamedEdge extends DefaultEdge {
    private final String name;

    /**
     * Constructs a relationship edge
     *
     * @param label the artifact name of the new edge.
     */
    public NamedEdge(String label) {
        this.name = label;
    }

    /**
     * Gets the artifact name associated with this edge.
     *
     * @return edge label
     */
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "(" + getSource() + " : " + getTarget() + " : " + name + ")";
    }
}
