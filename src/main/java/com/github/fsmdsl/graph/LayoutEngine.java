package com.github.fsmdsl.graph;

import com.github.fsmdsl.FsmException;

/**
 * The external graph-layout collaborator. Implementations typically serialize the graph with
 * {@link GraphCodec#write}, hand it to a layout process and parse the answer with
 * {@link GraphCodec#readLayout}.
 */
@FunctionalInterface
public interface LayoutEngine {

  LayoutResult layout(GraphDescription graph) throws FsmException;
}
