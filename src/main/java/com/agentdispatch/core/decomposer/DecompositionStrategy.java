package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;

import java.util.List;

/**
 * One way of turning a specification into raw tasks. Output is validated by
 * {@link TaskValidator} before use, so ids may be left null.
 */
public interface DecompositionStrategy {

    String name();

    List<Task> decompose(Specification specification);
}
