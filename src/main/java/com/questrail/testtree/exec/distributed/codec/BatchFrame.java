package com.questrail.testtree.exec.distributed.codec;

import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.TestPath;

import java.util.List;
import java.util.Objects;

/**
 * Canonical form of one message exchanged between a distributed coordinator
 * and its worker processes.
 *
 * <h2>Directionality</h2>
 * <ul>
 *   <li>Worker → coordinator: {@link Hello}, {@link CaseReport}, {@link Done}</li>
 *   <li>Coordinator → worker: {@link Assign}, {@link Abort}</li>
 * </ul>
 *
 * <p>Frames carry only values, never classes from the plan, so a coordinator
 * can decode what a worker built from its own copy of the plan.</p>
 */
public sealed interface BatchFrame
        permits BatchFrame.Hello, BatchFrame.Assign, BatchFrame.CaseReport, BatchFrame.Done, BatchFrame.Abort {

    /** First frame on every worker connection. */
    record Hello(int workerId) implements BatchFrame {}

    /**
     * The coordinator's answer to {@link Hello}: the discovery indices the
     * worker must run, in order.
     */
    record Assign(int workerId, List<Integer> caseIndices) implements BatchFrame {
        public Assign {
            caseIndices = List.copyOf(caseIndices);
            for (int index : caseIndices) {
                if (index < 0) {
                    throw new IllegalArgumentException("negative case index " + index);
                }
            }
        }
    }

    /**
     * The serialized outcome batch of one case.
     *
     * @param index  discovery index of the case in the plan
     * @param caseId full path of the case as the worker discovered it
     */
    record CaseReport(int workerId, int index, TestPath caseId, CaseResult result) implements BatchFrame {
        public CaseReport {
            Objects.requireNonNull(caseId, "caseId");
            Objects.requireNonNull(result, "result");
        }
    }

    /** Last frame of a worker that reported all of its cases. */
    record Done(int workerId) implements BatchFrame {}

    /** Tells a worker to stop starting new cases. */
    record Abort(String reason) implements BatchFrame {
        public Abort {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
