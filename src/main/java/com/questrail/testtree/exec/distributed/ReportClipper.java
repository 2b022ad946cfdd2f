package com.questrail.testtree.exec.distributed;

import com.questrail.testtree.exec.distributed.codec.BatchFrame;
import com.questrail.testtree.exec.distributed.codec.BatchFrameEncoder;
import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ReportClipper
 * -----------------------------------------------------------------------------
 * Encodes a case report so that it fits on the worker link.
 *
 * <p>A report over {@code maxBytes} is re-encoded with every outcome text
 * (expression, evaluated value, description, location, reason) clipped, first
 * to {@value #LONG_TEXT} and then to {@value #SHORT_TEXT} characters. Clipping
 * keeps every outcome, so the case's counts survive. A report that is still
 * too large is replaced by a single {@link CaseStatus#CRASHED} outcome naming
 * its size.</p>
 */
final class ReportClipper
{
    /** Well under the transport's frame limit and the codec's string limit. */
    static final int MAX_REPORT_BYTES = 8 * 1024 * 1024;

    static final int LONG_TEXT = 4096;
    static final int SHORT_TEXT = 64;

    private final BatchFrameEncoder encoder;
    private final int maxBytes;

    ReportClipper(BatchFrameEncoder encoder)
    {
        this(encoder, MAX_REPORT_BYTES);
    }

    ReportClipper(BatchFrameEncoder encoder, int maxBytes)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.maxBytes = maxBytes;
    }

    byte[] encode(BatchFrame.CaseReport report)
    {
        byte[] bytes = encoder.encode(report);
        for (int limit : new int[] { LONG_TEXT, SHORT_TEXT }) {
            if (bytes.length <= maxBytes) {
                return bytes;
            }
            bytes = encoder.encode(withResult(report, clip(report.result(), limit)));
        }
        if (bytes.length <= maxBytes) {
            return bytes;
        }
        return encoder.encode(withResult(report, CaseResult.unexecuted(CaseStatus.CRASHED,
                "report of " + report.result().outcomes().size() + " outcomes needs " + bytes.length
                        + " bytes after clipping; the worker link carries at most " + maxBytes)));
    }

    private static BatchFrame.CaseReport withResult(BatchFrame.CaseReport report, CaseResult result)
    {
        return new BatchFrame.CaseReport(report.workerId(), report.index(), report.caseId(), result);
    }

    static CaseResult clip(CaseResult result, int limit)
    {
        List<AssertionOutcome> clipped = new ArrayList<>(result.outcomes().size());
        for (AssertionOutcome o : result.outcomes()) {
            if (o instanceof AssertionOutcome.Failed) {
                AssertionOutcome.Failed f = (AssertionOutcome.Failed) o;
                clipped.add(new AssertionOutcome.Failed(clip(f.expression(), limit), clip(f.evaluated(), limit)));
            }
            else if (o instanceof AssertionOutcome.Errored) {
                AssertionOutcome.Errored e = (AssertionOutcome.Errored) o;
                String location = e.location() == null ? null : clip(e.location(), limit);
                clipped.add(new AssertionOutcome.Errored(clip(e.description(), limit), location));
            }
            else if (o instanceof AssertionOutcome.Broken) {
                clipped.add(new AssertionOutcome.Broken(clip(((AssertionOutcome.Broken) o).reason(), limit)));
            }
            else {
                clipped.add(o);
            }
        }
        return new CaseResult(result.status(), clipped, result.sections(), result.duration());
    }

    static String clip(String text, int limit)
    {
        if (text.length() <= limit) {
            return text;
        }
        int end = limit;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "... [" + (text.length() - end) + " chars clipped]";
    }
}
