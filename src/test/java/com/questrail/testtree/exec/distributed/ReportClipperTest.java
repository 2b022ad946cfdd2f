package com.questrail.testtree.exec.distributed;

import com.questrail.testtree.exec.distributed.codec.BatchFrame;
import com.questrail.testtree.exec.distributed.codec.BatchFrameDecoder;
import com.questrail.testtree.exec.distributed.codec.BatchFrameEncoder;
import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.TestPath;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ReportClipperTest
{
    private static final int LIMIT = 64 * 1024;

    private final BatchFrameEncoder encoder = new BatchFrameEncoder();
    private final BatchFrameDecoder decoder = new BatchFrameDecoder();
    private final ReportClipper clipper = new ReportClipper(encoder, LIMIT);

    private static BatchFrame.CaseReport report(List<AssertionOutcome> outcomes)
    {
        return new BatchFrame.CaseReport(0, 4, TestPath.of("Plan", "huge"), CaseResult.executed(outcomes));
    }

    private CaseResult decoded(byte[] bytes)
    {
        return ((BatchFrame.CaseReport) decoder.decodeOrThrow(bytes)).result();
    }

    @Test
    void reportUnderTheLimitIsSentUnchanged()
    {
        BatchFrame.CaseReport report = report(List.of(
                AssertionOutcome.pass(),
                AssertionOutcome.fail("a == b", "x".repeat(10_000))));

        byte[] bytes = clipper.encode(report);

        assertArrayEquals(encoder.encode(report), bytes);
    }

    @Test
    void oversizedTextIsClippedAndCountsSurvive()
    {
        String huge = "y".repeat(200_000);
        BatchFrame.CaseReport report = report(List.of(
                AssertionOutcome.pass(),
                AssertionOutcome.fail("big", huge),
                AssertionOutcome.error(huge, "Plan.java:1"),
                AssertionOutcome.broken("short")));

        byte[] bytes = clipper.encode(report);

        assertTrue(bytes.length <= LIMIT);
        CaseResult result = decoded(bytes);
        assertEquals(new Counts(1, 1, 1, 1), result.counts());
        AssertionOutcome.Failed failed = result.firstFailure().orElseThrow();
        assertEquals("y".repeat(ReportClipper.LONG_TEXT) + "... [" + (200_000 - ReportClipper.LONG_TEXT)
                + " chars clipped]", failed.evaluated());
        assertEquals("short", ((AssertionOutcome.Broken) result.outcomes().get(3)).reason());
    }

    @Test
    void manyMediumFailuresFallBackToShortText()
    {
        List<AssertionOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            outcomes.add(AssertionOutcome.fail("check " + i, "z".repeat(3000)));
        }

        CaseResult result = decoded(clipper.encode(report(outcomes)));

        assertEquals(new Counts(0, 100, 0, 0), result.counts());
        assertTrue(result.firstFailure().orElseThrow().evaluated()
                .startsWith("z".repeat(ReportClipper.SHORT_TEXT) + "... ["));
    }

    @Test
    void reportThatCannotFitBecomesACrash()
    {
        List<AssertionOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            outcomes.add(AssertionOutcome.fail("f", "v"));
        }

        CaseResult result = decoded(clipper.encode(report(outcomes)));

        assertEquals(CaseStatus.CRASHED, result.status());
        String description = ((AssertionOutcome.Errored) result.outcomes().get(0)).description();
        assertTrue(description.startsWith("report of 20000 outcomes needs "), description);
    }

    @Test
    void clippingNeverSplitsASurrogatePair()
    {
        String text = "ab😀cd";

        assertEquals("ab... [4 chars clipped]", ReportClipper.clip(text, 3));
        assertEquals(text, ReportClipper.clip(text, 6));
    }
}
