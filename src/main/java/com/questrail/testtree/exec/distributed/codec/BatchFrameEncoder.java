package com.questrail.testtree.exec.distributed.codec;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.SectionResult;
import com.questrail.testtree.model.TestPath;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * BatchFrameEncoder
 * -----------------------------------------------------------------------------
 * Turns a {@link BatchFrame} into wire bytes: kind byte, payload, CRC.
 *
 * <p>This is the mechanical inverse of {@link BatchFrameDecoder}. Length
 * prefixing for the stream is left to the transport.</p>
 */
public final class BatchFrameEncoder
{
    public byte[] encode(BatchFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            if (frame instanceof BatchFrame.Hello) {
                out.writeByte(BatchWire.KIND_HELLO);
                out.writeInt(((BatchFrame.Hello) frame).workerId());
            }
            else if (frame instanceof BatchFrame.Done) {
                out.writeByte(BatchWire.KIND_DONE);
                out.writeInt(((BatchFrame.Done) frame).workerId());
            }
            else if (frame instanceof BatchFrame.Assign) {
                BatchFrame.Assign assign = (BatchFrame.Assign) frame;
                out.writeByte(BatchWire.KIND_ASSIGN);
                out.writeInt(assign.workerId());
                out.writeInt(assign.caseIndices().size());
                for (int index : assign.caseIndices()) {
                    out.writeInt(index);
                }
            }
            else if (frame instanceof BatchFrame.Abort) {
                out.writeByte(BatchWire.KIND_ABORT);
                writeString(out, ((BatchFrame.Abort) frame).reason());
            }
            else {
                BatchFrame.CaseReport report = (BatchFrame.CaseReport) frame;
                out.writeByte(BatchWire.KIND_CASE);
                out.writeInt(report.workerId());
                out.writeInt(report.index());
                writePath(out, report.caseId());
                writeResult(out, report.result());
            }
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not throw; reaching here is a JDK defect.
            throw new UncheckedIOException(e);
        }

        return BatchCrc.append(bytes.toByteArray());
    }

    private static void writeResult(DataOutputStream out, CaseResult result) throws IOException
    {
        switch (result.status()) {
            case EXECUTED: out.writeByte(BatchWire.STATUS_EXECUTED); break;
            case ABORTED: out.writeByte(BatchWire.STATUS_ABORTED); break;
            case CRASHED: out.writeByte(BatchWire.STATUS_CRASHED); break;
            default: out.writeByte(BatchWire.STATUS_NOT_RUN); break;
        }
        out.writeLong(result.duration().toNanos());

        out.writeInt(result.sections().size());
        for (SectionResult s : result.sections()) {
            writeString(out, s.name());
            out.writeInt(s.counts().pass());
            out.writeInt(s.counts().fail());
            out.writeInt(s.counts().error());
            out.writeInt(s.counts().broken());
        }

        out.writeInt(result.outcomes().size());
        for (AssertionOutcome o : result.outcomes()) {
            writeOutcome(out, o);
        }
    }

    private static void writeOutcome(DataOutputStream out, AssertionOutcome o) throws IOException
    {
        if (o instanceof AssertionOutcome.Passed) {
            out.writeByte(BatchWire.OUTCOME_PASSED);
        }
        else if (o instanceof AssertionOutcome.Failed) {
            AssertionOutcome.Failed f = (AssertionOutcome.Failed) o;
            out.writeByte(BatchWire.OUTCOME_FAILED);
            writeString(out, f.expression());
            writeString(out, f.evaluated());
        }
        else if (o instanceof AssertionOutcome.Errored) {
            AssertionOutcome.Errored e = (AssertionOutcome.Errored) o;
            out.writeByte(BatchWire.OUTCOME_ERRORED);
            writeString(out, e.description());
            out.writeBoolean(e.location() != null);
            if (e.location() != null) {
                writeString(out, e.location());
            }
        }
        else {
            out.writeByte(BatchWire.OUTCOME_BROKEN);
            writeString(out, ((AssertionOutcome.Broken) o).reason());
        }
    }

    private static void writePath(DataOutputStream out, TestPath path) throws IOException
    {
        out.writeInt(path.depth());
        for (String segment : path.segments()) {
            writeString(out, segment);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException
    {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }
}
