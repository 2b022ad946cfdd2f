package com.questrail.testtree.exec.distributed.codec;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.SectionResult;
import com.questrail.testtree.model.TestPath;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BatchFrameDecoder
 * -----------------------------------------------------------------------------
 * Turns wire bytes back into a {@link BatchFrame}.
 *
 * <p>Performs, in order:</p>
 * <ol>
 *   <li>CRC validation and removal</li>
 *   <li>Kind dispatch</li>
 *   <li>Payload parsing; trailing bytes are a defect</li>
 * </ol>
 *
 * <p>The decoder is handed exactly one frame (the transport has already removed
 * the length prefix). Invalid input yields {@link Optional#empty()} from
 * {@link #decode}; {@link #decodeOrThrow} reports the reason instead.</p>
 */
public final class BatchFrameDecoder
{
    public Optional<BatchFrame> decode(byte[] frame)
    {
        try {
            return Optional.of(decodeOrThrow(frame));
        }
        catch (BatchCodecException e) {
            return Optional.empty();
        }
    }

    public BatchFrame decodeOrThrow(byte[] frame)
    {
        final byte[] body = BatchCrc.verifyAndStrip(frame);
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(body))) {
            final int kind = in.readUnsignedByte();
            final BatchFrame decoded;
            switch (kind) {
                case BatchWire.KIND_HELLO:
                    decoded = new BatchFrame.Hello(in.readInt());
                    break;
                case BatchWire.KIND_DONE:
                    decoded = new BatchFrame.Done(in.readInt());
                    break;
                case BatchWire.KIND_ASSIGN:
                    decoded = readAssign(in);
                    break;
                case BatchWire.KIND_ABORT:
                    decoded = new BatchFrame.Abort(readString(in));
                    break;
                case BatchWire.KIND_CASE:
                    int workerId = in.readInt();
                    int index = in.readInt();
                    TestPath caseId = readPath(in);
                    decoded = new BatchFrame.CaseReport(workerId, index, caseId, readResult(in));
                    break;
                default:
                    throw new BatchCodecException(String.format("unknown frame kind 0x%02X", kind));
            }
            if (in.available() > 0) {
                throw new BatchCodecException(in.available() + " trailing bytes after frame payload");
            }
            return decoded;
        }
        catch (EOFException e) {
            throw new BatchCodecException("truncated frame", e);
        }
        catch (IOException e) {
            throw new BatchCodecException("unreadable frame", e);
        }
        catch (IllegalArgumentException | NullPointerException e) {
            // Values that decode but violate model invariants (negative counts, bad path segments).
            throw new BatchCodecException("invalid frame content: " + e.getMessage(), e);
        }
    }

    private static BatchFrame.Assign readAssign(DataInputStream in) throws IOException
    {
        int workerId = in.readInt();
        int count = readLength(in);
        List<Integer> indices = new ArrayList<>(Math.min(count, 4096));
        for (int i = 0; i < count; i++) {
            indices.add(in.readInt());
        }
        return new BatchFrame.Assign(workerId, indices);
    }

    private static CaseResult readResult(DataInputStream in) throws IOException
    {
        final CaseStatus status;
        int code = in.readUnsignedByte();
        switch (code) {
            case BatchWire.STATUS_EXECUTED: status = CaseStatus.EXECUTED; break;
            case BatchWire.STATUS_ABORTED: status = CaseStatus.ABORTED; break;
            case BatchWire.STATUS_CRASHED: status = CaseStatus.CRASHED; break;
            case BatchWire.STATUS_NOT_RUN: status = CaseStatus.NOT_RUN; break;
            default: throw new BatchCodecException("unknown case status " + code);
        }
        Duration duration = Duration.ofNanos(in.readLong());

        int sectionCount = readLength(in);
        List<SectionResult> sections = new ArrayList<>(Math.min(sectionCount, 64));
        for (int i = 0; i < sectionCount; i++) {
            String name = readString(in);
            sections.add(new SectionResult(name, new Counts(in.readInt(), in.readInt(), in.readInt(), in.readInt())));
        }

        int outcomeCount = readLength(in);
        List<AssertionOutcome> outcomes = new ArrayList<>(Math.min(outcomeCount, 1024));
        for (int i = 0; i < outcomeCount; i++) {
            outcomes.add(readOutcome(in));
        }
        return new CaseResult(status, outcomes, sections, duration);
    }

    private static AssertionOutcome readOutcome(DataInputStream in) throws IOException
    {
        int tag = in.readUnsignedByte();
        switch (tag) {
            case BatchWire.OUTCOME_PASSED:
                return AssertionOutcome.pass();
            case BatchWire.OUTCOME_FAILED:
                return new AssertionOutcome.Failed(readString(in), readString(in));
            case BatchWire.OUTCOME_ERRORED:
                String description = readString(in);
                String location = in.readBoolean() ? readString(in) : null;
                return new AssertionOutcome.Errored(description, location);
            case BatchWire.OUTCOME_BROKEN:
                return new AssertionOutcome.Broken(readString(in));
            default:
                throw new BatchCodecException("unknown outcome tag " + tag);
        }
    }

    private static TestPath readPath(DataInputStream in) throws IOException
    {
        int depth = readLength(in);
        List<String> segments = new ArrayList<>(Math.min(depth, 64));
        for (int i = 0; i < depth; i++) {
            segments.add(readString(in));
        }
        return TestPath.of(segments);
    }

    private static String readString(DataInputStream in) throws IOException
    {
        byte[] utf8 = new byte[readLength(in)];
        in.readFully(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }

    private static int readLength(DataInputStream in) throws IOException
    {
        int n = in.readInt();
        if (n < 0 || n > BatchWire.MAX_LENGTH) {
            throw new BatchCodecException("invalid length field " + n);
        }
        return n;
    }
}
