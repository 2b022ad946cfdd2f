package com.questrail.testtree.exec.distributed.codec;

/**
 * Wire constants shared by the encoder and decoder.
 *
 * <pre>
 *   frame   := kind:u8  payload  crc:u16
 *   string  := length:i32  utf8-bytes
 *   path    := count:i32  string*
 *   outcome := tag:u8  fields
 * </pre>
 */
final class BatchWire
{
    static final int KIND_HELLO = 0xF1;
    static final int KIND_CASE = 0xF2;
    static final int KIND_DONE = 0xF3;
    static final int KIND_ABORT = 0xF4;
    static final int KIND_ASSIGN = 0xF5;

    static final int OUTCOME_PASSED = 1;
    static final int OUTCOME_FAILED = 2;
    static final int OUTCOME_ERRORED = 3;
    static final int OUTCOME_BROKEN = 4;

    static final int STATUS_EXECUTED = 1;
    static final int STATUS_ABORTED = 2;
    static final int STATUS_CRASHED = 3;
    static final int STATUS_NOT_RUN = 4;

    /** Upper bound on any length field, so a corrupt length cannot force a huge allocation. */
    static final int MAX_LENGTH = 16 * 1024 * 1024;

    private BatchWire() {}
}
