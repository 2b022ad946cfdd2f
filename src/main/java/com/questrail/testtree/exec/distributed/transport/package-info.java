/**
 * Worker Link Transport
 * =============================================================================
 *
 * Framework-agnostic ports between the distributed coordinator, its worker
 * processes and a concrete stream transport.
 *
 * <p>Everything above this package sees only whole frames as {@code byte[]},
 * socket addresses, and connection lifecycle callbacks. Netty types stay inside
 * {@code transport.netty}.</p>
 *
 * <p>Implementations must not decode frames or interpret them, and must not
 * retry or time out on their own.</p>
 */
package com.questrail.testtree.exec.distributed.transport;
