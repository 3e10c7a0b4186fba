/**
 * Netty-backed implementation of the stream transport ports.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied out of Netty buffers
 * into caller-supplied arrays and every reference-counted buffer is released
 * here.
 *
 * <h2>Bridging to blocking ports</h2>
 * The connection layer reads with blocking calls on its own worker threads.
 * {@link com.questrail.courier.transport.netty.NettyStreamSource} accumulates
 * bytes delivered on the event loop and hands them out under a lock; auto-read
 * is paused while the backlog is above a high-water mark, so a slow reader
 * pushes back on the peer through the socket buffer just as a blocking socket
 * would. Blocking calls must never run on an event loop thread.
 */
package com.questrail.courier.transport.netty;
