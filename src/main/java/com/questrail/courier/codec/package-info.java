/**
 * Wire Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: the exact byte
 * layout that lets two independently built endpoints exchange
 * {@link com.questrail.courier.model.Message}s over a stream.</p>
 *
 * <h2>Frame layout</h2>
 * <pre>
 *   +------+------------------+------------------------+
 *   | kind | body length      | body                   |
 *   | u8   | u32, big-endian  | body length bytes      |
 *   +------+------------------+------------------------+
 *
 *   kind 0 (KEY_VALUE) body, repeated until the body is consumed:
 *   +-------------+-----------+---------------+-------------+
 *   | key length  | key bytes | value length  | value bytes |
 *   | u16, BE     | UTF-8     | u16, BE       | UTF-8       |
 *   +-------------+-----------+---------------+-------------+
 *
 *   kind 1 (RAW_STRING) body: UTF-8 text
 * </pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Encoding is deterministic: no padding, no optional fields.</li>
 *   <li>Oversized payloads fail at encode time with
 *       {@link com.questrail.courier.error.PayloadTooLargeException}; nothing
 *       is truncated.</li>
 *   <li>Any framing ambiguity on decode is a
 *       {@link com.questrail.courier.error.ProtocolException}; the decoder never
 *       guesses and never returns a partially populated message.</li>
 *   <li>End of stream before a complete header is a clean disconnect, not an
 *       error.</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   StreamSource bytes
 *        → MessageFrameDecoder   (framing and validation applied here)
 *            → Message
 *                → ConnectionHandler dispatch
 * </pre>
 */
package com.questrail.courier.codec;
