/**
 * Default codec implementations. {@link com.questrail.courier.codec.impl.MessageFraming}
 * holds the wire constants shared by the encoder and decoder.
 */
package com.questrail.courier.codec.impl;
