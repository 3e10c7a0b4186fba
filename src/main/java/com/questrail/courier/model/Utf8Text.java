package com.questrail.courier.model;

/**
 * UTF-8 representability checks shared by the message model and the codec.
 *
 * <p>A Java {@link String} is a sequence of UTF-16 code units and may hold
 * unpaired surrogates, which have no UTF-8 encoding. {@link String#getBytes}
 * silently replaces them with {@code '?'}, so they have to be rejected before
 * a message is allowed to exist.</p>
 */
public final class Utf8Text
{
    private Utf8Text() {}

    /**
     * @return true if every surrogate in {@code text} is part of a valid pair
     */
    public static boolean isEncodable(CharSequence text)
    {
        final int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= n || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return false;
                }
                i++;
            }
            else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of bytes {@code text} occupies in UTF-8, without allocating.
     * Assumes {@link #isEncodable(CharSequence)} holds.
     */
    public static long encodedLength(CharSequence text)
    {
        long bytes = 0;
        final int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            }
            else if (c < 0x800) {
                bytes += 2;
            }
            else if (Character.isHighSurrogate(c)) {
                bytes += 4;
                i++;
            }
            else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
