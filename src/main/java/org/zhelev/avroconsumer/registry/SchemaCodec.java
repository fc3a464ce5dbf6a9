package org.zhelev.avroconsumer.registry;

import java.io.IOException;

/**
 * Converts payloads written with one registered schema between their binary, native and textual forms.
 */
public interface SchemaCodec {

    /**
     * Reads {@code length} bytes of binary encoded data starting at {@code offset} into an in-memory value.
     */
    Object binaryToNative(byte[] data, int offset, int length) throws IOException;

    /**
     * Writes a value produced by {@link #binaryToNative} in the schema's JSON encoding.
     */
    byte[] nativeToTextual(Object value) throws IOException;

}
