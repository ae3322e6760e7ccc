/*
 * Copyright 2017 Christian Basler
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ch.dissem.sourcing.utils;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * This class handles decoding simple types from a byte stream written by {@link Encode}.
 */
public class Decode {
    public static byte[] bytes(InputStream stream, int count) throws IOException {
        byte[] result = new byte[count];
        int off = 0;
        while (off < count) {
            int read = stream.read(result, off, count - off);
            if (read < 0) {
                throw new EOFException("Expected " + count + " bytes, got " + off);
            }
            off += read;
        }
        return result;
    }

    public static long varInt(InputStream stream) throws IOException {
        int first = uint8(stream);
        switch (first) {
            case 0xfd:
                return uint16(stream);
            case 0xfe:
                return uint32(stream);
            case 0xff:
                return int64(stream);
            default:
                return first;
        }
    }

    public static int uint8(InputStream stream) throws IOException {
        int value = stream.read();
        if (value < 0) {
            throw new EOFException();
        }
        return value;
    }

    public static int uint16(InputStream stream) throws IOException {
        return uint8(stream) * 256 + uint8(stream);
    }

    public static long uint32(InputStream stream) throws IOException {
        return uint8(stream) * 16777216L + uint8(stream) * 65536L + uint8(stream) * 256L + uint8(stream);
    }

    public static long int64(InputStream stream) throws IOException {
        return ByteBuffer.wrap(bytes(stream, 8)).getLong();
    }

    public static double float64(InputStream stream) throws IOException {
        return Double.longBitsToDouble(int64(stream));
    }

    public static String varString(InputStream stream) throws IOException {
        long length = varInt(stream);
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IOException("Invalid string length: " + length);
        }
        return new String(bytes(stream, (int) length), StandardCharsets.UTF_8);
    }
}
