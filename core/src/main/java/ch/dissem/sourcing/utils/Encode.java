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

import ch.dissem.sourcing.entity.Streamable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * This class handles encoding simple types to a byte stream. Numbers are written big endian, variable length
 * integers take one byte below 0xfd, otherwise a marker byte followed by 2, 4 or 8 bytes.
 */
public class Encode {
    public static void varInt(long value, OutputStream stream) throws IOException {
        if (value < 0) {
            // Negative values are never expected, but they must survive a round trip
            stream.write(0xff);
            int64(value, stream);
        } else if (value < 0xfd) {
            int8(value, stream);
        } else if (value <= 0xffffL) {
            stream.write(0xfd);
            int16(value, stream);
        } else if (value <= 0xffffffffL) {
            stream.write(0xfe);
            int32(value, stream);
        } else {
            stream.write(0xff);
            int64(value, stream);
        }
    }

    public static void int8(long value, OutputStream stream) throws IOException {
        stream.write((int) value);
    }

    public static void int16(long value, OutputStream stream) throws IOException {
        stream.write(ByteBuffer.allocate(4).putInt((int) value).array(), 2, 2);
    }

    public static void int32(long value, OutputStream stream) throws IOException {
        stream.write(ByteBuffer.allocate(4).putInt((int) value).array());
    }

    public static void int64(long value, OutputStream stream) throws IOException {
        stream.write(ByteBuffer.allocate(8).putLong(value).array());
    }

    /**
     * Writes the exact bit pattern of the given double, so it can be restored without any loss.
     */
    public static void float64(double value, OutputStream stream) throws IOException {
        int64(Double.doubleToLongBits(value), stream);
    }

    public static void varString(String value, OutputStream stream) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        varInt(bytes.length, stream);
        stream.write(bytes);
    }

    /**
     * Returns an array of bytes representing the given streamable object.
     */
    public static byte[] bytes(Streamable streamable) throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        streamable.write(stream);
        return stream.toByteArray();
    }
}
