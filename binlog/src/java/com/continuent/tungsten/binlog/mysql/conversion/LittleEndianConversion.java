/**
 * VMware Continuent Tungsten Replicator
 * Copyright (C) 2015 VMware, Inc. All rights reserved.
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
 *
 * Initial developer(s): Stephane Giron
 * Contributor(s):
 */

package com.continuent.tungsten.binlog.mysql.conversion;

import com.continuent.tungsten.binlog.mysql.TruncatedEventException;

/**
 * Reads unsigned little-endian integers out of event buffers. Every read is
 * checked against the buffer limit so that a short event surfaces as a
 * {@link TruncatedEventException} rather than an index error.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class LittleEndianConversion
{
    /*
     * bytes to int conversion methods
     */
    public static int convert1ByteToInt(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return (int) convertNBytesToLong(buffer, offset, 1);
    }

    public static int convert2BytesToInt(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return (int) convertNBytesToLong(buffer, offset, 2);
    }

    public static int convert3BytesToInt(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return (int) convertNBytesToLong(buffer, offset, 3);
    }

    /*
     * bytes to long conversion methods
     */
    public static long convert4BytesToLong(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return convertNBytesToLong(buffer, offset, 4);
    }

    public static long convert6BytesToLong(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return convertNBytesToLong(buffer, offset, 6);
    }

    /**
     * Reads an 8 byte value. Values above Long.MAX_VALUE come back negative,
     * callers treat the result as an unsigned bit pattern.
     */
    public static long convert8BytesToLong(byte[] buffer, int offset)
            throws TruncatedEventException
    {
        return convertNBytesToLong(buffer, offset, 8);
    }

    /**
     * Reads an unsigned little-endian integer of 1 to 8 bytes.
     *
     * @param buffer Buffer to read from
     * @param offset Offset of the least significant byte
     * @param nBytes Width of the integer in bytes
     * @throws TruncatedEventException If the buffer ends before offset +
     *             nBytes
     */
    public static long convertNBytesToLong(byte[] buffer, int offset,
            int nBytes) throws TruncatedEventException
    {
        if (nBytes < 1 || nBytes > 8)
            throw new IllegalArgumentException(
                    "Integer width must be between 1 and 8 bytes: " + nBytes);
        checkAvailable(buffer, offset, nBytes);

        long value = 0;
        int shift = 0;
        for (int i = offset; i < offset + nBytes; i++, shift += 8)
        {
            value |= (long) unsignedByteToInt(buffer[i]) << shift;
        }
        return value;
    }

    /**
     * Ensures length bytes can be read from buffer at offset.
     */
    public static void checkAvailable(byte[] buffer, int offset, int length)
            throws TruncatedEventException
    {
        int available = buffer.length - offset;
        if (offset < 0 || length < 0 || available < length)
            throw new TruncatedEventException("Read past end of buffer at offset "
                    + offset, length, Math.max(available, 0));
    }

    public static int unsignedByteToInt(byte b)
    {
        return b & 0xFF;
    }
}
