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

package com.continuent.tungsten.binlog.mysql;

import java.util.BitSet;

import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * A packed set of flags, one per column, as found in table map and rows
 * events. Bit i is held in byte i / 8 at bit position i % 8.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class Bitfield
{
    private final byte[] bytes;
    private final int    size;

    /**
     * Copies a bit field of size bits out of a buffer.
     *
     * @throws TruncatedEventException if the buffer is too short
     */
    public Bitfield(byte[] buffer, int offset, int size)
            throws TruncatedEventException
    {
        int length = MysqlBinlog.bitFieldLength(size);
        LittleEndianConversion.checkAvailable(buffer, offset, length);
        this.bytes = new byte[length];
        System.arraycopy(buffer, offset, bytes, 0, length);
        this.size = size;
    }

    /** Returns true if bit i is set. */
    public boolean get(int i)
    {
        if (i < 0 || i >= size)
            throw new IndexOutOfBoundsException("Bit " + i
                    + " is outside bit field of size " + size);
        return ((bytes[i / 8] >> (i % 8)) & 1) == 1;
    }

    /** Number of flags in the field. */
    public int size()
    {
        return size;
    }

    /** Number of bytes the field occupies on the wire. */
    public int getLength()
    {
        return bytes.length;
    }

    /** Number of flags that are set. */
    public int cardinality()
    {
        return toBitSet().cardinality();
    }

    public BitSet toBitSet()
    {
        BitSet bitset = new BitSet(size);
        MysqlBinlog.setBitField(bitset, bytes, 0, size);
        return bitset;
    }

    public byte[] getBytes()
    {
        return bytes.clone();
    }

    public String toString()
    {
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++)
            sb.append(get(i) ? '1' : '0');
        return sb.toString();
    }
}
