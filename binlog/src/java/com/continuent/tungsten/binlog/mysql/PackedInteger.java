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

/**
 * Result of decoding a packed integer: the value, whether the encoding was the
 * NULL marker, and the number of bytes consumed.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class PackedInteger
{
    private final long    value;
    private final boolean isNull;
    private final int     length;

    public PackedInteger(long value, boolean isNull, int length)
    {
        this.value = value;
        this.isNull = isNull;
        this.length = length;
    }

    /** Decoded value, 0 when {@link #isNull()} is true. */
    public long getValue()
    {
        return value;
    }

    public boolean isNull()
    {
        return isNull;
    }

    /** Number of bytes the encoding occupies. */
    public int getLength()
    {
        return length;
    }

    public String toString()
    {
        return isNull ? "NULL" : Long.toString(value);
    }
}
