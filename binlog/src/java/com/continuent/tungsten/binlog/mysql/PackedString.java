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

import java.nio.charset.Charset;

/**
 * Result of decoding a packed string.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class PackedString
{
    private final byte[] bytes;
    private final int    length;

    public PackedString(byte[] bytes, int length)
    {
        this.bytes = bytes;
        this.length = length;
    }

    /** Payload bytes, or null if the length prefix was the NULL marker. */
    public byte[] getBytes()
    {
        return bytes;
    }

    public String getString(Charset charset)
    {
        if (bytes == null)
            return null;
        return new String(bytes, charset);
    }

    /** Bytes consumed including the length prefix. */
    public int getLength()
    {
        return length;
    }
}
