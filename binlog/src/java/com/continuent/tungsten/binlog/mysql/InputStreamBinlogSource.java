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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import org.apache.log4j.Logger;

/**
 * Reads binlog bytes from any input stream, for instance a binlog held in
 * memory or fetched from another host.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class InputStreamBinlogSource implements BinlogSource
{
    static Logger             logger = Logger.getLogger(InputStreamBinlogSource.class);

    private static final int  CHUNK_SIZE = 64 * 1024;

    private final InputStream in;
    private long              offset;

    public InputStreamBinlogSource(InputStream in)
    {
        this.in = in;
    }

    /**
     * {@inheritDoc}
     *
     * @see com.continuent.tungsten.binlog.mysql.BinlogSource#readExactly(int)
     */
    public byte[] readExactly(int length) throws TruncatedEventException,
            IOException
    {
        // Allocate by chunks so a corrupt size cannot exhaust the heap.
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.min(
                length, CHUNK_SIZE));
        byte[] chunk = new byte[Math.min(length, CHUNK_SIZE)];
        int read = 0;
        while (read < length)
        {
            int count = in.read(chunk, 0,
                    Math.min(chunk.length, length - read));
            if (count < 0)
                break;
            bytes.write(chunk, 0, count);
            read += count;
        }
        offset += read;

        if (read == length)
            return bytes.toByteArray();
        else if (read == 0)
            return null;
        else
            throw new TruncatedEventException("Stream ends at offset "
                    + offset, length, read);
    }

    public long getOffset()
    {
        return offset;
    }

    public void close()
    {
        try
        {
            in.close();
        }
        catch (IOException e)
        {
            logger.warn("Unable to close binlog input stream: "
                    + e.getMessage());
        }
    }

    public String toString()
    {
        return "InputStreamBinlogSource offset=" + offset;
    }
}
