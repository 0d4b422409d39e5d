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
 * Initial developer(s): Robert Hodges
 * Contributor(s): Stephane Giron
 */

package com.continuent.tungsten.binlog.mysql;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.apache.log4j.Logger;

import com.continuent.tungsten.common.io.BufferedFileDataInput;

/**
 * Reads a binlog file through a {@link BufferedFileDataInput}, which keeps
 * reads buffered and limits file system metadata calls.
 *
 * @author <a href="mailto:robert.hodges@continuent.com">Robert Hodges</a>
 */
public class FileBinlogSource implements BinlogSource
{
    static Logger                 logger = Logger.getLogger(FileBinlogSource.class);

    private final File            file;
    private BufferedFileDataInput bfdi;

    /**
     * Opens the file for reading from its first byte.
     *
     * @param file Binlog file
     * @param bufferSize Size of buffer to read
     */
    public FileBinlogSource(File file, int bufferSize)
            throws FileNotFoundException, IOException, InterruptedException
    {
        this.file = file;
        if (logger.isDebugEnabled())
            logger.debug("Opening file " + file.getName() + " with buffer = "
                    + bufferSize);
        this.bfdi = new BufferedFileDataInput(file, bufferSize);
    }

    /**
     * {@inheritDoc}
     *
     * @see com.continuent.tungsten.binlog.mysql.BinlogSource#readExactly(int)
     */
    public byte[] readExactly(int length) throws TruncatedEventException,
            IOException, InterruptedException
    {
        if (bfdi == null)
            throw new IOException("Binlog file is closed: " + file.getName());
        if (length == 0)
            return new byte[0];

        long available = bfdi.available();
        if (available <= 0)
            return null;
        if (available < length)
            throw new TruncatedEventException("Binlog file "
                    + file.getName() + " ends at offset "
                    + (bfdi.getOffset() + available), length, (int) available);

        byte[] bytes = new byte[length];
        bfdi.readFully(bytes);
        return bytes;
    }

    public long getOffset()
    {
        return bfdi == null ? -1 : bfdi.getOffset();
    }

    public File getFile()
    {
        return file;
    }

    public void close()
    {
        if (bfdi != null)
        {
            bfdi.close();
            bfdi = null;
        }
    }

    public String toString()
    {
        return "FileBinlogSource " + (bfdi == null ? file.getName() : bfdi);
    }
}
