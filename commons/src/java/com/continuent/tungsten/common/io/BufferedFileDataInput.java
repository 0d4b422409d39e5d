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

package com.continuent.tungsten.common.io;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;

import org.apache.log4j.Logger;

/**
 * Buffered sequential reader over a file that tracks its own offset. The
 * number of readable bytes comes from the file channel size, so a reader can
 * find out how much of a file is there before it commits to a read.
 *
 * @author <a href="mailto:robert.hodges@continuent.com">Robert Hodges</a>
 */
public class BufferedFileDataInput
{
    private static Logger       logger = Logger.getLogger(BufferedFileDataInput.class);

    private final File          file;
    private final int           size;

    private FileInputStream     fileInput;
    private FileChannel         fileChannel;
    private BufferedInputStream bufferedInput;
    private long                offset;

    /**
     * Creates instance positioned on start of file.
     *
     * @param file File from which to read
     * @param size Size of buffer for buffered I/O
     */
    public BufferedFileDataInput(File file, int size)
            throws FileNotFoundException, IOException, InterruptedException
    {
        if (size <= 0)
            throw new IllegalArgumentException("Buffer size must be positive: "
                    + size);
        this.file = file;
        this.size = size;
        seek(0);
    }

    /**
     * Creates instance with default buffer size.
     */
    public BufferedFileDataInput(File file) throws FileNotFoundException,
            IOException, InterruptedException
    {
        this(file, 1024);
    }

    public File getFile()
    {
        return file;
    }

    /**
     * Returns the current offset position, or -1 once closed.
     */
    public long getOffset()
    {
        return offset;
    }

    /**
     * Returns the number of bytes between the current offset and the end of
     * the file. This results in a file system metadata call.
     */
    public long available() throws IOException, InterruptedException
    {
        if (fileChannel == null)
            throw new IOException("Reader is closed: file=" + file.getName());
        try
        {
            return fileChannel.size() - offset;
        }
        catch (ClosedByInterruptException e)
        {
            // NIO interrupt. The channel is unusable from here on.
            throw new InterruptedException(e.getClass().getName());
        }
    }

    /**
     * Positions the reader at a specific offset, reopening the file.
     *
     * @param seekBytes Number of bytes from start of file
     * @throws FileNotFoundException Thrown if file is not found
     * @throws IOException Thrown if offset cannot be reached
     * @throws InterruptedException Thrown if thread is interrupted
     */
    public void seek(long seekBytes) throws FileNotFoundException, IOException,
            InterruptedException
    {
        if (fileInput != null)
            fileInput.close();

        fileInput = new FileInputStream(file);
        fileChannel = fileInput.getChannel();
        try
        {
            fileChannel.position(seekBytes);
        }
        catch (ClosedByInterruptException e)
        {
            throw new InterruptedException(e.getClass().getName());
        }
        bufferedInput = new BufferedInputStream(fileInput, size);
        offset = seekBytes;

        if (logger.isDebugEnabled())
            logger.debug("Positioned reader: " + this);
    }

    /**
     * Reads a single unsigned byte.
     *
     * @throws EOFException Thrown if the file ends first
     */
    public int readUnsignedByte() throws IOException
    {
        int v = bufferedInput.read();
        if (v < 0)
            throw new EOFException("End of file reached: file="
                    + file.getName() + " offset=" + offset);
        offset++;
        return v;
    }

    /**
     * Fills a byte array completely.
     *
     * @throws EOFException Thrown if the file ends first
     */
    public void readFully(byte[] bytes) throws IOException
    {
        readFully(bytes, 0, bytes.length);
    }

    /**
     * Reads exactly len bytes into a buffer. On end of file the offset still
     * accounts for the bytes that were read.
     *
     * @param bytes Buffer into which to read
     * @param start Starting byte position
     * @param len Number of bytes to read
     * @throws EOFException Thrown if the file ends first
     */
    public void readFully(byte[] bytes, int start, int len) throws IOException
    {
        int read = 0;
        while (read < len)
        {
            int count = bufferedInput.read(bytes, start + read, len - read);
            if (count < 0)
            {
                offset += read;
                throw new EOFException("End of file reached: file="
                        + file.getName() + " offset=" + offset + " missing="
                        + (len - read));
            }
            read += count;
        }
        offset += len;
    }

    /** Close and release all resources. */
    public void close()
    {
        try
        {
            if (fileChannel != null)
                fileChannel.close();
            if (fileInput != null)
                fileInput.close();
        }
        catch (IOException e)
        {
            logger.warn("Unable to close buffered file reader: file="
                    + file.getName() + " exception=" + e.getMessage());
        }
        fileChannel = null;
        fileInput = null;
        bufferedInput = null;
        offset = -1;
    }

    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(this.getClass().getSimpleName());
        sb.append(" file=").append(file.getName());
        sb.append(" size=").append(size);
        sb.append(" offset=").append(offset);
        return sb.toString();
    }
}
