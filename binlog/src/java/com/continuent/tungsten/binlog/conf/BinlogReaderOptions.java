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

package com.continuent.tungsten.binlog.conf;

import com.continuent.tungsten.binlog.mysql.LogEventHeader;
import com.continuent.tungsten.common.config.PropertyException;
import com.continuent.tungsten.common.config.TungstenProperties;

/**
 * Options of a binlog walk: the window of events to deliver, table map
 * handling and read buffer size. Positions are byte offsets in the binlog
 * file and times are epoch seconds; 0 leaves a bound unset.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class BinlogReaderOptions
{
    /** Prefix of binlog reader keys in a properties file. */
    public static final String PROPERTY_PREFIX     = "binlog.";

    public static final int    DEFAULT_BUFFER_SIZE = 64000;

    private long               startPosition       = 0;
    private long               endPosition         = 0;
    private long               startTime           = 0;
    private long               endTime             = 0;
    private boolean            strictTableMap      = true;
    private int                bufferSize          = DEFAULT_BUFFER_SIZE;

    public BinlogReaderOptions()
    {
    }

    /**
     * Builds options from the binlog.* keys of a properties set, for example
     * binlog.start_position=4. Other keys are ignored.
     *
     * @throws PropertyException If a key is unknown or a value is malformed
     */
    public static BinlogReaderOptions fromProperties(TungstenProperties props)
    {
        BinlogReaderOptions options = new BinlogReaderOptions();
        props.subset(PROPERTY_PREFIX, true).applyProperties(options);
        options.validate();
        return options;
    }

    /**
     * Checks the options for values that cannot work.
     *
     * @throws PropertyException If a value is out of range
     */
    public void validate()
    {
        if (startPosition < 0 || endPosition < 0 || startTime < 0
                || endTime < 0)
            throw new PropertyException("Window bounds must not be negative: "
                    + this);
        if (bufferSize <= 0)
            throw new PropertyException("Buffer size must be positive: "
                    + bufferSize, "buffer_size", null);
    }

    /**
     * Returns true if the event starts inside the window. With no start bound
     * every event does; otherwise either set bound may open the window.
     */
    public boolean isWithinStart(LogEventHeader header)
    {
        if (startPosition == 0 && startTime == 0)
            return true;
        if (startPosition > 0 && header.getStartPosition() >= startPosition)
            return true;
        return startTime > 0 && header.getTimestamp() >= startTime;
    }

    /**
     * Returns true if the event lies past the end of the window, which ends
     * the walk.
     */
    public boolean isPastEnd(LogEventHeader header)
    {
        if (endPosition > 0 && header.getLogPos() > endPosition)
            return true;
        return endTime > 0 && header.getTimestamp() >= endTime;
    }

    public long getStartPosition()
    {
        return startPosition;
    }

    public void setStartPosition(long startPosition)
    {
        this.startPosition = startPosition;
    }

    public long getEndPosition()
    {
        return endPosition;
    }

    public void setEndPosition(long endPosition)
    {
        this.endPosition = endPosition;
    }

    public long getStartTime()
    {
        return startTime;
    }

    public void setStartTime(long startTime)
    {
        this.startTime = startTime;
    }

    public long getEndTime()
    {
        return endTime;
    }

    public void setEndTime(long endTime)
    {
        this.endTime = endTime;
    }

    /**
     * Returns true if a rows event without a table map is an error rather
     * than a warning.
     */
    public boolean isStrictTableMap()
    {
        return strictTableMap;
    }

    public void setStrictTableMap(boolean strictTableMap)
    {
        this.strictTableMap = strictTableMap;
    }

    public int getBufferSize()
    {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize)
    {
        this.bufferSize = bufferSize;
    }

    public String toString()
    {
        return "BinlogReaderOptions start_position=" + startPosition
                + " end_position=" + endPosition + " start_time=" + startTime
                + " end_time=" + endTime + " strict_table_map="
                + strictTableMap + " buffer_size=" + bufferSize;
    }
}
