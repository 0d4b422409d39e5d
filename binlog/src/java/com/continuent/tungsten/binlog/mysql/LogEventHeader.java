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
 * Initial developer(s): Seppo Jaakola
 * Contributor(s): Stephane Giron
 */

package com.continuent.tungsten.binlog.mysql;

import java.sql.Timestamp;

import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Common header found at the start of every binlog event. Legacy streams use a
 * 13 byte header which stops after the event size; later streams add the log
 * position and the flags for a total of 19 bytes.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class LogEventHeader
{
    private final long timestamp;
    private final int  eventType;
    private final long serverId;
    private final long eventSize;
    private final long logPos;
    private final int  flags;

    public LogEventHeader(long timestamp, int eventType, long serverId,
            long eventSize, long logPos, int flags)
    {
        this.timestamp = timestamp;
        this.eventType = eventType;
        this.serverId = serverId;
        this.eventSize = eventSize;
        this.logPos = logPos;
        this.flags = flags;
    }

    /**
     * Decodes a header.
     *
     * @param buffer Buffer starting with the header
     * @param headerLength Header length in effect for the stream, 13 or more
     * @throws InvalidHeaderException If the length is unusable or the buffer
     *             holds fewer bytes than the header length
     */
    public static LogEventHeader decode(byte[] buffer, int headerLength)
            throws InvalidHeaderException
    {
        if (headerLength < MysqlBinlog.OLD_HEADER_LEN)
            throw new InvalidHeaderException("Header length " + headerLength
                    + " is shorter than the minimum of "
                    + MysqlBinlog.OLD_HEADER_LEN);
        if (buffer == null || buffer.length < headerLength)
            throw new InvalidHeaderException("Expected " + headerLength
                    + " header bytes but got "
                    + (buffer == null ? 0 : buffer.length));

        try
        {
            long timestamp = LittleEndianConversion.convert4BytesToLong(
                    buffer, 0);
            int eventType = LittleEndianConversion.convert1ByteToInt(buffer,
                    MysqlBinlog.EVENT_TYPE_OFFSET);
            long serverId = LittleEndianConversion.convert4BytesToLong(buffer,
                    MysqlBinlog.SERVER_ID_OFFSET);
            long eventSize = LittleEndianConversion.convert4BytesToLong(
                    buffer, MysqlBinlog.EVENT_LEN_OFFSET);

            long logPos = 0;
            int flags = 0;
            if (headerLength > MysqlBinlog.OLD_HEADER_LEN)
            {
                logPos = LittleEndianConversion.convert4BytesToLong(buffer,
                        MysqlBinlog.LOG_POS_OFFSET);
                flags = LittleEndianConversion.convert2BytesToInt(buffer,
                        MysqlBinlog.FLAGS_OFFSET);
            }
            return new LogEventHeader(timestamp, eventType, serverId,
                    eventSize, logPos, flags);
        }
        catch (TruncatedEventException e)
        {
            // Cannot happen once the length check passed.
            throw new InvalidHeaderException("Unable to decode event header: "
                    + e.getMessage());
        }
    }

    /** Seconds since the epoch at which the event was written. */
    public long getTimestamp()
    {
        return timestamp;
    }

    public Timestamp getWhen()
    {
        return new Timestamp(timestamp * 1000);
    }

    public int getEventType()
    {
        return eventType;
    }

    public String getTypeName()
    {
        return MysqlBinlog.getTypeName(eventType);
    }

    public long getServerId()
    {
        return serverId;
    }

    /** Total length of the event including header, body and checksum. */
    public long getEventSize()
    {
        return eventSize;
    }

    /**
     * Returns the position for the next event, i.e. the end offset of this
     * one.
     */
    public long getLogPos()
    {
        return logPos;
    }

    public int getFlags()
    {
        return flags;
    }

    /**
     * Returns the offset at which the event starts according to its own
     * header.
     */
    public long getStartPosition()
    {
        return logPos - eventSize;
    }

    public boolean equals(Object o)
    {
        if (!(o instanceof LogEventHeader))
            return false;
        LogEventHeader other = (LogEventHeader) o;
        return timestamp == other.timestamp && eventType == other.eventType
                && serverId == other.serverId && eventSize == other.eventSize
                && logPos == other.logPos && flags == other.flags;
    }

    public int hashCode()
    {
        int hash = (int) (timestamp ^ (timestamp >>> 32));
        hash = 31 * hash + eventType;
        hash = 31 * hash + (int) serverId;
        hash = 31 * hash + (int) eventSize;
        hash = 31 * hash + (int) logPos;
        return 31 * hash + flags;
    }

    public String toString()
    {
        StringBuffer sb = new StringBuffer();
        sb.append(getTypeName());
        sb.append(" timestamp=").append(timestamp);
        sb.append(" server_id=").append(serverId);
        sb.append(" event_size=").append(eventSize);
        sb.append(" log_pos=").append(logPos);
        sb.append(" flags=0x").append(Integer.toHexString(flags));
        return sb.toString();
    }
}
