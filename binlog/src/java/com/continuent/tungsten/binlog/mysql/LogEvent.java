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

import com.continuent.tungsten.binlog.mysql.event.EventData;

/**
 * A decoded binlog event: the common header, the decoded body and the
 * checksum that protected it.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class LogEvent
{
    private final LogEventHeader header;
    private final EventData      data;
    private final int            checksumAlgorithm;
    private final long           checksum;
    private final long           position;

    public LogEvent(LogEventHeader header, EventData data,
            ValidatedBody validated, long position)
    {
        this.header = header;
        this.data = data;
        this.checksumAlgorithm = validated.getChecksumAlgorithm();
        this.checksum = validated.getChecksum();
        this.position = position;
    }

    public LogEventHeader getHeader()
    {
        return header;
    }

    public int getType()
    {
        return header.getEventType();
    }

    public EventData getData()
    {
        return data;
    }

    /**
     * Returns the checksum algorithm of the event, see the
     * BINLOG_CHECKSUM_ALG constants in {@link MysqlBinlog}.
     */
    public int getChecksumAlgorithm()
    {
        return checksumAlgorithm;
    }

    /** Returns true if a checksum was stored with the event. */
    public boolean hasChecksum()
    {
        return checksum >= 0;
    }

    /** Stored checksum value, or -1 if there is none. */
    public long getChecksum()
    {
        return checksum;
    }

    /** Offset of the first byte of the event within the stream. */
    public long getPosition()
    {
        return position;
    }

    /** Returns the position for the next event. */
    public long getNextEventPosition()
    {
        return header.getLogPos();
    }

    public String toString()
    {
        return "position=" + position + " " + header + " : " + data;
    }
}
