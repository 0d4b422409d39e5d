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

package com.continuent.tungsten.binlog.mysql.event;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of a query event.
 * <p>
 * Fixed data part:
 * <ul>
 * <li>4 bytes. The ID of the thread that issued this statement.</li>
 * <li>4 bytes. The time in seconds that the statement took to execute.</li>
 * <li>1 byte. The length of the name of the database which was the default
 * database when the statement was executed.</li>
 * <li>2 bytes. The error code resulting from execution of the statement on
 * the master.</li>
 * <li>2 bytes (binlog v4 only). The length of the status variable block.</li>
 * </ul>
 * Variable part: the status variables, the default database name followed
 * by a NUL, and the statement text up to the end of the body.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class QueryEventData extends EventData
{
    private long   threadId;
    private long   execTime;
    private int    errorCode;
    private String databaseName;
    private byte[] statusVariables;
    private byte[] query;

    public QueryEventData(byte[] body, FormatDescriptionEventData description)
            throws BinlogDecodeException
    {
        threadId = LittleEndianConversion.convert4BytesToLong(body,
                MysqlBinlog.Q_THREAD_ID_OFFSET);
        execTime = LittleEndianConversion.convert4BytesToLong(body,
                MysqlBinlog.Q_EXEC_TIME_OFFSET);
        int databaseNameLength = LittleEndianConversion.convert1ByteToInt(
                body, MysqlBinlog.Q_DB_LEN_OFFSET);
        errorCode = LittleEndianConversion.convert2BytesToInt(body,
                MysqlBinlog.Q_ERR_CODE_OFFSET);

        int offset = MysqlBinlog.QUERY_HEADER_MINIMAL_LEN;
        if (description.getBinlogVersion() >= 4)
        {
            int statusVariablesLength = LittleEndianConversion
                    .convert2BytesToInt(body,
                            MysqlBinlog.Q_STATUS_VARS_LEN_OFFSET);
            offset = MysqlBinlog.QUERY_HEADER_LEN;
            LittleEndianConversion.checkAvailable(body, offset,
                    statusVariablesLength);
            statusVariables = Arrays.copyOfRange(body, offset, offset
                    + statusVariablesLength);
            offset += statusVariablesLength;
        }
        else
            statusVariables = new byte[0];

        // Database name and its NUL terminator.
        LittleEndianConversion.checkAvailable(body, offset,
                databaseNameLength + 1);
        databaseName = new String(body, offset, databaseNameLength,
                StandardCharsets.UTF_8);
        offset += databaseNameLength + 1;

        query = Arrays.copyOfRange(body, offset, body.length);
    }

    public EventDataKind getKind()
    {
        return EventDataKind.QUERY;
    }

    public long getThreadId()
    {
        return threadId;
    }

    public long getExecTime()
    {
        return execTime;
    }

    public int getErrorCode()
    {
        return errorCode;
    }

    public String getDatabaseName()
    {
        return databaseName;
    }

    /** Raw status variable block. */
    public byte[] getStatusVariables()
    {
        return statusVariables.clone();
    }

    /**
     * Decodes the status variable block.
     *
     * @throws BinlogDecodeException If the block holds a key whose length is
     *             unknown or is truncated. The query itself stays usable.
     */
    public QueryStatusVariables decodeStatusVariables()
            throws BinlogDecodeException
    {
        return QueryStatusVariables.decode(statusVariables);
    }

    /** Statement text as raw bytes, in the client character set. */
    public byte[] getQueryBytes()
    {
        return query.clone();
    }

    public String getQuery()
    {
        return new String(query, StandardCharsets.UTF_8);
    }

    public String toString()
    {
        return "Query thread_id=" + threadId + " exec_time=" + execTime
                + " error_code=" + errorCode + " db=" + databaseName
                + " query=" + getQuery();
    }
}
