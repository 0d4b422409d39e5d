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

import java.util.Arrays;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.Bitfield;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.PackedInteger;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of a write, update or delete rows event of any version.
 * <p>
 * Fixed data part:
 * <ul>
 * <li>6 bytes. The table ID (4 bytes for servers writing a 6 byte
 * post-header).</li>
 * <li>2 bytes. Flags.</li>
 * <li>Version 2 only: 2 bytes holding the length of the extra data,
 * including these 2 bytes, followed by the extra data.</li>
 * </ul>
 * <p>
 * Variable data part:
 * <ul>
 * <li>Packed integer. The number of columns in the table.</li>
 * <li>Variable-sized. Bit-field indicating whether each column is used, one
 * bit per column.</li>
 * <li>Variable-sized (for UPDATE events only). Bit-field indicating whether
 * each column is used in the after image.</li>
 * <li>Variable-sized. The row images. They are kept packed as found; values
 * need the table map to be read.</li>
 * </ul>
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class RowsEventData extends EventData
{
    static Logger logger = Logger.getLogger(RowsEventData.class);

    public enum Action
    {
        WRITE, UPDATE, DELETE
    }

    private int               eventType;
    private int               version;
    private Action            action;
    private long              tableId;
    private int               flags;
    private byte[]            extraData;
    private int               columnsNumber;
    private Bitfield          usedColumns;
    private Bitfield          usedColumnsForUpdate;
    private byte[]            packedRows;
    private TableMapEventData tableMap;

    public RowsEventData(byte[] body, int eventType,
            FormatDescriptionEventData description)
            throws BinlogDecodeException
    {
        this.eventType = eventType;
        this.version = versionOf(eventType);
        this.action = actionOf(eventType);

        /* Read the fixed data part */
        int index = 0;
        int tableIdLength = description.getTableIdLength(eventType);
        tableId = LittleEndianConversion.convertNBytesToLong(body, index,
                tableIdLength);
        index += tableIdLength;
        flags = LittleEndianConversion.convert2BytesToInt(body, index);
        index += 2;

        if (version == 2)
        {
            int extraDataLength = LittleEndianConversion.convert2BytesToInt(
                    body, index);
            if (extraDataLength < 2)
                throw new BinlogDecodeException(
                        "Invalid rows event extra data length: "
                                + extraDataLength);
            LittleEndianConversion.checkAvailable(body, index,
                    extraDataLength);
            extraData = Arrays.copyOfRange(body, index + 2, index
                    + extraDataLength);
            index += extraDataLength;
        }
        else
            extraData = new byte[0];

        /* Read the variable data part of the event */
        PackedInteger columns = MysqlBinlog.decodePackedInteger(body, index);
        if (columns.isNull() || columns.getValue() > Integer.MAX_VALUE)
            throw new BinlogDecodeException("Invalid column count " + columns
                    + " in rows event for table id " + tableId);
        columnsNumber = (int) columns.getValue();
        index += columns.getLength();

        usedColumns = new Bitfield(body, index, columnsNumber);
        index += usedColumns.getLength();

        if (action == Action.UPDATE)
        {
            usedColumnsForUpdate = new Bitfield(body, index, columnsNumber);
            index += usedColumnsForUpdate.getLength();
        }

        packedRows = Arrays.copyOfRange(body, index, body.length);

        if (logger.isDebugEnabled())
            logger.debug("Rows event: type=" + eventType + " table_id="
                    + tableId + " columns=" + columnsNumber + " used="
                    + usedColumns + " rows_length=" + packedRows.length);
    }

    /**
     * Returns 0, 1 or 2 for pre-GA, v1 and v2 rows events.
     */
    public static int versionOf(int eventType)
    {
        if (eventType >= MysqlBinlog.PRE_GA_WRITE_ROWS_EVENT
                && eventType <= MysqlBinlog.PRE_GA_DELETE_ROWS_EVENT)
            return 0;
        else if (eventType >= MysqlBinlog.WRITE_ROWS_EVENT
                && eventType <= MysqlBinlog.DELETE_ROWS_EVENT)
            return 1;
        else if (eventType >= MysqlBinlog.NEW_WRITE_ROWS_EVENT
                && eventType <= MysqlBinlog.NEW_DELETE_ROWS_EVENT)
            return 2;
        throw new IllegalArgumentException("Not a rows event type: "
                + eventType);
    }

    public static Action actionOf(int eventType)
    {
        switch (eventType)
        {
            case MysqlBinlog.PRE_GA_WRITE_ROWS_EVENT :
            case MysqlBinlog.WRITE_ROWS_EVENT :
            case MysqlBinlog.NEW_WRITE_ROWS_EVENT :
                return Action.WRITE;
            case MysqlBinlog.PRE_GA_UPDATE_ROWS_EVENT :
            case MysqlBinlog.UPDATE_ROWS_EVENT :
            case MysqlBinlog.NEW_UPDATE_ROWS_EVENT :
                return Action.UPDATE;
            case MysqlBinlog.PRE_GA_DELETE_ROWS_EVENT :
            case MysqlBinlog.DELETE_ROWS_EVENT :
            case MysqlBinlog.NEW_DELETE_ROWS_EVENT :
                return Action.DELETE;
            default :
                throw new IllegalArgumentException("Not a rows event type: "
                        + eventType);
        }
    }

    public EventDataKind getKind()
    {
        return EventDataKind.ROWS;
    }

    public int getEventType()
    {
        return eventType;
    }

    public int getVersion()
    {
        return version;
    }

    public Action getAction()
    {
        return action;
    }

    public long getTableId()
    {
        return tableId;
    }

    public int getFlags()
    {
        return flags;
    }

    /** Version 2 extra data without its length, empty if there is none. */
    public byte[] getExtraData()
    {
        return extraData.clone();
    }

    public int getColumnsNumber()
    {
        return columnsNumber;
    }

    /** Columns present in the row image (before image for updates). */
    public Bitfield getUsedColumns()
    {
        return usedColumns;
    }

    /** Columns present in the after image of updates, null otherwise. */
    public Bitfield getUsedColumnsForUpdate()
    {
        return usedColumnsForUpdate;
    }

    /** Row images, still packed. */
    public byte[] getPackedRows()
    {
        return packedRows.clone();
    }

    /**
     * Returns the table map the rows refer to, or null if none was found in
     * the stream and the reader was told not to insist on it.
     */
    public TableMapEventData getTableMap()
    {
        return tableMap;
    }

    public void setTableMap(TableMapEventData tableMap)
    {
        this.tableMap = tableMap;
    }

    public String toString()
    {
        StringBuffer sb = new StringBuffer();
        sb.append("Rows v").append(version).append(' ').append(action);
        sb.append(" table_id=").append(tableId);
        if (tableMap != null)
            sb.append(" table=").append(tableMap.getDatabaseName())
                    .append('.').append(tableMap.getTableName());
        sb.append(" columns=").append(columnsNumber);
        return sb.toString();
    }
}
