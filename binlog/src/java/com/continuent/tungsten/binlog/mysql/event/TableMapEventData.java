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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.Bitfield;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.PackedInteger;
import com.continuent.tungsten.binlog.mysql.PackedString;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of a table map event, which binds a table id to a table definition for
 * the rows events that follow.
 * <p>
 * Fixed data part:
 * <ul>
 * <li>6 bytes. The table ID (4 bytes for servers writing a 6 byte
 * post-header).</li>
 * <li>2 bytes. Reserved for future use.</li>
 * </ul>
 * <p>
 * Variable data part:
 * <ul>
 * <li>1 byte. The length of the database name.</li>
 * <li>Variable-sized. The database name (null-terminated).</li>
 * <li>1 byte. The length of the table name.</li>
 * <li>Variable-sized. The table name (null-terminated).</li>
 * <li>Packed integer. The number of columns in the table.</li>
 * <li>Variable-sized. An array of column types, one byte per column.</li>
 * <li>Packed integer. The length of the metadata block.</li>
 * <li>Variable-sized. The metadata block.</li>
 * <li>Variable-sized. Bit-field indicating whether each column can be NULL,
 * one bit per column. For this field, the amount of storage required for N
 * columns is INT((N+7)/8) bytes.</li>
 * </ul>
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class TableMapEventData extends EventData
{
    static Logger                logger = Logger.getLogger(TableMapEventData.class);

    private long                 tableId;
    private int                  flags;
    private String               databaseName;
    private String               tableName;
    private int                  columnsCount;
    private byte[]               columnsTypes;
    private List<ColumnMetadata> metadata;
    private Bitfield             nullBits;

    public TableMapEventData(byte[] body,
            FormatDescriptionEventData description)
            throws BinlogDecodeException
    {
        int index = 0;
        int tableIdLength = description
                .getTableIdLength(MysqlBinlog.TABLE_MAP_EVENT);
        tableId = LittleEndianConversion.convertNBytesToLong(body, index,
                tableIdLength);
        index += tableIdLength;
        flags = LittleEndianConversion.convert2BytesToInt(body, index);
        index += 2;

        /* Extract the length of the various parts from the buffer */
        int databaseNameLength = LittleEndianConversion.convert1ByteToInt(
                body, index);
        index++;
        LittleEndianConversion.checkAvailable(body, index,
                databaseNameLength + 1);
        databaseName = new String(body, index, databaseNameLength,
                StandardCharsets.UTF_8);
        /* Length of database name + terminating null */
        index += databaseNameLength + 1;

        int tableNameLength = LittleEndianConversion.convert1ByteToInt(body,
                index);
        index++;
        LittleEndianConversion.checkAvailable(body, index, tableNameLength + 1);
        tableName = new String(body, index, tableNameLength,
                StandardCharsets.UTF_8);
        index += tableNameLength + 1;

        PackedInteger count = MysqlBinlog.decodePackedInteger(body, index);
        if (count.isNull() || count.getValue() > Integer.MAX_VALUE)
            throw new BinlogDecodeException("Invalid column count " + count
                    + " in table map for " + databaseName + "." + tableName);
        columnsCount = (int) count.getValue();
        index += count.getLength();

        LittleEndianConversion.checkAvailable(body, index, columnsCount);
        columnsTypes = new byte[columnsCount];
        System.arraycopy(body, index, columnsTypes, 0, columnsCount);
        index += columnsCount;

        PackedString metadataBlock = MysqlBinlog.decodePackedString(body,
                index);
        index += metadataBlock.getLength();
        metadata = buildMetadata(metadataBlock.getBytes());

        int nullBitsLength = MysqlBinlog.bitFieldLength(columnsCount);
        if (body.length - index != nullBitsLength)
            throw new BinlogDecodeException("Table map for " + databaseName
                    + "." + tableName + " has " + (body.length - index)
                    + " bytes left for the null bit field, expected "
                    + nullBitsLength);
        nullBits = new Bitfield(body, index, columnsCount);

        if (logger.isDebugEnabled())
            logger.debug("Table map: id=" + tableId + " table="
                    + databaseName + "." + tableName + " columns="
                    + columnsCount + " metadata=" + metadata);
    }

    private List<ColumnMetadata> buildMetadata(byte[] block)
            throws BinlogDecodeException
    {
        if (block == null)
            block = new byte[0];
        List<ColumnMetadata> columns = new ArrayList<ColumnMetadata>(
                columnsCount);
        int index = 0;
        for (int i = 0; i < columnsCount; i++)
        {
            int columnType = columnsTypes[i] & 0xFF;
            ColumnMetadata column = ColumnMetadata.decode(columnType, block,
                    index);
            index += column.getLength();
            columns.add(column);
        }
        if (index != block.length)
            throw new BinlogDecodeException("Table map for " + databaseName
                    + "." + tableName + " has " + block.length
                    + " bytes of column metadata, columns use " + index);
        return Collections.unmodifiableList(columns);
    }

    public EventDataKind getKind()
    {
        return EventDataKind.TABLE_MAP;
    }

    public long getTableId()
    {
        return tableId;
    }

    public int getFlags()
    {
        return flags;
    }

    public String getDatabaseName()
    {
        return databaseName;
    }

    public String getTableName()
    {
        return tableName;
    }

    public int getColumnsCount()
    {
        return columnsCount;
    }

    public byte[] getColumnsTypes()
    {
        return columnsTypes.clone();
    }

    public int getColumnType(int column)
    {
        return columnsTypes[column] & 0xFF;
    }

    public List<ColumnMetadata> getMetadata()
    {
        return metadata;
    }

    /** Bit i is set if column i accepts NULL. */
    public Bitfield getNullBits()
    {
        return nullBits;
    }

    public boolean isNullable(int column)
    {
        return nullBits.get(column);
    }

    public String toString()
    {
        return "Table_map table_id=" + tableId + " table=" + databaseName
                + "." + tableName + " columns=" + columnsCount;
    }
}
