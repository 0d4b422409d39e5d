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

import junit.framework.TestCase;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.BinlogStreamBuilder;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;

/**
 * Tests table map decoding, in particular per-type column metadata.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class TableMapEventDataTest extends TestCase
{
    private static final FormatDescriptionEventData V4 = FormatDescriptionEventData
                                                               .createDefault(4);

    /**
     * Verify names, column types and the null bit field.
     */
    public void testFields() throws Exception
    {
        byte[] types = {MysqlBinlog.MYSQL_TYPE_LONG,
                MysqlBinlog.MYSQL_TYPE_VARCHAR};
        byte[] metadata = {(byte) 0x2C, 0x01};
        TableMapEventData tableMap = new TableMapEventData(
                BinlogStreamBuilder.tableMapBody(0x010203040506L, "shop",
                        "orders", types, metadata), V4);

        assertEquals("table id", 0x010203040506L, tableMap.getTableId());
        assertEquals("flags", 1, tableMap.getFlags());
        assertEquals("database", "shop", tableMap.getDatabaseName());
        assertEquals("table", "orders", tableMap.getTableName());
        assertEquals("columns", 2, tableMap.getColumnsCount());
        assertEquals("type 0", MysqlBinlog.MYSQL_TYPE_LONG,
                tableMap.getColumnType(0));
        assertEquals("metadata per column", 2, tableMap.getMetadata().size());
        assertEquals("varchar length", 300, tableMap.getMetadata().get(1)
                .getMaxLength());
        assertEquals("int has none", ColumnMetadata.Kind.NONE, tableMap
                .getMetadata().get(0).getKind());
        assertTrue("nullable", tableMap.isNullable(1));
        assertEquals("null bits", 2, tableMap.getNullBits().size());
        assertEquals("kind", EventDataKind.TABLE_MAP, tableMap.getKind());
    }

    /**
     * Verify metadata of every kind is read with the right width.
     */
    public void testMetadataKinds() throws Exception
    {
        byte[] types = {(byte) MysqlBinlog.MYSQL_TYPE_STRING,
                (byte) MysqlBinlog.MYSQL_TYPE_STRING,
                (byte) MysqlBinlog.MYSQL_TYPE_NEWDECIMAL,
                MysqlBinlog.MYSQL_TYPE_BIT, (byte) MysqlBinlog.MYSQL_TYPE_BLOB,
                MysqlBinlog.MYSQL_TYPE_DATETIME2,
                (byte) MysqlBinlog.MYSQL_TYPE_ENUM,
                MysqlBinlog.MYSQL_TYPE_DOUBLE, MysqlBinlog.MYSQL_TYPE_DATE};
        byte[] metadata = {
                // CHAR(255) in utf8, 765 bytes
                (byte) 0xDE, (byte) 0xFD,
                // ENUM stored as STRING
                (byte) MysqlBinlog.MYSQL_TYPE_ENUM, 1,
                // DECIMAL(10,2)
                10, 2,
                // BIT(10)
                2, 1,
                // BLOB
                2,
                // DATETIME(3)
                3,
                // ENUM type code
                (byte) MysqlBinlog.MYSQL_TYPE_ENUM, 2,
                // DOUBLE
                8};
        TableMapEventData tableMap = new TableMapEventData(
                BinlogStreamBuilder.tableMapBody(7, "db", "t", types,
                        metadata), V4);

        ColumnMetadata chars = tableMap.getMetadata().get(0);
        assertEquals("char kind", ColumnMetadata.Kind.MAX_LENGTH,
                chars.getKind());
        assertEquals("char max length", 765, chars.getMaxLength());
        assertEquals("char real type", MysqlBinlog.MYSQL_TYPE_STRING,
                chars.getRealType());

        ColumnMetadata enumAsString = tableMap.getMetadata().get(1);
        assertEquals("enum kind", ColumnMetadata.Kind.ENUM_SET,
                enumAsString.getKind());
        assertEquals("enum real type", MysqlBinlog.MYSQL_TYPE_ENUM,
                enumAsString.getRealType());
        assertEquals("enum size", 1, enumAsString.getSize());
        assertEquals("column type kept", MysqlBinlog.MYSQL_TYPE_STRING,
                enumAsString.getColumnType());

        ColumnMetadata decimal = tableMap.getMetadata().get(2);
        assertEquals("precision", 10, decimal.getPrecision());
        assertEquals("decimals", 2, decimal.getDecimals());

        ColumnMetadata bit = tableMap.getMetadata().get(3);
        assertEquals("bits", 10, bit.getBits());
        assertEquals("bit bytes", 2, bit.getBytes());

        assertEquals("blob length size", 2, tableMap.getMetadata().get(4)
                .getLengthSize());
        assertEquals("fsp", 3, tableMap.getMetadata().get(5)
                .getFractionalSecondsPrecision());
        assertEquals("enum type size", 2, tableMap.getMetadata().get(6)
                .getSize());
        assertEquals("double size", 8, tableMap.getMetadata().get(7)
                .getLengthSize());
        assertEquals("date", ColumnMetadata.Kind.NONE, tableMap.getMetadata()
                .get(8).getKind());
        assertEquals("unrelated accessor", 0, tableMap.getMetadata().get(8)
                .getMaxLength());
    }

    /**
     * Verify a short CHAR keeps its declared length.
     */
    public void testShortChar() throws Exception
    {
        ColumnMetadata column = ColumnMetadata.decode(
                MysqlBinlog.MYSQL_TYPE_STRING, new byte[]{(byte) 0xFE, 0x40},
                0);
        assertEquals("max length", 64, column.getMaxLength());
        assertEquals("metadata width", 2, column.getLength());
    }

    /**
     * Verify unknown types and short metadata blocks are rejected.
     */
    public void testInvalidMetadata() throws Exception
    {
        try
        {
            new TableMapEventData(BinlogStreamBuilder.tableMapBody(7, "db",
                    "t", new byte[]{20}, new byte[0]), V4);
            fail("Decoded unknown column type");
        }
        catch (BinlogDecodeException e)
        {
        }

        try
        {
            new TableMapEventData(BinlogStreamBuilder.tableMapBody(7, "db",
                    "t", new byte[]{MysqlBinlog.MYSQL_TYPE_VARCHAR},
                    new byte[]{1}), V4);
            fail("Decoded truncated varchar metadata");
        }
        catch (BinlogDecodeException e)
        {
        }
    }

    /**
     * Verify metadata bytes left over after the last column are rejected.
     */
    public void testTrailingMetadata() throws Exception
    {
        try
        {
            new TableMapEventData(BinlogStreamBuilder.tableMapBody(7, "db",
                    "t", new byte[]{MysqlBinlog.MYSQL_TYPE_VARCHAR},
                    new byte[]{(byte) 0x2C, 0x01, 0x00}), V4);
            fail("Decoded table map with trailing metadata");
        }
        catch (BinlogDecodeException e)
        {
            assertTrue("message names the table",
                    e.getMessage().contains("db.t"));
        }
    }

    /**
     * Verify column types handed out cannot alter the decoded table map.
     */
    public void testColumnTypesCopied() throws Exception
    {
        TableMapEventData tableMap = new TableMapEventData(
                BinlogStreamBuilder.tableMapBody(7, "db", "t",
                        new byte[]{MysqlBinlog.MYSQL_TYPE_LONG}, new byte[0]),
                V4);
        tableMap.getColumnsTypes()[0] = MysqlBinlog.MYSQL_TYPE_DOUBLE;
        assertEquals("type kept", MysqlBinlog.MYSQL_TYPE_LONG,
                tableMap.getColumnType(0));
        assertEquals("array kept", MysqlBinlog.MYSQL_TYPE_LONG,
                tableMap.getColumnsTypes()[0]);
    }

    /**
     * Verify the null bit field must take exactly the remaining bytes.
     */
    public void testNullBitFieldLength() throws Exception
    {
        byte[] body = BinlogStreamBuilder.tableMapBody(7, "db", "t",
                new byte[]{MysqlBinlog.MYSQL_TYPE_LONG}, new byte[0]);

        byte[] longer = Arrays.copyOf(body, body.length + 1);
        try
        {
            new TableMapEventData(longer, V4);
            fail("Accepted trailing bytes");
        }
        catch (BinlogDecodeException e)
        {
        }

        byte[] shorter = Arrays.copyOf(body, body.length - 1);
        try
        {
            new TableMapEventData(shorter, V4);
            fail("Accepted missing null bit field");
        }
        catch (BinlogDecodeException e)
        {
        }
    }

    /**
     * Verify servers with a 6 byte post-header write 4 byte table ids.
     */
    public void testFourByteTableId() throws Exception
    {
        byte[] fd = BinlogStreamBuilder.formatDescriptionBody("5.0.1", 19);
        fd[MysqlBinlog.ST_POST_HEADER_LEN_OFFSET + MysqlBinlog.TABLE_MAP_EVENT
                - 1] = 6;
        FormatDescriptionEventData description = new FormatDescriptionEventData(
                fd, MysqlBinlog.BINLOG_CHECKSUM_ALG_UNDEF);

        byte[] wide = BinlogStreamBuilder.tableMapBody(0x01020304L, "db",
                "t", new byte[]{MysqlBinlog.MYSQL_TYPE_LONG}, new byte[0]);
        byte[] narrow = new byte[wide.length - 2];
        System.arraycopy(wide, 0, narrow, 0, 4);
        System.arraycopy(wide, 6, narrow, 4, wide.length - 6);

        TableMapEventData tableMap = new TableMapEventData(narrow,
                description);
        assertEquals("table id", 0x01020304L, tableMap.getTableId());
        assertEquals("table", "t", tableMap.getTableName());
    }
}
