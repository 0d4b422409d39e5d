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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import junit.framework.TestCase;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.BinlogStreamBuilder;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.TruncatedEventException;
import com.continuent.tungsten.binlog.mysql.UnknownStatusVariableException;

/**
 * Tests query event bodies and their status variables.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class QueryEventDataTest extends TestCase
{
    private static final FormatDescriptionEventData V4 = FormatDescriptionEventData
                                                               .createDefault(4);
    private static final FormatDescriptionEventData V3 = FormatDescriptionEventData
                                                               .createDefault(3);

    /**
     * Verify the fixed part, database name and query text.
     */
    public void testFields() throws Exception
    {
        QueryEventData query = new QueryEventData(queryBody(12, 3, 1064,
                "shop", "INSERT INTO t VALUES (1)", new byte[0], true), V4);
        assertEquals("thread", 12, query.getThreadId());
        assertEquals("exec time", 3, query.getExecTime());
        assertEquals("error code", 1064, query.getErrorCode());
        assertEquals("database", "shop", query.getDatabaseName());
        assertEquals("query", "INSERT INTO t VALUES (1)", query.getQuery());
        assertEquals("no status vars", 0, query.getStatusVariables().length);
        assertTrue("empty decode", query.decodeStatusVariables().getKeys()
                .isEmpty());
        assertEquals("kind", EventDataKind.QUERY, query.getKind());
    }

    /**
     * Verify v3 bodies have no status variable length.
     */
    public void testBinlogV3() throws Exception
    {
        QueryEventData query = new QueryEventData(queryBody(1, 0, 0, "",
                "BEGIN", null, false), V3);
        assertEquals("database", "", query.getDatabaseName());
        assertEquals("query", "BEGIN", query.getQuery());
        assertEquals("no status vars", 0, query.getStatusVariables().length);
    }

    /**
     * Verify a status variable block longer than the body is rejected.
     */
    public void testTruncatedStatusVariables() throws Exception
    {
        byte[] body = queryBody(1, 0, 0, "db", "", new byte[0], true);
        body[MysqlBinlog.Q_STATUS_VARS_LEN_OFFSET] = 100;
        try
        {
            new QueryEventData(body, V4);
            fail("Accepted oversized status variable block");
        }
        catch (TruncatedEventException e)
        {
        }
    }

    /**
     * Verify every known status variable decodes to its value.
     */
    public void testStatusVariables() throws Exception
    {
        ByteArrayOutputStream vars = new ByteArrayOutputStream();
        vars.write(MysqlBinlog.Q_FLAGS2_CODE);
        BinlogStreamBuilder.writeInt(vars, 0x4000, 4);
        vars.write(MysqlBinlog.Q_SQL_MODE_CODE);
        BinlogStreamBuilder.writeInt(vars, 1436549152L, 8);
        vars.write(MysqlBinlog.Q_CATALOG_NZ_CODE);
        writeString(vars, "std");
        vars.write(MysqlBinlog.Q_AUTO_INCREMENT);
        BinlogStreamBuilder.writeInt(vars, 2, 2);
        BinlogStreamBuilder.writeInt(vars, 1, 2);
        vars.write(MysqlBinlog.Q_CHARSET_CODE);
        BinlogStreamBuilder.writeInt(vars, 33, 2);
        BinlogStreamBuilder.writeInt(vars, 33, 2);
        BinlogStreamBuilder.writeInt(vars, 8, 2);
        vars.write(MysqlBinlog.Q_TIME_ZONE_CODE);
        writeString(vars, "SYSTEM");
        vars.write(MysqlBinlog.Q_LC_TIME_NAMES_CODE);
        BinlogStreamBuilder.writeInt(vars, 5, 2);
        vars.write(MysqlBinlog.Q_CHARSET_DATABASE_CODE);
        BinlogStreamBuilder.writeInt(vars, 45, 2);
        vars.write(MysqlBinlog.Q_TABLE_MAP_FOR_UPDATE_CODE);
        BinlogStreamBuilder.writeInt(vars, 3, 8);
        vars.write(MysqlBinlog.Q_MASTER_DATA_WRITTEN_CODE);
        BinlogStreamBuilder.writeInt(vars, 999, 4);
        vars.write(MysqlBinlog.Q_INVOKER);
        writeString(vars, "root");
        writeString(vars, "localhost");
        vars.write(MysqlBinlog.Q_UPDATED_DB_NAMES);
        vars.write(2);
        writeNulTerminated(vars, "shop");
        writeNulTerminated(vars, "audit");
        vars.write(MysqlBinlog.Q_MICROSECONDS);
        BinlogStreamBuilder.writeInt(vars, 123456, 3);
        vars.write(MysqlBinlog.Q_EXPLICIT_DEFAULTS_FOR_TIMESTAMP);
        vars.write(1);
        vars.write(MysqlBinlog.Q_DDL_LOGGED_WITH_XID);
        BinlogStreamBuilder.writeInt(vars, 42, 8);
        vars.write(MysqlBinlog.Q_DEFAULT_COLLATION_FOR_UTF8MB4);
        BinlogStreamBuilder.writeInt(vars, 255, 2);
        vars.write(MysqlBinlog.Q_SQL_REQUIRE_PRIMARY_KEY);
        vars.write(1);
        vars.write(MysqlBinlog.Q_DEFAULT_TABLE_ENCRYPTION);
        vars.write(0);

        QueryEventData query = new QueryEventData(queryBody(5, 0, 0, "shop",
                "CREATE TABLE t (id int)", vars.toByteArray(), true), V4);
        assertEquals("query after status vars", "CREATE TABLE t (id int)",
                query.getQuery());
        assertEquals("database after status vars", "shop",
                query.getDatabaseName());

        QueryStatusVariables status = query.decodeStatusVariables();
        assertEquals("key count", 18, status.getKeys().size());
        assertEquals("first key", Integer.valueOf(MysqlBinlog.Q_FLAGS2_CODE),
                status.getKeys().get(0));
        assertEquals("flags2", Long.valueOf(0x4000), status.getFlags2());
        assertEquals("sql mode", Long.valueOf(1436549152L),
                status.getSqlMode());
        assertEquals("catalog", "std", status.getCatalog());
        assertEquals("auto inc increment", Integer.valueOf(2),
                status.getAutoIncrementIncrement());
        assertEquals("auto inc offset", Integer.valueOf(1),
                status.getAutoIncrementOffset());
        assertEquals("client charset", Integer.valueOf(33),
                status.getClientCharset());
        assertEquals("collation connection", Integer.valueOf(33),
                status.getCollationConnection());
        assertEquals("collation server", Integer.valueOf(8),
                status.getCollationServer());
        assertEquals("time zone", "SYSTEM", status.getTimeZone());
        assertEquals("lc time names", Integer.valueOf(5),
                status.getLcTimeNames());
        assertEquals("charset database", Integer.valueOf(45),
                status.getCharsetDatabase());
        assertEquals("table map for update", Long.valueOf(3),
                status.getTableMapForUpdate());
        assertEquals("master data written", Long.valueOf(999),
                status.getMasterDataWritten());
        assertEquals("invoker user", "root", status.getInvokerUser());
        assertEquals("invoker host", "localhost", status.getInvokerHost());
        assertEquals("updated dbs", 2, status.getUpdatedDbNames().size());
        assertEquals("updated db 2", "audit", status.getUpdatedDbNames()
                .get(1));
        assertEquals("microseconds", Integer.valueOf(123456),
                status.getMicroseconds());
        assertEquals("explicit defaults", Boolean.TRUE,
                status.getExplicitDefaultsForTimestamp());
        assertEquals("ddl xid", Long.valueOf(42), status.getDdlLoggedWithXid());
        assertEquals("utf8mb4 collation", Integer.valueOf(255),
                status.getDefaultCollationForUtf8mb4());
        assertEquals("require pk", Integer.valueOf(1),
                status.getSqlRequirePrimaryKey());
        assertEquals("table encryption", Integer.valueOf(0),
                status.getDefaultTableEncryption());
        assertTrue("contains invoker", status.contains(MysqlBinlog.Q_INVOKER));
        assertFalse("no old catalog", status.contains(MysqlBinlog.Q_CATALOG_CODE));
    }

    /**
     * Verify the old NUL terminated catalog and the too-many-databases
     * marker.
     */
    public void testOldCatalogAndManyDatabases() throws Exception
    {
        ByteArrayOutputStream vars = new ByteArrayOutputStream();
        vars.write(MysqlBinlog.Q_CATALOG_CODE);
        writeString(vars, "std");
        vars.write(0);
        vars.write(MysqlBinlog.Q_UPDATED_DB_NAMES);
        vars.write(MysqlBinlog.OVER_MAX_DBS_IN_EVENT_MTS);
        vars.write(MysqlBinlog.Q_FLAGS2_CODE);
        BinlogStreamBuilder.writeInt(vars, 1, 4);

        QueryEventData query = new QueryEventData(queryBody(5, 0, 0, "",
                "DROP DATABASE a", vars.toByteArray(), true), V4);
        QueryStatusVariables status = query.decodeStatusVariables();
        assertEquals("catalog", "std", status.getCatalog());
        assertTrue("no names listed", status.getUpdatedDbNames().isEmpty());
        assertEquals("flags2 after marker", Long.valueOf(1),
                status.getFlags2());
        assertNull("absent value", status.getSqlMode());
    }

    /**
     * Verify an old style catalog must end with its NUL byte.
     */
    public void testOldCatalogWithoutNul() throws Exception
    {
        ByteArrayOutputStream vars = new ByteArrayOutputStream();
        vars.write(MysqlBinlog.Q_CATALOG_CODE);
        writeString(vars, "std");
        try
        {
            QueryStatusVariables.decode(vars.toByteArray());
            fail("Decoded catalog missing its NUL");
        }
        catch (TruncatedEventException e)
        {
        }

        vars.write(MysqlBinlog.Q_SQL_MODE_CODE);
        BinlogStreamBuilder.writeInt(vars, 0, 8);
        try
        {
            QueryStatusVariables.decode(vars.toByteArray());
            fail("Decoded catalog followed by another variable");
        }
        catch (BinlogDecodeException e)
        {
            assertTrue("message", e.getMessage().contains("NUL"));
        }
    }

    /**
     * Verify an unknown key stops status decoding but not the query.
     */
    public void testUnknownStatusVariable() throws Exception
    {
        ByteArrayOutputStream vars = new ByteArrayOutputStream();
        vars.write(MysqlBinlog.Q_FLAGS2_CODE);
        BinlogStreamBuilder.writeInt(vars, 0, 4);
        vars.write(99);
        vars.write(1);

        QueryEventData query = new QueryEventData(queryBody(5, 0, 0, "db",
                "SELECT 1", vars.toByteArray(), true), V4);
        assertEquals("query still readable", "SELECT 1", query.getQuery());
        try
        {
            query.decodeStatusVariables();
            fail("Decoded unknown status variable");
        }
        catch (UnknownStatusVariableException e)
        {
            assertEquals("key", 99, e.getKey());
        }
    }

    /**
     * Verify a truncated value and an unterminated database list are errors.
     */
    public void testMalformedStatusVariables() throws Exception
    {
        try
        {
            QueryStatusVariables.decode(new byte[]{
                    MysqlBinlog.Q_SQL_MODE_CODE, 1, 2});
            fail("Decoded truncated sql mode");
        }
        catch (BinlogDecodeException e)
        {
        }

        try
        {
            QueryStatusVariables.decode(new byte[]{
                    MysqlBinlog.Q_UPDATED_DB_NAMES, 1, 'a', 'b'});
            fail("Decoded unterminated database name");
        }
        catch (BinlogDecodeException e)
        {
        }
    }

    private static byte[] queryBody(long threadId, long execTime,
            int errorCode, String database, String sql, byte[] statusVariables,
            boolean v4)
    {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] db = database.getBytes(StandardCharsets.UTF_8);
        BinlogStreamBuilder.writeInt(body, threadId, 4);
        BinlogStreamBuilder.writeInt(body, execTime, 4);
        body.write(db.length);
        BinlogStreamBuilder.writeInt(body, errorCode, 2);
        if (v4)
        {
            BinlogStreamBuilder.writeInt(body, statusVariables.length, 2);
            body.write(statusVariables, 0, statusVariables.length);
        }
        body.write(db, 0, db.length);
        body.write(0);
        byte[] query = sql.getBytes(StandardCharsets.UTF_8);
        body.write(query, 0, query.length);
        return body.toByteArray();
    }

    private static void writeString(ByteArrayOutputStream os, String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        os.write(bytes.length);
        os.write(bytes, 0, bytes.length);
    }

    private static void writeNulTerminated(ByteArrayOutputStream os,
            String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        os.write(bytes, 0, bytes.length);
        os.write(0);
    }
}
