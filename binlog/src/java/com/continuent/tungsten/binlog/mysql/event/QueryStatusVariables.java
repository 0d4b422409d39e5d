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

package com.continuent.tungsten.binlog.mysql.event;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.UnknownStatusVariableException;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Session state logged with a query: each entry is a one byte key followed by
 * a value whose layout depends on the key. Values that were not logged stay
 * null.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class QueryStatusVariables
{
    private static Logger logger         = Logger.getLogger(QueryStatusVariables.class);

    private List<Integer> keys           = new ArrayList<Integer>();
    private Long          flags2;
    private Long          sqlMode;
    private String        catalog;
    private Integer       autoIncrementIncrement;
    private Integer       autoIncrementOffset;
    private Integer       clientCharset;
    private Integer       collationConnection;
    private Integer       collationServer;
    private String        timeZone;
    private Integer       lcTimeNames;
    private Integer       charsetDatabase;
    private Long          tableMapForUpdate;
    private Long          masterDataWritten;
    private String        invokerUser;
    private String        invokerHost;
    private List<String>  updatedDbNames;
    private Integer       microseconds;
    private Boolean       explicitDefaultsForTimestamp;
    private Long          ddlLoggedWithXid;
    private Integer       defaultCollationForUtf8mb4;
    private Integer       sqlRequirePrimaryKey;
    private Integer       defaultTableEncryption;

    private QueryStatusVariables()
    {
    }

    /**
     * Decodes a status variable block.
     *
     * @throws UnknownStatusVariableException On a key this decoder does not
     *             know the length of
     * @throws BinlogDecodeException If a value runs past the end of the block
     */
    public static QueryStatusVariables decode(byte[] buffer)
            throws BinlogDecodeException
    {
        QueryStatusVariables vars = new QueryStatusVariables();
        int pos = 0;
        while (pos < buffer.length)
        {
            int key = buffer[pos] & 0xFF;
            int keyOffset = pos;
            pos++;
            switch (key)
            {
                case MysqlBinlog.Q_FLAGS2_CODE :
                    vars.flags2 = LittleEndianConversion.convert4BytesToLong(
                            buffer, pos);
                    pos += 4;
                    break;
                case MysqlBinlog.Q_SQL_MODE_CODE :
                    vars.sqlMode = LittleEndianConversion.convert8BytesToLong(
                            buffer, pos);
                    pos += 8;
                    break;
                case MysqlBinlog.Q_CATALOG_CODE :
                    vars.catalog = readLengthPrefixedString(buffer, pos);
                    pos += 1 + vars.catalog.length();
                    // Old style catalog is followed by a NUL.
                    if (LittleEndianConversion.convert1ByteToInt(buffer, pos) != 0)
                        throw new BinlogDecodeException(
                                "Old style catalog is not NUL terminated at status variable offset "
                                        + keyOffset);
                    pos++;
                    break;
                case MysqlBinlog.Q_AUTO_INCREMENT :
                    vars.autoIncrementIncrement = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos);
                    vars.autoIncrementOffset = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos + 2);
                    pos += 4;
                    break;
                case MysqlBinlog.Q_CHARSET_CODE :
                    vars.clientCharset = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos);
                    vars.collationConnection = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos + 2);
                    vars.collationServer = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos + 4);
                    pos += 6;
                    break;
                case MysqlBinlog.Q_TIME_ZONE_CODE :
                    vars.timeZone = readLengthPrefixedString(buffer, pos);
                    pos += 1 + vars.timeZone.length();
                    break;
                case MysqlBinlog.Q_CATALOG_NZ_CODE :
                    vars.catalog = readLengthPrefixedString(buffer, pos);
                    pos += 1 + vars.catalog.length();
                    break;
                case MysqlBinlog.Q_LC_TIME_NAMES_CODE :
                    vars.lcTimeNames = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos);
                    pos += 2;
                    break;
                case MysqlBinlog.Q_CHARSET_DATABASE_CODE :
                    vars.charsetDatabase = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos);
                    pos += 2;
                    break;
                case MysqlBinlog.Q_TABLE_MAP_FOR_UPDATE_CODE :
                    vars.tableMapForUpdate = LittleEndianConversion
                            .convert8BytesToLong(buffer, pos);
                    pos += 8;
                    break;
                case MysqlBinlog.Q_MASTER_DATA_WRITTEN_CODE :
                    vars.masterDataWritten = LittleEndianConversion
                            .convert4BytesToLong(buffer, pos);
                    pos += 4;
                    break;
                case MysqlBinlog.Q_INVOKER :
                    vars.invokerUser = readLengthPrefixedString(buffer, pos);
                    pos += 1 + vars.invokerUser.length();
                    vars.invokerHost = readLengthPrefixedString(buffer, pos);
                    pos += 1 + vars.invokerHost.length();
                    break;
                case MysqlBinlog.Q_UPDATED_DB_NAMES :
                    pos = vars.readUpdatedDbNames(buffer, pos);
                    break;
                case MysqlBinlog.Q_MICROSECONDS :
                case MysqlBinlog.Q_MDB_MICROSECONDS :
                    vars.microseconds = LittleEndianConversion
                            .convert3BytesToInt(buffer, pos);
                    pos += 3;
                    break;
                case MysqlBinlog.Q_EXPLICIT_DEFAULTS_FOR_TIMESTAMP :
                    vars.explicitDefaultsForTimestamp = LittleEndianConversion
                            .convert1ByteToInt(buffer, pos) != 0;
                    pos += 1;
                    break;
                case MysqlBinlog.Q_DDL_LOGGED_WITH_XID :
                    vars.ddlLoggedWithXid = LittleEndianConversion
                            .convert8BytesToLong(buffer, pos);
                    pos += 8;
                    break;
                case MysqlBinlog.Q_DEFAULT_COLLATION_FOR_UTF8MB4 :
                    vars.defaultCollationForUtf8mb4 = LittleEndianConversion
                            .convert2BytesToInt(buffer, pos);
                    pos += 2;
                    break;
                case MysqlBinlog.Q_SQL_REQUIRE_PRIMARY_KEY :
                    vars.sqlRequirePrimaryKey = LittleEndianConversion
                            .convert1ByteToInt(buffer, pos);
                    pos += 1;
                    break;
                case MysqlBinlog.Q_DEFAULT_TABLE_ENCRYPTION :
                    vars.defaultTableEncryption = LittleEndianConversion
                            .convert1ByteToInt(buffer, pos);
                    pos += 1;
                    break;
                default :
                    throw new UnknownStatusVariableException(key, keyOffset);
            }
            vars.keys.add(key);
        }
        if (logger.isDebugEnabled())
            logger.debug("Decoded query status variables: " + vars.keys);
        return vars;
    }

    private int readUpdatedDbNames(byte[] buffer, int pos)
            throws BinlogDecodeException
    {
        int count = LittleEndianConversion.convert1ByteToInt(buffer, pos);
        pos++;
        updatedDbNames = new ArrayList<String>();
        if (count == MysqlBinlog.OVER_MAX_DBS_IN_EVENT_MTS)
            return pos;

        for (int i = 0; i < count; i++)
        {
            int end = pos;
            while (end < buffer.length && buffer[end] != 0)
                end++;
            if (end == buffer.length)
                throw new BinlogDecodeException(
                        "Unterminated database name in updated db names list at offset "
                                + pos);
            updatedDbNames.add(new String(buffer, pos, end - pos,
                    StandardCharsets.UTF_8));
            pos = end + 1;
        }
        return pos;
    }

    // Strings read here are ASCII names, so their length in chars matches the
    // length in bytes.
    private static String readLengthPrefixedString(byte[] buffer, int pos)
            throws BinlogDecodeException
    {
        int length = LittleEndianConversion.convert1ByteToInt(buffer, pos);
        LittleEndianConversion.checkAvailable(buffer, pos + 1, length);
        return new String(buffer, pos + 1, length,
                StandardCharsets.ISO_8859_1);
    }

    /** Keys in the order they were found. */
    public List<Integer> getKeys()
    {
        return Collections.unmodifiableList(keys);
    }

    public boolean contains(int key)
    {
        return keys.contains(key);
    }

    public Long getFlags2()
    {
        return flags2;
    }

    public Long getSqlMode()
    {
        return sqlMode;
    }

    public String getCatalog()
    {
        return catalog;
    }

    public Integer getAutoIncrementIncrement()
    {
        return autoIncrementIncrement;
    }

    public Integer getAutoIncrementOffset()
    {
        return autoIncrementOffset;
    }

    public Integer getClientCharset()
    {
        return clientCharset;
    }

    public Integer getCollationConnection()
    {
        return collationConnection;
    }

    public Integer getCollationServer()
    {
        return collationServer;
    }

    public String getTimeZone()
    {
        return timeZone;
    }

    public Integer getLcTimeNames()
    {
        return lcTimeNames;
    }

    public Integer getCharsetDatabase()
    {
        return charsetDatabase;
    }

    public Long getTableMapForUpdate()
    {
        return tableMapForUpdate;
    }

    public Long getMasterDataWritten()
    {
        return masterDataWritten;
    }

    public String getInvokerUser()
    {
        return invokerUser;
    }

    public String getInvokerHost()
    {
        return invokerHost;
    }

    /**
     * Databases updated by the statement, an empty list if the server logged
     * that there were too many to list, or null if not logged.
     */
    public List<String> getUpdatedDbNames()
    {
        return updatedDbNames;
    }

    public Integer getMicroseconds()
    {
        return microseconds;
    }

    public Boolean getExplicitDefaultsForTimestamp()
    {
        return explicitDefaultsForTimestamp;
    }

    public Long getDdlLoggedWithXid()
    {
        return ddlLoggedWithXid;
    }

    public Integer getDefaultCollationForUtf8mb4()
    {
        return defaultCollationForUtf8mb4;
    }

    public Integer getSqlRequirePrimaryKey()
    {
        return sqlRequirePrimaryKey;
    }

    public Integer getDefaultTableEncryption()
    {
        return defaultTableEncryption;
    }
}
