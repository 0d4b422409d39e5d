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
 * Contributor(s): Stephane Giron, Robert Hodges
 */

package com.continuent.tungsten.binlog.mysql;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.zip.CRC32;

import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Constants and low level helpers shared by the binlog decoders: event type
 * codes, header and post-header offsets, column type codes, query status
 * variable codes, packed integer and string decoding, bit fields and
 * checksums.
 * <p/>
 * For additional information on binlog format consult the MySQL internals
 * documentation on the replication protocol. Type codes above
 * {@link #PREVIOUS_GTIDS_LOG_EVENT} are not part of the MySQL binlog format
 * handled here.
 */
public class MysqlBinlog
{
    // Binary log offset values.
    public static final int    EVENT_TYPE_OFFSET                   = 4;
    public static final int    SERVER_ID_OFFSET                    = 5;
    public static final int    EVENT_LEN_OFFSET                    = 9;
    public static final int    LOG_POS_OFFSET                      = 13;
    public static final int    FLAGS_OFFSET                        = 17;

    // Binlog event flags.
    public static final int    LOG_EVENT_BINLOG_IN_USE_F           = 0x1;

    public static final int    BIN_LOG_HEADER_SIZE                 = 4;

    // Magic number for a binlog file.
    public static final byte[] BINLOG_MAGIC                        = {
            (byte) 0xfe, 0x62, 0x69, 0x6e                          };

    // List of binlog event types.
    public static final int    UNKNOWN_EVENT                       = 0;
    public static final int    START_EVENT_V3                      = 1;
    public static final int    QUERY_EVENT                         = 2;
    public static final int    STOP_EVENT                          = 3;
    public static final int    ROTATE_EVENT                        = 4;
    public static final int    INTVAR_EVENT                        = 5;
    public static final int    LOAD_EVENT                          = 6;
    public static final int    SLAVE_EVENT                         = 7;
    public static final int    CREATE_FILE_EVENT                   = 8;
    public static final int    APPEND_BLOCK_EVENT                  = 9;
    public static final int    EXEC_LOAD_EVENT                     = 10;
    public static final int    DELETE_FILE_EVENT                   = 11;
    public static final int    NEW_LOAD_EVENT                      = 12;
    public static final int    RAND_EVENT                          = 13;
    public static final int    USER_VAR_EVENT                      = 14;
    public static final int    FORMAT_DESCRIPTION_EVENT            = 15;
    public static final int    XID_EVENT                           = 16;
    public static final int    BEGIN_LOAD_QUERY_EVENT              = 17;
    public static final int    EXECUTE_LOAD_QUERY_EVENT            = 18;
    public static final int    TABLE_MAP_EVENT                     = 19;
    // PRE_GA events are from pre-release MySQL 5.1 and should not appear in
    // production binlogs.
    public static final int    PRE_GA_WRITE_ROWS_EVENT             = 20;
    public static final int    PRE_GA_UPDATE_ROWS_EVENT            = 21;
    public static final int    PRE_GA_DELETE_ROWS_EVENT            = 22;
    public static final int    WRITE_ROWS_EVENT                    = 23;
    public static final int    UPDATE_ROWS_EVENT                   = 24;
    public static final int    DELETE_ROWS_EVENT                   = 25;
    public static final int    INCIDENT_EVENT                      = 26;

    // MySQL 5.6 new events.
    public static final int    HEARTBEAT_LOG_EVENT                 = 27;
    public static final int    IGNORABLE_LOG_EVENT                 = 28;
    public static final int    ROWS_QUERY_LOG_EVENT                = 29;
    public static final int    NEW_WRITE_ROWS_EVENT                = 30;
    public static final int    NEW_UPDATE_ROWS_EVENT               = 31;
    public static final int    NEW_DELETE_ROWS_EVENT               = 32;
    public static final int    GTID_LOG_EVENT                      = 33;
    public static final int    ANONYMOUS_GTID_LOG_EVENT            = 34;
    public static final int    PREVIOUS_GTIDS_LOG_EVENT            = 35;

    // Used to count events, not a real event.
    public static final int    ENUM_END_EVENT                      = 36;

    // Header lengths.
    public static final int    OLD_HEADER_LEN                      = 13;
    public static final int    LOG_EVENT_HEADER_LEN                = 19;

    // Format description layout.
    public static final int    ST_BINLOG_VER_OFFSET                = 0;
    public static final int    ST_SERVER_VER_OFFSET                = 2;
    public static final int    ST_SERVER_VER_LEN                   = 50;
    public static final int    ST_CREATED_OFFSET                   = (ST_SERVER_VER_OFFSET + ST_SERVER_VER_LEN);
    public static final int    ST_COMMON_HEADER_LEN_OFFSET         = (ST_CREATED_OFFSET + 4);
    public static final int    ST_POST_HEADER_LEN_OFFSET           = (ST_COMMON_HEADER_LEN_OFFSET + 1);

    // Post-header sizes for various events, as written by binlog v4.
    public static final int    QUERY_HEADER_MINIMAL_LEN            = (4 + 4 + 1 + 2);
    public static final int    QUERY_HEADER_LEN                    = (QUERY_HEADER_MINIMAL_LEN + 2);
    public static final int    LOAD_HEADER_LEN                     = (4 + 4 + 4 + 1 + 1 + 4);
    public static final int    START_V3_HEADER_LEN                 = (2 + ST_SERVER_VER_LEN + 4);
    public static final int    ROTATE_HEADER_LEN                   = 8;
    public static final int    CREATE_FILE_HEADER_LEN              = 4;
    public static final int    APPEND_BLOCK_HEADER_LEN             = 4;
    public static final int    EXEC_LOAD_HEADER_LEN                = 4;
    public static final int    DELETE_FILE_HEADER_LEN              = 4;
    public static final int    FORMAT_DESCRIPTION_HEADER_LEN       = (START_V3_HEADER_LEN + 1 + (ENUM_END_EVENT - 1));
    public static final int    ROWS_HEADER_LEN_V1                  = 8;
    public static final int    ROWS_HEADER_LEN_V2                  = 10;
    public static final int    TABLE_MAP_HEADER_LEN                = 8;
    public static final int    EXECUTE_LOAD_QUERY_EXTRA_HEADER_LEN = (4 + 4 + 4 + 1);
    public static final int    EXECUTE_LOAD_QUERY_HEADER_LEN       = (QUERY_HEADER_LEN + EXECUTE_LOAD_QUERY_EXTRA_HEADER_LEN);
    public static final int    INCIDENT_HEADER_LEN                 = 2;
    public static final int    GTID_HEADER_LEN                     = 42;

    // Offsets for query log events.
    public static final int    Q_THREAD_ID_OFFSET                  = 0;
    public static final int    Q_EXEC_TIME_OFFSET                  = 4;
    public static final int    Q_DB_LEN_OFFSET                     = 8;
    public static final int    Q_ERR_CODE_OFFSET                   = 9;
    public static final int    Q_STATUS_VARS_LEN_OFFSET            = 11;

    // Query status variable codes.
    public static final int    Q_FLAGS2_CODE                       = 0;
    public static final int    Q_SQL_MODE_CODE                     = 1;
    public static final int    Q_CATALOG_CODE                      = 2;
    public static final int    Q_AUTO_INCREMENT                    = 3;
    public static final int    Q_CHARSET_CODE                      = 4;
    public static final int    Q_TIME_ZONE_CODE                    = 5;
    public static final int    Q_CATALOG_NZ_CODE                   = 6;
    public static final int    Q_LC_TIME_NAMES_CODE                = 7;
    public static final int    Q_CHARSET_DATABASE_CODE             = 8;
    public static final int    Q_TABLE_MAP_FOR_UPDATE_CODE         = 9;
    public static final int    Q_MASTER_DATA_WRITTEN_CODE          = 10;
    public static final int    Q_INVOKER                           = 11;
    public static final int    Q_UPDATED_DB_NAMES                  = 12;
    public static final int    Q_MICROSECONDS                      = 13;
    public static final int    Q_EXPLICIT_DEFAULTS_FOR_TIMESTAMP   = 16;
    public static final int    Q_DDL_LOGGED_WITH_XID               = 17;
    public static final int    Q_DEFAULT_COLLATION_FOR_UTF8MB4     = 18;
    public static final int    Q_SQL_REQUIRE_PRIMARY_KEY           = 19;
    public static final int    Q_DEFAULT_TABLE_ENCRYPTION          = 20;
    public static final int    Q_MDB_MICROSECONDS                  = 0x80;

    // Q_UPDATED_DB_NAMES count telling the list was not written.
    public static final int    OVER_MAX_DBS_IN_EVENT_MTS           = 254;

    // Column types.
    public static final int    MYSQL_TYPE_DECIMAL                  = 0;
    public static final int    MYSQL_TYPE_TINY                     = 1;
    public static final int    MYSQL_TYPE_SHORT                    = 2;
    public static final int    MYSQL_TYPE_LONG                     = 3;
    public static final int    MYSQL_TYPE_FLOAT                    = 4;
    public static final int    MYSQL_TYPE_DOUBLE                   = 5;
    public static final int    MYSQL_TYPE_NULL                     = 6;
    public static final int    MYSQL_TYPE_TIMESTAMP                = 7;
    public static final int    MYSQL_TYPE_LONGLONG                 = 8;
    public static final int    MYSQL_TYPE_INT24                    = 9;
    public static final int    MYSQL_TYPE_DATE                     = 10;
    public static final int    MYSQL_TYPE_TIME                     = 11;
    public static final int    MYSQL_TYPE_DATETIME                 = 12;
    public static final int    MYSQL_TYPE_YEAR                     = 13;
    public static final int    MYSQL_TYPE_NEWDATE                  = 14;
    public static final int    MYSQL_TYPE_VARCHAR                  = 15;
    public static final int    MYSQL_TYPE_BIT                      = 16;
    public static final int    MYSQL_TYPE_TIMESTAMP2               = 17;
    public static final int    MYSQL_TYPE_DATETIME2                = 18;
    public static final int    MYSQL_TYPE_TIME2                    = 19;
    public static final int    MYSQL_TYPE_JSON                     = 245;
    public static final int    MYSQL_TYPE_NEWDECIMAL               = 246;
    public static final int    MYSQL_TYPE_ENUM                     = 247;
    public static final int    MYSQL_TYPE_SET                      = 248;
    public static final int    MYSQL_TYPE_TINY_BLOB                = 249;
    public static final int    MYSQL_TYPE_MEDIUM_BLOB              = 250;
    public static final int    MYSQL_TYPE_LONG_BLOB                = 251;
    public static final int    MYSQL_TYPE_BLOB                     = 252;
    public static final int    MYSQL_TYPE_VAR_STRING               = 253;
    public static final int    MYSQL_TYPE_STRING                   = 254;
    public static final int    MYSQL_TYPE_GEOMETRY                 = 255;

    // Checksum algorithms.
    public static final int    BINLOG_CHECKSUM_ALG_OFF             = 0;
    public static final int    BINLOG_CHECKSUM_ALG_CRC32           = 1;
    public static final int    BINLOG_CHECKSUM_ALG_UNDEF           = 255;
    public static final int    BINLOG_CHECKSUM_LEN                 = 4;
    public static final int    BINLOG_CHECKSUM_ALG_DESC_LEN        = 1;

    // Server version which introduced the checksum algorithm byte in format
    // description events.
    public static final int[]  CHECKSUM_VERSION_SPLIT              = {5, 6, 1};
    public static final long   CHECKSUM_VERSION_PRODUCT            = versionProduct(CHECKSUM_VERSION_SPLIT);

    private static final String[] EVENT_TYPE_NAMES             = {
            "Unknown", "Start_v3", "Query", "Stop", "Rotate", "Intvar",
            "Load", "Slave", "Create_file", "Append_block", "Exec_load",
            "Delete_file", "New_load", "RAND", "User var",
            "Format_desc", "Xid", "Begin_load_query", "Execute_load_query",
            "Table_map", "Write_rows_event_old", "Update_rows_event_old",
            "Delete_rows_event_old", "Write_rows_v1", "Update_rows_v1",
            "Delete_rows_v1", "Incident", "Heartbeat", "Ignorable",
            "Rows_query", "Write_rows", "Update_rows", "Delete_rows", "Gtid",
            "Anonymous_Gtid", "Previous_gtids"                      };

    /**
     * Returns true if the type code belongs to the MySQL binlog format. Code 0
     * is reserved for unknown events and is never valid on the wire.
     */
    public static boolean isKnownEventType(int eventType)
    {
        return eventType > UNKNOWN_EVENT && eventType < ENUM_END_EVENT;
    }

    /**
     * Returns a printable name for an event type code.
     */
    public static String getTypeName(int eventType)
    {
        if (eventType >= 0 && eventType < EVENT_TYPE_NAMES.length)
            return EVENT_TYPE_NAMES[eventType];
        return "Unknown type:" + eventType;
    }

    /**
     * Returns true for the write, update and delete rows events of every
     * version.
     */
    public static boolean isRowsEvent(int eventType)
    {
        return (eventType >= PRE_GA_WRITE_ROWS_EVENT && eventType <= DELETE_ROWS_EVENT)
                || (eventType >= NEW_WRITE_ROWS_EVENT && eventType <= NEW_DELETE_ROWS_EVENT);
    }

    /**
     * Decodes a packed ("length coded") integer.
     * <ul>
     * <li>0-250 The first byte is the number. No additional bytes are
     * used.</li>
     * <li>251 stands for the SQL NULL value.</li>
     * <li>252 Two more bytes are used.</li>
     * <li>253 Three more bytes are used.</li>
     * <li>254 Eight more bytes are used.</li>
     * </ul>
     *
     * @param buffer Buffer holding the integer
     * @param position Offset of the first byte
     * @throws TruncatedEventException If the buffer ends inside the integer
     * @throws BinlogDecodeException If the first byte is 255
     */
    public static PackedInteger decodePackedInteger(byte[] buffer, int position)
            throws BinlogDecodeException
    {
        int first = LittleEndianConversion.convert1ByteToInt(buffer, position);
        if (first <= 250)
            return new PackedInteger(first, false, 1);

        switch (first)
        {
            case 251 :
                return new PackedInteger(0, true, 1);
            case 252 :
                return new PackedInteger(
                        LittleEndianConversion.convert2BytesToInt(buffer,
                                position + 1), false, 3);
            case 253 :
                return new PackedInteger(
                        LittleEndianConversion.convert3BytesToInt(buffer,
                                position + 1), false, 4);
            case 254 :
                return new PackedInteger(
                        LittleEndianConversion.convert8BytesToLong(buffer,
                                position + 1), false, 9);
            default :
                throw new BinlogDecodeException(
                        "Invalid packed integer prefix 0xff at offset "
                                + position);
        }
    }

    /**
     * Decodes a packed string: a packed integer length followed by that many
     * bytes.
     */
    public static PackedString decodePackedString(byte[] buffer, int position)
            throws BinlogDecodeException
    {
        PackedInteger length = decodePackedInteger(buffer, position);
        if (length.isNull())
            return new PackedString(null, length.getLength());

        int start = position + length.getLength();
        long size = length.getValue();
        if (size < 0 || size > buffer.length - start)
            throw new TruncatedEventException(
                    "Packed string runs past end of buffer at offset "
                            + position, (int) Math.min(size, Integer.MAX_VALUE),
                    buffer.length - start);
        byte[] bytes = new byte[(int) size];
        System.arraycopy(buffer, start, bytes, 0, bytes.length);
        return new PackedString(bytes, length.getLength() + bytes.length);
    }

    /**
     * Reads a fixed length string made of length bytes, as found in the
     * format description server version field, dropping trailing NUL
     * padding.
     */
    public static String readNulPaddedString(byte[] buffer, int position,
            int length) throws TruncatedEventException
    {
        LittleEndianConversion.checkAvailable(buffer, position, length);
        int end = position;
        while (end < position + length && buffer[end] != 0)
            end++;
        return new String(buffer, position, end - position,
                StandardCharsets.ISO_8859_1);
    }

    /**
     * Returns the number of bytes holding a bit field of the given size.
     */
    public static int bitFieldLength(int bits)
    {
        return (bits + 7) / 8;
    }

    /**
     * Copies length bits starting at buffer[pos] into the bit set. Bits are
     * read from the least significant bit of each byte upward.
     */
    public static void setBitField(BitSet bitset, byte[] buffer, int pos,
            int length)
    {
        for (int i = 0; i < length; i++)
        {
            int b = buffer[pos + (i / 8)] & 0xFF;
            if (((b >> (i % 8)) & 0x01) == 0x01)
                bitset.set(i);
            else
                bitset.clear(i);
        }
    }

    /**
     * Splits a server version such as "5.6.14-log" into its major, minor and
     * patch numbers. Returns null if the string does not start with a dotted
     * version number.
     */
    public static int[] splitServerVersion(String serverVersion)
    {
        if (serverVersion == null)
            return null;
        int[] split = new int[3];
        int part = 0;
        boolean digits = false;
        for (int i = 0; i < serverVersion.length() && part < 3; i++)
        {
            char c = serverVersion.charAt(i);
            if (Character.isDigit(c))
            {
                split[part] = split[part] * 10 + (c - '0');
                digits = true;
            }
            else if (c == '.' && digits)
            {
                part++;
                digits = false;
            }
            else
                break;
        }
        if (part < 2 || (part == 2 && !digits))
            return null;
        return split;
    }

    /**
     * Returns a single number that orders server versions.
     */
    public static long versionProduct(int[] split)
    {
        return ((long) split[0] * 256 + split[1]) * 256 + split[2];
    }

    /**
     * Computes the checksum of a region for a given algorithm, or -1 if the
     * algorithm is not supported.
     */
    public static long getChecksum(int checksumAlgorithm, byte[] buffer,
            int offset, int length)
    {
        switch (checksumAlgorithm)
        {
            case BINLOG_CHECKSUM_ALG_CRC32 :
                return getCrc32(buffer, offset, length);
            default :
                return -1;
        }
    }

    /**
     * Computes a CRC32. A fresh engine is used on each call so that separate
     * decoders may run on separate threads.
     */
    public static long getCrc32(byte[] buffer, int offset, int length)
    {
        CRC32 crc32 = new CRC32();
        crc32.update(buffer, offset, length);
        return crc32.getValue();
    }

    /**
     * Formats bytes as hex for log messages.
     */
    public static String hexdump(byte[] buffer, int offset, int length)
    {
        StringBuilder dump = new StringBuilder();
        int end = Math.min(buffer.length, offset + length);
        for (int i = offset; i < end; i++)
        {
            if (dump.length() > 0)
                dump.append(' ');
            dump.append(String.format("%02x", buffer[i]));
        }
        return dump.toString();
    }

    public static String hexdump(byte[] buffer)
    {
        return hexdump(buffer, 0, buffer.length);
    }
}
