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

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.BinlogDecodeException;
import com.continuent.tungsten.binlog.mysql.InvalidHeaderException;
import com.continuent.tungsten.binlog.mysql.MysqlBinlog;
import com.continuent.tungsten.binlog.mysql.TruncatedEventException;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of the format description event, which describes how the events that
 * follow it are laid out: the common header length, the post-header length of
 * each event type and the checksum algorithm.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class FormatDescriptionEventData extends EventData
{
    private static Logger logger = Logger.getLogger(FormatDescriptionEventData.class);

    private int           binlogVersion;
    private String        serverVersion;
    private long          createTimestamp;
    private int           commonHeaderLength;
    private short[]       postHeaderLength;
    private int           checksumAlgorithm;

    /**
     * Decodes a format description body.
     *
     * @param body Body with any checksum descriptor already removed
     * @param checksumAlgorithm Algorithm found in the trailing descriptor, or
     *            {@link MysqlBinlog#BINLOG_CHECKSUM_ALG_UNDEF} if there is
     *            none
     */
    public FormatDescriptionEventData(byte[] body, int checksumAlgorithm)
            throws BinlogDecodeException
    {
        binlogVersion = LittleEndianConversion.convert2BytesToInt(body,
                MysqlBinlog.ST_BINLOG_VER_OFFSET);
        serverVersion = MysqlBinlog.readNulPaddedString(body,
                MysqlBinlog.ST_SERVER_VER_OFFSET, MysqlBinlog.ST_SERVER_VER_LEN);
        createTimestamp = LittleEndianConversion.convert4BytesToLong(body,
                MysqlBinlog.ST_CREATED_OFFSET);
        commonHeaderLength = LittleEndianConversion.convert1ByteToInt(body,
                MysqlBinlog.ST_COMMON_HEADER_LEN_OFFSET);
        if (commonHeaderLength < MysqlBinlog.OLD_HEADER_LEN)
        {
            throw new InvalidHeaderException(
                    "Format Description event header length is too short: "
                            + commonHeaderLength);
        }

        int eventTypesCount = body.length
                - MysqlBinlog.ST_POST_HEADER_LEN_OFFSET;
        postHeaderLength = new short[eventTypesCount];
        for (int i = 0; i < eventTypesCount; i++)
            postHeaderLength[i] = (short) (body[MysqlBinlog.ST_POST_HEADER_LEN_OFFSET
                    + i] & 0xFF);
        this.checksumAlgorithm = checksumAlgorithm;

        if (logger.isDebugEnabled())
            logger.debug("Format description: binlogVersion=" + binlogVersion
                    + " serverVersion=" + serverVersion
                    + " commonHeaderLength=" + commonHeaderLength
                    + " eventTypesCount=" + eventTypesCount
                    + " checksumAlgorithm=" + checksumAlgorithm);
    }

    /**
     * Builds the description a server of the given binlog version would use,
     * for events that have to be decoded before any format description is
     * found.
     */
    private FormatDescriptionEventData(int binlogVersion)
    {
        this.binlogVersion = binlogVersion;
        this.serverVersion = "";
        this.checksumAlgorithm = MysqlBinlog.BINLOG_CHECKSUM_ALG_OFF;
        postHeaderLength = new short[MysqlBinlog.ENUM_END_EVENT - 1];

        switch (binlogVersion)
        {
            case 1 : // 3.23
            case 3 : // 4.0.2
                commonHeaderLength = MysqlBinlog.OLD_HEADER_LEN;
                setPostHeaderLength(MysqlBinlog.START_EVENT_V3,
                        MysqlBinlog.START_V3_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.QUERY_EVENT,
                        MysqlBinlog.QUERY_HEADER_MINIMAL_LEN);
                setPostHeaderLength(MysqlBinlog.ROTATE_EVENT,
                        binlogVersion == 1 ? 0 : MysqlBinlog.ROTATE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.LOAD_EVENT,
                        MysqlBinlog.LOAD_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.CREATE_FILE_EVENT,
                        MysqlBinlog.CREATE_FILE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.APPEND_BLOCK_EVENT,
                        MysqlBinlog.APPEND_BLOCK_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.EXEC_LOAD_EVENT,
                        MysqlBinlog.EXEC_LOAD_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.DELETE_FILE_EVENT,
                        MysqlBinlog.DELETE_FILE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.NEW_LOAD_EVENT,
                        MysqlBinlog.LOAD_HEADER_LEN);
                break;
            default : // 5.0 and later
                commonHeaderLength = MysqlBinlog.LOG_EVENT_HEADER_LEN;
                setPostHeaderLength(MysqlBinlog.START_EVENT_V3,
                        MysqlBinlog.START_V3_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.QUERY_EVENT,
                        MysqlBinlog.QUERY_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.ROTATE_EVENT,
                        MysqlBinlog.ROTATE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.LOAD_EVENT,
                        MysqlBinlog.LOAD_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.CREATE_FILE_EVENT,
                        MysqlBinlog.CREATE_FILE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.APPEND_BLOCK_EVENT,
                        MysqlBinlog.APPEND_BLOCK_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.EXEC_LOAD_EVENT,
                        MysqlBinlog.EXEC_LOAD_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.DELETE_FILE_EVENT,
                        MysqlBinlog.DELETE_FILE_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.NEW_LOAD_EVENT,
                        MysqlBinlog.LOAD_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.FORMAT_DESCRIPTION_EVENT,
                        MysqlBinlog.FORMAT_DESCRIPTION_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.BEGIN_LOAD_QUERY_EVENT,
                        MysqlBinlog.APPEND_BLOCK_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.EXECUTE_LOAD_QUERY_EVENT,
                        MysqlBinlog.EXECUTE_LOAD_QUERY_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.TABLE_MAP_EVENT,
                        MysqlBinlog.TABLE_MAP_HEADER_LEN);
                for (int type = MysqlBinlog.PRE_GA_WRITE_ROWS_EVENT; type <= MysqlBinlog.DELETE_ROWS_EVENT; type++)
                    setPostHeaderLength(type, MysqlBinlog.ROWS_HEADER_LEN_V1);
                setPostHeaderLength(MysqlBinlog.INCIDENT_EVENT,
                        MysqlBinlog.INCIDENT_HEADER_LEN);
                for (int type = MysqlBinlog.NEW_WRITE_ROWS_EVENT; type <= MysqlBinlog.NEW_DELETE_ROWS_EVENT; type++)
                    setPostHeaderLength(type, MysqlBinlog.ROWS_HEADER_LEN_V2);
                setPostHeaderLength(MysqlBinlog.GTID_LOG_EVENT,
                        MysqlBinlog.GTID_HEADER_LEN);
                setPostHeaderLength(MysqlBinlog.ANONYMOUS_GTID_LOG_EVENT,
                        MysqlBinlog.GTID_HEADER_LEN);
                break;
        }
    }

    /**
     * Returns the description to use when a stream of the given binlog version
     * has not supplied one.
     */
    public static FormatDescriptionEventData createDefault(int binlogVersion)
    {
        return new FormatDescriptionEventData(binlogVersion);
    }

    /**
     * Tells whether a format description body ends with a checksum algorithm
     * byte and a 4 byte checksum. Servers from 5.6.1 on always write them. If
     * the server version cannot be parsed, the trailing 4 bytes are probed as
     * a CRC32 of the rest of the event.
     *
     * @param header Raw event header
     * @param body Raw event body
     */
    public static boolean hasChecksumDescriptor(byte[] header, byte[] body)
            throws TruncatedEventException
    {
        String version = MysqlBinlog.readNulPaddedString(body,
                MysqlBinlog.ST_SERVER_VER_OFFSET, MysqlBinlog.ST_SERVER_VER_LEN);
        int[] split = MysqlBinlog.splitServerVersion(version);
        if (split != null)
        {
            return MysqlBinlog.versionProduct(split) >= MysqlBinlog.CHECKSUM_VERSION_PRODUCT;
        }

        int descriptorLength = MysqlBinlog.BINLOG_CHECKSUM_ALG_DESC_LEN
                + MysqlBinlog.BINLOG_CHECKSUM_LEN;
        if (body.length < MysqlBinlog.ST_POST_HEADER_LEN_OFFSET
                + descriptorLength)
            return false;

        int noCrcLength = header.length + body.length
                - MysqlBinlog.BINLOG_CHECKSUM_LEN;
        byte[] event = concatenate(header, body);
        clearInUseFlag(event);
        long stored = LittleEndianConversion.convert4BytesToLong(event,
                noCrcLength);
        boolean checksummed = stored == MysqlBinlog.getCrc32(event, 0,
                noCrcLength);
        logger.warn("Unable to parse server version '" + version
                + "', checksum descriptor detected from CRC: " + checksummed);
        return checksummed;
    }

    /**
     * Clears the binlog-in-use flag, which the server sets after computing the
     * checksum of the format description event.
     */
    public static void clearInUseFlag(byte[] event)
    {
        event[MysqlBinlog.FLAGS_OFFSET] = (byte) (event[MysqlBinlog.FLAGS_OFFSET] & ~MysqlBinlog.LOG_EVENT_BINLOG_IN_USE_F);
    }

    private static byte[] concatenate(byte[] header, byte[] body)
    {
        byte[] event = new byte[header.length + body.length];
        System.arraycopy(header, 0, event, 0, header.length);
        System.arraycopy(body, 0, event, header.length, body.length);
        return event;
    }

    private void setPostHeaderLength(int eventType, int length)
    {
        postHeaderLength[eventType - 1] = (short) length;
    }

    public EventDataKind getKind()
    {
        return EventDataKind.FORMAT_DESCRIPTION;
    }

    public int getBinlogVersion()
    {
        return binlogVersion;
    }

    public String getServerVersion()
    {
        return serverVersion;
    }

    public long getCreateTimestamp()
    {
        return createTimestamp;
    }

    public int getCommonHeaderLength()
    {
        return commonHeaderLength;
    }

    /**
     * Returns the post-header length of an event type, or -1 if the type is
     * beyond the table written by the server.
     */
    public int getPostHeaderLength(int eventType)
    {
        if (eventType < 1 || eventType > postHeaderLength.length)
            return -1;
        return postHeaderLength[eventType - 1];
    }

    /** Number of event types described by the post-header length table. */
    public int getEventTypesCount()
    {
        return postHeaderLength.length;
    }

    public int getChecksumAlgorithm()
    {
        return checksumAlgorithm;
    }

    /**
     * Returns true if events following this one end with a checksum.
     */
    public boolean isChecksumEnabled()
    {
        return checksumAlgorithm > MysqlBinlog.BINLOG_CHECKSUM_ALG_OFF
                && checksumAlgorithm < MysqlBinlog.BINLOG_CHECKSUM_ALG_UNDEF;
    }

    /**
     * Width of the table id field in table map and rows events of the given
     * type: 4 bytes for servers writing a 6 byte post-header, 6 otherwise.
     */
    public int getTableIdLength(int eventType)
    {
        return getPostHeaderLength(eventType) == 6 ? 4 : 6;
    }

    public String toString()
    {
        return "FormatDescription binlogVersion=" + binlogVersion
                + " serverVersion=" + serverVersion + " headerLength="
                + commonHeaderLength + " checksumAlgorithm="
                + checksumAlgorithm;
    }
}
