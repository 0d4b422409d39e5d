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

package com.continuent.tungsten.binlog.mysql;

import java.util.Arrays;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;
import com.continuent.tungsten.binlog.mysql.event.FormatDescriptionEventData;

/**
 * Checks the framing of an event before its body is decoded: the bytes read
 * must match the size in the header and the checksum, when the stream has
 * one, must match the event content.
 * <p>
 * Format description events carry their own checksum descriptor: an
 * algorithm byte followed by the 4 byte checksum. Every other event carries
 * only the 4 byte checksum, with the algorithm announced by the last format
 * description.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class LogEventValidator
{
    private static Logger logger = Logger.getLogger(LogEventValidator.class);

    /**
     * Validates an event other than a format description.
     *
     * @param headerBytes Raw header
     * @param body Raw body, checksum included
     * @param header Decoded header
     * @param checksumAlgorithm Algorithm in effect for the stream
     * @return Body without checksum
     * @throws EventSizeMismatchException If header and body do not add up to
     *             the event size
     * @throws ChecksumMismatchException If the checksum is wrong or cannot be
     *             computed
     * @throws TruncatedEventException If the body cannot hold a checksum
     */
    public static ValidatedBody validate(byte[] headerBytes, byte[] body,
            LogEventHeader header, int checksumAlgorithm)
            throws BinlogDecodeException
    {
        checkSize(headerBytes, body, header);

        if (checksumAlgorithm == MysqlBinlog.BINLOG_CHECKSUM_ALG_OFF
                || checksumAlgorithm == MysqlBinlog.BINLOG_CHECKSUM_ALG_UNDEF)
            return new ValidatedBody(body, checksumAlgorithm, -1);

        if (body.length < MysqlBinlog.BINLOG_CHECKSUM_LEN)
            throw new TruncatedEventException("Event body too short for checksum",
                    MysqlBinlog.BINLOG_CHECKSUM_LEN, body.length);

        int dataLength = body.length - MysqlBinlog.BINLOG_CHECKSUM_LEN;
        byte[] event = concatenate(headerBytes, body);
        long checksum = verify(event, headerBytes.length + dataLength,
                checksumAlgorithm, header);
        return new ValidatedBody(Arrays.copyOf(body, dataLength),
                checksumAlgorithm, checksum);
    }

    /**
     * Validates a format description event, which tells itself whether it
     * carries a checksum descriptor.
     */
    public static ValidatedBody validateFormatDescription(byte[] headerBytes,
            byte[] body, LogEventHeader header) throws BinlogDecodeException
    {
        checkSize(headerBytes, body, header);

        if (!FormatDescriptionEventData.hasChecksumDescriptor(headerBytes,
                body))
            return new ValidatedBody(body,
                    MysqlBinlog.BINLOG_CHECKSUM_ALG_UNDEF, -1);

        int descriptorLength = MysqlBinlog.BINLOG_CHECKSUM_ALG_DESC_LEN
                + MysqlBinlog.BINLOG_CHECKSUM_LEN;
        if (body.length < MysqlBinlog.ST_POST_HEADER_LEN_OFFSET
                + descriptorLength)
            throw new TruncatedEventException(
                    "Format description too short for checksum descriptor",
                    MysqlBinlog.ST_POST_HEADER_LEN_OFFSET + descriptorLength,
                    body.length);

        int dataLength = body.length - descriptorLength;
        int algorithm = body[dataLength] & 0xFF;
        byte[] trimmed = Arrays.copyOf(body, dataLength);
        if (algorithm == MysqlBinlog.BINLOG_CHECKSUM_ALG_OFF
                || algorithm == MysqlBinlog.BINLOG_CHECKSUM_ALG_UNDEF)
        {
            if (logger.isDebugEnabled())
                logger.debug("Format description announces no checksum: algorithm="
                        + algorithm);
            return new ValidatedBody(trimmed, algorithm, -1);
        }

        // The server sets the in-use flag after computing the checksum.
        byte[] event = concatenate(headerBytes, body);
        FormatDescriptionEventData.clearInUseFlag(event);
        long checksum = verify(event, headerBytes.length + dataLength + 1,
                algorithm, header);
        return new ValidatedBody(trimmed, algorithm, checksum);
    }

    private static void checkSize(byte[] headerBytes, byte[] body,
            LogEventHeader header) throws EventSizeMismatchException
    {
        long actual = (long) headerBytes.length + body.length;
        if (actual != header.getEventSize())
            throw new EventSizeMismatchException("Event size mismatch for "
                    + header.getTypeName() + ": header declares "
                    + header.getEventSize() + " bytes, read " + actual);
    }

    /**
     * Compares the checksum stored after the first length bytes of event with
     * the one computed over them.
     */
    private static long verify(byte[] event, int length, int algorithm,
            LogEventHeader header) throws BinlogDecodeException
    {
        long computed = MysqlBinlog.getChecksum(algorithm, event, 0, length);
        if (computed < 0)
            throw new ChecksumMismatchException(
                    "Unsupported checksum algorithm " + algorithm + " for "
                            + header.getTypeName());

        long stored = LittleEndianConversion.convert4BytesToLong(event,
                length);
        if (stored != computed)
        {
            if (logger.isDebugEnabled())
                logger.debug("Checksummed bytes: "
                        + MysqlBinlog.hexdump(event, 0, length));
            throw new ChecksumMismatchException("Checksum mismatch for "
                    + header.getTypeName() + ": stored=" + stored
                    + " computed=" + computed);
        }
        return stored;
    }

    private static byte[] concatenate(byte[] headerBytes, byte[] body)
    {
        byte[] event = new byte[headerBytes.length + body.length];
        System.arraycopy(headerBytes, 0, event, 0, headerBytes.length);
        System.arraycopy(body, 0, event, headerBytes.length, body.length);
        return event;
    }
}
