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
 * Contributor(s): Robert Hodges
 */

package com.continuent.tungsten.binlog.mysql;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.BinlogException;
import com.continuent.tungsten.binlog.conf.BinlogReaderOptions;
import com.continuent.tungsten.binlog.mysql.event.EventData;
import com.continuent.tungsten.binlog.mysql.event.FormatDescriptionEventData;
import com.continuent.tungsten.binlog.mysql.event.IntvarEventData;
import com.continuent.tungsten.binlog.mysql.event.QueryEventData;
import com.continuent.tungsten.binlog.mysql.event.RotateEventData;
import com.continuent.tungsten.binlog.mysql.event.RowsEventData;
import com.continuent.tungsten.binlog.mysql.event.TableMapEventData;
import com.continuent.tungsten.binlog.mysql.event.UnsupportedEventData;
import com.continuent.tungsten.binlog.mysql.event.XidEventData;

/**
 * Walks a binlog from its magic number to its end, one event at a time.
 * <p>
 * Every event is read, checked and decoded, including those before the start
 * of the window, so that format descriptions and table maps are always
 * known. Events before the window are then dropped, except format
 * descriptions which are always delivered. The first event past the end of
 * the window ends the walk and is not delivered. Any error ends the walk too:
 * the decoder is then finished and reads nothing more.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class BinlogDecoder
{
    static Logger                     logger = Logger.getLogger(BinlogDecoder.class);

    public enum State
    {
        AWAITING_MAGIC, STREAMING, FINISHED
    }

    private final BinlogSource        source;
    private final BinlogReaderOptions options;
    private final String              name;
    private final DecodeContext       context = new DecodeContext();

    private State                     state   = State.AWAITING_MAGIC;
    private boolean                   windowOpen;
    private long                      position;
    private long                      eventsRead;
    private long                      eventsDelivered;

    /**
     * Creates a decoder over any source of binlog bytes.
     *
     * @param source Source positioned on the binlog magic number
     * @param options Window and decoding options
     */
    public BinlogDecoder(BinlogSource source, BinlogReaderOptions options)
    {
        this(source, options, source.toString());
    }

    /**
     * Creates a decoder reading a binlog file.
     */
    public BinlogDecoder(File file, BinlogReaderOptions options)
            throws IOException, InterruptedException
    {
        this(new FileBinlogSource(file, options.getBufferSize()), options,
                file.getName());
    }

    private BinlogDecoder(BinlogSource source, BinlogReaderOptions options,
            String name)
    {
        this.source = source;
        this.options = options;
        this.name = name;
    }

    /**
     * Reads and checks the magic number. Calling this is optional as the
     * first call to {@link #nextEvent()} does it.
     *
     * @throws InvalidFileHeaderException If the stream is not a binlog
     */
    public void open() throws BinlogException, InterruptedException
    {
        if (state != State.AWAITING_MAGIC)
            throw new IllegalStateException("Binlog " + name
                    + " is already open: state=" + state);

        boolean opened = false;
        try
        {
            byte[] magic = source.readExactly(MysqlBinlog.BIN_LOG_HEADER_SIZE);
            if (magic == null || !Arrays.equals(magic, MysqlBinlog.BINLOG_MAGIC))
                throw new InvalidFileHeaderException("File " + name
                        + " is not a binary log file: magic="
                        + (magic == null ? "<empty>" : MysqlBinlog
                                .hexdump(magic)));
            opened = true;
        }
        catch (TruncatedEventException e)
        {
            throw positioned(new InvalidFileHeaderException("File " + name
                    + " is too short to be a binary log file"), 0);
        }
        catch (BinlogDecodeException e)
        {
            throw positioned(e, 0);
        }
        catch (IOException e)
        {
            throw positioned(new BinlogDecodeException(
                    "Unable to read header of binlog " + name, e), 0);
        }
        finally
        {
            if (!opened)
                state = State.FINISHED;
        }

        position = MysqlBinlog.BIN_LOG_HEADER_SIZE;
        state = State.STREAMING;
        logger.info("Opened binlog " + name + " with " + options);
    }

    /**
     * Returns the next event in the window, or null once the walk is over.
     *
     * @throws BinlogDecodeException If the stream cannot be decoded
     * @throws InterruptedException If the reading thread is interrupted
     */
    public LogEvent nextEvent() throws BinlogException, InterruptedException
    {
        if (state == State.AWAITING_MAGIC)
            open();
        if (state == State.FINISHED)
            return null;

        boolean succeeded = false;
        try
        {
            LogEvent event = readNextEvent();
            succeeded = true;
            return event;
        }
        catch (BinlogDecodeException e)
        {
            throw positioned(e, position);
        }
        catch (IOException e)
        {
            throw positioned(new BinlogDecodeException("Unable to read binlog "
                    + name, e), position);
        }
        finally
        {
            if (!succeeded)
                state = State.FINISHED;
        }
    }

    /**
     * Delivers every event of the window to the handler, stopping early when
     * the handler returns false.
     *
     * @return Number of events delivered
     * @throws BinlogException If decoding fails or the handler throws
     */
    public long walk(LogEventHandler handler) throws BinlogException,
            InterruptedException
    {
        long delivered = 0;
        LogEvent event;
        while ((event = nextEvent()) != null)
        {
            delivered++;
            boolean more;
            try
            {
                more = handler.handle(event);
            }
            catch (BinlogException e)
            {
                state = State.FINISHED;
                throw e;
            }
            catch (RuntimeException e)
            {
                state = State.FINISHED;
                throw e;
            }
            if (!more)
            {
                finish("handler stopped the walk after " + event.getHeader());
                break;
            }
        }
        return delivered;
    }

    private LogEvent readNextEvent() throws BinlogDecodeException,
            IOException, InterruptedException
    {
        while (true)
        {
            int headerLength = context.getHeaderLength();
            byte[] headerBytes = source.readExactly(headerLength);
            if (headerBytes == null)
            {
                finish("end of binlog reached at offset " + position);
                return null;
            }

            LogEventHeader header = LogEventHeader.decode(headerBytes,
                    headerLength);
            int eventType = header.getEventType();
            if (!MysqlBinlog.isKnownEventType(eventType))
                throw new UnknownEventTypeException(eventType);
            if (header.getEventSize() < headerLength
                    || header.getEventSize() > Integer.MAX_VALUE)
                throw new InvalidHeaderException("Invalid size "
                        + header.getEventSize() + " in event header: "
                        + header);

            int bodyLength = (int) header.getEventSize() - headerLength;
            byte[] body = source.readExactly(bodyLength);
            if (body == null)
                throw new TruncatedEventException("Binlog " + name
                        + " ends after header of " + header.getTypeName(),
                        bodyLength, 0);

            if (logger.isDebugEnabled())
                logger.debug("Read " + header + " at offset " + position);

            LogEvent event = decode(headerBytes, body, header);
            long eventPosition = position;
            position += header.getEventSize();
            eventsRead++;

            if (!windowOpen && options.isWithinStart(header))
            {
                windowOpen = true;
                if (logger.isDebugEnabled())
                    logger.debug("Window opened at offset " + eventPosition);
            }
            if (!windowOpen
                    && eventType != MysqlBinlog.FORMAT_DESCRIPTION_EVENT)
                continue;

            if (options.isPastEnd(header))
            {
                finish("end of window reached at offset " + eventPosition);
                return null;
            }
            eventsDelivered++;
            return event;
        }
    }

    // Validates the event and decodes its body, updating the context.
    private LogEvent decode(byte[] headerBytes, byte[] body,
            LogEventHeader header) throws BinlogDecodeException
    {
        int eventType = header.getEventType();
        if (eventType == MysqlBinlog.FORMAT_DESCRIPTION_EVENT)
        {
            ValidatedBody validated = LogEventValidator
                    .validateFormatDescription(headerBytes, body, header);
            FormatDescriptionEventData description = new FormatDescriptionEventData(
                    validated.getBody(), validated.getChecksumAlgorithm());
            context.adoptFormatDescription(description);
            return new LogEvent(header, description, validated, position);
        }

        ValidatedBody validated = LogEventValidator.validate(headerBytes, body,
                header, context.getChecksumAlgorithm());
        FormatDescriptionEventData description = context
                .getEffectiveFormatDescription();
        byte[] data = validated.getBody();

        EventData eventData;
        switch (eventType)
        {
            case MysqlBinlog.QUERY_EVENT :
                eventData = new QueryEventData(data, description);
                break;
            case MysqlBinlog.XID_EVENT :
                eventData = new XidEventData(data);
                break;
            case MysqlBinlog.INTVAR_EVENT :
                eventData = new IntvarEventData(data);
                break;
            case MysqlBinlog.ROTATE_EVENT :
                RotateEventData rotate = new RotateEventData(data, description);
                logger.info("Binlog " + name + " rotates to "
                        + rotate.getNewBinlogFilename() + " at position "
                        + rotate.getPosition());
                eventData = rotate;
                break;
            case MysqlBinlog.TABLE_MAP_EVENT :
                TableMapEventData tableMap = new TableMapEventData(data,
                        description);
                context.registerTable(tableMap);
                eventData = tableMap;
                break;
            default :
                if (MysqlBinlog.isRowsEvent(eventType))
                {
                    RowsEventData rows = new RowsEventData(data, eventType,
                            description);
                    rows.setTableMap(resolveTableMap(rows));
                    eventData = rows;
                }
                else
                    eventData = new UnsupportedEventData(eventType, data);
        }
        return new LogEvent(header, eventData, validated, position);
    }

    private TableMapEventData resolveTableMap(RowsEventData rows)
            throws UnknownTableException
    {
        if (options.isStrictTableMap() || context.hasTableMap(rows.getTableId()))
            return context.getTableMap(rows.getTableId());

        logger.warn("No table map for table id " + rows.getTableId() + " in "
                + MysqlBinlog.getTypeName(rows.getEventType())
                + " at offset " + position + "; rows left unresolved");
        return null;
    }

    private BinlogDecodeException positioned(BinlogDecodeException e,
            long offset)
    {
        if (e.getPosition() < 0)
            e.setPosition(offset);
        return e;
    }

    private void finish(String reason)
    {
        state = State.FINISHED;
        logger.info("Finished reading binlog " + name + ": " + reason
                + " (events read=" + eventsRead + " delivered="
                + eventsDelivered + ")");
    }

    public State getState()
    {
        return state;
    }

    /** Returns the offset of the next event to read. */
    public long getPosition()
    {
        return position;
    }

    public DecodeContext getContext()
    {
        return context;
    }

    public long getEventsRead()
    {
        return eventsRead;
    }

    public long getEventsDelivered()
    {
        return eventsDelivered;
    }

    /**
     * Releases the source. The decoder is finished afterwards.
     */
    public void close()
    {
        state = State.FINISHED;
        source.close();
    }
}
