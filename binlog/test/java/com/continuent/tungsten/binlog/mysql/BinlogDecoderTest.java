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

import java.io.ByteArrayInputStream;
import java.io.File;
import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

import com.continuent.tungsten.binlog.BinlogException;
import com.continuent.tungsten.binlog.conf.BinlogReaderOptions;
import com.continuent.tungsten.binlog.mysql.event.EventDataKind;
import com.continuent.tungsten.binlog.mysql.event.FormatDescriptionEventData;
import com.continuent.tungsten.binlog.mysql.event.QueryEventData;
import com.continuent.tungsten.binlog.mysql.event.RotateEventData;
import com.continuent.tungsten.binlog.mysql.event.RowsEventData;
import com.continuent.tungsten.binlog.mysql.event.UnsupportedEventData;
import com.continuent.tungsten.binlog.mysql.event.XidEventData;

/**
 * Tests walking complete binlog streams, including window selection and the
 * way errors end the walk.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class BinlogDecoderTest extends TestCase
{
    private static final byte[] ONE_INT_ROW = {0x00, 0x01, 0x00, 0x00, 0x00};

    /**
     * Collects every event delivered, optionally stopping after a number of
     * them.
     */
    static class CollectingHandler implements LogEventHandler
    {
        final List<LogEvent> events = new ArrayList<LogEvent>();
        private final int    limit;

        CollectingHandler(int limit)
        {
            this.limit = limit;
        }

        public boolean handle(LogEvent event)
        {
            events.add(event);
            return limit <= 0 || events.size() < limit;
        }
    }

    /**
     * Verify a checksummed stream decodes completely, with correct positions
     * and resolved table maps.
     */
    public void testChecksumStream() throws Exception
    {
        BinlogStreamBuilder builder = transactionStream();
        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());
        CollectingHandler handler = new CollectingHandler(0);

        assertEquals("delivered", 7, decoder.walk(handler));
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
        assertEquals("read", 7, decoder.getEventsRead());
        assertEquals("position at end", builder.getPosition(),
                decoder.getPosition());
        assertNull("nothing after the end", decoder.nextEvent());

        List<LogEvent> events = handler.events;
        int[] types = {MysqlBinlog.FORMAT_DESCRIPTION_EVENT,
                MysqlBinlog.QUERY_EVENT, MysqlBinlog.TABLE_MAP_EVENT,
                MysqlBinlog.WRITE_ROWS_EVENT, MysqlBinlog.XID_EVENT,
                MysqlBinlog.GTID_LOG_EVENT, MysqlBinlog.ROTATE_EVENT};
        for (int i = 0; i < types.length; i++)
        {
            LogEvent event = events.get(i);
            assertEquals("type " + i, types[i], event.getType());
            assertEquals("position " + i, builder.getEventPosition(i),
                    event.getPosition());
            assertTrue("checksum " + i, event.hasChecksum());
        }
        assertEquals("next position", builder.getEventPosition(2), events
                .get(1).getNextEventPosition());

        FormatDescriptionEventData description = (FormatDescriptionEventData) events
                .get(0).getData();
        assertEquals("server version", "5.7.30-log",
                description.getServerVersion());
        assertTrue("checksums on", decoder.getContext().isChecksumEnabled());

        QueryEventData query = (QueryEventData) events.get(1).getData();
        assertEquals("query", "BEGIN", query.getQuery());

        RowsEventData rows = (RowsEventData) events.get(3).getData();
        assertNotNull("table map resolved", rows.getTableMap());
        assertEquals("table", "orders", rows.getTableMap().getTableName());

        assertEquals("xid", 5, ((XidEventData) events.get(4).getData())
                .getXid());
        assertEquals("unsupported kept raw", 42,
                ((UnsupportedEventData) events.get(5).getData()).getData().length);
        assertEquals("rotate file", "mysql-bin.000002",
                ((RotateEventData) events.get(6).getData())
                        .getNewBinlogFilename());
    }

    /**
     * Verify a stream from a server without checksums.
     */
    public void testLegacyStream() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder()
                .legacyFormatDescription().query("shop", "BEGIN").xid(9);
        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());

        LogEvent fd = decoder.nextEvent();
        assertEquals("format description", EventDataKind.FORMAT_DESCRIPTION,
                fd.getData().getKind());
        assertFalse("no descriptor", fd.hasChecksum());
        LogEvent query = decoder.nextEvent();
        assertFalse("no checksum", query.hasChecksum());
        assertEquals("database", "shop",
                ((QueryEventData) query.getData()).getDatabaseName());
        assertNotNull("xid", decoder.nextEvent());
        assertNull("end", decoder.nextEvent());
    }

    /**
     * Verify non binlog input is rejected at offset 0.
     */
    public void testInvalidMagic() throws Exception
    {
        byte[][] inputs = {"abcdefgh".getBytes(), new byte[0],
                {(byte) 0xFE, 0x62}};
        for (int i = 0; i < inputs.length; i++)
        {
            BinlogDecoder decoder = new BinlogDecoder(
                    new InputStreamBinlogSource(new ByteArrayInputStream(
                            inputs[i])), new BinlogReaderOptions());
            try
            {
                decoder.open();
                fail("Opened invalid input " + i);
            }
            catch (InvalidFileHeaderException e)
            {
                assertEquals("position", 0, e.getPosition());
            }
            assertEquals("finished", BinlogDecoder.State.FINISHED,
                    decoder.getState());
            assertNull("nothing to read", decoder.nextEvent());
        }
    }

    /**
     * Verify a decoder only opens once.
     */
    public void testOpenTwice() throws Exception
    {
        BinlogDecoder decoder = decoder(new BinlogStreamBuilder(),
                new BinlogReaderOptions());
        decoder.open();
        assertEquals("streaming", BinlogDecoder.State.STREAMING,
                decoder.getState());
        try
        {
            decoder.open();
            fail("Opened twice");
        }
        catch (IllegalStateException e)
        {
        }
        assertNull("magic only", decoder.nextEvent());
    }

    /**
     * Verify events found before any format description use the v4 defaults
     * without checksums.
     */
    public void testNoFormatDescription() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder().query("db",
                "SELECT 1");
        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());
        LogEvent event = decoder.nextEvent();
        assertEquals("query", "SELECT 1",
                ((QueryEventData) event.getData()).getQuery());
        assertFalse("no checksum", event.hasChecksum());
        assertNull("no format description",
                decoder.getContext().getFormatDescription());
    }

    /**
     * Verify rows without a table map fail in strict mode and carry no table
     * map otherwise.
     */
    public void testRowsWithoutTableMap() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder()
                .formatDescription().rows(MysqlBinlog.WRITE_ROWS_EVENT, 99, 1,
                        ONE_INT_ROW);

        BinlogDecoder strict = decoder(builder, new BinlogReaderOptions());
        assertNotNull("format description", strict.nextEvent());
        try
        {
            strict.nextEvent();
            fail("Decoded rows of unknown table");
        }
        catch (UnknownTableException e)
        {
            assertEquals("table id", 99, e.getTableId());
            assertEquals("position", builder.getEventPosition(1),
                    e.getPosition());
        }
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                strict.getState());
        assertNull("no more events", strict.nextEvent());

        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setStrictTableMap(false);
        BinlogDecoder lenient = decoder(builder, options);
        lenient.nextEvent();
        RowsEventData rows = (RowsEventData) lenient.nextEvent().getData();
        assertNull("unresolved", rows.getTableMap());
        assertEquals("table id", 99, rows.getTableId());
    }

    /**
     * Verify a start time after every event still delivers the format
     * description.
     */
    public void testStartTimeAfterStream() throws Exception
    {
        BinlogStreamBuilder builder = transactionStream();
        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setStartTime(2000000000L);
        BinlogDecoder decoder = decoder(builder, options);
        CollectingHandler handler = new CollectingHandler(0);

        assertEquals("delivered", 1, decoder.walk(handler));
        assertEquals("format description only",
                MysqlBinlog.FORMAT_DESCRIPTION_EVENT, handler.events.get(0)
                        .getType());
        assertEquals("all decoded", 7, decoder.getEventsRead());
    }

    /**
     * Verify the window opens exactly at the start position and the table map
     * read before it still resolves rows.
     */
    public void testStartPosition() throws Exception
    {
        BinlogStreamBuilder builder = transactionStream();
        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setStartPosition(builder.getEventPosition(3));
        CollectingHandler handler = new CollectingHandler(0);
        decoder(builder, options).walk(handler);

        assertEquals("delivered", 5, handler.events.size());
        assertEquals("format description", MysqlBinlog.FORMAT_DESCRIPTION_EVENT,
                handler.events.get(0).getType());
        LogEvent first = handler.events.get(1);
        assertEquals("first in window", builder.getEventPosition(3),
                first.getPosition());
        assertNotNull("table map from before the window",
                ((RowsEventData) first.getData()).getTableMap());
    }

    /**
     * Verify an event ending exactly at the end position is delivered and the
     * next one ends the walk.
     */
    public void testEndPosition() throws Exception
    {
        BinlogStreamBuilder builder = transactionStream();
        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setEndPosition(builder.getEventPosition(3));
        BinlogDecoder decoder = decoder(builder, options);
        CollectingHandler handler = new CollectingHandler(0);

        assertEquals("delivered", 3, decoder.walk(handler));
        assertEquals("last", MysqlBinlog.TABLE_MAP_EVENT, handler.events
                .get(2).getType());
        assertEquals("read the stopping event", 4, decoder.getEventsRead());
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
    }

    /**
     * Verify the first event at or after the end time ends the walk.
     */
    public void testEndTime() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder().timestamp(100)
                .formatDescription().query("db", "BEGIN").timestamp(200)
                .xid(1).timestamp(300).query("db", "BEGIN");
        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setEndTime(200);
        assertEquals("delivered", 2,
                decoder(builder, options).walk(new CollectingHandler(0)));
    }

    /**
     * Verify a handler can stop the walk.
     */
    public void testHandlerStops() throws Exception
    {
        BinlogDecoder decoder = decoder(transactionStream(),
                new BinlogReaderOptions());
        CollectingHandler handler = new CollectingHandler(2);
        assertEquals("delivered", 2, decoder.walk(handler));
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
        assertNull("stopped", decoder.nextEvent());
    }

    /**
     * Verify a handler failure ends the walk and reaches the caller.
     */
    public void testHandlerFails() throws Exception
    {
        BinlogDecoder decoder = decoder(transactionStream(),
                new BinlogReaderOptions());
        try
        {
            decoder.walk(new LogEventHandler()
            {
                public boolean handle(LogEvent event) throws BinlogException
                {
                    if (event.getType() == MysqlBinlog.QUERY_EVENT)
                        throw new BinlogException("Unable to apply "
                                + event.getHeader());
                    return true;
                }
            });
            fail("Handler failure was lost");
        }
        catch (BinlogException e)
        {
            assertTrue("handler message",
                    e.getMessage().startsWith("Unable to apply"));
        }
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
    }

    /**
     * Verify an unchecked handler failure also ends the walk.
     */
    public void testHandlerRuntimeFailure() throws Exception
    {
        BinlogDecoder decoder = decoder(transactionStream(),
                new BinlogReaderOptions());
        try
        {
            decoder.walk(new LogEventHandler()
            {
                public boolean handle(LogEvent event)
                {
                    throw new IllegalStateException("Consumer closed");
                }
            });
            fail("Handler failure was lost");
        }
        catch (IllegalStateException e)
        {
            assertEquals("handler message", "Consumer closed", e.getMessage());
        }
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
        assertNull("nothing after a failed handler", decoder.nextEvent());
    }

    /**
     * Verify streams ending inside a header or a body raise truncation at the
     * start of the broken event.
     */
    public void testTruncatedStreams() throws Exception
    {
        BinlogStreamBuilder partialHeader = new BinlogStreamBuilder()
                .formatDescription();
        long brokenAt = partialHeader.getPosition();
        partialHeader.raw(new byte[10]);
        assertTruncated(partialHeader, brokenAt);

        BinlogStreamBuilder missingBody = new BinlogStreamBuilder()
                .formatDescription();
        brokenAt = missingBody.getPosition();
        missingBody.raw(BinlogStreamBuilder.header(1500000000L,
                MysqlBinlog.QUERY_EVENT, 1, 100, brokenAt + 100, 0));
        assertTruncated(missingBody, brokenAt);

        BinlogStreamBuilder partialBody = new BinlogStreamBuilder()
                .formatDescription();
        brokenAt = partialBody.getPosition();
        partialBody.raw(BinlogStreamBuilder.header(1500000000L,
                MysqlBinlog.QUERY_EVENT, 1, 100, brokenAt + 100, 0));
        partialBody.raw(new byte[30]);
        assertTruncated(partialBody, brokenAt);
    }

    /**
     * Verify a header declaring a size far beyond the stream fails as a
     * truncation without allocating the declared size.
     */
    public void testHugeDeclaredSize() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder();
        long eventSize = 0x7FFFFF00L;
        builder.raw(BinlogStreamBuilder.header(1500000000L,
                MysqlBinlog.QUERY_EVENT, 1, eventSize,
                MysqlBinlog.BIN_LOG_HEADER_SIZE + eventSize, 0));
        builder.raw(new byte[4]);
        assertEquals("stream length", 27, builder.toByteArray().length);

        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());
        try
        {
            decoder.nextEvent();
            fail("Decoded event larger than the stream");
        }
        catch (TruncatedEventException e)
        {
            assertEquals("position", MysqlBinlog.BIN_LOG_HEADER_SIZE,
                    e.getPosition());
        }
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
    }

    private void assertTruncated(BinlogStreamBuilder builder, long position)
            throws Exception
    {
        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());
        assertNotNull("format description", decoder.nextEvent());
        try
        {
            decoder.nextEvent();
            fail("Decoded truncated event");
        }
        catch (TruncatedEventException e)
        {
            assertEquals("position", position, e.getPosition());
        }
        assertEquals("finished", BinlogDecoder.State.FINISHED,
                decoder.getState());
        assertNull("no more events", decoder.nextEvent());
    }

    /**
     * Verify event types beyond the known range are rejected.
     */
    public void testUnknownEventType() throws Exception
    {
        BinlogStreamBuilder builder = new BinlogStreamBuilder()
                .formatDescription().event(40, new byte[]{1, 2});
        BinlogDecoder decoder = decoder(builder, new BinlogReaderOptions());
        decoder.nextEvent();
        try
        {
            decoder.nextEvent();
            fail("Decoded event type 40");
        }
        catch (UnknownEventTypeException e)
        {
            assertEquals("type", 40, e.getEventType());
            assertEquals("position", builder.getEventPosition(1),
                    e.getPosition());
        }
    }

    /**
     * Verify a corrupted query text is caught by its checksum.
     */
    public void testCorruptedEvent() throws Exception
    {
        BinlogStreamBuilder builder = transactionStream();
        byte[] bytes = builder.toByteArray();
        int queryText = (int) builder.getEventPosition(1)
                + MysqlBinlog.LOG_EVENT_HEADER_LEN + 18;
        bytes[queryText] ^= 0x01;

        BinlogDecoder decoder = new BinlogDecoder(new InputStreamBinlogSource(
                new ByteArrayInputStream(bytes)), new BinlogReaderOptions());
        decoder.nextEvent();
        try
        {
            decoder.nextEvent();
            fail("Accepted corrupted query");
        }
        catch (ChecksumMismatchException e)
        {
            assertEquals("position", builder.getEventPosition(1),
                    e.getPosition());
        }
    }

    /**
     * Verify a binlog written to disk reads the same as from memory.
     */
    public void testFileSource() throws Exception
    {
        File dir = new File("target/test-data/decoder");
        dir.mkdirs();
        File binlog = transactionStream().writeTo(
                new File(dir, "mysql-bin.000001"));

        BinlogReaderOptions options = new BinlogReaderOptions();
        options.setBufferSize(64);
        BinlogDecoder decoder = new BinlogDecoder(binlog, options);
        try
        {
            assertEquals("delivered", 7,
                    decoder.walk(new CollectingHandler(0)));
            assertEquals("position", binlog.length(), decoder.getPosition());
        }
        finally
        {
            decoder.close();
        }
    }

    // FD, BEGIN, table map, write rows, xid, gtid, rotate.
    private static BinlogStreamBuilder transactionStream()
    {
        return new BinlogStreamBuilder()
                .formatDescription()
                .query("shop", "BEGIN")
                .tableMap(10, "shop", "orders",
                        new byte[]{MysqlBinlog.MYSQL_TYPE_LONG}, new byte[0])
                .rows(MysqlBinlog.WRITE_ROWS_EVENT, 10, 1, ONE_INT_ROW)
                .xid(5).event(MysqlBinlog.GTID_LOG_EVENT, new byte[42])
                .rotate(4, "mysql-bin.000002");
    }

    private static BinlogDecoder decoder(BinlogStreamBuilder builder,
            BinlogReaderOptions options)
    {
        return new BinlogDecoder(new InputStreamBinlogSource(
                builder.toInputStream()), options);
    }
}
