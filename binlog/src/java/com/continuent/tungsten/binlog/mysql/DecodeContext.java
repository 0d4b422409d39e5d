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

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import com.continuent.tungsten.binlog.mysql.event.FormatDescriptionEventData;
import com.continuent.tungsten.binlog.mysql.event.TableMapEventData;

/**
 * State carried from one event to the next while decoding a binlog: the last
 * format description and the table maps seen so far, by table id. Each
 * decoder owns one context; contexts are not shared between threads.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class DecodeContext
{
    private static Logger                      logger                 = Logger.getLogger(DecodeContext.class);

    private static final int                   DEFAULT_BINLOG_VERSION = 4;

    private FormatDescriptionEventData         formatDescription;
    private FormatDescriptionEventData         defaultDescription;
    private final Map<Long, TableMapEventData> tables                 = new HashMap<Long, TableMapEventData>();

    /**
     * Replaces the format description, for instance after a rotation.
     */
    public void adoptFormatDescription(FormatDescriptionEventData description)
    {
        if (logger.isDebugEnabled())
            logger.debug("Adopting " + description);
        this.formatDescription = description;
    }

    /**
     * Registers a table map under its table id, replacing any earlier map for
     * the same id.
     */
    public void registerTable(TableMapEventData tableMap)
    {
        TableMapEventData previous = tables.put(tableMap.getTableId(),
                tableMap);
        if (previous != null && logger.isDebugEnabled())
            logger.debug("Replaced table map for table id "
                    + tableMap.getTableId());
    }

    /**
     * Returns the table map registered for the id.
     *
     * @throws UnknownTableException If no table map has the id
     */
    public TableMapEventData getTableMap(long tableId)
            throws UnknownTableException
    {
        TableMapEventData tableMap = tables.get(tableId);
        if (tableMap == null)
            throw new UnknownTableException(tableId);
        return tableMap;
    }

    public boolean hasTableMap(long tableId)
    {
        return tables.containsKey(tableId);
    }

    public int getTableMapCount()
    {
        return tables.size();
    }

    /** Last format description, or null if none has been seen. */
    public FormatDescriptionEventData getFormatDescription()
    {
        return formatDescription;
    }

    /**
     * Returns the format description to decode with. Before one is found in
     * the stream this is the description of a binlog v4 server without
     * checksums.
     */
    public FormatDescriptionEventData getEffectiveFormatDescription()
    {
        if (formatDescription != null)
            return formatDescription;
        if (defaultDescription == null)
        {
            logger.warn("No format description found yet, decoding with binlog v"
                    + DEFAULT_BINLOG_VERSION + " defaults");
            defaultDescription = FormatDescriptionEventData
                    .createDefault(DEFAULT_BINLOG_VERSION);
        }
        return defaultDescription;
    }

    /**
     * Length of event headers: 19 bytes until a format description says
     * otherwise.
     */
    public int getHeaderLength()
    {
        if (formatDescription == null)
            return MysqlBinlog.LOG_EVENT_HEADER_LEN;
        return formatDescription.getCommonHeaderLength();
    }

    /**
     * Post-header length of an event type, or -1 if the format description
     * does not cover it.
     */
    public int getPostHeaderLength(int eventType)
    {
        return getEffectiveFormatDescription().getPostHeaderLength(eventType);
    }

    public boolean isChecksumEnabled()
    {
        return formatDescription != null
                && formatDescription.isChecksumEnabled();
    }

    /** Checksum algorithm of events following the format description. */
    public int getChecksumAlgorithm()
    {
        if (formatDescription == null)
            return MysqlBinlog.BINLOG_CHECKSUM_ALG_OFF;
        return formatDescription.getChecksumAlgorithm();
    }
}
