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

/**
 * Body of an event whose type is part of the binlog format but whose content
 * is not interpreted, such as GTID or rows query events. The bytes are kept
 * as found, without the checksum.
 *
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 */
public class UnsupportedEventData extends EventData
{
    private final int    eventType;
    private final byte[] data;

    public UnsupportedEventData(int eventType, byte[] data)
    {
        this.eventType = eventType;
        this.data = data;
    }

    public EventDataKind getKind()
    {
        return EventDataKind.UNSUPPORTED;
    }

    public int getEventType()
    {
        return eventType;
    }

    public byte[] getData()
    {
        return data;
    }

    public String toString()
    {
        return "Unsupported type=" + eventType + " length=" + data.length;
    }
}
