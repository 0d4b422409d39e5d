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

import com.continuent.tungsten.binlog.mysql.TruncatedEventException;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of an XID event, written when a transaction commits. It holds the 8
 * byte transaction id used for two phase commit.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @version 1.0
 */
public class XidEventData extends EventData
{
    private long xid;

    public XidEventData(byte[] body) throws TruncatedEventException
    {
        xid = LittleEndianConversion.convert8BytesToLong(body, 0);
    }

    public EventDataKind getKind()
    {
        return EventDataKind.XID;
    }

    /** Transaction id, an unsigned 64 bit value. */
    public long getXid()
    {
        return xid;
    }

    public String toString()
    {
        return "Xid xid=" + Long.toUnsignedString(xid);
    }
}
