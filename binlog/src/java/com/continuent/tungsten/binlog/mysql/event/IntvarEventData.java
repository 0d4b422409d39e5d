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
 * Body of an intvar event.
 * <ul>
 * <li>1 byte. A value indicating the variable type: LAST_INSERT_ID_EVENT = 1
 * or INSERT_ID_EVENT = 2.</li>
 * <li>8 bytes. An unsigned integer indicating the value to be used for the
 * LAST_INSERT_ID() invocation or AUTO_INCREMENT column.</li>
 * </ul>
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class IntvarEventData extends EventData
{
    public static final int LAST_INSERT_ID_EVENT = 1;
    public static final int INSERT_ID_EVENT      = 2;

    private int             type;
    private long            value;

    public IntvarEventData(byte[] body) throws TruncatedEventException
    {
        type = LittleEndianConversion.convert1ByteToInt(body, 0);
        value = LittleEndianConversion.convert8BytesToLong(body, 1);
    }

    public EventDataKind getKind()
    {
        return EventDataKind.INTVAR;
    }

    public int getType()
    {
        return type;
    }

    public long getValue()
    {
        return value;
    }

    public String toString()
    {
        return "Intvar type=" + type + " value=" + Long.toUnsignedString(value);
    }
}
