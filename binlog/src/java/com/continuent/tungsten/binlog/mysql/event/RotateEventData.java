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

import java.nio.charset.StandardCharsets;

import com.continuent.tungsten.binlog.mysql.TruncatedEventException;
import com.continuent.tungsten.binlog.mysql.conversion.LittleEndianConversion;

/**
 * Body of a rotate event.
 * <p>
 * Fixed data part:
 * <ul>
 * <li>8 bytes. The position of the first event in the next log file. This
 * field is not present in v1; the value is then assumed to be 4.</li>
 * </ul>
 * Variable data part: the name of the next binary log. The filename is not
 * null-terminated, its length is what remains of the body.
 *
 * @author <a href="mailto:seppo.jaakola@continuent.com">Seppo Jaakola</a>
 * @author <a href="mailto:stephane.giron@continuent.com">Stephane Giron</a>
 * @version 1.0
 */
public class RotateEventData extends EventData
{
    private long   position;
    private String filename;

    public RotateEventData(byte[] body, FormatDescriptionEventData description)
            throws TruncatedEventException
    {
        int filenameOffset = 0;
        if (description.getBinlogVersion() > 1)
        {
            position = LittleEndianConversion.convert8BytesToLong(body, 0);
            filenameOffset = 8;
        }
        else
            position = 4;

        filename = rightTrim(new String(body, filenameOffset, body.length
                - filenameOffset, StandardCharsets.UTF_8));
    }

    private static String rightTrim(String value)
    {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1)))
            end--;
        return value.substring(0, end);
    }

    public EventDataKind getKind()
    {
        return EventDataKind.ROTATE;
    }

    /** Offset of the first event in the next binlog. */
    public long getPosition()
    {
        return position;
    }

    public String getNewBinlogFilename()
    {
        return filename;
    }

    public String toString()
    {
        return "Rotate file=" + filename + " position=" + position;
    }
}
